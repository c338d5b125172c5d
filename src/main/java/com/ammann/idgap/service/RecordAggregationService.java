/* (C)2026 */
package com.ammann.idgap.service;

import com.ammann.idgap.client.RecordStoreGateway;
import com.ammann.idgap.dto.IdRecordDTO;
import com.ammann.idgap.dto.PageFetchFailureDTO;
import com.ammann.idgap.dto.RecordPageDTO;
import com.ammann.idgap.exception.AnalysisTimeoutException;
import com.ammann.idgap.exception.PageFetchException;
import com.ammann.idgap.model.AggregationResult;
import com.ammann.idgap.model.IdRange;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.NavigableMap;
import java.util.TreeMap;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Drains the paginated record listing of an entity into a map keyed by ID.
 *
 * <p>Pages are fetched sequentially; each request carries the continuation token of the
 * previous page. Records outside the requested range or without an ID are dropped. When
 * the same ID appears on more than one page the later record wins.
 *
 * <p>A failed page does not abort the drain with an exception. The records collected so
 * far are returned together with a {@link PageFetchFailureDTO}, and the caller decides
 * whether a partial result is acceptable. Hitting the page cap is reported the same way.
 * Passing the deadline or an interrupt of the calling thread aborts with
 * {@link AnalysisTimeoutException}.
 */
@ApplicationScoped
public class RecordAggregationService {

    private static final Logger LOG = Logger.getLogger(RecordAggregationService.class);

    static final int DEFAULT_PAGE_SIZE = 1000;
    static final int DEFAULT_MAX_PAGES = 10_000;

    private final RecordStoreGateway gateway;
    private final Clock clock;

    @ConfigProperty(name = "gap-analysis.aggregation.page-size", defaultValue = "1000")
    int pageSize = DEFAULT_PAGE_SIZE;

    @ConfigProperty(name = "gap-analysis.aggregation.max-pages", defaultValue = "10000")
    int maxPages = DEFAULT_MAX_PAGES;

    @Inject MeterRegistry meterRegistry;

    private Counter pagesFetchedCounter;
    private Counter pageFailuresCounter;
    private Counter duplicateRecordsCounter;

    @Inject
    public RecordAggregationService(RecordStoreGateway gateway, Clock clock) {
        this.gateway = gateway;
        this.clock = clock;
    }

    /**
     * Initializes Micrometer counters. Safe to call without a registry.
     */
    @PostConstruct
    void initMetrics() {
        if (meterRegistry == null) {
            LOG.warn("MeterRegistry not available - aggregation metrics disabled");
            return;
        }

        try {
            pagesFetchedCounter =
                    Counter.builder("gap_analysis_record_pages_fetched_total")
                            .description("Record pages fetched from the record store")
                            .register(meterRegistry);

            pageFailuresCounter =
                    Counter.builder("gap_analysis_record_page_failures_total")
                            .description("Record page fetches that failed or hit the page cap")
                            .register(meterRegistry);

            duplicateRecordsCounter =
                    Counter.builder("gap_analysis_duplicate_records_total")
                            .description("Records that replaced an earlier record with the same ID")
                            .register(meterRegistry);
        } catch (Exception e) {
            LOG.warn("Failed to initialize aggregation metrics", e);
        }
    }

    /**
     * Collects all records of an entity inside {@code range}.
     *
     * @param entityId entity whose records are listed
     * @param range ID range to keep
     * @param deadline instant after which no further page is requested
     * @return collected records, complete or partial
     * @throws AnalysisTimeoutException if the deadline passes or the thread is interrupted
     */
    public AggregationResult aggregate(String entityId, IdRange range, Instant deadline) {
        Instant startedAt = clock.instant();
        NavigableMap<Long, IdRecordDTO> records = new TreeMap<>();
        String continuationToken = null;
        PageFetchFailureDTO failure = null;
        int pages = 0;
        int duplicates = 0;
        int discarded = 0;

        do {
            checkDeadline(entityId, deadline, startedAt, pages);

            if (pages >= maxPages) {
                failure =
                        new PageFetchFailureDTO(
                                pages + 1,
                                "Page limit of " + maxPages + " reached before the last page",
                                records.size());
                LOG.warnf(
                        "Record aggregation for entity %s stopped at page limit %d with %d records",
                        entityId, maxPages, records.size());
                increment(pageFailuresCounter);
                break;
            }

            RecordPageDTO page;
            try {
                page = gateway.listRecords(entityId, pageSize, continuationToken);
            } catch (PageFetchException e) {
                failure = new PageFetchFailureDTO(pages + 1, e.getMessage(), records.size());
                LOG.warnf(
                        "Record page %d of entity %s failed after %d records: %s",
                        pages + 1, entityId, records.size(), e.getMessage());
                increment(pageFailuresCounter);
                break;
            }
            pages++;
            increment(pagesFetchedCounter);

            for (IdRecordDTO record : page.itemsOrEmpty()) {
                if (record == null || record.id() == null || !range.contains(record.id())) {
                    discarded++;
                    continue;
                }
                if (records.put(record.id(), record) != null) {
                    duplicates++;
                }
            }

            continuationToken = page.hasNext() ? page.nextToken() : null;
        } while (continuationToken != null);

        if (duplicates > 0) {
            LOG.warnf(
                    "Entity %s returned %d duplicate IDs across pages; later records replaced earlier ones",
                    entityId, duplicates);
            if (duplicateRecordsCounter != null) {
                duplicateRecordsCounter.increment(duplicates);
            }
        }

        LOG.debugf(
                "Aggregated %d records of entity %s in [%d, %d] from %d pages (%d discarded, partial=%s)",
                records.size(), entityId, range.minId(), range.maxId(), pages, discarded,
                failure != null);

        return new AggregationResult(records, failure, pages, duplicates, discarded);
    }

    private void checkDeadline(String entityId, Instant deadline, Instant startedAt, int pages) {
        if (Thread.currentThread().isInterrupted()) {
            throw new AnalysisTimeoutException(
                    "Record aggregation for entity " + entityId + " was interrupted after "
                            + pages + " pages");
        }
        if (deadline != null && !clock.instant().isBefore(deadline)) {
            throw AnalysisTimeoutException.after(
                    entityId, Duration.between(startedAt, clock.instant()));
        }
    }

    private static void increment(Counter counter) {
        if (counter != null) {
            counter.increment();
        }
    }
}
