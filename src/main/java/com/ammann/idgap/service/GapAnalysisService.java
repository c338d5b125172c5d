/* (C)2026 */
package com.ammann.idgap.service;

import com.ammann.idgap.client.RecordStoreGateway;
import com.ammann.idgap.dto.AnalysisRequestDTO;
import com.ammann.idgap.dto.CoverageStatsDTO;
import com.ammann.idgap.dto.CsvExportDTO;
import com.ammann.idgap.dto.EntityConfigDTO;
import com.ammann.idgap.dto.GapAnalysisResponseDTO;
import com.ammann.idgap.dto.GapAnalysisResultDTO;
import com.ammann.idgap.dto.GapRangeDTO;
import com.ammann.idgap.dto.IdBoundsDTO;
import com.ammann.idgap.dto.IdRecordDTO;
import com.ammann.idgap.dto.IdStatusDTO;
import com.ammann.idgap.enumeration.StatusClassification;
import com.ammann.idgap.exception.NoDataException;
import com.ammann.idgap.exception.PageFetchException;
import com.ammann.idgap.exception.ValidationException;
import com.ammann.idgap.model.AggregationResult;
import com.ammann.idgap.model.AnalysisKey;
import com.ammann.idgap.model.CachedAnalysis;
import com.ammann.idgap.model.IdRange;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Entry point of the gap analysis.
 *
 * <p>{@link #analyze(AnalysisRequestDTO)} validates the request, consults the cache and
 * on a miss runs the pipeline: resolve bounds, drain the record pages, find gaps, count
 * statuses and compute coverage. Results are immutable; a new run supersedes the cached
 * one instead of modifying it.
 *
 * <p>A record page failure yields a result flagged {@code partial} unless
 * {@code gap-analysis.partial-results.enabled} is {@code false}, in which case it fails
 * with {@link PageFetchException}. Auxiliary queries (status grid, existing IDs) have no
 * way to report partial data and always fail on an incomplete drain.
 */
@ApplicationScoped
public class GapAnalysisService {

    private static final Logger LOG = Logger.getLogger(GapAnalysisService.class);

    static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);
    static final int DEFAULT_STATUS_GRID_MAX_IDS = 10_000;
    static final int MAX_EXISTING_IDS_LIMIT = 10_000;

    private final BoundsResolverService boundsResolver;
    private final RecordAggregationService aggregationService;
    private final GapFinderService gapFinder;
    private final StatusClassifier classifier;
    private final AnalysisCacheService cache;
    private final GapExportService exportService;
    private final RecordStoreGateway gateway;
    private final Clock clock;

    @ConfigProperty(name = "gap-analysis.request-timeout", defaultValue = "60s")
    Duration requestTimeout = DEFAULT_TIMEOUT;

    @ConfigProperty(name = "gap-analysis.partial-results.enabled", defaultValue = "true")
    boolean partialResultsEnabled = true;

    @ConfigProperty(name = "gap-analysis.status-grid.max-ids", defaultValue = "10000")
    int statusGridMaxIds = DEFAULT_STATUS_GRID_MAX_IDS;

    @Inject MeterRegistry meterRegistry;

    private Counter analysesComputedCounter;
    private Counter cacheHitsCounter;
    private Counter partialResultsCounter;
    private Timer analysisTimer;

    @Inject
    public GapAnalysisService(
            BoundsResolverService boundsResolver,
            RecordAggregationService aggregationService,
            GapFinderService gapFinder,
            StatusClassifier classifier,
            AnalysisCacheService cache,
            GapExportService exportService,
            RecordStoreGateway gateway,
            Clock clock) {
        this.boundsResolver = boundsResolver;
        this.aggregationService = aggregationService;
        this.gapFinder = gapFinder;
        this.classifier = classifier;
        this.cache = cache;
        this.exportService = exportService;
        this.gateway = gateway;
        this.clock = clock;
    }

    /**
     * Initializes Micrometer meters. Safe to call without a registry.
     */
    @PostConstruct
    void initMetrics() {
        if (meterRegistry == null) {
            LOG.warn("MeterRegistry not available - gap analysis metrics disabled");
            return;
        }

        try {
            analysesComputedCounter =
                    Counter.builder("gap_analysis_computed_total")
                            .description("Gap analyses computed from record data")
                            .register(meterRegistry);

            cacheHitsCounter =
                    Counter.builder("gap_analysis_cache_hits_total")
                            .description("Gap analyses served from the cache")
                            .register(meterRegistry);

            partialResultsCounter =
                    Counter.builder("gap_analysis_partial_results_total")
                            .description("Gap analyses computed from incomplete record data")
                            .register(meterRegistry);

            analysisTimer =
                    Timer.builder("gap_analysis_duration")
                            .description("Duration of gap analysis computations")
                            .register(meterRegistry);
        } catch (Exception e) {
            LOG.warn("Failed to initialize gap analysis metrics", e);
        }
    }

    /**
     * Runs or looks up a gap analysis.
     *
     * @param request analysis parameters
     * @return result with cache metadata and summary
     */
    public GapAnalysisResponseDTO analyze(AnalysisRequestDTO request) {
        validateEntityId(request.entityId());
        BoundsResolverService.validateRequestedRange(request.startId(), request.endId());
        Instant deadline = deadlineFor(request.timeout());

        AnalysisKey key = AnalysisKey.from(request);
        CachedAnalysis analysis =
                cache.getOrCompute(
                        key, request.forceRefresh(), () -> compute(request, deadline), deadline);

        if (analysis.fromCache()) {
            increment(cacheHitsCounter);
            LOG.debugf("Serving cached analysis %s (age %s)", key, analysis.age());
        }

        GapAnalysisResultDTO result = analysis.result();
        return new GapAnalysisResponseDTO(
                result,
                analysis.fromCache(),
                analysis.age().toSeconds(),
                exportService.summarize(result));
    }

    /**
     * Drops every cached analysis of an entity.
     *
     * @param entityId entity identifier
     * @return number of dropped entries
     */
    public int invalidate(String entityId) {
        validateEntityId(entityId);
        return cache.invalidateEntity(entityId);
    }

    public IdBoundsDTO getBounds(String entityId) {
        validateEntityId(entityId);
        return boundsResolver.getBounds(entityId);
    }

    /**
     * Classifies every ID of a range, IDs without a record included.
     *
     * @param entityId entity identifier
     * @param startId explicit first ID, or {@code null}
     * @param endId explicit last ID, or {@code null}
     * @return one status per ID, ascending
     */
    public List<IdStatusDTO> classifyRange(String entityId, Long startId, Long endId) {
        validateEntityId(entityId);
        IdRange range = boundsResolver.resolveBounds(entityId, startId, endId);
        if (range.size() > statusGridMaxIds) {
            throw ValidationException.limitExceeded("IDs in status grid", statusGridMaxIds, range.size());
        }

        AggregationResult aggregation = aggregateComplete(entityId, range);
        List<IdStatusDTO> statuses = new ArrayList<>((int) range.size());
        // Offset loop: an ID counter would wrap past Long.MAX_VALUE.
        for (long offset = 0; offset < range.size(); offset++) {
            long id = range.minId() + offset;
            IdRecordDTO record = aggregation.records().get(id);
            StatusClassification status = classifier.classify(record);
            statuses.add(
                    new IdStatusDTO(
                            id,
                            status,
                            record != null ? record.displayName() : null,
                            record != null ? record.archivedLocator() : null));
        }
        return statuses;
    }

    /**
     * Lists the IDs of a range that have a record.
     *
     * @param entityId entity identifier
     * @param startId explicit first ID, or {@code null}
     * @param endId explicit last ID, or {@code null}
     * @param limit maximum number of IDs returned
     * @return ascending IDs
     */
    public List<Long> listExistingIds(String entityId, Long startId, Long endId, int limit) {
        validateEntityId(entityId);
        if (limit < 1 || limit > MAX_EXISTING_IDS_LIMIT) {
            throw ValidationException.invalidParameter(
                    "limit", limit, "a value between 1 and " + MAX_EXISTING_IDS_LIMIT);
        }
        IdRange range = boundsResolver.resolveBounds(entityId, startId, endId);
        return aggregateComplete(entityId, range).records().keySet().stream()
                .limit(limit)
                .collect(Collectors.toList());
    }

    /**
     * Exports the missing IDs of an entity's full range as CSV.
     *
     * @param entityId entity identifier
     * @param selectedRanges gap keys ({@code start-end}) to export; all gaps when empty
     * @param skipExcluded whether excluded IDs are skipped from the gap list
     * @return CSV file
     */
    public CsvExportDTO exportGaps(
            String entityId, List<String> selectedRanges, boolean skipExcluded) {
        validateEntityId(entityId);
        Set<String> selection = new LinkedHashSet<>();
        if (selectedRanges != null) {
            for (String selected : selectedRanges) {
                selection.add(exportService.parseRangeKey(selected));
            }
        }

        EntityConfigDTO entity =
                gateway.findEntity(entityId)
                        .orElseThrow(
                                () -> new NoDataException(entityId, "Unknown entity " + entityId));

        GapAnalysisResultDTO result =
                analyze(new AnalysisRequestDTO(entityId, false, null, null, skipExcluded, null))
                        .result();

        List<GapRangeDTO> gaps =
                selection.isEmpty()
                        ? result.gaps()
                        : result.gaps().stream()
                                .filter(gap -> selection.contains(gap.key()))
                                .collect(Collectors.toList());

        byte[] content = exportService.exportCsv(entity, gaps);
        long rows = GapExportService.countIds(gaps);
        String fileName = exportService.exportFileName(entity, LocalDate.now(clock));

        LOG.infof(
                "Exported %d missing IDs in %d gaps of entity %s to %s",
                rows, gaps.size(), entityId, fileName);
        return new CsvExportDTO(fileName, content, rows);
    }

    GapAnalysisResultDTO compute(AnalysisRequestDTO request, Instant deadline) {
        long started = System.nanoTime();
        String entityId = request.entityId();

        IdRange range = boundsResolver.resolveBounds(entityId, request.startId(), request.endId());
        AggregationResult aggregation = aggregationService.aggregate(entityId, range, deadline);

        if (aggregation.isPartial() && !partialResultsEnabled) {
            throw new PageFetchException(
                    String.format(
                            "Record page %d of entity %s could not be fetched: %s",
                            aggregation.failure().pageNumber(),
                            entityId,
                            aggregation.failure().message()));
        }

        Map<Long, IdRecordDTO> records = aggregation.records();
        List<GapRangeDTO> gaps =
                gapFinder.findGaps(range.minId(), range.maxId(), records, request.skipExcluded());
        Map<StatusClassification, Long> statusCounts =
                gapFinder.countStatuses(range.minId(), range.maxId(), records);
        CoverageStatsDTO stats =
                exportService.buildStats(range.minId(), range.maxId(), gaps, records.size());

        GapAnalysisResultDTO result =
                new GapAnalysisResultDTO(
                        entityId,
                        range.minId(),
                        range.maxId(),
                        request.skipExcluded(),
                        gaps,
                        stats,
                        statusCounts,
                        clock.instant(),
                        aggregation.isPartial(),
                        aggregation.failure());

        increment(analysesComputedCounter);
        if (aggregation.isPartial()) {
            increment(partialResultsCounter);
        }
        if (analysisTimer != null) {
            analysisTimer.record(Duration.ofNanos(System.nanoTime() - started));
        }

        LOG.infof(
                "Gap analysis of entity %s over [%d, %d]: %d records, %d gaps, %d missing, coverage %.2f%%%s",
                entityId,
                range.minId(),
                range.maxId(),
                records.size(),
                stats.gapCount(),
                stats.totalMissing(),
                stats.coveragePercent(),
                aggregation.isPartial() ? " (partial)" : "");

        return result;
    }

    private AggregationResult aggregateComplete(String entityId, IdRange range) {
        AggregationResult aggregation =
                aggregationService.aggregate(entityId, range, deadlineFor(null));
        if (aggregation.isPartial()) {
            throw new PageFetchException(
                    String.format(
                            "Record page %d of entity %s could not be fetched: %s",
                            aggregation.failure().pageNumber(),
                            entityId,
                            aggregation.failure().message()));
        }
        return aggregation;
    }

    private Instant deadlineFor(Duration timeout) {
        Duration effective = timeout != null ? timeout : requestTimeout;
        if (effective.isZero() || effective.isNegative()) {
            throw ValidationException.invalidParameter("timeout", effective, "a positive duration");
        }
        return clock.instant().plus(effective);
    }

    private static void validateEntityId(String entityId) {
        if (entityId == null || entityId.isBlank()) {
            throw ValidationException.invalidParameter("entityId", entityId, "a non-blank identifier");
        }
    }

    private static void increment(Counter counter) {
        if (counter != null) {
            counter.increment();
        }
    }
}
