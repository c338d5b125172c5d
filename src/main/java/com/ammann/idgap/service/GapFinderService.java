/* (C)2026 */
package com.ammann.idgap.service;

import com.ammann.idgap.dto.GapRangeDTO;
import com.ammann.idgap.dto.IdRecordDTO;
import com.ammann.idgap.enumeration.StatusClassification;
import com.ammann.idgap.model.IdRange;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import org.jboss.logging.Logger;

/**
 * Detects gaps in an ID range as maximal runs of missing IDs.
 *
 * <p>Instead of enumerating every missing ID (which can exhaust memory for large ranges),
 * the scan walks the sorted IDs that count as present once and emits the ranges between
 * them. The result is ascending, non-overlapping and maximal: no two ranges touch.
 *
 * <p>An ID counts as present when its status is HAS_RESULT, ERROR, NOT_FOUND or OTHER,
 * or EXCLUDED while excluded IDs are skipped. Everything else is missing.
 */
@ApplicationScoped
public class GapFinderService {

    private static final Logger LOG = Logger.getLogger(GapFinderService.class);

    private final StatusClassifier classifier;

    @Inject
    public GapFinderService(StatusClassifier classifier) {
        this.classifier = classifier;
    }

    /**
     * Finds the gaps of {@code [minId, maxId]}.
     *
     * @param minId first ID of the range
     * @param maxId last ID of the range
     * @param records records keyed by ID; entries outside the range are ignored
     * @param skipExcluded whether excluded IDs are skipped (counted as present)
     * @return gaps in ascending order, empty if every ID is present
     */
    public List<GapRangeDTO> findGaps(
            long minId, long maxId, Map<Long, IdRecordDTO> records, boolean skipExcluded) {
        IdRange range = new IdRange(minId, maxId);
        List<GapRangeDTO> gaps = new ArrayList<>();

        long nextUncovered = minId;
        boolean reachedEnd = false;

        for (Map.Entry<Long, IdRecordDTO> entry : inRange(range, records).entrySet()) {
            long id = entry.getKey();
            if (!classifier.classify(entry.getValue()).countsAsPresent(skipExcluded)) {
                continue;
            }
            if (id > nextUncovered) {
                gaps.add(GapRangeDTO.of(nextUncovered, id - 1));
            }
            if (id == maxId) {
                reachedEnd = true;
                break;
            }
            nextUncovered = id + 1;
        }

        if (!reachedEnd) {
            gaps.add(GapRangeDTO.of(nextUncovered, maxId));
        }

        if (!gaps.isEmpty()) {
            long totalMissing = gaps.stream().mapToLong(GapRangeDTO::count).sum();
            LOG.debugf(
                    "Detected %d gaps containing %d missing IDs in [%d, %d] (skipExcluded=%s)",
                    gaps.size(), totalMissing, minId, maxId, skipExcluded);
        }

        return gaps;
    }

    /**
     * Counts the IDs of {@code [minId, maxId]} per status. IDs without a record are
     * counted as {@link StatusClassification#EMPTY}, so the counts sum to the range size.
     *
     * @param minId first ID of the range
     * @param maxId last ID of the range
     * @param records records keyed by ID; entries outside the range are ignored
     * @return count for every status, zero counts included
     */
    public Map<StatusClassification, Long> countStatuses(
            long minId, long maxId, Map<Long, IdRecordDTO> records) {
        IdRange range = new IdRange(minId, maxId);
        Map<StatusClassification, Long> counts = new EnumMap<>(StatusClassification.class);
        for (StatusClassification status : StatusClassification.values()) {
            counts.put(status, 0L);
        }

        NavigableMap<Long, IdRecordDTO> present = inRange(range, records);
        for (IdRecordDTO record : present.values()) {
            counts.merge(classifier.classify(record), 1L, Long::sum);
        }
        counts.merge(StatusClassification.EMPTY, range.size() - present.size(), Long::sum);

        return counts;
    }

    private static NavigableMap<Long, IdRecordDTO> inRange(
            IdRange range, Map<Long, IdRecordDTO> records) {
        NavigableMap<Long, IdRecordDTO> sorted =
                records instanceof NavigableMap<Long, IdRecordDTO> navigable
                        ? navigable
                        : new TreeMap<>(records);
        return sorted.subMap(range.minId(), true, range.maxId(), true);
    }
}
