/* (C)2026 */
package com.ammann.idgap.support;

import com.ammann.idgap.dto.CoverageStatsDTO;
import com.ammann.idgap.dto.EntityConfigDTO;
import com.ammann.idgap.dto.GapAnalysisResultDTO;
import com.ammann.idgap.dto.GapRangeDTO;
import com.ammann.idgap.dto.IdRecordDTO;
import com.ammann.idgap.dto.PageFetchFailureDTO;
import com.ammann.idgap.model.AnalysisKey;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class TestDataFactory {

    public static final String ENTITY_ID = "tournaments";

    private TestDataFactory() {}

    public static EntityConfigDTO entity() {
        return new EntityConfigDTO(ENTITY_ID, "Tournaments", "https://example.com", "/tournament");
    }

    public static IdRecordDTO withResult(long id) {
        return new IdRecordDTO(id, "result-" + id, null, null, "s3://archive/" + id, "Event " + id);
    }

    public static IdRecordDTO excluded(long id) {
        return new IdRecordDTO(id, null, "NOT_PUBLISHED", null, null, null);
    }

    public static IdRecordDTO failed(long id) {
        return new IdRecordDTO(id, null, null, "ERROR", null, null);
    }

    public static IdRecordDTO notFound(long id) {
        return new IdRecordDTO(id, null, null, "NOT_FOUND", null, null);
    }

    /** Records with a linked result for each of the given IDs. */
    public static List<IdRecordDTO> withResults(long... ids) {
        List<IdRecordDTO> records = new ArrayList<>(ids.length);
        for (long id : ids) {
            records.add(withResult(id));
        }
        return records;
    }

    /** Keys records by ID, keeping the input order. */
    public static Map<Long, IdRecordDTO> byId(List<IdRecordDTO> records) {
        Map<Long, IdRecordDTO> map = new LinkedHashMap<>();
        for (IdRecordDTO record : records) {
            map.put(record.id(), record);
        }
        return map;
    }

    public static AnalysisKey key(String entityId) {
        return new AnalysisKey(entityId, null, null, true);
    }

    /** Result over 1..10 with the single gap 3-4. */
    public static GapAnalysisResultDTO analysisResult(
            String entityId, boolean partial, Instant computedAt) {
        GapRangeDTO gap = GapRangeDTO.of(3, 4);
        return new GapAnalysisResultDTO(
                entityId,
                1L,
                10L,
                true,
                List.of(gap),
                new CoverageStatsDTO(10L, 8L, 2L, 1, 80.0, gap),
                Map.of(),
                computedAt,
                partial,
                partial ? new PageFetchFailureDTO(2, "HTTP 503", 8) : null);
    }
}
