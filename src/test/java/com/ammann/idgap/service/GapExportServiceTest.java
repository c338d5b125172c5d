/* (C)2026 */
package com.ammann.idgap.service;

import static com.ammann.idgap.support.TestDataFactory.ENTITY_ID;
import static com.ammann.idgap.support.TestDataFactory.analysisResult;
import static com.ammann.idgap.support.TestDataFactory.entity;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.idgap.dto.CoverageStatsDTO;
import com.ammann.idgap.dto.EntityConfigDTO;
import com.ammann.idgap.dto.GapAnalysisResultDTO;
import com.ammann.idgap.dto.GapRangeDTO;
import com.ammann.idgap.dto.GapUrlDTO;
import com.ammann.idgap.exception.ValidationException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class GapExportServiceTest {

    private final GapExportService service = new GapExportService();

    @Test
    void buildsStatsForTypicalRange() {
        List<GapRangeDTO> gaps = List.of(GapRangeDTO.of(3, 4), GapRangeDTO.of(8, 9));

        CoverageStatsDTO stats = service.buildStats(1, 10, gaps, 6);

        assertThat(stats.totalSlots()).isEqualTo(10L);
        assertThat(stats.totalStored()).isEqualTo(6L);
        assertThat(stats.totalMissing()).isEqualTo(4L);
        assertThat(stats.gapCount()).isEqualTo(2);
        assertThat(stats.coveragePercent()).isEqualTo(60.0);
        // ties keep the first gap
        assertThat(stats.largestGap()).isEqualTo(GapRangeDTO.of(3, 4));
    }

    @Test
    void statsWithoutGapsHaveFullCoverage() {
        CoverageStatsDTO stats = service.buildStats(1, 5, List.of(), 5);

        assertThat(stats.coveragePercent()).isEqualTo(100.0);
        assertThat(stats.largestGap()).isNull();
    }

    @ParameterizedTest
    @CsvSource({
        "0,0,100.0",
        "3,1,66.67",
        "3,2,33.33",
        "7,7,0.0",
        "200000,1,100.0",
        "8,1,87.5"
    })
    void roundsCoverageHalfUpToTwoDecimals(long slots, long missing, double expected) {
        assertThat(GapExportService.coveragePercent(slots, missing)).isEqualTo(expected);
    }

    @Test
    void buildsSourceUrlForEveryIdOfGap() {
        List<GapUrlDTO> urls = service.urlsForRange(entity(), GapRangeDTO.of(3, 5));

        assertThat(urls)
                .extracting(GapUrlDTO::url)
                .containsExactly(
                        "https://example.com/tournament?id=3",
                        "https://example.com/tournament?id=4",
                        "https://example.com/tournament?id=5");
    }

    @Test
    @Timeout(5)
    void buildsUrlsForGapEndingAtLargestId() {
        List<GapUrlDTO> urls =
                service.urlsForRange(entity(), GapRangeDTO.of(Long.MAX_VALUE - 1, Long.MAX_VALUE));

        assertThat(urls)
                .extracting(GapUrlDTO::id)
                .containsExactly(Long.MAX_VALUE - 1, Long.MAX_VALUE);
    }

    @Test
    void writesCsvWithHeaderAndOneRowPerMissingId() {
        byte[] csv =
                service.exportCsv(entity(), List.of(GapRangeDTO.of(3, 4), GapRangeDTO.of(9, 9)));

        assertThat(new String(csv, StandardCharsets.UTF_8))
                .isEqualTo(
                        "ID,URL\n"
                                + "3,https://example.com/tournament?id=3\n"
                                + "4,https://example.com/tournament?id=4\n"
                                + "9,https://example.com/tournament?id=9\n");
    }

    @Test
    void rejectsExportAboveRowLimit() {
        service.maxExportRows = 10;

        assertThatThrownBy(() -> service.exportCsv(entity(), List.of(GapRangeDTO.of(1, 11))))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("export rows");
    }

    @Test
    void fileNameUsesSanitizedEntityNameAndDate() {
        EntityConfigDTO entity = new EntityConfigDTO("t-1", "Pro Tour / 2026", "https://x", "/t");

        assertThat(service.exportFileName(entity, LocalDate.of(2026, 3, 1)))
                .isEqualTo("gap_analysis_Pro_Tour_2026_2026-03-01.csv");
        assertThat(service.exportFileName(new EntityConfigDTO("t-1", null, null, null), LocalDate.of(2026, 3, 1)))
                .isEqualTo("gap_analysis_t-1_2026-03-01.csv");
    }

    @Test
    void summarizesGaps() {
        GapAnalysisResultDTO result = analysisResult(ENTITY_ID, false, Instant.EPOCH);

        assertThat(service.summarize(result))
                .isEqualTo("Found 2 missing IDs in 1 gaps. Coverage: 80.00%. Largest gap: 3-4 (2 IDs).");
    }

    @Test
    void summaryFlagsPartialData() {
        GapAnalysisResultDTO result = analysisResult(ENTITY_ID, true, Instant.EPOCH);

        assertThat(service.summarize(result)).endsWith("Record data is incomplete, retry for a full analysis.");
    }

    @Test
    void summaryWithoutGaps() {
        GapAnalysisResultDTO result =
                new GapAnalysisResultDTO(
                        ENTITY_ID,
                        1L,
                        5L,
                        true,
                        List.of(),
                        service.buildStats(1, 5, List.of(), 5),
                        Map.of(),
                        Instant.EPOCH,
                        false,
                        null);

        assertThat(service.summarize(result)).isEqualTo("No gaps found. All IDs from 1 to 5 are present.");
    }

    @Test
    void formatsFirstFiveRangesThenCountsRest() {
        List<GapRangeDTO> gaps =
                List.of(
                        GapRangeDTO.of(2, 2),
                        GapRangeDTO.of(4, 6),
                        GapRangeDTO.of(8, 8),
                        GapRangeDTO.of(10, 12),
                        GapRangeDTO.of(14, 14),
                        GapRangeDTO.of(16, 20),
                        GapRangeDTO.of(22, 22));

        assertThat(service.formatGapRanges(gaps)).isEqualTo("2, 4-6, 8, 10-12, 14 ... and 2 more");
        assertThat(service.formatGapRanges(gaps.subList(0, 2))).isEqualTo("2, 4-6");
        assertThat(service.formatGapRanges(List.of())).isEqualTo("None");
    }

    @Test
    void parsesRangeSelectors() {
        assertThat(service.parseRangeKey(" 3 - 4 ")).isEqualTo("3-4");
        assertThat(service.parseRangeKey("007-9")).isEqualTo("7-9");
        assertThatThrownBy(() -> service.parseRangeKey("3..4")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.parseRangeKey(null)).isInstanceOf(ValidationException.class);
    }
}
