/* (C)2026 */
package com.ammann.idgap.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.idgap.dto.IdRecordDTO;
import com.ammann.idgap.enumeration.StatusClassification;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/**
 * Unit tests for {@link StatusClassifier}.
 *
 * <p>Covers rule priority, case-insensitive matching and totality of the classification.
 */
class StatusClassifierTest {

    private final StatusClassifier classifier = new StatusClassifier(List.of("NOT_PUBLISHED"));

    @Test
    void absentRecordIsEmpty() {
        assertThat(classifier.classify(null)).isEqualTo(StatusClassification.EMPTY);
    }

    @Test
    void linkedResultDominatesErrorOutcome() {
        IdRecordDTO record = new IdRecordDTO(1L, "r-1", "NOT_PUBLISHED", "ERROR", null, null);

        assertThat(classifier.classify(record)).isEqualTo(StatusClassification.HAS_RESULT);
    }

    @Test
    void exclusionWinsOverFetchOutcome() {
        IdRecordDTO record = new IdRecordDTO(2L, null, "not_published", "ERROR", null, null);

        assertThat(classifier.classify(record)).isEqualTo(StatusClassification.EXCLUDED);
    }

    @Test
    void blankLinkedResultDoesNotCount() {
        IdRecordDTO record = new IdRecordDTO(3L, "  ", null, null, null, null);

        assertThat(classifier.classify(record)).isEqualTo(StatusClassification.OTHER);
    }

    @ParameterizedTest
    @CsvSource({
        "ERROR,ERROR",
        "error,ERROR",
        "NOT_FOUND,NOT_FOUND",
        "blank,NOT_FOUND",
        "Not_In_Use,NOT_FOUND",
        "TIMEOUT,OTHER"
    })
    void classifiesFetchOutcomesCaseInsensitively(String outcome, StatusClassification expected) {
        IdRecordDTO record = new IdRecordDTO(4L, null, null, outcome, null, null);

        assertThat(classifier.classify(record)).isEqualTo(expected);
    }

    @Test
    void unknownExclusionReasonIsOther() {
        IdRecordDTO record = new IdRecordDTO(5L, null, "DRAFT", null, null, null);

        assertThat(classifier.classify(record)).isEqualTo(StatusClassification.OTHER);
    }

    @Test
    void bareRecordIsOther() {
        assertThat(classifier.classify(IdRecordDTO.bare(6L))).isEqualTo(StatusClassification.OTHER);
    }

    @Test
    void configuredMarkersReplaceDefault() {
        StatusClassifier custom = new StatusClassifier(List.of("draft", " WITHDRAWN ", ""));

        assertThat(custom.excludedMarkers()).containsExactlyInAnyOrder("DRAFT", "WITHDRAWN");
        assertThat(custom.classify(new IdRecordDTO(7L, null, "Withdrawn", null, null, null)))
                .isEqualTo(StatusClassification.EXCLUDED);
        assertThat(custom.classify(new IdRecordDTO(8L, null, "NOT_PUBLISHED", null, null, null)))
                .isEqualTo(StatusClassification.OTHER);
    }

    @Test
    void rulesAreEvaluatedInPriorityOrder() {
        assertThat(classifier.rules())
                .extracting(StatusClassifier.ClassificationRule::status)
                .containsExactly(
                        StatusClassification.HAS_RESULT,
                        StatusClassification.EXCLUDED,
                        StatusClassification.ERROR,
                        StatusClassification.NOT_FOUND);
    }
}
