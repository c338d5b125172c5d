/* (C)2026 */
package com.ammann.idgap.service;

import com.ammann.idgap.dto.IdRecordDTO;
import com.ammann.idgap.enumeration.StatusClassification;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Classifies per-ID records into exactly one {@link StatusClassification}.
 *
 * <p>Rules are evaluated in list order and the first match wins. An absent record is
 * {@link StatusClassification#EMPTY}; a record matching no rule is
 * {@link StatusClassification#OTHER}. A linked result dominates every failure signal,
 * so a record with both a linked result and an ERROR outcome is
 * {@link StatusClassification#HAS_RESULT}.
 *
 * <p>The exclusion markers are configurable via {@code gap-analysis.classifier.excluded-markers}.
 */
@ApplicationScoped
public class StatusClassifier {

    private static final Logger LOG = Logger.getLogger(StatusClassifier.class);

    static final String DEFAULT_EXCLUDED_MARKER = "NOT_PUBLISHED";
    static final String ERROR_OUTCOME = "ERROR";
    static final Set<String> NOT_FOUND_OUTCOMES = Set.of("NOT_FOUND", "BLANK", "NOT_IN_USE");

    /**
     * A single classification rule.
     *
     * @param name rule name, used in logs
     * @param predicate condition on a present record
     * @param status status assigned when the predicate matches
     */
    public record ClassificationRule(
            String name, Predicate<IdRecordDTO> predicate, StatusClassification status) {}

    private final Set<String> excludedMarkers;
    private final List<ClassificationRule> rules;

    @Inject
    public StatusClassifier(
            @ConfigProperty(
                            name = "gap-analysis.classifier.excluded-markers",
                            defaultValue = DEFAULT_EXCLUDED_MARKER)
                    List<String> excludedMarkers) {
        this.excludedMarkers =
                excludedMarkers.stream()
                        .filter(Objects::nonNull)
                        .map(String::trim)
                        .filter(marker -> !marker.isEmpty())
                        .map(StatusClassifier::normalize)
                        .collect(Collectors.toUnmodifiableSet());
        this.rules =
                List.of(
                        new ClassificationRule(
                                "linked-result",
                                record -> !isBlank(record.linkedResultId()),
                                StatusClassification.HAS_RESULT),
                        new ClassificationRule(
                                "excluded-marker",
                                record -> matchesAny(record.exclusionReason(), this.excludedMarkers),
                                StatusClassification.EXCLUDED),
                        new ClassificationRule(
                                "fetch-error",
                                record -> ERROR_OUTCOME.equals(normalize(record.lastFetchOutcome())),
                                StatusClassification.ERROR),
                        new ClassificationRule(
                                "fetch-not-found",
                                record -> matchesAny(record.lastFetchOutcome(), NOT_FOUND_OUTCOMES),
                                StatusClassification.NOT_FOUND));
        LOG.debugf("Status classifier initialized with excluded markers %s", this.excludedMarkers);
    }

    /**
     * Classifies a record.
     *
     * @param record the record, or {@code null} if no record exists for the ID
     * @return the status of the first matching rule
     */
    public StatusClassification classify(IdRecordDTO record) {
        if (record == null) {
            return StatusClassification.EMPTY;
        }
        for (ClassificationRule rule : rules) {
            if (rule.predicate().test(record)) {
                return rule.status();
            }
        }
        return StatusClassification.OTHER;
    }

    /** Returns the rules in evaluation order. */
    public List<ClassificationRule> rules() {
        return rules;
    }

    /** Returns the normalized (upper-case) exclusion markers. */
    public Set<String> excludedMarkers() {
        return excludedMarkers;
    }

    private static boolean matchesAny(String value, Set<String> normalizedCandidates) {
        return value != null && normalizedCandidates.contains(normalize(value));
    }

    private static String normalize(String value) {
        return value == null ? null : value.toUpperCase(Locale.ROOT);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
