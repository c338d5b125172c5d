/* (C)2026 */
package com.ammann.idgap.service;

import com.ammann.idgap.dto.CoverageStatsDTO;
import com.ammann.idgap.dto.EntityConfigDTO;
import com.ammann.idgap.dto.GapAnalysisResultDTO;
import com.ammann.idgap.dto.GapRangeDTO;
import com.ammann.idgap.dto.GapUrlDTO;
import com.ammann.idgap.exception.SomeThingWentWrongException;
import com.ammann.idgap.exception.ValidationException;
import com.opencsv.CSVWriter;
import jakarta.enterprise.context.ApplicationScoped;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Derives coverage statistics, source URLs, CSV exports and text summaries from gaps.
 */
@ApplicationScoped
public class GapExportService {

    private static final Logger LOG = Logger.getLogger(GapExportService.class);

    static final String[] HEADERS = {"ID", "URL"};
    static final int DEFAULT_MAX_ROWS = 100_000;
    static final int SUMMARY_RANGE_LIMIT = 5;

    private static final Pattern RANGE_KEY = Pattern.compile("^\\s*(\\d+)\\s*-\\s*(\\d+)\\s*$");
    private static final Pattern UNSAFE_FILE_CHARS = Pattern.compile("[^A-Za-z0-9._-]+");
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    @ConfigProperty(name = "gap-analysis.export.max-rows", defaultValue = "100000")
    int maxExportRows = DEFAULT_MAX_ROWS;

    /**
     * Computes coverage statistics of an analysed range.
     *
     * @param minId first ID of the range
     * @param maxId last ID of the range
     * @param gaps gaps of the range
     * @param totalStored number of IDs in the range that have a record
     * @return statistics; coverage is 100 for an empty range
     */
    public CoverageStatsDTO buildStats(
            long minId, long maxId, List<GapRangeDTO> gaps, long totalStored) {
        long totalSlots = maxId >= minId ? maxId - minId + 1 : 0;
        long totalMissing = gaps.stream().mapToLong(GapRangeDTO::count).sum();

        GapRangeDTO largestGap = null;
        for (GapRangeDTO gap : gaps) {
            if (largestGap == null || gap.count() > largestGap.count()) {
                largestGap = gap;
            }
        }

        return new CoverageStatsDTO(
                totalSlots,
                totalStored,
                totalMissing,
                gaps.size(),
                coveragePercent(totalSlots, totalMissing),
                largestGap);
    }

    /**
     * Share of the range not covered by gaps, in percent, rounded half-up to two decimals.
     *
     * @param totalSlots number of IDs in the range
     * @param totalMissing number of missing IDs
     * @return coverage between 0 and 100; 100 if {@code totalSlots} is 0
     */
    public static double coveragePercent(long totalSlots, long totalMissing) {
        if (totalSlots <= 0) {
            return 100.0;
        }
        return BigDecimal.valueOf(totalSlots - totalMissing)
                .multiply(HUNDRED)
                .divide(BigDecimal.valueOf(totalSlots), 2, RoundingMode.HALF_UP)
                .doubleValue();
    }

    /**
     * Builds the source URL of every ID in a gap.
     *
     * @param entity entity holding the URL template
     * @param gap gap to expand
     * @return one URL per ID, ascending
     */
    public List<GapUrlDTO> urlsForRange(EntityConfigDTO entity, GapRangeDTO gap) {
        ensureWithinLimit(gap.count());
        List<GapUrlDTO> urls = new ArrayList<>(Math.toIntExact(gap.count()));
        for (long offset = 0; offset < gap.count(); offset++) {
            long id = gap.start() + offset;
            urls.add(new GapUrlDTO(id, entity.urlFor(id)));
        }
        return urls;
    }

    /**
     * Writes the missing IDs of the given gaps as CSV with the header {@code ID,URL}.
     *
     * @param entity entity holding the URL template
     * @param gaps gaps to export
     * @return UTF-8 encoded CSV
     * @throws ValidationException if the gaps hold more IDs than the export row limit
     */
    public byte[] exportCsv(EntityConfigDTO entity, List<GapRangeDTO> gaps) {
        ensureWithinLimit(countIds(gaps));

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (CSVWriter writer =
                new CSVWriter(
                        new OutputStreamWriter(out, StandardCharsets.UTF_8),
                        CSVWriter.DEFAULT_SEPARATOR,
                        CSVWriter.DEFAULT_QUOTE_CHARACTER,
                        CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                        CSVWriter.DEFAULT_LINE_END)) {
            writer.writeNext(HEADERS, false);
            for (GapRangeDTO gap : gaps) {
                for (GapUrlDTO url : urlsForRange(entity, gap)) {
                    writer.writeNext(new String[] {Long.toString(url.id()), url.url()}, false);
                }
            }
        } catch (IOException e) {
            throw new SomeThingWentWrongException("writing the gap CSV of " + entity.id(), e);
        }

        LOG.debugf("Exported %d gap IDs of entity %s as CSV", countIds(gaps), entity.id());
        return out.toByteArray();
    }

    /**
     * Suggested download file name, {@code gap_analysis_<entity>_<yyyy-MM-dd>.csv}.
     *
     * @param entity exported entity; its name is used, or its ID when unnamed
     * @param date export date
     * @return file name with unsafe characters replaced by underscores
     */
    public String exportFileName(EntityConfigDTO entity, LocalDate date) {
        String name =
                entity.entityName() == null || entity.entityName().isBlank()
                        ? entity.id()
                        : entity.entityName();
        String safeName = UNSAFE_FILE_CHARS.matcher(name.trim()).replaceAll("_");
        return "gap_analysis_" + safeName + "_" + DateTimeFormatter.ISO_LOCAL_DATE.format(date)
                + ".csv";
    }

    /**
     * One-line human readable summary of a result.
     *
     * @param result analysis result
     * @return summary text
     */
    public String summarize(GapAnalysisResultDTO result) {
        CoverageStatsDTO stats = result.stats();
        StringBuilder summary = new StringBuilder();

        if (stats.totalMissing() == 0) {
            summary.append(
                    String.format(
                            Locale.ROOT,
                            "No gaps found. All IDs from %d to %d are present.",
                            result.minId(),
                            result.maxId()));
        } else {
            GapRangeDTO largest = stats.largestGap();
            summary.append(
                    String.format(
                            Locale.ROOT,
                            "Found %d missing IDs in %d gaps. Coverage: %.2f%%. Largest gap: %d-%d (%d IDs).",
                            stats.totalMissing(),
                            stats.gapCount(),
                            stats.coveragePercent(),
                            largest.start(),
                            largest.end(),
                            largest.count()));
        }

        if (Boolean.TRUE.equals(result.partial())) {
            summary.append(" Record data is incomplete, retry for a full analysis.");
        }
        return summary.toString();
    }

    /**
     * Compact listing of gaps, e.g. {@code 3-4, 9, 12-20}; after five gaps the rest is
     * abbreviated as {@code ... and N more}.
     *
     * @param gaps gaps to list
     * @return listing, {@code "None"} without gaps
     */
    public String formatGapRanges(List<GapRangeDTO> gaps) {
        if (gaps.isEmpty()) {
            return "None";
        }

        String listed =
                gaps.stream()
                        .limit(SUMMARY_RANGE_LIMIT)
                        .map(gap -> gap.count() == 1 ? String.valueOf(gap.start()) : gap.key())
                        .collect(Collectors.joining(", "));

        int remaining = gaps.size() - SUMMARY_RANGE_LIMIT;
        return remaining > 0 ? listed + " ... and " + remaining + " more" : listed;
    }

    /**
     * Parses an export selection such as {@code 3-4} into its normalized key.
     *
     * @param selection range selector
     * @return normalized key, {@code start-end}
     * @throws ValidationException if the selector is malformed
     */
    public String parseRangeKey(String selection) {
        Matcher matcher = selection == null ? null : RANGE_KEY.matcher(selection);
        if (matcher == null || !matcher.matches()) {
            throw ValidationException.invalidParameter("range", selection, "a range like 3-4");
        }
        try {
            long start = Long.parseLong(matcher.group(1));
            long end = Long.parseLong(matcher.group(2));
            return start + "-" + end;
        } catch (NumberFormatException e) {
            throw new ValidationException("Range selector out of bounds: " + selection, e);
        }
    }

    private void ensureWithinLimit(long rows) {
        if (rows > maxExportRows) {
            throw ValidationException.limitExceeded("export rows", maxExportRows, rows);
        }
    }

    static long countIds(List<GapRangeDTO> gaps) {
        return gaps.stream().mapToLong(GapRangeDTO::count).sum();
    }
}
