package com.tallybook.ledger.util;

import java.time.LocalDate;
import java.time.Year;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalQuery;
import java.util.List;

/**
 * Resolves heterogeneous date text into a {@code YYYY-MM} period key.
 */
public class PeriodResolver {

    private static final DateTimeFormatter PERIOD = DateTimeFormatter.ofPattern("uuuu-MM");
    private static final DateTimeFormatter COMPACT = DateTimeFormatter.ofPattern("uuuuMM").withResolverStyle(ResolverStyle.STRICT);

    private static final DateTimeFormatter BARE_YEAR = new DateTimeFormatterBuilder()
            .appendValue(ChronoField.YEAR, 4)
            .toFormatter()
            .withResolverStyle(ResolverStyle.STRICT);

    private record Candidate(DateTimeFormatter format, TemporalQuery<YearMonth> query) {}

    // Full dates first, then year-month, then bare year
    private static final List<Candidate> FORMATS = List.of(
            date("uuuu-M-d"),
            date("uuuu/M/d"),
            date("uuuu.M.d"),
            month("uuuu-M"),
            month("uuuu/M"),
            month("uuuu.M"),
            new Candidate(BARE_YEAR, t -> Year.from(t).atMonth(1))
    );

    private PeriodResolver() {}

    /**
     * @param rowValue date text from the row, may be null
     * @param fallback task-wide period used when the row value does not parse, may be null
     * @return the period, or an empty string when neither input resolves
     */
    public static String resolvePeriod(String rowValue, String fallback) {
        if (rowValue != null && !rowValue.isBlank()) {
            String s = rowValue.trim();
            for (Candidate c : FORMATS) {
                try {
                    return c.format().parse(s, c.query()).format(PERIOD);
                } catch (DateTimeParseException ignored) {
                    // try the next format
                }
            }
        }
        if (fallback != null && !fallback.isBlank()) {
            String f = fallback.trim();
            if (f.length() >= 7) {
                return f.substring(0, 7);
            }
            try {
                return YearMonth.parse(f, COMPACT).format(PERIOD);
            } catch (DateTimeParseException ignored) {
                // unresolved
            }
        }
        return "";
    }

    private static Candidate date(String pattern) {
        return new Candidate(strict(pattern), t -> YearMonth.from(LocalDate.from(t)));
    }

    private static Candidate month(String pattern) {
        return new Candidate(strict(pattern), YearMonth::from);
    }

    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT);
    }
}
