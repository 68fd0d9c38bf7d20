package utils;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Dates are integer day counts since 1970-01-01 (UTC). Day counts are
 * {@code int}, which covers years from about -5,877,000 to +5,881,000;
 * dates outside that range are rejected.
 */
public class EpochalDays {

    // accepts single-digit months and days, e.g. 2017-1-1
    private static final DateTimeFormatter LENIENT = DateTimeFormatter.ofPattern("u-M-d");

    public static int toEpochal(String date) {
        String text = date.trim();
        LocalDate parsed;
        try {
            parsed = LocalDate.parse(text);
        } catch (DateTimeParseException e) {
            try {
                parsed = LocalDate.parse(text, LENIENT);
            } catch (DateTimeParseException e2) {
                throw new IllegalArgumentException("Not a date: " + date, e2);
            }
        }
        long epochDay = parsed.toEpochDay();
        if (epochDay < Integer.MIN_VALUE || epochDay > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Date out of the epochal-day range: " + date);
        }
        return (int) epochDay;
    }

    public static String toDateString(long epochalDay) {
        return LocalDate.ofEpochDay(epochalDay).toString();
    }

    public static int today() {
        return Math.toIntExact(LocalDate.now(ZoneOffset.UTC).toEpochDay());
    }
}
