package paperless.util;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * Parsování datumových řetězců z Paperless API (ISO 8601, s časovou zónou nebo bez ní).
 */
public final class DateTimes {

    private DateTimes() {
        // Utility class
    }

    /**
     * Datum a čas; hodnota bez zóny se bere jako UTC, samotné datum jako půlnoc UTC.
     *
     * @return null pro null vstup
     * @throws DateTimeParseException pokud řetězec není ISO 8601
     */
    public static OffsetDateTime parseDateTime(String value) {
        if (value == null) {
            return null;
        }
        String text = value.trim();
        if (text.length() == 10) {
            return LocalDate.parse(text).atStartOfDay().atOffset(ZoneOffset.UTC);
        }
        if (hasOffset(text)) {
            return OffsetDateTime.parse(text);
        }
        return LocalDateTime.parse(text).atOffset(ZoneOffset.UTC);
    }

    /**
     * Samotné datum; z hodnoty s časem se vezme datumová část.
     */
    public static LocalDate parseDate(String value) {
        if (value == null) {
            return null;
        }
        String text = value.trim();
        if (text.length() == 10) {
            return LocalDate.parse(text);
        }
        return parseDateTime(text).toLocalDate();
    }

    private static boolean hasOffset(String text) {
        if (text.endsWith("Z") || text.endsWith("z")) {
            return true;
        }
        int timeStart = text.indexOf('T');
        return timeStart > 0 && (text.indexOf('+', timeStart) > 0 || text.indexOf('-', timeStart) > 0);
    }
}
