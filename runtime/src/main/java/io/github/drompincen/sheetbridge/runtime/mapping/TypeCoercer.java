package io.github.drompincen.sheetbridge.runtime.mapping;

import io.github.drompincen.sheetbridge.protocol.api.FieldType;
import io.github.drompincen.sheetbridge.protocol.error.DataConversionException;
import io.github.drompincen.sheetbridge.runtime.rows.CellValue;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Converts tagged cells to the declared field type. Numbers become {@code Long} when
 * integral and {@code Double} otherwise; dates become UTC {@code Instant}s.
 */
@Component
public class TypeCoercer {

    private static final Pattern GROUPED_NUMBER = Pattern.compile("[+-]?\\d{1,3}(,\\d{3})+(\\.\\d+)?");

    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss"),
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"));

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ofPattern("yyyy-MM-dd"),
            DateTimeFormatter.ofPattern("M/d/yyyy"),
            DateTimeFormatter.ofPattern("d.M.yyyy"),
            DateTimeFormatter.ofPattern("yyyy/MM/dd"),
            new DateTimeFormatterBuilder().parseCaseInsensitive()
                    .appendPattern("d-MMM-yyyy").toFormatter(Locale.ENGLISH));

    /**
     * @return the converted value, or null for a blank cell
     * @throws DataConversionException if the cell cannot be read as {@code type}
     */
    public Object coerce(CellValue cell, FieldType type) {
        if (cell.isBlank()) return null;
        return switch (type) {
            case STRING -> toText(cell);
            case NUMBER -> toNumber(cell);
            case DATE -> toDate(cell);
            case BOOLEAN -> toBoolean(cell);
        };
    }

    private String toText(CellValue cell) {
        return cell.kind() == CellValue.Kind.TEXT ? cell.asText().trim() : cell.raw();
    }

    private Number toNumber(CellValue cell) {
        switch (cell.kind()) {
            case NUMBER:
                return narrow(BigDecimal.valueOf(cell.asNumber()));
            case TEXT:
                String text = cell.asText().trim();
                if (text.indexOf(',') >= 0) {
                    if (!GROUPED_NUMBER.matcher(text).matches()) throw failed(cell, FieldType.NUMBER);
                    text = text.replace(",", "");
                }
                if (text.startsWith("+")) text = text.substring(1);
                try {
                    return narrow(new BigDecimal(text));
                } catch (NumberFormatException e) {
                    throw failed(cell, FieldType.NUMBER);
                }
            default:
                throw failed(cell, FieldType.NUMBER);
        }
    }

    private static Number narrow(BigDecimal value) {
        BigDecimal stripped = value.stripTrailingZeros();
        if (stripped.scale() <= 0) {
            try {
                return stripped.longValueExact();
            } catch (ArithmeticException e) {
                return value.doubleValue();
            }
        }
        return value.doubleValue();
    }

    private Instant toDate(CellValue cell) {
        if (cell.kind() == CellValue.Kind.DATE) return cell.asDate();
        if (cell.kind() != CellValue.Kind.TEXT) throw failed(cell, FieldType.DATE);
        String text = cell.asText().trim();
        Optional<Instant> parsed = tryParse(text, Instant::parse);
        for (DateTimeFormatter format : DATE_TIME_FORMATS) {
            if (parsed.isPresent()) break;
            parsed = tryParse(text, t -> LocalDateTime.parse(t, format).toInstant(ZoneOffset.UTC));
        }
        for (DateTimeFormatter format : DATE_FORMATS) {
            if (parsed.isPresent()) break;
            parsed = tryParse(text, t -> LocalDate.parse(t, format).atStartOfDay(ZoneOffset.UTC).toInstant());
        }
        return parsed.orElseThrow(() -> failed(cell, FieldType.DATE));
    }

    private static Optional<Instant> tryParse(String text, Function<String, Instant> parser) {
        try {
            return Optional.of(parser.apply(text));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private Boolean toBoolean(CellValue cell) {
        if (cell.kind() == CellValue.Kind.BOOLEAN) return cell.asBoolean();
        if (cell.kind() == CellValue.Kind.NUMBER) {
            double d = cell.asNumber();
            if (d == 1) return true;
            if (d == 0) return false;
            throw failed(cell, FieldType.BOOLEAN);
        }
        if (cell.kind() != CellValue.Kind.TEXT) throw failed(cell, FieldType.BOOLEAN);
        return switch (cell.asText().trim().toLowerCase(Locale.ROOT)) {
            case "true", "yes", "1" -> true;
            case "false", "no", "0" -> false;
            default -> throw failed(cell, FieldType.BOOLEAN);
        };
    }

    private static DataConversionException failed(CellValue cell, FieldType type) {
        return new DataConversionException("cannot convert '" + cell.raw() + "' to " + type.label(), cell.raw());
    }

    /** Hint shown next to a conversion failure. */
    public static String suggestion(FieldType type) {
        return switch (type) {
            case NUMBER -> "use digits with an optional sign, decimal point and thousands separators";
            case DATE -> "use a date such as 2024-03-31 or 03/31/2024";
            case BOOLEAN -> "use true/false, yes/no or 1/0";
            case STRING -> null;
        };
    }
}
