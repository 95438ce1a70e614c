package com.enterprise.sheetrecovery.core.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Objects;

/**
 * A single typed cell. Absent data is always {@link #empty()}, whose value is the empty string.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CellValue {

    public enum Type {
        EMPTY, NUMBER, BOOLEAN, DATE, STRING
    }

    private static final CellValue EMPTY = new CellValue(Type.EMPTY, "");

    Type type;
    Object value;

    public static CellValue empty() {
        return EMPTY;
    }

    public static CellValue number(double value) {
        return new CellValue(Type.NUMBER, value);
    }

    public static CellValue bool(boolean value) {
        return new CellValue(Type.BOOLEAN, value);
    }

    public static CellValue date(LocalDate value) {
        return dateTime(value.atStartOfDay());
    }

    public static CellValue dateTime(LocalDateTime value) {
        return new CellValue(Type.DATE, Objects.requireNonNull(value, "value"));
    }

    /**
     * String cell; {@code null} and the empty string both collapse to {@link #empty()}.
     */
    public static CellValue string(String value) {
        if (value == null || value.isEmpty()) {
            return EMPTY;
        }
        return new CellValue(Type.STRING, value);
    }

    public boolean isEmpty() {
        return type == Type.EMPTY;
    }

    public double asNumber() {
        requireType(Type.NUMBER);
        return (Double) value;
    }

    public boolean asBoolean() {
        requireType(Type.BOOLEAN);
        return (Boolean) value;
    }

    public LocalDateTime asDate() {
        requireType(Type.DATE);
        return (LocalDateTime) value;
    }

    /**
     * Display text: integral numbers without a trailing ".0", dates as ISO dates
     * (with the time only when it is not midnight).
     */
    public String asText() {
        return switch (type) {
            case EMPTY -> "";
            case NUMBER -> {
                double d = (Double) value;
                yield d == Math.floor(d) && !Double.isInfinite(d) && Math.abs(d) < 1e15
                        ? String.valueOf((long) d)
                        : String.valueOf(d);
            }
            case BOOLEAN -> String.valueOf(value);
            case DATE -> {
                LocalDateTime dt = (LocalDateTime) value;
                yield dt.toLocalTime().equals(LocalTime.MIDNIGHT)
                        ? dt.toLocalDate().toString()
                        : dt.toString();
            }
            case STRING -> (String) value;
        };
    }

    private void requireType(Type expected) {
        if (type != expected) {
            throw new IllegalStateException("Cell is " + type + ", not " + expected);
        }
    }
}
