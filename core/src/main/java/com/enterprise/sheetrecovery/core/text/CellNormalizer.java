package com.enterprise.sheetrecovery.core.text;

import com.enterprise.sheetrecovery.core.model.CellValue;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts raw field text into typed cells (data rows) or into names that are safe to use
 * as column headers.
 */
public class CellNormalizer {

    public static final String HEADER_PLACEHOLDER = "컬럼";

    private static final Pattern CONTROL = Pattern.compile("[\\x00-\\x1F\\x7F-\\x9F]");
    private static final Pattern HEADER_UNSAFE = Pattern.compile("[^A-Za-z0-9_\\s가-힣()\\[\\]{}.,\\-]");
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    private static final Pattern NUMBER = Pattern.compile("-?\\d+(,\\d+)*(\\.\\d+)?");
    private static final Pattern PERCENT = Pattern.compile("(-?\\d+(?:,\\d+)*(?:\\.\\d+)?)\\s*%");
    private static final Pattern ISO_DATE = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");

    private static final Set<String> TRUE_WORDS = Set.of("true", "yes", "참");
    private static final Set<String> FALSE_WORDS = Set.of("false", "no", "거짓");

    /**
     * Header-safe name for column {@code columnIndex} (0-based); never empty.
     */
    public String header(String raw, int columnIndex) {
        String cleaned = cleanHeader(raw);
        return cleaned.isEmpty() ? HEADER_PLACEHOLDER + (columnIndex + 1) : cleaned;
    }

    /**
     * Header cleanup without the placeholder: may return the empty string.
     */
    public String cleanHeader(String raw) {
        if (raw == null || raw.isBlank()) {
            return "";
        }
        String normalized = CONTROL.matcher(raw.trim()).replaceAll("");
        normalized = HEADER_UNSAFE.matcher(normalized).replaceAll("");
        return WHITESPACE_RUN.matcher(normalized.trim()).replaceAll(" ");
    }

    public CellValue data(String raw) {
        if (raw == null || raw.isBlank()) {
            return CellValue.empty();
        }
        String trimmed = raw.trim();

        if (trimmed.indexOf('(') >= 0 || trimmed.indexOf(')') >= 0) {
            return CellValue.string(trimmed);
        }

        if (NUMBER.matcher(trimmed).matches()) {
            Double number = parse(trimmed);
            if (number != null) {
                return CellValue.number(number);
            }
        }

        Matcher percent = PERCENT.matcher(trimmed);
        if (percent.matches()) {
            Double number = parse(percent.group(1));
            if (number != null) {
                return CellValue.number(number / 100);
            }
        }

        if (ISO_DATE.matcher(trimmed).matches()) {
            try {
                return CellValue.date(LocalDate.parse(trimmed));
            } catch (DateTimeParseException e) {
                // not a calendar date, e.g. 2024-13-45
            }
        }

        String lower = trimmed.toLowerCase(Locale.ROOT);
        if (TRUE_WORDS.contains(lower)) {
            return CellValue.bool(true);
        }
        if (FALSE_WORDS.contains(lower)) {
            return CellValue.bool(false);
        }

        return CellValue.string(trimmed);
    }

    private static Double parse(String digits) {
        try {
            double value = Double.parseDouble(digits.replace(",", ""));
            return Double.isFinite(value) ? value : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
