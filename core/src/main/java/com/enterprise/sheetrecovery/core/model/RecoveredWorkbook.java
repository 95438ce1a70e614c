package com.enterprise.sheetrecovery.core.model;

import com.enterprise.sheetrecovery.core.util.FileNames;
import lombok.Value;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Ordered, named sheets. Sheet names are sanitized, truncated to the 31 characters a
 * workbook allows and made unique (case-insensitively) when the workbook is built.
 */
@Value
public class RecoveredWorkbook {

    public static final int MAX_SHEET_NAME_LENGTH = 31;

    List<RecoveredSheet> sheets;

    private RecoveredWorkbook(List<RecoveredSheet> sheets) {
        this.sheets = List.copyOf(sheets);
    }

    public static RecoveredWorkbook single(String sheetName, Table table) {
        return builder().sheet(sheetName, table).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public RecoveredSheet firstSheet() {
        return sheets.get(0);
    }

    public List<String> sheetNames() {
        return sheets.stream().map(RecoveredSheet::getName).collect(Collectors.toList());
    }

    public static final class Builder {

        private final List<RecoveredSheet> sheets = new ArrayList<>();
        private final Set<String> usedNames = new HashSet<>();

        private Builder() {
        }

        public Builder sheet(String name, Table table) {
            String safeName = uniqueName(name, sheets.size() + 1);
            usedNames.add(safeName.toLowerCase(Locale.ROOT));
            sheets.add(new RecoveredSheet(safeName, table));
            return this;
        }

        public boolean isEmpty() {
            return sheets.isEmpty();
        }

        public RecoveredWorkbook build() {
            if (sheets.isEmpty()) {
                throw new IllegalStateException("A workbook needs at least one sheet");
            }
            return new RecoveredWorkbook(sheets);
        }

        private String uniqueName(String requested, int position) {
            String base = requested == null ? "" : FileNames.sanitize(requested, "");
            if (base.isEmpty()) {
                base = "Sheet" + position;
            }
            base = truncate(base, MAX_SHEET_NAME_LENGTH);
            String candidate = base;
            int suffix = 2;
            while (usedNames.contains(candidate.toLowerCase(Locale.ROOT))) {
                String tail = "_" + suffix++;
                candidate = truncate(base, MAX_SHEET_NAME_LENGTH - tail.length()) + tail;
            }
            return candidate;
        }

        private static String truncate(String value, int max) {
            return value.length() <= max ? value : value.substring(0, max);
        }
    }
}
