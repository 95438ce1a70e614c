package com.enterprise.sheetrecovery.core.model;

import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * One row of a {@link Table}. Row 0 of every table is its header.
 */
@Value
public class TableRow {

    List<CellValue> cells;

    public TableRow(List<CellValue> cells) {
        this.cells = List.copyOf(cells);
    }

    public static TableRow of(CellValue... cells) {
        return new TableRow(List.of(cells));
    }

    public static TableRow ofStrings(List<String> values) {
        return new TableRow(values.stream().map(CellValue::string).collect(Collectors.toList()));
    }

    public CellValue get(int index) {
        return cells.get(index);
    }

    public int size() {
        return cells.size();
    }

    public boolean isBlank() {
        return cells.stream().allMatch(CellValue::isEmpty);
    }

    public List<String> texts() {
        return cells.stream().map(CellValue::asText).collect(Collectors.toList());
    }
}
