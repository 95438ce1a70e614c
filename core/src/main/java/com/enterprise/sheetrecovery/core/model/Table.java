package com.enterprise.sheetrecovery.core.model;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Rectangular grid of cells: every row has {@link #getWidth()} cells, short rows having been
 * right-padded with empty cells when the table was built.
 */
@Value
public class Table {

    List<TableRow> rows;
    int width;

    private Table(List<TableRow> rows, int width) {
        this.rows = rows;
        this.width = width;
    }

    public static Table of(List<? extends List<CellValue>> rows) {
        int width = rows.stream().mapToInt(List::size).max().orElse(0);
        List<TableRow> padded = new ArrayList<>(rows.size());
        for (List<CellValue> row : rows) {
            List<CellValue> cells = new ArrayList<>(width);
            for (CellValue cell : row) {
                cells.add(cell == null ? CellValue.empty() : cell);
            }
            while (cells.size() < width) {
                cells.add(CellValue.empty());
            }
            padded.add(new TableRow(cells));
        }
        return new Table(Collections.unmodifiableList(padded), width);
    }

    public static Table ofRows(List<TableRow> rows) {
        List<List<CellValue>> cells = new ArrayList<>(rows.size());
        for (TableRow row : rows) {
            cells.add(row.getCells());
        }
        return of(cells);
    }

    public int height() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public TableRow header() {
        if (rows.isEmpty()) {
            throw new IllegalStateException("Table has no rows");
        }
        return rows.get(0);
    }

    public TableRow row(int index) {
        return rows.get(index);
    }
}
