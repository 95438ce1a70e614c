package com.enterprise.sheetrecovery.core.decode;

import com.enterprise.sheetrecovery.core.model.CellValue;
import com.enterprise.sheetrecovery.core.model.RecoveredSheet;
import com.enterprise.sheetrecovery.core.model.RecoveredWorkbook;
import com.enterprise.sheetrecovery.core.model.Table;
import com.enterprise.sheetrecovery.core.model.TableRow;
import com.enterprise.sheetrecovery.core.text.CellNormalizer;

import java.util.ArrayList;
import java.util.List;

/**
 * Re-types string cells of a decoded workbook: header strings are trimmed, data strings go
 * through {@link CellNormalizer#data(String)} so "1,234" and "2024-01-05" become a number
 * and a date the way they would from delimited text.
 */
public class DecodedWorkbookNormalizer {

    private final CellNormalizer normalizer;

    public DecodedWorkbookNormalizer(CellNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    public RecoveredWorkbook normalize(RecoveredWorkbook workbook) {
        RecoveredWorkbook.Builder builder = RecoveredWorkbook.builder();
        for (RecoveredSheet sheet : workbook.getSheets()) {
            builder.sheet(sheet.getName(), normalize(sheet.getTable()));
        }
        return builder.build();
    }

    private Table normalize(Table table) {
        List<List<CellValue>> rows = new ArrayList<>(table.height());
        for (int r = 0; r < table.height(); r++) {
            TableRow row = table.row(r);
            List<CellValue> cells = new ArrayList<>(row.size());
            for (CellValue cell : row.getCells()) {
                if (cell.getType() != CellValue.Type.STRING) {
                    cells.add(cell);
                } else if (r == 0) {
                    cells.add(CellValue.string(cell.asText().trim()));
                } else {
                    cells.add(normalizer.data(cell.asText()));
                }
            }
            rows.add(cells);
        }
        return Table.of(rows);
    }
}
