package com.enterprise.sheetrecovery.core.decode;

import com.enterprise.sheetrecovery.core.DecodeFailureException;
import com.enterprise.sheetrecovery.core.model.CellValue;
import com.enterprise.sheetrecovery.core.model.RecoveredWorkbook;
import com.enterprise.sheetrecovery.core.model.Table;
import com.enterprise.sheetrecovery.core.util.TextDecoding;
import org.apache.poi.hssf.usermodel.HSSFWorkbook;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.FormulaError;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * {@link StructuredDecoder} on Apache POI. Each sheet's used range spans the rows and columns
 * of cells that hold a value.
 */
public class PoiStructuredDecoder implements StructuredDecoder {

    private static final Logger log = LoggerFactory.getLogger(PoiStructuredDecoder.class);

    private final DataFormatter formatter = new DataFormatter(Locale.US);

    @Override
    public RecoveredWorkbook decode(byte[] bytes, DecodeOptions options) {
        try (Workbook workbook = open(bytes, options.getReader())) {
            if (workbook.getNumberOfSheets() == 0) {
                throw new DecodeFailureException("Workbook has no sheets");
            }
            RecoveredWorkbook.Builder builder = RecoveredWorkbook.builder();
            for (int i = 0; i < workbook.getNumberOfSheets(); i++) {
                Sheet sheet = workbook.getSheetAt(i);
                builder.sheet(repair(sheet.getSheetName(), options.getCodepageHint()), readSheet(sheet, options));
            }
            RecoveredWorkbook result = builder.build();
            log.debug("Decoded {} sheet(s) with {}", result.getSheets().size(), options.describe());
            return result;
        } catch (DecodeFailureException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new DecodeFailureException("Cannot read workbook with " + options.describe() + ": " + e.getMessage(), e);
        }
    }

    private static Workbook open(byte[] bytes, DecodeOptions.ReaderKind reader) throws IOException {
        InputStream in = new ByteArrayInputStream(bytes);
        return switch (reader) {
            case AUTO -> WorkbookFactory.create(in);
            case OOXML -> new XSSFWorkbook(in);
            case BIFF8 -> new HSSFWorkbook(in);
        };
    }

    // ─── Sheet reading ──────────────────────────────────────────────────────

    private Table readSheet(Sheet sheet, DecodeOptions options) {
        // Bounds come from cells holding values; styled blanks do not widen the range
        int firstRow = Integer.MAX_VALUE;
        int lastRow = -1;
        int firstColumn = Integer.MAX_VALUE;
        int lastColumn = -1;
        for (Row row : sheet) {
            for (Cell cell : row) {
                if (cell.getCellType() == CellType.BLANK) {
                    continue;
                }
                firstRow = Math.min(firstRow, row.getRowNum());
                lastRow = Math.max(lastRow, row.getRowNum());
                firstColumn = Math.min(firstColumn, cell.getColumnIndex());
                lastColumn = Math.max(lastColumn, cell.getColumnIndex());
            }
        }
        if (lastRow < 0) {
            return Table.of(List.of());
        }

        List<List<CellValue>> rows = new ArrayList<>(lastRow - firstRow + 1);
        for (int r = firstRow; r <= lastRow; r++) {
            Row row = sheet.getRow(r);
            List<CellValue> cells = new ArrayList<>(lastColumn - firstColumn + 1);
            for (int c = firstColumn; c <= lastColumn; c++) {
                Cell cell = row == null ? null : row.getCell(c, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL);
                cells.add(cell == null ? CellValue.empty() : readCell(cell, options));
            }
            rows.add(cells);
        }
        return Table.of(rows);
    }

    private CellValue readCell(Cell cell, DecodeOptions options) {
        CellType type = cell.getCellType() == CellType.FORMULA
                ? cell.getCachedFormulaResultType()
                : cell.getCellType();
        boolean formatted = options.getCellMode() == DecodeOptions.CellMode.FORMATTED;

        return switch (type) {
            case STRING -> CellValue.string(repair(cell.getStringCellValue(), options.getCodepageHint()));
            case NUMERIC -> {
                if (options.isDatesAsDates() && isDateFormatted(cell)) {
                    yield CellValue.dateTime(cell.getLocalDateTimeCellValue());
                }
                if (formatted) {
                    CellStyle style = cell.getCellStyle();
                    yield CellValue.string(formatter.formatRawCellContents(
                            cell.getNumericCellValue(), style.getDataFormat(), style.getDataFormatString()));
                }
                yield CellValue.number(cell.getNumericCellValue());
            }
            case BOOLEAN -> formatted
                    ? CellValue.string(cell.getBooleanCellValue() ? "TRUE" : "FALSE")
                    : CellValue.bool(cell.getBooleanCellValue());
            case ERROR -> CellValue.string(errorText(cell.getErrorCellValue()));
            default -> CellValue.empty();
        };
    }

    private static boolean isDateFormatted(Cell cell) {
        try {
            return DateUtil.isCellDateFormatted(cell);
        } catch (RuntimeException e) {
            log.debug("Unreadable number format on {}: {}", cell.getAddress(), e.getMessage());
            return false;
        }
    }

    private static String errorText(byte code) {
        try {
            return FormulaError.forInt(code).getString();
        } catch (IllegalArgumentException e) {
            return "#ERROR";
        }
    }

    // ─── Code page repair ───────────────────────────────────────────────────

    /**
     * Legacy workbooks without a code page record come back as Latin-1 mojibake; when every
     * char fits in one byte and some are high, re-decode those bytes with the hinted code page.
     */
    static String repair(String value, Charset hint) {
        if (hint == null || value == null) {
            return value;
        }
        boolean high = false;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c > 0xFF) {
                return value;
            }
            if (c >= 0x80) {
                high = true;
            }
        }
        if (!high) {
            return value;
        }
        return TextDecoding.strict(value.getBytes(StandardCharsets.ISO_8859_1), hint).orElse(value);
    }
}
