package com.enterprise.sheetrecovery.core.write;

import com.enterprise.sheetrecovery.core.model.CellValue;
import com.enterprise.sheetrecovery.core.model.RecoveredSheet;
import com.enterprise.sheetrecovery.core.model.RecoveredWorkbook;
import com.enterprise.sheetrecovery.core.model.Table;
import com.enterprise.sheetrecovery.core.model.TableRow;
import org.apache.poi.ss.SpreadsheetVersion;
import org.apache.poi.ss.usermodel.BorderStyle;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.HorizontalAlignment;
import org.apache.poi.ss.usermodel.IndexedColors;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.xssf.usermodel.XSSFCellStyle;
import org.apache.poi.xssf.usermodel.XSSFColor;
import org.apache.poi.xssf.usermodel.XSSFFont;
import org.apache.poi.xssf.usermodel.XSSFSheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * Writes recovered sheets as styled .xlsx.
 * Row 0 of each sheet gets the header style (bold white on navy); the remaining rows are
 * thin-bordered data cells. Numbers, booleans and dates keep their cell types.
 * Text longer than a cell can hold is cut at the format's limit and rows past the last
 * addressable row are dropped, each with a warning.
 */
public class PoiWorkbookWriter implements WorkbookWriter {

    private static final Logger log = LoggerFactory.getLogger(PoiWorkbookWriter.class);

    static final String DATE_FORMAT = "yyyy-mm-dd";
    static final String DATE_TIME_FORMAT = "yyyy-mm-dd hh:mm:ss";

    private static final int MIN_COLUMN_CHARS = 8;
    private static final int MAX_COLUMN_CHARS = 60;

    static final int MAX_TEXT_LENGTH = SpreadsheetVersion.EXCEL2007.getMaxTextLength();
    static final int MAX_ROWS = SpreadsheetVersion.EXCEL2007.getMaxRows();

    private final int maxRows;

    public PoiWorkbookWriter() {
        this(MAX_ROWS);
    }

    PoiWorkbookWriter(int maxRows) {
        this.maxRows = Math.min(maxRows, MAX_ROWS);
    }

    @Override
    public byte[] write(RecoveredWorkbook recovered) throws IOException {
        try (XSSFWorkbook workbook = new XSSFWorkbook()) {
            Styles styles = new Styles(workbook);
            for (RecoveredSheet sheet : recovered.getSheets()) {
                writeSheet(workbook, sheet, styles);
            }
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            workbook.write(out);
            log.info("Generated Excel workbook with {} sheet(s) {}", recovered.getSheets().size(), recovered.sheetNames());
            return out.toByteArray();
        }
    }

    // ─── Sheets ────────────────────────────────────────────────────────────

    private void writeSheet(XSSFWorkbook workbook, RecoveredSheet recovered, Styles styles) {
        XSSFSheet sheet = workbook.createSheet(recovered.getName());
        Table table = recovered.getTable();
        int[] widths = new int[table.getWidth()];
        int rows = Math.min(table.height(), maxRows);
        int truncatedCells = 0;

        for (int r = 0; r < rows; r++) {
            TableRow source = table.row(r);
            Row row = sheet.createRow(r);
            for (int c = 0; c < source.size(); c++) {
                CellValue value = source.get(c);
                if (writeCell(row.createCell(c), value, r == 0, styles)) {
                    truncatedCells++;
                }
                widths[c] = Math.max(widths[c], value.asText().length());
            }
        }

        if (rows < table.height()) {
            log.warn("Sheet '{}': kept {} of {} row(s), the rest exceed the sheet's row limit",
                    recovered.getName(), rows, table.height());
        }
        if (truncatedCells > 0) {
            log.warn("Sheet '{}': cut {} cell(s) to {} characters", recovered.getName(), truncatedCells,
                    MAX_TEXT_LENGTH);
        }

        // autoSizeColumn needs AWT font metrics, which headless hosts often lack
        for (int c = 0; c < widths.length; c++) {
            int chars = Math.max(MIN_COLUMN_CHARS, Math.min(MAX_COLUMN_CHARS, widths[c] + 2));
            sheet.setColumnWidth(c, chars * 256);
        }
        log.debug("Sheet '{}': {} row(s) x {} column(s)", recovered.getName(), table.height(), table.getWidth());
    }

    /**
     * @return true when the text had to be cut to fit the cell
     */
    private static boolean writeCell(Cell cell, CellValue value, boolean header, Styles styles) {
        boolean truncated = false;
        switch (value.getType()) {
            case NUMBER -> {
                cell.setCellValue(value.asNumber());
                cell.setCellStyle(header ? styles.header : styles.data);
            }
            case BOOLEAN -> {
                cell.setCellValue(value.asBoolean());
                cell.setCellStyle(header ? styles.header : styles.data);
            }
            case DATE -> {
                LocalDateTime date = value.asDate();
                cell.setCellValue(date);
                cell.setCellStyle(date.toLocalTime().equals(LocalTime.MIDNIGHT) ? styles.date : styles.dateTime);
            }
            case STRING -> {
                String text = value.asText();
                truncated = text.length() > MAX_TEXT_LENGTH;
                cell.setCellValue(truncated ? text.substring(0, MAX_TEXT_LENGTH) : text);
                cell.setCellStyle(header ? styles.header : styles.data);
            }
            default -> cell.setCellStyle(header ? styles.header : styles.data);
        }
        return truncated;
    }

    // ─── Styles ────────────────────────────────────────────────────────────

    private static final class Styles {
        final CellStyle header;
        final CellStyle data;
        final CellStyle date;
        final CellStyle dateTime;

        Styles(XSSFWorkbook workbook) {
            header = createHeaderStyle(workbook);
            data = createDataStyle(workbook);
            date = createDateStyle(workbook, DATE_FORMAT);
            dateTime = createDateStyle(workbook, DATE_TIME_FORMAT);
        }
    }

    private static CellStyle createHeaderStyle(XSSFWorkbook wb) {
        XSSFCellStyle style = wb.createCellStyle();
        XSSFFont font = wb.createFont();
        font.setBold(true);
        font.setColor(IndexedColors.WHITE.getIndex());
        style.setFont(font);
        style.setFillForegroundColor(new XSSFColor(new byte[] { (byte) 0x1e, (byte) 0x3a, (byte) 0x5f }, null));
        style.setFillPattern(FillPatternType.SOLID_FOREGROUND);
        style.setBorderBottom(BorderStyle.THIN);
        style.setBorderTop(BorderStyle.THIN);
        style.setBorderLeft(BorderStyle.THIN);
        style.setBorderRight(BorderStyle.THIN);
        style.setAlignment(HorizontalAlignment.LEFT);
        return style;
    }

    private static XSSFCellStyle createDataStyle(XSSFWorkbook wb) {
        XSSFCellStyle style = wb.createCellStyle();
        style.setBorderBottom(BorderStyle.THIN);
        style.setBorderTop(BorderStyle.THIN);
        style.setBorderLeft(BorderStyle.THIN);
        style.setBorderRight(BorderStyle.THIN);
        style.setBottomBorderColor(IndexedColors.GREY_25_PERCENT.getIndex());
        style.setTopBorderColor(IndexedColors.GREY_25_PERCENT.getIndex());
        style.setLeftBorderColor(IndexedColors.GREY_25_PERCENT.getIndex());
        style.setRightBorderColor(IndexedColors.GREY_25_PERCENT.getIndex());
        return style;
    }

    private static CellStyle createDateStyle(XSSFWorkbook wb, String format) {
        XSSFCellStyle style = createDataStyle(wb);
        style.setDataFormat(wb.getCreationHelper().createDataFormat().getFormat(format));
        return style;
    }
}
