package com.enterprise.sheetrecovery.core.write;

import com.enterprise.sheetrecovery.core.model.RecoveredWorkbook;

import java.io.IOException;

/**
 * Serializes a recovered workbook to .xlsx bytes.
 */
public interface WorkbookWriter {

    byte[] write(RecoveredWorkbook workbook) throws IOException;
}
