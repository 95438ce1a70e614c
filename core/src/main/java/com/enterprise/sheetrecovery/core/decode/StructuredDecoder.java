package com.enterprise.sheetrecovery.core.decode;

import com.enterprise.sheetrecovery.core.DecodeFailureException;
import com.enterprise.sheetrecovery.core.model.RecoveredWorkbook;

/**
 * Full-fidelity spreadsheet reader.
 */
public interface StructuredDecoder {

    /**
     * @throws DecodeFailureException when the bytes cannot be read with these options or
     *                                contain no sheets
     */
    RecoveredWorkbook decode(byte[] bytes, DecodeOptions options);
}
