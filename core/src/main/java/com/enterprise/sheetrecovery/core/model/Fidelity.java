package com.enterprise.sheetrecovery.core.model;

/**
 * How faithfully a result reflects the input, in the order the recovery chain tries them.
 */
public enum Fidelity {
    STRUCTURED,
    SHARED_STRINGS,
    WORKSHEET_CELLS,
    DELIMITED_TEXT,
    BYTE_SCAN,
    DIAGNOSTIC
}
