package com.enterprise.sheetrecovery.core.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of one recovery stage: either a workbook, or the reason the next stage should run.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RecoveryAttemptResult {

    boolean success;
    Fidelity fidelity;
    RecoveredWorkbook workbook;
    String reason;

    public static RecoveryAttemptResult succeeded(Fidelity fidelity, RecoveredWorkbook workbook) {
        return new RecoveryAttemptResult(true, fidelity, workbook, null);
    }

    public static RecoveryAttemptResult deferred(Fidelity fidelity, String reason) {
        return new RecoveryAttemptResult(false, fidelity, null, reason);
    }
}
