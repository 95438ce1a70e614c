package com.enterprise.sheetrecovery.core.pipeline;

import com.enterprise.sheetrecovery.core.model.Fidelity;
import com.enterprise.sheetrecovery.core.model.RecoveryAttemptResult;

/**
 * One tier of the fallback chain. Returns a workbook, or a deferral naming why the next
 * tier should run.
 */
public interface RecoveryStage {

    Fidelity fidelity();

    RecoveryAttemptResult attempt(RecoveryContext context);
}
