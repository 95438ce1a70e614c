package com.enterprise.sheetrecovery.core.pipeline;

import com.enterprise.sheetrecovery.core.decode.DecodeOptions;
import com.enterprise.sheetrecovery.core.model.Fidelity;
import com.enterprise.sheetrecovery.core.model.RecoveredWorkbook;
import com.enterprise.sheetrecovery.core.text.ResolvedText;

/**
 * Receives the decisions a recovery run makes. All callbacks default to no-ops.
 */
public interface RecoveryObserver {

    RecoveryObserver NONE = new RecoveryObserver() {
    };

    default void stageEntered(Fidelity stage) {
    }

    default void stageAccepted(Fidelity stage, RecoveredWorkbook workbook) {
    }

    default void stageDeferred(Fidelity stage, String reason) {
    }

    /** A stage threw instead of deferring; the run continues with the next stage. */
    default void stageFailed(Fidelity stage, RuntimeException error) {
    }

    default void encodingResolved(String charset, ResolvedText.Method method) {
    }

    default void delimiterDetected(char delimiter, double confidence) {
    }

    default void decodeVariantTried(int index, DecodeOptions options, boolean accepted) {
    }
}
