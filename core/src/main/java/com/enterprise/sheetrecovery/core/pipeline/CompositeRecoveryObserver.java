package com.enterprise.sheetrecovery.core.pipeline;

import com.enterprise.sheetrecovery.core.decode.DecodeOptions;
import com.enterprise.sheetrecovery.core.model.Fidelity;
import com.enterprise.sheetrecovery.core.model.RecoveredWorkbook;
import com.enterprise.sheetrecovery.core.text.ResolvedText;

import java.util.List;

class CompositeRecoveryObserver implements RecoveryObserver {

    private final List<RecoveryObserver> delegates;

    CompositeRecoveryObserver(RecoveryObserver... delegates) {
        this.delegates = List.of(delegates);
    }

    @Override
    public void stageEntered(Fidelity stage) {
        delegates.forEach(o -> o.stageEntered(stage));
    }

    @Override
    public void stageAccepted(Fidelity stage, RecoveredWorkbook workbook) {
        delegates.forEach(o -> o.stageAccepted(stage, workbook));
    }

    @Override
    public void stageDeferred(Fidelity stage, String reason) {
        delegates.forEach(o -> o.stageDeferred(stage, reason));
    }

    @Override
    public void stageFailed(Fidelity stage, RuntimeException error) {
        delegates.forEach(o -> o.stageFailed(stage, error));
    }

    @Override
    public void encodingResolved(String charset, ResolvedText.Method method) {
        delegates.forEach(o -> o.encodingResolved(charset, method));
    }

    @Override
    public void delimiterDetected(char delimiter, double confidence) {
        delegates.forEach(o -> o.delimiterDetected(delimiter, confidence));
    }

    @Override
    public void decodeVariantTried(int index, DecodeOptions options, boolean accepted) {
        delegates.forEach(o -> o.decodeVariantTried(index, options, accepted));
    }
}
