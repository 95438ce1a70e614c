package com.enterprise.sheetrecovery.core.pipeline;

import com.enterprise.sheetrecovery.core.mining.ByteScanMiner;
import com.enterprise.sheetrecovery.core.model.Fidelity;
import com.enterprise.sheetrecovery.core.model.RecoveredWorkbook;
import com.enterprise.sheetrecovery.core.model.RecoveryAttemptResult;

import java.util.List;

public class ByteScanStage implements RecoveryStage {

    public static final String SHEET_NAME = "MeaningfulData";

    private final ByteScanMiner miner;

    public ByteScanStage(ByteScanMiner miner) {
        this.miner = miner;
    }

    @Override
    public Fidelity fidelity() {
        return Fidelity.BYTE_SCAN;
    }

    @Override
    public RecoveryAttemptResult attempt(RecoveryContext context) {
        RecoveryRequest request = context.getRequest();
        List<String> tokens = miner.mine(request.getBytes(), request.getFilename());
        if (tokens.isEmpty()) {
            return RecoveryAttemptResult.deferred(fidelity(), "no meaningful token in any encoding");
        }
        return RecoveryAttemptResult.succeeded(fidelity(), RecoveredWorkbook.single(SHEET_NAME, miner.toTable(tokens)));
    }
}
