package com.enterprise.sheetrecovery.core.pipeline;

import com.enterprise.sheetrecovery.core.container.ContainerScanner;
import com.enterprise.sheetrecovery.core.container.ZipSignatures;
import com.enterprise.sheetrecovery.core.mining.StringPoolMiner;
import com.enterprise.sheetrecovery.core.model.Fidelity;
import com.enterprise.sheetrecovery.core.model.RecoveredWorkbook;
import com.enterprise.sheetrecovery.core.model.RecoveryAttemptResult;

import java.util.List;
import java.util.Optional;

/**
 * Lays out the literal text of a damaged container's shared-string part.
 */
public class SharedStringsStage implements RecoveryStage {

    public static final String SHEET_NAME = "SharedStrings";

    private final ContainerScanner scanner;
    private final StringPoolMiner miner;

    public SharedStringsStage(ContainerScanner scanner, StringPoolMiner miner) {
        this.scanner = scanner;
        this.miner = miner;
    }

    @Override
    public Fidelity fidelity() {
        return Fidelity.SHARED_STRINGS;
    }

    @Override
    public RecoveryAttemptResult attempt(RecoveryContext context) {
        byte[] bytes = context.getRequest().getBytes();
        if (!ZipSignatures.startsWithZipSignature(bytes)) {
            return RecoveryAttemptResult.deferred(fidelity(), "no ZIP signature");
        }
        Optional<String> markup = scanner.readEntry(bytes, ContainerScanner.SHARED_STRINGS_ENTRY,
                ContainerScanner.SHARED_STRINGS_PAYLOAD_CAP);
        if (markup.isEmpty()) {
            return RecoveryAttemptResult.deferred(fidelity(), "shared-string part not found or not inflatable");
        }
        List<String> tokens = miner.extract(markup.get());
        if (tokens.isEmpty()) {
            return RecoveryAttemptResult.deferred(fidelity(), "shared-string part holds no text");
        }
        if (!miner.hasMeaningfulContent(tokens)) {
            return RecoveryAttemptResult.deferred(fidelity(), "no meaningful token among " + tokens.size());
        }
        return RecoveryAttemptResult.succeeded(fidelity(), RecoveredWorkbook.single(SHEET_NAME, miner.layout(tokens)));
    }
}
