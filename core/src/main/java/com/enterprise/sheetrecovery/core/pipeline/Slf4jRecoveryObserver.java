package com.enterprise.sheetrecovery.core.pipeline;

import com.enterprise.sheetrecovery.core.decode.DecodeOptions;
import com.enterprise.sheetrecovery.core.model.Fidelity;
import com.enterprise.sheetrecovery.core.model.RecoveredWorkbook;
import com.enterprise.sheetrecovery.core.text.ResolvedText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs every recovery decision: accepted and deferred stages at INFO, thrown stages at WARN, the
 * rest at DEBUG.
 */
public class Slf4jRecoveryObserver implements RecoveryObserver {

    private static final Logger log = LoggerFactory.getLogger(Slf4jRecoveryObserver.class);

    @Override
    public void stageEntered(Fidelity stage) {
        log.debug("Trying {}", stage);
    }

    @Override
    public void stageAccepted(Fidelity stage, RecoveredWorkbook workbook) {
        log.info("Recovered {} sheet(s) {} via {}", workbook.getSheets().size(), workbook.sheetNames(), stage);
    }

    @Override
    public void stageDeferred(Fidelity stage, String reason) {
        log.info("{} deferred: {}", stage, reason);
    }

    @Override
    public void stageFailed(Fidelity stage, RuntimeException error) {
        log.warn("{} failed, continuing with the next stage: {}", stage, error.getMessage(), error);
    }

    @Override
    public void encodingResolved(String charset, ResolvedText.Method method) {
        log.debug("Text decoded as {} ({})", charset, method);
    }

    @Override
    public void delimiterDetected(char delimiter, double confidence) {
        log.debug("Delimiter {} (confidence {})", delimiter == '\t' ? "TAB" : String.valueOf(delimiter),
                String.format("%.2f", confidence));
    }

    @Override
    public void decodeVariantTried(int index, DecodeOptions options, boolean accepted) {
        log.debug("Decode variant {} [{}] {}", index, options.describe(), accepted ? "accepted" : "rejected");
    }
}
