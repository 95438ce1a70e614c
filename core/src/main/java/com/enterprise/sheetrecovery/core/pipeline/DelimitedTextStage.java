package com.enterprise.sheetrecovery.core.pipeline;

import com.enterprise.sheetrecovery.core.EmptyResultException;
import com.enterprise.sheetrecovery.core.model.DetectionResult;
import com.enterprise.sheetrecovery.core.model.Fidelity;
import com.enterprise.sheetrecovery.core.model.RecoveredWorkbook;
import com.enterprise.sheetrecovery.core.model.RecoveryAttemptResult;
import com.enterprise.sheetrecovery.core.model.Table;
import com.enterprise.sheetrecovery.core.text.DelimiterDetector;
import com.enterprise.sheetrecovery.core.text.EncodingResolver;
import com.enterprise.sheetrecovery.core.text.ResolvedText;
import com.enterprise.sheetrecovery.core.text.TextTableBuilder;
import com.enterprise.sheetrecovery.core.util.TextDecoding;

/**
 * Decodes the input as text, infers the delimiter and tokenizes it into a single sheet.
 *
 * In the regular chain, text that is mostly control characters is treated as binary and
 * deferred. A forced run skips that check and lets an empty result escape to the caller.
 */
public class DelimitedTextStage implements RecoveryStage {

    public static final String SHEET_NAME = "Sheet1";

    /** Share of control characters above which decoded text is considered binary. */
    public static final double BINARY_CONTROL_RATIO = 0.05;

    private final EncodingResolver encodingResolver;
    private final DelimiterDetector delimiterDetector;
    private final TextTableBuilder tableBuilder;

    public DelimitedTextStage(EncodingResolver encodingResolver, DelimiterDetector delimiterDetector,
                              TextTableBuilder tableBuilder) {
        this.encodingResolver = encodingResolver;
        this.delimiterDetector = delimiterDetector;
        this.tableBuilder = tableBuilder;
    }

    @Override
    public Fidelity fidelity() {
        return Fidelity.DELIMITED_TEXT;
    }

    @Override
    public RecoveryAttemptResult attempt(RecoveryContext context) {
        boolean forced = context.getRequest().isForceTextRecovery();
        ResolvedText resolved = encodingResolver.resolve(context.getRequest().getBytes());
        context.getObserver().encodingResolved(resolved.getCharset(), resolved.getMethod());

        String text = resolved.getText();
        double controlRatio = TextDecoding.controlCharacterRatio(text);
        if (!forced && controlRatio > BINARY_CONTROL_RATIO) {
            return RecoveryAttemptResult.deferred(fidelity(),
                    String.format("looks binary (%.0f%% control characters)", controlRatio * 100));
        }

        DetectionResult delimiter = delimiterDetector.detect(text);
        char separator = delimiter.getLabel().charAt(0);
        context.getObserver().delimiterDetected(separator, delimiter.getConfidence());

        try {
            Table table = tableBuilder.build(text, separator);
            return RecoveryAttemptResult.succeeded(fidelity(), RecoveredWorkbook.single(SHEET_NAME, table));
        } catch (EmptyResultException e) {
            if (forced) {
                throw e;
            }
            return RecoveryAttemptResult.deferred(fidelity(), e.getMessage());
        }
    }
}
