package com.enterprise.sheetrecovery.core.pipeline;

import com.enterprise.sheetrecovery.core.DecodeFailureException;
import com.enterprise.sheetrecovery.core.decode.DecodeOptions;
import com.enterprise.sheetrecovery.core.decode.DecodeVariants;
import com.enterprise.sheetrecovery.core.decode.DecodedWorkbookNormalizer;
import com.enterprise.sheetrecovery.core.decode.StructuredDecoder;
import com.enterprise.sheetrecovery.core.model.Fidelity;
import com.enterprise.sheetrecovery.core.model.RecoveredWorkbook;
import com.enterprise.sheetrecovery.core.model.RecoveryAttemptResult;
import com.enterprise.sheetrecovery.core.model.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Runs the structured decoder over the route's option matrix and keeps the first variant
 * whose first sheet starts with a non-empty row.
 */
public class StructuredDecodeStage implements RecoveryStage {

    private static final Logger log = LoggerFactory.getLogger(StructuredDecodeStage.class);

    private final StructuredDecoder decoder;
    private final DecodedWorkbookNormalizer normalizer;

    public StructuredDecodeStage(StructuredDecoder decoder, DecodedWorkbookNormalizer normalizer) {
        this.decoder = decoder;
        this.normalizer = normalizer;
    }

    @Override
    public Fidelity fidelity() {
        return Fidelity.STRUCTURED;
    }

    @Override
    public RecoveryAttemptResult attempt(RecoveryContext context) {
        List<DecodeOptions> variants = context.getRoute() == InputRoute.CONTAINER
                ? DecodeVariants.CONTAINER
                : DecodeVariants.TEXT;
        byte[] bytes = context.getRequest().getBytes();

        for (int i = 0; i < variants.size(); i++) {
            DecodeOptions options = variants.get(i);
            try {
                RecoveredWorkbook workbook = decoder.decode(bytes, options);
                boolean accepted = firstRowHasContent(workbook);
                context.getObserver().decodeVariantTried(i, options, accepted);
                if (accepted) {
                    return RecoveryAttemptResult.succeeded(fidelity(), normalizer.normalize(workbook));
                }
            } catch (DecodeFailureException e) {
                log.debug("Variant {} rejected: {}", i, e.getMessage());
                context.getObserver().decodeVariantTried(i, options, false);
            }
        }
        return RecoveryAttemptResult.deferred(fidelity(),
                "none of " + variants.size() + " decode variant(s) produced a non-empty first row");
    }

    private static boolean firstRowHasContent(RecoveredWorkbook workbook) {
        if (workbook.getSheets().isEmpty()) {
            return false;
        }
        Table table = workbook.firstSheet().getTable();
        return !table.isEmpty() && !table.header().isBlank();
    }
}
