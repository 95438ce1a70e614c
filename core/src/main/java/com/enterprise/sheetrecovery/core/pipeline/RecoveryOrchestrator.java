package com.enterprise.sheetrecovery.core.pipeline;

import com.enterprise.sheetrecovery.core.EmptyResultException;
import com.enterprise.sheetrecovery.core.container.ContainerScanner;
import com.enterprise.sheetrecovery.core.container.PayloadInflater;
import com.enterprise.sheetrecovery.core.decode.DecodedWorkbookNormalizer;
import com.enterprise.sheetrecovery.core.decode.StructuredDecoder;
import com.enterprise.sheetrecovery.core.mining.ByteScanMiner;
import com.enterprise.sheetrecovery.core.mining.CellXmlMiner;
import com.enterprise.sheetrecovery.core.mining.StringPoolMiner;
import com.enterprise.sheetrecovery.core.mining.TokenClassifier;
import com.enterprise.sheetrecovery.core.model.RecoveryAttemptResult;
import com.enterprise.sheetrecovery.core.text.CellNormalizer;
import com.enterprise.sheetrecovery.core.text.DelimiterDetector;
import com.enterprise.sheetrecovery.core.text.EncodingDetector;
import com.enterprise.sheetrecovery.core.text.EncodingResolver;
import com.enterprise.sheetrecovery.core.text.LineTokenizer;
import com.enterprise.sheetrecovery.core.text.TextTableBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Drives the fallback chain, from the most to the least faithful tier:
 *
 * 1. structured decode
 * 2. shared-string part of a damaged container
 * 3. worksheet parts of a damaged container
 * 4. delimited text
 * 5. byte-level token mining
 * 6. diagnostic report
 *
 * The first tier that succeeds wins; a tier that throws is reported and skipped. A forced
 * request runs delimited-text recovery alone and fails with {@link EmptyResultException}
 * when the input has no text lines.
 *
 * Holds no per-run state, so one instance serves concurrent requests.
 */
public class RecoveryOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(RecoveryOrchestrator.class);

    private final List<RecoveryStage> stages;
    private final RecoveryStage forcedStage;
    private final DiagnosticStage diagnostic;
    private final InputRouter router;
    private final RecoveryObserver observer;

    public RecoveryOrchestrator(List<RecoveryStage> stages, RecoveryStage forcedStage,
                                InputRouter router, RecoveryObserver observer) {
        this.stages = List.copyOf(stages);
        this.forcedStage = forcedStage;
        this.diagnostic = new DiagnosticStage();
        this.router = router;
        this.observer = observer;
    }

    /**
     * The standard six-tier chain around the given collaborators.
     */
    public static RecoveryOrchestrator standard(StructuredDecoder decoder, EncodingDetector encodingDetector,
                                                RecoveryObserver observer) {
        CellNormalizer normalizer = new CellNormalizer();
        ContainerScanner scanner = new ContainerScanner(new PayloadInflater());
        DelimitedTextStage delimitedText = new DelimitedTextStage(
                new EncodingResolver(encodingDetector),
                new DelimiterDetector(),
                new TextTableBuilder(new LineTokenizer(), normalizer));

        List<RecoveryStage> stages = List.of(
                new StructuredDecodeStage(decoder, new DecodedWorkbookNormalizer(normalizer)),
                new SharedStringsStage(scanner, new StringPoolMiner(normalizer)),
                new WorksheetStage(scanner, new CellXmlMiner(normalizer)),
                delimitedText,
                new ByteScanStage(new ByteScanMiner(normalizer, new TokenClassifier())),
                new DiagnosticStage());
        return new RecoveryOrchestrator(stages, delimitedText, new InputRouter(), observer);
    }

    public RecoveryOutcome recover(RecoveryRequest request) {
        return recover(request, RecoveryObserver.NONE);
    }

    /**
     * Runs the chain, reporting decisions to {@code runObserver} as well as the configured observer.
     *
     * @throws EmptyResultException only for a forced request without text lines
     */
    public RecoveryOutcome recover(RecoveryRequest request, RecoveryObserver runObserver) {
        RecoveryObserver events = new CompositeRecoveryObserver(observer, runObserver);
        InputRoute route = router.route(request);
        RecoveryContext context = new RecoveryContext(request, route, events);
        log.debug("Recovering '{}' ({} bytes) on the {} route{}", request.getFilename(), request.getBytes().length,
                route, request.isForceTextRecovery() ? ", text forced" : "");

        if (request.isForceTextRecovery()) {
            return runForced(context);
        }

        for (RecoveryStage stage : stages) {
            events.stageEntered(stage.fidelity());
            RecoveryAttemptResult result;
            try {
                result = stage.attempt(context);
            } catch (RuntimeException e) {
                events.stageFailed(stage.fidelity(), e);
                continue;
            }
            if (result.isSuccess()) {
                events.stageAccepted(stage.fidelity(), result.getWorkbook());
                return new RecoveryOutcome(result.getWorkbook(), stage.fidelity(), route);
            }
            events.stageDeferred(stage.fidelity(), result.getReason());
        }

        // only reachable with a custom chain that lacks a terminal tier
        events.stageEntered(diagnostic.fidelity());
        RecoveryAttemptResult report = diagnostic.attempt(context);
        events.stageAccepted(diagnostic.fidelity(), report.getWorkbook());
        return new RecoveryOutcome(report.getWorkbook(), diagnostic.fidelity(), route);
    }

    private RecoveryOutcome runForced(RecoveryContext context) {
        RecoveryObserver events = context.getObserver();
        events.stageEntered(forcedStage.fidelity());
        RecoveryAttemptResult result;
        try {
            result = forcedStage.attempt(context);
        } catch (RuntimeException e) {
            events.stageFailed(forcedStage.fidelity(), e);
            throw e;
        }
        if (!result.isSuccess()) {
            events.stageDeferred(forcedStage.fidelity(), result.getReason());
            throw new EmptyResultException("Forced text recovery produced no rows: " + result.getReason());
        }
        events.stageAccepted(forcedStage.fidelity(), result.getWorkbook());
        return new RecoveryOutcome(result.getWorkbook(), forcedStage.fidelity(), context.getRoute());
    }
}
