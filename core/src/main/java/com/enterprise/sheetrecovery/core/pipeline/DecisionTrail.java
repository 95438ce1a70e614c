package com.enterprise.sheetrecovery.core.pipeline;

import com.enterprise.sheetrecovery.core.decode.DecodeOptions;
import com.enterprise.sheetrecovery.core.model.Fidelity;
import com.enterprise.sheetrecovery.core.model.RecoveredWorkbook;
import com.enterprise.sheetrecovery.core.text.ResolvedText;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Records the decisions of one recovery run, in order. Not thread-safe; use one per run.
 */
public class DecisionTrail implements RecoveryObserver {

    private final List<RecoveryEvent> events = new ArrayList<>();

    public List<RecoveryEvent> events() {
        return Collections.unmodifiableList(events);
    }

    public List<Fidelity> stagesEntered() {
        return events.stream()
                .filter(e -> e.getKind() == RecoveryEvent.Kind.STAGE_ENTERED)
                .map(RecoveryEvent::getStage)
                .collect(Collectors.toList());
    }

    public List<RecoveryEvent> ofKind(RecoveryEvent.Kind kind) {
        return events.stream().filter(e -> e.getKind() == kind).collect(Collectors.toList());
    }

    @Override
    public void stageEntered(Fidelity stage) {
        events.add(new RecoveryEvent(RecoveryEvent.Kind.STAGE_ENTERED, stage, ""));
    }

    @Override
    public void stageAccepted(Fidelity stage, RecoveredWorkbook workbook) {
        events.add(new RecoveryEvent(RecoveryEvent.Kind.STAGE_ACCEPTED, stage, String.join(",", workbook.sheetNames())));
    }

    @Override
    public void stageDeferred(Fidelity stage, String reason) {
        events.add(new RecoveryEvent(RecoveryEvent.Kind.STAGE_DEFERRED, stage, reason));
    }

    @Override
    public void stageFailed(Fidelity stage, RuntimeException error) {
        events.add(new RecoveryEvent(RecoveryEvent.Kind.STAGE_FAILED, stage, String.valueOf(error.getMessage())));
    }

    @Override
    public void encodingResolved(String charset, ResolvedText.Method method) {
        events.add(new RecoveryEvent(RecoveryEvent.Kind.ENCODING_RESOLVED, Fidelity.DELIMITED_TEXT, charset + " " + method));
    }

    @Override
    public void delimiterDetected(char delimiter, double confidence) {
        events.add(new RecoveryEvent(RecoveryEvent.Kind.DELIMITER_DETECTED, Fidelity.DELIMITED_TEXT, String.valueOf(delimiter)));
    }

    @Override
    public void decodeVariantTried(int index, DecodeOptions options, boolean accepted) {
        events.add(new RecoveryEvent(RecoveryEvent.Kind.DECODE_VARIANT_TRIED, Fidelity.STRUCTURED,
                index + " " + options.describe() + " " + (accepted ? "accepted" : "rejected")));
    }
}
