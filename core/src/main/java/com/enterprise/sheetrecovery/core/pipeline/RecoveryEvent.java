package com.enterprise.sheetrecovery.core.pipeline;

import com.enterprise.sheetrecovery.core.model.Fidelity;
import lombok.Value;

@Value
public class RecoveryEvent {

    public enum Kind {
        STAGE_ENTERED, STAGE_ACCEPTED, STAGE_DEFERRED, STAGE_FAILED,
        ENCODING_RESOLVED, DELIMITER_DETECTED, DECODE_VARIANT_TRIED
    }

    Kind kind;
    /** Stage that emitted the event. */
    Fidelity stage;
    String detail;
}
