package com.enterprise.sheetrecovery.core.pipeline;

import com.enterprise.sheetrecovery.core.model.Fidelity;
import com.enterprise.sheetrecovery.core.model.RecoveredWorkbook;
import lombok.Value;

@Value
public class RecoveryOutcome {
    RecoveredWorkbook workbook;
    Fidelity fidelity;
    InputRoute route;
}
