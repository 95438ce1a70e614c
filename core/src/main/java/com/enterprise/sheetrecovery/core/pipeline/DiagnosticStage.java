package com.enterprise.sheetrecovery.core.pipeline;

import com.enterprise.sheetrecovery.core.model.CellValue;
import com.enterprise.sheetrecovery.core.model.Fidelity;
import com.enterprise.sheetrecovery.core.model.RecoveredWorkbook;
import com.enterprise.sheetrecovery.core.model.RecoveryAttemptResult;
import com.enterprise.sheetrecovery.core.model.Table;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Terminal tier: a one-row report saying nothing could be recovered. Never defers.
 */
public class DiagnosticStage implements RecoveryStage {

    public static final String SHEET_NAME = "FileStatus";
    public static final List<String> HEADER = List.of("파일명", "상태", "크기", "비고");
    public static final String STATUS = "복구 실패";
    public static final String NOTE = "의미있는 텍스트를 찾을 수 없습니다";

    @Override
    public Fidelity fidelity() {
        return Fidelity.DIAGNOSTIC;
    }

    @Override
    public RecoveryAttemptResult attempt(RecoveryContext context) {
        return RecoveryAttemptResult.succeeded(fidelity(), report(context.getRequest()));
    }

    RecoveredWorkbook report(RecoveryRequest request) {
        Table table = Table.of(List.of(
                HEADER.stream().map(CellValue::string).collect(Collectors.toList()),
                List.of(CellValue.string(request.getFilename()),
                        CellValue.string(STATUS),
                        CellValue.string(request.getBytes().length + " bytes"),
                        CellValue.string(NOTE))));
        return RecoveredWorkbook.single(SHEET_NAME, table);
    }
}
