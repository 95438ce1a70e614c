package com.enterprise.sheetrecovery.core.pipeline;

import com.enterprise.sheetrecovery.core.container.ContainerScanner;
import com.enterprise.sheetrecovery.core.container.ZipSignatures;
import com.enterprise.sheetrecovery.core.mining.CellXmlMiner;
import com.enterprise.sheetrecovery.core.model.Fidelity;
import com.enterprise.sheetrecovery.core.model.RecoveredWorkbook;
import com.enterprise.sheetrecovery.core.model.RecoveryAttemptResult;
import com.enterprise.sheetrecovery.core.model.Table;

import java.util.List;
import java.util.Optional;

/**
 * Recovers cell values from every worksheet part of a damaged container, one sheet each.
 */
public class WorksheetStage implements RecoveryStage {

    private final ContainerScanner scanner;
    private final CellXmlMiner miner;

    public WorksheetStage(ContainerScanner scanner, CellXmlMiner miner) {
        this.scanner = scanner;
        this.miner = miner;
    }

    @Override
    public Fidelity fidelity() {
        return Fidelity.WORKSHEET_CELLS;
    }

    @Override
    public RecoveryAttemptResult attempt(RecoveryContext context) {
        byte[] bytes = context.getRequest().getBytes();
        if (!ZipSignatures.startsWithZipSignature(bytes)) {
            return RecoveryAttemptResult.deferred(fidelity(), "no ZIP signature");
        }
        List<String> entries = scanner.worksheetEntries(bytes);
        if (entries.isEmpty()) {
            return RecoveryAttemptResult.deferred(fidelity(), "no worksheet part found");
        }
        List<String> sharedStrings = scanner
                .readEntry(bytes, ContainerScanner.SHARED_STRINGS_ENTRY, ContainerScanner.SHARED_STRINGS_PAYLOAD_CAP)
                .map(miner::sharedStrings)
                .orElse(List.of());

        RecoveredWorkbook.Builder builder = RecoveredWorkbook.builder();
        for (String entry : entries) {
            Optional<Table> table = scanner.readEntry(bytes, entry, ContainerScanner.WORKSHEET_PAYLOAD_CAP)
                    .flatMap(markup -> miner.mine(markup, sharedStrings));
            table.ifPresent(t -> builder.sheet(sheetName(entry), t));
        }
        if (builder.isEmpty()) {
            return RecoveryAttemptResult.deferred(fidelity(), "no cell values in " + entries.size() + " worksheet part(s)");
        }
        return RecoveryAttemptResult.succeeded(fidelity(), builder.build());
    }

    // xl/worksheets/sheet2.xml -> Sheet2
    private static String sheetName(String entry) {
        String file = entry.substring(entry.lastIndexOf('/') + 1).replace(".xml", "");
        return Character.toUpperCase(file.charAt(0)) + file.substring(1);
    }
}
