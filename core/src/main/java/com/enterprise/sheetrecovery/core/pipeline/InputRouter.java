package com.enterprise.sheetrecovery.core.pipeline;

import com.enterprise.sheetrecovery.core.container.ZipSignatures;
import com.enterprise.sheetrecovery.core.util.FileNames;

import java.util.Set;

/**
 * Routes by extension first, then by the ZIP signature, so a renamed workbook still gets the
 * container treatment.
 */
public class InputRouter {

    private static final Set<String> SPREADSHEET_EXTENSIONS = Set.of("xlsx", "xls");

    public InputRoute route(RecoveryRequest request) {
        if (SPREADSHEET_EXTENSIONS.contains(FileNames.extension(request.getFilename()))
                || ZipSignatures.startsWithZipSignature(request.getBytes())) {
            return InputRoute.CONTAINER;
        }
        return InputRoute.TEXT;
    }
}
