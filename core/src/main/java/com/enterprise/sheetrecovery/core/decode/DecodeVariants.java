package com.enterprise.sheetrecovery.core.decode;

import com.enterprise.sheetrecovery.core.decode.DecodeOptions.CellMode;
import com.enterprise.sheetrecovery.core.decode.DecodeOptions.ReaderKind;
import com.enterprise.sheetrecovery.core.util.TextDecoding;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * The ordered option matrices tried by the structured stage. Container inputs get all of
 * them; text inputs only the first.
 */
public final class DecodeVariants {

    public static final List<DecodeOptions> CONTAINER = List.of(
            new DecodeOptions(ReaderKind.AUTO, CellMode.TYPED, true),
            new DecodeOptions(ReaderKind.AUTO, CellMode.FORMATTED, true),
            new DecodeOptions(ReaderKind.AUTO, CellMode.TYPED, false),
            new DecodeOptions(ReaderKind.AUTO, CellMode.FORMATTED, false),
            new DecodeOptions(ReaderKind.AUTO, CellMode.TYPED, false, TextDecoding.MS949),
            new DecodeOptions(ReaderKind.AUTO, CellMode.FORMATTED, false, TextDecoding.MS949),
            new DecodeOptions(ReaderKind.AUTO, CellMode.TYPED, true, StandardCharsets.UTF_8),
            new DecodeOptions(ReaderKind.BIFF8, CellMode.TYPED, true),
            new DecodeOptions(ReaderKind.OOXML, CellMode.TYPED, true),
            new DecodeOptions(ReaderKind.OOXML, CellMode.FORMATTED, true));

    public static final List<DecodeOptions> TEXT = List.of(CONTAINER.get(0));

    private DecodeVariants() {
    }
}
