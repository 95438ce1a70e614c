package com.enterprise.sheetrecovery.core.decode;

import lombok.AllArgsConstructor;
import lombok.Value;

import java.nio.charset.Charset;

/**
 * One way of asking the structured decoder to read a workbook.
 */
@Value
@AllArgsConstructor
public class DecodeOptions {

    public enum ReaderKind {
        /** Sniff the container and pick the matching reader. */
        AUTO,
        /** Office Open XML (.xlsx) only. */
        OOXML,
        /** Legacy BIFF8 (.xls) only. */
        BIFF8
    }

    public enum CellMode {
        /** Native numbers and booleans. */
        TYPED,
        /** The text a spreadsheet application would display. */
        FORMATTED
    }

    ReaderKind reader;
    CellMode cellMode;
    boolean datesAsDates;
    /** Legacy code page used to repair mis-decoded strings; {@code null} for none. */
    Charset codepageHint;

    public DecodeOptions(ReaderKind reader, CellMode cellMode, boolean datesAsDates) {
        this(reader, cellMode, datesAsDates, null);
    }

    public String describe() {
        return reader + "/" + cellMode + "/" + (datesAsDates ? "dates" : "serials")
                + (codepageHint == null ? "" : "/" + codepageHint.name());
    }
}
