package com.enterprise.sheetrecovery.core.pipeline;

public enum InputRoute {
    /** Spreadsheet container: the full decode matrix and container scans apply. */
    CONTAINER,
    /** Anything else: a single default decode, then text recovery. */
    TEXT
}
