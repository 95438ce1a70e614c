package com.enterprise.sheetrecovery.core;

/**
 * Base of the recovery error taxonomy. Stages recover from these locally by deferring to
 * the next stage; only forced delimited-text recovery lets one reach the caller.
 */
public class RecoveryException extends RuntimeException {

    public RecoveryException(String message) {
        super(message);
    }

    public RecoveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
