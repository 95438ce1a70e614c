package com.enterprise.sheetrecovery.core;

/**
 * A stage produced zero rows, or a header with no content.
 */
public class EmptyResultException extends RecoveryException {

    public EmptyResultException(String message) {
        super(message);
    }
}
