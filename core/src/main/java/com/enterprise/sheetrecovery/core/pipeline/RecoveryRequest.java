package com.enterprise.sheetrecovery.core.pipeline;

import lombok.Builder;
import lombok.Value;

/**
 * One conversion: the raw bytes, the name the file arrived with and whether to skip straight
 * to delimited-text recovery.
 */
@Value
@Builder(toBuilder = true)
public class RecoveryRequest {

    private static final byte[] NO_BYTES = new byte[0];

    byte[] bytes;
    String filename;
    boolean forceTextRecovery;

    public byte[] getBytes() {
        return bytes == null ? NO_BYTES : bytes;
    }

    public String getFilename() {
        return filename == null ? "" : filename;
    }
}
