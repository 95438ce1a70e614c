package com.enterprise.sheetrecovery.core.text;

import lombok.Value;

/**
 * Decoded text plus the charset that produced it and the resolution step that chose it.
 */
@Value
public class ResolvedText {

    public enum Method {
        UTF8, DETECTED, CANDIDATE, FALLBACK
    }

    String text;
    String charset;
    Method method;
}
