package com.enterprise.sheetrecovery.core.text;

import com.enterprise.sheetrecovery.core.model.DetectionResult;

import java.util.Optional;

/**
 * Statistical charset guesser. The label is a charset name, the confidence lies in [0, 1].
 */
public interface EncodingDetector {

    Optional<DetectionResult> detect(byte[] bytes);
}
