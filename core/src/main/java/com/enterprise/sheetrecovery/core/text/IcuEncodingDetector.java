package com.enterprise.sheetrecovery.core.text;

import com.enterprise.sheetrecovery.core.model.DetectionResult;
import com.ibm.icu.text.CharsetDetector;
import com.ibm.icu.text.CharsetMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * {@link EncodingDetector} backed by ICU4J's {@link CharsetDetector}.
 */
public class IcuEncodingDetector implements EncodingDetector {

    private static final Logger log = LoggerFactory.getLogger(IcuEncodingDetector.class);

    @Override
    public Optional<DetectionResult> detect(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            return Optional.empty();
        }
        try {
            CharsetMatch match = new CharsetDetector().setText(bytes).detect();
            if (match == null) {
                return Optional.empty();
            }
            return Optional.of(new DetectionResult(match.getName(), match.getConfidence() / 100.0));
        } catch (RuntimeException e) {
            log.debug("ICU charset detection failed: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
