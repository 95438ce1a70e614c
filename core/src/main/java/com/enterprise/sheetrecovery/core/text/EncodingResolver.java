package com.enterprise.sheetrecovery.core.text;

import com.enterprise.sheetrecovery.core.model.DetectionResult;
import com.enterprise.sheetrecovery.core.util.TextDecoding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Turns bytes into text. Never fails: the last step is a byte-preserving ISO-8859-1 decode.
 *
 * Order:
 * 1. strict UTF-8 (leading BOM dropped)
 * 2. the statistical detector's charset when its confidence clears the acceptance threshold
 * 3. the first clean strict decode among EUC-KR, MS949, UTF-8, ISO-8859-1
 * 4. ISO-8859-1
 */
public class EncodingResolver {

    private static final Logger log = LoggerFactory.getLogger(EncodingResolver.class);

    private static final List<Charset> CANDIDATES = List.of(
            TextDecoding.EUC_KR,
            TextDecoding.MS949,
            StandardCharsets.UTF_8,
            StandardCharsets.ISO_8859_1);

    private final EncodingDetector detector;

    public EncodingResolver(EncodingDetector detector) {
        this.detector = detector;
    }

    public ResolvedText resolve(byte[] bytes) {
        Optional<String> utf8 = TextDecoding.strict(TextDecoding.stripUtf8Bom(bytes), StandardCharsets.UTF_8);
        if (utf8.isPresent()) {
            return new ResolvedText(utf8.get(), StandardCharsets.UTF_8.name(), ResolvedText.Method.UTF8);
        }

        Optional<ResolvedText> detected = fromDetector(bytes);
        if (detected.isPresent()) {
            return detected.get();
        }

        for (Charset charset : CANDIDATES) {
            Optional<String> decoded = TextDecoding.strict(bytes, charset);
            if (decoded.isPresent()) {
                return new ResolvedText(decoded.get(), charset.name(), ResolvedText.Method.CANDIDATE);
            }
        }

        return new ResolvedText(TextDecoding.latin1(bytes), StandardCharsets.ISO_8859_1.name(),
                ResolvedText.Method.FALLBACK);
    }

    private Optional<ResolvedText> fromDetector(byte[] bytes) {
        Optional<DetectionResult> guess = detector.detect(bytes);
        if (guess.isEmpty() || !guess.get().isConfident()) {
            guess.ifPresent(g -> log.debug("Ignoring charset guess {} (confidence {})", g.getLabel(), g.getConfidence()));
            return Optional.empty();
        }
        Optional<Charset> charset = toCharset(guess.get().getLabel());
        if (charset.isEmpty()) {
            log.debug("Detected charset {} is not supported by this JVM", guess.get().getLabel());
            return Optional.empty();
        }
        return Optional.of(new ResolvedText(TextDecoding.lenient(bytes, charset.get()), charset.get().name(),
                ResolvedText.Method.DETECTED));
    }

    static Optional<Charset> toCharset(String label) {
        String lower = label.toLowerCase(Locale.ROOT);
        if (lower.contains("euc-kr") || lower.contains("cp949") || lower.contains("949")
                || lower.contains("ks_c_5601")) {
            return Optional.of(TextDecoding.MS949);
        }
        try {
            return Charset.isSupported(label) ? Optional.of(Charset.forName(label)) : Optional.empty();
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
