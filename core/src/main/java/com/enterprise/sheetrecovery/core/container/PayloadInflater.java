package com.enterprise.sheetrecovery.core.container;

import com.enterprise.sheetrecovery.core.util.TextDecoding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.zip.DataFormatException;
import java.util.zip.GZIPInputStream;
import java.util.zip.Inflater;

/**
 * Turns a candidate part payload into markup text. Tries, in order: the payload is already
 * markup, raw deflate, gzip, and a re-decode under alternate charsets. Truncated streams keep
 * whatever was inflated before the damage.
 */
public class PayloadInflater {

    private static final Logger log = LoggerFactory.getLogger(PayloadInflater.class);

    static final double MAX_NOISE_RATIO = 0.05;

    private static final int MAX_INFLATED_BYTES = 16 * 1024 * 1024;

    private static final List<Charset> REDECODE_CHARSETS = List.of(
            StandardCharsets.UTF_8, StandardCharsets.UTF_16LE, TextDecoding.MS949);

    public Optional<String> inflate(byte[] payload) {
        if (payload.length == 0) {
            return Optional.empty();
        }

        String plain = new String(payload, StandardCharsets.UTF_8);
        if (looksLikeMarkup(plain)) {
            return Optional.of(plain);
        }

        Optional<String> deflated = rawInflate(payload).filter(PayloadInflater::looksLikeMarkup);
        if (deflated.isPresent()) {
            return deflated;
        }

        Optional<String> gunzipped = gunzip(payload).filter(PayloadInflater::looksLikeMarkup);
        if (gunzipped.isPresent()) {
            return gunzipped;
        }

        for (Charset charset : REDECODE_CHARSETS) {
            String text = TextDecoding.lenient(payload, charset);
            if (looksLikeMarkup(text) && text.contains("xml")) {
                return Optional.of(text);
            }
        }
        return Optional.empty();
    }

    static boolean looksLikeMarkup(String text) {
        if (text.indexOf('<') < 0 || text.indexOf('>') < 0) {
            return false;
        }
        long replacements = text.chars().filter(c -> c == TextDecoding.REPLACEMENT).count();
        return TextDecoding.controlCharacterRatio(text) <= MAX_NOISE_RATIO
                && (double) replacements / text.length() <= MAX_NOISE_RATIO;
    }

    private static Optional<String> rawInflate(byte[] payload) {
        Inflater inflater = new Inflater(true);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            inflater.setInput(payload);
            byte[] buffer = new byte[8192];
            while (!inflater.finished() && out.size() < MAX_INFLATED_BYTES) {
                int n = inflater.inflate(buffer);
                if (n == 0) {
                    break;
                }
                out.write(buffer, 0, n);
            }
        } catch (DataFormatException e) {
            log.debug("Raw deflate stopped after {} bytes: {}", out.size(), e.getMessage());
        } finally {
            inflater.end();
        }
        return out.size() == 0 ? Optional.empty() : Optional.of(out.toString(StandardCharsets.UTF_8));
    }

    private static Optional<String> gunzip(byte[] payload) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (GZIPInputStream in = new GZIPInputStream(new ByteArrayInputStream(payload))) {
            byte[] buffer = new byte[8192];
            int n;
            while ((n = in.read(buffer)) > 0 && out.size() < MAX_INFLATED_BYTES) {
                out.write(buffer, 0, n);
            }
        } catch (IOException e) {
            log.debug("Gzip stopped after {} bytes: {}", out.size(), e.getMessage());
        }
        return out.size() == 0 ? Optional.empty() : Optional.of(out.toString(StandardCharsets.UTF_8));
    }
}
