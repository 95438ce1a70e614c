package com.enterprise.sheetrecovery.core.util;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Charset helpers shared by the text and mining stages.
 */
public final class TextDecoding {

    public static final Charset EUC_KR = Charset.forName("EUC-KR");
    /** Microsoft's superset of EUC-KR (code page 949). */
    public static final Charset MS949 = Charset.forName("x-windows-949");

    public static final char REPLACEMENT = '�';

    private static final byte[] UTF8_BOM = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};

    private TextDecoding() {
    }

    /**
     * Decodes without substitution; empty when the bytes are malformed or unmappable in
     * {@code charset}, or when the decoded text already carries replacement characters.
     */
    public static Optional<String> strict(byte[] bytes, Charset charset) {
        try {
            String text = charset.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
            return text.indexOf(REPLACEMENT) >= 0 ? Optional.empty() : Optional.of(text);
        } catch (CharacterCodingException e) {
            return Optional.empty();
        }
    }

    public static String lenient(byte[] bytes, Charset charset) {
        return new String(bytes, charset);
    }

    public static String latin1(byte[] bytes) {
        return new String(bytes, StandardCharsets.ISO_8859_1);
    }

    public static byte[] stripUtf8Bom(byte[] bytes) {
        if (bytes.length >= UTF8_BOM.length
                && bytes[0] == UTF8_BOM[0] && bytes[1] == UTF8_BOM[1] && bytes[2] == UTF8_BOM[2]) {
            byte[] stripped = new byte[bytes.length - UTF8_BOM.length];
            System.arraycopy(bytes, UTF8_BOM.length, stripped, 0, stripped.length);
            return stripped;
        }
        return bytes;
    }

    /**
     * Share of characters that are control characters other than tab, CR and LF.
     */
    public static double controlCharacterRatio(CharSequence text) {
        if (text.length() == 0) {
            return 0.0;
        }
        int control = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isISOControl(c) && c != '\t' && c != '\n' && c != '\r') {
                control++;
            }
        }
        return (double) control / text.length();
    }
}
