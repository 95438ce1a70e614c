package com.enterprise.sheetrecovery.core.container;

import com.enterprise.sheetrecovery.core.util.TextDecoding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the bytes of named parts inside a ZIP container without trusting its directory.
 *
 * For every occurrence of the part name, the payload starts after the nearest preceding local
 * file header (name and extra field skipped when the header's lengths agree with where the
 * name was found) and ends at the header's compressed size, the next ZIP record marker, or a
 * fixed cap, whichever applies first.
 */
public class ContainerScanner {

    private static final Logger log = LoggerFactory.getLogger(ContainerScanner.class);

    public static final String SHARED_STRINGS_ENTRY = "xl/sharedStrings.xml";
    public static final int SHARED_STRINGS_PAYLOAD_CAP = 1000;
    public static final int WORKSHEET_PAYLOAD_CAP = 2000;

    private static final Pattern WORKSHEET_ENTRY = Pattern.compile("xl/worksheets/sheet(\\d+)\\.xml");

    private final PayloadInflater inflater;

    public ContainerScanner(PayloadInflater inflater) {
        this.inflater = inflater;
    }

    /**
     * Markup of the first occurrence of {@code entryName} whose payload inflates.
     */
    public Optional<String> readEntry(byte[] bytes, String entryName, int cap) {
        for (byte[] payload : payloads(bytes, entryName, cap)) {
            Optional<String> markup = inflater.inflate(payload);
            if (markup.isPresent()) {
                return markup;
            }
        }
        log.debug("No inflatable payload for {}", entryName);
        return Optional.empty();
    }

    /**
     * Worksheet part names present anywhere in the buffer, in sheet-number order.
     */
    public List<String> worksheetEntries(byte[] bytes) {
        TreeSet<Integer> numbers = new TreeSet<>();
        Matcher m = WORKSHEET_ENTRY.matcher(TextDecoding.latin1(bytes));
        while (m.find()) {
            try {
                numbers.add(Integer.parseInt(m.group(1)));
            } catch (NumberFormatException e) {
                log.debug("Ignoring worksheet entry with oversized number {}", m.group(1));
            }
        }
        List<String> entries = new ArrayList<>(numbers.size());
        for (int n : numbers) {
            entries.add("xl/worksheets/sheet" + n + ".xml");
        }
        return entries;
    }

    List<byte[]> payloads(byte[] bytes, String entryName, int cap) {
        String text = TextDecoding.latin1(bytes);
        int nameLength = entryName.getBytes(StandardCharsets.ISO_8859_1).length;
        List<byte[]> payloads = new ArrayList<>();

        int idx = text.indexOf(entryName);
        while (idx >= 0) {
            int start = idx + nameLength;
            long declaredSize = -1;
            int headerStart = text.lastIndexOf(ZipSignatures.LOCAL_FILE_HEADER, idx);
            if (headerStart >= 0 && idx == headerStart + ZipSignatures.LOCAL_HEADER_SIZE
                    && ZipSignatures.u16le(bytes, headerStart + 26) == nameLength) {
                int extraLength = ZipSignatures.u16le(bytes, headerStart + 28);
                start = headerStart + ZipSignatures.LOCAL_HEADER_SIZE + nameLength + extraLength;
                declaredSize = ZipSignatures.u32le(bytes, headerStart + 18);
            }
            if (start < bytes.length) {
                int end = end(text, start, declaredSize, cap);
                byte[] payload = new byte[end - start];
                System.arraycopy(bytes, start, payload, 0, payload.length);
                payloads.add(payload);
            }
            idx = text.indexOf(entryName, idx + 1);
        }
        return payloads;
    }

    private static int end(String text, int start, long declaredSize, int cap) {
        if (declaredSize > 0 && start + declaredSize <= text.length()) {
            return (int) (start + declaredSize);
        }
        int next = -1;
        for (String signature : ZipSignatures.ALL) {
            int at = text.indexOf(signature, start);
            if (at >= 0 && (next < 0 || at < next)) {
                next = at;
            }
        }
        return next >= 0 ? next : Math.min(text.length(), start + cap);
    }
}
