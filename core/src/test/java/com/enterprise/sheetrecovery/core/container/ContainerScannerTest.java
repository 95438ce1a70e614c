package com.enterprise.sheetrecovery.core.container;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ContainerScannerTest {

    private final ContainerScanner scanner = new ContainerScanner(new PayloadInflater());

    @Test
    @DisplayName("reads a deflated part by name")
    void readsDeflatedPart() {
        String markup = ZipFixtures.sharedStrings("주문번호", "고객명", "배송지");
        byte[] zip = ZipFixtures.container(ContainerScanner.SHARED_STRINGS_ENTRY, markup);

        assertThat(scanner.readEntry(zip, ContainerScanner.SHARED_STRINGS_ENTRY,
                ContainerScanner.SHARED_STRINGS_PAYLOAD_CAP)).contains(markup);
    }

    @Test
    @DisplayName("still finds parts when the central directory is gone")
    void survivesMissingCentralDirectory() {
        String markup = ZipFixtures.sharedStrings("연락처", "전화번호");
        byte[] truncated = ZipFixtures.withoutCentralDirectory(
                ZipFixtures.container(ContainerScanner.SHARED_STRINGS_ENTRY, markup));

        assertThat(scanner.readEntry(truncated, ContainerScanner.SHARED_STRINGS_ENTRY,
                ContainerScanner.SHARED_STRINGS_PAYLOAD_CAP)).contains(markup);
    }

    @Test
    void missingPartIsEmpty() {
        byte[] zip = ZipFixtures.container("docProps/app.xml", "<Properties/>");

        assertThat(scanner.readEntry(zip, ContainerScanner.SHARED_STRINGS_ENTRY, 1000)).isEmpty();
    }

    @Test
    @DisplayName("lists worksheet parts in sheet order, each once")
    void listsWorksheets() {
        Map<String, String> parts = new LinkedHashMap<>();
        parts.put("xl/worksheets/sheet2.xml", "<worksheet/>");
        parts.put("xl/worksheets/sheet1.xml", "<worksheet/>");
        parts.put("xl/worksheets/sheet10.xml", "<worksheet/>");

        assertThat(scanner.worksheetEntries(ZipFixtures.container(parts))).containsExactly(
                "xl/worksheets/sheet1.xml", "xl/worksheets/sheet2.xml", "xl/worksheets/sheet10.xml");
    }

    @Test
    @DisplayName("a name without a matching local header yields the bytes after the name")
    void looseNameOccurrence() {
        byte[] bytes = ("junk xl/sharedStrings.xml<sst><si><t>x</t></si></sst>").getBytes(StandardCharsets.ISO_8859_1);

        assertThat(scanner.payloads(bytes, ContainerScanner.SHARED_STRINGS_ENTRY, 1000))
                .singleElement()
                .satisfies(p -> assertThat(new String(p, StandardCharsets.ISO_8859_1))
                        .isEqualTo("<sst><si><t>x</t></si></sst>"));
    }

    @Test
    void zipSignature() {
        assertThat(ZipSignatures.startsWithZipSignature(new byte[]{'P', 'K', 3, 4})).isTrue();
        assertThat(ZipSignatures.startsWithZipSignature(new byte[]{'P', 'K', 5, 6})).isTrue();
        assertThat(ZipSignatures.startsWithZipSignature(new byte[]{'P', 'K', 1, 2})).isFalse();
        assertThat(ZipSignatures.startsWithZipSignature("a,b".getBytes(StandardCharsets.US_ASCII))).isFalse();
    }
}
