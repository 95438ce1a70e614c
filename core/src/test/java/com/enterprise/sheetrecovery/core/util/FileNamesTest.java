package com.enterprise.sheetrecovery.core.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FileNamesTest {

    @Test
    @DisplayName("replaces unsafe characters and collapses underscore runs")
    void sanitizesUnsafeCharacters() {
        assertThat(FileNames.sanitize("주문 목록 (최종)!!.xlsx")).isEqualTo("주문_목록_최종_.xlsx");
        assertThat(FileNames.sanitize("report-2024.csv")).isEqualTo("report-2024.csv");
    }

    @Test
    @DisplayName("falls back when nothing usable is left")
    void fallsBackForEmptyNames() {
        assertThat(FileNames.sanitize(null)).isEqualTo(FileNames.DEFAULT_NAME);
        assertThat(FileNames.sanitize("")).isEqualTo(FileNames.DEFAULT_NAME);
        assertThat(FileNames.sanitize(null, "Sheet")).isEqualTo("Sheet");
    }

    @Test
    void splitsBaseNameAndExtension() {
        assertThat(FileNames.baseName("orders.final.XLSX")).isEqualTo("orders.final");
        assertThat(FileNames.extension("orders.final.XLSX")).isEqualTo("xlsx");
        assertThat(FileNames.extension("README")).isEmpty();
    }
}
