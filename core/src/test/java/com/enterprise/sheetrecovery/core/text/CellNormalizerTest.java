package com.enterprise.sheetrecovery.core.text;

import com.enterprise.sheetrecovery.core.model.CellValue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class CellNormalizerTest {

    private final CellNormalizer normalizer = new CellNormalizer();

    @Nested
    @DisplayName("data cells")
    class DataCells {

        @Test
        void numbersWithThousandsSeparators() {
            assertThat(normalizer.data("1,234")).isEqualTo(CellValue.number(1234));
            assertThat(normalizer.data("-12.5")).isEqualTo(CellValue.number(-12.5));
        }

        @Test
        void percentagesBecomeFractions() {
            assertThat(normalizer.data("50%")).isEqualTo(CellValue.number(0.5));
            assertThat(normalizer.data("12.5 %")).isEqualTo(CellValue.number(0.125));
        }

        @Test
        void isoDates() {
            CellValue date = normalizer.data("2024-01-05");

            assertThat(date.getType()).isEqualTo(CellValue.Type.DATE);
            assertThat(date.asDate()).isEqualTo(LocalDateTime.of(2024, 1, 5, 0, 0));
        }

        @Test
        @DisplayName("impossible calendar dates stay text")
        void invalidDate() {
            assertThat(normalizer.data("2024-13-45")).isEqualTo(CellValue.string("2024-13-45"));
        }

        @Test
        @DisplayName("parentheses keep a value as text")
        void parenthesesStayText() {
            assertThat(normalizer.data("(123)")).isEqualTo(CellValue.string("(123)"));
            assertThat(normalizer.data("02)123-4567")).isEqualTo(CellValue.string("02)123-4567"));
        }

        @Test
        void booleansInEnglishAndKorean() {
            assertThat(normalizer.data("TRUE")).isEqualTo(CellValue.bool(true));
            assertThat(normalizer.data("yes")).isEqualTo(CellValue.bool(true));
            assertThat(normalizer.data("참")).isEqualTo(CellValue.bool(true));
            assertThat(normalizer.data("No")).isEqualTo(CellValue.bool(false));
            assertThat(normalizer.data("거짓")).isEqualTo(CellValue.bool(false));
        }

        @Test
        void blankIsEmptyAndTextIsTrimmed() {
            assertThat(normalizer.data("   ").isEmpty()).isTrue();
            assertThat(normalizer.data(null).isEmpty()).isTrue();
            assertThat(normalizer.data("  서울시 강남구 ")).isEqualTo(CellValue.string("서울시 강남구"));
        }
    }

    @Nested
    @DisplayName("header cells")
    class HeaderCells {

        @Test
        void stripsControlAndUnsafeCharacters() {
            assertThat(normalizer.header("  이름\u0001 ", 0)).isEqualTo("이름");
            assertThat(normalizer.header("Price ($)", 0)).isEqualTo("Price ()");
            assertThat(normalizer.header("a \t  b", 0)).isEqualTo("a b");
        }

        @Test
        @DisplayName("empty names get a numbered placeholder")
        void placeholders() {
            assertThat(normalizer.header("", 2)).isEqualTo("컬럼3");
            assertThat(normalizer.header("@#!", 0)).isEqualTo("컬럼1");
        }
    }
}
