package com.enterprise.sheetrecovery.core.mining;

import com.enterprise.sheetrecovery.core.model.CellValue;
import com.enterprise.sheetrecovery.core.model.Table;
import com.enterprise.sheetrecovery.core.text.CellNormalizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CellXmlMinerTest {

    private static final String SHEET = "<worksheet><sheetData>"
            + "<row r=\"1\"><c r=\"A1\" t=\"s\"><v>0</v></c><c r=\"B1\" t=\"s\"><v>1</v></c>"
            + "<c r=\"C1\" t=\"inlineStr\"><is><t>금액</t></is></c></row>"
            + "<row r=\"2\"><c r=\"A2\" t=\"s\"><v>2</v></c><c r=\"B2\"><v>30</v></c>"
            + "<c r=\"C2\" s=\"1\"><v>1500</v></c><c r=\"D2\" s=\"1\"/></row>"
            + "</sheetData></worksheet>";

    private final CellXmlMiner miner = new CellXmlMiner(new CellNormalizer());

    @Test
    @DisplayName("resolves shared-string indexes and inline strings")
    void resolvesStrings() {
        List<String> shared = miner.sharedStrings(
                "<sst><si><t>이름</t></si><si><r><t>나</t></r><r><t>이</t></r></si><si><t>Kim</t></si></sst>");

        assertThat(shared).containsExactly("이름", "나이", "Kim");
        assertThat(miner.cellValues(SHEET, shared)).containsExactly("이름", "나이", "금액", "Kim", "30", "1500");
    }

    @Test
    @DisplayName("unresolvable indexes keep their raw value")
    void missingSharedStrings() {
        assertThat(miner.cellValues(SHEET, List.of())).containsExactly("0", "1", "금액", "2", "30", "1500");
    }

    @Test
    @DisplayName("reshapes values into a near-square table with a normalized header")
    void reshapes() {
        Table table = miner.mine(SHEET, List.of("이름", "나이", "Kim")).orElseThrow();

        assertThat(table.getWidth()).isEqualTo(3);
        assertThat(table.header().texts()).containsExactly("이름", "나이", "금액");
        assertThat(table.row(1).getCells()).containsExactly(
                CellValue.string("Kim"), CellValue.number(30), CellValue.number(1500));
    }

    @Test
    void booleanCells() {
        String xml = "<c r=\"A1\" t=\"b\"><v>1</v></c><c r=\"B1\" t=\"b\"><v>0</v></c>";

        assertThat(miner.cellValues(xml, List.of())).containsExactly("true", "false");
    }

    @Test
    void noValuesIsEmpty() {
        assertThat(miner.mine("<worksheet><sheetData/></worksheet>", List.of())).isEmpty();
    }

    @Test
    void columnCountIsClampedSquareRoot() {
        assertThat(CellXmlMiner.columnsFor(1)).isEqualTo(3);
        assertThat(CellXmlMiner.columnsFor(16)).isEqualTo(4);
        assertThat(CellXmlMiner.columnsFor(99)).isEqualTo(9);
        assertThat(CellXmlMiner.columnsFor(400)).isEqualTo(15);
    }
}
