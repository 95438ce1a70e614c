package com.enterprise.sheetrecovery.core.pipeline;

import com.enterprise.sheetrecovery.core.EmptyResultException;
import com.enterprise.sheetrecovery.core.container.ContainerScanner;
import com.enterprise.sheetrecovery.core.container.ZipFixtures;
import com.enterprise.sheetrecovery.core.decode.PoiStructuredDecoder;
import com.enterprise.sheetrecovery.core.mining.ByteScanMiner;
import com.enterprise.sheetrecovery.core.model.CellValue;
import com.enterprise.sheetrecovery.core.model.Fidelity;
import com.enterprise.sheetrecovery.core.model.RecoveredWorkbook;
import com.enterprise.sheetrecovery.core.model.Table;
import com.enterprise.sheetrecovery.core.text.IcuEncodingDetector;
import com.enterprise.sheetrecovery.core.util.TextDecoding;
import com.enterprise.sheetrecovery.core.write.PoiWorkbookWriter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end runs of the standard chain over realistic inputs.
 */
class RecoveryScenariosTest {

    private final RecoveryOrchestrator orchestrator =
            RecoveryOrchestrator.standard(new PoiStructuredDecoder(), new IcuEncodingDetector(), RecoveryObserver.NONE);

    // Skips the statistical detector so short legacy-encoded samples resolve through the candidate list
    private final RecoveryOrchestrator withoutDetector =
            RecoveryOrchestrator.standard(new PoiStructuredDecoder(), bytes -> Optional.empty(), RecoveryObserver.NONE);

    private static RecoveryRequest request(String filename, byte[] bytes) {
        return RecoveryRequest.builder().filename(filename).bytes(bytes).build();
    }

    @Nested
    @DisplayName("delimited text")
    class DelimitedText {

        @Test
        @DisplayName("UTF-8 TSV becomes one typed sheet")
        void utf8Tsv() {
            DecisionTrail trail = new DecisionTrail();
            byte[] tsv = "이름\t나이\n홍길동\t30\n".getBytes(StandardCharsets.UTF_8);

            RecoveryOutcome outcome = orchestrator.recover(request("people.txt", tsv), trail);

            assertThat(outcome.getFidelity()).isEqualTo(Fidelity.DELIMITED_TEXT);
            assertThat(outcome.getRoute()).isEqualTo(InputRoute.TEXT);
            Table table = outcome.getWorkbook().firstSheet().getTable();
            assertThat(outcome.getWorkbook().sheetNames()).containsExactly("Sheet1");
            assertThat(table.header().texts()).containsExactly("이름", "나이");
            assertThat(table.row(1).getCells()).containsExactly(CellValue.string("홍길동"), CellValue.number(30));
            assertThat(trail.ofKind(RecoveryEvent.Kind.DECODE_VARIANT_TRIED)).hasSize(1);
        }

        @Test
        @DisplayName("data.tsv splits on tabs into a typed name and age table")
        void koreanTsv() {
            DecisionTrail trail = new DecisionTrail();
            byte[] tsv = "이름\t나이\n철수\t20\n영희\t30".getBytes(StandardCharsets.UTF_8);

            RecoveryOutcome outcome = orchestrator.recover(request("data.tsv", tsv), trail);

            assertThat(outcome.getFidelity()).isEqualTo(Fidelity.DELIMITED_TEXT);
            assertThat(trail.ofKind(RecoveryEvent.Kind.DELIMITER_DETECTED))
                    .extracting(RecoveryEvent::getDetail)
                    .containsExactly("\t");
            Table table = outcome.getWorkbook().firstSheet().getTable();
            assertThat(table.height()).isEqualTo(3);
            assertThat(table.header().texts()).containsExactly("이름", "나이");
            assertThat(table.row(1).getCells()).containsExactly(CellValue.string("철수"), CellValue.number(20));
            assertThat(table.row(2).getCells()).containsExactly(CellValue.string("영희"), CellValue.number(30));
        }

        @Test
        @DisplayName("EUC-KR CSV with quoting, percentages and dates")
        void legacyKoreanCsv() {
            String csv = "주문번호,고객,할인율,주문일\n"
                    + "A-1,\"김, 철수\",10%,2024-01-05\n"
                    + "A-2,이영희,5%,2024-02-29\n";

            RecoveryOutcome outcome = withoutDetector.recover(request("orders.csv", csv.getBytes(TextDecoding.EUC_KR)));

            Table table = outcome.getWorkbook().firstSheet().getTable();
            assertThat(outcome.getFidelity()).isEqualTo(Fidelity.DELIMITED_TEXT);
            assertThat(table.header().texts()).containsExactly("주문번호", "고객", "할인율", "주문일");
            assertThat(table.row(1).getCells()).containsExactly(
                    CellValue.string("A-1"), CellValue.string("김, 철수"), CellValue.number(0.1),
                    CellValue.date(LocalDate.of(2024, 1, 5)));
        }

        @Test
        @DisplayName("text named like a workbook gets the full decode matrix before text recovery")
        void misnamedText() {
            DecisionTrail trail = new DecisionTrail();
            byte[] csv = "a,b\n1,2".getBytes(StandardCharsets.UTF_8);

            RecoveryOutcome outcome = orchestrator.recover(request("export.xls", csv), trail);

            assertThat(outcome.getRoute()).isEqualTo(InputRoute.CONTAINER);
            assertThat(outcome.getFidelity()).isEqualTo(Fidelity.DELIMITED_TEXT);
            assertThat(trail.ofKind(RecoveryEvent.Kind.DECODE_VARIANT_TRIED)).hasSize(10);
        }

        @Test
        @DisplayName("forcing text recovery skips the decode attempts")
        void forced() {
            DecisionTrail trail = new DecisionTrail();
            RecoveryRequest forced = RecoveryRequest.builder()
                    .filename("report.xlsx")
                    .bytes("a;b\n1;2".getBytes(StandardCharsets.UTF_8))
                    .forceTextRecovery(true)
                    .build();

            RecoveryOutcome outcome = orchestrator.recover(forced, trail);

            assertThat(outcome.getFidelity()).isEqualTo(Fidelity.DELIMITED_TEXT);
            assertThat(trail.stagesEntered()).containsExactly(Fidelity.DELIMITED_TEXT);
        }

        @Test
        void forcedEmptyInputFails() {
            RecoveryRequest forced = RecoveryRequest.builder().filename("empty.csv").bytes(new byte[0])
                    .forceTextRecovery(true).build();

            assertThatThrownBy(() -> orchestrator.recover(forced)).isInstanceOf(EmptyResultException.class);
        }
    }

    @Nested
    @DisplayName("containers")
    class Containers {

        @Test
        @DisplayName("an intact workbook is decoded structurally")
        void intactWorkbook() throws IOException {
            Table table = Table.of(List.of(
                    List.of(CellValue.string("품목"), CellValue.string("수량")),
                    List.of(CellValue.string("사과"), CellValue.number(3))));
            byte[] xlsx = new PoiWorkbookWriter().write(RecoveredWorkbook.single("재고", table));

            RecoveryOutcome outcome = orchestrator.recover(request("stock.xlsx", xlsx));

            assertThat(outcome.getFidelity()).isEqualTo(Fidelity.STRUCTURED);
            assertThat(outcome.getWorkbook().sheetNames()).containsExactly("재고");
            assertThat(outcome.getWorkbook().firstSheet().getTable()).isEqualTo(table);
        }

        @Test
        @DisplayName("a broken container falls back to its shared strings")
        void brokenContainerSharedStrings() {
            Map<String, String> parts = new LinkedHashMap<>();
            parts.put(ContainerScanner.SHARED_STRINGS_ENTRY, ZipFixtures.sharedStrings("주문번호", "고객명", "배송지"));
            parts.put("xl/worksheets/sheet1.xml", "<worksheet><sheetData/></worksheet>");
            byte[] broken = ZipFixtures.withoutCentralDirectory(ZipFixtures.container(parts));

            RecoveryOutcome outcome = orchestrator.recover(request("orders.xlsx", broken));

            assertThat(outcome.getFidelity()).isEqualTo(Fidelity.SHARED_STRINGS);
            assertThat(outcome.getWorkbook().firstSheet().getTable().header().texts())
                    .containsExactly("주문번호", "고객명", "배송지");
        }

        @Test
        @DisplayName("worksheet cells are mined when there is no usable string pool")
        void brokenContainerWorksheet() {
            String sheet = "<worksheet><sheetData><row r=\"1\">"
                    + "<c r=\"A1\" t=\"inlineStr\"><is><t>품목</t></is></c>"
                    + "<c r=\"B1\" t=\"inlineStr\"><is><t>수량</t></is></c>"
                    + "<c r=\"C1\" t=\"inlineStr\"><is><t>단가</t></is></c></row><row r=\"2\">"
                    + "<c r=\"A2\" t=\"inlineStr\"><is><t>사과</t></is></c>"
                    + "<c r=\"B2\"><v>3</v></c><c r=\"C2\"><v>1200</v></c></row></sheetData></worksheet>";
            byte[] broken = ZipFixtures.container("xl/worksheets/sheet1.xml", sheet);

            RecoveryOutcome outcome = orchestrator.recover(request("stock.xlsx", broken));

            assertThat(outcome.getFidelity()).isEqualTo(Fidelity.WORKSHEET_CELLS);
            Table table = outcome.getWorkbook().firstSheet().getTable();
            assertThat(outcome.getWorkbook().sheetNames()).containsExactly("Sheet1");
            assertThat(table.header().texts()).containsExactly("품목", "수량", "단가");
            assertThat(table.row(1).getCells()).containsExactly(
                    CellValue.string("사과"), CellValue.number(3), CellValue.number(1200));
        }

        @Test
        @DisplayName("every recoverable worksheet part becomes its own sheet")
        void brokenContainerSeveralWorksheets() {
            Map<String, String> parts = new LinkedHashMap<>();
            parts.put("xl/worksheets/sheet1.xml", "<worksheet><sheetData><row r=\"1\">"
                    + "<c t=\"inlineStr\"><is><t>품목</t></is></c><c><v>1</v></c><c><v>2</v></c></row></sheetData></worksheet>");
            parts.put("xl/worksheets/sheet2.xml", "<worksheet><sheetData><row r=\"1\">"
                    + "<c t=\"inlineStr\"><is><t>고객</t></is></c><c><v>3</v></c><c><v>4</v></c></row></sheetData></worksheet>");

            RecoveryOutcome outcome = orchestrator.recover(request("multi.xlsx", ZipFixtures.container(parts)));

            assertThat(outcome.getFidelity()).isEqualTo(Fidelity.WORKSHEET_CELLS);
            assertThat(outcome.getWorkbook().sheetNames()).containsExactly("Sheet1", "Sheet2");
            assertThat(outcome.getWorkbook().getSheets().get(1).getTable().header().texts()).startsWith("고객");
        }
    }

    @Nested
    @DisplayName("last resorts")
    class LastResorts {

        @Test
        @DisplayName("binary with embedded text is mined byte by byte")
        void binaryWithText() {
            byte[] bytes = new byte[400];
            byte[] text = "주문번호 20240105123 배송".getBytes(StandardCharsets.UTF_8);
            System.arraycopy(text, 0, bytes, 150, text.length);

            RecoveryOutcome outcome = orchestrator.recover(request("dump.bin", bytes));

            assertThat(outcome.getFidelity()).isEqualTo(Fidelity.BYTE_SCAN);
            assertThat(outcome.getWorkbook().sheetNames()).containsExactly(ByteScanStage.SHEET_NAME);
            assertThat(outcome.getWorkbook().firstSheet().getTable().getRows())
                    .extracting(row -> row.get(0).asText())
                    .contains("주문번호", "20240105123", "배송", "dump");
        }

        @Test
        @DisplayName("binary without any text is reported through the filename's tokens")
        void binaryWithoutTextNamedFile() {
            RecoveryOutcome outcome = orchestrator.recover(request("주문내역.xls", new byte[512]));

            assertThat(outcome.getFidelity()).isEqualTo(Fidelity.BYTE_SCAN);
            Table table = outcome.getWorkbook().firstSheet().getTable();
            assertThat(table.height()).isEqualTo(2);
            assertThat(table.row(1).get(0).asText()).isEqualTo("주문내역");
            assertThat(table.row(1).get(2)).isEqualTo(CellValue.number(4));
        }

        @Test
        @DisplayName("binary without any text under a meaningless name ends in the diagnostic report")
        void binaryWithoutText() {
            RecoveryOutcome outcome = orchestrator.recover(request("1.bin", new byte[512]));

            assertThat(outcome.getFidelity()).isEqualTo(Fidelity.DIAGNOSTIC);
            Table table = outcome.getWorkbook().firstSheet().getTable();
            assertThat(outcome.getWorkbook().sheetNames()).containsExactly("FileStatus");
            assertThat(table.header().texts()).containsExactlyElementsOf(DiagnosticStage.HEADER);
            assertThat(table.row(1).texts()).containsExactly(
                    "1.bin", DiagnosticStage.STATUS, "512 bytes", DiagnosticStage.NOTE);
        }

        @Test
        void emptyInputIsDiagnosed() {
            RecoveryOutcome outcome = orchestrator.recover(request("0.csv", new byte[0]));

            assertThat(outcome.getFidelity()).isEqualTo(Fidelity.DIAGNOSTIC);
            assertThat(outcome.getWorkbook().firstSheet().getTable().row(1).get(2).asText()).isEqualTo("0 bytes");
        }

        @Test
        @DisplayName("an empty file with a meaningful name yields its filename tokens")
        void emptyInputWithNamedFile() {
            RecoveryOutcome outcome = orchestrator.recover(request("nothing.csv", new byte[0]));

            assertThat(outcome.getFidelity()).isEqualTo(Fidelity.BYTE_SCAN);
            assertThat(outcome.getWorkbook().firstSheet().getTable().row(1).get(0).asText()).isEqualTo("nothing");
        }

        @Test
        @DisplayName("random binary is mined into a bounded, classified token report")
        void randomBinaryIsMined() {
            byte[] bytes = new byte[16 * 1024];
            new Random(42L).nextBytes(bytes);

            RecoveryOutcome outcome = withoutDetector.recover(request("1.bin", bytes));

            assertThat(outcome.getFidelity()).isEqualTo(Fidelity.BYTE_SCAN);
            Table table = outcome.getWorkbook().firstSheet().getTable();
            assertThat(table.header().texts()).containsExactlyElementsOf(ByteScanMiner.HEADER);
            assertThat(table.height()).isBetween(2, ByteScanMiner.MAX_TOKENS + 1);
            for (int r = 1; r < table.height(); r++) {
                assertThat(table.row(r).size()).isEqualTo(4);
                assertThat(table.row(r).get(1).asText()).isIn("한글", "영문", "숫자", "복합");
                assertThat(table.row(r).get(2).getType()).isEqualTo(CellValue.Type.NUMBER);
                assertThat(table.row(r).get(3).asText()).isNotBlank();
            }
        }

        @Test
        @DisplayName("random bytes always yield a non-empty workbook")
        void randomBytesNeverFail() {
            Random random = new Random(20240105L);
            for (int i = 0; i < 20; i++) {
                byte[] bytes = new byte[64 + random.nextInt(4096)];
                random.nextBytes(bytes);

                RecoveryOutcome outcome = orchestrator.recover(request("random" + i + ".xlsx", bytes));

                assertThat(outcome.getWorkbook().getSheets()).isNotEmpty();
                assertThat(outcome.getWorkbook().firstSheet().getTable().isEmpty()).isFalse();
            }
        }
    }
}
