package com.enterprise.sheetrecovery.service;

import com.enterprise.sheetrecovery.core.EmptyResultException;
import com.enterprise.sheetrecovery.core.pipeline.RecoveryOrchestrator;
import com.enterprise.sheetrecovery.core.pipeline.RecoveryOutcome;
import com.enterprise.sheetrecovery.core.pipeline.RecoveryRequest;
import com.enterprise.sheetrecovery.core.util.FileNames;
import com.enterprise.sheetrecovery.core.write.WorkbookWriter;
import com.enterprise.sheetrecovery.model.ConversionResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts one uploaded file into a recovered .xlsx.
 * Workflow:
 * 1. Run the recovery chain (or forced text recovery)
 * 2. Write the recovered sheets as a styled workbook
 * 3. Compare sizes and attach warnings when the result looks suspicious
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConversionService {

    static final String LARGER_WARNING = "변환된 파일이 원본보다 상당히 큽니다. 데이터 확인을 권장합니다.";
    static final String SMALLER_WARNING = "변환된 파일이 원본보다 상당히 작습니다. 데이터 손실이 있을 수 있습니다.";

    private final RecoveryOrchestrator orchestrator;
    private final WorkbookWriter workbookWriter;

    @Value("${recovery.result-suffix:_변환완료}")
    private String resultSuffix;

    @Value("${recovery.warn.max-size-ratio:3.0}")
    private double maxSizeRatio;

    @Value("${recovery.warn.min-size-ratio:0.1}")
    private double minSizeRatio;

    @Value("${recovery.warn.min-original-bytes:1000}")
    private long minOriginalBytes;

    public ConversionResult convert(byte[] bytes, String originalFileName, boolean forceTextRecovery) {
        RecoveryRequest request = RecoveryRequest.builder()
                .bytes(bytes)
                .filename(originalFileName)
                .forceTextRecovery(forceTextRecovery)
                .build();

        RecoveryOutcome outcome;
        try {
            outcome = orchestrator.recover(request);
        } catch (EmptyResultException e) {
            log.warn("Text recovery found nothing in '{}': {}", originalFileName, e.getMessage());
            return failure(request, e.getMessage());
        }

        byte[] content;
        try {
            content = workbookWriter.write(outcome.getWorkbook());
        } catch (IOException | RuntimeException e) {
            log.error("Writing the converted workbook failed for '{}'", originalFileName, e);
            return failure(request, "Failed to write converted workbook: " + e.getMessage());
        }

        long originalSize = request.getBytes().length;
        List<String> warnings = sizeWarnings(originalSize, content.length);
        log.info("Converted '{}' via {}: {} bytes -> {} bytes", originalFileName, outcome.getFidelity(),
                originalSize, content.length);

        return ConversionResult.builder()
                .success(true)
                .fileName(buildResultName(originalFileName))
                .originalSize(originalSize)
                .convertedSize(content.length)
                .fidelity(outcome.getFidelity())
                .sheetNames(outcome.getWorkbook().sheetNames())
                .warnings(warnings)
                .content(content)
                .build();
    }

    // ─── Helpers ───────────────────────────────────────────────────────────

    String buildResultName(String originalFileName) {
        return FileNames.sanitize(FileNames.baseName(originalFileName)) + resultSuffix + ".xlsx";
    }

    List<String> sizeWarnings(long originalSize, long convertedSize) {
        List<String> warnings = new ArrayList<>();
        if (originalSize == 0) {
            return warnings;
        }
        double ratio = (double) convertedSize / originalSize;
        if (ratio > maxSizeRatio) {
            warnings.add(LARGER_WARNING);
        } else if (ratio < minSizeRatio && originalSize > minOriginalBytes) {
            warnings.add(SMALLER_WARNING);
        }
        return warnings;
    }

    private static ConversionResult failure(RecoveryRequest request, String message) {
        return ConversionResult.builder()
                .success(false)
                .fileName(request.getFilename())
                .originalSize(request.getBytes().length)
                .warnings(List.of())
                .message(message)
                .build();
    }
}
