package com.enterprise.sheetrecovery.runner;

import com.enterprise.sheetrecovery.model.ConversionResult;
import com.enterprise.sheetrecovery.service.ConversionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Converts every file named on the command line.
 * Usage: {@code java -jar sheet-recovery-backend.jar [--force-text] file...}
 * Results are written next to each input, or into {@code recovery.output-dir} when set.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConversionRunner implements ApplicationRunner {

    static final String FORCE_TEXT_OPTION = "force-text";

    private final ConversionService conversionService;

    @Value("${recovery.output-dir:}")
    private String outputDir;

    @Override
    public void run(ApplicationArguments args) {
        boolean forceText = args.containsOption(FORCE_TEXT_OPTION);
        int converted = 0;
        for (String file : args.getNonOptionArgs()) {
            Path input = Paths.get(file);
            try {
                if (convertFile(input, forceText)) {
                    converted++;
                }
            } catch (IOException | RuntimeException e) {
                log.error("Conversion failed for: {}", input, e);
            }
        }
        if (!args.getNonOptionArgs().isEmpty()) {
            log.info("Converted {} of {} file(s)", converted, args.getNonOptionArgs().size());
        }
    }

    boolean convertFile(Path input, boolean forceText) throws IOException {
        byte[] bytes = Files.readAllBytes(input);
        ConversionResult result = conversionService.convert(bytes, input.getFileName().toString(), forceText);
        if (!result.isSuccess()) {
            log.warn("No output for {}: {}", input, result.getMessage());
            return false;
        }

        Path target = resolveOutputDir(input).resolve(result.getFileName());
        Files.createDirectories(target.getParent());
        Files.write(target, result.getContent());
        log.info("Wrote {} ({} via {}, sheets {})", target, result.getConvertedSize(), result.getFidelity(),
                result.getSheetNames());
        result.getWarnings().forEach(w -> log.warn("{}: {}", input.getFileName(), w));
        return true;
    }

    private Path resolveOutputDir(Path input) {
        if (outputDir != null && !outputDir.isBlank()) {
            return Paths.get(outputDir);
        }
        Path parent = input.toAbsolutePath().getParent();
        return parent != null ? parent : Paths.get(".");
    }
}
