package com.enterprise.sheetrecovery.config;

import com.enterprise.sheetrecovery.core.decode.PoiStructuredDecoder;
import com.enterprise.sheetrecovery.core.decode.StructuredDecoder;
import com.enterprise.sheetrecovery.core.pipeline.RecoveryObserver;
import com.enterprise.sheetrecovery.core.pipeline.RecoveryOrchestrator;
import com.enterprise.sheetrecovery.core.pipeline.Slf4jRecoveryObserver;
import com.enterprise.sheetrecovery.core.text.EncodingDetector;
import com.enterprise.sheetrecovery.core.text.IcuEncodingDetector;
import com.enterprise.sheetrecovery.core.write.PoiWorkbookWriter;
import com.enterprise.sheetrecovery.core.write.WorkbookWriter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the recovery pipeline. All beans are stateless and shared across conversions.
 */
@Configuration
public class RecoveryConfig {

    @Bean
    public StructuredDecoder structuredDecoder() {
        return new PoiStructuredDecoder();
    }

    @Bean
    public EncodingDetector encodingDetector() {
        return new IcuEncodingDetector();
    }

    @Bean
    public RecoveryObserver recoveryObserver() {
        return new Slf4jRecoveryObserver();
    }

    @Bean
    public RecoveryOrchestrator recoveryOrchestrator(StructuredDecoder structuredDecoder,
                                                     EncodingDetector encodingDetector,
                                                     RecoveryObserver recoveryObserver) {
        return RecoveryOrchestrator.standard(structuredDecoder, encodingDetector, recoveryObserver);
    }

    @Bean
    public WorkbookWriter workbookWriter() {
        return new PoiWorkbookWriter();
    }
}
