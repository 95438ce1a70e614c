package com.enterprise.sheetrecovery.model;

import com.enterprise.sheetrecovery.core.model.Fidelity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversionResult {

    private boolean success;
    private String fileName;
    private long originalSize;
    private long convertedSize;
    private Fidelity fidelity;
    private List<String> sheetNames;
    private List<String> warnings;
    private String message;

    @ToString.Exclude
    private byte[] content;
}
