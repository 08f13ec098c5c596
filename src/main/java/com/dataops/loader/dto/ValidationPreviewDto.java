package com.dataops.loader.dto;

import com.dataops.loader.model.ValidationError;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Dry-run validation result for the first rows of a file. Nothing is loaded or persisted.
 */
@Data
@NoArgsConstructor
public class ValidationPreviewDto {

    private Long sourceFileId;
    private String targetName;
    private List<String> header = new ArrayList<>();
    private int sampleSize; // rows actually examined
    private int validRows;
    private int errorRows;
    private double errorRate; // percent of examined rows, 0 to 100
    private List<ValidationError> sampleErrors = new ArrayList<>();
    private String fatalError; // set when the file cannot be parsed or matched to a target

    public boolean isParsable() {
        return fatalError == null;
    }
}
