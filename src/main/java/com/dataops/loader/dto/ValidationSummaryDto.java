package com.dataops.loader.dto;

import com.dataops.loader.model.ErrorKind;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumMap;
import java.util.Map;

/**
 * Error ledger summary for one source file
 */
@Data
@NoArgsConstructor
public class ValidationSummaryDto {

    private Long sourceFileId;
    private long totalErrors;
    private long rejectedRows; // distinct rows with at least one error
    private Map<ErrorKind, Long> errorsByKind = new EnumMap<>(ErrorKind.class);
}
