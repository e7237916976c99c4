package com.mccengine.api.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.List;

/**
 * DTO for validating a candidate MCC against format, existence and category rules.
 */
@Data
public class ValidateMccRequest {

    @NotNull(message = "MCC is required")
    private String mcc;

    /**
     * Defaults to strict validation when omitted.
     */
    private Boolean strict;

    private List<String> denyCategories;

    /**
     * Omit for no allow-list. An empty list rejects every code.
     */
    private List<String> allowCategories;
}
