package com.mccengine.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ValidateMccResponse {

    private String mcc;
    private boolean valid;
    private List<String> errors;
}
