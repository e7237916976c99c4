package com.mccengine.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of reloading the MCC dataset.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReloadResponse {

    private int codes;
    private int ranges;
    private int categories;
}
