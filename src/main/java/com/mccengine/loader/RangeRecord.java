package com.mccengine.loader;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Raw ISO 18245 range fields as supplied by a data source.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RangeRecord {

    private String start;
    private String end;
    private String name;
    private String description;
    private Boolean reserved;
}
