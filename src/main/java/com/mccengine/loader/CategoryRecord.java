package com.mccengine.loader;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Raw risk category fields. The category id is the key of the map the loader returns.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CategoryRecord {

    private String name;
    private String description;

    /**
     * Single codes ("7995", or bare numbers) and "start-end" ranges.
     */
    private List<Object> codes;
}
