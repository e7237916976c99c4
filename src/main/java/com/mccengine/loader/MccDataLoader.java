package com.mccengine.loader;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Interface for MCC data sources.
 *
 * A loader adapts whatever storage holds the reference data (files, an embedded
 * table, a remote service) into three record sets. It only fetches and parses;
 * turning records into codes, ranges and categories is the collection's job.
 * Retrying a failed fetch, if wanted, is the loader's responsibility.
 */
public interface MccDataLoader {

    /**
     * Load the flat list of code records.
     *
     * @param dataPath opaque location from the configuration
     */
    List<CodeRecord> loadCodes(String dataPath) throws IOException;

    List<RangeRecord> loadRanges(String dataPath) throws IOException;

    /**
     * Load categories keyed by category id, in source order.
     */
    Map<String, CategoryRecord> loadCategories(String dataPath) throws IOException;

    /**
     * Identifier of the given record set, used in error reports.
     */
    String describe(String dataPath, DataFile file);
}
