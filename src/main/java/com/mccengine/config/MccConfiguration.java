package com.mccengine.config;

import com.mccengine.codes.DescriptionSource;
import com.mccengine.common.exception.ConfigurationException;
import lombok.Builder;
import lombok.Value;

/**
 * Resolved settings consumed by {@link com.mccengine.collection.MccCollection}.
 *
 * Instances are immutable and passed explicitly; the application's default
 * instance is built from {@code mcc-engine.*} properties in {@link MccEngineConfig}.
 */
@Value
@Builder(toBuilder = true)
public class MccConfiguration {

    public static final String DEFAULT_DATA_PATH = "classpath:mcc-data";

    /**
     * Source tried first when resolving a code's description.
     */
    @Builder.Default
    DescriptionSource defaultDescriptionSource = DescriptionSource.ISO;

    /**
     * Whether reserved ISO ranges count as eligible. Advisory: only
     * {@code MccCollection#eligibleRanges()} honours it.
     */
    @Builder.Default
    boolean includeReservedRanges = false;

    /**
     * When false every top-level query reloads the data first.
     */
    @Builder.Default
    boolean cacheEnabled = true;

    /**
     * Load the data at startup instead of on first query.
     */
    @Builder.Default
    boolean eagerLoad = false;

    /**
     * Location handed to the data loader: {@code classpath:<dir>} or a filesystem directory.
     */
    @Builder.Default
    String dataPath = DEFAULT_DATA_PATH;

    public static MccConfiguration defaults() {
        return builder().build();
    }

    /**
     * @throws ConfigurationException if the data path is blank or no description source is set
     */
    public MccConfiguration validate() {
        if (dataPath == null || dataPath.isBlank()) {
            throw new ConfigurationException("data_path cannot be blank");
        }
        if (defaultDescriptionSource == null) {
            throw new ConfigurationException(
                "default_description_source must be one of: " + DescriptionSource.supportedIds());
        }
        return this;
    }
}
