package com.mccengine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mccengine.codes.DescriptionSource;
import com.mccengine.collection.MccCollection;
import com.mccengine.loader.JsonMccDataLoader;
import com.mccengine.loader.MccDataLoader;
import com.mccengine.validation.MccValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the process-wide MCC configuration, data loader, collection and
 * default validator from {@code mcc-engine.*} properties.
 */
@Configuration
@Slf4j
public class MccEngineConfig {

    @Bean
    public MccConfiguration mccConfiguration(
            @Value("${mcc-engine.default-description-source:iso}") String defaultDescriptionSource,
            @Value("${mcc-engine.include-reserved-ranges:false}") boolean includeReservedRanges,
            @Value("${mcc-engine.cache-enabled:true}") boolean cacheEnabled,
            @Value("${mcc-engine.eager-load:false}") boolean eagerLoad,
            @Value("${mcc-engine.data-path:" + MccConfiguration.DEFAULT_DATA_PATH + "}") String dataPath) {

        MccConfiguration configuration = MccConfiguration.builder()
            .defaultDescriptionSource(DescriptionSource.require(defaultDescriptionSource))
            .includeReservedRanges(includeReservedRanges)
            .cacheEnabled(cacheEnabled)
            .eagerLoad(eagerLoad)
            .dataPath(dataPath)
            .build()
            .validate();

        log.info("MCC engine configured: dataPath={}, defaultDescriptionSource={}, cacheEnabled={}, eagerLoad={}",
            dataPath, configuration.getDefaultDescriptionSource().id(), cacheEnabled, eagerLoad);

        return configuration;
    }

    @Bean
    public MccDataLoader mccDataLoader(ObjectMapper objectMapper) {
        return new JsonMccDataLoader(objectMapper);
    }

    @Bean
    public MccCollection mccCollection(MccConfiguration configuration, MccDataLoader loader) {
        MccCollection collection = new MccCollection(configuration, loader);
        if (configuration.isEagerLoad()) {
            collection.reload();
        }
        return collection;
    }

    /**
     * Strict validator with no category restrictions.
     */
    @Bean
    public MccValidator mccValidator(MccCollection collection) {
        return new MccValidator(collection);
    }
}
