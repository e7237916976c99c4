package com.mccengine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mccengine.codes.DescriptionSource;
import com.mccengine.collection.MccCollection;
import com.mccengine.common.exception.ConfigurationException;
import com.mccengine.validation.MccValidator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for the MCC engine wiring.
 */
@SpringBootTest
@ActiveProfiles("test")
class MccEngineConfigTest {

    @Autowired
    private MccConfiguration configuration;

    @Autowired
    private MccCollection collection;

    @Autowired
    private MccValidator validator;

    @Test
    void testConfiguration_FromProperties() {
        assertEquals(DescriptionSource.ISO, configuration.getDefaultDescriptionSource());
        assertEquals("classpath:mcc-data", configuration.getDataPath());
        assertTrue(configuration.isCacheEnabled());
        assertFalse(configuration.isEagerLoad());
        assertSame(configuration, collection.getConfiguration());
    }

    @Test
    void testDefaultValidator_IsStrict() {
        assertTrue(validator.getOptions().isStrict());
        assertTrue(validator.valid("5411"));
        assertFalse(validator.valid("9999"));
    }

    @Test
    void testUnknownDescriptionSource_Rejected() {
        MccEngineConfig config = new MccEngineConfig();

        assertThrows(ConfigurationException.class,
            () -> config.mccConfiguration("discover", false, true, false, "classpath:mcc-data"));
    }

    @Test
    void testEagerLoad_LoadsAtStartup() {
        MccEngineConfig config = new MccEngineConfig();
        MccConfiguration eager = config.mccConfiguration("visa", false, true, true, "classpath:mcc-data");

        MccCollection eagerCollection = config.mccCollection(eager, config.mccDataLoader(
            new ObjectMapper()));

        assertTrue(eagerCollection.isLoaded());
        assertEquals(DescriptionSource.VISA, eager.getDefaultDescriptionSource());
    }
}
