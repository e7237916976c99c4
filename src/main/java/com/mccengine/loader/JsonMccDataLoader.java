package com.mccengine.loader;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads MCC data from JSON files.
 *
 * The data path is either {@code classpath:<directory>} or a filesystem
 * directory. It must contain {@code mcc_codes.json} (array of code objects),
 * {@code ranges.json} (array of range objects) and {@code risk_categories.json}
 * (object keyed by category id). Field names are snake_case.
 */
@Slf4j
public class JsonMccDataLoader implements MccDataLoader {

    private static final String CLASSPATH_PREFIX = "classpath:";

    private final ObjectMapper objectMapper;

    public JsonMccDataLoader() {
        this(new ObjectMapper());
    }

    public JsonMccDataLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public List<CodeRecord> loadCodes(String dataPath) throws IOException {
        return read(dataPath, DataFile.CODES, new TypeReference<List<CodeRecord>>() { });
    }

    @Override
    public List<RangeRecord> loadRanges(String dataPath) throws IOException {
        return read(dataPath, DataFile.RANGES, new TypeReference<List<RangeRecord>>() { });
    }

    @Override
    public Map<String, CategoryRecord> loadCategories(String dataPath) throws IOException {
        return read(dataPath, DataFile.CATEGORIES, new TypeReference<LinkedHashMap<String, CategoryRecord>>() { });
    }

    @Override
    public String describe(String dataPath, DataFile file) {
        String base = dataPath.endsWith("/") ? dataPath.substring(0, dataPath.length() - 1) : dataPath;
        return base + "/" + file.getFileName();
    }

    private <T> T read(String dataPath, DataFile file, TypeReference<T> type) throws IOException {
        String location = describe(dataPath, file);
        log.debug("Reading MCC data file {}", location);

        try (InputStream inputStream = open(location)) {
            T result = objectMapper.readValue(inputStream, type);
            if (result == null) {
                throw new IOException("Data file is empty: " + location);
            }
            return result;
        }
    }

    private InputStream open(String location) throws IOException {
        if (location.startsWith(CLASSPATH_PREFIX)) {
            String resource = location.substring(CLASSPATH_PREFIX.length());
            if (resource.startsWith("/")) {
                resource = resource.substring(1);
            }
            InputStream inputStream = JsonMccDataLoader.class.getClassLoader().getResourceAsStream(resource);
            if (inputStream == null) {
                throw new IOException("Resource not found: " + location);
            }
            return inputStream;
        }
        return Files.newInputStream(Path.of(location));
    }
}
