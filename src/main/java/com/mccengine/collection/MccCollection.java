package com.mccengine.collection;

import com.mccengine.categories.RiskCategory;
import com.mccengine.codes.Code;
import com.mccengine.codes.CodeAttribute;
import com.mccengine.common.MccCodes;
import com.mccengine.common.exception.CategoryNotFoundException;
import com.mccengine.common.exception.CodeNotFoundException;
import com.mccengine.common.exception.DataLoadException;
import com.mccengine.config.MccConfiguration;
import com.mccengine.loader.CategoryRecord;
import com.mccengine.loader.CodeRecord;
import com.mccengine.loader.DataFile;
import com.mccengine.loader.MccDataLoader;
import com.mccengine.loader.RangeRecord;
import com.mccengine.ranges.MccRange;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Owns the MCC dataset and answers every query over it.
 *
 * Data is loaded from the {@link MccDataLoader} on first use (or at startup when
 * the configuration asks for eager loading) and kept as a single immutable
 * {@link MccDataSnapshot}. Loading and reloading run under one lock; queries read
 * the current snapshot reference once and work on it without locking, so a
 * concurrent reload never exposes a half-replaced dataset.
 *
 * With caching disabled every top-level query reloads before answering.
 *
 * Lookup misses are normal outcomes: {@link #find} returns empty and the list
 * queries return empty lists. Only {@link #findOrThrow} and
 * {@link #requireCategory} turn absence into an exception.
 */
@Slf4j
public class MccCollection {

    private final MccConfiguration configuration;
    private final MccDataLoader loader;
    private final ReentrantLock loadLock = new ReentrantLock();

    private volatile MccDataSnapshot snapshot = MccDataSnapshot.EMPTY;

    public MccCollection(MccConfiguration configuration, MccDataLoader loader) {
        this.configuration = configuration.validate();
        this.loader = loader;
    }

    public MccConfiguration getConfiguration() {
        return configuration;
    }

    /**
     * All codes in source order. Under caching the same list instance is returned
     * until the next reload.
     */
    public List<Code> all() {
        return ensureLoaded().codes();
    }

    /**
     * Look up a code given as a String, Number or Code.
     *
     * @return the code, or empty when the value is malformed or unknown
     */
    public Optional<Code> find(Object value) {
        MccDataSnapshot current = ensureLoaded();
        return MccCodes.tryNormalize(value).map(current::lookup);
    }

    /**
     * Alias of {@link #find(Object)}.
     */
    public Optional<Code> get(Object value) {
        return find(value);
    }

    /**
     * @throws CodeNotFoundException if no code matches
     */
    public Code findOrThrow(Object value) {
        return find(value).orElseThrow(() -> new CodeNotFoundException(value));
    }

    public boolean valid(Object value) {
        return find(value).isPresent();
    }

    public boolean exists(Object value) {
        return valid(value);
    }

    public int count() {
        return all().size();
    }

    /**
     * Conjunctive filter. Each condition value is matched against the attribute as:
     * <ul>
     *   <li>a {@link Pattern}: found anywhere in the stringified attribute (absent reads as "")</li>
     *   <li>a {@link Collection}: the attribute is one of its elements</li>
     *   <li>anything else: the attribute equals it</li>
     * </ul>
     * No conditions returns {@link #all()}.
     */
    public List<Code> where(Map<CodeAttribute, ?> conditions) {
        List<Code> codes = all();
        if (conditions == null || conditions.isEmpty()) {
            return codes;
        }

        return codes.stream()
            .filter(code -> conditions.entrySet().stream()
                .allMatch(condition -> conditionMatches(condition.getKey().valueOf(code), condition.getValue())))
            .collect(Collectors.toList());
    }

    /**
     * {@link #where(Map)} keyed by attribute names such as {@code "irs_reportable"}.
     *
     * @throws com.mccengine.common.exception.ConfigurationException on an unknown attribute name
     */
    public List<Code> whereAttributes(Map<String, ?> conditions) {
        if (conditions == null) {
            return where(null);
        }
        Map<CodeAttribute, Object> resolved = new LinkedHashMap<>();
        conditions.forEach((key, value) -> resolved.put(CodeAttribute.require(key), value));
        return where(resolved);
    }

    private static boolean conditionMatches(Object actual, Object expected) {
        if (expected instanceof Pattern) {
            String text = actual == null ? "" : actual.toString();
            return ((Pattern) expected).matcher(text).find();
        }
        if (expected instanceof Collection) {
            return ((Collection<?>) expected).stream().anyMatch(candidate -> Objects.equals(candidate, actual));
        }
        return Objects.equals(actual, expected);
    }

    /**
     * Codes inside the range whose name matches case-insensitively.
     */
    public List<Code> inRange(String rangeName) {
        MccDataSnapshot current = ensureLoaded();
        Optional<MccRange> range = findRange(current, rangeName);
        if (range.isEmpty()) {
            log.debug("No range named '{}'", rangeName);
            return List.of();
        }
        return current.codes().stream()
            .filter(code -> range.get().includes(code))
            .collect(Collectors.toList());
    }

    /**
     * Case-insensitive substring search over the code and every description and
     * identifier it carries. A blank query returns all codes.
     */
    public List<Code> search(String query) {
        List<Code> codes = all();
        if (query == null || query.isBlank()) {
            return codes;
        }

        String needle = query.toLowerCase(Locale.ROOT);
        return codes.stream()
            .filter(code -> searchableText(code).contains(needle))
            .collect(Collectors.toList());
    }

    private static String searchableText(Code code) {
        return Stream.of(
                code.getMcc(),
                code.getIsoDescription(),
                code.getUsdaDescription(),
                code.getStripeDescription(),
                code.getStripeCode(),
                code.getVisaDescription(),
                code.getVisaClearingName(),
                code.getMastercardDescription(),
                code.getAmexDescription(),
                code.getAlipayDescription(),
                code.getIrsDescription())
            .filter(Objects::nonNull)
            .collect(Collectors.joining(" "))
            .toLowerCase(Locale.ROOT);
    }

    /**
     * Codes belonging to the category, or an empty list for an unknown id.
     */
    public List<Code> inCategory(String categoryId) {
        MccDataSnapshot current = ensureLoaded();
        Optional<RiskCategory> category = findCategory(current, categoryId);
        if (category.isEmpty()) {
            log.debug("No category with id '{}'", categoryId);
            return List.of();
        }
        return current.codes().stream()
            .filter(code -> category.get().includes(code))
            .collect(Collectors.toList());
    }

    public List<Code> inCategory(RiskCategory category) {
        return inCategory(category.getId());
    }

    /**
     * Whether the category with this id contains the code. False for unknown ids.
     */
    public boolean isInCategory(String categoryId, Code code) {
        return findCategory(ensureLoaded(), categoryId)
            .map(category -> category.includes(code))
            .orElse(false);
    }

    public List<MccRange> ranges() {
        return ensureLoaded().ranges();
    }

    /**
     * Ranges callers should treat as eligible: reserved ranges are left out unless
     * the configuration includes them.
     */
    public List<MccRange> eligibleRanges() {
        List<MccRange> ranges = ranges();
        if (configuration.isIncludeReservedRanges()) {
            return ranges;
        }
        return ranges.stream().filter(range -> !range.isReserved()).collect(Collectors.toList());
    }

    public List<RiskCategory> categories() {
        return ensureLoaded().categories();
    }

    public Optional<MccRange> findRange(String rangeName) {
        return findRange(ensureLoaded(), rangeName);
    }

    public Optional<RiskCategory> findCategory(String categoryId) {
        return findCategory(ensureLoaded(), categoryId);
    }

    /**
     * @throws CategoryNotFoundException if no category has this id
     */
    public RiskCategory requireCategory(String categoryId) {
        return findCategory(categoryId).orElseThrow(() -> new CategoryNotFoundException(categoryId));
    }

    /**
     * The first range that contains the code.
     */
    public Optional<MccRange> rangeOf(Code code) {
        return ensureLoaded().ranges().stream()
            .filter(range -> range.includes(code))
            .findFirst();
    }

    public List<RiskCategory> categoriesOf(Code code) {
        return ensureLoaded().categories().stream()
            .filter(category -> category.includes(code))
            .collect(Collectors.toList());
    }

    public boolean isLoaded() {
        return snapshot.isLoaded();
    }

    /**
     * Load the data again from the data source and replace the current data in
     * one step.
     *
     * @throws DataLoadException if the source cannot be loaded; the previously
     *                           loaded data, if any, stays in place
     */
    public MccCollection reload() {
        loadLock.lock();
        try {
            snapshot = loadSnapshot(true);
        } finally {
            loadLock.unlock();
        }
        return this;
    }

    private MccDataSnapshot ensureLoaded() {
        MccDataSnapshot current = snapshot;
        if (current.isLoaded() && configuration.isCacheEnabled()) {
            return current;
        }

        loadLock.lock();
        try {
            current = snapshot;
            if (current.isLoaded() && configuration.isCacheEnabled()) {
                return current;
            }
            MccDataSnapshot loaded = loadSnapshot(!current.isLoaded());
            snapshot = loaded;
            return loaded;
        } finally {
            loadLock.unlock();
        }
    }

    /**
     * @param summaryAtInfo log the load summary at info; per-query reloads with
     *                      caching disabled log it at debug
     */
    private MccDataSnapshot loadSnapshot(boolean summaryAtInfo) {
        String dataPath = configuration.getDataPath();
        log.debug("Loading MCC data from {}", dataPath);

        List<Code> codes = loadCodes(dataPath);
        List<MccRange> ranges = loadRanges(dataPath);
        List<RiskCategory> categories = loadCategories(dataPath);

        String summary = "Loaded {} MCC codes, {} ranges and {} categories from {}";
        if (summaryAtInfo) {
            log.info(summary, codes.size(), ranges.size(), categories.size(), dataPath);
        } else {
            log.debug(summary, codes.size(), ranges.size(), categories.size(), dataPath);
        }

        return MccDataSnapshot.loaded(codes, ranges, categories);
    }

    private List<Code> loadCodes(String dataPath) {
        String source = loader.describe(dataPath, DataFile.CODES);
        try {
            List<CodeRecord> records = loader.loadCodes(dataPath);
            List<Code> codes = new ArrayList<>(records.size());
            Set<String> seen = new HashSet<>();
            for (CodeRecord record : records) {
                Code code = toCode(record);
                if (!seen.add(code.getMcc())) {
                    throw new IllegalStateException("Duplicate MCC code: " + code.getMcc());
                }
                codes.add(code);
            }
            return codes;
        } catch (Exception e) {
            throw new DataLoadException(source, e);
        }
    }

    private List<MccRange> loadRanges(String dataPath) {
        String source = loader.describe(dataPath, DataFile.RANGES);
        try {
            return loader.loadRanges(dataPath).stream()
                .map(MccCollection::toRange)
                .collect(Collectors.toList());
        } catch (Exception e) {
            throw new DataLoadException(source, e);
        }
    }

    private List<RiskCategory> loadCategories(String dataPath) {
        String source = loader.describe(dataPath, DataFile.CATEGORIES);
        try {
            Map<String, CategoryRecord> records = loader.loadCategories(dataPath);
            List<RiskCategory> categories = new ArrayList<>(records.size());
            Set<String> seen = new HashSet<>();
            for (Map.Entry<String, CategoryRecord> entry : records.entrySet()) {
                RiskCategory category = toCategory(entry.getKey(), entry.getValue());
                if (!seen.add(category.getId())) {
                    throw new IllegalStateException("Duplicate category id: " + category.getId());
                }
                categories.add(category);
            }
            return categories;
        } catch (Exception e) {
            throw new DataLoadException(source, e);
        }
    }

    private Code toCode(CodeRecord record) {
        return Code.builder()
            .mcc(record.getMcc())
            .isoDescription(record.getIsoDescription())
            .usdaDescription(record.getUsdaDescription())
            .stripeDescription(record.getStripeDescription())
            .stripeCode(record.getStripeCode())
            .visaDescription(record.getVisaDescription())
            .visaClearingName(record.getVisaClearingName())
            .mastercardDescription(record.getMastercardDescription())
            .amexDescription(record.getAmexDescription())
            .alipayDescription(record.getAlipayDescription())
            .irsDescription(record.getIrsDescription())
            .irsReportable(record.getIrsReportable())
            .owner(this)
            .build();
    }

    private static MccRange toRange(RangeRecord record) {
        return MccRange.builder()
            .start(record.getStart())
            .end(record.getEnd())
            .name(record.getName())
            .description(record.getDescription())
            .reserved(record.getReserved())
            .build();
    }

    private static RiskCategory toCategory(String id, CategoryRecord record) {
        return RiskCategory.builder()
            .id(id)
            .name(record.getName())
            .description(record.getDescription())
            .codes(record.getCodes())
            .build();
    }

    private static Optional<MccRange> findRange(MccDataSnapshot current, String rangeName) {
        if (rangeName == null) {
            return Optional.empty();
        }
        return current.ranges().stream()
            .filter(range -> range.getName().equalsIgnoreCase(rangeName))
            .findFirst();
    }

    private static Optional<RiskCategory> findCategory(MccDataSnapshot current, String categoryId) {
        String id = RiskCategory.normalizeId(categoryId);
        return current.categories().stream()
            .filter(category -> category.getId().equals(id))
            .findFirst();
    }
}
