package com.mccengine.categories;

import com.mccengine.common.MccCodes;
import lombok.Builder;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * A named risk category: an arbitrary set of MCCs used for business-policy checks
 * such as blocking gambling or allowing only healthcare spend.
 *
 * Entries are either single codes ({@code "7995"}) or inclusive ranges
 * ({@code "3000-3350"}). Unlike {@link com.mccengine.ranges.MccRange} a category
 * need not be contiguous and its members can overlap other categories.
 */
@Getter
public final class RiskCategory {

    private static final String RANGE_SEPARATOR = "-";

    private final String id;

    private final String name;

    private final String description;

    /**
     * Entries as stored: 4-digit codes or "start-end" range strings.
     */
    private final List<String> codes;

    @Builder
    private RiskCategory(String id, String name, String description, List<?> codes) {
        this.id = normalizeId(id);
        this.name = name == null ? "" : name;
        this.description = description == null ? "" : description;
        this.codes = normalizeEntries(codes);
    }

    /**
     * Normalize a category identifier to the form used for lookups.
     */
    public static String normalizeId(String id) {
        return id == null ? "" : id.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Whether the value (String, Number or Code) is covered by any entry.
     */
    public boolean includes(Object value) {
        Optional<String> normalized = MccCodes.tryNormalize(value);
        if (normalized.isEmpty()) {
            return false;
        }
        String code = normalized.get();
        for (String entry : codes) {
            if (entryCovers(entry, code)) {
                return true;
            }
        }
        return false;
    }

    private static boolean entryCovers(String entry, String code) {
        if (entry.contains(RANGE_SEPARATOR)) {
            String[] bounds = entry.split(RANGE_SEPARATOR, 2);
            String start = MccCodes.pad(bounds[0]);
            String end = MccCodes.pad(bounds[1]);
            return code.compareTo(start) >= 0 && code.compareTo(end) <= 0;
        }
        return MccCodes.pad(entry).equals(code);
    }

    private static List<String> normalizeEntries(List<?> entries) {
        if (entries == null) {
            return Collections.emptyList();
        }
        List<String> normalized = new ArrayList<>(entries.size());
        for (Object entry : entries) {
            if (entry == null) {
                continue;
            }
            normalized.add(entry instanceof Number ? MccCodes.pad(entry) : entry.toString().trim());
        }
        return Collections.unmodifiableList(normalized);
    }

    public Map<String, Object> toRecord() {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("id", id);
        record.put("name", name);
        record.put("description", description);
        record.put("codes", codes);
        return record;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof RiskCategory)) {
            return false;
        }
        return id.equals(((RiskCategory) other).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
