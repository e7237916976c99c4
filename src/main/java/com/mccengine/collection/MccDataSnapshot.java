package com.mccengine.collection;

import com.mccengine.categories.RiskCategory;
import com.mccengine.codes.Code;
import com.mccengine.ranges.MccRange;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * One complete, immutable load of the dataset.
 *
 * The collection swaps whole snapshots, so a reader holding a reference always
 * sees codes, ranges, categories and index from the same load. The index is
 * built on first lookup and is derived solely from this snapshot's code list.
 */
final class MccDataSnapshot {

    static final MccDataSnapshot EMPTY = new MccDataSnapshot(
        Collections.emptyList(), Collections.emptyList(), Collections.emptyList(), false);

    private final List<Code> codes;
    private final List<MccRange> ranges;
    private final List<RiskCategory> categories;
    private final boolean loaded;

    // Built on first lookup; concurrent builds yield equal maps.
    private volatile Map<String, Code> index;

    private MccDataSnapshot(List<Code> codes, List<MccRange> ranges, List<RiskCategory> categories,
                            boolean loaded) {
        this.codes = codes;
        this.ranges = ranges;
        this.categories = categories;
        this.loaded = loaded;
    }

    static MccDataSnapshot loaded(List<Code> codes, List<MccRange> ranges, List<RiskCategory> categories) {
        return new MccDataSnapshot(
            List.copyOf(codes),
            List.copyOf(ranges),
            List.copyOf(categories),
            true);
    }

    List<Code> codes() {
        return codes;
    }

    List<MccRange> ranges() {
        return ranges;
    }

    List<RiskCategory> categories() {
        return categories;
    }

    boolean isLoaded() {
        return loaded;
    }

    boolean isIndexed() {
        return index != null;
    }

    Code lookup(String normalizedCode) {
        Map<String, Code> current = index;
        if (current == null) {
            current = buildIndex();
            index = current;
        }
        return current.get(normalizedCode);
    }

    private Map<String, Code> buildIndex() {
        Map<String, Code> built = new HashMap<>(codes.size() * 2);
        for (Code code : codes) {
            built.put(code.getMcc(), code);
        }
        return Collections.unmodifiableMap(built);
    }
}
