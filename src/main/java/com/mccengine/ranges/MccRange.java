package com.mccengine.ranges;

import com.mccengine.common.MccCodes;
import com.mccengine.common.exception.InvalidRangeException;
import lombok.Builder;
import lombok.Getter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An ISO 18245 range: a closed interval of MCCs sharing an industry segment.
 *
 * Both boundaries are stored zero-padded, so string comparison and numeric
 * comparison agree. Equality is defined by the boundaries only.
 */
@Getter
public final class MccRange {

    private final String startCode;

    private final String endCode;

    private final String name;

    private final String description;

    private final boolean reserved;

    @Builder
    private MccRange(Object start, Object end, String name, String description, Boolean reserved) {
        this.startCode = MccCodes.normalize(start);
        this.endCode = MccCodes.normalize(end);
        this.name = name == null ? "" : name;
        this.description = description == null ? "" : description;
        this.reserved = Boolean.TRUE.equals(reserved);

        if (startCode.compareTo(endCode) > 0) {
            throw new InvalidRangeException(startCode, endCode);
        }
    }

    public static MccRange of(Object start, Object end, String name) {
        return builder().start(start).end(end).name(name).build();
    }

    /**
     * Whether the value (String, Number or Code) falls inside this range.
     * Values that cannot be normalized are never included.
     */
    public boolean includes(Object value) {
        return MccCodes.tryNormalize(value)
            .map(this::covers)
            .orElse(false);
    }

    private boolean covers(String normalized) {
        return normalized.compareTo(startCode) >= 0 && normalized.compareTo(endCode) <= 0;
    }

    public int size() {
        return Integer.parseInt(endCode) - Integer.parseInt(startCode) + 1;
    }

    /**
     * Every code in the range, start to end. Each call builds a fresh list.
     */
    public List<String> enumerate() {
        int start = Integer.parseInt(startCode);
        int end = Integer.parseInt(endCode);
        List<String> codes = new ArrayList<>(end - start + 1);
        for (int code = start; code <= end; code++) {
            codes.add(MccCodes.pad(code));
        }
        return codes;
    }

    public Map<String, Object> toRecord() {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("start_code", startCode);
        record.put("end_code", endCode);
        record.put("name", name);
        record.put("description", description);
        record.put("reserved", reserved);
        return record;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof MccRange)) {
            return false;
        }
        MccRange range = (MccRange) other;
        return startCode.equals(range.startCode) && endCode.equals(range.endCode);
    }

    @Override
    public int hashCode() {
        return 31 * startCode.hashCode() + endCode.hashCode();
    }

    @Override
    public String toString() {
        return startCode + "-" + endCode;
    }
}
