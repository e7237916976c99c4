package com.mccengine.codes;

import com.mccengine.categories.RiskCategory;
import com.mccengine.collection.MccCollection;
import com.mccengine.common.MccCodes;
import com.mccengine.ranges.MccRange;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A single Merchant Category Code with its descriptions from every source.
 *
 * Codes are immutable. Identity is the normalized 4-digit {@code mcc}; two codes
 * are equal when their codes match regardless of descriptions. A code built by an
 * {@link MccCollection} keeps a reference to it so that {@link #range()} and
 * {@link #categories()} can be resolved against the currently loaded data.
 */
@Getter
public final class Code {

    private final String mcc;

    /**
     * Official ISO 18245 description.
     */
    private final String isoDescription;

    private final String usdaDescription;

    private final String stripeDescription;

    /**
     * Stripe's snake_case identifier, e.g. {@code grocery_stores_supermarkets}.
     */
    private final String stripeCode;

    private final String visaDescription;

    /**
     * Visa's abbreviated clearing name.
     */
    private final String visaClearingName;

    private final String mastercardDescription;

    private final String amexDescription;

    private final String alipayDescription;

    private final String irsDescription;

    /**
     * Whether transactions are reportable under IRS 6050W. Null when the source is silent.
     */
    private final Boolean irsReportable;

    @Getter(AccessLevel.NONE)
    private final MccCollection owner;

    @Builder
    private Code(Object mcc, String isoDescription, String usdaDescription, String stripeDescription,
                 String stripeCode, String visaDescription, String visaClearingName,
                 String mastercardDescription, String amexDescription, String alipayDescription,
                 String irsDescription, Boolean irsReportable, MccCollection owner) {
        this.mcc = MccCodes.normalize(mcc);
        this.isoDescription = presence(isoDescription);
        this.usdaDescription = presence(usdaDescription);
        this.stripeDescription = presence(stripeDescription);
        this.stripeCode = presence(stripeCode);
        this.visaDescription = presence(visaDescription);
        this.visaClearingName = presence(visaClearingName);
        this.mastercardDescription = presence(mastercardDescription);
        this.amexDescription = presence(amexDescription);
        this.alipayDescription = presence(alipayDescription);
        this.irsDescription = presence(irsDescription);
        this.irsReportable = irsReportable;
        this.owner = owner;
    }

    /**
     * True only when the source explicitly flags the code as reportable.
     */
    public boolean isIrsReportable() {
        return Boolean.TRUE.equals(irsReportable);
    }

    /**
     * Description from the configured default source, falling back through the others.
     */
    public String description() {
        return description(defaultSource());
    }

    /**
     * Description from the given source. When that source has nothing, every source
     * is tried in {@link DescriptionSource} order and the first present one wins.
     *
     * @return the description, or null when no source has one
     */
    public String description(DescriptionSource source) {
        if (source != null) {
            String preferred = source.descriptionOf(this);
            if (preferred != null) {
                return preferred;
            }
        }
        for (DescriptionSource fallback : DescriptionSource.values()) {
            String description = fallback.descriptionOf(this);
            if (description != null) {
                return description;
            }
        }
        return null;
    }

    /**
     * The ISO 18245 range containing this code.
     */
    public Optional<MccRange> range() {
        return owner == null ? Optional.empty() : owner.rangeOf(this);
    }

    public List<RiskCategory> categories() {
        return owner == null ? Collections.emptyList() : owner.categoriesOf(this);
    }

    public boolean inCategory(RiskCategory category) {
        return category != null && inCategory(category.getId());
    }

    public boolean inCategory(String categoryId) {
        if (owner == null || categoryId == null) {
            return false;
        }
        return owner.isInCategory(categoryId, this);
    }

    /**
     * Compare against a raw value (String, Number or Code) after normalization.
     */
    public boolean matches(Object value) {
        if (value instanceof Code) {
            return equals(value);
        }
        return MccCodes.tryNormalize(value).map(mcc::equals).orElse(false);
    }

    public int toInt() {
        return Integer.parseInt(mcc);
    }

    /**
     * Every stored field, absent ones included as null.
     */
    public Map<String, Object> toRecord() {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("mcc", mcc);
        record.put("iso_description", isoDescription);
        record.put("usda_description", usdaDescription);
        record.put("stripe_description", stripeDescription);
        record.put("stripe_code", stripeCode);
        record.put("visa_description", visaDescription);
        record.put("visa_clearing_name", visaClearingName);
        record.put("mastercard_description", mastercardDescription);
        record.put("amex_description", amexDescription);
        record.put("alipay_description", alipayDescription);
        record.put("irs_description", irsDescription);
        record.put("irs_reportable", irsReportable);
        return record;
    }

    /**
     * {@link #toRecord()} plus the resolved description, category ids and range name.
     */
    public Map<String, Object> toPublicView() {
        Map<String, Object> view = toRecord();
        view.put("description", description());
        view.put("categories", categories().stream().map(RiskCategory::getId).collect(Collectors.toList()));
        view.put("range", range().map(MccRange::getName).orElse(null));
        return view;
    }

    private DescriptionSource defaultSource() {
        return owner == null ? DescriptionSource.ISO : owner.getConfiguration().getDefaultDescriptionSource();
    }

    private static String presence(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Code)) {
            return false;
        }
        return mcc.equals(((Code) other).mcc);
    }

    @Override
    public int hashCode() {
        return mcc.hashCode();
    }

    @Override
    public String toString() {
        return mcc;
    }
}
