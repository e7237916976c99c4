package com.mccengine.codes;

import com.mccengine.common.exception.ConfigurationException;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Sources a code description can come from.
 *
 * Declaration order is the fallback order used by {@link Code#description(DescriptionSource)}.
 */
public enum DescriptionSource {
    ISO(Code::getIsoDescription),
    USDA(Code::getUsdaDescription),
    STRIPE(Code::getStripeDescription),
    VISA(Code::getVisaDescription),
    MASTERCARD(Code::getMastercardDescription),
    AMEX(Code::getAmexDescription),
    ALIPAY(Code::getAlipayDescription),
    IRS(Code::getIrsDescription);

    private final Function<Code, String> accessor;

    DescriptionSource(Function<Code, String> accessor) {
        this.accessor = accessor;
    }

    String descriptionOf(Code code) {
        return accessor.apply(code);
    }

    /**
     * Identifier used in configuration, e.g. {@code iso} or {@code mastercard}.
     */
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<DescriptionSource> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String normalized = id.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(source -> source.name().equals(normalized))
            .findFirst();
    }

    /**
     * Resolve a configured identifier.
     *
     * @throws ConfigurationException if the identifier is not a known source
     */
    public static DescriptionSource require(String id) {
        return fromId(id).orElseThrow(() -> new ConfigurationException(
            "default_description_source must be one of: " + supportedIds()));
    }

    public static String supportedIds() {
        return Arrays.stream(values()).map(DescriptionSource::id).collect(Collectors.joining(", "));
    }
}
