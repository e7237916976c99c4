package com.mccengine.codes;

import com.mccengine.common.exception.ConfigurationException;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Attributes of a {@link Code} that can be used as filter keys.
 *
 * Keys are the snake_case field names used by the data files.
 */
public enum CodeAttribute {
    MCC("mcc", Code::getMcc),
    ISO_DESCRIPTION("iso_description", Code::getIsoDescription),
    USDA_DESCRIPTION("usda_description", Code::getUsdaDescription),
    STRIPE_DESCRIPTION("stripe_description", Code::getStripeDescription),
    STRIPE_CODE("stripe_code", Code::getStripeCode),
    VISA_DESCRIPTION("visa_description", Code::getVisaDescription),
    VISA_CLEARING_NAME("visa_clearing_name", Code::getVisaClearingName),
    MASTERCARD_DESCRIPTION("mastercard_description", Code::getMastercardDescription),
    AMEX_DESCRIPTION("amex_description", Code::getAmexDescription),
    ALIPAY_DESCRIPTION("alipay_description", Code::getAlipayDescription),
    IRS_DESCRIPTION("irs_description", Code::getIrsDescription),
    IRS_REPORTABLE("irs_reportable", Code::getIrsReportable),
    DESCRIPTION("description", Code::description);

    private final String key;
    private final Function<Code, Object> accessor;

    CodeAttribute(String key, Function<Code, Object> accessor) {
        this.key = key;
        this.accessor = accessor;
    }

    public String getKey() {
        return key;
    }

    public Object valueOf(Code code) {
        return accessor.apply(code);
    }

    public static Optional<CodeAttribute> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(attribute -> attribute.key.equals(normalized))
            .findFirst();
    }

    /**
     * @throws ConfigurationException if the key does not name a filterable attribute
     */
    public static CodeAttribute require(String key) {
        return fromKey(key).orElseThrow(() -> new ConfigurationException(
            String.format("Unknown code attribute '%s'. Supported attributes: %s", key,
                Arrays.stream(values()).map(CodeAttribute::getKey).collect(Collectors.joining(", ")))));
    }
}
