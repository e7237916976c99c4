package com.mccengine.api.serializer;

import com.mccengine.categories.RiskCategory;
import com.mccengine.codes.Code;
import com.mccengine.ranges.MccRange;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builds the JSON shapes returned by the REST API.
 *
 * The compact code shape carries the resolved description, the Stripe code and
 * the reportable flag; per-source descriptions, categories and range are
 * switched by {@link SerializationOptions}.
 */
@Component
public class MccSerializer {

    public Map<String, Object> serializeCode(Code code) {
        return serializeCode(code, SerializationOptions.defaults());
    }

    public Map<String, Object> serializeCode(Code code, SerializationOptions options) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("mcc", code.getMcc());
        result.put("description", code.description());
        result.put("stripe_code", code.getStripeCode());
        result.put("irs_reportable", code.isIrsReportable());

        if (options.isIncludeAllDescriptions()) {
            result.put("iso_description", code.getIsoDescription());
            result.put("usda_description", code.getUsdaDescription());
            result.put("stripe_description", code.getStripeDescription());
            result.put("visa_description", code.getVisaDescription());
            result.put("visa_clearing_name", code.getVisaClearingName());
            result.put("mastercard_description", code.getMastercardDescription());
            result.put("amex_description", code.getAmexDescription());
            result.put("alipay_description", code.getAlipayDescription());
            result.put("irs_description", code.getIrsDescription());
        }
        if (options.isIncludeCategories()) {
            result.put("categories", code.categories().stream()
                .map(RiskCategory::getId)
                .collect(Collectors.toList()));
        }
        if (options.isIncludeRange()) {
            result.put("range", code.range().map(MccRange::getName).orElse(null));
        }
        return result;
    }

    public List<Map<String, Object>> serializeCollection(List<Code> codes, SerializationOptions options) {
        return codes.stream()
            .map(code -> serializeCode(code, options))
            .collect(Collectors.toList());
    }

    public Map<String, Object> serializeCategory(RiskCategory category, boolean includeCodes) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("id", category.getId());
        result.put("name", category.getName());
        result.put("description", category.getDescription());
        if (includeCodes) {
            result.put("codes", category.getCodes());
        }
        return result;
    }

    public Map<String, Object> serializeRange(MccRange range) {
        return range.toRecord();
    }
}
