package com.mccengine.loader;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Raw code fields as supplied by a data source.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CodeRecord {

    private String mcc;
    private String isoDescription;
    private String usdaDescription;
    private String stripeDescription;
    private String stripeCode;
    private String visaDescription;
    private String visaClearingName;
    private String mastercardDescription;
    private String amexDescription;
    private String alipayDescription;
    private String irsDescription;
    private Boolean irsReportable;
}
