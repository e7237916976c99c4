package com.mccengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the MCC Engine.
 *
 * MCC Engine is a reference-data service for Merchant Category Codes: it
 * aggregates descriptions from ISO 18245, USDA, the card networks and the IRS,
 * groups codes into ISO ranges and risk categories, and validates candidate
 * codes for payment data-entry pipelines.
 */
@SpringBootApplication
public class MccEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(MccEngineApplication.class, args);
    }
}
