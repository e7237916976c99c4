package com.mccengine.loader;

/**
 * The three record sets a data source provides.
 */
public enum DataFile {
    CODES("mcc_codes.json"),
    RANGES("ranges.json"),
    CATEGORIES("risk_categories.json");

    private final String fileName;

    DataFile(String fileName) {
        this.fileName = fileName;
    }

    public String getFileName() {
        return fileName;
    }
}
