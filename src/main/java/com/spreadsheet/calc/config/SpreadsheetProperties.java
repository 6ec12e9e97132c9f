package com.spreadsheet.calc.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings under the "spreadsheet" prefix in application.properties.
 * Field initializers are the defaults when a key is absent.
 */
@ConfigurationProperties(prefix = "spreadsheet")
public class SpreadsheetProperties {

    // Size of a sheet created without explicit dimensions
    private int defaultRows = 100;
    private int defaultCols = 100;

    // Undo entries kept per sheet
    private int historyLimit = 100;

    // Length of one SLEEP unit; zero turns SLEEP into a no-op
    private Duration sleepUnit = Duration.ofSeconds(1);

    public int getDefaultRows() {
        return defaultRows;
    }

    public void setDefaultRows(int defaultRows) {
        this.defaultRows = defaultRows;
    }

    public int getDefaultCols() {
        return defaultCols;
    }

    public void setDefaultCols(int defaultCols) {
        this.defaultCols = defaultCols;
    }

    public int getHistoryLimit() {
        return historyLimit;
    }

    public void setHistoryLimit(int historyLimit) {
        this.historyLimit = historyLimit;
    }

    public Duration getSleepUnit() {
        return sleepUnit;
    }

    public void setSleepUnit(Duration sleepUnit) {
        this.sleepUnit = sleepUnit;
    }
}
