package com.spreadsheet.formula.config;

import com.spreadsheet.formula.engine.CalculationMode;
import com.spreadsheet.formula.engine.ClearedReferencePolicy;
import com.spreadsheet.formula.engine.EngineSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Engine settings bound from the "formula.*" properties.
 */
@ConfigurationProperties(prefix = "formula")
public class FormulaProperties {

    private CalculationMode calculationMode = CalculationMode.AUTOMATIC;
    private long maxRangeCells = EngineSettings.DEFAULT_MAX_RANGE_CELLS;
    private ClearedReferencePolicy clearedReferencePolicy = ClearedReferencePolicy.INVALID_REFERENCE;
    private String defaultSheetName = "Sheet1";
    // Zone TODAY() and NOW() are evaluated in; empty means the system default
    private String timeZone = "";

    public CalculationMode getCalculationMode() {
        return calculationMode;
    }

    public void setCalculationMode(CalculationMode calculationMode) {
        this.calculationMode = calculationMode;
    }

    public long getMaxRangeCells() {
        return maxRangeCells;
    }

    public void setMaxRangeCells(long maxRangeCells) {
        this.maxRangeCells = maxRangeCells;
    }

    public ClearedReferencePolicy getClearedReferencePolicy() {
        return clearedReferencePolicy;
    }

    public void setClearedReferencePolicy(ClearedReferencePolicy clearedReferencePolicy) {
        this.clearedReferencePolicy = clearedReferencePolicy;
    }

    public String getDefaultSheetName() {
        return defaultSheetName;
    }

    public void setDefaultSheetName(String defaultSheetName) {
        this.defaultSheetName = defaultSheetName;
    }

    public String getTimeZone() {
        return timeZone;
    }

    public void setTimeZone(String timeZone) {
        this.timeZone = timeZone;
    }
}
