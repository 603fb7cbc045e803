package com.spreadsheet.formula.engine;

import java.time.Clock;

/**
 * Per-workbook engine settings.
 */
public class EngineSettings {

    public static final long DEFAULT_MAX_RANGE_CELLS = 100_000;

    private CalculationMode calculationMode = CalculationMode.AUTOMATIC;
    private long maxRangeCells = DEFAULT_MAX_RANGE_CELLS;
    private ClearedReferencePolicy clearedReferencePolicy = ClearedReferencePolicy.INVALID_REFERENCE;
    private Clock clock = Clock.systemDefaultZone();

    public static EngineSettings defaults() {
        return new EngineSettings();
    }

    public CalculationMode getCalculationMode() {
        return calculationMode;
    }

    public EngineSettings setCalculationMode(CalculationMode calculationMode) {
        this.calculationMode = calculationMode;
        return this;
    }

    public long getMaxRangeCells() {
        return maxRangeCells;
    }

    public EngineSettings setMaxRangeCells(long maxRangeCells) {
        if (maxRangeCells < 1) {
            throw new IllegalArgumentException("maxRangeCells must be positive: " + maxRangeCells);
        }
        this.maxRangeCells = maxRangeCells;
        return this;
    }

    public ClearedReferencePolicy getClearedReferencePolicy() {
        return clearedReferencePolicy;
    }

    public EngineSettings setClearedReferencePolicy(ClearedReferencePolicy clearedReferencePolicy) {
        this.clearedReferencePolicy = clearedReferencePolicy;
        return this;
    }

    public Clock getClock() {
        return clock;
    }

    public EngineSettings setClock(Clock clock) {
        this.clock = clock;
        return this;
    }
}
