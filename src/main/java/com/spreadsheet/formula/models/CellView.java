package com.spreadsheet.formula.models;

import com.spreadsheet.formula.value.EvalResult;

/**
 * JSON view of one cell: what was written, what it evaluates to and how it is displayed.
 * For example:
 * {
 *   "address": "A4",
 *   "rawInput": "=SUM(A1:A3)",
 *   "value": 60.0,
 *   "displayValue": "60",
 *   "type": "NUMBER",
 *   "state": "CLEAN"
 * }
 */
public class CellView {
    private final String address;
    private final String rawInput;
    private final Object value;
    private final String displayValue;
    private final String type;
    private final CellState state;

    public CellView(String address, String rawInput, EvalResult value, CellState state) {
        this.address = address;
        this.rawInput = rawInput;
        this.value = value.toJavaValue();
        this.displayValue = value.toDisplayString();
        this.type = value.getType().name();
        this.state = state;
    }

    public String getAddress() {
        return address;
    }
    public String getRawInput() {
        return rawInput;
    }
    public Object getValue() {
        return value;
    }
    public String getDisplayValue() {
        return displayValue;
    }
    public String getType() {
        return type;
    }
    public CellState getState() {
        return state;
    }
}
