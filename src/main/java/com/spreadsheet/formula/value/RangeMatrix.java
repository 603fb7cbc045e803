package com.spreadsheet.formula.value;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A row-major block of scalar values resolved from a range reference.
 * Cells never hold nested matrices.
 */
public final class RangeMatrix {

    private final int rows;
    private final int columns;
    private final EvalResult[] values;

    public RangeMatrix(int rows, int columns, EvalResult[] values) {
        if (rows < 1 || columns < 1 || values.length != rows * columns) {
            throw new IllegalArgumentException("Bad matrix shape " + rows + "x" + columns
                    + " for " + values.length + " values");
        }
        for (EvalResult value : values) {
            if (value == null || value.isMatrix()) {
                throw new IllegalArgumentException("Matrix cells must be non-null scalars");
            }
        }
        this.rows = rows;
        this.columns = columns;
        this.values = values.clone();
    }

    public static RangeMatrix single(EvalResult value) {
        return new RangeMatrix(1, 1, new EvalResult[]{value});
    }

    public int getRows() {
        return rows;
    }

    public int getColumns() {
        return columns;
    }

    public int size() {
        return values.length;
    }

    /**
     * 0-based access.
     */
    public EvalResult get(int row, int column) {
        if (row < 0 || row >= rows || column < 0 || column >= columns) {
            throw new IndexOutOfBoundsException("(" + row + "," + column + ") outside " + rows + "x" + columns);
        }
        return values[row * columns + column];
    }

    public List<EvalResult> row(int row) {
        List<EvalResult> result = new ArrayList<>(columns);
        for (int c = 0; c < columns; c++) {
            result.add(get(row, c));
        }
        return result;
    }

    public List<EvalResult> column(int column) {
        List<EvalResult> result = new ArrayList<>(rows);
        for (int r = 0; r < rows; r++) {
            result.add(get(r, column));
        }
        return result;
    }

    /**
     * All values, row-major.
     */
    public List<EvalResult> flatten() {
        return Collections.unmodifiableList(Arrays.asList(values));
    }

    public boolean sameShape(RangeMatrix other) {
        return rows == other.rows && columns == other.columns;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RangeMatrix)) {
            return false;
        }
        RangeMatrix other = (RangeMatrix) o;
        return rows == other.rows && columns == other.columns && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * rows + columns) + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        for (int r = 0; r < rows; r++) {
            if (r > 0) {
                sb.append(';');
            }
            for (int c = 0; c < columns; c++) {
                if (c > 0) {
                    sb.append(',');
                }
                sb.append(get(r, c));
            }
        }
        return sb.append('}').toString();
    }
}
