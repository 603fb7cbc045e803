package com.spreadsheet.formula.address;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A rectangular block of cells on one sheet.
 * Always normalized: start is the top-left corner, end the bottom-right one,
 * whatever order the corners were written in.
 */
public final class CellRange {

    private final CellAddress start;
    private final CellAddress end;

    private CellRange(CellAddress start, CellAddress end) {
        this.start = start;
        this.end = end;
    }

    /**
     * Builds a normalized range from two corners. The sheet of the first corner wins
     * when the second one doesn't name a sheet.
     */
    public static CellRange of(CellAddress first, CellAddress second) {
        String sheet = first.getSheet() != null ? first.getSheet() : second.getSheet();

        boolean firstIsLeft = first.getColumn() <= second.getColumn();
        boolean firstIsTop = first.getRow() <= second.getRow();
        CellAddress left = firstIsLeft ? first : second;
        CellAddress right = firstIsLeft ? second : first;
        CellAddress top = firstIsTop ? first : second;
        CellAddress bottom = firstIsTop ? second : first;

        CellAddress normalizedStart = new CellAddress(sheet, left.getColumn(), top.getRow(),
                left.isColumnAbsolute(), top.isRowAbsolute());
        CellAddress normalizedEnd = new CellAddress(sheet, right.getColumn(), bottom.getRow(),
                right.isColumnAbsolute(), bottom.isRowAbsolute());
        return new CellRange(normalizedStart, normalizedEnd);
    }

    public static CellRange of(CellAddress single) {
        return new CellRange(single, single);
    }

    /**
     * Parses "A1:B10", "Sheet1!A1:B10" or a bare "C3" (start == end).
     * Both corners must be on the same sheet.
     */
    public static Optional<CellRange> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String trimmed = text.trim();
        int colon = trimmed.lastIndexOf(':');
        if (colon < 0) {
            return CellAddress.parse(trimmed).map(CellRange::of);
        }
        Optional<CellAddress> first = CellAddress.parse(trimmed.substring(0, colon));
        Optional<CellAddress> second = CellAddress.parse(trimmed.substring(colon + 1));
        if (first.isEmpty() || second.isEmpty()) {
            return Optional.empty();
        }
        String firstSheet = first.get().getSheet();
        String secondSheet = second.get().getSheet();
        if (secondSheet != null && !secondSheet.equals(firstSheet)) {
            return Optional.empty();
        }
        return Optional.of(of(first.get(), second.get()));
    }

    public String format() {
        if (start.equals(end)) {
            return start.format();
        }
        // The sheet prefix is written once, in front of the first corner
        CellAddress bareEnd = new CellAddress(null, end.getColumn(), end.getRow(),
                end.isColumnAbsolute(), end.isRowAbsolute());
        return start.format() + ":" + bareEnd.format();
    }

    public CellRange inSheet(String sheetName) {
        if (start.getSheet() != null || sheetName == null) {
            return this;
        }
        return new CellRange(start.inSheet(sheetName), end.inSheet(sheetName));
    }

    public String getSheet() {
        return start.getSheet();
    }
    public CellAddress getStart() {
        return start;
    }
    public CellAddress getEnd() {
        return end;
    }

    public int getRowCount() {
        return end.getRow() - start.getRow() + 1;
    }

    public int getColumnCount() {
        return end.getColumn() - start.getColumn() + 1;
    }

    public long cellCount() {
        return (long) getRowCount() * getColumnCount();
    }

    /**
     * Every position in the range, row-major, without '$' anchors.
     */
    public List<CellAddress> addresses() {
        List<CellAddress> result = new ArrayList<>((int) Math.min(cellCount(), Integer.MAX_VALUE));
        for (int r = start.getRow(); r <= end.getRow(); r++) {
            for (int c = start.getColumn(); c <= end.getColumn(); c++) {
                result.add(CellAddress.of(getSheet(), c, r));
            }
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellRange)) {
            return false;
        }
        CellRange other = (CellRange) o;
        return start.equals(other.start) && end.equals(other.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return format();
    }
}
