package com.spreadsheet.formula.address;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * An A1-style cell reference:
 * - optional sheet name (null means "the sheet the formula lives in")
 * - 1-based column and row
 * - '$' anchors on column and/or row
 *
 * Instances are immutable. Equality covers every field, so "A1" and "$A$1"
 * are different references to the same position; use {@link #toPosition()}
 * when only the position matters (e.g. as a dependency graph key).
 */
public final class CellAddress {

    public static final int MAX_COLUMN = 26 + 26 * 26 + 26 * 26 * 26; // "ZZZ"

    // [sheet!] [$] letters [$] digits
    private static final Pattern CELL_PATTERN = Pattern.compile("^(\\$?)([A-Za-z]{1,3})(\\$?)([0-9]+)$");
    private static final Pattern PLAIN_SHEET_NAME = Pattern.compile("^[A-Za-z_][A-Za-z0-9_.]*$");

    private final String sheet;
    private final int column;
    private final int row;
    private final boolean columnAbsolute;
    private final boolean rowAbsolute;

    public CellAddress(String sheet, int column, int row, boolean columnAbsolute, boolean rowAbsolute) {
        if (column < 1 || column > MAX_COLUMN) {
            throw new IllegalArgumentException("Column out of range: " + column);
        }
        if (row < 1) {
            throw new IllegalArgumentException("Row out of range: " + row);
        }
        this.sheet = sheet;
        this.column = column;
        this.row = row;
        this.columnAbsolute = columnAbsolute;
        this.rowAbsolute = rowAbsolute;
    }

    public static CellAddress of(int column, int row) {
        return new CellAddress(null, column, row, false, false);
    }

    public static CellAddress of(String sheet, int column, int row) {
        return new CellAddress(sheet, column, row, false, false);
    }

    /**
     * Parses "A1", "$B$10", "Sheet2!C3" or "'My Sheet'!C3".
     * Returns empty for anything malformed (the caller reports it as an invalid reference).
     */
    public static Optional<CellAddress> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }

        String sheet = null;
        String cellPart = trimmed;
        int bang = trimmed.lastIndexOf('!');
        if (bang >= 0) {
            Optional<String> parsedSheet = parseSheetName(trimmed.substring(0, bang));
            if (parsedSheet.isEmpty()) {
                return Optional.empty();
            }
            sheet = parsedSheet.get();
            cellPart = trimmed.substring(bang + 1);
        }

        Matcher matcher = CELL_PATTERN.matcher(cellPart);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        int column = columnIndex(matcher.group(2));
        int row;
        try {
            row = Integer.parseInt(matcher.group(4));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
        if (row < 1) {
            return Optional.empty();
        }
        return Optional.of(new CellAddress(sheet, column, row,
                !matcher.group(1).isEmpty(), !matcher.group(3).isEmpty()));
    }

    /**
     * Accepts a plain sheet name or a single-quoted one where '' stands for a quote.
     */
    static Optional<String> parseSheetName(String text) {
        if (text.length() >= 2 && text.startsWith("'") && text.endsWith("'")) {
            String inner = text.substring(1, text.length() - 1);
            if (inner.isEmpty() || inner.replace("''", "").contains("'")) {
                return Optional.empty();
            }
            return Optional.of(inner.replace("''", "'"));
        }
        if (PLAIN_SHEET_NAME.matcher(text).matches()) {
            return Optional.of(text);
        }
        return Optional.empty();
    }

    static String formatSheetName(String sheet) {
        if (PLAIN_SHEET_NAME.matcher(sheet).matches()) {
            return sheet;
        }
        return "'" + sheet.replace("'", "''") + "'";
    }

    /**
     * "A" -> 1, "Z" -> 26, "AA" -> 27 (case-insensitive).
     */
    public static int columnIndex(String letters) {
        int result = 0;
        for (int i = 0; i < letters.length(); i++) {
            char c = Character.toUpperCase(letters.charAt(i));
            if (c < 'A' || c > 'Z') {
                throw new IllegalArgumentException("Not a column name: " + letters);
            }
            result = result * 26 + (c - 'A' + 1);
        }
        return result;
    }

    /**
     * 1 -> "A", 27 -> "AA".
     */
    public static String columnName(int column) {
        StringBuilder sb = new StringBuilder();
        int remaining = column;
        while (remaining > 0) {
            int digit = (remaining - 1) % 26;
            sb.append((char) ('A' + digit));
            remaining = (remaining - 1) / 26;
        }
        return sb.reverse().toString();
    }

    public String format() {
        StringBuilder sb = new StringBuilder();
        if (sheet != null) {
            sb.append(formatSheetName(sheet)).append('!');
        }
        if (columnAbsolute) {
            sb.append('$');
        }
        sb.append(columnName(column));
        if (rowAbsolute) {
            sb.append('$');
        }
        sb.append(row);
        return sb.toString();
    }

    /**
     * Fills in the sheet when this reference doesn't name one.
     */
    public CellAddress inSheet(String sheetName) {
        if (sheet != null || sheetName == null) {
            return this;
        }
        return new CellAddress(sheetName, column, row, columnAbsolute, rowAbsolute);
    }

    /**
     * Same sheet, column and row without '$' anchors.
     */
    public CellAddress toPosition() {
        if (!columnAbsolute && !rowAbsolute) {
            return this;
        }
        return new CellAddress(sheet, column, row, false, false);
    }

    public String getSheet() {
        return sheet;
    }
    public int getColumn() {
        return column;
    }
    public int getRow() {
        return row;
    }
    public boolean isColumnAbsolute() {
        return columnAbsolute;
    }
    public boolean isRowAbsolute() {
        return rowAbsolute;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellAddress)) {
            return false;
        }
        CellAddress other = (CellAddress) o;
        return column == other.column
                && row == other.row
                && columnAbsolute == other.columnAbsolute
                && rowAbsolute == other.rowAbsolute
                && Objects.equals(sheet, other.sheet);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sheet, column, row, columnAbsolute, rowAbsolute);
    }

    @Override
    public String toString() {
        return format();
    }
}
