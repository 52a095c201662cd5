package com.bireporting.anomaly.engine;

/**
 * Conversions for untyped result cells.
 */
public final class CellValues {

    private CellValues() {}

    /**
     * Numeric value of a cell: numbers are used directly, anything else is parsed from
     * its string form.
     *
     * @return the value, or null if the cell is null or not numeric
     */
    public static Double toDouble(Object cell) {
        if (cell == null) return null;
        if (cell instanceof Number number) {
            double value = number.doubleValue();
            return Double.isFinite(value) ? value : null;
        }
        if (cell instanceof Boolean) return null;

        String text = cell.toString().trim();
        if (text.isEmpty()) return null;
        try {
            double value = Double.parseDouble(text);
            return Double.isFinite(value) ? value : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
