package com.bireporting.anomaly.engine.condition;

import com.bireporting.anomaly.model.ColumnMetadata;

import java.util.List;
import java.util.Locale;

/**
 * Maps a condition identifier to a result column: exact case-insensitive name first,
 * otherwise the first column whose name contains the identifier. "revenue" therefore
 * matches a column called "TotalRevenue" when no column is called "revenue".
 */
public final class ColumnResolver {

    private ColumnResolver() {}

    /**
     * @return the column index, or -1 if nothing matches
     */
    public static int resolve(String identifier, List<ColumnMetadata> columns) {
        if (identifier == null || columns == null) return -1;

        for (int i = 0; i < columns.size(); i++) {
            String name = columns.get(i).getName();
            if (name != null && name.equalsIgnoreCase(identifier)) return i;
        }

        String needle = identifier.toLowerCase(Locale.ROOT);
        for (int i = 0; i < columns.size(); i++) {
            String name = columns.get(i).getName();
            if (name != null && name.toLowerCase(Locale.ROOT).contains(needle)) return i;
        }
        return -1;
    }
}
