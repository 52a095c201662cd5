package com.bireporting.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Tabular output of a reporting query: ordered column metadata plus ordered rows of
 * nullable cells. Rows may be shorter than the column list.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Tabular result of a reporting query")
public class QueryResult {

    @Schema(description = "Ordered column metadata")
    @Builder.Default
    private List<ColumnMetadata> columns = new ArrayList<>();

    @Schema(description = "Ordered rows, each an ordered list of nullable cell values",
            example = "[[\"2025-01-01\", 1520.5], [\"2025-01-02\", null]]")
    @Builder.Default
    private List<List<Object>> data = new ArrayList<>();

    public int rowCount() {
        return data == null ? 0 : data.size();
    }

    public int columnCount() {
        return columns == null ? 0 : columns.size();
    }

    public Object cell(int row, int column) {
        List<Object> values = data.get(row);
        if (values == null || column >= values.size()) {
            return null;
        }
        return values.get(column);
    }
}
