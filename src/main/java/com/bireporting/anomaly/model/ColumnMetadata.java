package com.bireporting.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Locale;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Name and declared SQL type of a result column")
public class ColumnMetadata {

    @Schema(description = "Column name", example = "TotalRevenue")
    private String name;

    @Schema(description = "Declared type name as reported by the database", example = "decimal(18,2)")
    private String dataType;

    public String normalizedType() {
        return dataType == null ? "" : dataType.toLowerCase(Locale.ROOT);
    }
}
