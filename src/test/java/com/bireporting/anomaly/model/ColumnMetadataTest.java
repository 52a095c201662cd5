package com.bireporting.anomaly.model;

import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

class ColumnMetadataTest {

    @Test
    void normalizedType_ignoresDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            ColumnMetadata column = ColumnMetadata.builder().name("Units").dataType("INT").build();

            assertThat(column.normalizedType()).isEqualTo("int");
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void normalizedType_nullType_isEmpty() {
        assertThat(new ColumnMetadata().normalizedType()).isEmpty();
    }
}
