package io.github.drompincen.sheetbridge.runtime.schema;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SchemaNamesTest {

    @Test
    void labelsBecomeSnakeCase() {
        assertThat(SchemaNames.toFieldName("Order Date (UTC)")).isEqualTo("order_date_utc");
        assertThat(SchemaNames.toFieldName("customerEmail")).isEqualTo("customer_email");
        assertThat(SchemaNames.toFieldName("  --  ")).isEqualTo("field");
    }

    @Test
    void leadingDigitGetsPrefixAndLengthIsCapped() {
        assertThat(SchemaNames.toFieldName("2024 Sales")).isEqualTo("f_2024_sales");
        assertThat(SchemaNames.toFieldName("x".repeat(80))).hasSize(64);
    }

    @Test
    void collectionNamesAvoidSystemPrefix() {
        assertThat(SchemaNames.toCollectionName("Monthly Sales")).isEqualTo("monthly_sales");
        assertThat(SchemaNames.toCollectionName("System Users")).isEqualTo("c_system_users");
    }
}
