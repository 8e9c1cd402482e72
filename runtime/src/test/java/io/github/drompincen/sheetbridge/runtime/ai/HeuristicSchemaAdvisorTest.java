package io.github.drompincen.sheetbridge.runtime.ai;

import io.github.drompincen.sheetbridge.protocol.api.AttributeDefinition;
import io.github.drompincen.sheetbridge.protocol.api.FieldType;
import io.github.drompincen.sheetbridge.protocol.api.IndexDefinition;
import io.github.drompincen.sheetbridge.protocol.api.IndexKind;
import io.github.drompincen.sheetbridge.protocol.api.SchemaProposal;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class HeuristicSchemaAdvisorTest {

    private final HeuristicSchemaAdvisor advisor = new HeuristicSchemaAdvisor();

    @Test
    void guessesTypesFromWords() {
        SchemaProposal proposal = advisor.propose(List.of("SKU", "Unit Price", "Created At", "Is Active", "Notes"));

        assertThat(proposal.attributes().values()).extracting(AttributeDefinition::fieldName, AttributeDefinition::type)
                .containsExactly(
                        tuple("sku", FieldType.STRING),
                        tuple("unit_price", FieldType.NUMBER),
                        tuple("created_at", FieldType.DATE),
                        tuple("is_active", FieldType.BOOLEAN),
                        tuple("notes", FieldType.STRING));
        assertThat(proposal.collectionName()).isNull();
    }

    @Test
    void firstKeyLikeFieldBecomesTheDuplicateKey() {
        SchemaProposal proposal = advisor.propose(List.of("Name", "Customer Id", "Email", "Order Date"));

        assertThat(proposal.duplicateKeyFields()).containsExactly("customer_id");
        assertThat(proposal.indexes()).extracting(IndexDefinition::field, IndexDefinition::kind).containsExactly(
                tuple("customer_id", IndexKind.ASCENDING),
                tuple("order_date", IndexKind.DESCENDING));
    }

    @Test
    void collidingFieldNamesAreNumbered() {
        SchemaProposal proposal = advisor.propose(List.of("Total", "total", "TOTAL!"));

        assertThat(proposal.attributes().values()).extracting(AttributeDefinition::fieldName)
                .containsExactly("total", "total_2", "total_3");
    }
}
