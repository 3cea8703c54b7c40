package com.migratorx.cdc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.migratorx.cdc.testing.InMemoryKafkaInspector;
import com.migratorx.checks.CheckInput;
import com.migratorx.workflow.ExecutionContext;
import com.migratorx.workflow.Finding;
import com.migratorx.workflow.Severity;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SchemaHistoryCheck")
class SchemaHistoryCheckTest {

    private static final String TOPIC = "dbhistory.orders";

    private final ExecutionContext context = ExecutionContext.create("history-test");
    private InMemoryKafkaInspector kafka;

    @BeforeEach
    void setUp() {
        kafka = new InMemoryKafkaInspector();
    }

    private List<Finding> run(String... expected) {
        return new SchemaHistoryCheck(kafka, TOPIC, List.of(expected)).run(context, CheckInput.EMPTY);
    }

    @Test
    @DisplayName("should report healthy when every expected table is covered")
    void shouldPass() {
        kafka.withTopic(TOPIC, "shop.orders", "shop.customers");

        assertThat(run("shop.orders", "shop.customers")).singleElement().satisfies(f -> {
            assertThat(f.severity()).isEqualTo(Severity.INFO);
            assertThat(f.message()).isEqualTo("schema history topic \"dbhistory.orders\" is healthy");
        });
    }

    @Test
    @DisplayName("should block on a missing topic")
    void shouldBlockMissingTopic() {
        assertThat(run("shop.orders")).singleElement().extracting(Finding::message)
                .isEqualTo("schema history topic \"dbhistory.orders\" is missing");
    }

    @Test
    @DisplayName("should block on an unreadable topic")
    void shouldBlockUnreadable() {
        kafka.withTopic(TOPIC, "shop.orders").unreadable(TOPIC);

        assertThat(run("shop.orders")).singleElement().extracting(Finding::message)
                .isEqualTo("schema history topic \"dbhistory.orders\" is not readable");
    }

    @Test
    @DisplayName("should stop at the first inspector failure")
    void shouldBlockOnFailure() {
        kafka.failing("broker unavailable");

        assertThat(run("shop.orders")).singleElement().extracting(Finding::message)
                .isEqualTo("failed to check schema history topic \"dbhistory.orders\": broker unavailable");
    }

    @Test
    @DisplayName("should list every missing table in one BLOCK, ignoring case and whitespace")
    void shouldListMissing() {
        kafka.withTopic(TOPIC, " SHOP.ORDERS ");

        List<Finding> findings = run("shop.orders", "shop.items", "shop.refunds");

        assertThat(findings).singleElement().satisfies(f -> {
            assertThat(f.message()).isEqualTo("schema history missing tables: shop.items, shop.refunds");
            assertThat(f.metadata()).containsEntry("missing_tables", List.of("shop.items", "shop.refunds"));
        });
    }

    @Test
    @DisplayName("should ignore blank expected entries")
    void shouldIgnoreBlankExpected() {
        assertThat(SchemaHistoryCheck.missingTables(Arrays.asList(" ", null, "a"), List.of("A")))
                .isEmpty();
    }

    @Test
    @DisplayName("should reject a blank topic")
    void shouldRejectBlankTopic() {
        assertThatThrownBy(() -> new SchemaHistoryCheck(kafka, " ", List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
