package com.migratorx.workflow;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Severity, Finding and Summary")
class SummaryTest {

    @Nested
    @DisplayName("Severity")
    class SeverityOrder {

        @Test
        @DisplayName("orders INFO < WARN < BLOCK")
        void totalOrder() {
            assertThat(Severity.INFO.compareTo(Severity.WARN)).isNegative();
            assertThat(Severity.WARN.compareTo(Severity.BLOCK)).isNegative();
            assertThat(Severity.BLOCK.atLeast(Severity.WARN)).isTrue();
            assertThat(Severity.INFO.atLeast(Severity.WARN)).isFalse();
        }

        @Test
        @DisplayName("only BLOCK halts")
        void onlyBlockHalts() {
            assertThat(Severity.BLOCK.isHalting()).isTrue();
            assertThat(Severity.WARN.isHalting()).isFalse();
            assertThat(Severity.INFO.isHalting()).isFalse();
        }

        @Test
        @DisplayName("renders as upper-case name")
        void rendering() {
            assertThat(Severity.WARN).hasToString("WARN");
        }
    }

    @Nested
    @DisplayName("Finding")
    class FindingConstruction {

        @Test
        @DisplayName("rejects blank message")
        void rejectsBlankMessage() {
            assertThatThrownBy(() -> Finding.warn("  "))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("message");
            assertThatThrownBy(() -> Finding.info(null))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("keeps null metadata values and insertion order")
        void metadataOrder() {
            Finding finding = Finding.block("boom", Findings.meta("b", 1, "a", null));
            assertThat(finding.metadata()).containsKeys("b", "a");
            assertThat(finding.metadata().keySet()).containsExactly("b", "a");
            assertThat(finding.metadata().get("a")).isNull();
        }

        @Test
        @DisplayName("withMetadata returns a new finding")
        void withMetadata() {
            Finding original = Finding.info("ok");
            Finding tagged = original.withMetadata("check", "schema_parity");
            assertThat(original.metadata()).isEmpty();
            assertThat(tagged.metadata()).containsEntry("check", "schema_parity");
            assertThat(tagged.message()).isEqualTo("ok");
        }

        @Test
        @DisplayName("metadata is unmodifiable")
        void metadataUnmodifiable() {
            Finding finding = Finding.info("ok", Findings.meta("k", "v"));
            assertThatThrownBy(() -> finding.metadata().put("x", "y"))
                    .isInstanceOf(UnsupportedOperationException.class);
        }
    }

    @Nested
    @DisplayName("Summary")
    class Aggregation {

        @Test
        @DisplayName("counts findings by severity")
        void counts() {
            Summary summary = Summary.of(List.of(
                    Finding.info("a"), Finding.warn("b"), Finding.warn("c"), Finding.block("d")));
            assertThat(summary).isEqualTo(new Summary(1, 2, 1));
            assertThat(summary.hasBlock()).isTrue();
            assertThat(summary.isClean()).isFalse();
            assertThat(summary.total()).isEqualTo(4);
            assertThat(summary).hasToString("Summary: 1 INFO / 2 WARN / 1 BLOCK");
        }

        @Test
        @DisplayName("aggregation order does not matter")
        void commutativeAndAssociative() {
            List<Finding> findings = new ArrayList<>();
            for (int i = 0; i < 30; i++) {
                findings.add(new Finding(Severity.values()[i % 3], "f" + i, null));
            }
            Summary expected = Summary.of(findings);

            List<Finding> shuffled = new ArrayList<>(findings);
            Collections.shuffle(shuffled, new Random(42));
            assertThat(Summary.of(shuffled)).isEqualTo(expected);

            Summary left = Summary.of(shuffled.subList(0, 10))
                    .plus(Summary.of(shuffled.subList(10, 20)))
                    .plus(Summary.of(shuffled.subList(20, 30)));
            Summary right = Summary.of(shuffled.subList(0, 10))
                    .plus(Summary.of(shuffled.subList(10, 20))
                            .plus(Summary.of(shuffled.subList(20, 30))));
            assertThat(left).isEqualTo(expected).isEqualTo(right);
        }

        @Test
        @DisplayName("empty summary is clean")
        void emptyIsClean() {
            assertThat(Summary.EMPTY.isClean()).isTrue();
            assertThat(Summary.EMPTY.add(Severity.INFO).isClean()).isTrue();
            assertThat(Summary.EMPTY.add(Severity.WARN).isClean()).isFalse();
        }
    }

    @Nested
    @DisplayName("ResultAggregator")
    class Aggregator {

        @Test
        @DisplayName("stays blocked once a BLOCK was seen")
        void staysBlocked() {
            ResultAggregator aggregator = new ResultAggregator();
            assertThat(aggregator.addFindings(List.of(Finding.info("a"), Finding.warn("b"))))
                    .isTrue();
            assertThat(aggregator.blocked()).isFalse();

            assertThat(aggregator.addFindings(List.of(Finding.block("c")))).isFalse();
            assertThat(aggregator.addFindings(List.of(Finding.info("d")))).isFalse();
            assertThat(aggregator.blocked()).isTrue();
            assertThat(aggregator.summary()).isEqualTo(new Summary(2, 1, 1));
        }
    }
}
