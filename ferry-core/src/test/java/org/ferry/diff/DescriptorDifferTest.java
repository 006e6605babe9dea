package org.ferry.diff;

import org.ferry.model.ColumnDescriptor;
import org.ferry.model.PolicyDescriptor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.ferry.Fixtures.column;
import static org.ferry.Fixtures.policy;

class DescriptorDifferTest {

    @Nested
    class Columns {

        private final ColumnDiffer differ = new ColumnDiffer();

        @Test
        @DisplayName("Ordinal position is not compared")
        void ordinalIgnored() {
            DiffResult<ColumnDescriptor> result = differ.compare(
                    List.of(column("t", "a", "text", 1)),
                    List.of(column("t", "a", "text", 7)));

            assertThat(result.isEmpty()).isTrue();
        }

        @Test
        @DisplayName("Type, nullability and default are reported in that order")
        void allFields() {
            ColumnDescriptor source = column("t", "a", "bigint", 1).toBuilder()
                    .nullable(false).defaultExpression("0").build();
            ColumnDescriptor target = column("t", "a", "integer", 1);

            DiffResult<ColumnDescriptor> result = differ.compare(List.of(source), List.of(target));

            assertThat(result.getChanged()).singleElement()
                    .satisfies(c -> assertThat(c.getFields())
                            .containsExactly(ColumnDiffer.TYPE, ColumnDiffer.NULLABLE, ColumnDiffer.DEFAULT));
        }

        @Test
        @DisplayName("Empty default equals no default")
        void emptyDefault() {
            ColumnDescriptor source = column("t", "a", "text", 1).toBuilder().defaultExpression("").build();
            ColumnDescriptor target = column("t", "a", "text", 1);

            assertThat(differ.compare(List.of(source), List.of(target)).isEmpty()).isTrue();
        }

        @Test
        @DisplayName("Target-only column is reported as removed")
        void removed() {
            DiffResult<ColumnDescriptor> result = differ.compare(
                    List.of(column("t", "a", "text", 1)),
                    List.of(column("t", "a", "text", 1), column("t", "legacy", "text", 2)));

            assertThat(result.getRemoved()).extracting(ColumnDescriptor::getName).containsExactly("legacy");
            assertThat(result.size()).isEqualTo(1);
        }

        @Test
        void duplicateKeysAreRejected() {
            assertThatThrownBy(() -> differ.compare(
                    List.of(column("t", "a", "text", 1), column("t", "a", "int", 2)), List.of()))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("public.t.a");
        }
    }

    @Nested
    class Policies {

        private final PolicyDiffer differ = new PolicyDiffer();

        @Test
        @DisplayName("Role order does not matter")
        void roleOrder() {
            DiffResult<PolicyDescriptor> result = differ.compare(
                    List.of(policy("t", "p", List.of("anon", "authenticated"), "true")),
                    List.of(policy("t", "p", List.of("authenticated", "anon"), "true")));

            assertThat(result.isEmpty()).isTrue();
        }

        @Test
        @DisplayName("Expressions are compared literally")
        void literalExpressions() {
            DiffResult<PolicyDescriptor> result = differ.compare(
                    List.of(policy("t", "p", List.of("anon"), "(owner = auth.uid())")),
                    List.of(policy("t", "p", List.of("anon"), "(auth.uid() = owner)")));

            assertThat(result.getChanged()).singleElement()
                    .satisfies(c -> assertThat(c.getFields()).containsExactly("using"));
        }
    }
}
