package org.ferry.cli;

import org.ferry.model.SyncMode;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

class ModeOptionsTest {

    private static SyncMode parse(String... args) {
        ModeOptions options = new ModeOptions();
        new CommandLine(options).parseArgs(args);
        return options.toMode();
    }

    @Test
    void noSwitchIsSchemaOnlyIncremental() {
        assertEquals(SyncMode.schemaOnly(), parse());
        assertEquals(SyncMode.schemaOnly(), parse("--schema-only"));
    }

    @Test
    void dataSwitches() {
        assertEquals(SyncMode.of(SyncMode.Scope.SCHEMA_AND_DATA, SyncMode.Strategy.INCREMENTAL), parse("--data"));
        assertEquals(SyncMode.of(SyncMode.Scope.SCHEMA_AND_DATA, SyncMode.Strategy.REPLACE), parse("--replace-data"));
        assertEquals(SyncMode.of(SyncMode.Scope.DATA_ONLY, SyncMode.Strategy.INCREMENTAL), parse("--data-only"));
        assertEquals(SyncMode.of(SyncMode.Scope.DATA_ONLY, SyncMode.Strategy.REPLACE), parse("--data-only", "--replace"));
    }

    @Test
    void replaceAloneKeepsSchemaScope() {
        SyncMode mode = parse("--replace");

        assertThat(mode.includesData()).isFalse();
        assertThat(mode.isIncremental()).isFalse();
    }

    @Test
    void schemaOnlyConflictsWithData() {
        assertThatThrownBy(() -> parse("--schema-only", "--data-only"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("--schema-only cannot be combined");
    }
}
