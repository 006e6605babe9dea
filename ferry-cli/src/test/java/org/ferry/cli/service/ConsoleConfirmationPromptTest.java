package org.ferry.cli.service;

import org.ferry.model.ColumnDescriptor;
import org.ferry.model.Snapshot;
import org.ferry.model.SyncMode;
import org.ferry.model.TableDescriptor;
import org.ferry.plan.MigrationPlan;
import org.ferry.plan.PlanGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class ConsoleConfirmationPromptTest {

    private static MigrationPlan destructivePlan() {
        Snapshot target = Snapshot.builder()
                .table(TableDescriptor.builder().schema("public").name("legacy").build())
                .column(ColumnDescriptor.builder().schema("public").tableName("legacy").name("id")
                        .type("bigint").nullable(true).ordinalPosition(1).build())
                .build();
        return new PlanGenerator().generate(Snapshot.builder().build(), target,
                SyncMode.of(SyncMode.Scope.SCHEMA_ONLY, SyncMode.Strategy.REPLACE));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "y|true",
            "YES|true",
            "' yes '|true",
            "n|false",
            "maybe|false",
            "''|false"
    })
    void answers(String input, boolean expected) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ConsoleConfirmationPrompt prompt = new ConsoleConfirmationPrompt(
                new ByteArrayInputStream((input + "\n").getBytes(StandardCharsets.UTF_8)), new PrintStream(out));

        boolean confirmed = prompt.confirm(destructivePlan(), "prod", "test");

        assertThat(confirmed).isEqualTo(expected);
        assertThat(out.toString())
                .contains("destructive operations")
                .contains("DROP_TABLE public.legacy")
                .contains("Apply it to test? [y/N]");
    }

    @Test
    void endOfInputDeclines() {
        ConsoleConfirmationPrompt prompt = new ConsoleConfirmationPrompt(
                new ByteArrayInputStream(new byte[0]), new PrintStream(new ByteArrayOutputStream()));

        assertThat(prompt.confirm(destructivePlan(), "prod", "test")).isFalse();
    }
}
