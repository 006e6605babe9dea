package org.ferry.cli;

import org.ferry.cli.service.ReconcilerFactory;
import org.ferry.config.FerryConfiguration.ProfileConfiguration;
import org.ferry.model.ReconciliationConfig;
import org.ferry.model.SyncMode;
import org.ferry.reconcile.Reconciler;
import org.ferry.verify.DriftItem;
import org.ferry.verify.DriftReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import picocli.CommandLine;

import java.util.List;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for VerifyCommand.
 */
class VerifyCommandTest {

    private ReconcilerFactory factory;
    private Reconciler reconciler;

    @BeforeEach
    void setUp() {
        factory = mock(ReconcilerFactory.class);
        reconciler = mock(Reconciler.class);
        ProfileConfiguration profile = new ProfileConfiguration();
        when(factory.loadProfile(any())).thenReturn(profile);
        when(factory.create(eq(profile), any())).thenReturn(reconciler);
    }

    private int execute(String... args) {
        return new CommandLine(new VerifyCommand(factory)).execute(args);
    }

    private static DriftReport drift(DriftItem... items) {
        return new DriftReport("fp-src", "fp-tgt", new TreeSet<>(List.of("auth", "storage")), List.of(items), List.of());
    }

    @Test
    @DisplayName("Clean target -> exit-0, expected differences listed separately")
    void testVerify_Clean() {
        when(reconciler.verify(any(), any(), any())).thenReturn(drift(
                new DriftItem("tables", DriftItem.Kind.REMOVED, "public.scratch", "kept by incremental run", true)));

        try (StreamCaptor sc = new StreamCaptor()) {
            int exitCode = execute("prod", "test");

            assertThat(exitCode).isEqualTo(0);
            assertThat(sc.out())
                    .contains("test matches prod")
                    .contains("Expected differences (1)")
                    .contains("Excluded schemas: auth, storage");
        }
    }

    @Test
    void testVerify_Drift() {
        when(reconciler.verify(any(), any(), any())).thenReturn(drift(
                new DriftItem("columns", DriftItem.Kind.ADDED, "public.orders.status", null, false)));

        try (StreamCaptor sc = new StreamCaptor()) {
            int exitCode = execute("prod", "test");

            assertThat(exitCode).isEqualTo(1);
            assertThat(sc.out()).contains("Drift detected in test").contains("columns ADDED public.orders.status");
        }
    }

    @Test
    @DisplayName("--strict compares as a replace run")
    void testVerify_Strict() {
        when(reconciler.verify(any(), any(), any())).thenReturn(drift());

        try (StreamCaptor sc = new StreamCaptor()) {
            assertThat(execute("prod", "test", "--strict")).isEqualTo(0);
        }
        ArgumentCaptor<ReconciliationConfig> captor = ArgumentCaptor.forClass(ReconciliationConfig.class);
        verify(reconciler).verify(eq("prod"), eq("test"), captor.capture());
        assertThat(captor.getValue().getMode())
                .isEqualTo(SyncMode.of(SyncMode.Scope.SCHEMA_ONLY, SyncMode.Strategy.REPLACE));
    }

    @Test
    void testVerify_Json() {
        when(reconciler.verify(any(), any(), any())).thenReturn(drift());

        try (StreamCaptor sc = new StreamCaptor()) {
            assertThat(execute("prod", "test", "--json")).isEqualTo(0);
            assertThat(sc.out())
                    .contains("\"sourceFingerprint\" : \"fp-src\"")
                    .contains("\"clean\" : true");
        }
    }
}
