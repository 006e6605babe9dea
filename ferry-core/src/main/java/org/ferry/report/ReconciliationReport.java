package org.ferry.report;

import lombok.Data;
import org.ferry.execute.ExecutionReport;
import org.ferry.model.SyncMode;
import org.ferry.plan.PlanSummary;
import org.ferry.sync.RestoreResult;
import org.ferry.sync.SyncReport;
import org.ferry.verify.DriftReport;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything a run produced, in the shape written to {@code report.json}.
 * Filled in stage by stage; sections of stages that never ran stay {@code null}.
 */
@Data
public class ReconciliationReport {
    private String source;
    private String target;
    private SyncMode mode;
    private String startedAt;
    private String finishedAt;
    private RunStatus status;
    private String failedStage;
    private String error;
    /** Dump of the target taken before the run applied anything, if one was requested and written. */
    private String backupFile;

    private PlanSummary planSummary;
    private int operationCount;
    private List<String> destructiveOperations = new ArrayList<>();
    private List<String> withheldOperations = new ArrayList<>();
    private List<String> warnings = new ArrayList<>();

    private ExecutionReport execution;
    private SyncReport dataSync;
    private List<RestoreResult> restoredTables = new ArrayList<>();
    private DriftReport drift;

    public boolean isSuccessful() {
        return status == RunStatus.SUCCEEDED || status == RunStatus.NO_CHANGES || status == RunStatus.CANCELLED;
    }
}
