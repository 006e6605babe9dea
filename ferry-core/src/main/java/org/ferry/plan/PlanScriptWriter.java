package org.ferry.plan;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Renders a plan as a reviewable SQL script. Withheld operations are listed as comments.
 */
public class PlanScriptWriter {

    public String render(MigrationPlan plan, String sourceEnv, String targetEnv) {
        StringBuilder out = new StringBuilder();
        out.append(String.format("""
                -- Ferry reconciliation plan
                -- ferry:source=%s
                -- ferry:target=%s
                -- ferry:mode=%s
                -- ferry:summary=%s
                -- ferry:generated=%s
                """,
                sourceEnv, targetEnv, plan.getMode(), plan.getSummary(),
                LocalDateTime.now().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)));

        String openGroup = null;
        Phase currentPhase = null;
        for (Operation op : plan.getOperations()) {
            if (op.getPhase() != currentPhase) {
                openGroup = closeGroup(out, openGroup);
                currentPhase = op.getPhase();
                out.append("\n-- ").append(currentPhase).append('\n');
            }
            if (!Objects.equals(op.getTransactionGroup(), openGroup)) {
                openGroup = closeGroup(out, openGroup);
                if (op.getTransactionGroup() != null) {
                    out.append("BEGIN;\n");
                    openGroup = op.getTransactionGroup();
                }
            }
            if (op.hasSql()) {
                if (op.isDestructive()) {
                    out.append("-- destructive\n");
                }
                if (op.isDeferred()) {
                    out.append("-- runs only if ").append(op.getTargetObject()).append(" holds no NULLs\n");
                }
                out.append(op.getSql()).append('\n');
            } else {
                out.append("-- load rows of ").append(op.getTargetObject()).append('\n');
            }
        }
        closeGroup(out, openGroup);

        if (!plan.getSuppressed().isEmpty()) {
            out.append("\n-- withheld\n");
            for (SuppressedOperation s : plan.getSuppressed()) {
                out.append("-- ").append(s.operation().getSql()).append('\n');
            }
        }
        return out.toString();
    }

    private static String closeGroup(StringBuilder out, String openGroup) {
        if (openGroup != null) {
            out.append("COMMIT;\n");
        }
        return null;
    }
}
