package org.ferry.cli.service;

import org.ferry.plan.MigrationPlan;
import org.ferry.plan.Operation;
import org.ferry.reconcile.ConfirmationPrompt;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Lists the destructive operations of a plan and asks on the terminal before applying it.
 * Anything but {@code y} or {@code yes} declines, including end of input.
 */
public class ConsoleConfirmationPrompt implements ConfirmationPrompt {

    private final BufferedReader in;
    private final PrintStream out;

    public ConsoleConfirmationPrompt() {
        this(System.in, System.out);
    }

    public ConsoleConfirmationPrompt(InputStream in, PrintStream out) {
        this.in = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.out = out;
    }

    @Override
    public boolean confirm(MigrationPlan plan, String source, String target) {
        out.println("The plan for " + target + " (from " + source + ") contains destructive operations:");
        for (Operation op : plan.getDestructiveOperations()) {
            out.println("   - " + op);
        }
        out.print("Apply it to " + target + "? [y/N] ");
        out.flush();
        try {
            String answer = in.readLine();
            if (answer == null) {
                return false;
            }
            String normalized = answer.trim().toLowerCase(Locale.ROOT);
            return normalized.equals("y") || normalized.equals("yes");
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read confirmation", e);
        }
    }
}
