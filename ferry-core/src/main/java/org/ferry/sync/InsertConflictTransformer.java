package org.ferry.sync;

import java.util.Locale;

/**
 * Rewrites every INSERT of a data dump to end in {@code ON CONFLICT DO NOTHING}, leaving all other lines untouched.
 * Statements may span lines; a semicolon only ends a statement outside string literals.
 */
public class InsertConflictTransformer {

    static final String SUFFIX = " ON CONFLICT DO NOTHING;";

    public String transform(String sql) {
        StringBuilder out = new StringBuilder(sql.length() + 1024);
        StringBuilder statement = null;
        boolean inQuote = false;

        for (String line : sql.split("\n", -1)) {
            if (statement == null) {
                if (!line.toUpperCase(Locale.ROOT).startsWith("INSERT INTO")) {
                    out.append(line).append('\n');
                    continue;
                }
                statement = new StringBuilder();
                inQuote = false;
            } else {
                statement.append('\n');
            }
            statement.append(line);
            inQuote = scanQuotes(line, inQuote);
            if (!inQuote && line.stripTrailing().endsWith(";")) {
                out.append(rewrite(statement.toString())).append('\n');
                statement = null;
            }
        }
        if (statement != null) {
            out.append(rewrite(statement.toString())).append('\n');
        }
        // every segment was followed by a newline, including the last one
        if (out.length() > 0) {
            out.setLength(out.length() - 1);
        }
        return out.toString();
    }

    private static boolean scanQuotes(String line, boolean inQuote) {
        for (int i = 0; i < line.length(); i++) {
            if (line.charAt(i) == '\'') {
                inQuote = !inQuote;
            }
        }
        return inQuote;
    }

    private static String rewrite(String statement) {
        String body = statement.stripTrailing();
        if (body.endsWith(";")) {
            body = body.substring(0, body.length() - 1).stripTrailing();
        }
        if (body.toUpperCase(Locale.ROOT).endsWith("ON CONFLICT DO NOTHING")) {
            return body + ";";
        }
        return body + SUFFIX;
    }
}
