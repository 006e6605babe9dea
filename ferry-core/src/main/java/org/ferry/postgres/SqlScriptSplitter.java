package org.ferry.postgres;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a SQL script into statements at top-level semicolons.
 * Semicolons inside quoted strings, quoted identifiers, dollar-quoted bodies and comments do not end a statement.
 * Statements made only of whitespace and comments are dropped.
 */
final class SqlScriptSplitter {

    private static final Pattern DOLLAR_TAG = Pattern.compile("\\$([A-Za-z_][A-Za-z0-9_]*)?\\$");

    private SqlScriptSplitter() {
    }

    static List<String> split(String script) {
        List<String> statements = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean meaningful = false;
        int i = 0;
        int length = script.length();

        while (i < length) {
            char c = script.charAt(i);
            char next = i + 1 < length ? script.charAt(i + 1) : '\0';

            if (c == '-' && next == '-') {
                int end = script.indexOf('\n', i);
                end = end < 0 ? length : end;
                current.append(script, i, end);
                i = end;
            } else if (c == '/' && next == '*') {
                int end = blockCommentEnd(script, i);
                current.append(script, i, end);
                i = end;
            } else if (c == '\'') {
                boolean escapes = i > 0 && (script.charAt(i - 1) == 'E' || script.charAt(i - 1) == 'e')
                        && (i < 2 || !isIdentifierChar(script.charAt(i - 2)));
                int end = quotedEnd(script, i, '\'', escapes);
                current.append(script, i, end);
                meaningful = true;
                i = end;
            } else if (c == '"') {
                int end = quotedEnd(script, i, '"', false);
                current.append(script, i, end);
                meaningful = true;
                i = end;
            } else if (c == '$' && (i == 0 || !isIdentifierChar(script.charAt(i - 1))) && dollarTag(script, i) != null) {
                String tag = dollarTag(script, i);
                int close = script.indexOf(tag, i + tag.length());
                int end = close < 0 ? length : close + tag.length();
                current.append(script, i, end);
                meaningful = true;
                i = end;
            } else if (c == ';') {
                if (meaningful) {
                    statements.add(current.toString().strip());
                }
                current.setLength(0);
                meaningful = false;
                i++;
            } else {
                current.append(c);
                if (!Character.isWhitespace(c)) {
                    meaningful = true;
                }
                i++;
            }
        }
        if (meaningful) {
            statements.add(current.toString().strip());
        }
        return statements;
    }

    private static String dollarTag(String script, int start) {
        Matcher matcher = DOLLAR_TAG.matcher(script);
        matcher.region(start, script.length());
        return matcher.lookingAt() ? matcher.group() : null;
    }

    /**
     * Index just past the closing quote; a doubled quote is an escaped quote.
     */
    private static int quotedEnd(String script, int start, char quote, boolean backslashEscapes) {
        int i = start + 1;
        while (i < script.length()) {
            char c = script.charAt(i);
            if (backslashEscapes && c == '\\') {
                i += 2;
                continue;
            }
            if (c == quote) {
                if (i + 1 < script.length() && script.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return script.length();
    }

    // block comments nest in PostgreSQL
    private static int blockCommentEnd(String script, int start) {
        int depth = 0;
        int i = start;
        while (i < script.length() - 1) {
            if (script.charAt(i) == '/' && script.charAt(i + 1) == '*') {
                depth++;
                i += 2;
            } else if (script.charAt(i) == '*' && script.charAt(i + 1) == '/') {
                depth--;
                i += 2;
                if (depth == 0) {
                    return i;
                }
            } else {
                i++;
            }
        }
        return script.length();
    }

    private static boolean isIdentifierChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
