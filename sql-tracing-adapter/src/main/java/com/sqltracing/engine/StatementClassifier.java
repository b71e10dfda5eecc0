package com.sqltracing.engine;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives a {@link StatementKind} from literal SQL text.
 *
 * <p>Only the leading keywords are inspected. Leading whitespace,
 * {@code --} line comments and {@code /* *}{@code /} block comments are
 * skipped first.</p>
 */
public final class StatementClassifier {

    /** Leading whitespace and comments. */
    private static final Pattern LEADING_NOISE = Pattern.compile(
        "\\A(?:\\s+|--[^\\n]*(?:\\n|\\z)|/\\*.*?\\*/)*", Pattern.DOTALL);

    /** Up to four leading words. */
    private static final Pattern LEADING_WORDS = Pattern.compile(
        "\\A([a-z]+)(?:\\s+([a-z]+))?(?:\\s+([a-z]+))?(?:\\s+([a-z]+))?");

    /** Prevent instantiation. */
    private StatementClassifier() {
        throw new AssertionError("No instances");
    }

    /**
     * Classify a SQL statement.
     *
     * @param sql the SQL text, may be null
     * @return the statement kind, {@link StatementKind#GENERIC} when the
     *         text is not recognized
     */
    public static StatementKind classify(final String sql) {
        if (sql == null) {
            return StatementKind.GENERIC;
        }
        String text = LEADING_NOISE.matcher(sql).replaceFirst("")
            .toLowerCase(Locale.ROOT);
        Matcher words = LEADING_WORDS.matcher(text);
        if (!words.find()) {
            return StatementKind.GENERIC;
        }
        String first = words.group(1);
        switch (first) {
            case "select":
            case "with":
            case "values":
                return StatementKind.SELECT;
            case "insert":
            case "replace":
                return StatementKind.INSERT;
            case "update":
                return StatementKind.UPDATE;
            case "delete":
                return StatementKind.DELETE;
            case "create":
                return classifyDdl(words, StatementKind.CREATE_TABLE,
                    StatementKind.CREATE_INDEX);
            case "drop":
                return classifyDdl(words, StatementKind.DROP_TABLE,
                    StatementKind.DROP_INDEX);
            default:
                return StatementKind.GENERIC;
        }
    }

    /**
     * Classify {@code CREATE}/{@code DROP} by the object keyword, skipping
     * the modifiers that may precede it.
     */
    private static StatementKind classifyDdl(final Matcher words,
            final StatementKind table, final StatementKind index) {
        for (int group = 2; group <= words.groupCount(); group++) {
            String word = words.group(group);
            if (word == null) {
                break;
            }
            switch (word) {
                case "table":
                    return table;
                case "index":
                    return index;
                case "temp":
                case "temporary":
                case "unique":
                case "global":
                case "local":
                    continue;
                default:
                    return StatementKind.GENERIC;
            }
        }
        return StatementKind.GENERIC;
    }
}
