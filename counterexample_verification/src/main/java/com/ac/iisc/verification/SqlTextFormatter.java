package com.ac.iisc.verification;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text clean-up applied to generated and gold SQL before they are handed to
 * the prover.
 */
public final class SqlTextFormatter
{
    /** Generated SQL is stored as {@code sql<TAB>...}; everything after the first tab is metadata. */
    public static final String STOPPER = "\t";

    private static final Pattern BACKTICKED = Pattern.compile("`([^`]+)`");
    private static final Pattern DIGIT_RANGE = Pattern.compile("(\\d+)-(\\d+)");
    private static final Pattern LETTERS_DIGITS = Pattern.compile("([A-Z]+)-(\\d+)");
    private static final Pattern NOT_IDENTIFIER = Pattern.compile("[^A-Z0-9_]");
    private static final Pattern UNDERSCORES = Pattern.compile("_+");

    private SqlTextFormatter() {
    }

    /** Cut at the first tab, collapse whitespace runs to one space, upper-case. */
    public static String formatSql(String sql)
    {
        if (sql == null || sql.isEmpty()) return "";
        int stop = sql.indexOf(STOPPER);
        String head = stop >= 0 ? sql.substring(0, stop) : sql;
        return String.join(" ", head.trim().split("\\s+")).toUpperCase(Locale.ROOT);
    }

    /**
     * Replace every back-tick quoted name with a plain identifier:
     * {@code `FREE MEAL COUNT (K-12)`} becomes {@code FREE_MEAL_COUNT_K12} and
     * {@code `ENROLLMENT (AGES 5-17)`} becomes {@code ENROLLMENT_AGES_5_17}.
     */
    public static String cleanBacktickIdentifiers(String sql)
    {
        if (sql == null || sql.indexOf('`') < 0) return sql;
        Matcher m = BACKTICKED.matcher(sql);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            m.appendReplacement(sb, Matcher.quoteReplacement(toIdentifier(m.group(1))));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    static String toIdentifier(String name)
    {
        String s = name.toUpperCase(Locale.ROOT).replace(' ', '_');
        s = DIGIT_RANGE.matcher(s).replaceAll("$1_$2");
        s = LETTERS_DIGITS.matcher(s).replaceAll("$1$2");
        s = NOT_IDENTIFIER.matcher(s).replaceAll("");
        s = UNDERSCORES.matcher(s).replaceAll("_");
        int start = 0;
        int end = s.length();
        while (start < end && s.charAt(start) == '_') start++;
        while (end > start && s.charAt(end - 1) == '_') end--;
        return s.substring(start, end);
    }
}
