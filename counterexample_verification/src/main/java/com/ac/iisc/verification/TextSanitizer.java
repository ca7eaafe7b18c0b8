package com.ac.iisc.verification;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import org.apache.calcite.sql.SqlDialect;

/**
 * Character-level repair of loosely formed SQL so that prover output can run
 * on SQLite. It is not a SQL parser.
 *
 * Three passes, applied in this order by {@link #sanitize(String)}:
 * <ol>
 *   <li>{@link #fixUnescapedApostrophes(String)}: inside a '...' literal, a
 *       lone quote followed by a letter is doubled (ANCESTOR'S CHOSEN becomes
 *       ANCESTOR''S CHOSEN); any other lone quote ends the literal.
 *       Best effort only: an unescaped apostrophe followed by punctuation
 *       (JAMES' BOOK) still ends the literal early.</li>
 *   <li>{@link #quoteHyphenatedIdentifiers(String)}: bare identifiers with an
 *       internal hyphen (T-BIL) are double-quoted.</li>
 *   <li>{@link #quoteReservedWords(String)}: bare words from the reserved table
 *       (ORDER) are double-quoted unless followed by their continuation keyword
 *       (ORDER BY).</li>
 * </ol>
 * All passes share one scanner ({@link ScanState}) that tracks literals, quoted
 * identifiers and comments, so text inside those regions is copied through
 * untouched. Running the passes again on their own output changes nothing.
 */
public class TextSanitizer
{
    /** Lexical region the scanner is in. */
    enum ScanState
    {
        CODE,
        SINGLE_QUOTED,
        DOUBLE_QUOTED,
        BACKTICK_QUOTED,
        LINE_COMMENT,
        BLOCK_COMMENT;

        /** State entered when {@code ch} (followed by {@code next}) is seen in CODE; CODE if none. */
        static ScanState opening(char ch, char next) {
            if (ch == '-' && next == '-') return LINE_COMMENT;
            if (ch == '/' && next == '*') return BLOCK_COMMENT;
            if (ch == '\'') return SINGLE_QUOTED;
            if (ch == '"') return DOUBLE_QUOTED;
            if (ch == '`') return BACKTICK_QUOTED;
            return CODE;
        }

        /** Number of characters that open this region. */
        int openerLength() {
            return (this == LINE_COMMENT || this == BLOCK_COMMENT) ? 2 : 1;
        }
    }

    // SQLite accepts standard double-quoted identifiers; embedded quotes are doubled.
    private static final SqlDialect ENGINE_DIALECT =
            new SqlDialect(SqlDialect.EMPTY_CONTEXT.withIdentifierQuoteString("\""));

    private final Map<String, String> reservedWords;

    /** Sanitizer using the reserved-word table from config.properties. */
    public TextSanitizer() {
        this(FileIO.getReservedWords());
    }

    /**
     * @param reservedWords upper-case word to continuation keyword; an empty
     *                      continuation means the word is always quoted
     */
    public TextSanitizer(Map<String, String> reservedWords) {
        Map<String, String> copy = new LinkedHashMap<>();
        if (reservedWords != null) {
            reservedWords.forEach((k, v) -> copy.put(k.toUpperCase(Locale.ROOT), v == null ? "" : v.toUpperCase(Locale.ROOT)));
        }
        this.reservedWords = Map.copyOf(copy);
    }

    /** All three passes, for setup scripts. */
    public String sanitize(String sql) {
        if (sql == null || sql.isEmpty()) return sql;
        return quoteReservedWords(quoteHyphenatedIdentifiers(fixUnescapedApostrophes(sql)));
    }

    /** Identifier passes only, for query text (apostrophes in queries are left alone). */
    public String sanitizeQuery(String sql) {
        if (sql == null || sql.isEmpty()) return sql;
        return quoteReservedWords(quoteHyphenatedIdentifiers(sql));
    }

    public String fixUnescapedApostrophes(String sql) {
        Cursor c = new Cursor(sql, true);
        while (c.hasNext()) {
            if (!c.advanceRegion()) c.copy(1);
        }
        return c.result();
    }

    public String quoteHyphenatedIdentifiers(String sql) {
        Cursor c = new Cursor(sql, false);
        while (c.hasNext()) {
            if (c.advanceRegion()) continue;
            char ch = c.current();
            if (isWordStart(ch)) {
                String token = c.takeWord();
                c.out.append(token.indexOf('-') >= 0 ? ENGINE_DIALECT.quoteIdentifier(token) : token);
            } else if (Character.isDigit(ch)) {
                c.out.append(c.takeNumber());
            } else {
                c.copy(1);
            }
        }
        return c.result();
    }

    public String quoteReservedWords(String sql) {
        if (reservedWords.isEmpty()) return sql;
        Cursor c = new Cursor(sql, false);
        while (c.hasNext()) {
            if (c.advanceRegion()) continue;
            char ch = c.current();
            if (isWordStart(ch)) {
                String token = c.takeWord();
                String continuation = reservedWords.get(token.toUpperCase(Locale.ROOT));
                if (continuation != null && !(continuation.length() > 0 && c.followedByKeyword(continuation))) {
                    c.out.append(ENGINE_DIALECT.quoteIdentifier(token));
                } else {
                    c.out.append(token);
                }
            } else if (Character.isDigit(ch)) {
                c.out.append(c.takeNumber());
            } else {
                c.copy(1);
            }
        }
        return c.result();
    }

    private static boolean isWordStart(char ch) {
        return Character.isLetter(ch) || ch == '_';
    }

    private static boolean isWordPart(char ch) {
        return Character.isLetterOrDigit(ch) || ch == '_';
    }

    /** Scanner position, output buffer and current {@link ScanState}. */
    private static final class Cursor
    {
        private final String sql;
        private final int n;
        private final boolean repairApostrophes;
        private final StringBuilder out;
        private int i = 0;
        private ScanState state = ScanState.CODE;

        Cursor(String sql, boolean repairApostrophes) {
            this.sql = sql;
            this.n = sql.length();
            this.repairApostrophes = repairApostrophes;
            this.out = new StringBuilder(n + 16);
        }

        boolean hasNext() { return i < n; }

        char current() { return sql.charAt(i); }

        char peek(int ahead) {
            int k = i + ahead;
            return k < n ? sql.charAt(k) : '\0';
        }

        void copy(int count) {
            int end = Math.min(n, i + count);
            out.append(sql, i, end);
            i = end;
        }

        String result() { return out.toString(); }

        /**
         * Consume one step of a non-CODE region, or the opener of a new region.
         * Returns false when positioned on a plain CODE character, which the
         * calling pass handles itself.
         */
        boolean advanceRegion() {
            char ch = current();
            char next = peek(1);
            switch (state) {
                case LINE_COMMENT -> {
                    copy(1);
                    if (ch == '\n') state = ScanState.CODE;
                    return true;
                }
                case BLOCK_COMMENT -> {
                    if (ch == '*' && next == '/') {
                        copy(2);
                        state = ScanState.CODE;
                    } else {
                        copy(1);
                    }
                    return true;
                }
                case SINGLE_QUOTED -> {
                    if (ch != '\'') {
                        copy(1);
                    } else if (next == '\'') {
                        copy(2);
                    } else if (repairApostrophes && Character.isLetter(next)) {
                        out.append("''");
                        i++;
                    } else {
                        copy(1);
                        state = ScanState.CODE;
                    }
                    return true;
                }
                case DOUBLE_QUOTED -> {
                    closeQuoted('"');
                    return true;
                }
                case BACKTICK_QUOTED -> {
                    closeQuoted('`');
                    return true;
                }
                default -> {
                    ScanState opened = ScanState.opening(ch, next);
                    if (opened == ScanState.CODE) return false;
                    copy(opened.openerLength());
                    state = opened;
                    return true;
                }
            }
        }

        private void closeQuoted(char quote) {
            if (current() != quote) {
                copy(1);
            } else if (peek(1) == quote) {
                copy(2);
            } else {
                copy(1);
                state = ScanState.CODE;
            }
        }

        /** Identifier run; a hyphen belongs to it only when a word character follows. */
        String takeWord() {
            int start = i;
            int j = i + 1;
            while (j < n) {
                char c = sql.charAt(j);
                if (isWordPart(c)) {
                    j++;
                } else if (c == '-' && j + 1 < n && isWordPart(sql.charAt(j + 1))) {
                    j++;
                } else {
                    break;
                }
            }
            i = j;
            return sql.substring(start, j);
        }

        /** Numeric literal such as 42, 1.5 or the 1e of 1e-5; never quoted. */
        String takeNumber() {
            int start = i;
            int j = i + 1;
            while (j < n && (isWordPart(sql.charAt(j)) || sql.charAt(j) == '.')) {
                j++;
            }
            i = j;
            return sql.substring(start, j);
        }

        /** True when whitespace and then {@code keyword} (as a whole word) come next. */
        boolean followedByKeyword(String keyword) {
            int k = i;
            while (k < n && Character.isWhitespace(sql.charAt(k))) k++;
            if (k == i) return false;
            if (!sql.regionMatches(true, k, keyword, 0, keyword.length())) return false;
            int end = k + keyword.length();
            return end >= n || !isWordPart(sql.charAt(end));
        }
    }
}
