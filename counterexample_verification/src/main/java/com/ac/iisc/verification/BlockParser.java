package com.ac.iisc.verification;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits raw prover counterexample text into setup/query triples.
 *
 * Expected layout of one block:
 * <pre>
 *   CREATE TABLE ...; INSERT INTO ...;
 *   -- ----------sql1------------
 *   SELECT ...
 *   -- ----------sql2------------
 *   SELECT ...
 * </pre>
 * Several blocks may share one text, separated by {@link #BLOCK_DELIMITER}.
 *
 * Parsing never throws: a block without both markers (in order) or with an
 * empty segment is dropped. The caller decides whether "no cases at all" is an
 * error.
 */
public class BlockParser
{
    public static final String BLOCK_DELIMITER = "~~~~~~~~~~~";
    public static final String SQL1_MARKER = "-- ----------sql1------------";
    public static final String SQL2_MARKER = "-- ----------sql2------------";

    private static final String COMMENT_PREFIX = "--";

    /** Setup script and the two queries of one block. */
    public static final class Triple
    {
        private final String setupSql;
        private final String sql1;
        private final String sql2;

        Triple(String setupSql, String sql1, String sql2) {
            this.setupSql = setupSql;
            this.sql1 = sql1;
            this.sql2 = sql2;
        }

        public String getSetupSql() { return setupSql; }
        public String getSql1() { return sql1; }
        public String getSql2() { return sql2; }
    }

    /**
     * Parse one text that may contain one or more counterexample blocks.
     *
     * @param text raw counterexample text (null is treated as empty)
     * @return valid triples in the order they appear; possibly empty
     */
    public List<Triple> parse(String text)
    {
        List<Triple> out = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return out;
        }

        List<String> chunks = new ArrayList<>();
        for (String part : text.split(java.util.regex.Pattern.quote(BLOCK_DELIMITER), -1)) {
            String t = part.strip();
            if (!t.isEmpty()) chunks.add(t);
        }
        if (chunks.isEmpty()) {
            chunks.add(text.strip());
        }

        for (String chunk : chunks) {
            Triple triple = parseChunk(chunk);
            if (triple != null) out.add(triple);
        }
        return out;
    }

    /**
     * Parse the text of one source record into cases. The first triple keeps
     * {@code questionId}; later ones get {@code _blk2}, {@code _blk3}, ...
     */
    public List<CounterexampleCase> parseCases(String questionId, Integer boundSize, String text)
    {
        List<Triple> triples = parse(text);
        List<CounterexampleCase> cases = new ArrayList<>(triples.size());
        for (int i = 0; i < triples.size(); i++) {
            Triple t = triples.get(i);
            String id = i == 0 ? questionId : questionId + "_blk" + (i + 1);
            cases.add(new CounterexampleCase(id, boundSize, t.getSetupSql(), t.getSql1(), t.getSql2()));
        }
        return cases;
    }

    private Triple parseChunk(String chunk) {
        int first = chunk.indexOf(SQL1_MARKER);
        if (first < 0) return null;
        int second = chunk.indexOf(SQL2_MARKER, first + SQL1_MARKER.length());
        if (second < 0) return null;

        String setupSql = chunk.substring(0, first).strip();
        String sql1 = stripLeadingCommentLines(chunk.substring(first + SQL1_MARKER.length(), second));
        String sql2 = stripLeadingCommentLines(chunk.substring(second + SQL2_MARKER.length()));

        if (setupSql.isEmpty() || sql1.isEmpty() || sql2.isEmpty()) {
            return null;
        }
        return new Triple(setupSql, sql1, sql2);
    }

    /**
     * Drop the leading lines of a query segment that are blank or start with
     * "--" (provers prepend explanations there). Comments after the first SQL
     * line are kept.
     */
    static String stripLeadingCommentLines(String segment) {
        String[] lines = segment.strip().split("\\R", -1);
        StringBuilder sb = new StringBuilder();
        boolean started = false;
        for (String line : lines) {
            String t = line.strip();
            if (!started && (t.isEmpty() || t.startsWith(COMMENT_PREFIX))) {
                continue;
            }
            if (started) sb.append('\n');
            started = true;
            sb.append(line);
        }
        return sb.toString().strip();
    }
}
