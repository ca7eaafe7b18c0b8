package com.ac.iisc.verification;

import java.util.regex.Pattern;

import org.apache.calcite.avatica.util.Casing;
import org.apache.calcite.avatica.util.Quoting;
import org.apache.calcite.sql.SqlKind;
import org.apache.calcite.sql.SqlNode;
import org.apache.calcite.sql.SqlOrderBy;
import org.apache.calcite.sql.SqlWith;
import org.apache.calcite.sql.parser.SqlParseException;
import org.apache.calcite.sql.parser.SqlParser;
import org.apache.calcite.sql.validate.SqlConformanceEnum;

/**
 * Syntactic facts about a query, read with Calcite's parser (no validation, no
 * schema). Used to flag sides whose row order is engine-defined when results
 * are compared order-sensitively.
 */
public final class QueryFeatures
{
    private static final Pattern ORDER_BY = Pattern.compile("\\border\\s+by\\b", Pattern.CASE_INSENSITIVE);

    private static final SqlParser.Config PARSER_CONFIG = SqlParser.config()
            .withQuoting(Quoting.DOUBLE_QUOTE)
            .withUnquotedCasing(Casing.UNCHANGED)
            .withQuotedCasing(Casing.UNCHANGED)
            .withCaseSensitive(false)
            .withConformance(SqlConformanceEnum.BABEL);

    private QueryFeatures() {
    }

    /**
     * True when the outermost query sorts its result. Falls back to a textual
     * search for ORDER BY when Calcite cannot parse the statement (SQLite
     * specific syntax); the fallback also matches ORDER BY inside subqueries.
     */
    public static boolean hasOrderBy(String sql)
    {
        if (sql == null || sql.isBlank()) return false;
        String text = stripTrailingSemicolon(sql);
        try {
            SqlNode node = SqlParser.create(text, PARSER_CONFIG).parseQuery();
            return isOrdered(node);
        } catch (SqlParseException | RuntimeException ex) {
            return ORDER_BY.matcher(sql).find();
        }
    }

    private static boolean isOrdered(SqlNode node) {
        if (node == null) return false;
        if (node.getKind() == SqlKind.ORDER_BY) {
            // LIMIT without ORDER BY is also parsed into SqlOrderBy
            return ((SqlOrderBy) node).orderList.size() > 0;
        }
        if (node instanceof SqlWith with) {
            return isOrdered(with.body);
        }
        return false;
    }

    static String stripTrailingSemicolon(String sql) {
        String t = sql.strip();
        while (t.endsWith(";")) {
            t = t.substring(0, t.length() - 1).strip();
        }
        return t;
    }
}
