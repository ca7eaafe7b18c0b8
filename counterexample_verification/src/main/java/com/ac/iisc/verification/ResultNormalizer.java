package com.ac.iisc.verification;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.sql.Clob;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Objects;

import org.json.JSONArray;

import com.google.common.collect.ImmutableMultiset;
import com.google.common.collect.Multiset;

/**
 * Makes JDBC cell values comparable and compares two query results.
 *
 * Every cell becomes null, a Long, a finite Double or a String. Each row is
 * then rendered as a canonical JSON array (org.json), which is the unit of
 * comparison: org.json prints integral doubles without a fraction, so 1 and
 * 1.0 produce the same key, while the number 1 and the text '1' do not.
 */
public final class ResultNormalizer
{
    private ResultNormalizer() {
    }

    /** Coerce one driver value into null, Long, Double or String. */
    public static Object normalizeCell(Object v)
    {
        if (v == null) return null;
        if (v instanceof String s) return s;
        if (v instanceof Long || v instanceof Integer || v instanceof Short || v instanceof Byte) {
            return ((Number) v).longValue();
        }
        if (v instanceof Double || v instanceof Float) {
            double d = ((Number) v).doubleValue();
            // JSON has no NaN/Infinity
            return Double.isFinite(d) ? (Object) d : String.valueOf(d);
        }
        if (v instanceof BigInteger bi) {
            return bi.bitLength() < 64 ? (Object) bi.longValue() : bi.toString();
        }
        if (v instanceof BigDecimal bd) {
            BigDecimal stripped = bd.stripTrailingZeros();
            if (stripped.scale() <= 0 && stripped.precision() - stripped.scale() < 19) {
                return stripped.longValueExact();
            }
            double d = bd.doubleValue();
            return Double.isFinite(d) ? (Object) d : bd.toPlainString();
        }
        if (v instanceof Boolean b) return b ? 1L : 0L;
        if (v instanceof byte[] bytes) return decodeBytes(bytes);
        if (v instanceof Clob clob) {
            try {
                return clob.getSubString(1, (int) clob.length());
            } catch (SQLException ex) {
                return String.valueOf(clob);
            }
        }
        return String.valueOf(v);
    }

    /** UTF-8 text when the bytes are valid UTF-8, Base64 otherwise. */
    static String decodeBytes(byte[] bytes) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException ex) {
            return Base64.getEncoder().encodeToString(bytes);
        }
    }

    /** Canonical text form of one normalized row. */
    public static String rowKey(List<Object> row) {
        return new JSONArray(row).toString();
    }

    /** JSON array text of a list of normalized rows. */
    public static String rowsToJson(List<List<Object>> rows) {
        JSONArray arr = new JSONArray();
        for (List<Object> row : rows) {
            arr.put(new JSONArray(row));
        }
        return arr.toString();
    }

    /**
     * Column names must match exactly in both modes. Order-sensitive compares
     * the row sequences, order-insensitive compares the row multisets.
     */
    public static boolean resultsEqual(QueryOutcome a, QueryOutcome b, ComparisonMode mode)
    {
        if (!a.getColumns().equals(b.getColumns())) return false;
        if (a.getRowCount() != b.getRowCount()) return false;

        if (mode == ComparisonMode.ORDER_SENSITIVE) {
            return keys(a.getFullRows()).equals(keys(b.getFullRows()));
        }
        return bag(a.getFullRows()).equals(bag(b.getFullRows()));
    }

    private static List<String> keys(List<List<Object>> rows) {
        List<String> out = new ArrayList<>(rows.size());
        for (List<Object> row : rows) out.add(rowKey(row));
        return out;
    }

    private static Multiset<String> bag(List<List<Object>> rows) {
        return ImmutableMultiset.copyOf(keys(rows));
    }

    /** The only value of a one-row, one-column result; null for any other shape. */
    public static Object maybeScalar(List<String> columns, List<List<Object>> rows) {
        if (rows.size() == 1 && columns.size() == 1) {
            List<Object> only = rows.get(0);
            return only.isEmpty() ? null : only.get(0);
        }
        return null;
    }

    /** Text form of a scalar for the results table; "" when absent. */
    public static String scalarText(Object scalar) {
        return Objects.toString(scalar, "");
    }
}
