package com.ac.iisc.verification;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

public class BlockParserTest
{
    private static final String SETUP = "CREATE TABLE t(x INT);\nINSERT INTO t VALUES (1),(2);";

    private static String block(String setup, String sql1, String sql2) {
        return setup + "\n" + BlockParser.SQL1_MARKER + "\n" + sql1 + "\n" + BlockParser.SQL2_MARKER + "\n" + sql2;
    }

    private final BlockParser parser = new BlockParser();

    @Test
    void testSingleBlock()
    {
        List<BlockParser.Triple> triples = parser.parse(block(SETUP, "SELECT x FROM t", "SELECT x FROM t ORDER BY x DESC"));

        assertEquals(1, triples.size());
        assertEquals(SETUP, triples.get(0).getSetupSql());
        assertEquals("SELECT x FROM t", triples.get(0).getSql1());
        assertEquals("SELECT x FROM t ORDER BY x DESC", triples.get(0).getSql2());
    }

    @Test
    void testLeadingCommentLinesAreDroppedFromQueries()
    {
        String sql1 = "-- the generated query\n\n-- second note\nSELECT x\n-- kept\nFROM t";
        List<BlockParser.Triple> triples = parser.parse(block(SETUP, sql1, "  -- only note\nSELECT 1"));

        assertEquals(1, triples.size());
        assertEquals("SELECT x\n-- kept\nFROM t", triples.get(0).getSql1());
        assertEquals("SELECT 1", triples.get(0).getSql2());
    }

    @Test
    void testMissingMarkerYieldsNothing()
    {
        String noSecond = SETUP + "\n" + BlockParser.SQL1_MARKER + "\nSELECT 1";
        String noFirst = SETUP + "\n" + BlockParser.SQL2_MARKER + "\nSELECT 1";
        String swapped = SETUP + "\n" + BlockParser.SQL2_MARKER + "\nSELECT 1\n" + BlockParser.SQL1_MARKER + "\nSELECT 2";

        assertTrue(parser.parse(noSecond).isEmpty());
        assertTrue(parser.parse(noFirst).isEmpty());
        assertTrue(parser.parse(swapped).isEmpty());
    }

    @Test
    void testMarkersAreCaseSensitive()
    {
        String text = SETUP + "\n-- ----------SQL1------------\nSELECT 1\n-- ----------SQL2------------\nSELECT 2";
        assertTrue(parser.parse(text).isEmpty());
    }

    @Test
    void testEmptySegmentsAreDropped()
    {
        assertTrue(parser.parse(block("", "SELECT 1", "SELECT 2")).isEmpty());
        assertTrue(parser.parse(block(SETUP, "-- nothing but a comment", "SELECT 2")).isEmpty());
        assertTrue(parser.parse(block(SETUP, "SELECT 1", "   ")).isEmpty());
    }

    @Test
    void testNullAndBlankInput()
    {
        assertTrue(parser.parse(null).isEmpty());
        assertTrue(parser.parse("   \n").isEmpty());
        assertTrue(parser.parse(BlockParser.BLOCK_DELIMITER).isEmpty());
    }

    @Test
    void testSeveralBlocksGetSuffixedIds()
    {
        String text = block(SETUP, "SELECT 1", "SELECT 2")
                + "\n" + BlockParser.BLOCK_DELIMITER + "\n"
                + "garbage without markers"
                + "\n" + BlockParser.BLOCK_DELIMITER + "\n"
                + block(SETUP, "SELECT 3", "SELECT 4")
                + "\n" + BlockParser.BLOCK_DELIMITER + "\n"
                + block(SETUP, "SELECT 5", "SELECT 6");

        List<CounterexampleCase> cases = parser.parseCases("42", 3, text);

        assertEquals(3, cases.size());
        assertEquals("42", cases.get(0).getQuestionId());
        assertEquals("42_blk2", cases.get(1).getQuestionId());
        assertEquals("42_blk3", cases.get(2).getQuestionId());
        assertEquals("SELECT 3", cases.get(1).getSql1());
        for (CounterexampleCase c : cases) {
            assertEquals(Integer.valueOf(3), c.getBoundSize());
        }
    }

    @Test
    void testMissingBoundSizeIsCarriedAsNull()
    {
        List<CounterexampleCase> cases = parser.parseCases("7", null, block(SETUP, "SELECT 1", "SELECT 2"));
        assertEquals(1, cases.size());
        assertNull(cases.get(0).getBoundSize());
    }
}
