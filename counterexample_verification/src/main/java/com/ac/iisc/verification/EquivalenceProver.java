package com.ac.iisc.verification;

import java.util.Map;

import org.json.JSONArray;
import org.json.JSONObject;

/**
 * Bounded SQL equivalence prover (VeriEQL or similar). Implementations live
 * outside this module; {@link ProverSweep} only drives them.
 */
public interface EquivalenceProver
{
    /**
     * Decide whether two queries agree on every database up to {@code boundSize}
     * rows per table.
     *
     * @param sqlA        first query (generated)
     * @param sqlB        second query (gold)
     * @param schema      table definitions of the database the queries run on
     * @param boundSize   bound on table sizes for the symbolic search
     * @param constraints integrity constraints of that database
     * @param options     prover switches such as {@code show_counterexample}
     * @throws Exception  any prover failure; recorded as an ERROR row
     */
    ProverResult verify(String sqlA, String sqlB, JSONObject schema, int boundSize,
                        JSONArray constraints, Map<String, Boolean> options) throws Exception;
}
