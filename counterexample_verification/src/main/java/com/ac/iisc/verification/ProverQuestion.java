package com.ac.iisc.verification;

import org.json.JSONArray;
import org.json.JSONObject;

/** One benchmark question as the prover sweep needs it. */
public final class ProverQuestion
{
    private final String questionId;
    private final String generatedSql;
    private final String goldSql;
    private final JSONObject schema;
    private final JSONArray constraints;

    public ProverQuestion(String questionId, String generatedSql, String goldSql, JSONObject schema, JSONArray constraints)
    {
        if (questionId == null || questionId.isBlank()) {
            throw new IllegalArgumentException("questionId must not be null or blank");
        }
        this.questionId = questionId;
        this.generatedSql = generatedSql == null ? "" : generatedSql;
        this.goldSql = goldSql == null ? "" : goldSql;
        this.schema = schema == null ? new JSONObject() : schema;
        this.constraints = constraints == null ? new JSONArray() : constraints;
    }

    public String getQuestionId() { return questionId; }
    public String getGeneratedSql() { return generatedSql; }
    public String getGoldSql() { return goldSql; }
    public JSONObject getSchema() { return schema; }
    public JSONArray getConstraints() { return constraints; }
}
