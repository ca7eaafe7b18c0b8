package com.ac.iisc.verification;

import java.time.Duration;
import java.util.Map;

/** One prover call for a question at one bound size. */
public class ProverTask implements VerificationTask<ProverResult>
{
    private final EquivalenceProver prover;
    private final ProverQuestion question;
    private final String generatedSql;
    private final String goldSql;
    private final int boundSize;
    private final Map<String, Boolean> options;

    /**
     * @param generatedSql generated query as it will be proved (already formatted)
     * @param goldSql      gold query as it will be proved (already formatted)
     */
    public ProverTask(EquivalenceProver prover, ProverQuestion question, String generatedSql, String goldSql,
                      int boundSize, Map<String, Boolean> options)
    {
        if (prover == null || question == null) {
            throw new IllegalArgumentException("prover and question are required");
        }
        this.prover = prover;
        this.question = question;
        this.generatedSql = generatedSql;
        this.goldSql = goldSql;
        this.boundSize = boundSize;
        this.options = options == null ? Map.of() : Map.copyOf(options);
    }

    @Override
    public ProverResult call() throws Exception {
        ProverResult r = prover.verify(generatedSql, goldSql, question.getSchema(), boundSize,
                                       question.getConstraints(), options);
        if (r == null) {
            throw new IllegalStateException("prover returned no result");
        }
        return r;
    }

    @Override
    public ProverResult timedOut(Duration budget) {
        return ProverResult.timeout();
    }

    @Override
    public ProverResult failed(Throwable cause) {
        return ProverResult.error(cause);
    }

    @Override
    public String describe() {
        return "question " + question.getQuestionId() + " @" + boundSize;
    }

    public ProverQuestion getQuestion() { return question; }
    public String getGeneratedSql() { return generatedSql; }
    public String getGoldSql() { return goldSql; }
    public int getBoundSize() { return boundSize; }
}
