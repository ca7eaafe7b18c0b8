package com.ac.iisc.verification;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.json.JSONException;
import org.json.JSONObject;

/**
 * Execution accuracy (EX) of predicted SQL against gold SQL on the benchmark's
 * SQLite databases, overall and per difficulty band.
 *
 * Inputs (same layout as the benchmark's own evaluator):
 * - {@code <predicted_sql_path>/predict_<data_mode>.json}: object mapping the
 *   question index to {@code "<sql>\t----- bird -----\t<db_id>"}.
 * - {@code <ground_truth_path>/<data_mode>_gold.sql}: one {@code <sql>\t<db_id>} per line.
 * - {@code <db_root_path>/<db_id>/<db_id>.sqlite}.
 * - optional {@code --diff_json_path}: JSON array with a {@code difficulty} per question.
 *
 * Pairs run in parallel with a per-pair timeout; a pair scores 1 when both
 * queries return the same row set.
 */
public class ExecutionAccuracyEvaluator
{
    public static final String BIRD_SEPARATOR = "\t----- bird -----\t";

    // used by the benchmark when a prediction is missing
    static final String FALLBACK_SQL = " ";
    static final String FALLBACK_DB = "financial";

    /** A query and the database it targets. */
    static final class SqlEntry
    {
        final String sql;
        final String dbName;

        SqlEntry(String sql, String dbName) {
            this.sql = sql;
            this.dbName = dbName;
        }
    }

    private ExecutionAccuracyEvaluator() {
    }

    /** Predictions ordered by numeric question index. */
    static List<SqlEntry> loadPredicted(Path file) throws IOException
    {
        JSONObject obj;
        try {
            obj = new JSONObject(FileIO.readTextFile(file));
        } catch (JSONException ex) {
            throw new IOException("Malformed predictions file " + file + ": " + ex.getMessage(), ex);
        }
        List<String> keys = new ArrayList<>(obj.keySet());
        keys.sort(Comparator.comparingLong(ExecutionAccuracyEvaluator::indexOf).thenComparing(Comparator.naturalOrder()));

        List<SqlEntry> out = new ArrayList<>(keys.size());
        for (String k : keys) {
            Object v = obj.get(k);
            if (!(v instanceof String s)) {
                out.add(new SqlEntry(FALLBACK_SQL, FALLBACK_DB));
                continue;
            }
            int sep = s.lastIndexOf(BIRD_SEPARATOR);
            if (sep < 0) {
                throw new IOException("Prediction " + k + " in " + file + " has no database suffix");
            }
            out.add(new SqlEntry(s.substring(0, sep), s.substring(sep + BIRD_SEPARATOR.length()).trim()));
        }
        return out;
    }

    private static long indexOf(String key) {
        try {
            return Long.parseLong(key.trim());
        } catch (NumberFormatException ex) {
            return Long.MAX_VALUE;
        }
    }

    /** Gold queries, one per non-blank line. */
    static List<SqlEntry> loadGold(Path file) throws IOException
    {
        List<SqlEntry> out = new ArrayList<>();
        String[] lines = FileIO.readTextFile(file).split("\\R");
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].strip();
            if (line.isEmpty()) continue;
            int tab = line.lastIndexOf('\t');
            if (tab < 0) {
                throw new IOException(file + ":" + (i + 1) + ": expected '<sql>\\t<db_id>'");
            }
            out.add(new SqlEntry(line.substring(0, tab), line.substring(tab + 1).trim()));
        }
        return out;
    }

    static Path databasePath(Path dbRoot, String dbName) {
        return dbRoot.resolve(dbName).resolve(dbName + ".sqlite");
    }

    /**
     * Score predicted/gold pairs (zipped up to the shorter list). Each pair
     * runs against the database named by the prediction.
     *
     * @param labels difficulty per pair in the same order, or null
     */
    static DifficultyBreakdown evaluate(List<SqlEntry> predicted, List<SqlEntry> gold, Path dbRoot,
                                        int workers, Duration timeout, List<String> labels) throws InterruptedException
    {
        int n = Math.min(predicted.size(), gold.size());
        if (predicted.size() != gold.size()) {
            System.err.println("[ExecutionAccuracyEvaluator] " + predicted.size() + " predictions vs "
                    + gold.size() + " gold queries; scoring the first " + n);
        }
        List<ExecutionMatchTask> tasks = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            SqlEntry p = predicted.get(i);
            tasks.add(new ExecutionMatchTask(p.sql, gold.get(i).sql, databasePath(dbRoot, p.dbName)));
        }
        List<Integer> flags = new ParallelScheduler(workers, timeout, "pairs").runAll(tasks);
        List<String> bandLabels = null;
        if (labels != null) {
            // unlabelled pairs only count toward the total
            bandLabels = new ArrayList<>(labels.subList(0, Math.min(labels.size(), n)));
            while (bandLabels.size() < n) bandLabels.add(null);
        }
        return DifficultyAggregator.compute(flags, bandLabels);
    }

    static int run(String[] args)
    {
        String predictedPath = null, groundTruthPath = null, dataMode = null, dbRoot = null, diffJson = null;
        int cpus = 1;
        double metaTimeOut = 30.0;
        try {
            for (int i = 0; i < args.length; i++) {
                String a = args[i];
                String v = i + 1 < args.length ? args[i + 1] : null;
                if (v == null) throw new IllegalArgumentException(a + " needs a value");
                switch (a) {
                    case "--predicted_sql_path" -> predictedPath = v;
                    case "--ground_truth_path" -> groundTruthPath = v;
                    case "--data_mode" -> dataMode = v;
                    case "--db_root_path" -> dbRoot = v;
                    case "--num_cpus" -> cpus = Integer.parseInt(v.trim());
                    case "--meta_time_out" -> metaTimeOut = Double.parseDouble(v.trim());
                    case "--diff_json_path" -> diffJson = v;
                    default -> throw new IllegalArgumentException("unknown option: " + a);
                }
                i++;
            }
            if (predictedPath == null || groundTruthPath == null || dataMode == null || dbRoot == null) {
                throw new IllegalArgumentException("--predicted_sql_path, --ground_truth_path, --data_mode and --db_root_path are required");
            }
            if (cpus < 1 || !(metaTimeOut > 0)) {
                throw new IllegalArgumentException("--num_cpus and --meta_time_out must be positive");
            }
        } catch (IllegalArgumentException ex) {
            // NumberFormatException is an IllegalArgumentException too
            System.err.println("[ExecutionAccuracyEvaluator] " + ex.getMessage());
            return 2;
        }

        try {
            List<SqlEntry> predicted = loadPredicted(Paths.get(predictedPath).resolve("predict_" + dataMode + ".json"));
            List<SqlEntry> gold = loadGold(Paths.get(groundTruthPath).resolve(dataMode + "_gold.sql"));
            List<String> labels = (diffJson == null || diffJson.isBlank())
                    ? null : DifficultyAggregator.loadDifficulties(Paths.get(diffJson));

            DifficultyBreakdown scores = evaluate(predicted, gold, Paths.get(dbRoot), cpus,
                    Duration.ofMillis(Math.round(metaTimeOut * 1000)), labels);
            System.out.print(scores.format());
            System.out.println("===========================================================================================");
            System.out.println("Finished evaluation");
            return 0;
        } catch (IOException ex) {
            System.err.println("[ExecutionAccuracyEvaluator] " + ex.getMessage());
            return 1;
        } catch (IllegalArgumentException ex) {
            System.err.println("[ExecutionAccuracyEvaluator] " + ex.getMessage());
            return 2;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            System.err.println("[ExecutionAccuracyEvaluator] Interrupted.");
            return 130;
        }
    }

    public static void main(String[] args) {
        int code = run(args);
        if (code != 0) System.exit(code);
    }
}
