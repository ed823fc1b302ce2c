import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.json.JSONArray;
import org.json.JSONObject;

/**
 * Outcome of one algorithm run: the best packing found, its score and how the
 * run ended. Immutable.
 */
public final class BPP_Result {

  public enum Termination {
    /** No neighbor improves the current packing. */
    LOCAL_OPTIMUM,
    /** Too many consecutive equal-score moves. */
    SIDEWAYS_LIMIT,
    /** Iteration cap of a single climb or annealing run. */
    ITERATION_CAP,
    RESTARTS_EXHAUSTED,
    MIN_TEMPERATURE,
    GENERATION_CAP,
    /** Best fitness unchanged for the configured number of generations. */
    STAGNATION,
    /** Zero items, nothing to search. */
    EMPTY_PROBLEM;

    public String label() {
      return name().toLowerCase(Locale.ROOT);
    }

    /** False when the run stopped on a hard cap rather than by itself. */
    public boolean converged() {
      return this != ITERATION_CAP && this != GENERATION_CAP;
    }
  }

  private final String algorithm;
  private final BPP_State state;
  private final BPP_Score score;
  private final BPP_Score initialScore;
  private final int iterations;
  private final long elapsedMillis;
  private final Termination termination;
  private final List<Double> history;
  private final Map<String, Object> metrics;

  BPP_Result(String algorithm, BPP_State state, BPP_Score initialScore, int iterations, long elapsedMillis,
      Termination termination, List<Double> history, Map<String, Object> metrics) {
    this.algorithm = algorithm;
    this.state = state;
    this.score = BPP_Objective.evaluate(state);
    this.initialScore = initialScore;
    this.iterations = iterations;
    this.elapsedMillis = elapsedMillis;
    this.termination = termination;
    this.history = Collections.unmodifiableList(new ArrayList<>(history));
    this.metrics = Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
  }

  static BPP_Result empty(String algorithm, BPP_Input input) {
    BPP_State state = BPP_State.fromAssignment(input, new int[0]);
    return new BPP_Result(algorithm, state, BPP_Score.EMPTY, 0, 0L, Termination.EMPTY_PROBLEM,
        Collections.emptyList(), Collections.emptyMap());
  }

  public String algorithm() {
    return algorithm;
  }

  public BPP_State state() {
    return state;
  }

  public BPP_Score score() {
    return score;
  }

  public BPP_Score initialScore() {
    return initialScore;
  }

  public int binsUsed() {
    return score.bins();
  }

  /** Iterations for local search, generations for the genetic algorithm. */
  public int iterations() {
    return iterations;
  }

  public long elapsedMillis() {
    return elapsedMillis;
  }

  public Termination termination() {
    return termination;
  }

  /**
   * Objective value per iteration: the current value for local search, the
   * best fitness of each generation for the genetic algorithm. Entry 0 is the
   * starting point.
   */
  public List<Double> history() {
    return history;
  }

  public Map<String, Object> metrics() {
    return metrics;
  }

  public Map<String, Integer> assignment() {
    return state.assignment();
  }

  /** Same run outcome, ignoring wall-clock time. */
  boolean sameOutcome(BPP_Result other) {
    return algorithm.equals(other.algorithm) && state.equals(other.state) && iterations == other.iterations
        && termination == other.termination && history.equals(other.history);
  }

  // --- Export ---

  public JSONObject toJSON() {
    return toJSON(false);
  }

  public JSONObject toJSON(boolean withDetails) {
    JSONObject j = new JSONObject();
    j.put("algorithm", algorithm);
    j.put("bins_used", binsUsed());
    j.put("score", score.value());
    j.put("iterations_or_generations", iterations);
    j.put("elapsed", elapsedMillis / 1000.0);
    j.put("termination_reason", termination.label());
    JSONObject a = new JSONObject();
    for (Map.Entry<String, Integer> e : assignment().entrySet())
      a.put(e.getKey(), e.getValue());
    j.put("assignment", a);
    if (withDetails) {
      j.put("initial_bins", initialScore.bins());
      j.put("initial_score", initialScore.value());
      j.put("objective", new JSONObject(BPP_Objective.components(state)));
      j.put("bins", state.binsToJSON());
      j.put("metrics", new JSONObject(metrics));
      j.put("history", new JSONArray(history));
    }
    return j;
  }

  static String csvHeader() {
    return "algorithm,bins_used,initial_bins,score,initial_score,iterations,elapsed_ms,termination,is_valid";
  }

  String toCsvLine() {
    return String.format(Locale.US, "%s,%d,%d,%.6f,%.6f,%d,%d,%s,%s", algorithm.replace(',', ';'), binsUsed(),
        initialScore.bins(), score.value(), initialScore.value(), iterations, elapsedMillis, termination.label(),
        state.isValid());
  }

  @Override
  public String toString() {
    return String.format(Locale.US, "%s: %d bins (score %.4f) after %d iterations in %d ms [%s]", algorithm,
        binsUsed(), score.value(), iterations, elapsedMillis, termination.label());
  }
}
