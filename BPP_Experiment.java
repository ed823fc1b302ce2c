import java.io.BufferedWriter;
import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.json.JSONArray;
import org.json.JSONObject;

/**
 * Runs a set of algorithms a number of times each on one problem and collects
 * the results. Units of work (one algorithm, one trial) run either in order or
 * on a fixed thread pool. Every unit draws from its own {@link Random} seeded
 * from the experiment seed and the unit index, so both modes give the same
 * results.
 */
public final class BPP_Experiment {

  /** One algorithm run inside the experiment. */
  static final class Unit {
    final int index;
    final BPP_Algorithm algorithm;
    final int trial;

    Unit(int index, BPP_Algorithm algorithm, int trial) {
      this.index = index;
      this.algorithm = algorithm;
      this.trial = trial;
    }
  }

  /** Aggregate over the trials of one algorithm. */
  public static final class Stats {
    public final String algorithm;
    public final int runs;
    public final int minBins;
    public final int maxBins;
    public final double meanBins;
    public final double bestScore;
    public final double meanScore;
    public final double meanElapsedMillis;

    Stats(String algorithm, List<BPP_Result> results) {
      this.algorithm = algorithm;
      this.runs = results.size();
      int min = Integer.MAX_VALUE;
      int max = Integer.MIN_VALUE;
      double bins = 0, score = 0, elapsed = 0;
      double best = Double.POSITIVE_INFINITY;
      for (BPP_Result r : results) {
        min = Math.min(min, r.binsUsed());
        max = Math.max(max, r.binsUsed());
        bins += r.binsUsed();
        score += r.score().value();
        best = Math.min(best, r.score().value());
        elapsed += r.elapsedMillis();
      }
      this.minBins = min;
      this.maxBins = max;
      this.meanBins = bins / runs;
      this.meanScore = score / runs;
      this.bestScore = best;
      this.meanElapsedMillis = elapsed / runs;
    }

    JSONObject toJSON() {
      JSONObject j = new JSONObject();
      j.put("runs", runs);
      j.put("min_bins", minBins);
      j.put("max_bins", maxBins);
      j.put("mean_bins", meanBins);
      j.put("best_score", bestScore);
      j.put("mean_score", meanScore);
      j.put("mean_elapsed", meanElapsedMillis / 1000.0);
      return j;
    }
  }

  private final BPP_Input input;
  private final BPP_Config config;
  private final List<BPP_Algorithm> algorithms;
  private final int trials;
  private final int threads;
  private List<BPP_Result> results = Collections.emptyList();
  private List<Unit> units = Collections.emptyList();

  /**
   * @param threads 1 runs the units one after the other, more uses a thread
   *                pool of that size
   */
  public BPP_Experiment(BPP_Input input, BPP_Config config, List<BPP_Algorithm> algorithms, int trials,
      int threads) {
    if (algorithms.isEmpty())
      throw new IllegalArgumentException("An experiment needs at least one algorithm");
    BPP_InvalidConfigException.check(trials >= 1, "trials", trials, ">= 1");
    BPP_InvalidConfigException.check(threads >= 1, "threads", threads, ">= 1");
    this.input = input;
    this.config = config;
    this.algorithms = new ArrayList<>(algorithms);
    this.trials = trials;
    this.threads = threads;
  }

  static long unitSeed(long seed, int unitIndex) {
    return seed + unitIndex;
  }

  /** Runs every unit and returns the results in unit order (algorithm, then trial). */
  public List<BPP_Result> run() {
    List<Unit> plan = new ArrayList<>();
    for (BPP_Algorithm a : algorithms) {
      for (int t = 0; t < trials; t++)
        plan.add(new Unit(plan.size(), a, t));
    }

    List<BPP_Result> out = new ArrayList<>(plan.size());
    if (threads == 1) {
      for (Unit u : plan)
        out.add(runUnit(u));
    } else {
      ExecutorService exec = Executors.newFixedThreadPool(Math.min(threads, plan.size()));
      try {
        List<Future<BPP_Result>> futures = new ArrayList<>();
        for (Unit u : plan)
          futures.add(exec.submit(() -> runUnit(u)));
        for (Future<BPP_Result> f : futures)
          out.add(await(f));
      } finally {
        exec.shutdownNow();
      }
    }
    this.units = Collections.unmodifiableList(plan);
    this.results = Collections.unmodifiableList(out);
    return results;
  }

  private BPP_Result runUnit(Unit u) {
    BPP_Config unitConfig = config.withLogFile(logFileFor(u));
    Random rng = new Random(unitSeed(config.seed(), u.index));
    return u.algorithm.run(input, unitConfig, rng);
  }

  private String logFileFor(Unit u) {
    if (config.logDirectory() == null)
      return null;
    return new File(config.logDirectory(), u.algorithm.cliName() + "_trial" + (u.trial + 1) + ".csv").getPath();
  }

  private static BPP_Result await(Future<BPP_Result> f) {
    try {
      return f.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Experiment interrupted", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException)
        throw (RuntimeException) cause;
      if (cause instanceof Error)
        throw (Error) cause;
      throw new IllegalStateException("Algorithm run failed", cause);
    }
  }

  // --- Aggregation ---

  public List<BPP_Result> results() {
    return results;
  }

  /** Best result by score; the earliest unit wins ties. Null before {@link #run}. */
  public BPP_Result best() {
    BPP_Result best = null;
    for (BPP_Result r : results) {
      if (best == null || r.score().isBetterThan(best.score()))
        best = r;
    }
    return best;
  }

  /** Statistics per algorithm display name, in run order. */
  public Map<String, Stats> statistics() {
    Map<String, List<BPP_Result>> grouped = new LinkedHashMap<>();
    for (BPP_Result r : results)
      grouped.computeIfAbsent(r.algorithm(), k -> new ArrayList<>()).add(r);
    Map<String, Stats> stats = new LinkedHashMap<>();
    for (Map.Entry<String, List<BPP_Result>> e : grouped.entrySet())
      stats.put(e.getKey(), new Stats(e.getKey(), e.getValue()));
    return stats;
  }

  // --- Export ---

  public JSONObject toJSON() {
    JSONObject root = new JSONObject();
    root.put("timestamp", Instant.now().toString());

    JSONObject problem = new JSONObject();
    problem.put("capacity", input.Capacity());
    problem.put("items", input.Items());
    problem.put("total_weight", input.TotalWeight());
    problem.put("lower_bound", input.LowerBound());
    root.put("problem", problem);

    root.put("config", config.toJSON());
    root.put("trials", trials);
    root.put("threads", threads);

    JSONArray runs = new JSONArray();
    for (int k = 0; k < results.size(); k++) {
      JSONObject j = results.get(k).toJSON(true);
      j.put("trial", units.get(k).trial + 1);
      j.put("seed", unitSeed(config.seed(), units.get(k).index));
      runs.put(j);
    }
    root.put("results", runs);

    JSONObject summary = new JSONObject();
    for (Map.Entry<String, Stats> e : statistics().entrySet())
      summary.put(e.getKey(), e.getValue().toJSON());
    root.put("summary", summary);
    BPP_Result best = best();
    if (best != null)
      root.put("best", best.toJSON());
    return root;
  }

  public void writeJson(String path) throws IOException {
    try (BufferedWriter w = open(path)) {
      w.write(toJSON().toString(2));
      w.newLine();
    }
  }

  public void writeCsv(String path) throws IOException {
    try (BufferedWriter w = open(path)) {
      w.write("trial,seed," + BPP_Result.csvHeader());
      w.newLine();
      for (int k = 0; k < results.size(); k++) {
        Unit u = units.get(k);
        w.write(String.format(Locale.US, "%d,%d,%s", u.trial + 1, unitSeed(config.seed(), u.index),
            results.get(k).toCsvLine()));
        w.newLine();
      }
    }
  }

  private static BufferedWriter open(String path) throws IOException {
    File f = new File(path);
    File parent = f.getParentFile();
    if (parent != null && !parent.exists() && !parent.mkdirs()) {
      throw new IOException("Cannot create directory " + parent);
    }
    return new BufferedWriter(new FileWriter(f, StandardCharsets.UTF_8, false));
  }
}
