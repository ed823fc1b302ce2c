import java.io.BufferedReader;
import java.io.FileReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Locale;
import java.util.Set;

import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

/**
 * Algorithm parameters for an experiment, read from an optional JSON file.
 * Every key is optional; a missing key keeps its default.
 *
 * <pre>
 * { "seed": 42,
 *   "log_directory": "logs",
 *   "hill_climbing":       { "max_iterations": 1000, ... },
 *   "simulated_annealing": { "initial_temperature": 10.0, ... },
 *   "genetic_algorithm":   { "population_size": 50, ... } }
 * </pre>
 *
 * Values are range checked by the algorithms themselves when a run starts;
 * this class only rejects values of the wrong type or unknown enum names.
 */
public final class BPP_Config {

  static final long DEFAULT_SEED = 42L;

  private static final Set<String> ROOT_KEYS = Set.of("seed", "log_directory", "hill_climbing",
      "simulated_annealing", "genetic_algorithm");
  private static final Set<String> HC_KEYS = Set.of("max_iterations", "sideways_limit", "restarts",
      "stochastic_trials", "initializer", "restart_base", "log_interval");
  private static final Set<String> SA_KEYS = Set.of("initial_temperature", "cooling_rate", "min_temperature",
      "iterations_per_temperature", "max_iterations", "initializer", "log_interval");
  private static final Set<String> GA_KEYS = Set.of("population_size", "max_generations", "crossover_probability",
      "mutation_probability", "selection", "tournament_size", "elitism_count", "stagnation_generations",
      "seeded_individuals", "mutation", "log_interval");

  private long seed = DEFAULT_SEED;
  /** Directory for per-run progress CSV files, null = no progress logs. */
  private String logDirectory = null;
  private BPP_HillClimbing.Config hc = new BPP_HillClimbing.Config();
  private BPP_SA.Config sa = new BPP_SA.Config();
  private BPP_GA.Config ga = new BPP_GA.Config();

  public BPP_Config() {
  }

  public static BPP_Config fromFile(String fileName) throws IOException {
    try (BufferedReader br = new BufferedReader(new FileReader(fileName, StandardCharsets.UTF_8))) {
      return fromJSON(new JSONObject(new JSONTokener(br)));
    }
  }

  public static BPP_Config fromJSON(JSONObject j) {
    BPP_Config c = new BPP_Config();
    warnUnknown("", j, ROOT_KEYS);
    if (j.has("seed"))
      c.seed = getLong(j, "seed");
    if (j.has("log_directory"))
      c.logDirectory = getString(j, "log_directory");

    JSONObject j_hc = section(j, "hill_climbing");
    if (j_hc != null) {
      warnUnknown("hill_climbing.", j_hc, HC_KEYS);
      BPP_HillClimbing.Config hc = c.hc;
      hc.maxIterations = j_hc.has("max_iterations") ? getInt(j_hc, "max_iterations") : hc.maxIterations;
      hc.sidewaysLimit = j_hc.has("sideways_limit") ? getInt(j_hc, "sideways_limit") : hc.sidewaysLimit;
      hc.restarts = j_hc.has("restarts") ? getInt(j_hc, "restarts") : hc.restarts;
      hc.stochasticTrials = j_hc.has("stochastic_trials") ? getInt(j_hc, "stochastic_trials") : hc.stochasticTrials;
      hc.logInterval = j_hc.has("log_interval") ? getInt(j_hc, "log_interval") : hc.logInterval;
      if (j_hc.has("initializer"))
        hc.initializer = getEnum(j_hc, "initializer", BPP_Initializer.class);
      if (j_hc.has("restart_base"))
        hc.restartBase = getEnum(j_hc, "restart_base", BPP_HillClimbing.Variant.class);
    }

    JSONObject j_sa = section(j, "simulated_annealing");
    if (j_sa != null) {
      warnUnknown("simulated_annealing.", j_sa, SA_KEYS);
      BPP_SA.Config sa = c.sa;
      sa.initialTemperature = j_sa.has("initial_temperature") ? getDouble(j_sa, "initial_temperature")
          : sa.initialTemperature;
      sa.coolingRate = j_sa.has("cooling_rate") ? getDouble(j_sa, "cooling_rate") : sa.coolingRate;
      sa.minTemperature = j_sa.has("min_temperature") ? getDouble(j_sa, "min_temperature") : sa.minTemperature;
      sa.iterationsPerTemperature = j_sa.has("iterations_per_temperature")
          ? getInt(j_sa, "iterations_per_temperature")
          : sa.iterationsPerTemperature;
      sa.maxIterations = j_sa.has("max_iterations") ? getInt(j_sa, "max_iterations") : sa.maxIterations;
      sa.logInterval = j_sa.has("log_interval") ? getInt(j_sa, "log_interval") : sa.logInterval;
      if (j_sa.has("initializer"))
        sa.initializer = getEnum(j_sa, "initializer", BPP_Initializer.class);
    }

    JSONObject j_ga = section(j, "genetic_algorithm");
    if (j_ga != null) {
      warnUnknown("genetic_algorithm.", j_ga, GA_KEYS);
      BPP_GA.Config ga = c.ga;
      ga.populationSize = j_ga.has("population_size") ? getInt(j_ga, "population_size") : ga.populationSize;
      ga.maxGenerations = j_ga.has("max_generations") ? getInt(j_ga, "max_generations") : ga.maxGenerations;
      ga.crossoverProbability = j_ga.has("crossover_probability") ? getDouble(j_ga, "crossover_probability")
          : ga.crossoverProbability;
      ga.mutationProbability = j_ga.has("mutation_probability") ? getDouble(j_ga, "mutation_probability")
          : ga.mutationProbability;
      ga.tournamentSize = j_ga.has("tournament_size") ? getInt(j_ga, "tournament_size") : ga.tournamentSize;
      ga.elitismCount = j_ga.has("elitism_count") ? getInt(j_ga, "elitism_count") : ga.elitismCount;
      ga.stagnationGenerations = j_ga.has("stagnation_generations") ? getInt(j_ga, "stagnation_generations")
          : ga.stagnationGenerations;
      ga.seededIndividuals = j_ga.has("seeded_individuals") ? getInt(j_ga, "seeded_individuals")
          : ga.seededIndividuals;
      ga.logInterval = j_ga.has("log_interval") ? getInt(j_ga, "log_interval") : ga.logInterval;
      if (j_ga.has("selection"))
        ga.selection = getEnum(j_ga, "selection", BPP_GA.Selection.class);
      if (j_ga.has("mutation"))
        ga.mutation = getEnum(j_ga, "mutation", BPP_GA.Mutation.class);
    }
    return c;
  }

  // --- Accessors, each returns a copy so runs never share mutable config ---

  public long seed() {
    return seed;
  }

  public void setSeed(long seed) {
    this.seed = seed;
  }

  public String logDirectory() {
    return logDirectory;
  }

  public void setLogDirectory(String logDirectory) {
    this.logDirectory = logDirectory;
  }

  /** Console progress for every algorithm. */
  public void setVerbose(boolean verbose) {
    hc.verbose = verbose;
    sa.verbose = verbose;
    ga.verbose = verbose;
  }

  public BPP_HillClimbing.Config hillClimbingConfig() {
    return new BPP_HillClimbing.Config(hc);
  }

  public BPP_SA.Config saConfig() {
    return new BPP_SA.Config(sa);
  }

  public BPP_GA.Config gaConfig() {
    return new BPP_GA.Config(ga);
  }

  // Live references, used by tests and the launcher to override single values
  BPP_HillClimbing.Config hc() {
    return hc;
  }

  BPP_SA.Config sa() {
    return sa;
  }

  BPP_GA.Config ga() {
    return ga;
  }

  /** Copy that differs only in the log file paths, used per experiment unit. */
  BPP_Config withLogFile(String path) {
    BPP_Config c = new BPP_Config();
    c.seed = seed;
    c.logDirectory = logDirectory;
    c.hc = new BPP_HillClimbing.Config(hc);
    c.sa = new BPP_SA.Config(sa);
    c.ga = new BPP_GA.Config(ga);
    c.hc.logFilePath = path;
    c.sa.logFilePath = path;
    c.ga.logFilePath = path;
    return c;
  }

  public JSONObject toJSON() {
    JSONObject root = new JSONObject();
    root.put("seed", seed);
    if (logDirectory != null)
      root.put("log_directory", logDirectory);

    JSONObject j_hc = new JSONObject();
    j_hc.put("max_iterations", hc.maxIterations);
    j_hc.put("sideways_limit", hc.sidewaysLimit);
    j_hc.put("restarts", hc.restarts);
    j_hc.put("stochastic_trials", hc.stochasticTrials);
    j_hc.put("initializer", hc.initializer.name());
    j_hc.put("restart_base", hc.restartBase.name());
    root.put("hill_climbing", j_hc);

    JSONObject j_sa = new JSONObject();
    j_sa.put("initial_temperature", sa.initialTemperature);
    j_sa.put("cooling_rate", sa.coolingRate);
    j_sa.put("min_temperature", sa.minTemperature);
    j_sa.put("iterations_per_temperature", sa.iterationsPerTemperature);
    j_sa.put("max_iterations", sa.maxIterations);
    j_sa.put("initializer", sa.initializer.name());
    root.put("simulated_annealing", j_sa);

    JSONObject j_ga = new JSONObject();
    j_ga.put("population_size", ga.populationSize);
    j_ga.put("max_generations", ga.maxGenerations);
    j_ga.put("crossover_probability", ga.crossoverProbability);
    j_ga.put("mutation_probability", ga.mutationProbability);
    j_ga.put("selection", ga.selection.name());
    j_ga.put("tournament_size", ga.tournamentSize);
    j_ga.put("elitism_count", ga.elitismCount);
    j_ga.put("stagnation_generations", ga.stagnationGenerations);
    j_ga.put("seeded_individuals", ga.seededIndividuals);
    j_ga.put("mutation", ga.mutation.name());
    root.put("genetic_algorithm", j_ga);
    return root;
  }

  // --- JSON helpers ---

  private static JSONObject section(JSONObject j, String key) {
    if (!j.has(key))
      return null;
    JSONObject s = j.optJSONObject(key);
    if (s == null)
      throw new BPP_InvalidConfigException(key, j.get(key), "a JSON object");
    return s;
  }

  private static void warnUnknown(String prefix, JSONObject j, Set<String> known) {
    for (String key : j.keySet()) {
      if (!known.contains(key))
        System.err.println("Warning: unknown configuration key " + prefix + key + " ignored");
    }
  }

  private static int getInt(JSONObject j, String key) {
    try {
      return j.getInt(key);
    } catch (JSONException e) {
      throw invalid(key, j.get(key), "an integer", e);
    }
  }

  private static long getLong(JSONObject j, String key) {
    try {
      return j.getLong(key);
    } catch (JSONException e) {
      throw invalid(key, j.get(key), "an integer", e);
    }
  }

  private static double getDouble(JSONObject j, String key) {
    try {
      return j.getDouble(key);
    } catch (JSONException e) {
      throw invalid(key, j.get(key), "a number", e);
    }
  }

  private static String getString(JSONObject j, String key) {
    try {
      return j.getString(key);
    } catch (JSONException e) {
      throw invalid(key, j.get(key), "a string", e);
    }
  }

  private static <E extends Enum<E>> E getEnum(JSONObject j, String key, Class<E> type) {
    String name = getString(j, key);
    try {
      return Enum.valueOf(type, name.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw invalid(key, name, "one of " + Arrays.toString(type.getEnumConstants()), e);
    }
  }

  private static BPP_InvalidConfigException invalid(String key, Object value, String expected, Exception cause) {
    BPP_InvalidConfigException ex = new BPP_InvalidConfigException(key, value, expected);
    ex.initCause(cause);
    return ex;
  }
}
