import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Simulated annealing with a geometric cooling schedule. Each step draws one
 * random feasible neighbor and applies the Metropolis criterion on the scalar
 * score; the best packing seen anywhere on the trajectory is returned.
 */
public final class BPP_SA {

  public static final String NAME = "Simulated Annealing";

  /** Non-improving steps in a row that count as one "stuck" episode. */
  static final int STUCK_WINDOW = 10;
  /** Draws per step before giving up on finding a feasible neighbor. */
  static final int MOVE_TRIALS = 100;

  public static final class Config {
    public double initialTemperature = 10.0;
    /** Geometric cooling factor alpha, T = alpha * T. */
    public double coolingRate = 0.99;
    public double minTemperature = 0.001;
    public int iterationsPerTemperature = 20;
    /** Hard stop regardless of the temperature. */
    public int maxIterations = 20000;
    public BPP_Initializer initializer = BPP_Initializer.FIRST_FIT;
    public boolean verbose = false;
    public String logFilePath = null;
    public int logInterval = 100;

    public Config() {
    }

    public Config(Config other) {
      this.initialTemperature = other.initialTemperature;
      this.coolingRate = other.coolingRate;
      this.minTemperature = other.minTemperature;
      this.iterationsPerTemperature = other.iterationsPerTemperature;
      this.maxIterations = other.maxIterations;
      this.initializer = other.initializer;
      this.verbose = other.verbose;
      this.logFilePath = other.logFilePath;
      this.logInterval = other.logInterval;
    }

    void validate() {
      BPP_InvalidConfigException.check(initialTemperature > 0 && !Double.isInfinite(initialTemperature),
          "initial_temperature", initialTemperature, "> 0");
      BPP_InvalidConfigException.check(coolingRate > 0 && coolingRate < 1, "cooling_rate", coolingRate,
          "in (0, 1)");
      BPP_InvalidConfigException.check(minTemperature > 0 && minTemperature < initialTemperature,
          "min_temperature", minTemperature, "in (0, initial_temperature)");
      BPP_InvalidConfigException.check(iterationsPerTemperature >= 1, "iterations_per_temperature",
          iterationsPerTemperature, ">= 1");
      BPP_InvalidConfigException.check(maxIterations >= 1, "max_iterations", maxIterations, ">= 1");
      BPP_InvalidConfigException.check(initializer != null, "initializer", null, "an initializer name");
      BPP_InvalidConfigException.check(logInterval >= 1, "log_interval", logInterval, ">= 1");
    }
  }

  private BPP_SA() {
  }

  public static BPP_Result run(BPP_Input input, Config config, Random rand) {
    config.validate();
    if (rand == null) {
      throw new IllegalArgumentException("Simulated annealing needs a random source");
    }
    if (input.isEmpty())
      return BPP_Result.empty(NAME, input);

    long startTime = System.nanoTime();
    BPP_State currentState = config.initializer.initialize(input, rand);
    BPP_Score currentScore = BPP_Objective.evaluate(currentState);
    BPP_Score initialScore = currentScore;
    BPP_State bestState = currentState;
    BPP_Score bestScore = currentScore;

    if (config.verbose) {
      System.out.println("\nStarting SA Simulation...");
      System.out.println("Initial: " + currentScore);
    }

    List<Double> history = new ArrayList<>();
    history.add(currentScore.value());

    double T_curr = config.initialTemperature;
    int iter = 0;
    int atTemperature = 0;
    int accepted = 0;
    int acceptedWorse = 0;
    int noFeasibleMove = 0;
    int stuckCount = 0;
    int stuckCounter = 0;
    BPP_Result.Termination termination;

    try (BPP_ProgressLog log = BPP_ProgressLog.open(config.logFilePath, config.logInterval)) {
      log.logAlways(0, 0L, currentScore.value(), bestScore.value(), currentScore.bins(), T_curr);

      while (true) {
        if (T_curr < config.minTemperature) {
          termination = BPP_Result.Termination.MIN_TEMPERATURE;
          break;
        }
        if (iter >= config.maxIterations) {
          termination = BPP_Result.Termination.ITERATION_CAP;
          break;
        }
        iter++;

        // 1. Pick move
        BPP_Move move = BPP_Neighborhood.randomMove(currentState, rand, MOVE_TRIALS);
        boolean improvedBest = false;
        if (move == null) {
          noFeasibleMove++;
        } else {
          // 2. Metropolis criterion
          BPP_State candidate = move.apply(currentState);
          BPP_Score candidateScore = BPP_Objective.evaluate(candidate);
          double delta = candidateScore.value() - currentScore.value();
          boolean accept;
          if (delta <= 0) {
            accept = true;
          } else {
            accept = rand.nextDouble() < Math.exp(-delta / T_curr);
            if (accept)
              acceptedWorse++;
          }

          if (accept) {
            accepted++;
            currentState = candidate;
            currentScore = candidateScore;
            if (currentScore.isBetterThan(bestScore)) {
              bestState = currentState;
              bestScore = currentScore;
              improvedBest = true;
              if (config.verbose)
                System.out.println("New Best: " + bestScore + " (Iter " + iter + ")");
            }
          }
        }

        if (improvedBest) {
          stuckCounter = 0;
        } else if (++stuckCounter >= STUCK_WINDOW) {
          stuckCount++;
          stuckCounter = 0;
        }

        history.add(currentScore.value());
        long elapsed = (System.nanoTime() - startTime) / 1_000_000L;
        log.log(iter, elapsed, currentScore.value(), bestScore.value(), currentScore.bins(), T_curr);

        // 3. Cooling
        if (++atTemperature >= config.iterationsPerTemperature) {
          T_curr *= config.coolingRate;
          atTemperature = 0;
        }
      }

      long elapsed = (System.nanoTime() - startTime) / 1_000_000L;
      log.logAlways(iter, elapsed, currentScore.value(), bestScore.value(), currentScore.bins(), T_curr);

      Map<String, Object> metrics = new LinkedHashMap<>();
      metrics.put("initial_temperature", config.initialTemperature);
      metrics.put("cooling_rate", config.coolingRate);
      metrics.put("final_temperature", T_curr);
      metrics.put("accepted", accepted);
      metrics.put("accepted_worse", acceptedWorse);
      metrics.put("stuck_count", stuckCount);
      metrics.put("no_feasible_move", noFeasibleMove);

      if (config.verbose) {
        System.out.println("SA Finished after " + iter + " iterations. Best: " + bestScore);
        System.out.println("Accepted worse: " + acceptedWorse + ", stuck count: " + stuckCount);
        System.out.println("Stopping criterion: " + termination.label());
      }
      return new BPP_Result(NAME, bestState, initialScore, iter, elapsed, termination, history, metrics);
    }
  }
}
