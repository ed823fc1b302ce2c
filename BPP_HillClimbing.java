import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Hill climbing over {@link BPP_Neighborhood}. The four variants share one
 * search loop; a variant only chooses how the next candidate is picked and
 * which {@link AcceptancePolicy} judges it.
 */
public final class BPP_HillClimbing {

  public enum Variant {
    STEEPEST_ASCENT("Steepest Ascent Hill Climbing"),
    STOCHASTIC("Stochastic Hill Climbing"),
    SIDEWAYS_MOVE("Sideways Move Hill Climbing"),
    RANDOM_RESTART("Random Restart Hill Climbing");

    private final String displayName;

    Variant(String displayName) {
      this.displayName = displayName;
    }

    public String displayName() {
      return displayName;
    }
  }

  /** Outcome of one iteration of the loop. */
  enum Step {
    IMPROVED, PLATEAU, TERMINATED
  }

  /**
   * Judges the chosen candidate against the current packing. Policies keep
   * per-climb state (the sideways counter) and are created fresh for every
   * climb.
   */
  interface AcceptancePolicy {
    Step judge(BPP_Score current, BPP_Score candidate);

    /** Why the climb ended, valid after {@link #judge} returned TERMINATED. */
    BPP_Result.Termination stopReason();

    static AcceptancePolicy strictlyBetter() {
      return new AcceptancePolicy() {
        @Override
        public Step judge(BPP_Score current, BPP_Score candidate) {
          return candidate != null && candidate.isBetterThan(current) ? Step.IMPROVED : Step.TERMINATED;
        }

        @Override
        public BPP_Result.Termination stopReason() {
          return BPP_Result.Termination.LOCAL_OPTIMUM;
        }
      };
    }

    static AcceptancePolicy betterOrEqualWithin(int sidewaysLimit) {
      return new AcceptancePolicy() {
        private int consecutive = 0;
        private BPP_Result.Termination reason = BPP_Result.Termination.LOCAL_OPTIMUM;

        @Override
        public Step judge(BPP_Score current, BPP_Score candidate) {
          if (candidate == null) {
            reason = BPP_Result.Termination.LOCAL_OPTIMUM;
            return Step.TERMINATED;
          }
          int cmp = candidate.compareTo(current);
          if (cmp < 0) {
            consecutive = 0;
            return Step.IMPROVED;
          }
          if (cmp == 0) {
            if (consecutive >= sidewaysLimit) {
              reason = BPP_Result.Termination.SIDEWAYS_LIMIT;
              return Step.TERMINATED;
            }
            consecutive++;
            return Step.PLATEAU;
          }
          reason = BPP_Result.Termination.LOCAL_OPTIMUM;
          return Step.TERMINATED;
        }

        @Override
        public BPP_Result.Termination stopReason() {
          return reason;
        }
      };
    }
  }

  public static final class Config {
    /** Hard stop per climb, regardless of convergence. */
    public int maxIterations = 1000;
    /** Consecutive equal-score moves allowed (sideways variant). */
    public int sidewaysLimit = 100;
    /** Climbs after the first one (random-restart variant). */
    public int restarts = 10;
    /** Variant used for each climb of a random restart. */
    public Variant restartBase = Variant.STEEPEST_ASCENT;
    /** Candidates examined per stochastic iteration, 0 = whole neighborhood. */
    public int stochasticTrials = 0;
    /** Start packing; random restarts always use RANDOM_FIT. */
    public BPP_Initializer initializer = BPP_Initializer.FIRST_FIT;
    public boolean verbose = false;
    public String logFilePath = null;
    public int logInterval = 1;

    public Config() {
    }

    public Config(Config other) {
      this.maxIterations = other.maxIterations;
      this.sidewaysLimit = other.sidewaysLimit;
      this.restarts = other.restarts;
      this.restartBase = other.restartBase;
      this.stochasticTrials = other.stochasticTrials;
      this.initializer = other.initializer;
      this.verbose = other.verbose;
      this.logFilePath = other.logFilePath;
      this.logInterval = other.logInterval;
    }

    void validate(Variant variant) {
      BPP_InvalidConfigException.check(variant != null, "variant", variant, "a hill climbing variant");
      BPP_InvalidConfigException.check(maxIterations >= 1, "max_iterations", maxIterations, ">= 1");
      BPP_InvalidConfigException.check(sidewaysLimit >= 0, "sideways_limit", sidewaysLimit, ">= 0");
      BPP_InvalidConfigException.check(restarts >= 0, "restarts", restarts, ">= 0");
      BPP_InvalidConfigException.check(stochasticTrials >= 0, "stochastic_trials", stochasticTrials, ">= 0");
      BPP_InvalidConfigException.check(initializer != null, "initializer", null, "an initializer name");
      BPP_InvalidConfigException.check(logInterval >= 1, "log_interval", logInterval, ">= 1");
      if (variant == Variant.RANDOM_RESTART) {
        BPP_InvalidConfigException.check(restartBase != null && restartBase != Variant.RANDOM_RESTART,
            "restart_base", restartBase, "STEEPEST_ASCENT, STOCHASTIC or SIDEWAYS_MOVE");
      }
    }
  }

  // Result of a single climb to a local optimum
  private static final class Climb {
    BPP_State state;
    BPP_Score score;
    BPP_State best;
    BPP_Score bestScore;
    int iterations;
    int sidewaysMoves;
    long evaluations;
    BPP_Result.Termination termination;
  }

  private BPP_HillClimbing() {
  }

  public static BPP_Result run(BPP_Input input, Variant variant, Config config, Random rng) {
    config.validate(variant);
    if (rng == null && variant != Variant.STEEPEST_ASCENT && variant != Variant.SIDEWAYS_MOVE) {
      throw new IllegalArgumentException(variant + " needs a random source");
    }
    if (input.isEmpty())
      return BPP_Result.empty(variant.displayName(), input);

    long t0 = System.nanoTime();
    List<Double> history = new ArrayList<>();
    Map<String, Object> metrics = new LinkedHashMap<>();
    BPP_State start = config.initializer.initialize(input, rng);
    BPP_Score initialScore = BPP_Objective.evaluate(start);

    if (config.verbose) {
      System.out.println("\n=== " + variant.displayName() + " Started ===");
      System.out.println("Initial: " + initialScore);
    }

    try (BPP_ProgressLog log = BPP_ProgressLog.open(config.logFilePath, config.logInterval)) {
      if (variant != Variant.RANDOM_RESTART) {
        Climb c = climb(start, variant, config, rng, history, log, 0, t0);
        metrics.put("evaluations", c.evaluations);
        metrics.put("sideways_moves", c.sidewaysMoves);
        return finish(variant, config, c.best, initialScore, c.iterations, t0, c.termination, history, metrics);
      }

      // Random restart: first climb from the configured start, then from random packings
      BPP_State best = null;
      BPP_Score bestScore = null;
      int totalIterations = 0;
      long evaluations = 0;
      List<Integer> binsPerClimb = new ArrayList<>();
      BPP_State from = start;
      for (int r = 0; r <= config.restarts; r++) {
        if (r > 0)
          from = BPP_Initializer.RANDOM_FIT.initialize(input, rng);
        Climb c = climb(from, config.restartBase, config, rng, history, log, totalIterations, t0);
        totalIterations += c.iterations;
        evaluations += c.evaluations;
        binsPerClimb.add(c.bestScore.bins());
        if (best == null || c.bestScore.isBetterThan(bestScore)) {
          best = c.best;
          bestScore = c.bestScore;
          if (config.verbose)
            System.out.println("Restart " + r + ": NEW BEST " + bestScore);
        }
      }
      metrics.put("evaluations", evaluations);
      metrics.put("restarts", config.restarts);
      metrics.put("bins_per_climb", binsPerClimb);
      return finish(variant, config, best, initialScore, totalIterations, t0,
          BPP_Result.Termination.RESTARTS_EXHAUSTED, history, metrics);
    }
  }

  private static BPP_Result finish(Variant variant, Config config, BPP_State best, BPP_Score initialScore,
      int iterations, long t0, BPP_Result.Termination termination, List<Double> history,
      Map<String, Object> metrics) {
    long elapsedMs = (System.nanoTime() - t0) / 1_000_000L;
    BPP_Result result = new BPP_Result(variant.displayName(), best, initialScore, iterations, elapsedMs, termination,
        history, metrics);
    if (config.verbose) {
      System.out.println("=== " + variant.displayName() + " Complete ===");
      System.out.println("Total Iterations: " + iterations);
      System.out.println("Best: " + result.score());
      System.out.println("Stopping criterion: " + termination.label());
    }
    return result;
  }

  /**
   * Climbs from {@code start} until the policy terminates or the iteration cap
   * is hit. Appends one history entry per accepted move (plus the start).
   */
  private static Climb climb(BPP_State start, Variant variant, Config config, Random rng, List<Double> history,
      BPP_ProgressLog log, int iterationOffset, long t0) {
    AcceptancePolicy policy = variant == Variant.SIDEWAYS_MOVE
        ? AcceptancePolicy.betterOrEqualWithin(config.sidewaysLimit)
        : AcceptancePolicy.strictlyBetter();

    Climb c = new Climb();
    c.state = start;
    c.score = BPP_Objective.evaluate(start);
    c.best = start;
    c.bestScore = c.score;
    history.add(c.score.value());
    BPP_State previous = null;

    while (true) {
      if (c.iterations >= config.maxIterations) {
        c.termination = BPP_Result.Termination.ITERATION_CAP;
        break;
      }

      Step step;
      BPP_State next;
      if (variant == Variant.STOCHASTIC) {
        next = firstImprovingInRandomOrder(c, policy, config.stochasticTrials, rng);
        step = next == null ? Step.TERMINATED : Step.IMPROVED;
      } else {
        next = bestNeighbor(c, previous);
        step = policy.judge(c.score, next == null ? null : BPP_Objective.evaluate(next));
      }

      if (step == Step.TERMINATED) {
        c.termination = policy.stopReason();
        break;
      }

      previous = c.state;
      c.state = next;
      c.score = BPP_Objective.evaluate(next);
      c.iterations++;
      if (step == Step.PLATEAU)
        c.sidewaysMoves++;
      history.add(c.score.value());

      if (c.score.isBetterThan(c.bestScore)) {
        c.best = c.state;
        c.bestScore = c.score;
      }
      long elapsedMs = (System.nanoTime() - t0) / 1_000_000L;
      log.log(iterationOffset + c.iterations, elapsedMs, c.score.value(), c.bestScore.value(), c.score.bins(),
          c.sidewaysMoves);
    }
    long elapsedMs = (System.nanoTime() - t0) / 1_000_000L;
    log.logAlways(iterationOffset + c.iterations, elapsedMs, c.score.value(), c.bestScore.value(), c.score.bins(),
        c.sidewaysMoves);
    return c;
  }

  /**
   * Best scoring neighbor; the first one in neighborhood order on ties. The
   * packing we just came from is skipped so a plateau walk does not bounce
   * between two states.
   */
  private static BPP_State bestNeighbor(Climb c, BPP_State previous) {
    BPP_State best = null;
    BPP_Score bestScore = null;
    for (BPP_State neighbor : BPP_Neighborhood.neighbors(c.state, c.state.input())) {
      if (neighbor.equals(previous))
        continue;
      c.evaluations++;
      BPP_Score s = BPP_Objective.evaluate(neighbor);
      if (bestScore == null || s.isBetterThan(bestScore)) {
        best = neighbor;
        bestScore = s;
      }
    }
    return best;
  }

  private static BPP_State firstImprovingInRandomOrder(Climb c, AcceptancePolicy policy, int trials, Random rng) {
    List<BPP_Move> moves = BPP_Neighborhood.allMoves(c.state);
    Collections.shuffle(moves, rng);
    int limit = trials == 0 ? moves.size() : Math.min(trials, moves.size());
    for (int k = 0; k < limit; k++) {
      BPP_State candidate = moves.get(k).apply(c.state);
      c.evaluations++;
      if (policy.judge(c.score, BPP_Objective.evaluate(candidate)) == Step.IMPROVED)
        return candidate;
    }
    return null;
  }
}
