import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Genetic algorithm over permutation-encoded packings. A chromosome is an
 * ordering of the item indices; it is decoded by sequential first-fit, so
 * every chromosome maps to a valid packing. Fitness is maximized and equals
 * {@code 1 / (1 + score)}.
 *
 * <p>
 * Every genetic operator keeps the permutation invariant: no item is ever
 * duplicated or dropped.
 */
public final class BPP_GA {

  public static final String NAME = "Genetic Algorithm";

  public enum Selection {
    TOURNAMENT, ROULETTE
  }

  public enum Mutation {
    /** Exchange two positions. */
    SWAP,
    /** Reverse a segment. */
    INVERSION
  }

  public static final class Config {
    public int populationSize = 50;
    public int maxGenerations = 500;
    public double crossoverProbability = 0.9;
    /** Chance that an offspring is mutated once. */
    public double mutationProbability = 0.2;
    public Selection selection = Selection.TOURNAMENT;
    public int tournamentSize = 3;
    /** Best individuals copied unchanged into the next generation. */
    public int elitismCount = 2;
    /** Generations without a change of the best fitness before stopping, 0 = never. */
    public int stagnationGenerations = 100;
    /** Initial individuals built from greedy orders, the rest are random. */
    public int seededIndividuals = 1;
    public Mutation mutation = Mutation.SWAP;
    public boolean verbose = false;
    public String logFilePath = null;
    public int logInterval = 1;

    public Config() {
    }

    public Config(Config other) {
      this.populationSize = other.populationSize;
      this.maxGenerations = other.maxGenerations;
      this.crossoverProbability = other.crossoverProbability;
      this.mutationProbability = other.mutationProbability;
      this.selection = other.selection;
      this.tournamentSize = other.tournamentSize;
      this.elitismCount = other.elitismCount;
      this.stagnationGenerations = other.stagnationGenerations;
      this.seededIndividuals = other.seededIndividuals;
      this.mutation = other.mutation;
      this.verbose = other.verbose;
      this.logFilePath = other.logFilePath;
      this.logInterval = other.logInterval;
    }

    void validate() {
      BPP_InvalidConfigException.check(populationSize >= 1, "population_size", populationSize, ">= 1");
      BPP_InvalidConfigException.check(maxGenerations >= 1, "max_generations", maxGenerations, ">= 1");
      BPP_InvalidConfigException.check(crossoverProbability >= 0 && crossoverProbability <= 1,
          "crossover_probability", crossoverProbability, "in [0, 1]");
      BPP_InvalidConfigException.check(mutationProbability >= 0 && mutationProbability <= 1,
          "mutation_probability", mutationProbability, "in [0, 1]");
      BPP_InvalidConfigException.check(selection != null, "selection", null, "TOURNAMENT or ROULETTE");
      BPP_InvalidConfigException.check(selection != Selection.TOURNAMENT || tournamentSize >= 1,
          "tournament_size", tournamentSize, ">= 1");
      BPP_InvalidConfigException.check(elitismCount >= 0 && elitismCount <= populationSize, "elitism_count",
          elitismCount, "in [0, population_size]");
      BPP_InvalidConfigException.check(stagnationGenerations >= 0, "stagnation_generations",
          stagnationGenerations, ">= 0");
      BPP_InvalidConfigException.check(seededIndividuals >= 0 && seededIndividuals <= populationSize,
          "seeded_individuals", seededIndividuals, "in [0, population_size]");
      BPP_InvalidConfigException.check(mutation != null, "mutation", null, "SWAP or INVERSION");
      BPP_InvalidConfigException.check(logInterval >= 1, "log_interval", logInterval, ">= 1");
    }
  }

  /** An item ordering together with its decoded packing and fitness. */
  static final class Chromosome {
    final int[] genes;
    final BPP_State decoded;
    final BPP_Score score;
    final double fitness;

    Chromosome(BPP_Input input, int[] genes) {
      this.genes = genes;
      this.decoded = decode(input, genes);
      this.score = BPP_Objective.evaluate(decoded);
      this.fitness = fitness(score);
    }
  }

  private static final Comparator<Chromosome> BY_FITNESS_DESC = (a, b) -> Double.compare(b.fitness, a.fitness);

  private BPP_GA() {
  }

  public static BPP_Result run(BPP_Input input, Config config, Random rng) {
    config.validate();
    if (rng == null) {
      throw new IllegalArgumentException("The genetic algorithm needs a random source");
    }
    if (input.isEmpty())
      return BPP_Result.empty(NAME, input);

    final long t0 = System.nanoTime();
    List<Chromosome> population = initializePopulation(input, config, rng);
    population.sort(BY_FITNESS_DESC);

    Chromosome bestChromosome = population.get(0);
    BPP_Score initialScore = bestChromosome.score;
    List<Double> history = new ArrayList<>();
    history.add(bestChromosome.fitness);
    if (config.verbose) {
      System.out.println("\n=== " + NAME + " Started ===");
      System.out.println("(Gen. 0) BestSol = " + bestChromosome.score);
    }

    int g = 0;
    int noImprovement = 0;
    BPP_Result.Termination termination = BPP_Result.Termination.GENERATION_CAP;

    try (BPP_ProgressLog log = BPP_ProgressLog.open(config.logFilePath, config.logInterval)) {
      log.logAlways(0, 0L, bestChromosome.score.value(), bestChromosome.score.value(),
          bestChromosome.score.bins(), averageFitness(population));

      while (g < config.maxGenerations) {
        g++;
        population = nextGeneration(input, population, config, rng);
        population.sort(BY_FITNESS_DESC);

        Chromosome generationBest = population.get(0);
        history.add(generationBest.fitness);
        if (generationBest.score.isBetterThan(bestChromosome.score)) {
          bestChromosome = generationBest;
          noImprovement = 0;
          if (config.verbose)
            System.out.println("(Gen. " + g + ") BestSol = " + bestChromosome.score);
        } else {
          noImprovement++;
        }

        long elapsedMs = (System.nanoTime() - t0) / 1_000_000L;
        log.log(g, elapsedMs, generationBest.score.value(), bestChromosome.score.value(),
            bestChromosome.score.bins(), averageFitness(population));

        if (config.stagnationGenerations > 0 && noImprovement >= config.stagnationGenerations) {
          termination = BPP_Result.Termination.STAGNATION;
          break;
        }
      }

      long totalMs = (System.nanoTime() - t0) / 1_000_000L;
      log.logAlways(g, totalMs, population.get(0).score.value(), bestChromosome.score.value(),
          bestChromosome.score.bins(), averageFitness(population));

      if (config.verbose) {
        System.out.println("Finished after " + g + " generations.");
        System.out.println("Best solution found: " + bestChromosome.score + " in time: " + (totalMs / 1000.0) + " s.");
        System.out.println("Stopping criterion: " + termination.label() + ".");
      }

      Map<String, Object> metrics = new LinkedHashMap<>();
      metrics.put("population_size", config.populationSize);
      metrics.put("best_fitness", bestChromosome.fitness);
      metrics.put("final_average_fitness", averageFitness(population));
      metrics.put("generations_without_improvement", noImprovement);
      return new BPP_Result(NAME, bestChromosome.decoded, initialScore, g, totalMs, termination, history, metrics);
    }
  }

  // --- Population ---

  /**
   * Seeded individuals: the first-fit-decreasing order, the problem order,
   * then decreasing orders with one random swap each. The rest are uniformly
   * random permutations.
   */
  static List<Chromosome> initializePopulation(BPP_Input input, Config config, Random rng) {
    List<Chromosome> population = new ArrayList<>(config.populationSize);
    int[] decreasing = BPP_Initializer.decreasingOrder(input);
    for (int k = 0; k < config.seededIndividuals; k++) {
      int[] genes;
      if (k == 0) {
        genes = decreasing.clone();
      } else if (k == 1) {
        genes = BPP_Initializer.naturalOrder(input);
      } else {
        genes = decreasing.clone();
        swapMutation(genes, rng);
      }
      population.add(new Chromosome(input, genes));
    }
    while (population.size() < config.populationSize) {
      population.add(new Chromosome(input, randomPermutation(input.Items(), rng)));
    }
    return population;
  }

  /** Expects the population sorted best first. */
  private static List<Chromosome> nextGeneration(BPP_Input input, List<Chromosome> population, Config config,
      Random rng) {
    List<Chromosome> next = new ArrayList<>(config.populationSize);
    for (int e = 0; e < config.elitismCount; e++)
      next.add(population.get(e));

    while (next.size() < config.populationSize) {
      Chromosome parent1 = select(population, config, rng);
      Chromosome parent2 = select(population, config, rng);

      int[][] children;
      if (rng.nextDouble() < config.crossoverProbability) {
        children = orderCrossover(parent1.genes, parent2.genes, rng);
      } else {
        children = new int[][] { parent1.genes.clone(), parent2.genes.clone() };
      }

      for (int[] child : children) {
        if (next.size() >= config.populationSize)
          break;
        if (rng.nextDouble() < config.mutationProbability)
          mutate(child, config.mutation, rng);
        next.add(new Chromosome(input, child));
      }
    }
    return next;
  }

  static Chromosome select(List<Chromosome> population, Config config, Random rng) {
    if (config.selection == Selection.ROULETTE) {
      double total = 0;
      for (Chromosome c : population)
        total += c.fitness;
      double r = rng.nextDouble() * total;
      double acc = 0;
      for (Chromosome c : population) {
        acc += c.fitness;
        if (r < acc)
          return c;
      }
      return population.get(population.size() - 1);
    }

    Chromosome winner = null;
    for (int k = 0; k < config.tournamentSize; k++) {
      Chromosome c = population.get(rng.nextInt(population.size()));
      if (winner == null || c.fitness > winner.fitness)
        winner = c;
    }
    return winner;
  }

  // --- Encoding ---

  static BPP_State decode(BPP_Input input, int[] genes) {
    return BPP_Initializer.firstFit(input, genes);
  }

  static double fitness(BPP_Score score) {
    return 1.0 / (1.0 + score.value());
  }

  static int[] randomPermutation(int n, Random rng) {
    int[] p = new int[n];
    for (int i = 0; i < n; i++)
      p[i] = i;
    for (int i = n - 1; i > 0; i--) {
      int j = rng.nextInt(i + 1);
      int tmp = p[i];
      p[i] = p[j];
      p[j] = tmp;
    }
    return p;
  }

  static boolean isPermutation(int[] genes, int n) {
    if (genes.length != n)
      return false;
    boolean[] seen = new boolean[n];
    for (int g : genes) {
      if (g < 0 || g >= n || seen[g])
        return false;
      seen[g] = true;
    }
    return true;
  }

  // --- Operators ---

  /**
   * Order crossover (OX1). Child 1 keeps the segment [a, b] of parent 1 and
   * takes the remaining items in the order they appear in parent 2, starting
   * after b and wrapping around; child 2 is built the other way round.
   *
   * <pre>
   *   parent 1: 0 1 | 2 3 4 | 5 6
   *   parent 2: 6 4 | 2 0 5 | 1 3
   *   child 1 : 0 5 | 2 3 4 | 1 6     (fill order from p2: 1 3 6 4 2 0 5)
   * </pre>
   */
  static int[][] orderCrossover(int[] p1, int[] p2, Random rng) {
    int n = p1.length;
    int i = rng.nextInt(n);
    int j = rng.nextInt(n);
    int a = Math.min(i, j);
    int b = Math.max(i, j);
    return new int[][] { orderCrossover(p1, p2, a, b), orderCrossover(p2, p1, a, b) };
  }

  static int[] orderCrossover(int[] keep, int[] fill, int a, int b) {
    int n = keep.length;
    int[] child = new int[n];
    boolean[] used = new boolean[n];
    for (int k = a; k <= b; k++) {
      child[k] = keep[k];
      used[keep[k]] = true;
    }
    int pos = (b + 1) % n;
    for (int k = 0; k < n; k++) {
      int gene = fill[(b + 1 + k) % n];
      if (used[gene])
        continue;
      child[pos] = gene;
      used[gene] = true;
      pos = (pos + 1) % n;
    }
    return child;
  }

  static void mutate(int[] genes, Mutation mutation, Random rng) {
    if (mutation == Mutation.INVERSION)
      inversionMutation(genes, rng);
    else
      swapMutation(genes, rng);
  }

  static void swapMutation(int[] genes, Random rng) {
    int n = genes.length;
    if (n < 2)
      return;
    int i = rng.nextInt(n);
    int j = rng.nextInt(n - 1);
    if (j >= i)
      j++;
    swapPositions(genes, i, j);
  }

  static void swapPositions(int[] genes, int i, int j) {
    int tmp = genes[i];
    genes[i] = genes[j];
    genes[j] = tmp;
  }

  static void inversionMutation(int[] genes, Random rng) {
    int n = genes.length;
    if (n < 2)
      return;
    int i = rng.nextInt(n);
    int j = rng.nextInt(n);
    reverse(genes, Math.min(i, j), Math.max(i, j));
  }

  static void reverse(int[] genes, int from, int to) {
    while (from < to) {
      swapPositions(genes, from++, to--);
    }
  }

  private static double averageFitness(List<Chromosome> population) {
    double sum = 0;
    for (Chromosome c : population)
      sum += c.fitness;
    return sum / population.size();
  }
}
