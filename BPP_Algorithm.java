import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Random;

/**
 * The algorithms an experiment can run. Closed set; each constant knows its
 * command-line name and how to start itself from a {@link BPP_Config}.
 */
public enum BPP_Algorithm {

  STEEPEST("steepest"),
  STOCHASTIC("stochastic"),
  SIDEWAYS("sideways"),
  RANDOM_RESTART("restart"),
  SA("sa"),
  GA("ga");

  /** Command-line name that selects every algorithm. */
  public static final String ALL = "all";

  private final String cliName;

  BPP_Algorithm(String cliName) {
    this.cliName = cliName;
  }

  public String cliName() {
    return cliName;
  }

  /** Name used in results, e.g. "Simulated Annealing". */
  public String displayName() {
    switch (this) {
    case SA:
      return BPP_SA.NAME;
    case GA:
      return BPP_GA.NAME;
    default:
      return variant().displayName();
    }
  }

  /** Hill climbing variant of this algorithm, null for SA and GA. */
  BPP_HillClimbing.Variant variant() {
    switch (this) {
    case STEEPEST:
      return BPP_HillClimbing.Variant.STEEPEST_ASCENT;
    case STOCHASTIC:
      return BPP_HillClimbing.Variant.STOCHASTIC;
    case SIDEWAYS:
      return BPP_HillClimbing.Variant.SIDEWAYS_MOVE;
    case RANDOM_RESTART:
      return BPP_HillClimbing.Variant.RANDOM_RESTART;
    default:
      return null;
    }
  }

  public BPP_Result run(BPP_Input input, BPP_Config config, Random rng) {
    switch (this) {
    case SA:
      return BPP_SA.run(input, config.saConfig(), rng);
    case GA:
      return BPP_GA.run(input, config.gaConfig(), rng);
    default:
      return BPP_HillClimbing.run(input, variant(), config.hillClimbingConfig(), rng);
    }
  }

  public static BPP_Algorithm fromName(String name) {
    String key = name.trim().toLowerCase(Locale.ROOT);
    for (BPP_Algorithm a : values()) {
      if (a.cliName.equals(key) || a.name().toLowerCase(Locale.ROOT).equals(key))
        return a;
    }
    throw new IllegalArgumentException("Unknown algorithm '" + name + "', expected one of " + ALL + ", "
        + String.join(", ", cliNames()));
  }

  /** Parses "all" or a comma separated list such as "steepest,sa". */
  public static List<BPP_Algorithm> parseList(String names) {
    if (names.trim().equalsIgnoreCase(ALL))
      return Arrays.asList(values());
    List<BPP_Algorithm> list = new ArrayList<>();
    for (String n : names.split(",")) {
      if (n.isBlank())
        continue;
      BPP_Algorithm a = fromName(n);
      if (!list.contains(a))
        list.add(a);
    }
    if (list.isEmpty())
      throw new IllegalArgumentException("No algorithm selected");
    return list;
  }

  static List<String> cliNames() {
    List<String> names = new ArrayList<>();
    for (BPP_Algorithm a : values())
      names.add(a.cliName);
    return names;
  }
}
