import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.Random;

import org.json.JSONException;

/**
 * Command line entry point.
 *
 * <pre>
 * java BPP_Launcher --input problem.json --algorithm sa --seed 7
 * java BPP_Launcher --demo 30 --algorithm all --trials 5 --parallel --output results
 * </pre>
 */
public class BPP_Launcher {

  static final int DEFAULT_DEMO_ITEMS = 20;
  static final int DEMO_CAPACITY = 100;
  static final int DEMO_MIN_WEIGHT = 10;
  static final int DEMO_MAX_WEIGHT = 70;

  /** Parsed command line. */
  static final class Options {
    String inputFile = null;
    int demoItems = -1;
    String algorithms = BPP_Algorithm.ALL;
    String configFile = null;
    Long seed = null;
    int trials = 1;
    boolean parallel = false;
    String outputDir = null;
    boolean quiet = false;
    boolean help = false;
  }

  public static void main(String[] args) {
    System.exit(run(args));
  }

  /** Runs the command line and returns the exit status. */
  static int run(String[] args) {
    Options opt;
    try {
      opt = parse(args);
    } catch (IllegalArgumentException e) {
      System.err.println("Error: " + e.getMessage());
      printUsage();
      return 1;
    }
    if (opt.help) {
      printUsage();
      return 0;
    }

    try {
      BPP_Config config = opt.configFile != null ? BPP_Config.fromFile(opt.configFile) : new BPP_Config();
      if (opt.seed != null)
        config.setSeed(opt.seed);
      config.setVerbose(!opt.quiet && !opt.parallel);

      BPP_Input input;
      if (opt.inputFile != null) {
        System.out.println("Reading input from: " + opt.inputFile);
        input = BPP_Input.fromFile(opt.inputFile);
      } else {
        System.out.println("Generating demo problem with " + opt.demoItems + " items (seed " + config.seed() + ")");
        input = BPP_Input.randomInstance(opt.demoItems, DEMO_CAPACITY, DEMO_MIN_WEIGHT, DEMO_MAX_WEIGHT,
            new Random(config.seed()));
      }

      System.out.println("=================================================");
      System.out.println("   Bin Packing Local Search");
      System.out.println("=================================================");
      System.out.print(BPP_Report.renderAnalysis(input));

      List<BPP_Algorithm> algorithms = BPP_Algorithm.parseList(opt.algorithms);
      int threads = opt.parallel ? Runtime.getRuntime().availableProcessors() : 1;
      BPP_Experiment experiment = new BPP_Experiment(input, config, algorithms, opt.trials, threads);
      List<BPP_Result> results = experiment.run();

      if (!opt.quiet) {
        for (BPP_Result r : results)
          System.out.print(BPP_Report.renderComparison(r));
      }
      System.out.println();
      System.out.print(BPP_Report.renderSummary(results));
      BPP_Result best = experiment.best();
      if (best != null)
        System.out.println("\nBest: " + best);

      if (opt.outputDir != null) {
        String json = new File(opt.outputDir, "results.json").getPath();
        String csv = new File(opt.outputDir, "results.csv").getPath();
        experiment.writeJson(json);
        experiment.writeCsv(csv);
        System.out.println("Results saved to: " + json + " and " + csv);
        List<File> charts = BPP_Charts.writeAll(results, new File(opt.outputDir, "plots"));
        System.out.println("Charts saved: " + charts.size() + " PNG files in "
            + new File(opt.outputDir, "plots").getPath());
      }
      return 0;
    } catch (BPP_InfeasibleItemException e) {
      System.err.println("Infeasible problem: " + e.getMessage());
      return 1;
    } catch (BPP_InvalidConfigException e) {
      System.err.println("Invalid configuration: " + e.getMessage());
      return 1;
    } catch (JSONException e) {
      System.err.println("Malformed JSON: " + e.getMessage());
      return 1;
    } catch (IOException e) {
      System.err.println("I/O error: " + e.getMessage());
      return 1;
    } catch (IllegalArgumentException e) {
      System.err.println("Error: " + e.getMessage());
      return 1;
    }
  }

  static Options parse(String[] args) {
    Options opt = new Options();
    for (int i = 0; i < args.length; i++) {
      String a = args[i];
      switch (a) {
      case "--input":
        opt.inputFile = value(args, ++i, a);
        break;
      case "--demo":
        opt.demoItems = DEFAULT_DEMO_ITEMS;
        if (i + 1 < args.length && !args[i + 1].startsWith("--"))
          opt.demoItems = parseInt(args[++i], a);
        if (opt.demoItems < 0)
          throw new IllegalArgumentException("--demo expects a non-negative item count");
        break;
      case "--algorithm":
        opt.algorithms = value(args, ++i, a);
        break;
      case "--config":
        opt.configFile = value(args, ++i, a);
        break;
      case "--seed":
        try {
          opt.seed = Long.parseLong(value(args, ++i, a));
        } catch (NumberFormatException e) {
          throw new IllegalArgumentException("--seed expects an integer, got " + args[i]);
        }
        break;
      case "--trials":
        opt.trials = parseInt(value(args, ++i, a), a);
        break;
      case "--parallel":
        opt.parallel = true;
        break;
      case "--output":
        opt.outputDir = value(args, ++i, a);
        break;
      case "--quiet":
        opt.quiet = true;
        break;
      case "--help":
      case "-h":
        opt.help = true;
        break;
      default:
        throw new IllegalArgumentException("Unknown option " + a);
      }
    }
    if (opt.help)
      return opt;
    if ((opt.inputFile == null) == (opt.demoItems < 0))
      throw new IllegalArgumentException("Give exactly one of --input <file> or --demo [n]");
    if (opt.trials < 1)
      throw new IllegalArgumentException("--trials must be at least 1");
    return opt;
  }

  private static String value(String[] args, int i, String option) {
    if (i >= args.length)
      throw new IllegalArgumentException(option + " expects a value");
    return args[i];
  }

  private static int parseInt(String s, String option) {
    try {
      return Integer.parseInt(s);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(option + " expects an integer, got " + s);
    }
  }

  static void printUsage() {
    System.out.println("Usage: java -cp .;json-20250107.jar BPP_Launcher (--input <file> | --demo [n]) [options]");
    System.out.println("  --algorithm all|" + String.join("|", BPP_Algorithm.cliNames())
        + "   comma separated, default all");
    System.out.println("  --config <file>     JSON algorithm parameters");
    System.out.println("  --seed <long>       default " + BPP_Config.DEFAULT_SEED);
    System.out.println("  --trials <n>        runs per algorithm, default 1");
    System.out.println("  --parallel          run on a thread pool");
    System.out.println("  --output <dir>      write results.json, results.csv and plots/*.png");
    System.out.println("  --quiet             no per-run output");
  }
}
