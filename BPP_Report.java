import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Plain-text rendering for the console: bin fill bars, the problem analysis
 * and the comparison table of an experiment.
 */
public final class BPP_Report {

  static final int BAR_WIDTH = 40;
  private static final String RULE = "======================================================================";

  private BPP_Report() {
  }

  /** Integral weights without decimals, others with up to two. */
  public static String formatWeight(double w) {
    if (w == Math.rint(w) && Math.abs(w) < 1e15)
      return String.valueOf((long) w);
    String s = String.format(Locale.US, "%.2f", w);
    if (s.endsWith("0"))
      s = s.substring(0, s.length() - 1);
    return s;
  }

  static String bar(double ratio, int width) {
    int filled = (int) Math.floor(Math.max(0, Math.min(1, ratio)) * width + 1e-9);
    StringBuilder sb = new StringBuilder(width);
    for (int k = 0; k < width; k++)
      sb.append(k < filled ? '#' : '.');
    return sb.toString();
  }

  /**
   * One line per bin with its fill bar, load and items, e.g.
   *
   * <pre>
   *   Bin  1 [##############################..........]  75/100 ( 75.0%)
   *          A(40), B(35)
   * </pre>
   */
  public static String renderBins(BPP_State state) {
    BPP_Input in = state.input();
    StringBuilder sb = new StringBuilder();
    for (int b = 0; b < state.binsUsed(); b++) {
      sb.append(String.format(Locale.US, "  Bin %2d [%s] %s/%s (%5.1f%%)%n", b + 1,
          bar(state.fillRatio(b), BAR_WIDTH), formatWeight(state.load(b)), formatWeight(in.Capacity()),
          state.fillRatio(b) * 100));
      StringBuilder items = new StringBuilder();
      for (int item : state.itemsInBin(b)) {
        if (items.length() > 0)
          items.append(", ");
        items.append(in.ItemAt(item));
      }
      sb.append("         ").append(items).append(System.lineSeparator());
    }
    return sb.toString();
  }

  public static String renderComparison(BPP_Result result) {
    StringBuilder sb = new StringBuilder();
    sb.append(RULE).append(System.lineSeparator());
    sb.append("RESULT - ").append(result.algorithm()).append(System.lineSeparator());
    sb.append(RULE).append(System.lineSeparator());
    sb.append(String.format(Locale.US, "Bins: %d -> %d (saved %d)%n", result.initialScore().bins(),
        result.binsUsed(), result.initialScore().bins() - result.binsUsed()));
    sb.append(String.format(Locale.US, "Score: %.6f -> %.6f%n", result.initialScore().value(),
        result.score().value()));
    sb.append(String.format(Locale.US, "Iterations: %d, time: %.3f s, stop: %s%n", result.iterations(),
        result.elapsedMillis() / 1000.0, result.termination().label()));
    for (Map.Entry<String, Object> e : result.metrics().entrySet())
      sb.append("  ").append(e.getKey()).append(": ").append(e.getValue()).append(System.lineSeparator());
    sb.append(renderBins(result.state()));
    return sb.toString();
  }

  /** Capacity, totals, lower bound and the bins of every deterministic start. */
  public static String renderAnalysis(BPP_Input in) {
    StringBuilder sb = new StringBuilder();
    sb.append("Problem: ").append(in.Items()).append(" items, capacity ").append(formatWeight(in.Capacity()))
        .append(System.lineSeparator());
    sb.append("Total weight: ").append(formatWeight(in.TotalWeight())).append(System.lineSeparator());
    sb.append(String.format(Locale.US, "Theoretical minimum: %.2f (lower bound %d bins)%n",
        in.TotalWeight() / in.Capacity(), in.LowerBound()));
    for (Map.Entry<BPP_Initializer, Integer> e : BPP_Initializer.analyze(in).entrySet())
      sb.append(String.format(Locale.US, "  %-22s %d bins%n", e.getKey().name(), e.getValue()));
    return sb.toString();
  }

  public static String renderSummary(List<BPP_Result> results) {
    StringBuilder sb = new StringBuilder();
    String header = String.format(Locale.US, "%-32s %6s %12s %10s %10s  %s", "Algorithm", "Bins", "Score",
        "Iter", "Time(s)", "Stop");
    sb.append(header).append(System.lineSeparator());
    sb.append("-".repeat(header.length() + 6)).append(System.lineSeparator());
    for (BPP_Result r : results) {
      sb.append(String.format(Locale.US, "%-32s %6d %12.6f %10d %10.3f  %s%n", r.algorithm(), r.binsUsed(),
          r.score().value(), r.iterations(), r.elapsedMillis() / 1000.0, r.termination().label()));
    }
    return sb.toString();
  }
}
