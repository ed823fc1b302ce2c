import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Objective function shared by every algorithm. Minimizes the number of bins
 * and breaks ties with the mean squared fill ratio, which rewards packings
 * where some bins are nearly full and one is nearly empty (that bin is the
 * next one to be closed).
 *
 * <p>
 * Pure and stateless. The same secondary term must be used for every
 * algorithm being compared, so there is only this one implementation.
 */
public final class BPP_Objective {

  private BPP_Objective() {
  }

  public static BPP_Score evaluate(BPP_State state) {
    int k = state.binsUsed();
    if (k == 0)
      return BPP_Score.EMPTY;
    // summed over the sorted loads so that the bin labelling cannot change the result
    double[] loads = new double[k];
    for (int b = 0; b < k; b++)
      loads[b] = state.load(b);
    Arrays.sort(loads);
    double sumSq = 0;
    for (double load : loads)
      sumSq += load * load;
    double capacity = state.input().Capacity();
    return new BPP_Score(k, sumSq / (capacity * capacity * k));
  }

  /** Breakdown used by the reports. */
  public static Map<String, Object> components(BPP_State state) {
    BPP_Score score = evaluate(state);
    int k = state.binsUsed();
    double meanFill = 0;
    for (int b = 0; b < k; b++)
      meanFill += state.fillRatio(b);
    meanFill = k == 0 ? 0 : meanFill / k;

    Map<String, Object> c = new LinkedHashMap<>();
    c.put("bins_used", k);
    c.put("lower_bound", state.input().LowerBound());
    c.put("mean_fill", meanFill);
    c.put("mean_squared_fill", score.meanSquaredFill());
    c.put("value", score.value());
    c.put("is_valid", state.isValid());
    return c;
  }
}
