import java.util.Locale;

/**
 * Score of a packing. Ordered first by bins used (fewer is better), then by
 * the mean squared fill ratio of the bins (higher is better). Lower scores
 * compare as smaller, so {@code a.compareTo(b) < 0} means a is the better
 * packing.
 *
 * <p>
 * Mean squared fills closer than {@link #TIE_TOLERANCE} compare as equal, so
 * packings whose loads agree up to rounding are ties.
 */
public final class BPP_Score implements Comparable<BPP_Score> {

  static final BPP_Score EMPTY = new BPP_Score(0, 0.0);

  static final double TIE_TOLERANCE = 1e-12;

  private final int bins;
  private final double meanSquaredFill;

  BPP_Score(int bins, double meanSquaredFill) {
    this.bins = bins;
    this.meanSquaredFill = meanSquaredFill;
  }

  public int bins() {
    return bins;
  }

  public double meanSquaredFill() {
    return meanSquaredFill;
  }

  /**
   * Scalar form {@code bins + (1 - meanSquaredFill)}, in [bins, bins + 1). Its
   * ordering is the same as {@link #compareTo}.
   */
  public double value() {
    if (bins == 0)
      return 0.0;
    return bins + (1.0 - meanSquaredFill);
  }

  public boolean isBetterThan(BPP_Score other) {
    return compareTo(other) < 0;
  }

  @Override
  public int compareTo(BPP_Score o) {
    if (bins != o.bins)
      return Integer.compare(bins, o.bins);
    if (Math.abs(meanSquaredFill - o.meanSquaredFill) <= TIE_TOLERANCE)
      return 0;
    return Double.compare(o.meanSquaredFill, meanSquaredFill);
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof BPP_Score))
      return false;
    return compareTo((BPP_Score) o) == 0;
  }

  // ties within the tolerance must hash alike
  @Override
  public int hashCode() {
    return bins;
  }

  @Override
  public String toString() {
    return String.format(Locale.US, "%d bins (%.6f)", bins, value());
  }
}
