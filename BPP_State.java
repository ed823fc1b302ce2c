import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.json.JSONArray;
import org.json.JSONObject;

/**
 * A packing of the items of a {@link BPP_Input} into bins.
 *
 * <p>
 * Instances are immutable values. Bin labels are canonical: bins are numbered
 * 0..k-1 in order of their first item (by item index), and a bin never exists
 * without an item. Two states with the same grouping of items are therefore
 * equal. Every operator returns a new state and never touches the receiver.
 */
public final class BPP_State {

  /** Tolerance for capacity checks on non-integer weights. */
  static final double EPS = 1e-9;

  private final BPP_Input input;
  // item index -> bin index (canonical)
  private final int[] binOf;
  // bin index -> summed weight
  private final double[] loads;
  private final int hash;

  private BPP_State(BPP_Input input, int[] canonicalBinOf, double[] loads) {
    this.input = input;
    this.binOf = canonicalBinOf;
    this.loads = loads;
    this.hash = Arrays.hashCode(canonicalBinOf);
  }

  // --- Factories ---

  /**
   * Builds a state from an arbitrary labelling (gaps and any order allowed).
   * Labels are renumbered to the canonical form.
   */
  static BPP_State fromAssignment(BPP_Input input, int[] rawBinOf) {
    int n = input.Items();
    if (rawBinOf.length != n) {
      throw new IllegalArgumentException("Assignment covers " + rawBinOf.length + " items, problem has " + n);
    }
    Map<Integer, Integer> relabel = new LinkedHashMap<>();
    int[] canonical = new int[n];
    for (int i = 0; i < n; i++) {
      if (rawBinOf[i] < 0) {
        throw new IllegalArgumentException("Item " + input.ItemId(i) + " is not assigned to a bin");
      }
      Integer label = relabel.get(rawBinOf[i]);
      if (label == null) {
        label = relabel.size();
        relabel.put(rawBinOf[i], label);
      }
      canonical[i] = label;
    }
    double[] loads = new double[relabel.size()];
    for (int i = 0; i < n; i++) {
      loads[canonical[i]] += input.ItemWeight(i);
    }
    return new BPP_State(input, canonical, loads);
  }

  /** Builds a state from explicit bin contents (lists of item indices). */
  static BPP_State fromBins(BPP_Input input, List<List<Integer>> bins) {
    int[] raw = new int[input.Items()];
    Arrays.fill(raw, -1);
    for (int b = 0; b < bins.size(); b++) {
      for (int item : bins.get(b)) {
        if (raw[item] != -1) {
          throw new IllegalArgumentException("Item " + input.ItemId(item) + " is packed twice");
        }
        raw[item] = b;
      }
    }
    return fromAssignment(input, raw);
  }

  // --- Queries ---

  BPP_Input input() {
    return input;
  }

  int binsUsed() {
    return loads.length;
  }

  int itemCount() {
    return binOf.length;
  }

  int binOf(int item) {
    return binOf[item];
  }

  double load(int bin) {
    return loads[bin];
  }

  double remaining(int bin) {
    return input.Capacity() - loads[bin];
  }

  double fillRatio(int bin) {
    return loads[bin] / input.Capacity();
  }

  /** True if an item of the given weight can be added to the bin. */
  boolean fits(int bin, double weight) {
    return loads[bin] + weight <= input.Capacity() + EPS;
  }

  int binSize(int bin) {
    int count = 0;
    for (int b : binOf) {
      if (b == bin)
        count++;
    }
    return count;
  }

  /** Item indices in the bin, ascending. */
  List<Integer> itemsInBin(int bin) {
    List<Integer> items = new ArrayList<>();
    for (int i = 0; i < binOf.length; i++) {
      if (binOf[i] == bin)
        items.add(i);
    }
    return items;
  }

  List<List<Integer>> bins() {
    List<List<Integer>> bins = new ArrayList<>(loads.length);
    for (int b = 0; b < loads.length; b++)
      bins.add(new ArrayList<>());
    for (int i = 0; i < binOf.length; i++)
      bins.get(binOf[i]).add(i);
    return bins;
  }

  /** Checks all three packing invariants from scratch. */
  boolean isValid() {
    int k = loads.length;
    double[] recomputed = new double[k];
    boolean[] used = new boolean[k];
    for (int i = 0; i < binOf.length; i++) {
      int b = binOf[i];
      if (b < 0 || b >= k)
        return false;
      used[b] = true;
      recomputed[b] += input.ItemWeight(i);
    }
    for (int b = 0; b < k; b++) {
      if (!used[b])
        return false;
      if (recomputed[b] > input.Capacity() + EPS)
        return false;
    }
    return true;
  }

  // --- Operators (each returns a new state) ---

  /**
   * Moves one item to another bin. {@code targetBin == binsUsed()} opens a new
   * bin. A source bin left empty disappears.
   */
  BPP_State relocate(int item, int targetBin) {
    if (targetBin < 0 || targetBin > loads.length) {
      throw new IllegalArgumentException("No bin " + targetBin + " in a packing of " + loads.length + " bins");
    }
    int[] raw = binOf.clone();
    raw[item] = targetBin;
    return fromAssignment(input, raw);
  }

  /** Exchanges the bins of two items. */
  BPP_State swap(int itemA, int itemB) {
    int[] raw = binOf.clone();
    raw[itemA] = binOf[itemB];
    raw[itemB] = binOf[itemA];
    return fromAssignment(input, raw);
  }

  // --- Export ---

  int[] toArray() {
    return binOf.clone();
  }

  /** Item id to bin index, in item order. */
  Map<String, Integer> assignment() {
    Map<String, Integer> map = new LinkedHashMap<>();
    for (int i = 0; i < binOf.length; i++) {
      map.put(input.ItemId(i), binOf[i]);
    }
    return Collections.unmodifiableMap(map);
  }

  JSONArray binsToJSON() {
    JSONArray arr = new JSONArray();
    List<List<Integer>> bins = bins();
    for (int b = 0; b < bins.size(); b++) {
      JSONObject jb = new JSONObject();
      jb.put("bin", b);
      jb.put("load", loads[b]);
      jb.put("capacity", input.Capacity());
      JSONArray items = new JSONArray();
      for (int item : bins.get(b))
        items.put(input.ItemId(item));
      jb.put("items", items);
      arr.put(jb);
    }
    return arr;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o)
      return true;
    if (!(o instanceof BPP_State))
      return false;
    BPP_State other = (BPP_State) o;
    return hash == other.hash && input == other.input && Arrays.equals(binOf, other.binOf);
  }

  @Override
  public int hashCode() {
    return hash;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("State with ").append(loads.length).append(" bins:\n");
    List<List<Integer>> bins = bins();
    for (int b = 0; b < bins.size(); b++) {
      sb.append("  Bin ").append(b).append(" (").append(BPP_Report.formatWeight(loads[b])).append('/')
          .append(BPP_Report.formatWeight(input.Capacity())).append("): ");
      List<Integer> items = bins.get(b);
      for (int k = 0; k < items.size(); k++) {
        if (k > 0)
          sb.append(", ");
        sb.append(input.ItemAt(items.get(k)));
      }
      sb.append('\n');
    }
    return sb.toString();
  }
}
