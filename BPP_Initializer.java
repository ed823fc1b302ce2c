import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Constructive heuristics that build a first packing. Every strategy returns a
 * valid state: an item that fits no open bin opens a new one. Only
 * {@link #RANDOM_FIT} draws from the random source; the others ignore it.
 */
public enum BPP_Initializer {

  /** First bin with room, items in problem order. */
  FIRST_FIT,
  FIRST_FIT_DECREASING,
  /** Bin with the least room left that still fits the item. */
  BEST_FIT,
  BEST_FIT_DECREASING,
  /** Bin with the most room left that fits the item. */
  WORST_FIT,
  /** Only the most recently opened bin is considered. */
  NEXT_FIT,
  /** Shuffled order, uniformly random choice among the bins that fit. */
  RANDOM_FIT,
  /** Every item alone in its own bin. Upper bound baseline. */
  ONE_PER_BIN;

  public BPP_State initialize(BPP_Input input, Random rng) {
    switch (this) {
    case FIRST_FIT:
      return firstFit(input, naturalOrder(input));
    case FIRST_FIT_DECREASING:
      return firstFit(input, decreasingOrder(input));
    case BEST_FIT:
      return bestOrWorstFit(input, naturalOrder(input), true);
    case BEST_FIT_DECREASING:
      return bestOrWorstFit(input, decreasingOrder(input), true);
    case WORST_FIT:
      return bestOrWorstFit(input, naturalOrder(input), false);
    case NEXT_FIT:
      return nextFit(input, naturalOrder(input));
    case RANDOM_FIT:
      return randomFit(input, rng);
    case ONE_PER_BIN:
    default:
      int[] raw = new int[input.Items()];
      for (int i = 0; i < raw.length; i++)
        raw[i] = i;
      return BPP_State.fromAssignment(input, raw);
    }
  }

  boolean isRandomized() {
    return this == RANDOM_FIT;
  }

  /** Bins used by every deterministic strategy on this problem. */
  static Map<BPP_Initializer, Integer> analyze(BPP_Input input) {
    Map<BPP_Initializer, Integer> result = new LinkedHashMap<>();
    for (BPP_Initializer init : values()) {
      if (init.isRandomized())
        continue;
      result.put(init, init.initialize(input, null).binsUsed());
    }
    return result;
  }

  // --- Shared decoders ---

  /**
   * Sequential first-fit over the given item order. Also the chromosome
   * decoder of the genetic algorithm.
   */
  static BPP_State firstFit(BPP_Input input, int[] order) {
    double cap = input.Capacity();
    int[] raw = new int[input.Items()];
    List<Double> loads = new ArrayList<>();
    for (int item : order) {
      double w = input.ItemWeight(item);
      int target = -1;
      for (int b = 0; b < loads.size(); b++) {
        if (loads.get(b) + w <= cap + BPP_State.EPS) {
          target = b;
          break;
        }
      }
      if (target == -1) {
        target = loads.size();
        loads.add(0.0);
      }
      loads.set(target, loads.get(target) + w);
      raw[item] = target;
    }
    return BPP_State.fromAssignment(input, raw);
  }

  private static BPP_State bestOrWorstFit(BPP_Input input, int[] order, boolean best) {
    double cap = input.Capacity();
    int[] raw = new int[input.Items()];
    List<Double> loads = new ArrayList<>();
    for (int item : order) {
      double w = input.ItemWeight(item);
      int target = -1;
      double chosenRemaining = best ? Double.POSITIVE_INFINITY : Double.NEGATIVE_INFINITY;
      for (int b = 0; b < loads.size(); b++) {
        double remaining = cap - loads.get(b);
        if (remaining + BPP_State.EPS < w)
          continue;
        if (best ? remaining < chosenRemaining : remaining > chosenRemaining) {
          target = b;
          chosenRemaining = remaining;
        }
      }
      if (target == -1) {
        target = loads.size();
        loads.add(0.0);
      }
      loads.set(target, loads.get(target) + w);
      raw[item] = target;
    }
    return BPP_State.fromAssignment(input, raw);
  }

  private static BPP_State nextFit(BPP_Input input, int[] order) {
    double cap = input.Capacity();
    int[] raw = new int[input.Items()];
    int current = -1;
    double load = 0;
    for (int item : order) {
      double w = input.ItemWeight(item);
      if (current == -1 || load + w > cap + BPP_State.EPS) {
        current++;
        load = 0;
      }
      load += w;
      raw[item] = current;
    }
    return BPP_State.fromAssignment(input, raw);
  }

  private static BPP_State randomFit(BPP_Input input, Random rng) {
    if (rng == null) {
      throw new IllegalArgumentException("RANDOM_FIT needs a random source");
    }
    double cap = input.Capacity();
    List<Integer> order = new ArrayList<>();
    for (int i = 0; i < input.Items(); i++)
      order.add(i);
    Collections.shuffle(order, rng);

    int[] raw = new int[input.Items()];
    List<Double> loads = new ArrayList<>();
    List<Integer> candidates = new ArrayList<>();
    for (int item : order) {
      double w = input.ItemWeight(item);
      candidates.clear();
      for (int b = 0; b < loads.size(); b++) {
        if (loads.get(b) + w <= cap + BPP_State.EPS)
          candidates.add(b);
      }
      int target;
      if (candidates.isEmpty()) {
        target = loads.size();
        loads.add(0.0);
      } else {
        target = candidates.get(rng.nextInt(candidates.size()));
      }
      loads.set(target, loads.get(target) + w);
      raw[item] = target;
    }
    return BPP_State.fromAssignment(input, raw);
  }

  static int[] naturalOrder(BPP_Input input) {
    int[] order = new int[input.Items()];
    for (int i = 0; i < order.length; i++)
      order[i] = i;
    return order;
  }

  /** Heaviest first; ties keep problem order. */
  static int[] decreasingOrder(BPP_Input input) {
    List<Integer> order = new ArrayList<>();
    for (int i = 0; i < input.Items(); i++)
      order.add(i);
    order.sort((a, b) -> Double.compare(input.ItemWeight(b), input.ItemWeight(a)));
    int[] result = new int[order.size()];
    for (int i = 0; i < result.length; i++)
      result[i] = order.get(i);
    return result;
  }
}
