/**
 * One atomic change of a packing. Moves are computed against the state they
 * were generated from and applied by building a new state.
 */
abstract class BPP_Move {

  abstract BPP_State apply(BPP_State state);

  /** Capacity check against the state the move would be applied to. */
  abstract boolean isFeasible(BPP_State state);

  // 1. Relocate one item to another bin (or a new bin when target == binsUsed)
  static final class Relocate extends BPP_Move {
    final int item;
    final int targetBin;

    Relocate(int item, int targetBin) {
      this.item = item;
      this.targetBin = targetBin;
    }

    @Override
    BPP_State apply(BPP_State state) {
      return state.relocate(item, targetBin);
    }

    @Override
    boolean isFeasible(BPP_State state) {
      if (state.binOf(item) == targetBin)
        return false;
      if (targetBin == state.binsUsed())
        return state.binSize(state.binOf(item)) > 1; // lone item to a new bin changes nothing
      return state.fits(targetBin, state.input().ItemWeight(item));
    }

    @Override
    public String toString() {
      return "Relocate(" + item + " -> " + targetBin + ")";
    }
  }

  // 2. Exchange two items that sit in different bins
  static final class Swap extends BPP_Move {
    final int itemA;
    final int itemB;

    Swap(int itemA, int itemB) {
      this.itemA = itemA;
      this.itemB = itemB;
    }

    @Override
    BPP_State apply(BPP_State state) {
      return state.swap(itemA, itemB);
    }

    @Override
    boolean isFeasible(BPP_State state) {
      int binA = state.binOf(itemA);
      int binB = state.binOf(itemB);
      if (binA == binB)
        return false;
      double wA = state.input().ItemWeight(itemA);
      double wB = state.input().ItemWeight(itemB);
      double cap = state.input().Capacity() + BPP_State.EPS;
      return state.load(binA) - wA + wB <= cap && state.load(binB) - wB + wA <= cap;
    }

    @Override
    public String toString() {
      return "Swap(" + itemA + " <-> " + itemB + ")";
    }
  }
}
