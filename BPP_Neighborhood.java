import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Random;

/**
 * Neighborhood of a packing: every feasible single-item relocation and every
 * feasible pairwise swap. Iteration order is fixed (item index, then target
 * bin index, then swap pairs i &lt; j), so steepest-ascent tie breaking is
 * reproducible. Infeasible candidates are skipped before they are yielded.
 *
 * <p>
 * The iterables are lazy and restartable: each {@code iterator()} call walks
 * the neighborhood again from the start, nothing is cached.
 */
public final class BPP_Neighborhood {

  /** Share of relocations among random moves, the rest are swaps. */
  static final double RELOCATE_SHARE = 0.8;

  private BPP_Neighborhood() {
  }

  public static Iterable<BPP_State> neighbors(BPP_State state, BPP_Input input) {
    if (state.input() != input) {
      throw new IllegalArgumentException("State belongs to a different problem");
    }
    return () -> new Iterator<BPP_State>() {
      private final Iterator<BPP_Move> moves = moves(state).iterator();

      @Override
      public boolean hasNext() {
        return moves.hasNext();
      }

      @Override
      public BPP_State next() {
        return moves.next().apply(state);
      }
    };
  }

  public static Iterable<BPP_Move> moves(BPP_State state) {
    return () -> new MoveIterator(state);
  }

  /** All feasible moves, in neighborhood order. */
  static List<BPP_Move> allMoves(BPP_State state) {
    List<BPP_Move> list = new ArrayList<>();
    for (BPP_Move m : moves(state))
      list.add(m);
    return list;
  }

  /**
   * Draws one feasible move at random. Returns null when no feasible move was
   * found within {@code maxTrials} draws.
   */
  static BPP_Move randomMove(BPP_State state, Random rng, int maxTrials) {
    int n = state.itemCount();
    if (n == 0)
      return null;
    for (int t = 0; t < maxTrials; t++) {
      BPP_Move move;
      if (n < 2 || rng.nextDouble() < RELOCATE_SHARE) {
        int item = rng.nextInt(n);
        // binsUsed() is a valid target: open a new bin
        int target = rng.nextInt(state.binsUsed() + 1);
        move = new BPP_Move.Relocate(item, target);
      } else {
        int a = rng.nextInt(n);
        int b = rng.nextInt(n - 1);
        if (b >= a)
          b++;
        move = new BPP_Move.Swap(Math.min(a, b), Math.max(a, b));
      }
      if (move.isFeasible(state))
        return move;
    }
    return null;
  }

  // --- Lazy walk over the neighborhood ---

  private static final class MoveIterator implements Iterator<BPP_Move> {
    private final BPP_State state;
    private final int n;
    private final int bins;

    // relocation phase: (item, target); swap phase: (i, j)
    private boolean swapPhase = false;
    private int a = 0;
    private int b = -1;
    private BPP_Move pending;

    MoveIterator(BPP_State state) {
      this.state = state;
      this.n = state.itemCount();
      this.bins = state.binsUsed();
    }

    @Override
    public boolean hasNext() {
      if (pending == null)
        pending = advance();
      return pending != null;
    }

    @Override
    public BPP_Move next() {
      if (!hasNext())
        throw new NoSuchElementException();
      BPP_Move m = pending;
      pending = null;
      return m;
    }

    private BPP_Move advance() {
      while (!swapPhase) {
        b++;
        if (b > bins) {
          a++;
          b = 0;
        }
        if (a >= n) {
          swapPhase = true;
          a = 0;
          b = 0;
          break;
        }
        BPP_Move m = new BPP_Move.Relocate(a, b);
        if (m.isFeasible(state))
          return m;
      }
      while (a < n) {
        b++;
        if (b >= n) {
          a++;
          b = a;
          continue;
        }
        BPP_Move m = new BPP_Move.Swap(a, b);
        if (m.isFeasible(state))
          return m;
      }
      return null;
    }
  }
}
