import java.util.List;
import java.util.Random;

import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public class BPP_HillClimbingTest {

  @DataProvider(name = "variants")
  public Object[][] variants() {
    BPP_HillClimbing.Variant[] all = BPP_HillClimbing.Variant.values();
    Object[][] data = new Object[all.length][];
    for (int i = 0; i < all.length; i++)
      data[i] = new Object[] { all[i] };
    return data;
  }

  @Test(dataProvider = "variants")
  public void testTrivialProblemNeedsOneBin(BPP_HillClimbing.Variant variant) {
    BPP_Result r = BPP_HillClimbing.run(BPP_TestProblems.tenOfTen(), variant, new BPP_HillClimbing.Config(),
        new Random(1));
    Assert.assertEquals(r.binsUsed(), 1);
    Assert.assertTrue(r.state().isValid());
    Assert.assertEquals(r.algorithm(), variant.displayName());
  }

  @Test(dataProvider = "variants")
  public void testEmptyProblem(BPP_HillClimbing.Variant variant) {
    BPP_Result r = BPP_HillClimbing.run(BPP_TestProblems.empty(), variant, new BPP_HillClimbing.Config(),
        new Random(1));
    Assert.assertEquals(r.binsUsed(), 0);
    Assert.assertTrue(r.assignment().isEmpty());
    Assert.assertEquals(r.termination(), BPP_Result.Termination.EMPTY_PROBLEM);
  }

  @Test
  public void testSteepestFindsOptimumFromFirstFit() {
    BPP_Result r = BPP_HillClimbing.run(BPP_TestProblems.threesAndSevens(),
        BPP_HillClimbing.Variant.STEEPEST_ASCENT, new BPP_HillClimbing.Config(), null);
    Assert.assertEquals(r.initialScore().bins(), 4);
    Assert.assertEquals(r.binsUsed(), 3);
    Assert.assertEquals(r.iterations(), 3);
    Assert.assertEquals(r.termination(), BPP_Result.Termination.LOCAL_OPTIMUM);
    Assert.assertEquals(r.history().size(), 4);
  }

  @Test
  public void testSteepestHistoryDecreases() {
    BPP_HillClimbing.Config c = new BPP_HillClimbing.Config();
    c.initializer = BPP_Initializer.ONE_PER_BIN;
    BPP_Result r = BPP_HillClimbing.run(BPP_TestProblems.random(20, 2L), BPP_HillClimbing.Variant.STEEPEST_ASCENT,
        c, null);
    List<Double> h = r.history();
    for (int k = 1; k < h.size(); k++)
      Assert.assertTrue(h.get(k) < h.get(k - 1), "step " + k + " did not improve");
    Assert.assertTrue(r.binsUsed() < r.initialScore().bins());
  }

  @Test
  public void testLocalOptimumHasNoBetterNeighbor() {
    BPP_Input in = BPP_TestProblems.random(12, 6L);
    BPP_Result r = BPP_HillClimbing.run(in, BPP_HillClimbing.Variant.STEEPEST_ASCENT, new BPP_HillClimbing.Config(),
        null);
    Assert.assertEquals(r.termination(), BPP_Result.Termination.LOCAL_OPTIMUM);
    for (BPP_State n : BPP_Neighborhood.neighbors(r.state(), in))
      Assert.assertFalse(BPP_Objective.evaluate(n).isBetterThan(r.score()));
  }

  @Test
  public void testStochasticHistoryDecreases() {
    BPP_HillClimbing.Config c = new BPP_HillClimbing.Config();
    c.initializer = BPP_Initializer.ONE_PER_BIN;
    BPP_Result r = BPP_HillClimbing.run(BPP_TestProblems.random(20, 2L), BPP_HillClimbing.Variant.STOCHASTIC, c,
        new Random(3));
    List<Double> h = r.history();
    for (int k = 1; k < h.size(); k++)
      Assert.assertTrue(h.get(k) < h.get(k - 1));
    Assert.assertEquals(r.termination(), BPP_Result.Termination.LOCAL_OPTIMUM);
  }

  @Test
  public void testStochasticIsReproducible() {
    BPP_Input in = BPP_TestProblems.random(25, 4L);
    BPP_HillClimbing.Config c = new BPP_HillClimbing.Config();
    c.initializer = BPP_Initializer.RANDOM_FIT;
    BPP_Result a = BPP_HillClimbing.run(in, BPP_HillClimbing.Variant.STOCHASTIC, c, new Random(99));
    BPP_Result b = BPP_HillClimbing.run(in, BPP_HillClimbing.Variant.STOCHASTIC, c, new Random(99));
    Assert.assertTrue(a.sameOutcome(b));
  }

  @Test
  public void testSidewaysStopsOnPlateau() {
    // first fit decreasing already packs 7+3 three times; swapping equal items keeps the score
    BPP_HillClimbing.Config c = new BPP_HillClimbing.Config();
    c.initializer = BPP_Initializer.FIRST_FIT_DECREASING;
    c.sidewaysLimit = 5;
    BPP_Result r = BPP_HillClimbing.run(BPP_TestProblems.threesAndSevens(), BPP_HillClimbing.Variant.SIDEWAYS_MOVE,
        c, null);
    Assert.assertEquals(r.termination(), BPP_Result.Termination.SIDEWAYS_LIMIT);
    Assert.assertEquals(r.iterations(), 5);
    Assert.assertEquals(r.metrics().get("sideways_moves"), 5);
    Assert.assertEquals(r.binsUsed(), 3);
  }

  /**
   * Capacity 13, first fit gives {6,1,5} {3,3}. No neighbor is better; moving
   * the 6 gives {1,5} {6,3,3} with the same loads, after which the 1 can join
   * the full bin.
   */
  private static BPP_Input plateauBeforeImprovement() {
    return BPP_TestProblems.of(13, 6, 1, 5, 3, 3);
  }

  @Test
  public void testSteepestStopsOnPlateau() {
    BPP_Result r = BPP_HillClimbing.run(plateauBeforeImprovement(), BPP_HillClimbing.Variant.STEEPEST_ASCENT,
        new BPP_HillClimbing.Config(), null);
    Assert.assertEquals(r.termination(), BPP_Result.Termination.LOCAL_OPTIMUM);
    Assert.assertEquals(r.iterations(), 0);
    Assert.assertEquals(r.score(), r.initialScore());
  }

  @Test
  public void testSidewaysEscapesPlateauThenImproves() {
    BPP_Input in = plateauBeforeImprovement();
    BPP_Result r = BPP_HillClimbing.run(in, BPP_HillClimbing.Variant.SIDEWAYS_MOVE, new BPP_HillClimbing.Config(),
        null);
    Assert.assertEquals(r.iterations(), 2);
    Assert.assertEquals(r.metrics().get("sideways_moves"), 1);
    Assert.assertEquals(r.termination(), BPP_Result.Termination.LOCAL_OPTIMUM);

    List<Double> h = r.history();
    Assert.assertEquals(h.size(), 3);
    Assert.assertEquals(h.get(1), h.get(0));
    Assert.assertTrue(h.get(2) < h.get(1));

    Assert.assertEquals(r.binsUsed(), 2);
    Assert.assertTrue(r.score().isBetterThan(r.initialScore()));
    // {5} {6,1,3,3}
    Assert.assertEquals(r.state().binSize(r.state().binOf(2)), 1);
    Assert.assertEquals(r.state().load(r.state().binOf(0)), 13.0);
  }

  @Test
  public void testSidewaysCounterRestartsAfterImprovement() {
    BPP_HillClimbing.AcceptancePolicy p = BPP_HillClimbing.AcceptancePolicy.betterOrEqualWithin(1);
    BPP_Score flat = new BPP_Score(2, 0.5);
    BPP_Score better = new BPP_Score(2, 0.6);
    Assert.assertEquals(p.judge(flat, flat), BPP_HillClimbing.Step.PLATEAU);
    Assert.assertEquals(p.judge(flat, better), BPP_HillClimbing.Step.IMPROVED);
    Assert.assertEquals(p.judge(better, better), BPP_HillClimbing.Step.PLATEAU);
    Assert.assertEquals(p.judge(better, better), BPP_HillClimbing.Step.TERMINATED);
    Assert.assertEquals(p.stopReason(), BPP_Result.Termination.SIDEWAYS_LIMIT);
  }

  @Test
  public void testSteepestNeverAcceptsAnEqualScore() {
    BPP_HillClimbing.Config c = new BPP_HillClimbing.Config();
    c.initializer = BPP_Initializer.RANDOM_FIT;
    for (long seed = 1; seed <= 40; seed++) {
      BPP_Result r = BPP_HillClimbing.run(BPP_TestProblems.random(20, seed),
          BPP_HillClimbing.Variant.STEEPEST_ASCENT, c, new Random(seed));
      List<Double> h = r.history();
      for (int k = 1; k < h.size(); k++)
        Assert.assertTrue(h.get(k) < h.get(k - 1), "seed " + seed + " step " + k);
      Assert.assertEquals(r.termination(), BPP_Result.Termination.LOCAL_OPTIMUM);
    }
  }

  @Test
  public void testIterationCap() {
    BPP_HillClimbing.Config c = new BPP_HillClimbing.Config();
    c.initializer = BPP_Initializer.FIRST_FIT_DECREASING;
    c.maxIterations = 2;
    BPP_Result r = BPP_HillClimbing.run(BPP_TestProblems.threesAndSevens(), BPP_HillClimbing.Variant.SIDEWAYS_MOVE,
        c, null);
    Assert.assertEquals(r.termination(), BPP_Result.Termination.ITERATION_CAP);
    Assert.assertEquals(r.iterations(), 2);
    Assert.assertFalse(r.termination().converged());
  }

  @Test
  public void testRandomRestartRunsEveryClimb() {
    BPP_HillClimbing.Config c = new BPP_HillClimbing.Config();
    c.restarts = 3;
    BPP_Input in = BPP_TestProblems.random(15, 8L);
    BPP_Result r = BPP_HillClimbing.run(in, BPP_HillClimbing.Variant.RANDOM_RESTART, c, new Random(5));
    Assert.assertEquals(r.termination(), BPP_Result.Termination.RESTARTS_EXHAUSTED);
    Assert.assertEquals(((List<?>) r.metrics().get("bins_per_climb")).size(), 4);
    BPP_Result first = BPP_HillClimbing.run(in, BPP_HillClimbing.Variant.STEEPEST_ASCENT, c, null);
    Assert.assertFalse(first.score().isBetterThan(r.score()));
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void testStochasticNeedsRandom() {
    BPP_HillClimbing.run(BPP_TestProblems.tenOfTen(), BPP_HillClimbing.Variant.STOCHASTIC,
        new BPP_HillClimbing.Config(), null);
  }

  @Test
  public void testInvalidConfig() {
    BPP_HillClimbing.Config c = new BPP_HillClimbing.Config();
    c.maxIterations = 0;
    try {
      BPP_HillClimbing.run(BPP_TestProblems.tenOfTen(), BPP_HillClimbing.Variant.STEEPEST_ASCENT, c, null);
      Assert.fail("Expected an invalid configuration");
    } catch (BPP_InvalidConfigException e) {
      Assert.assertEquals(e.getParameter(), "max_iterations");
    }
  }

  @Test(expectedExceptions = BPP_InvalidConfigException.class)
  public void testRestartCannotNestItself() {
    BPP_HillClimbing.Config c = new BPP_HillClimbing.Config();
    c.restartBase = BPP_HillClimbing.Variant.RANDOM_RESTART;
    BPP_HillClimbing.run(BPP_TestProblems.tenOfTen(), BPP_HillClimbing.Variant.RANDOM_RESTART, c, new Random(1));
  }
}
