import java.util.List;
import java.util.Random;

import org.testng.Assert;
import org.testng.annotations.Test;

public class BPP_GATest {

  private static BPP_GA.Config small() {
    BPP_GA.Config c = new BPP_GA.Config();
    c.populationSize = 20;
    c.maxGenerations = 60;
    c.stagnationGenerations = 0;
    return c;
  }

  @Test
  public void testTrivialProblemNeedsOneBin() {
    BPP_Result r = BPP_GA.run(BPP_TestProblems.tenOfTen(), new BPP_GA.Config(), new Random(1));
    Assert.assertEquals(r.binsUsed(), 1);
    Assert.assertEquals(r.algorithm(), BPP_GA.NAME);
  }

  @Test
  public void testOrderCrossoverExample() {
    int[] p1 = { 0, 1, 2, 3, 4, 5, 6 };
    int[] p2 = { 6, 4, 2, 0, 5, 1, 3 };
    Assert.assertEquals(BPP_GA.orderCrossover(p1, p2, 2, 4), new int[] { 0, 5, 2, 3, 4, 1, 6 });
  }

  @Test
  public void testOperatorsKeepPermutations() {
    Random rng = new Random(17);
    int n = 12;
    for (int k = 0; k < 500; k++) {
      int[] p1 = BPP_GA.randomPermutation(n, rng);
      int[] p2 = BPP_GA.randomPermutation(n, rng);
      for (int[] child : BPP_GA.orderCrossover(p1, p2, rng)) {
        Assert.assertTrue(BPP_GA.isPermutation(child, n));
        BPP_GA.mutate(child, BPP_GA.Mutation.SWAP, rng);
        Assert.assertTrue(BPP_GA.isPermutation(child, n));
        BPP_GA.mutate(child, BPP_GA.Mutation.INVERSION, rng);
        Assert.assertTrue(BPP_GA.isPermutation(child, n));
      }
    }
  }

  @Test
  public void testIsPermutation() {
    Assert.assertTrue(BPP_GA.isPermutation(new int[] { 2, 0, 1 }, 3));
    Assert.assertFalse(BPP_GA.isPermutation(new int[] { 2, 2, 1 }, 3));
    Assert.assertFalse(BPP_GA.isPermutation(new int[] { 0, 1 }, 3));
    Assert.assertFalse(BPP_GA.isPermutation(new int[] { 0, 1, 3 }, 3));
  }

  @Test
  public void testUndoneSwapDecodesToSameState() {
    BPP_Input in = BPP_TestProblems.random(20, 3L);
    int[] genes = BPP_GA.randomPermutation(in.Items(), new Random(5));
    BPP_State before = BPP_GA.decode(in, genes);
    BPP_GA.swapPositions(genes, 3, 11);
    BPP_GA.swapPositions(genes, 3, 11);
    Assert.assertEquals(BPP_GA.decode(in, genes), before);
  }

  @Test
  public void testDecodeIsAlwaysValid() {
    BPP_Input in = BPP_TestProblems.random(30, 4L);
    Random rng = new Random(8);
    for (int k = 0; k < 100; k++) {
      BPP_State s = BPP_GA.decode(in, BPP_GA.randomPermutation(in.Items(), rng));
      Assert.assertTrue(s.isValid());
    }
  }

  @Test
  public void testFitness() {
    BPP_State full = BPP_State.fromAssignment(BPP_TestProblems.threesAndSevens(), new int[] { 0, 1, 2, 0, 1, 2 });
    Assert.assertEquals(BPP_GA.fitness(BPP_Objective.evaluate(full)), 0.25, 1e-12);
  }

  @Test
  public void testBestFitnessNeverDecreasesWithElitism() {
    BPP_GA.Config c = small();
    c.elitismCount = 1;
    c.seededIndividuals = 0;
    BPP_Result r = BPP_GA.run(BPP_TestProblems.random(30, 6L), c, new Random(2));
    List<Double> h = r.history();
    Assert.assertEquals(h.size(), c.maxGenerations + 1);
    for (int k = 1; k < h.size(); k++)
      Assert.assertTrue(h.get(k) >= h.get(k - 1), "generation " + k);
    Assert.assertEquals(r.termination(), BPP_Result.Termination.GENERATION_CAP);
    Assert.assertEquals(r.iterations(), c.maxGenerations);
  }

  @Test
  public void testSeededStartIsKept() {
    BPP_Input in = BPP_TestProblems.random(30, 7L);
    BPP_Result r = BPP_GA.run(in, small(), new Random(2));
    BPP_State ffd = BPP_Initializer.FIRST_FIT_DECREASING.initialize(in, null);
    Assert.assertFalse(BPP_Objective.evaluate(ffd).isBetterThan(r.score()));
    Assert.assertTrue(r.state().isValid());
  }

  @Test
  public void testStagnation() {
    BPP_GA.Config c = new BPP_GA.Config();
    c.stagnationGenerations = 5;
    // every ordering of identical items decodes to the same single bin
    BPP_Result r = BPP_GA.run(BPP_TestProblems.tenOfTen(), c, new Random(1));
    Assert.assertEquals(r.termination(), BPP_Result.Termination.STAGNATION);
    Assert.assertEquals(r.iterations(), 5);
  }

  @Test
  public void testRouletteAndInversion() {
    BPP_GA.Config c = small();
    c.selection = BPP_GA.Selection.ROULETTE;
    c.mutation = BPP_GA.Mutation.INVERSION;
    BPP_Result r = BPP_GA.run(BPP_TestProblems.threesAndSevens(), c, new Random(4));
    Assert.assertEquals(r.binsUsed(), 3);
  }

  @Test
  public void testReproducible() {
    BPP_Input in = BPP_TestProblems.random(25, 9L);
    BPP_Result a = BPP_GA.run(in, small(), new Random(21));
    BPP_Result b = BPP_GA.run(in, small(), new Random(21));
    Assert.assertTrue(a.sameOutcome(b));
  }

  @Test
  public void testEmptyProblem() {
    BPP_Result r = BPP_GA.run(BPP_TestProblems.empty(), new BPP_GA.Config(), new Random(1));
    Assert.assertEquals(r.binsUsed(), 0);
    Assert.assertTrue(r.assignment().isEmpty());
  }

  @Test
  public void testInvalidElitism() {
    BPP_GA.Config c = new BPP_GA.Config();
    c.populationSize = 4;
    c.elitismCount = 5;
    try {
      BPP_GA.run(BPP_TestProblems.tenOfTen(), c, new Random(1));
      Assert.fail("Expected an invalid configuration");
    } catch (BPP_InvalidConfigException e) {
      Assert.assertEquals(e.getParameter(), "elitism_count");
    }
  }

  @Test(expectedExceptions = BPP_InvalidConfigException.class)
  public void testInvalidProbability() {
    BPP_GA.Config c = new BPP_GA.Config();
    c.mutationProbability = 1.5;
    BPP_GA.run(BPP_TestProblems.tenOfTen(), c, new Random(1));
  }
}
