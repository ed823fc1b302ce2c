import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.json.JSONArray;
import org.json.JSONObject;
import org.json.JSONTokener;
import org.testng.Assert;
import org.testng.annotations.Test;

public class BPP_ExperimentTest {

  private static BPP_Config fastConfig() {
    BPP_Config c = new BPP_Config();
    c.setSeed(5);
    c.ga().populationSize = 10;
    c.ga().maxGenerations = 20;
    c.sa().maxIterations = 500;
    c.hc().restarts = 2;
    return c;
  }

  @Test
  public void testParallelMatchesSequential() {
    BPP_Input in = BPP_TestProblems.random(18, 21L);
    List<BPP_Algorithm> all = Arrays.asList(BPP_Algorithm.values());
    List<BPP_Result> seq = new BPP_Experiment(in, fastConfig(), all, 2, 1).run();
    List<BPP_Result> par = new BPP_Experiment(in, fastConfig(), all, 2, 4).run();
    Assert.assertEquals(seq.size(), all.size() * 2);
    Assert.assertEquals(par.size(), seq.size());
    for (int k = 0; k < seq.size(); k++)
      Assert.assertTrue(seq.get(k).sameOutcome(par.get(k)), "unit " + k + " differs");
  }

  @Test
  public void testUnitOrderAndStatistics() {
    BPP_Input in = BPP_TestProblems.threesAndSevens();
    BPP_Experiment e = new BPP_Experiment(in, fastConfig(),
        Arrays.asList(BPP_Algorithm.STEEPEST, BPP_Algorithm.GA), 3, 1);
    List<BPP_Result> results = e.run();
    Assert.assertEquals(results.get(0).algorithm(), BPP_HillClimbing.Variant.STEEPEST_ASCENT.displayName());
    Assert.assertEquals(results.get(3).algorithm(), BPP_GA.NAME);

    Map<String, BPP_Experiment.Stats> stats = e.statistics();
    Assert.assertEquals(stats.size(), 2);
    BPP_Experiment.Stats steepest = stats.get(BPP_HillClimbing.Variant.STEEPEST_ASCENT.displayName());
    Assert.assertEquals(steepest.runs, 3);
    Assert.assertEquals(steepest.minBins, 3);
    Assert.assertEquals(steepest.maxBins, 3);
    Assert.assertEquals(e.best().binsUsed(), 3);
    Assert.assertSame(e.best(), results.get(0));
  }

  @Test
  public void testExport() throws IOException {
    File dir = Files.createTempDirectory("bpp_experiment").toFile();
    BPP_Config c = fastConfig();
    c.setLogDirectory(new File(dir, "logs").getPath());
    BPP_Experiment e = new BPP_Experiment(BPP_TestProblems.random(12, 2L), c,
        Arrays.asList(BPP_Algorithm.SA, BPP_Algorithm.SIDEWAYS), 2, 1);
    e.run();

    File json = new File(dir, "out/results.json");
    File csv = new File(dir, "out/results.csv");
    e.writeJson(json.getPath());
    e.writeCsv(csv.getPath());

    JSONObject root;
    try (FileReader r = new FileReader(json)) {
      root = new JSONObject(new JSONTokener(r));
    }
    JSONArray runs = root.getJSONArray("results");
    Assert.assertEquals(runs.length(), 4);
    JSONObject first = runs.getJSONObject(0);
    Assert.assertEquals(first.getString("algorithm"), BPP_SA.NAME);
    Assert.assertEquals(first.getInt("trial"), 1);
    Assert.assertEquals(first.getJSONObject("assignment").length(), 12);
    Assert.assertTrue(first.has("termination_reason"));
    Assert.assertTrue(first.has("iterations_or_generations"));
    Assert.assertEquals(root.getJSONObject("problem").getInt("items"), 12);
    Assert.assertTrue(root.getJSONObject("summary").has(BPP_SA.NAME));

    List<String> lines = Files.readAllLines(csv.toPath());
    Assert.assertEquals(lines.size(), 5);
    Assert.assertTrue(lines.get(0).startsWith("trial,seed,algorithm"));

    File log = new File(dir, "logs/sa_trial2.csv");
    Assert.assertTrue(log.exists());
    Assert.assertEquals(Files.readAllLines(log.toPath()).get(0), BPP_ProgressLog.HEADER);
  }

  @Test(expectedExceptions = BPP_InvalidConfigException.class)
  public void testTrialsMustBePositive() {
    new BPP_Experiment(BPP_TestProblems.tenOfTen(), new BPP_Config(), Arrays.asList(BPP_Algorithm.SA), 0, 1);
  }

  @Test
  public void testUnitSeedsDiffer() {
    Assert.assertNotEquals(BPP_Experiment.unitSeed(42, 0), BPP_Experiment.unitSeed(42, 1));
    Assert.assertEquals(BPP_Experiment.unitSeed(42, 0), 42L);
  }
}
