import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.List;
import java.util.Random;

import org.testng.Assert;
import org.testng.annotations.Test;

public class BPP_ProgressLogTest {

  @Test
  public void testIntervalGatesLines() throws IOException {
    File f = File.createTempFile("bpp_progress", ".csv");
    f.deleteOnExit();
    try (BPP_ProgressLog log = BPP_ProgressLog.open(f.getPath(), 5)) {
      Assert.assertTrue(log.isActive());
      log.logAlways(0, 0, 3.5, 3.5, 3, 1.0);
      for (int i = 1; i <= 12; i++)
        log.log(i, i, 3.2, 3.1, 3, 0.5);
    }
    List<String> lines = Files.readAllLines(f.toPath());
    Assert.assertEquals(lines.get(0), BPP_ProgressLog.HEADER);
    Assert.assertEquals(lines.size(), 4); // header, 0, 5, 10
    Assert.assertTrue(lines.get(2).startsWith("5,5,3.200000,3.100000,3,"));
  }

  @Test
  public void testNullPathIsInactive() {
    try (BPP_ProgressLog log = BPP_ProgressLog.open(null, 1)) {
      Assert.assertFalse(log.isActive());
      log.log(1, 1, 1, 1, 1, 1);
    }
  }

  @Test
  public void testAnnealingRunLogs() throws IOException {
    File f = File.createTempFile("bpp_sa", ".csv");
    f.deleteOnExit();
    BPP_SA.Config c = new BPP_SA.Config();
    c.maxIterations = 300;
    c.logFilePath = f.getPath();
    c.logInterval = 100;
    BPP_SA.run(BPP_TestProblems.random(10, 1L), c, new Random(1));
    List<String> lines = Files.readAllLines(f.toPath());
    // header, start, 100, 200, 300, final
    Assert.assertEquals(lines.size(), 6);
    Assert.assertTrue(lines.get(lines.size() - 1).startsWith("300,"));
  }
}
