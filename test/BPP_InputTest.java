import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.LinkedHashMap;
import java.util.Map;

import org.json.JSONException;
import org.json.JSONObject;
import org.testng.Assert;
import org.testng.annotations.Test;

public class BPP_InputTest {

  @Test
  public void testItemHeavierThanCapacityIsRejected() {
    Map<String, Integer> items = new LinkedHashMap<>();
    items.put("big", 60);
    try {
      new BPP_Input(50, items);
      Assert.fail("Expected an infeasible item");
    } catch (BPP_InfeasibleItemException e) {
      Assert.assertEquals(e.getItemId(), "big");
      Assert.assertEquals(e.getWeight(), 60.0);
      Assert.assertEquals(e.getCapacity(), 50.0);
    }
  }

  @Test
  public void testItemEqualToCapacityIsAccepted() {
    BPP_Input in = BPP_TestProblems.of(50, 50);
    Assert.assertEquals(in.Items(), 1);
    Assert.assertEquals(in.LowerBound(), 1);
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void testNonPositiveWeight() {
    BPP_TestProblems.of(10, 3, 0);
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void testNonPositiveCapacity() {
    BPP_TestProblems.of(0, 3);
  }

  @Test
  public void testEmptyProblem() {
    BPP_Input in = BPP_TestProblems.empty();
    Assert.assertTrue(in.isEmpty());
    Assert.assertEquals(in.LowerBound(), 0);
    Assert.assertEquals(in.TotalWeight(), 0.0);
  }

  @Test
  public void testLowerBound() {
    Assert.assertEquals(BPP_TestProblems.threesAndSevens().LowerBound(), 3);
    Assert.assertEquals(BPP_TestProblems.of(10, 5, 5, 1).LowerBound(), 2);
  }

  @Test
  public void testPrimaryFormatSortsIds() {
    JSONObject j = new JSONObject("{\"capacity\": 20, \"items\": {\"c\": 3, \"a\": 5.5, \"b\": 7}}");
    BPP_Input in = BPP_Input.fromJSON(j);
    Assert.assertEquals(in.Capacity(), 20.0);
    Assert.assertEquals(in.Items(), 3);
    Assert.assertEquals(in.ItemId(0), "a");
    Assert.assertEquals(in.ItemId(1), "b");
    Assert.assertEquals(in.ItemId(2), "c");
    Assert.assertEquals(in.ItemWeight(0), 5.5);
    Assert.assertEquals(in.findItemIndex("c"), 2);
    Assert.assertEquals(in.findItemIndex("zzz"), -1);
  }

  @Test
  public void testLegacyFormatKeepsListOrder() {
    JSONObject j = new JSONObject("{\"kapasitas_kontainer\": 100, \"barang\": ["
        + "{\"id\": \"BRG002\", \"ukuran\": 40}, {\"id\": \"BRG001\", \"ukuran\": 55}]}");
    BPP_Input in = BPP_Input.fromJSON(j);
    Assert.assertEquals(in.ItemId(0), "BRG002");
    Assert.assertEquals(in.ItemId(1), "BRG001");
    Assert.assertEquals(in.TotalWeight(), 95.0);
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void testLegacyFormatDuplicateId() {
    BPP_Input.fromJSON(new JSONObject("{\"kapasitas_kontainer\": 100, \"barang\": ["
        + "{\"id\": \"X\", \"ukuran\": 40}, {\"id\": \"X\", \"ukuran\": 55}]}"));
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void testUnknownLayout() {
    BPP_Input.fromJSON(new JSONObject("{\"size\": 100}"));
  }

  @Test
  public void testFromFile() throws IOException {
    File f = File.createTempFile("bpp_input", ".json");
    f.deleteOnExit();
    try (FileWriter w = new FileWriter(f)) {
      w.write(BPP_TestProblems.threesAndSevens().toJSON().toString());
    }
    BPP_Input in = BPP_Input.fromFile(f.getPath());
    Assert.assertEquals(in.Items(), 6);
    Assert.assertEquals(in.Capacity(), 10.0);
    Assert.assertEquals(in.TotalWeight(), 30.0);
  }

  @Test
  public void testFromFileReadsUtf8Ids() throws IOException {
    File f = File.createTempFile("bpp_utf8", ".json");
    f.deleteOnExit();
    String json = "{ \"capacity\": 10, \"items\": { \"b\u00e4r\": 4, \"\u7bb1\": 6 } }";
    Files.write(f.toPath(), json.getBytes(StandardCharsets.UTF_8));
    BPP_Input in = BPP_Input.fromFile(f.getPath());
    Assert.assertEquals(in.ItemId(0), "b\u00e4r");
    Assert.assertEquals(in.ItemId(1), "\u7bb1");
    Assert.assertEquals(in.ItemWeight(1), 6.0);
  }

  @Test(expectedExceptions = JSONException.class)
  public void testMalformedFile() throws IOException {
    File f = File.createTempFile("bpp_bad", ".json");
    f.deleteOnExit();
    try (FileWriter w = new FileWriter(f)) {
      w.write("{ \"capacity\": 10, ");
    }
    BPP_Input.fromFile(f.getPath());
  }

  @Test
  public void testRandomInstanceIsSeeded() {
    BPP_Input a = BPP_TestProblems.random(15, 7L);
    BPP_Input b = BPP_TestProblems.random(15, 7L);
    Assert.assertEquals(a.Items(), 15);
    Assert.assertEquals(a.ItemId(0), "BRG001");
    for (int i = 0; i < a.Items(); i++) {
      Assert.assertEquals(a.ItemWeight(i), b.ItemWeight(i));
      Assert.assertTrue(a.ItemWeight(i) >= 10 && a.ItemWeight(i) <= 70);
    }
  }
}
