import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Font;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.Stroke;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import javax.imageio.ImageIO;

/**
 * PNG charts of experiment results: objective value per iteration, bar
 * comparisons between algorithms and the spread of repeated runs.
 */
public final class BPP_Charts {

  static final int WIDTH = 960;
  static final int HEIGHT = 480;

  /** Quantity shown by a bar chart. */
  public enum Metric {
    BINS("Number of Bins", "Comparison: Number of Bins Used"),
    TIME("Duration (seconds)", "Comparison: Execution Time"),
    ITERATIONS("Number of Iterations", "Comparison: Iterations Count");

    private final String axisLabel;
    private final String title;

    Metric(String axisLabel, String title) {
      this.axisLabel = axisLabel;
      this.title = title;
    }

    double of(BPP_Result r) {
      switch (this) {
      case BINS:
        return r.binsUsed();
      case TIME:
        return r.elapsedMillis() / 1000.0;
      default:
        return r.iterations();
      }
    }
  }

  private static final Color[] PALETTE = { new Color(0, 102, 204), new Color(220, 110, 30), new Color(40, 150, 70),
      new Color(180, 40, 60), new Color(120, 80, 170), new Color(130, 90, 50), new Color(200, 90, 170),
      new Color(90, 90, 90) };
  private static final Color GRID = new Color(230, 230, 230);
  private static final int LEFT = 70, RIGHT = 190, TOP = 40, BOTTOM = 50;

  private BPP_Charts() {
  }

  /** One line per result, e.g. every algorithm of an experiment. */
  public static BufferedImage objectiveHistory(String title, List<BPP_Result> results) {
    List<String> labels = new ArrayList<>();
    List<List<Double>> series = new ArrayList<>();
    for (BPP_Result r : results) {
      labels.add(r.algorithm());
      series.add(r.history());
    }
    return lineChart(title, labels, series, -1);
  }

  /** Every trial of one algorithm plus the average of the trials at each iteration. */
  public static BufferedImage multipleRuns(String algorithm, List<BPP_Result> runs) {
    List<String> labels = new ArrayList<>();
    List<List<Double>> series = new ArrayList<>();
    for (int k = 0; k < runs.size(); k++) {
      labels.add("Run " + (k + 1));
      series.add(runs.get(k).history());
    }
    labels.add("Average");
    series.add(averageHistory(series));
    return lineChart(algorithm + " - Multiple Runs", labels, series, series.size() - 1);
  }

  /**
   * Mean over the histories at each index. Shorter histories stop contributing
   * once they end.
   */
  static List<Double> averageHistory(List<List<Double>> histories) {
    int longest = 0;
    for (List<Double> h : histories)
      longest = Math.max(longest, h.size());
    List<Double> avg = new ArrayList<>(longest);
    for (int j = 0; j < longest; j++) {
      double sum = 0;
      int n = 0;
      for (List<Double> h : histories) {
        if (j < h.size()) {
          sum += h.get(j);
          n++;
        }
      }
      avg.add(sum / n);
    }
    return avg;
  }

  public static BufferedImage comparisonBar(List<BPP_Result> results, Metric metric) {
    BufferedImage img = new BufferedImage(WIDTH, HEIGHT, BufferedImage.TYPE_INT_RGB);
    Graphics2D g = canvas(img, metric.title);
    int pw = WIDTH - LEFT - 20, ph = HEIGHT - TOP - BOTTOM;
    g.drawRect(LEFT, TOP, pw, ph);
    if (results.isEmpty()) {
      g.drawString("No data.", LEFT + 10, TOP + 20);
      g.dispose();
      return img;
    }

    double ymax = 0;
    for (BPP_Result r : results)
      ymax = Math.max(ymax, metric.of(r));
    if (ymax == 0)
      ymax = 1;
    ymax *= 1.1;

    drawHorizontalGrid(g, pw, ph, 0, ymax);
    g.drawString(metric.axisLabel, 6, TOP - 6);

    int slot = pw / results.size();
    int barWidth = Math.max(4, slot * 3 / 5);
    for (int k = 0; k < results.size(); k++) {
      double v = metric.of(results.get(k));
      int bh = (int) Math.round(v * ph / ymax);
      int x = LEFT + k * slot + (slot - barWidth) / 2;
      g.setColor(PALETTE[k % PALETTE.length]);
      g.fillRect(x, TOP + ph - bh, barWidth, bh);
      g.setColor(Color.DARK_GRAY);
      g.drawString(formatValue(v), x, TOP + ph - bh - 4);
      g.drawString(shorten(results.get(k).algorithm(), slot), LEFT + k * slot + 4, HEIGHT - BOTTOM + 16);
    }
    g.dispose();
    return img;
  }

  /**
   * Writes the charts for an experiment into {@code dir}: an objective chart
   * per algorithm (first trial), a runs chart per algorithm with more than one
   * trial, and the combined and bar comparisons.
   *
   * @return the files written, in the order written
   */
  public static List<File> writeAll(List<BPP_Result> results, File dir) throws IOException {
    if (!dir.exists() && !dir.mkdirs()) {
      throw new IOException("Cannot create directory " + dir);
    }
    Map<String, List<BPP_Result>> byAlgorithm = new LinkedHashMap<>();
    for (BPP_Result r : results)
      byAlgorithm.computeIfAbsent(r.algorithm(), k -> new ArrayList<>()).add(r);

    List<File> written = new ArrayList<>();
    List<BPP_Result> firstTrials = new ArrayList<>();
    for (Map.Entry<String, List<BPP_Result>> e : byAlgorithm.entrySet()) {
      String name = fileName(e.getKey());
      BPP_Result first = e.getValue().get(0);
      firstTrials.add(first);
      written.add(write(objectiveHistory(e.getKey() + ": Objective vs Iterations", List.of(first)),
          new File(dir, name + "_objective.png")));
      if (e.getValue().size() > 1)
        written.add(write(multipleRuns(e.getKey(), e.getValue()), new File(dir, name + "_runs.png")));
    }
    written.add(write(objectiveHistory("Objective Function Comparison", firstTrials),
        new File(dir, "objective_comparison.png")));
    written.add(write(comparisonBar(firstTrials, Metric.BINS), new File(dir, "bins_comparison.png")));
    written.add(write(comparisonBar(firstTrials, Metric.TIME), new File(dir, "time_comparison.png")));
    written.add(write(comparisonBar(firstTrials, Metric.ITERATIONS), new File(dir, "iterations_comparison.png")));
    return written;
  }

  static File write(BufferedImage img, File file) throws IOException {
    if (!ImageIO.write(img, "png", file)) {
      throw new IOException("No PNG writer available for " + file);
    }
    return file;
  }

  /** "Steepest Ascent Hill Climbing" becomes "steepest_ascent_hill_climbing". */
  static String fileName(String algorithm) {
    return algorithm.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "_").replaceAll("^_|_$", "");
  }

  // --- Drawing ---

  private static Graphics2D canvas(BufferedImage img, String title) {
    Graphics2D g = img.createGraphics();
    g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
    g.setColor(Color.WHITE);
    g.fillRect(0, 0, img.getWidth(), img.getHeight());
    g.setColor(Color.BLACK);
    g.setFont(g.getFont().deriveFont(Font.BOLD, 14f));
    g.drawString(title, LEFT, TOP - 18);
    g.setFont(g.getFont().deriveFont(Font.PLAIN, 11f));
    return g;
  }

  /**
   * @param emphasized index of a series drawn thick and dashed, -1 for none
   */
  private static BufferedImage lineChart(String title, List<String> labels, List<List<Double>> series,
      int emphasized) {
    BufferedImage img = new BufferedImage(WIDTH, HEIGHT, BufferedImage.TYPE_INT_RGB);
    Graphics2D g = canvas(img, title);
    int pw = WIDTH - LEFT - RIGHT, ph = HEIGHT - TOP - BOTTOM;
    g.drawRect(LEFT, TOP, pw, ph);

    int longest = 0;
    double ymin = Double.POSITIVE_INFINITY, ymax = Double.NEGATIVE_INFINITY;
    for (List<Double> s : series) {
      longest = Math.max(longest, s.size());
      for (double v : s) {
        ymin = Math.min(ymin, v);
        ymax = Math.max(ymax, v);
      }
    }
    if (longest == 0) {
      g.drawString("No data.", LEFT + 10, TOP + 20);
      g.dispose();
      return img;
    }
    if (ymax == ymin)
      ymax = ymin + 1;
    double xmax = Math.max(1, longest - 1);

    drawHorizontalGrid(g, pw, ph, ymin, ymax);
    g.setColor(GRID);
    for (int i = 1; i <= 5; i++) {
      int xx = LEFT + (int) Math.round(pw * i / 6.0);
      g.drawLine(xx, TOP, xx, TOP + ph);
    }
    g.setColor(Color.DARK_GRAY);
    g.drawString("0", LEFT, HEIGHT - BOTTOM + 16);
    g.drawString(Integer.toString(longest - 1), LEFT + pw - 30, HEIGHT - BOTTOM + 16);
    g.drawString("Iteration", LEFT + pw / 2 - 20, HEIGHT - 12);
    g.drawString("Objective", 6, TOP - 6);

    Stroke thin = new BasicStroke(1.5f);
    Stroke dashed = new BasicStroke(3f, BasicStroke.CAP_BUTT, BasicStroke.JOIN_MITER, 10f, new float[] { 8f, 6f },
        0f);
    for (int k = 0; k < series.size(); k++) {
      List<Double> s = series.get(k);
      Color color = k == emphasized ? Color.RED : PALETTE[k % PALETTE.length];
      g.setColor(color);
      g.setStroke(k == emphasized ? dashed : thin);
      int prevx = -1, prevy = -1;
      for (int i = 0; i < s.size(); i++) {
        int xx = LEFT + (int) Math.round(i * pw / xmax);
        int yy = TOP + ph - (int) Math.round((s.get(i) - ymin) * ph / (ymax - ymin));
        if (i > 0)
          g.drawLine(prevx, prevy, xx, yy);
        if (s.size() <= 60)
          g.fillOval(xx - 2, yy - 2, 4, 4);
        prevx = xx;
        prevy = yy;
      }

      // legend
      int ly = TOP + 14 + k * 16;
      g.fillRect(LEFT + pw + 12, ly - 8, 12, 8);
      g.setColor(Color.BLACK);
      g.drawString(shorten(labels.get(k), RIGHT - 36), LEFT + pw + 30, ly);
    }
    g.dispose();
    return img;
  }

  private static void drawHorizontalGrid(Graphics2D g, int pw, int ph, double ymin, double ymax) {
    g.setColor(GRID);
    for (int i = 1; i <= 5; i++) {
      int yy = TOP + (int) Math.round(ph * i / 6.0);
      g.drawLine(LEFT, yy, LEFT + pw, yy);
    }
    g.setColor(Color.DARK_GRAY);
    g.drawString(formatValue(ymin), 6, TOP + ph);
    g.drawString(formatValue(ymax), 6, TOP + 10);
  }

  private static String formatValue(double v) {
    return String.format(Locale.US, "%.2f", v);
  }

  // roughly 6 px per character at 11 pt
  private static String shorten(String s, int pixels) {
    int max = Math.max(4, pixels / 6);
    return s.length() <= max ? s : s.substring(0, max - 2) + "..";
  }
}
