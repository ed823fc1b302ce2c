import java.io.BufferedWriter;
import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Per-run CSV progress log. A log that cannot be written is reported once on
 * stderr and then ignored, the search itself keeps running.
 */
final class BPP_ProgressLog implements AutoCloseable {

  static final String HEADER = "iteration,time_ms,current,best,bins,extra";

  private final String path;
  private final int interval;
  private BufferedWriter logWriter;

  private BPP_ProgressLog(String path, int interval) {
    this.path = path;
    this.interval = Math.max(1, interval);
    if (path == null)
      return;
    try {
      File logFile = new File(path);
      if (logFile.getParentFile() != null && !logFile.getParentFile().exists()) {
        logFile.getParentFile().mkdirs();
      }
      logWriter = new BufferedWriter(new FileWriter(logFile, StandardCharsets.UTF_8, false));
      logWriter.write(HEADER + "\n");
      logWriter.flush();
    } catch (IOException e) {
      System.err.println("Error creating log file " + path + ": " + e.getMessage());
      logWriter = null;
    }
  }

  /** Returns a log that writes nothing when path is null. */
  static BPP_ProgressLog open(String path, int interval) {
    return new BPP_ProgressLog(path, interval);
  }

  boolean isActive() {
    return logWriter != null;
  }

  /** Writes the line when iteration is a multiple of the interval. */
  void log(int iteration, long elapsedMs, double current, double best, int bins, double extra) {
    if (logWriter == null || iteration % interval != 0)
      return;
    write(iteration, elapsedMs, current, best, bins, extra);
  }

  /** Writes the line regardless of the interval (first and last lines). */
  void logAlways(int iteration, long elapsedMs, double current, double best, int bins, double extra) {
    if (logWriter == null)
      return;
    write(iteration, elapsedMs, current, best, bins, extra);
  }

  private void write(int iteration, long elapsedMs, double current, double best, int bins, double extra) {
    try {
      logWriter.write(String.format(Locale.US, "%d,%d,%.6f,%.6f,%d,%.6f%n", iteration, elapsedMs, current, best,
          bins, extra));
      logWriter.flush();
    } catch (IOException e) {
      System.err.println("Error writing log file " + path + ": " + e.getMessage());
      close();
    }
  }

  @Override
  public void close() {
    if (logWriter == null)
      return;
    try {
      logWriter.close();
    } catch (IOException e) {
      System.err.println("Error closing log file " + path + ": " + e.getMessage());
    }
    logWriter = null;
  }
}
