/**
 * Raised when an algorithm parameter is out of range. Thrown from the config
 * validation at the start of a run, before the first iteration.
 */
public class BPP_InvalidConfigException extends IllegalArgumentException {

  private static final long serialVersionUID = 1L;

  private final String parameter;

  public BPP_InvalidConfigException(String parameter, Object value, String expected) {
    super("Invalid value for " + parameter + ": " + value + " (expected " + expected + ")");
    this.parameter = parameter;
  }

  public String getParameter() {
    return parameter;
  }

  static void check(boolean condition, String parameter, Object value, String expected) {
    if (!condition)
      throw new BPP_InvalidConfigException(parameter, value, expected);
  }
}
