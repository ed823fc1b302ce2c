/**
 * Raised when an item is heavier than the bin capacity. No packing of such a
 * problem can be valid, so it is rejected before any algorithm starts.
 */
public class BPP_InfeasibleItemException extends IllegalArgumentException {

  private static final long serialVersionUID = 1L;

  private final String itemId;
  private final double weight;
  private final double capacity;

  public BPP_InfeasibleItemException(String itemId, double weight, double capacity) {
    super("Item " + itemId + " has weight " + weight + " which exceeds the capacity " + capacity);
    this.itemId = itemId;
    this.weight = weight;
    this.capacity = capacity;
  }

  public String getItemId() {
    return itemId;
  }

  public double getWeight() {
    return weight;
  }

  public double getCapacity() {
    return capacity;
  }
}
