import java.io.BufferedReader;
import java.io.FileReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.TreeSet;

import org.json.JSONArray;
import org.json.JSONObject;
import org.json.JSONTokener;

/**
 * Immutable bin packing problem: a bin capacity and an ordered list of items.
 * Every item must fit into an empty bin, otherwise construction fails with
 * {@link BPP_InfeasibleItemException}. One instance can be shared read-only by
 * any number of concurrent runs.
 */
public final class BPP_Input {

    static final class Item {
        final String id;
        final double weight;

        Item(String id, double weight) {
            this.id = id;
            this.weight = weight;
        }

        @Override
        public String toString() {
            return id + "(" + BPP_Report.formatWeight(weight) + ")";
        }
    }

    private final double capacity;
    private final List<Item> itemsList;
    private final double[] weights;
    private final Map<String, Integer> itemIndexById;
    private final double totalWeight;

    /**
     * @param capacity capacity of every bin
     * @param items    item id to weight, in the order the algorithms should see
     *                 the items
     */
    public BPP_Input(double capacity, Map<String, ? extends Number> items) {
        if (!(capacity > 0) || Double.isInfinite(capacity)) {
            throw new IllegalArgumentException("Capacity must be a positive number, got " + capacity);
        }
        this.capacity = capacity;

        List<Item> list = new ArrayList<>(items.size());
        Map<String, Integer> index = new HashMap<>();
        double[] w = new double[items.size()];
        double total = 0;
        for (Map.Entry<String, ? extends Number> e : items.entrySet()) {
            String id = e.getKey();
            if (id == null) {
                throw new IllegalArgumentException("Item id must not be null");
            }
            if (e.getValue() == null) {
                throw new IllegalArgumentException("Item " + id + " has no weight");
            }
            double weight = e.getValue().doubleValue();
            if (!(weight > 0) || Double.isInfinite(weight)) {
                throw new IllegalArgumentException("Item " + id + " must have a positive weight, got " + weight);
            }
            if (weight > capacity) {
                throw new BPP_InfeasibleItemException(id, weight, capacity);
            }
            if (index.containsKey(id)) {
                throw new IllegalArgumentException("Duplicate item id " + id);
            }
            index.put(id, list.size());
            w[list.size()] = weight;
            list.add(new Item(id, weight));
            total += weight;
        }
        this.itemsList = Collections.unmodifiableList(list);
        this.weights = w;
        this.itemIndexById = Collections.unmodifiableMap(index);
        this.totalWeight = total;
    }

    /**
     * Reads a problem file. Two layouts are accepted:
     *
     * <pre>
     * { "capacity": 100, "items": { "A": 40, "B": 55 } }
     * { "kapasitas_kontainer": 100, "barang": [ {"id": "A", "ukuran": 40}, ... ] }
     * </pre>
     */
    public static BPP_Input fromFile(String fileName) throws IOException {
        try (BufferedReader br = new BufferedReader(new FileReader(fileName, StandardCharsets.UTF_8))) {
            JSONTokener tokener = new JSONTokener(br);
            return fromJSON(new JSONObject(tokener));
        }
    }

    public static BPP_Input fromJSON(JSONObject j_in) {
        if (j_in.has("capacity")) {
            double capacity = j_in.getDouble("capacity");
            Map<String, Double> items = new LinkedHashMap<>();
            JSONObject j_items = j_in.optJSONObject("items");
            if (j_items == null) {
                if (j_in.has("items")) {
                    throw new IllegalArgumentException("\"items\" must be an object of id -> weight");
                }
                j_items = new JSONObject();
            }
            // JSON objects are unordered, sort the ids so every run sees the same order
            for (String id : new TreeSet<>(j_items.keySet())) {
                items.put(id, j_items.getDouble(id));
            }
            return new BPP_Input(capacity, items);
        }

        // Legacy exporter layout: list of {"id", "ukuran"}, order preserved
        if (j_in.has("kapasitas_kontainer")) {
            double capacity = j_in.getDouble("kapasitas_kontainer");
            Map<String, Double> items = new LinkedHashMap<>();
            JSONArray barang = j_in.optJSONArray("barang");
            if (barang != null) {
                for (int i = 0; i < barang.length(); i++) {
                    JSONObject jb = barang.getJSONObject(i);
                    String id = jb.getString("id");
                    if (items.containsKey(id)) {
                        throw new IllegalArgumentException("Duplicate item id " + id);
                    }
                    items.put(id, jb.getDouble("ukuran"));
                }
            }
            return new BPP_Input(capacity, items);
        }

        throw new IllegalArgumentException("Input has neither \"capacity\" nor \"kapasitas_kontainer\"");
    }

    /**
     * Random instance for the demo mode, ids BRG001, BRG002, ... and integer
     * weights uniform in [minWeight, maxWeight].
     */
    public static BPP_Input randomInstance(int numItems, int capacity, int minWeight, int maxWeight, Random rng) {
        if (numItems < 0 || minWeight < 1 || maxWeight < minWeight || maxWeight > capacity) {
            throw new IllegalArgumentException("Bad demo parameters: n=" + numItems + " capacity=" + capacity
                    + " range=[" + minWeight + "," + maxWeight + "]");
        }
        Map<String, Integer> items = new LinkedHashMap<>();
        for (int i = 1; i <= numItems; i++) {
            items.put(String.format("BRG%03d", i), minWeight + rng.nextInt(maxWeight - minWeight + 1));
        }
        return new BPP_Input(capacity, items);
    }

    public JSONObject toJSON() {
        JSONObject root = new JSONObject();
        root.put("capacity", capacity);
        JSONObject items = new JSONObject();
        for (Item it : itemsList) {
            items.put(it.id, it.weight);
        }
        root.put("items", items);
        return root;
    }

    // --- Accessors ---

    double Capacity() {
        return capacity;
    }

    int Items() {
        return itemsList.size();
    }

    String ItemId(int i) {
        return itemsList.get(i).id;
    }

    double ItemWeight(int i) {
        return weights[i];
    }

    Item ItemAt(int i) {
        return itemsList.get(i);
    }

    double TotalWeight() {
        return totalWeight;
    }

    /** Lower bound on the number of bins: ceil(total weight / capacity). */
    int LowerBound() {
        if (itemsList.isEmpty())
            return 0;
        return (int) Math.ceil(totalWeight / capacity - 1e-9);
    }

    int findItemIndex(String id) {
        Integer idx = itemIndexById.get(id);
        return idx == null ? -1 : idx;
    }

    boolean isEmpty() {
        return itemsList.isEmpty();
    }

    @Override
    public String toString() {
        return "BPP_Input[capacity=" + BPP_Report.formatWeight(capacity) + ", items=" + itemsList.size()
                + ", total=" + BPP_Report.formatWeight(totalWeight) + "]";
    }
}
