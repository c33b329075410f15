package pl.marcinmilkowski.resonant_search.entropy;

import java.util.ArrayList;
import java.util.List;

/**
 * Fixed-capacity ring of dense vector snapshots. When full, the oldest snapshot
 * is overwritten by the next append.
 */
public final class VectorHistory {

    public static final int DEFAULT_CAPACITY = 5;

    private final double[][] slots;
    private int cursor;   // next write position
    private int size;

    public VectorHistory() {
        this(DEFAULT_CAPACITY);
    }

    public VectorHistory(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("History capacity must be positive: " + capacity);
        }
        this.slots = new double[capacity][];
    }

    public void append(double[] snapshot) {
        slots[cursor] = snapshot;
        cursor = (cursor + 1) % slots.length;
        if (size < slots.length) {
            size++;
        }
    }

    /**
     * Snapshots from oldest to newest.
     */
    public List<double[]> snapshots() {
        List<double[]> ordered = new ArrayList<>(size);
        int start = size < slots.length ? 0 : cursor;
        for (int i = 0; i < size; i++) {
            ordered.add(slots[(start + i) % slots.length]);
        }
        return ordered;
    }

    public int size() {
        return size;
    }

    public int capacity() {
        return slots.length;
    }

    public boolean isEmpty() {
        return size == 0;
    }
}
