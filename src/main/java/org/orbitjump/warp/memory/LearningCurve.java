package org.orbitjump.warp.memory;

import java.util.ArrayList;
import java.util.List;

/**
 * Fixed-capacity ring buffer of learning samples, oldest first.
 *
 * <p>Samples are stored column-wise in primitive arrays. Appending to a full buffer
 * overwrites the oldest sample.</p>
 */
public final class LearningCurve {

    private final double[] times;
    private final double[] costs;
    private final boolean[] optimal;
    private int head;
    private int size;

    LearningCurve(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0, got " + capacity);
        }
        this.times = new double[capacity];
        this.costs = new double[capacity];
        this.optimal = new boolean[capacity];
    }

    /**
     * Maximum number of retained samples.
     */
    public int capacity() {
        return times.length;
    }

    /**
     * Number of retained samples.
     */
    public int size() {
        return size;
    }

    /**
     * Returns the sample at {@code index}, where {@code 0} is the oldest retained sample.
     */
    public LearningSample get(int index) {
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException("index out of range: " + index + " [0, " + size + ")");
        }
        int slot = slot(index);
        return new LearningSample(times[slot], costs[slot], optimal[slot]);
    }

    /**
     * Returns a copy of the retained samples, oldest first.
     */
    public List<LearningSample> samples() {
        List<LearningSample> out = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            out.add(get(i));
        }
        return out;
    }

    /**
     * Returns the costs of the {@code count} most recent samples, oldest first.
     */
    public double[] recentCosts(int count) {
        int n = Math.min(count, size);
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            out[i] = costs[slot(size - n + i)];
        }
        return out;
    }

    void add(LearningSample sample) {
        int tail = (head + size) % times.length;
        if (size == times.length) {
            head = (head + 1) % times.length;
        } else {
            size++;
        }
        times[tail] = sample.time();
        costs[tail] = sample.cost();
        optimal[tail] = sample.optimal();
    }

    void retainMostRecent(int count) {
        if (count >= size) {
            return;
        }
        int dropped = size - Math.max(0, count);
        head = (head + dropped) % times.length;
        size -= dropped;
    }

    void clear() {
        head = 0;
        size = 0;
    }

    private int slot(int index) {
        return (head + index) % times.length;
    }
}
