package com.example.embedstore;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Keeps the {@code capacity} entries with the largest values seen so far.
 *
 * <p>Entries are held unordered. Once full, each insert scans for the current
 * minimum and replaces it only when the new value is strictly larger, so N
 * inserts cost O(N * K) time and O(K) memory.</p>
 */
public class CandidateSet {

    public static final int DEFAULT_CAPACITY = 5;

    private final int capacity;
    private final List<Candidate> entries;

    public CandidateSet() {
        this(DEFAULT_CAPACITY);
    }

    public CandidateSet(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Size must be a positive integer.");
        }
        this.capacity = capacity;
        this.entries = new ArrayList<>(capacity);
    }

    /**
     * Offers a candidate. Zero and negative values are legitimate scores.
     *
     * @throws IllegalArgumentException if {@code key} is empty or {@code value} is NaN
     */
    public void add(String key, double value) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Key must be provided.");
        }
        if (Double.isNaN(value)) {
            throw new IllegalArgumentException("Value must be a number.");
        }

        if (entries.size() < capacity) {
            entries.add(new Candidate(key, value));
            return;
        }

        int minIndex = 0;
        double minValue = entries.get(0).getValue();
        for (int i = 1; i < entries.size(); i++) {
            double v = entries.get(i).getValue();
            if (v < minValue) {
                minValue = v;
                minIndex = i;
            }
        }
        if (value > minValue) {
            entries.set(minIndex, new Candidate(key, value));
        }
    }

    /**
     * @return a copy of the held entries, largest value first
     */
    public List<Candidate> entries() {
        List<Candidate> sorted = new ArrayList<>(entries);
        sorted.sort(Comparator.comparingDouble(Candidate::getValue).reversed());
        return sorted;
    }

    public List<String> keys() {
        return entries().stream().map(Candidate::getKey).collect(Collectors.toList());
    }

    public int count() {
        return entries.size();
    }

    public int capacity() {
        return capacity;
    }
}
