package com.ssau.analyzer.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.OptionalInt;

import lombok.EqualsAndHashCode;

/**
 * Fixed number of edge slots. Populated slots come first, in ascending column
 * order; the remaining slots are absent.
 */
@EqualsAndHashCode
public final class EdgeSet {

    private static final int ABSENT = -1;

    private final int[] slots;

    private EdgeSet(int[] slots) {
        this.slots = slots;
    }

    public static EdgeSet of(List<Integer> edges, int maxEdges) {
        if (edges.size() > maxEdges) {
            throw new IllegalArgumentException(
                "Got " + edges.size() + " edges for " + maxEdges + " slots");
        }
        List<Integer> sorted = new ArrayList<>(edges);
        Collections.sort(sorted);
        int[] slots = new int[maxEdges];
        Arrays.fill(slots, ABSENT);
        for (int i = 0; i < sorted.size(); i++) {
            int column = sorted.get(i);
            if (column < 0) {
                throw new IllegalArgumentException("Edge column must be non-negative: " + column);
            }
            slots[i] = column;
        }
        return new EdgeSet(slots);
    }

    public static EdgeSet empty(int maxEdges) {
        return of(Collections.emptyList(), maxEdges);
    }

    public int size() {
        return slots.length;
    }

    public OptionalInt get(int slot) {
        int value = slots[slot];
        return value == ABSENT ? OptionalInt.empty() : OptionalInt.of(value);
    }

    public boolean isPresent(int slot) {
        return slots[slot] != ABSENT;
    }

    public List<Integer> populated() {
        List<Integer> result = new ArrayList<>(slots.length);
        for (int value : slots) {
            if (value != ABSENT) {
                result.add(value);
            }
        }
        return result;
    }

    /** Slot values with {@code null} standing for an absent edge. */
    public List<Integer> toNullableList() {
        List<Integer> result = new ArrayList<>(slots.length);
        for (int value : slots) {
            result.add(value == ABSENT ? null : value);
        }
        return Collections.unmodifiableList(result);
    }

    @Override
    public String toString() {
        return "EdgeSet" + toNullableList();
    }
}
