package com.alfacon.weather.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Candidate identifier space: prefix followed by every integer in [start, end].
 * e.g. CAL251 .. CAL351
 */
public record DeviceRange(String prefix, int start, int end) {

    public DeviceRange {
        if (start > end) {
            throw new IllegalArgumentException("start " + start + " is after end " + end);
        }
    }

    public int size() {
        return end - start + 1;
    }

    public List<String> identifiers() {
        List<String> ids = new ArrayList<>(size());
        for (int i = start; i <= end; i++) {
            ids.add(prefix + i);
        }
        return List.copyOf(ids);
    }

    @Override
    public String toString() {
        return prefix + start + ".." + prefix + end;
    }
}
