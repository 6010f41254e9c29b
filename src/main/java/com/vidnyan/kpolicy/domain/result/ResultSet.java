package com.vidnyan.kpolicy.domain.result;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Results of one manifest-scope pass, keyed by check ID.
 * Iteration is always in lexicographic check-ID order. Not thread-safe; owned by the pass that built it.
 */
public final class ResultSet implements Iterable<ResultRecord> {

    private final SortedMap<String, ResultRecord> records = new TreeMap<>();

    public void put(ResultRecord record) {
        records.put(record.id(), record);
    }

    public Optional<ResultRecord> get(String checkId) {
        return Optional.ofNullable(records.get(checkId));
    }

    public boolean contains(String checkId) {
        return records.containsKey(checkId);
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public List<String> ids() {
        return List.copyOf(records.keySet());
    }

    public List<ResultRecord> records() {
        return List.copyOf(records.values());
    }

    public Map<String, ResultRecord> asMap() {
        return Collections.unmodifiableSortedMap(records);
    }

    /**
     * Tally this set into a summary.
     */
    public CountSummary summary() {
        CountSummary summary = CountSummary.empty();
        for (ResultRecord record : records.values()) {
            summary = summary.add(record);
        }
        return summary;
    }

    @Override
    public Iterator<ResultRecord> iterator() {
        return records().iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResultSet other)) return false;
        return records.equals(other.records);
    }

    @Override
    public int hashCode() {
        return records.hashCode();
    }

    @Override
    public String toString() {
        return "ResultSet" + records.values();
    }
}
