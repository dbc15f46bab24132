package com.aiops.dataCollector.collector.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Fully materialized collection of records, in upstream response order.
 */
public final class CollectionResult implements Iterable<DataRecord> {

    private static final CollectionResult EMPTY = new CollectionResult(List.of());

    private final List<DataRecord> records;

    private CollectionResult(List<DataRecord> records) {
        this.records = records;
    }

    public static CollectionResult of(Collection<DataRecord> records) {
        return records.isEmpty() ? EMPTY : new CollectionResult(List.copyOf(records));
    }

    public static CollectionResult empty() {
        return EMPTY;
    }

    @JsonValue
    public List<DataRecord> records() {
        return records;
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    @Override
    public Iterator<DataRecord> iterator() {
        return records.iterator();
    }

    /**
     * Accumulates records page by page before freezing them into a result.
     */
    public static class Builder {
        private final List<DataRecord> records = new ArrayList<>();

        public Builder addAll(Iterable<DataRecord> page) {
            page.forEach(records::add);
            return this;
        }

        public Builder add(DataRecord record) {
            records.add(record);
            return this;
        }

        public CollectionResult build() {
            return CollectionResult.of(records);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CollectionResult)) {
            return false;
        }
        return records.equals(((CollectionResult) o).records);
    }

    @Override
    public int hashCode() {
        return Objects.hash(records);
    }

    @Override
    public String toString() {
        return records.toString();
    }
}
