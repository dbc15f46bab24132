package com.aiops.dataCollector.collector.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single upstream record: an ordered, immutable mapping of field name to value.
 * Records taking part in a join carry a stable {@code id}.
 */
public final class DataRecord {

    public static final String ID = "id";

    private final Map<String, Object> fields;

    @JsonCreator
    public DataRecord(Map<String, Object> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public Object id() {
        return fields.get(ID);
    }

    public Object get(String field) {
        return fields.get(field);
    }

    public boolean has(String field) {
        return fields.get(field) != null;
    }

    /**
     * Returns a copy of this record with {@code field} set to {@code value}.
     * An existing value is overwritten, field order is otherwise kept.
     */
    public DataRecord with(String field, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(fields);
        copy.put(field, value);
        return new DataRecord(copy);
    }

    @JsonValue
    public Map<String, Object> fields() {
        return fields;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DataRecord)) {
            return false;
        }
        return fields.equals(((DataRecord) o).fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields);
    }

    @Override
    public String toString() {
        return fields.toString();
    }
}
