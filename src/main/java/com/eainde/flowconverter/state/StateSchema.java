package com.eainde.flowconverter.state;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered mapping of shared-state field name to {@link FieldType}.
 *
 * <p>Always starts with {@code input: STRING} and {@code output: MAP}. Fields are
 * only ever added; the first type recorded for a name is kept and later
 * proposals for the same name are ignored.</p>
 */
public final class StateSchema {

    public static final String INPUT_FIELD = "input";
    public static final String OUTPUT_FIELD = "output";

    private final Map<String, FieldType> fields = new LinkedHashMap<>();

    public StateSchema() {
        fields.put(INPUT_FIELD, FieldType.STRING);
        fields.put(OUTPUT_FIELD, FieldType.MAP);
    }

    /**
     * Records {@code name} with {@code type} unless the name is already known.
     *
     * @return {@code true} if the field was added
     */
    public boolean propose(String name, FieldType type) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        if (name.isBlank() || fields.containsKey(name)) {
            return false;
        }
        fields.put(name, type);
        return true;
    }

    public boolean contains(String name) {
        return fields.containsKey(name);
    }

    public FieldType typeOf(String name) {
        return fields.get(name);
    }

    /** Unmodifiable view in discovery order. */
    public Map<String, FieldType> fields() {
        return Collections.unmodifiableMap(fields);
    }

    public int size() {
        return fields.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StateSchema other)) return false;
        // LinkedHashMap equality ignores order; the schema's order is part of its identity
        return fields.equals(other.fields) && fields.keySet().stream().toList()
                .equals(other.fields.keySet().stream().toList());
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "StateSchema" + fields;
    }
}
