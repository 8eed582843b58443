package com.eainde.flowconverter.codegen;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * A generated Python module, kept as its ordered sections together with the
 * context it was emitted from.
 */
public final class EmittedProgram {

    public enum Section {
        IMPORTS,
        STATE_SCHEMA,
        NODE_FUNCTIONS,
        EDGES,
        ENTRY_EXIT,
        BOOTSTRAP
    }

    private final Map<Section, String> sections;
    private final ConversionContext context;

    public EmittedProgram(Map<Section, String> sections, ConversionContext context) {
        Objects.requireNonNull(sections, "sections");
        for (Section section : Section.values()) {
            if (!sections.containsKey(section)) {
                throw new IllegalArgumentException("Missing section " + section);
            }
        }
        this.sections = Collections.unmodifiableMap(new EnumMap<>(sections));
        this.context = Objects.requireNonNull(context, "context");
    }

    public String section(Section section) {
        return sections.get(section);
    }

    public Map<Section, String> sections() {
        return sections;
    }

    public ConversionContext context() {
        return context;
    }

    /** The full module text, sections in declaration order. */
    public String source() {
        StringBuilder source = new StringBuilder();
        for (Section section : Section.values()) {
            source.append(sections.get(section));
        }
        return source.toString();
    }

    @Override
    public String toString() {
        return source();
    }
}
