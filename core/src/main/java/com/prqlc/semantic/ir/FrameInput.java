package com.prqlc.semantic.ir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.IntSupplier;

/**
 * One relation instance feeding a frame, such as {@code employees} in
 * {@code from e = employees}.
 *
 * <p>An input whose columns are not known up front carries a wildcard. Every bare
 * name the wildcard absorbs is recorded here with a stable column id, so later
 * references to the same name resolve to the same column.
 */
public final class FrameInput {

    private final int id;
    private final String name;
    private final boolean wildcard;
    private final int wildcardId;
    private final Map<String, Integer> observed = new LinkedHashMap<>();

    /**
     * @param id the input id, unique within a compilation
     * @param name the namespace this input is referenced by, or null
     * @param wildcard whether the input has columns not known by name
     * @param wildcardId the column id standing for all columns of the input
     */
    public FrameInput(int id, String name, boolean wildcard, int wildcardId) {
        this.id = id;
        this.name = name;
        this.wildcard = wildcard;
        this.wildcardId = wildcardId;
    }

    public int id() {
        return id;
    }

    public String name() {
        return name;
    }

    public boolean hasWildcard() {
        return wildcard;
    }

    public int wildcardId() {
        return wildcardId;
    }

    /**
     * Returns the id of the named column, registering it if the name was not
     * seen before.
     */
    public int observe(String column, IntSupplier ids) {
        Integer existing = observed.get(column);
        if (existing != null) {
            return existing;
        }
        int fresh = ids.getAsInt();
        observed.put(column, fresh);
        return fresh;
    }

    public boolean isObserved(String column) {
        return observed.containsKey(column);
    }

    /**
     * Returns all columns known by name, in the order they were first seen.
     */
    public Map<String, Integer> observed() {
        return Collections.unmodifiableMap(observed);
    }

    @Override
    public String toString() {
        return "input-" + id + (name == null ? "" : "(" + name + ")");
    }
}
