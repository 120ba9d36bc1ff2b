package com.prqlc.semantic.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The columns a relation exposes at one point of a pipeline, together with the
 * inputs they come from.
 *
 * <p>A frame built for a join condition additionally marks the inputs of the
 * joined relation, which {@code that} refers to. Names pinned by an equality join
 * on bare column names resolve to the left column even though both sides have one.
 */
public final class Frame {

    private final List<FrameColumn> columns;
    private final List<FrameInput> inputs;
    private final Set<FrameInput> thatInputs;
    private final Map<String, FrameColumn.Single> pinned;

    public Frame(List<FrameColumn> columns, List<FrameInput> inputs) {
        this(columns, inputs, Set.of(), Map.of());
    }

    private Frame(List<FrameColumn> columns, List<FrameInput> inputs, Set<FrameInput> thatInputs,
                  Map<String, FrameColumn.Single> pinned) {
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        this.inputs = Collections.unmodifiableList(new ArrayList<>(inputs));
        this.thatInputs = Set.copyOf(thatInputs);
        this.pinned = Collections.unmodifiableMap(new LinkedHashMap<>(pinned));
    }

    public static Frame empty() {
        return new Frame(List.of(), List.of());
    }

    /**
     * Builds the frame a join condition is resolved in.
     */
    public static Frame forJoin(Frame left, Frame right) {
        List<FrameColumn> columns = new ArrayList<>(left.columns);
        columns.addAll(right.columns);
        List<FrameInput> inputs = new ArrayList<>(left.inputs);
        inputs.addAll(right.inputs);
        return new Frame(columns, inputs, Set.copyOf(right.inputs), left.pinned);
    }

    public List<FrameColumn> columns() {
        return columns;
    }

    public List<FrameInput> inputs() {
        return inputs;
    }

    public boolean isEmpty() {
        return columns.isEmpty() && inputs.isEmpty();
    }

    public boolean isThat(FrameInput input) {
        return thatInputs.contains(input);
    }

    public boolean hasThat() {
        return !thatInputs.isEmpty();
    }

    public FrameColumn.Single pinned(String name) {
        return pinned.get(name);
    }

    public Map<String, FrameColumn.Single> pinnedColumns() {
        return pinned;
    }

    public Frame withColumns(List<FrameColumn> newColumns) {
        return new Frame(newColumns, inputs, Set.of(), pinned);
    }

    public Frame withPinned(Map<String, FrameColumn.Single> names) {
        Map<String, FrameColumn.Single> merged = new LinkedHashMap<>(pinned);
        merged.putAll(names);
        return new Frame(columns, inputs, Set.of(), merged);
    }

    public FrameInput input(String name) {
        for (FrameInput input : inputs) {
            if (name.equals(input.name())) {
                return input;
            }
        }
        return null;
    }

    /**
     * Returns the explicit single columns with the given name, optionally
     * restricted to one namespace.
     */
    public List<FrameColumn.Single> singles(String name, String namespace) {
        List<FrameColumn.Single> result = new ArrayList<>();
        for (FrameColumn column : columns) {
            if (column instanceof FrameColumn.Single single && name.equals(single.name())
                && (namespace == null || namespace.equals(single.namespace()))) {
                result.add(single);
            }
        }
        return result;
    }

    /**
     * Returns the inputs whose wildcard is still part of this frame.
     */
    public List<FrameInput> wildcardInputs() {
        List<FrameInput> result = new ArrayList<>();
        for (FrameColumn column : columns) {
            if (column instanceof FrameColumn.All all) {
                result.add(all.input());
            }
        }
        return result;
    }

    public boolean hasWildcard() {
        return columns.stream().anyMatch(c -> c instanceof FrameColumn.All);
    }

    /**
     * Returns a display name for every known column, used in error hints.
     */
    public List<String> columnNames() {
        List<String> names = new ArrayList<>();
        for (FrameColumn column : columns) {
            if (column instanceof FrameColumn.Single single) {
                if (single.name() != null) {
                    names.add(single.namespace() == null ? single.name() : single.namespace() + "." + single.name());
                }
            } else {
                FrameInput input = ((FrameColumn.All) column).input();
                names.add(input.name() == null ? "*" : input.name() + ".*");
            }
        }
        return names;
    }

    /**
     * Returns the name a relation declaration gives to its column at the given
     * position.
     */
    public static String outputName(FrameColumn.Single column, int position) {
        return column.name() != null ? column.name() : "_expr_" + position;
    }

    @Override
    public String toString() {
        return columns.stream().map(Object::toString).collect(Collectors.joining(", ", "[", "]"));
    }
}
