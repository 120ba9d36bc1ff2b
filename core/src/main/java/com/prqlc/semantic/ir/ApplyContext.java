package com.prqlc.semantic.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Settings in effect for the transforms of a {@code group} or {@code window}
 * pipeline: the partition, the window frame and the sort order.
 */
public record ApplyContext(List<FrameColumn.Single> partition, WindowFrame window, List<SortItem> sort) {

    public static final ApplyContext NONE = new ApplyContext(List.of(), null, List.of());

    public ApplyContext {
        partition = Collections.unmodifiableList(new ArrayList<>(partition));
        sort = Collections.unmodifiableList(new ArrayList<>(sort));
    }

    public ApplyContext withPartition(List<FrameColumn.Single> newPartition) {
        return new ApplyContext(newPartition, window, sort);
    }

    public ApplyContext withWindow(WindowFrame newWindow) {
        return new ApplyContext(partition, newWindow, sort);
    }

    public ApplyContext withSort(List<SortItem> newSort) {
        return new ApplyContext(partition, window, newSort);
    }

    public boolean isGrouped() {
        return !partition.isEmpty();
    }

    public boolean isNone() {
        return partition.isEmpty() && window == null && sort.isEmpty();
    }
}
