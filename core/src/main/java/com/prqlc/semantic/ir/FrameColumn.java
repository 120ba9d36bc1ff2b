package com.prqlc.semantic.ir;

import java.util.Objects;

/**
 * A column of a {@link Frame}: either a single column or all columns of an input
 * whose schema is unknown.
 */
public abstract class FrameColumn {

    private FrameColumn() {
    }

    /**
     * Returns the id this column is lowered to.
     */
    public abstract int id();

    /**
     * A single column, possibly without a name when computed from an expression.
     */
    public static final class Single extends FrameColumn {
        private final int id;
        private final String name;
        private final String namespace;

        public Single(int id, String name, String namespace) {
            this.id = id;
            this.name = name;
            this.namespace = namespace;
        }

        @Override
        public int id() {
            return id;
        }

        public String name() {
            return name;
        }

        public String namespace() {
            return namespace;
        }

        public Single withName(String newName) {
            return new Single(id, newName, namespace);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Single other && other.id == id
                && Objects.equals(other.name, name) && Objects.equals(other.namespace, namespace);
        }

        @Override
        public int hashCode() {
            return Objects.hash(id, name, namespace);
        }

        @Override
        public String toString() {
            String label = name == null ? "?" : name;
            return (namespace == null ? label : namespace + "." + label) + "#" + id;
        }
    }

    /**
     * All columns of an input.
     */
    public static final class All extends FrameColumn {
        private final FrameInput input;

        public All(FrameInput input) {
            this.input = Objects.requireNonNull(input, "input must not be null");
        }

        @Override
        public int id() {
            return input.wildcardId();
        }

        public FrameInput input() {
            return input;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof All other && other.input == input;
        }

        @Override
        public int hashCode() {
            return input.id();
        }

        @Override
        public String toString() {
            return (input.name() == null ? "" : input.name() + ".") + "*#" + id();
        }
    }
}
