package com.mathclip.parser;

import com.mathclip.table.CommandSpec;
import com.mathclip.table.EnvironmentKind;
import com.mathclip.table.EnvironmentSpec;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

public sealed interface Node {
    record TextRun(String text) implements Node {}

    /**
     * A command and its arguments. {@code optional} holds the bracketed argument of
     * commands such as {@code \sqrt[3]{x}} and is null when absent.
     */
    record Command(String name, CommandSpec spec, ImmutableList<Group> arguments, Group optional) implements Node {
        public static Command of(CommandSpec spec) {
            return new Command(spec.name(), spec, Lists.immutable.empty(), null);
        }

        public boolean preservesSpacing() {
            return spec.preserveSpacing();
        }

        /** Returns the argument at {@code index}, or an empty group when it was not supplied. */
        public Group argument(int index) {
            return index < arguments.size() ? arguments.get(index) : Group.EMPTY;
        }

        public Command withArguments(ImmutableList<Group> newArguments, Group newOptional) {
            return new Command(name, spec, newArguments, newOptional);
        }
    }

    record Group(ImmutableList<Node> children) implements Node {
        public static final Group EMPTY = new Group(Lists.immutable.empty());

        public static Group of(Node... children) {
            return new Group(Lists.immutable.of(children));
        }

        public boolean isEmpty() {
            return children.isEmpty();
        }
    }

    record Environment(String name, EnvironmentSpec spec, String columnSpec, ImmutableList<Row> rows) implements Node {
        public EnvironmentKind kind() {
            return spec.kind();
        }

        public Environment withRows(ImmutableList<Row> newRows) {
            return new Environment(name, spec, columnSpec, newRows);
        }
    }
}
