package com.mathclip.table;

import org.eclipse.collections.api.map.ImmutableMap;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Maps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;

/**
 * Static lookup of command arities, preserve-spacing flags and environment kinds.
 * Instances are immutable and safe to share between conversions.
 */
public final class CommandTable {
    public static final String BUILT_IN_RESOURCE = "/mathclip/commands.json";

    private static final Logger logger = LoggerFactory.getLogger(CommandTable.class);

    private final ImmutableMap<String, CommandSpec> commands;
    private final ImmutableMap<String, EnvironmentSpec> environments;

    public CommandTable(ImmutableMap<String, CommandSpec> commands,
                        ImmutableMap<String, EnvironmentSpec> environments) {
        this.commands = commands;
        this.environments = environments;
    }

    public static CommandTable builtIn() {
        return BuiltIn.TABLE;
    }

    /** Returns the entry for {@code name}, or null when the command is not listed. */
    public CommandSpec command(String name) {
        return commands.get(name);
    }

    /** Returns the entry for {@code name}, or null when the environment is not listed. */
    public EnvironmentSpec environment(String name) {
        return environments.get(name);
    }

    public int commandCount() {
        return commands.size();
    }

    public int environmentCount() {
        return environments.size();
    }

    /**
     * Returns a table holding this table's entries overlaid with those of {@code overrides}.
     */
    public CommandTable mergedWith(CommandTable overrides) {
        MutableMap<String, CommandSpec> mergedCommands = Maps.mutable.ofMap(commands.castToMap());
        mergedCommands.putAll(overrides.commands.castToMap());
        MutableMap<String, EnvironmentSpec> mergedEnvironments = Maps.mutable.ofMap(environments.castToMap());
        mergedEnvironments.putAll(overrides.environments.castToMap());
        return new CommandTable(mergedCommands.toImmutable(), mergedEnvironments.toImmutable());
    }

    private static final class BuiltIn {
        static final CommandTable TABLE = load();

        private static CommandTable load() {
            try (InputStream input = CommandTable.class.getResourceAsStream(BUILT_IN_RESOURCE)) {
                if (input == null) {
                    throw new CommandTableException("Missing resource " + BUILT_IN_RESOURCE);
                }
                CommandTable table = new CommandTableLoader().load(input);
                logger.debug("Loaded {} commands and {} environments from {}",
                    table.commandCount(), table.environmentCount(), BUILT_IN_RESOURCE);
                return table;
            } catch (IOException e) {
                throw new CommandTableException("Cannot read " + BUILT_IN_RESOURCE, e);
            }
        }
    }
}
