package com.mathclip.table;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Maps;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;

/**
 * Reads a command table from JSON.
 * <pre>
 * {
 *   "commands": [ {"name": "frac", "kind": "FRACTION"}, ... ],
 *   "environments": [ {"name": "bmatrix", "kind": "GRID", "plainOpen": "[", ...}, ... ]
 * }
 * </pre>
 * Entry fields other than {@code name} and {@code kind} are optional and default from the kind.
 */
public class CommandTableLoader {
    private final JsonFactory factory = new JsonFactory();

    public CommandTable load(InputStream input) throws IOException {
        try (JsonParser parser = factory.createParser(input)) {
            return parseTable(parser);
        }
    }

    private CommandTable parseTable(JsonParser parser) throws IOException {
        expect(parser, parser.nextToken(), JsonToken.START_OBJECT);

        MutableMap<String, CommandSpec> commands = Maps.mutable.empty();
        MutableMap<String, EnvironmentSpec> environments = Maps.mutable.empty();

        while (parser.nextToken() != JsonToken.END_OBJECT) {
            String section = parser.getCurrentName();
            expect(parser, parser.nextToken(), JsonToken.START_ARRAY);
            switch (section) {
                case "commands" -> {
                    while (parser.nextToken() != JsonToken.END_ARRAY) {
                        CommandSpec spec = toCommand(parseEntry(parser));
                        commands.put(spec.name(), spec);
                    }
                }
                case "environments" -> {
                    while (parser.nextToken() != JsonToken.END_ARRAY) {
                        EnvironmentSpec spec = toEnvironment(parseEntry(parser));
                        environments.put(spec.name(), spec);
                    }
                }
                default -> throw new CommandTableException("Unknown command table section: " + section);
            }
        }

        return new CommandTable(commands.toImmutable(), environments.toImmutable());
    }

    /**
     * Reads one flat object of scalar fields; values are kept as text.
     */
    private MutableMap<String, String> parseEntry(JsonParser parser) throws IOException {
        expect(parser, parser.currentToken(), JsonToken.START_OBJECT);
        MutableMap<String, String> fields = Maps.mutable.empty();

        while (parser.nextToken() != JsonToken.END_OBJECT) {
            String fieldName = parser.getCurrentName();
            JsonToken token = parser.nextToken();
            switch (token) {
                case VALUE_STRING, VALUE_NUMBER_INT -> fields.put(fieldName, parser.getText());
                case VALUE_TRUE -> fields.put(fieldName, "true");
                case VALUE_FALSE -> fields.put(fieldName, "false");
                case VALUE_NULL -> { }
                default -> throw new CommandTableException(
                    "Unexpected " + token + " for field '" + fieldName + "' at " + parser.getCurrentLocation());
            }
        }

        return fields;
    }

    private CommandSpec toCommand(MutableMap<String, String> fields) {
        String name = required(fields, "name");
        CommandKind kind = enumValue(CommandKind.class, required(fields, "kind"), name);

        int arity = fields.containsKey("arity")
            ? intValue(fields.get("arity"), "arity", name)
            : kind.defaultArity();
        ArgumentStyle argumentStyle = fields.containsKey("argumentStyle")
            ? enumValue(ArgumentStyle.class, fields.get("argumentStyle"), name)
            : kind.defaultArgumentStyle();
        boolean preserveSpacing = fields.containsKey("preserveSpacing")
            ? Boolean.parseBoolean(fields.get("preserveSpacing"))
            : kind.preserveSpacingByDefault();

        return new CommandSpec(
            name,
            kind,
            arity,
            argumentStyle,
            preserveSpacing,
            Boolean.parseBoolean(fields.get("optionalArgument")),
            fields.get("plain"),
            fields.get("markup"),
            fields.getIfAbsentValue("element", "mi"),
            fields.get("variant"));
    }

    private EnvironmentSpec toEnvironment(MutableMap<String, String> fields) {
        String name = required(fields, "name");
        EnvironmentKind kind = enumValue(EnvironmentKind.class, required(fields, "kind"), name);

        return new EnvironmentSpec(
            name,
            kind,
            fields.getIfAbsentValue("plainOpen", ""),
            fields.getIfAbsentValue("plainClose", ""),
            fields.getIfAbsentValue("markupOpen", ""),
            fields.getIfAbsentValue("markupClose", ""),
            Boolean.parseBoolean(fields.get("columnSpec")));
    }

    private static String required(MutableMap<String, String> fields, String field) {
        String value = fields.get(field);
        if (value == null || value.isEmpty()) {
            throw new CommandTableException("Command table entry without '" + field + "': " + fields);
        }
        return value;
    }

    private static int intValue(String value, String field, String entry) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new CommandTableException("Invalid " + field + " '" + value + "' for " + entry, e);
        }
    }

    private static <E extends Enum<E>> E enumValue(Class<E> type, String value, String entry) {
        try {
            return Enum.valueOf(type, value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new CommandTableException("Unknown " + type.getSimpleName() + " '" + value + "' for " + entry, e);
        }
    }

    private static void expect(JsonParser parser, JsonToken actual, JsonToken expected) throws IOException {
        if (actual != expected) {
            throw new CommandTableException("Expected " + expected + " but found " + actual
                + " at " + parser.getCurrentLocation());
        }
    }
}
