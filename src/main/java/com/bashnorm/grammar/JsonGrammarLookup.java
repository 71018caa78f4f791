package com.bashnorm.grammar;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.ImmutableMap;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;

/**
 * Grammar lookup backed by a JSON document of the form
 * <pre>
 * {"commands": {"find": {"predicate": true, "splitFlags": false, "implicitArgument": ".",
 *                        "arguments": [{"type": "File", "list": true, "optional": true}],
 *                        "flags": {"-name": "Pattern", "-exec": "Utility"}}}}
 * </pre>
 */
public final class JsonGrammarLookup implements GrammarLookup {
    private static final Logger logger = LoggerFactory.getLogger(JsonGrammarLookup.class);
    private static final String BUNDLED_GRAMMAR = "/grammar/commands.json";
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ImmutableMap<String, CommandGrammar> commands;

    private JsonGrammarLookup(ImmutableMap<String, CommandGrammar> commands) {
        this.commands = commands;
    }

    public static JsonGrammarLookup of(CommandGrammar... grammars) {
        MutableMap<String, CommandGrammar> commands = Maps.mutable.empty();
        for (CommandGrammar grammar : grammars) {
            commands.put(grammar.name(), grammar);
        }
        return new JsonGrammarLookup(commands.toImmutable());
    }

    /** Loads the grammar shipped on the classpath. */
    public static JsonGrammarLookup bundled() {
        try (InputStream in = JsonGrammarLookup.class.getResourceAsStream(BUNDLED_GRAMMAR)) {
            if (in == null) {
                throw new IllegalStateException("Bundled grammar not found: " + BUNDLED_GRAMMAR);
            }
            return read(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read bundled grammar", e);
        }
    }

    public static JsonGrammarLookup load(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return read(in);
        }
    }

    public static JsonGrammarLookup read(InputStream in) throws IOException {
        JsonNode root = MAPPER.readTree(in);
        JsonNode commandsNode = root == null ? null : root.get("commands");
        if (commandsNode == null || !commandsNode.isObject()) {
            throw new IOException("Grammar document must contain a \"commands\" object");
        }

        MutableMap<String, CommandGrammar> commands = Maps.mutable.empty();
        Iterator<Map.Entry<String, JsonNode>> fields = commandsNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            commands.put(entry.getKey(), parseCommand(entry.getKey(), entry.getValue()));
        }
        logger.debug("grammar.loaded commands={}", commands.size());
        return new JsonGrammarLookup(commands.toImmutable());
    }

    private static CommandGrammar parseCommand(String name, JsonNode node) throws IOException {
        MutableList<ArgSlot> arguments = Lists.mutable.empty();
        JsonNode argumentsNode = node.path("arguments");
        for (JsonNode slot : argumentsNode) {
            arguments.add(new ArgSlot(
                    parseType(name, slot.path("type").asText()),
                    slot.path("list").asBoolean(false),
                    slot.path("optional").asBoolean(false)));
        }

        MutableMap<String, ArgType> flags = Maps.mutable.empty();
        Iterator<Map.Entry<String, JsonNode>> flagFields = node.path("flags").fields();
        while (flagFields.hasNext()) {
            Map.Entry<String, JsonNode> flag = flagFields.next();
            if (!flag.getValue().isNull()) {
                flags.put(flag.getKey(), parseType(name, flag.getValue().asText()));
            }
        }

        JsonNode implicit = node.get("implicitArgument");
        return new CommandGrammar(
                name,
                arguments.toImmutable(),
                flags.toImmutable(),
                node.path("predicate").asBoolean(false),
                node.path("splitFlags").asBoolean(true),
                implicit == null || implicit.isNull() ? null : implicit.asText());
    }

    private static ArgType parseType(String command, String typeName) throws IOException {
        try {
            return ArgType.fromTypeName(typeName);
        } catch (IllegalArgumentException e) {
            throw new IOException("Grammar entry '" + command + "': " + e.getMessage(), e);
        }
    }

    @Override
    public ImmutableList<ArgSlot> argTypesFor(String headCommand) {
        CommandGrammar grammar = commands.get(headCommand);
        return grammar == null ? Lists.immutable.empty() : grammar.arguments();
    }

    @Override
    public Optional<ArgType> flagArgTypeFor(String headCommand, String flag) {
        CommandGrammar grammar = commands.get(headCommand);
        if (grammar == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(grammar.flagArguments().get(flag));
    }

    @Override
    public boolean isLongOption(String token) {
        return token.startsWith("--");
    }

    @Override
    public boolean isPredicateCommand(String headCommand) {
        CommandGrammar grammar = commands.get(headCommand);
        return grammar != null && grammar.predicate();
    }

    @Override
    public boolean splitsFlags(String headCommand) {
        CommandGrammar grammar = commands.get(headCommand);
        return grammar == null || grammar.splitFlags();
    }

    @Override
    public Optional<String> implicitArgumentFor(String headCommand) {
        CommandGrammar grammar = commands.get(headCommand);
        return grammar == null ? Optional.empty() : Optional.ofNullable(grammar.implicitArgument());
    }
}
