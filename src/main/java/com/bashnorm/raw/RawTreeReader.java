package com.bashnorm.raw;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads the external parser's output: a stream of JSON objects, one per command,
 * shaped as {@code {"command": "...", "tree": {...}}} or
 * {@code {"command": "...", "error": "..."}}.
 */
public class RawTreeReader {
    private final JsonFactory factory = new JsonFactory();

    public MutableList<ParsedCommand> readAll(InputStream input) throws IOException {
        MutableList<ParsedCommand> commands = Lists.mutable.empty();
        try (JsonParser parser = factory.createParser(input)) {
            JsonToken token;
            while ((token = parser.nextToken()) != null) {
                if (token != JsonToken.START_OBJECT) {
                    throw new IOException("Expected a command object but found " + token);
                }
                commands.add(parseCommand(parser));
            }
        }
        return commands;
    }

    public ParsedCommand read(String json) throws IOException {
        try (JsonParser parser = factory.createParser(json)) {
            if (parser.nextToken() != JsonToken.START_OBJECT) {
                throw new IOException("Expected a command object");
            }
            return parseCommand(parser);
        }
    }

    private ParsedCommand parseCommand(JsonParser parser) throws IOException {
        String text = null;
        RawNode tree = null;
        String error = null;

        while (parser.nextToken() != JsonToken.END_OBJECT) {
            String fieldName = parser.currentName();
            JsonToken value = parser.nextToken();
            switch (fieldName) {
                case "command" -> text = parser.getText();
                case "error" -> error = parser.getText();
                case "tree" -> tree = value == JsonToken.VALUE_NULL ? null : parseNode(parser);
                default -> parser.skipChildren();
            }
        }

        if (text == null) {
            throw new IOException("Command object without \"command\" text");
        }
        if (tree == null) {
            return ParsedCommand.rejected(text, error != null ? error : "no parse tree");
        }
        return ParsedCommand.parsed(text, tree);
    }

    private RawNode parseNode(JsonParser parser) throws IOException {
        if (parser.currentToken() != JsonToken.START_OBJECT) {
            throw new IOException("Expected a parse node but found " + parser.currentToken());
        }

        RawKind kind = null;
        String word = "";
        Span pos = null;
        MutableList<RawNode> parts = Lists.mutable.empty();
        RawNode command = null;

        while (parser.nextToken() != JsonToken.END_OBJECT) {
            String fieldName = parser.currentName();
            JsonToken value = parser.nextToken();
            switch (fieldName) {
                case "kind" -> kind = parseKind(parser.getText());
                case "word" -> word = parser.getText();
                case "pos" -> pos = parseSpan(parser);
                case "parts" -> {
                    if (value != JsonToken.START_ARRAY) {
                        throw new IOException("\"parts\" must be an array");
                    }
                    while (parser.nextToken() != JsonToken.END_ARRAY) {
                        parts.add(parseNode(parser));
                    }
                }
                case "command" -> command = value == JsonToken.VALUE_NULL ? null : parseNode(parser);
                default -> parser.skipChildren();
            }
        }

        if (kind == null) {
            throw new IOException("Parse node without \"kind\"");
        }
        return new RawNode(kind, word, pos, parts.toImmutable(), command);
    }

    private RawKind parseKind(String name) throws IOException {
        try {
            return RawKind.fromJsonName(name);
        } catch (IllegalArgumentException e) {
            throw new IOException(e.getMessage(), e);
        }
    }

    private Span parseSpan(JsonParser parser) throws IOException {
        if (parser.currentToken() != JsonToken.START_ARRAY) {
            throw new IOException("\"pos\" must be a two-element array");
        }
        parser.nextToken();
        int start = parser.getIntValue();
        parser.nextToken();
        int end = parser.getIntValue();
        if (parser.nextToken() != JsonToken.END_ARRAY) {
            throw new IOException("\"pos\" must be a two-element array");
        }
        return new Span(start, end);
    }
}
