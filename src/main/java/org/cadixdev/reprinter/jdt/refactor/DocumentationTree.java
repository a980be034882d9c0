/*
 * Copyright (c) 2018 Cadix Development (https://www.cadixdev.org)
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Public License 2.0 which accompanies this distribution,
 * and is available at https://www.eclipse.org/legal/epl-2.0/
 *
 * SPDX-License-Identifier: EPL-2.0
 */

package org.cadixdev.reprinter.jdt.refactor;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Documentation for types and methods, read from JSON:
 *
 * <pre>
 * {"classes": [{
 *     "name": "com.example.Outer$Inner",
 *     "methods": [{
 *         "name": "run",
 *         "javadoc": ["Runs it."],
 *         "parameters": [{"index": 0, "javadoc": ["The input"]}]
 *     }],
 *     "fields": [{"name": "count", "javadoc": ["The count"]}]
 * }]}
 * </pre>
 *
 * Types are identified by binary name, methods and fields by name alone.
 */
public final class DocumentationTree {

    private final Map<String, Type> types;

    private DocumentationTree(Map<String, Type> types) {
        this.types = types;
    }

    private static Optional<Javadoc> parseJavadoc(final JsonObject parent) {
        if (!parent.has("javadoc")) {
            return Optional.empty();
        }
        return Optional.of(new Javadoc(
                parent.getAsJsonArray("javadoc").asList().stream().map(JsonElement::getAsString).toList()
        ));
    }

    private static Map<Integer, Parameter> parseParameters(final JsonArray array) {
        return array.asList().stream().map(JsonElement::getAsJsonObject).collect(Collectors.toMap(
                obj -> obj.get("index").getAsInt(),
                obj -> new Parameter(parseJavadoc(obj))
        ));
    }

    private static Map<String, Method> parseMethods(final JsonArray array) {
        return array.asList().stream().map(JsonElement::getAsJsonObject).collect(Collectors.toMap(
                obj -> obj.get("name").getAsString(),
                obj -> new Method(
                        !obj.has("parameters") ? Map.of() : parseParameters(obj.getAsJsonArray("parameters")),
                        parseJavadoc(obj)
                )
        ));
    }

    private static Map<String, Field> parseFields(final JsonArray array) {
        return array.asList().stream().map(JsonElement::getAsJsonObject).collect(Collectors.toMap(
                obj -> obj.get("name").getAsString(),
                obj -> new Field(parseJavadoc(obj))
        ));
    }

    private static Type parseType(JsonObject obj) {
        return new Type(
                !obj.has("methods") ? Map.of() : parseMethods(obj.getAsJsonArray("methods")),
                !obj.has("fields") ? Map.of() : parseFields(obj.getAsJsonArray("fields"))
        );
    }

    public static DocumentationTree load(final Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return fromJson(JsonParser.parseReader(reader));
        }
    }

    public static DocumentationTree parse(final String json) {
        return fromJson(JsonParser.parseString(json));
    }

    public static DocumentationTree fromJson(JsonElement node) {
        if (!node.isJsonObject() || !node.getAsJsonObject().has("classes")
                || !node.getAsJsonObject().get("classes").isJsonArray()) {
            throw new IllegalArgumentException("Not a valid documentation json");
        }

        JsonArray classes = node.getAsJsonObject().getAsJsonArray("classes");
        return new DocumentationTree(classes.asList().stream().map(JsonElement::getAsJsonObject).collect(Collectors.toMap(
                obj -> obj.get("name").getAsString(),
                DocumentationTree::parseType
        )));
    }

    @Nullable
    public Type getType(String binaryName) {
        return this.types.get(binaryName);
    }

    @Nullable
    public Method getMethod(String binaryName, String methodName) {
        var type = this.types.get(binaryName);
        if (type == null) return null;

        return type.methods().get(methodName);
    }

    @Nullable
    public Field getField(String binaryName, String fieldName) {
        var type = this.types.get(binaryName);
        if (type == null) return null;

        return type.fields().get(fieldName);
    }

    public record Javadoc(List<String> lines) {
    }

    public record Parameter(Optional<Javadoc> javadoc) {
    }

    public record Method(Map<Integer, Parameter> parameters, Optional<Javadoc> javadoc) {
    }

    public record Field(Optional<Javadoc> javadoc) {
    }

    public record Type(Map<String, Method> methods, Map<String, Field> fields) {
    }

}
