/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of Atlas.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.atlas.io;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.hellblazer.atlas.build.AtlasResult;
import com.hellblazer.atlas.texture.UVBounds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Companion map file for a texture atlas: where each texture lives in the composite image.
 *
 * <pre>{@code
 * {
 *   "width" : 128,
 *   "height" : 128,
 *   "textures" : {
 *     "stone" : [ 0.0, 0.0, 0.5, 0.5 ],
 *     "dirt" : [ 0.5, 0.0, 0.75, 0.25 ]
 *   }
 * }
 * }</pre>
 * Each texture entry is {@code [u0, v0, u1, v1]}, in the key order of the atlas result.
 *
 * @author hal.hildebrand
 */
public final class AtlasMapWriter {
    private static final Logger       log          = LoggerFactory.getLogger(AtlasMapWriter.class);
    private static final ObjectMapper objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Contents of a map file.
     */
    public record AtlasMap(int width, int height, Map<String, UVBounds> textures) {
        public AtlasMap {
            textures = Collections.unmodifiableMap(new LinkedHashMap<>(textures));
        }
    }

    private AtlasMapWriter() {
    }

    public static void write(AtlasResult result, Path file) throws IOException {
        var parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (var out = Files.newOutputStream(file)) {
            write(result, out);
        }
        log.info("Wrote atlas map with {} textures to {}", result.uvTable().size(), file);
    }

    /**
     * Write the map document. The stream is left open.
     */
    public static void write(AtlasResult result, OutputStream out) throws IOException {
        var root = objectMapper.createObjectNode();
        root.put("width", result.width());
        root.put("height", result.height());
        var textures = root.putObject("textures");
        for (var entry : result.uvTable().entrySet()) {
            var bounds = entry.getValue();
            textures.putArray(entry.getKey()).add(bounds.u0()).add(bounds.v0()).add(bounds.u1()).add(bounds.v1());
        }
        objectMapper.writer().without(JsonGenerator.Feature.AUTO_CLOSE_TARGET).writeValue(out, root);
    }

    public static AtlasMap read(Path file) throws IOException {
        try (var in = Files.newInputStream(file)) {
            return read(in);
        }
    }

    /**
     * @throws IOException if the document is malformed
     */
    public static AtlasMap read(InputStream in) throws IOException {
        var root = objectMapper.readTree(in);
        if (root == null || !root.isObject() || !root.has("width") || !root.has("height")) {
            throw new IOException("Atlas map must be an object with width and height");
        }
        var texturesNode = root.get("textures");
        if (texturesNode == null || !texturesNode.isObject()) {
            throw new IOException("Atlas map is missing the textures object");
        }
        var textures = new LinkedHashMap<String, UVBounds>();
        var fields = texturesNode.fields();
        while (fields.hasNext()) {
            var entry = fields.next();
            textures.put(entry.getKey(), parseBounds(entry.getKey(), entry.getValue()));
        }
        return new AtlasMap(root.get("width").asInt(), root.get("height").asInt(), textures);
    }

    private static UVBounds parseBounds(String key, JsonNode node) throws IOException {
        if (!node.isArray() || node.size() != 4) {
            throw new IOException("Bounds of '" + key + "' must be an array of 4 numbers: " + node);
        }
        return new UVBounds((float) node.get(0).asDouble(), (float) node.get(1).asDouble(),
                            (float) node.get(2).asDouble(), (float) node.get(3).asDouble());
    }
}
