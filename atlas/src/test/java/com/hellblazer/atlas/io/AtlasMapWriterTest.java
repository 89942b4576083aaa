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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.atlas.build.AtlasBuilder;
import com.hellblazer.atlas.build.AtlasResult;
import com.hellblazer.atlas.texture.TestImages;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.Color;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the atlas map file
 *
 * @author hal.hildebrand
 */
class AtlasMapWriterTest {

    @TempDir
    Path dir;

    private AtlasResult buildAtlas() throws IOException {
        var input = new LinkedHashMap<String, Path>();
        input.put("stone", TestImages.png(dir, "stone.png", 32, 32, Color.GRAY));
        input.put("dirt", TestImages.png(dir, "dirt.png", 16, 16, Color.ORANGE));
        input.put("leaf", TestImages.png(dir, "leaf.png", 8, 4, Color.GREEN));
        return AtlasBuilder.from(input).build();
    }

    private static ByteArrayInputStream json(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void testDocumentStructure() throws IOException {
        var result = buildAtlas();
        var out = new ByteArrayOutputStream();
        AtlasMapWriter.write(result, out);

        var root = new ObjectMapper().readTree(out.toByteArray());
        assertEquals(result.width(), root.get("width").asInt());
        assertEquals(result.height(), root.get("height").asInt());

        var textures = root.get("textures");
        var names = new ArrayList<String>();
        textures.fieldNames().forEachRemaining(names::add);
        assertEquals(List.of("stone", "dirt", "leaf"), names);

        var stone = textures.get("stone");
        assertEquals(4, stone.size());
        var bounds = result.bounds("stone");
        assertEquals(bounds.u0(), stone.get(0).floatValue(), 1e-6);
        assertEquals(bounds.v1(), stone.get(3).floatValue(), 1e-6);
    }

    @Test
    void testWriteAndReadFile() throws IOException {
        var result = buildAtlas();
        var file = dir.resolve("out/maps/atlas.json");
        AtlasMapWriter.write(result, file);

        var map = AtlasMapWriter.read(file);
        assertEquals(result.width(), map.width());
        assertEquals(result.height(), map.height());
        assertEquals(result.uvTable(), map.textures());
    }

    @Test
    void testStreamLeftOpen() throws IOException {
        var result = buildAtlas();
        var out = new ByteArrayOutputStream();
        AtlasMapWriter.write(result, out);
        var length = out.size();
        out.write('\n');
        assertEquals(length + 1, out.size());
    }

    @Test
    void testMalformedDocuments() {
        assertThrows(IOException.class, () -> AtlasMapWriter.read(json("[]")));
        assertThrows(IOException.class, () -> AtlasMapWriter.read(json("{ \"width\": 4 }")));
        assertThrows(IOException.class, () -> AtlasMapWriter.read(json("{ \"width\": 4, \"height\": 4 }")));
        assertThrows(IOException.class, () -> AtlasMapWriter.read(
        json("{ \"width\": 4, \"height\": 4, \"textures\": { \"a\": [0, 0, 1] } }")));
        assertThrows(IOException.class, () -> AtlasMapWriter.read(
        json("{ \"width\": 4, \"height\": 4, \"textures\": { \"a\": \"everywhere\" } }")));
    }

    @Test
    void testEmptyTextures() throws IOException {
        var map = AtlasMapWriter.read(json("{ \"width\": 1, \"height\": 1, \"textures\": {} }"));
        assertEquals(1, map.width());
        assertTrue(map.textures().isEmpty());
    }
}
