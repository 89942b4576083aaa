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
package com.hellblazer.atlas.texture;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.Color;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ImageIOLoaderTest {

    @TempDir
    Path dir;

    private final ImageIOLoader loader = new ImageIOLoader();

    @Test
    void testLoadPngWithAlpha() throws IOException {
        var translucent = new Color(10, 20, 30, 40);
        var file = TestImages.png(dir, "glass.png", 5, 7, translucent);

        var image = loader.load(file);
        assertEquals(5, image.getWidth());
        assertEquals(7, image.getHeight());
        assertEquals(translucent.getRGB(), image.getRGB(2, 3));
    }

    @Test
    void testMissingFile() {
        var missing = dir.resolve("missing.png");
        var ex = assertThrows(AtlasException.DecodeFailureException.class, () -> loader.load(missing));
        assertEquals(missing, ex.getPath());
    }

    @Test
    void testDirectoryIsNotAnImage() {
        assertThrows(AtlasException.DecodeFailureException.class, () -> loader.load(dir));
    }

    @Test
    void testUndecodableFile() throws IOException {
        var file = dir.resolve("notes.png");
        Files.writeString(file, "definitely not a png");
        var ex = assertThrows(AtlasException.DecodeFailureException.class, () -> loader.load(file));
        assertTrue(ex.getMessage().contains("unsupported"));
    }
}
