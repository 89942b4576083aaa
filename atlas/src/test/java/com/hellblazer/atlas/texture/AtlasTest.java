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

import javax.imageio.ImageIO;
import java.awt.Color;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Atlas packing, rendering and bounds
 *
 * @author hal.hildebrand
 */
class AtlasTest {

    private static Texture texture(String name, int width, int height, Color color) {
        return Texture.of(name, new Frame(Path.of(name + ".png"), TestImages.solid(width, height, color)));
    }

    @Test
    void testInvalidSize() {
        assertThrows(IllegalArgumentException.class, () -> new Atlas(0));
    }

    @Test
    void testPackRecordsTexturesInPackOrder() {
        var atlas = new Atlas(64);
        var big = texture("big", 32, 32, Color.RED);
        var small = texture("small", 16, 16, Color.GREEN);

        atlas.pack(big);
        atlas.pack(small);

        assertEquals(List.of(big, small), atlas.textures());
        assertEquals(0, big.firstFrame().x());
        assertEquals(0, big.firstFrame().y());
        assertEquals(0, small.firstFrame().x());
        assertEquals(32, small.firstFrame().y());
        assertEquals(2, atlas.getAllPackables().size());
        assertTrue(atlas.validate().isEmpty());
    }

    @Test
    void testTooSmall() {
        var atlas = new Atlas(16);
        var texture = texture("huge", 17, 4, Color.BLUE);

        var ex = assertThrows(AtlasException.AtlasTooSmallException.class, () -> atlas.pack(texture));
        assertEquals(16, ex.getSize());
        assertTrue(ex.getMessage().contains("huge"));
        assertTrue(atlas.textures().isEmpty());
    }

    @Test
    void testFailedFrameDoesNotRollBackEarlierFrames() {
        var atlas = new Atlas(16);
        var first = new Frame(Path.of("f0.png"), TestImages.solid(16, 8, Color.RED));
        var second = new Frame(Path.of("f1.png"), TestImages.solid(16, 16, Color.RED));
        var animated = new Texture("animated", List.of(first, second));

        assertThrows(AtlasException.AtlasTooSmallException.class, () -> atlas.pack(animated));
        assertTrue(first.isPlaced());
        assertFalse(second.isPlaced());
        assertTrue(atlas.textures().isEmpty());
        assertTrue(atlas.toBoundsTable().isEmpty());
    }

    @Test
    void testHandPlacedFrameRejected() {
        var frame = new Frame(Path.of("loose.png"), TestImages.solid(4, 4, Color.RED));
        frame.place(100, 100);
        var atlas = new Atlas(16);

        assertThrows(IllegalStateException.class, () -> atlas.pack(Texture.of("loose", frame)));
        assertTrue(atlas.textures().isEmpty());
        assertTrue(atlas.getAllPackables().isEmpty());

        // an unplaced copy packs normally
        atlas.pack(Texture.of("loose", frame.unplaced()));
        assertEquals(1, atlas.textures().size());
        assertEquals(0, atlas.textures().get(0).firstFrame().x());
    }

    @Test
    void testDuplicateNameRejected() {
        var atlas = new Atlas(64);
        atlas.pack(texture("same", 8, 8, Color.RED));
        assertThrows(IllegalArgumentException.class, () -> atlas.pack(texture("same", 8, 8, Color.RED)));
    }

    @Test
    void testBoundsTable() {
        var atlas = new Atlas(128);
        atlas.pack(texture("square", 64, 64, Color.RED));
        atlas.pack(texture("strip", 32, 16, Color.GREEN));

        var table = atlas.toBoundsTable();
        assertEquals(List.of("square", "strip"), List.copyOf(table.keySet()));
        assertEquals(new UVBounds(0f, 0f, 0.5f, 0.5f), table.get("square"));
        // strip lands below the square; its v extent is min(16, 32) = 16
        assertEquals(new UVBounds(0f, 0.5f, 0.25f, 0.625f), table.get("strip"));
    }

    @Test
    void testBoundsTableClampsTallFrames() {
        var atlas = new Atlas(128);
        atlas.pack(texture("tall", 32, 64, Color.RED));

        var bounds = atlas.toBoundsTable().get("tall");
        assertEquals(0.25f, bounds.u1());
        // v1 uses min(height, width) = 32, not 64
        assertEquals(0.25f, bounds.v1());
    }

    @Test
    void testGenerateDrawsFramesAtTheirPositions() {
        var atlas = new Atlas(32);
        atlas.pack(texture("red", 16, 16, Color.RED));
        atlas.pack(texture("green", 16, 8, Color.GREEN));

        var image = atlas.generate(ColorMode.RGBA);
        assertEquals(32, image.getWidth());
        assertEquals(32, image.getHeight());
        assertEquals(Color.RED.getRGB(), image.getRGB(0, 0));
        assertEquals(Color.RED.getRGB(), image.getRGB(15, 15));
        assertEquals(Color.GREEN.getRGB(), image.getRGB(0, 16));
        assertEquals(Color.GREEN.getRGB(), image.getRGB(15, 23));
        // untouched pixels stay fully transparent
        assertEquals(0, image.getRGB(31, 31) >>> 24);
        assertEquals(0, image.getRGB(0, 24) >>> 24);
    }

    @Test
    void testGenerateCopiesTranslucentPixelsExactly() {
        var translucent = new Color(200, 100, 50, 128);
        var atlas = new Atlas(8);
        atlas.pack(texture("glass", 4, 4, translucent));

        var image = atlas.generate(ColorMode.RGBA);
        assertEquals(translucent.getRGB(), image.getRGB(1, 1));
    }

    @Test
    void testGenerateOpaqueMode() {
        var atlas = new Atlas(8);
        atlas.pack(texture("blue", 4, 4, Color.BLUE));

        var image = atlas.generate(ColorMode.RGB);
        assertEquals(ColorMode.RGB.imageType(), image.getType());
        assertEquals(Color.BLUE.getRGB(), image.getRGB(0, 0));
        assertEquals(Color.BLACK.getRGB(), image.getRGB(7, 7));
    }

    @Test
    void testWrite(@TempDir Path dir) throws IOException {
        var atlas = new Atlas(16);
        atlas.pack(texture("red", 8, 8, Color.RED));

        var file = dir.resolve("out/atlas.png");
        atlas.write(file, ColorMode.RGBA);

        var read = ImageIO.read(file.toFile());
        assertEquals(16, read.getWidth());
        assertEquals(16, read.getHeight());
        assertEquals(Color.RED.getRGB(), read.getRGB(3, 3));
    }
}
