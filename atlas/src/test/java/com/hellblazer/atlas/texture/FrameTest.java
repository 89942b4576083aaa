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

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FrameTest {

    @Test
    void testDimensionsFromImage() {
        var frame = new Frame(Path.of("dirt.png"), TestImages.solid(24, 12, Color.GRAY));
        assertEquals(24, frame.width());
        assertEquals(12, frame.height());
        assertEquals(72, frame.perimeter());
        assertEquals(Path.of("dirt.png"), frame.source());
        assertFalse(frame.isPlaced());
    }

    @Test
    void testZeroDimensionsRejected() {
        var empty = new BufferedImage(1, 1, BufferedImage.TYPE_INT_ARGB) {
            @Override
            public int getWidth() {
                return 0;
            }
        };
        var ex = assertThrows(AtlasException.InvalidDimensionsException.class,
                              () -> new Frame(Path.of("empty.png"), empty));
        assertEquals(0, ex.getWidth());
        assertEquals(1, ex.getHeight());
        assertTrue(ex.getMessage().contains("empty.png"));
    }

    @Test
    void testPlacementDelegatesToPackable() {
        var frame = new Frame(Path.of("a.png"), TestImages.solid(4, 4, Color.RED));
        frame.place(2, 3);
        assertTrue(frame.packable().isPlaced());
        assertEquals(2, frame.packable().x());
        assertEquals(3, frame.y());
        assertThrows(IllegalStateException.class, () -> frame.place(0, 0));
    }

    @Test
    void testUnplacedCopySharesImage() {
        var frame = new Frame(Path.of("a.png"), TestImages.solid(4, 4, Color.RED));
        frame.place(1, 1);

        var copy = frame.unplaced();
        assertFalse(copy.isPlaced());
        assertSame(frame.image(), copy.image());
        assertEquals(frame.source(), copy.source());
    }

    @Test
    void testTextureRequiresFrames() {
        assertThrows(IllegalArgumentException.class, () -> new Texture("none", List.of()));
        assertThrows(NullPointerException.class, () -> new Texture(null, List.of()));
    }

    @Test
    void testTextureUnplaced() {
        var frame = new Frame(Path.of("a.png"), TestImages.solid(4, 4, Color.RED));
        var texture = Texture.of("a", frame);
        frame.place(0, 0);

        var copy = texture.unplaced();
        assertEquals("a", copy.name());
        assertEquals(1, copy.frames().size());
        assertFalse(copy.firstFrame().isPlaced());
    }
}
