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

import com.hellblazer.atlas.binpack.Packable;
import com.hellblazer.atlas.binpack.Position;
import com.hellblazer.atlas.binpack.Positioned2D;
import com.hellblazer.atlas.binpack.Sized2D;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * A decoded source image together with the rectangle it occupies in an atlas.
 * <p>
 * The frame's extent is the natural pixel size of the image. Several frames may share one decoded image; each still
 * owns its own rectangle and so its own placement.
 *
 * @author hal.hildebrand
 */
public final class Frame implements Sized2D, Positioned2D {

    private final Path          source;
    private final BufferedImage image;
    private final Packable      packable;

    /**
     * @param source path the image was decoded from
     * @param image  decoded pixels
     * @throws AtlasException.InvalidDimensionsException if the image has zero width or height
     */
    public Frame(Path source, BufferedImage image) {
        this.source = Objects.requireNonNull(source, "source");
        this.image = Objects.requireNonNull(image, "image");
        if (image.getWidth() <= 0 || image.getHeight() <= 0) {
            throw new AtlasException.InvalidDimensionsException(source, image.getWidth(), image.getHeight());
        }
        this.packable = new Packable(image.getWidth(), image.getHeight(), source);
    }

    /**
     * @return a fresh, unplaced frame over the same decoded image
     */
    public Frame unplaced() {
        return new Frame(source, image);
    }

    public Path source() {
        return source;
    }

    public BufferedImage image() {
        return image;
    }

    /**
     * @return the rectangle handed to the region tree
     */
    public Packable packable() {
        return packable;
    }

    @Override
    public int width() {
        return packable.width();
    }

    @Override
    public int height() {
        return packable.height();
    }

    @Override
    public Optional<Position> position() {
        return packable.position();
    }

    /**
     * Assign a position by hand, outside any region tree. Meant for tests and for laying out frames that never go
     * through {@link Atlas#pack(Texture)}: an atlas refuses a frame that is already placed.
     *
     * @throws IllegalStateException if the frame is already placed
     */
    @Override
    public void place(int x, int y) {
        packable.place(x, y);
    }

    /**
     * Copy this frame's pixels into the target at the assigned position. The caller sets the composite.
     *
     * @throws IllegalStateException if the frame has not been placed
     */
    public void draw(Graphics2D target) {
        target.drawImage(image, x(), y(), null);
    }

    @Override
    public String toString() {
        return "Frame[" + source + " " + packable + "]";
    }
}
