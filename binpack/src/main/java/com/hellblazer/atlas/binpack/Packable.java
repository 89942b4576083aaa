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
package com.hellblazer.atlas.binpack;

import java.util.Objects;
import java.util.Optional;

/**
 * A rectangle that can be packed into a {@link PackRegion}.
 * <p>
 * The extent is fixed at construction. The position starts out unset and is assigned once, by the region that accepts
 * the rectangle; a packed rectangle is never moved.
 *
 * @author hal.hildebrand
 */
public final class Packable implements Sized2D, Positioned2D {

    private final int      width;
    private final int      height;
    private final Object   userdata;
    private       Position position;

    public Packable(int width, int height) {
        this(width, height, null);
    }

    /**
     * @param userdata optional caller payload, used only for diagnostics
     */
    public Packable(int width, int height, Object userdata) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Dimensions must be positive: " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.userdata = userdata;
    }

    @Override
    public int width() {
        return width;
    }

    @Override
    public int height() {
        return height;
    }

    public Object userdata() {
        return userdata;
    }

    @Override
    public Optional<Position> position() {
        return Optional.ofNullable(position);
    }

    @Override
    public void place(int x, int y) {
        if (position != null) {
            throw new IllegalStateException("Already placed at " + position + ": " + this);
        }
        position = new Position(x, y);
    }

    /**
     * @return true if both rectangles are placed and their areas intersect
     */
    public boolean overlaps(Packable other) {
        Objects.requireNonNull(other, "other");
        if (position == null || other.position == null) {
            return false;
        }
        return position.x() < other.position.x() + other.width && other.position.x() < position.x() + width
        && position.y() < other.position.y() + other.height && other.position.y() < position.y() + height;
    }

    @Override
    public String toString() {
        var where = position == null ? "?" : position.toString();
        var label = userdata == null ? "" : userdata + " ";
        return "{" + label + where + " " + width + "x" + height + "}";
    }
}
