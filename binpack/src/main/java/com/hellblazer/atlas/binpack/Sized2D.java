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

/**
 * Something with a fixed two dimensional extent.
 *
 * @author hal.hildebrand
 */
public interface Sized2D {

    int width();

    int height();

    /**
     * @return 2 * (width + height)
     */
    default int perimeter() {
        return 2 * width() + 2 * height();
    }

    default long area() {
        return (long) width() * height();
    }

    /**
     * @return true if a box of this size fits within the given extent
     */
    default boolean fitsWithin(int width, int height) {
        return width() <= width && height() <= height;
    }
}
