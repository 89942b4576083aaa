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

import java.util.Optional;

/**
 * Something that is assigned a position exactly once.
 * <p>
 * Implementations move through two states: unplaced, where {@link #position()} is empty, and placed, where it holds the
 * assigned origin. A second call to {@link #place(int, int)} is rejected.
 *
 * @author hal.hildebrand
 */
public interface Positioned2D {

    /**
     * @return the assigned origin, or empty while unplaced
     */
    Optional<Position> position();

    /**
     * Assign the origin.
     *
     * @throws IllegalStateException if a position has already been assigned
     */
    void place(int x, int y);

    default boolean isPlaced() {
        return position().isPresent();
    }

    /**
     * @throws IllegalStateException if unplaced
     */
    default int x() {
        return requirePosition().x();
    }

    /**
     * @throws IllegalStateException if unplaced
     */
    default int y() {
        return requirePosition().y();
    }

    private Position requirePosition() {
        return position().orElseThrow(() -> new IllegalStateException("Not yet placed: " + this));
    }
}
