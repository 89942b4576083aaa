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
package com.hellblazer.atlas.build;

import java.time.Duration;
import java.util.List;

/**
 * Statistics of one atlas build.
 *
 * @param textureCount   number of packed textures, one per input key
 * @param initialSize    side length estimated before packing
 * @param attemptedSizes every side length tried, in order; each is double the previous
 * @param finalSize      side length of the atlas that was produced
 * @param buildTime      wall clock time of the build
 * @author hal.hildebrand
 */
public record AtlasMetadata(int textureCount, int initialSize, List<Integer> attemptedSizes, int finalSize,
                            Duration buildTime) {

    public AtlasMetadata {
        attemptedSizes = List.copyOf(attemptedSizes);
    }

    /**
     * @return number of failed attempts before the final one
     */
    public int retries() {
        return attemptedSizes.size() - 1;
    }
}
