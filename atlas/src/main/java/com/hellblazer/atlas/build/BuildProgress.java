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

/**
 * Immutable progress snapshot for atlas builds.
 *
 * <p>The percentage is clamped to [0, 100] by the factory methods. During {@link BuildPhase#PACKING} one snapshot is
 * reported per candidate size, carrying that size; other snapshots carry 0.
 *
 * @param phase           current build phase
 * @param percentComplete completion percentage
 * @param atlasSize       candidate side length being attempted, or 0
 * @author hal.hildebrand
 * @see BuildPhase
 */
public record BuildProgress(BuildPhase phase, int percentComplete, int atlasSize) {

    public static BuildProgress of(BuildPhase phase, int percent) {
        return new BuildProgress(phase, clamp(percent), 0);
    }

    public static BuildProgress attempt(int atlasSize, int percent) {
        return new BuildProgress(BuildPhase.PACKING, clamp(percent), atlasSize);
    }

    private static int clamp(int percent) {
        return Math.min(100, Math.max(0, percent));
    }
}
