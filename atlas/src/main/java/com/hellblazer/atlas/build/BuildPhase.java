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
 * Atlas build phases for progress tracking.
 *
 * <ol>
 * <li><b>LOADING</b>: Decode source images into frames</li>
 * <li><b>SORTING</b>: Order textures by first frame perimeter, largest first</li>
 * <li><b>SIZING</b>: Estimate the initial square side</li>
 * <li><b>PACKING</b>: Pack into candidate atlases, doubling the side after each failure</li>
 * <li><b>VALIDATION</b>: Check containment and overlap of the final packing</li>
 * <li><b>RENDERING</b>: Draw the composite and compute the UV table</li>
 * <li><b>COMPLETE</b>: Build complete</li>
 * </ol>
 *
 * @author hal.hildebrand
 * @see BuildProgress
 */
public enum BuildPhase {
    LOADING,
    SORTING,
    SIZING,
    PACKING,
    VALIDATION,
    RENDERING,
    COMPLETE
}
