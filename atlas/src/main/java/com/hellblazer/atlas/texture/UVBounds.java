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

/**
 * Normalized texture coordinates of a sub-image. (u0, v0) is the top-left corner, (u1, v1) the bottom-right.
 *
 * @author hal.hildebrand
 */
public record UVBounds(float u0, float v0, float u1, float v1) {

    /**
     * Normalize a placed frame by the atlas extent.
     * <p>
     * The vertical extent is {@code min(height, width)} rather than {@code height}. Existing consumers of the bounds
     * table expect this, so non-square frames report a v1 clamped to their width.
     *
     * @throws IllegalStateException if the frame has not been placed
     */
    public static UVBounds fromFrame(Frame frame, int atlasWidth, int atlasHeight) {
        double w = atlasWidth;
        double h = atlasHeight;
        return new UVBounds((float) (frame.x() / w), (float) (frame.y() / h),
                            (float) ((frame.x() + frame.width()) / w),
                            (float) ((frame.y() + Math.min(frame.height(), frame.width())) / h));
    }

    public float[] toArray() {
        return new float[] { u0, v0, u1, v1 };
    }
}
