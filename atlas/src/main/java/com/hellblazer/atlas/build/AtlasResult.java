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

import com.hellblazer.atlas.texture.UVBounds;

import java.awt.image.BufferedImage;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Output of {@link AtlasBuilder#build()}.
 *
 * @param pixels   width * height * 4 bytes, RGBA, row-major from the top-left corner; copied on the way in and out
 * @param uvTable  bounds per input key, in the caller's key order
 * @param width    atlas width in pixels
 * @param height   atlas height in pixels
 * @param image    the rendered composite in the configured color mode
 * @param metadata build statistics
 * @author hal.hildebrand
 */
public record AtlasResult(byte[] pixels, Map<String, UVBounds> uvTable, int width, int height, BufferedImage image,
                          AtlasMetadata metadata) {

    public AtlasResult {
        Objects.requireNonNull(pixels, "pixels");
        if (pixels.length != (long) width * height * 4) {
            throw new IllegalArgumentException(
            "Pixel buffer holds " + pixels.length + " bytes, expected " + (long) width * height * 4);
        }
        pixels = pixels.clone();
        uvTable = Collections.unmodifiableMap(new LinkedHashMap<>(uvTable));
    }

    /**
     * @return a copy of the RGBA buffer
     */
    @Override
    public byte[] pixels() {
        return pixels.clone();
    }

    public UVBounds bounds(String key) {
        var bounds = uvTable.get(key);
        if (bounds == null) {
            throw new IllegalArgumentException("Unknown texture key: " + key);
        }
        return bounds;
    }

    /**
     * @return the RGBA components of one pixel as unsigned values
     */
    public int[] rgbaAt(int x, int y) {
        Objects.checkIndex(x, width);
        Objects.checkIndex(y, height);
        var offset = (y * width + x) * 4;
        return new int[] { pixels[offset] & 0xFF, pixels[offset + 1] & 0xFF, pixels[offset + 2] & 0xFF,
                           pixels[offset + 3] & 0xFF };
    }
}
