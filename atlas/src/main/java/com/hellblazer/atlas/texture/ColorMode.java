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

import java.awt.image.BufferedImage;

/**
 * Pixel layout of a generated atlas image.
 *
 * @author hal.hildebrand
 */
public enum ColorMode {
    /**
     * 8 bit per channel color with alpha. Transparent where nothing was drawn.
     */
    RGBA(BufferedImage.TYPE_INT_ARGB),

    /**
     * 8 bit per channel opaque color. Black where nothing was drawn.
     */
    RGB(BufferedImage.TYPE_INT_RGB),

    /**
     * 8 bit luminance.
     */
    GRAYSCALE(BufferedImage.TYPE_BYTE_GRAY);

    private final int imageType;

    ColorMode(int imageType) {
        this.imageType = imageType;
    }

    /**
     * @return the {@link BufferedImage} type constant for this mode
     */
    public int imageType() {
        return imageType;
    }

    public BufferedImage createImage(int width, int height) {
        return new BufferedImage(width, height, imageType);
    }
}
