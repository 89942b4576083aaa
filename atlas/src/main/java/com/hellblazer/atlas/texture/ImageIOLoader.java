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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Decodes images with the codecs registered with {@link ImageIO}. PNG (with alpha), GIF, BMP and JPEG are always
 * available.
 *
 * @author hal.hildebrand
 */
public class ImageIOLoader implements ImageLoader {
    private static final Logger log = LoggerFactory.getLogger(ImageIOLoader.class);

    @Override
    public BufferedImage load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new AtlasException.DecodeFailureException(path, "no such file");
        }
        BufferedImage image;
        try (var in = Files.newInputStream(path)) {
            image = ImageIO.read(in);
        } catch (IOException e) {
            throw new AtlasException.DecodeFailureException(path, e);
        }
        if (image == null) {
            throw new AtlasException.DecodeFailureException(path, "unsupported image format");
        }
        log.debug("Decoded {} ({}x{})", path, image.getWidth(), image.getHeight());
        return image;
    }
}
