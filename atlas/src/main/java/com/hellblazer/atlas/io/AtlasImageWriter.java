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
package com.hellblazer.atlas.io;

import com.hellblazer.atlas.build.AtlasResult;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Saves atlas composites through {@link ImageIO}. The format comes from the file extension, PNG when there is none.
 *
 * @author hal.hildebrand
 */
public final class AtlasImageWriter {

    public static final String DEFAULT_FORMAT = "png";

    private AtlasImageWriter() {
    }

    public static void write(AtlasResult result, Path file) throws IOException {
        write(result.image(), file);
    }

    /**
     * @throws IOException if no registered writer handles the format and image type, or writing fails
     */
    public static void write(BufferedImage image, Path file) throws IOException {
        var format = formatOf(file);
        var parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        if (!ImageIO.write(image, format, file.toFile())) {
            throw new IOException("No image writer for format '" + format + "' and image type " + image.getType());
        }
    }

    public static String formatOf(Path file) {
        var name = file.getFileName().toString();
        var dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return DEFAULT_FORMAT;
        }
        return name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
