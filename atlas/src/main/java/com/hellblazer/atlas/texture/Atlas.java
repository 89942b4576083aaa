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

import com.hellblazer.atlas.binpack.PackRegion;
import com.hellblazer.atlas.binpack.PackValidator;
import com.hellblazer.atlas.binpack.Packable;
import com.hellblazer.atlas.io.AtlasImageWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.AlphaComposite;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.*;

/**
 * One packing session over a square candidate size.
 * <p>
 * Textures are packed frame by frame into a {@link PackRegion} rooted at (0, 0). If a frame does not fit, the atlas
 * throws {@link AtlasException.AtlasTooSmallException} and is left partially filled; the caller is expected to discard
 * it and start over with a larger size.
 *
 * @author hal.hildebrand
 */
public final class Atlas {
    private static final Logger log = LoggerFactory.getLogger(Atlas.class);

    private final int           size;
    private final PackRegion    region;
    private final List<Texture> textures = new ArrayList<>();
    private final Set<String>   names    = new HashSet<>();

    public Atlas(int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("Atlas size must be positive: " + size);
        }
        this.size = size;
        this.region = new PackRegion(0, 0, size, size);
    }

    public int width() {
        return region.width();
    }

    public int height() {
        return region.height();
    }

    public int size() {
        return size;
    }

    /**
     * @return packed textures in pack order
     */
    public List<Texture> textures() {
        return Collections.unmodifiableList(textures);
    }

    /**
     * Pack every frame of the texture, in frame order. The texture is recorded only when all of its frames were placed.
     *
     * @throws AtlasException.AtlasTooSmallException if a frame does not fit; frames placed before it stay placed
     * @throws IllegalArgumentException              if a texture of the same name is already packed
     */
    public void pack(Texture texture) {
        Objects.requireNonNull(texture, "texture");
        if (names.contains(texture.name())) {
            throw new IllegalArgumentException("Texture already packed: " + texture.name());
        }
        for (var frame : texture.frames()) {
            if (!region.pack(frame.packable())) {
                throw new AtlasException.AtlasTooSmallException(
                "Failed to pack frame " + frame.source() + " of " + texture.name() + " into " + size + "x" + size,
                size);
            }
        }
        textures.add(texture);
        names.add(texture.name());
        log.debug("Packed {} at {}", texture.name(), texture.firstFrame().position().orElseThrow());
    }

    /**
     * Render the packed frames, in pack order, onto a blank image of the atlas extent.
     */
    public BufferedImage generate(ColorMode mode) {
        var out = mode.createImage(width(), height());
        var g = out.createGraphics();
        try {
            g.setComposite(AlphaComposite.Src);
            for (var texture : textures) {
                for (var frame : texture.frames()) {
                    frame.draw(g);
                }
            }
        } finally {
            g.dispose();
        }
        return out;
    }

    /**
     * Generate the atlas and save it. The image format is taken from the file extension, PNG when there is none.
     *
     * @throws IOException if no writer handles the format or writing fails
     */
    public void write(Path file, ColorMode mode) throws IOException {
        AtlasImageWriter.write(generate(mode), file);
        log.info("Wrote {}x{} atlas to {}", width(), height(), file);
    }

    /**
     * Normalized bounds of each texture's first frame, keyed by texture name, in pack order.
     *
     * @see UVBounds#fromFrame(Frame, int, int)
     */
    public Map<String, UVBounds> toBoundsTable() {
        var table = new LinkedHashMap<String, UVBounds>();
        for (var texture : textures) {
            table.put(texture.name(), UVBounds.fromFrame(texture.firstFrame(), width(), height()));
        }
        return table;
    }

    public List<Packable> getAllPackables() {
        return region.getAllPackables();
    }

    /**
     * @return containment and overlap violations of the current packing; empty when valid
     */
    public List<String> validate() {
        return PackValidator.validate(region.getAllPackables(), width(), height());
    }

    @Override
    public String toString() {
        return "Atlas[" + size + "x" + size + ", textures=" + textures.size() + "]";
    }
}
