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

import java.util.List;
import java.util.Objects;

/**
 * A named group of one or more frames. Multiple frames leave room for animated textures; the atlas builder creates
 * single frame textures.
 *
 * @param name   identifier, unique within an atlas
 * @param frames frames in packing order, never empty
 * @author hal.hildebrand
 */
public record Texture(String name, List<Frame> frames) {

    public Texture {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(frames, "frames");
        if (frames.isEmpty()) {
            throw new IllegalArgumentException("Texture needs at least one frame: " + name);
        }
        frames = List.copyOf(frames);
    }

    public static Texture of(String name, Frame frame) {
        return new Texture(name, List.of(frame));
    }

    /**
     * @return a texture of the same name whose frames share this texture's images but carry no position
     */
    public Texture unplaced() {
        return new Texture(name, frames.stream().map(Frame::unplaced).toList());
    }

    public Frame firstFrame() {
        return frames.get(0);
    }
}
