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

import java.nio.file.Path;

/**
 * Sealed exception hierarchy for atlas construction.
 * <p>
 * Exception types:
 * <ul>
 * <li>{@link AtlasTooSmallException} - a frame did not fit the candidate atlas; recovered by retrying larger</li>
 * <li>{@link DecodeFailureException} - a source image is missing or cannot be decoded</li>
 * <li>{@link InvalidDimensionsException} - a source image has zero width or height</li>
 * <li>{@link SizeLimitExceededException} - the atlas would have to grow beyond the configured limit</li>
 * </ul>
 *
 * @author hal.hildebrand
 */
public sealed class AtlasException extends RuntimeException
    permits AtlasException.AtlasTooSmallException,
            AtlasException.DecodeFailureException,
            AtlasException.InvalidDimensionsException,
            AtlasException.SizeLimitExceededException {

    public AtlasException(String message) {
        super(message);
    }

    public AtlasException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Thrown when a frame cannot be placed in the current candidate atlas. The atlas attempt is abandoned as a whole.
     */
    public static final class AtlasTooSmallException extends AtlasException {
        private final int size;

        public AtlasTooSmallException(String message, int size) {
            super(message);
            this.size = size;
        }

        /**
         * @return side length of the atlas that was too small
         */
        public int getSize() {
            return size;
        }
    }

    /**
     * Thrown when a source image is missing, unreadable or in a format no installed codec understands.
     */
    public static final class DecodeFailureException extends AtlasException {
        private final Path path;

        public DecodeFailureException(Path path, String reason) {
            super("Cannot decode " + path + ": " + reason);
            this.path = path;
        }

        public DecodeFailureException(Path path, Throwable cause) {
            super("Cannot decode " + path + ": " + cause.getMessage(), cause);
            this.path = path;
        }

        public Path getPath() {
            return path;
        }
    }

    /**
     * Thrown when a decoded image has no pixels along one axis.
     */
    public static final class InvalidDimensionsException extends AtlasException {
        private final int width;
        private final int height;

        public InvalidDimensionsException(Object source, int width, int height) {
            super(String.format("Invalid image dimensions %dx%d: %s", width, height, source));
            this.width = width;
            this.height = height;
        }

        public int getWidth() {
            return width;
        }

        public int getHeight() {
            return height;
        }
    }

    /**
     * Thrown when the retry loop would need an atlas larger than the configured maximum.
     */
    public static final class SizeLimitExceededException extends AtlasException {
        private final long requestedSize;
        private final int  limit;

        public SizeLimitExceededException(long requestedSize, int limit) {
            super(String.format("Atlas size %,d exceeds limit of %,d", requestedSize, limit));
            this.requestedSize = requestedSize;
            this.limit = limit;
        }

        public long getRequestedSize() {
            return requestedSize;
        }

        public int getLimit() {
            return limit;
        }
    }
}
