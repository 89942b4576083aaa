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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.atlas.texture.ColorMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;

/**
 * Immutable settings for {@link AtlasBuilder}.
 *
 * <p>Instances come from the presets, from {@link Builder}, or from a JSON document:
 * <pre>{@code
 * {
 *   "colorMode": "RGBA",
 *   "minimumSize": 1,
 *   "maxSize": 16384,
 *   "parallelDecode": false,
 *   "validate": true
 * }
 * }</pre>
 * Absent fields keep their defaults.
 *
 * @author hal.hildebrand
 */
public final class AtlasConfiguration {
    private static final Logger       log          = LoggerFactory.getLogger(AtlasConfiguration.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    public static final String DEFAULT_RESOURCE = "/atlas-defaults.json";

    public static final int DEFAULT_MAX_SIZE   = 16384;
    public static final int UNBOUNDED_MAX_SIZE = 1 << 30;

    private final ColorMode colorMode;
    private final int       minimumSize;
    private final int       maxSize;
    private final boolean   parallelDecode;
    private final boolean   validate;

    private AtlasConfiguration(Builder builder) {
        this.colorMode = builder.colorMode;
        this.minimumSize = builder.minimumSize;
        this.maxSize = builder.maxSize;
        this.parallelDecode = builder.parallelDecode;
        this.validate = builder.validate;
    }

    public static AtlasConfiguration defaultConfig() {
        return new Builder().build();
    }

    /**
     * Lets the retry loop grow the atlas as far as an int side length allows.
     */
    public static AtlasConfiguration unboundedConfig() {
        return new Builder().withMaxSize(UNBOUNDED_MAX_SIZE).build();
    }

    /**
     * Parse a JSON configuration document.
     *
     * @throws IOException              if the document cannot be read or parsed
     * @throws IllegalArgumentException if a value is out of range or the color mode is unknown
     */
    public static AtlasConfiguration load(InputStream in) throws IOException {
        var root = objectMapper.readTree(in);
        if (root == null || !root.isObject()) {
            throw new IOException("Atlas configuration must be a JSON object");
        }
        var builder = new Builder();
        if (root.has("colorMode")) {
            builder.withColorMode(ColorMode.valueOf(root.get("colorMode").asText().toUpperCase(Locale.ROOT)));
        }
        if (root.has("minimumSize")) {
            builder.withMinimumSize(intValue(root, "minimumSize"));
        }
        if (root.has("maxSize")) {
            builder.withMaxSize(intValue(root, "maxSize"));
        }
        if (root.has("parallelDecode")) {
            builder.withParallelDecode(root.get("parallelDecode").asBoolean());
        }
        if (root.has("validate")) {
            builder.withValidation(root.get("validate").asBoolean());
        }
        return builder.build();
    }

    /**
     * Load a configuration from the classpath, falling back to {@link #defaultConfig()} when the resource is absent or
     * unreadable.
     */
    public static AtlasConfiguration fromClasspath(String resource) {
        try (var is = AtlasConfiguration.class.getResourceAsStream(resource)) {
            if (is == null) {
                log.warn("Atlas configuration {} not found, using defaults", resource);
                return defaultConfig();
            }
            var config = load(is);
            log.debug("Loaded atlas configuration {}: {}", resource, config);
            return config;
        } catch (IOException e) {
            log.warn("Failed to load atlas configuration {}: {}, using defaults", resource, e.getMessage());
            return defaultConfig();
        }
    }

    private static int intValue(JsonNode root, String field) throws IOException {
        var node = root.get(field);
        if (!node.canConvertToInt()) {
            throw new IOException("Field '" + field + "' must be an int: " + node);
        }
        return node.asInt();
    }

    public ColorMode getColorMode() {
        return colorMode;
    }

    public int getMinimumSize() {
        return minimumSize;
    }

    public int getMaxSize() {
        return maxSize;
    }

    public boolean isParallelDecode() {
        return parallelDecode;
    }

    public boolean isValidate() {
        return validate;
    }

    @Override
    public String toString() {
        return "AtlasConfiguration[colorMode=" + colorMode + ", minimumSize=" + minimumSize + ", maxSize=" + maxSize
        + ", parallelDecode=" + parallelDecode + ", validate=" + validate + "]";
    }

    public static final class Builder {
        private ColorMode colorMode      = ColorMode.RGBA;
        private int       minimumSize    = 1;
        private int       maxSize        = DEFAULT_MAX_SIZE;
        private boolean   parallelDecode = false;
        private boolean   validate       = true;

        public Builder withColorMode(ColorMode colorMode) {
            this.colorMode = colorMode != null ? colorMode : ColorMode.RGBA;
            return this;
        }

        /**
         * Smallest side the atlas starts from, whatever the estimate says.
         */
        public Builder withMinimumSize(int minimumSize) {
            this.minimumSize = minimumSize;
            return this;
        }

        /**
         * Largest side the retry loop may try before giving up.
         */
        public Builder withMaxSize(int maxSize) {
            this.maxSize = maxSize;
            return this;
        }

        public Builder withParallelDecode(boolean parallelDecode) {
            this.parallelDecode = parallelDecode;
            return this;
        }

        public Builder withValidation(boolean validate) {
            this.validate = validate;
            return this;
        }

        public AtlasConfiguration build() {
            if (minimumSize <= 0) {
                throw new IllegalArgumentException("Minimum size must be positive: " + minimumSize);
            }
            if (maxSize <= 0) {
                throw new IllegalArgumentException("Max size must be positive: " + maxSize);
            }
            if (minimumSize > maxSize) {
                throw new IllegalArgumentException(
                "Minimum size " + minimumSize + " must not exceed max size " + maxSize);
            }
            return new AtlasConfiguration(this);
        }
    }
}
