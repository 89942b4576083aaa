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

import com.hellblazer.atlas.texture.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Builds a square texture atlas from a mapping of logical keys to image files.
 *
 * <h3>Build Phases</h3>
 * <ol>
 * <li><b>LOADING (0-30%)</b>: Decode each distinct path once; every key gets its own single frame texture</li>
 * <li><b>SORTING (30-35%)</b>: Order textures by first frame perimeter, descending, ties in key order</li>
 * <li><b>SIZING (35-40%)</b>: {@code max(maxHeight, maxWidth, nextPowerOfTwo(ceil(sqrt(totalArea))))}</li>
 * <li><b>PACKING (40-80%)</b>: Pack everything into a fresh atlas, doubling the side after each failure</li>
 * <li><b>VALIDATION (80-85%)</b>: Optional containment and overlap check</li>
 * <li><b>RENDERING (85-100%)</b>: Draw the composite and compute UV bounds per key</li>
 * </ol>
 *
 * <p>Packing large items first wastes less space with the guillotine split than packing small ones first. The area
 * estimate is usually enough but not guaranteed, so the retry loop doubles the side (quadrupling the area) until
 * everything fits or {@link AtlasConfiguration#getMaxSize()} would be exceeded.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * var result = AtlasBuilder.from(Map.of("stone", Path.of("stone.png"), "dirt", Path.of("dirt.png")))
 *     .withConfiguration(AtlasConfiguration.defaultConfig())
 *     .withProgressCallback(progress -> log.info("{}", progress))
 *     .build();
 * var stone = result.bounds("stone");
 * }</pre>
 *
 * <p>A builder may be reused; each {@link #build()} starts from scratch and yields an equal result for equal input.
 *
 * @author hal.hildebrand
 */
public final class AtlasBuilder {
    private static final Logger log = LoggerFactory.getLogger(AtlasBuilder.class);

    private static final Comparator<Texture> LARGEST_PERIMETER_FIRST = Comparator.comparingInt(
    (Texture t) -> t.firstFrame().perimeter()).reversed();

    private final Map<String, Path>       sources;
    private       AtlasConfiguration      configuration    = AtlasConfiguration.defaultConfig();
    private       ImageLoader             loader           = new ImageIOLoader();
    private       Consumer<BuildProgress> progressCallback = null;

    private AtlasBuilder(Map<String, Path> sources) {
        this.sources = sources;
    }

    /**
     * Create a builder over the given sources. Several keys may name the same path; each is packed separately.
     *
     * @param sources logical key to image path; iteration order is the order of the UV table
     * @throws IllegalArgumentException if the map holds a null key or path
     */
    public static AtlasBuilder from(Map<String, Path> sources) {
        Objects.requireNonNull(sources, "sources");
        var copy = new LinkedHashMap<String, Path>();
        for (var entry : sources.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                throw new IllegalArgumentException("Null key or path in sources: " + entry);
            }
            copy.put(entry.getKey(), entry.getValue());
        }
        return new AtlasBuilder(copy);
    }

    public AtlasBuilder withConfiguration(AtlasConfiguration configuration) {
        this.configuration = configuration != null ? configuration : AtlasConfiguration.defaultConfig();
        return this;
    }

    public AtlasBuilder withImageLoader(ImageLoader loader) {
        this.loader = Objects.requireNonNull(loader, "loader");
        return this;
    }

    /**
     * @param callback progress callback (null to disable)
     */
    public AtlasBuilder withProgressCallback(Consumer<BuildProgress> callback) {
        this.progressCallback = callback;
        return this;
    }

    /**
     * @return the packed atlas, its RGBA pixels and a UV entry for every key
     * @throws AtlasException.DecodeFailureException     if a source cannot be decoded
     * @throws AtlasException.InvalidDimensionsException if a source has zero width or height
     * @throws AtlasException.SizeLimitExceededException if the textures do not fit within the maximum size
     */
    public AtlasResult build() {
        var startTime = Instant.now();
        log.info("Creating texture atlas from {} textures", sources.size());

        reportProgress(BuildPhase.LOADING, 0);
        var textures = loadTextures();
        reportProgress(BuildPhase.LOADING, 30);

        reportProgress(BuildPhase.SORTING, 30);
        textures.sort(LARGEST_PERIMETER_FIRST);
        reportProgress(BuildPhase.SORTING, 35);

        reportProgress(BuildPhase.SIZING, 35);
        var estimate = estimateSize(textures, configuration.getMinimumSize());
        if (estimate > configuration.getMaxSize()) {
            throw new AtlasException.SizeLimitExceededException(estimate, configuration.getMaxSize());
        }
        var initialSize = (int) estimate;
        reportProgress(BuildPhase.SIZING, 40);

        var attempted = new ArrayList<Integer>();
        var atlas = packWithRetry(textures, initialSize, attempted);

        if (configuration.isValidate()) {
            reportProgress(BuildPhase.VALIDATION, 80);
            validate(atlas);
            reportProgress(BuildPhase.VALIDATION, 85);
        }

        reportProgress(BuildPhase.RENDERING, 85);
        var image = atlas.generate(configuration.getColorMode());
        var pixels = toRgba(image);
        var table = atlas.toBoundsTable();
        var uvTable = new LinkedHashMap<String, UVBounds>();
        for (var key : sources.keySet()) {
            uvTable.put(key, table.get(key));
        }
        reportProgress(BuildPhase.RENDERING, 100);

        var metadata = new AtlasMetadata(atlas.textures().size(), initialSize, attempted, atlas.size(),
                                         Duration.between(startTime, Instant.now()));
        reportProgress(BuildPhase.COMPLETE, 100);
        log.info("Finished creating {}x{} texture atlas ({} retries, {} ms)", atlas.width(), atlas.height(),
                 metadata.retries(), metadata.buildTime().toMillis());

        return new AtlasResult(pixels, uvTable, atlas.width(), atlas.height(), image, metadata);
    }

    /**
     * Decode each distinct path once and wrap one single frame texture per key, in key order.
     */
    private List<Texture> loadTextures() {
        var distinct = new LinkedHashSet<>(sources.values());
        Map<Path, BufferedImage> images;
        if (configuration.isParallelDecode() && distinct.size() > 1) {
            images = distinct.parallelStream().collect(Collectors.toConcurrentMap(Function.identity(), this::decode));
        } else {
            images = new HashMap<>();
            for (var path : distinct) {
                images.put(path, decode(path));
            }
        }
        log.debug("Decoded {} distinct images for {} keys", images.size(), sources.size());

        var textures = new ArrayList<Texture>(sources.size());
        for (var entry : sources.entrySet()) {
            var path = entry.getValue();
            textures.add(Texture.of(entry.getKey(), new Frame(path, images.get(path))));
        }
        return textures;
    }

    private BufferedImage decode(Path path) {
        var image = loader.load(path);
        if (image == null) {
            throw new AtlasException.DecodeFailureException(path, "loader returned no image");
        }
        return image;
    }

    private Atlas packWithRetry(List<Texture> textures, int initialSize, List<Integer> attempted) {
        var size = initialSize;
        while (true) {
            attempted.add(size);
            reportProgress(BuildProgress.attempt(size, 40));
            log.info("Trying to pack textures into image of size {}x{}", size, size);
            try {
                var atlas = packAll(textures, size);
                log.info("Successfully packed textures into an image of size {}x{}", size, size);
                reportProgress(BuildPhase.PACKING, 80);
                return atlas;
            } catch (AtlasException.AtlasTooSmallException e) {
                var next = 2L * size;
                log.info("Image was too small ({}). Trying {}x{}", e.getMessage(), next, next);
                if (next > configuration.getMaxSize()) {
                    throw new AtlasException.SizeLimitExceededException(next, configuration.getMaxSize());
                }
                size = (int) next;
            }
        }
    }

    /**
     * Pack every texture into a fresh atlas. Each attempt packs unplaced copies, so a failed attempt leaves nothing
     * behind.
     */
    static Atlas packAll(List<Texture> textures, int size) {
        var atlas = new Atlas(size);
        for (var texture : textures) {
            atlas.pack(texture.unplaced());
        }
        return atlas;
    }

    /**
     * Initial side estimate: the larger of the widest or tallest frame and the power of two at or above the square
     * root of the total pixel area, floored at the minimum size.
     */
    static long estimateSize(List<Texture> textures, int minimumSize) {
        var maxWidth = 0;
        var maxHeight = 0;
        var pixels = 0L;
        for (var texture : textures) {
            for (var frame : texture.frames()) {
                maxWidth = Math.max(maxWidth, frame.width());
                maxHeight = Math.max(maxHeight, frame.height());
                pixels += frame.area();
            }
        }
        var side = (long) Math.ceil(Math.sqrt((double) pixels));
        return Math.max(Math.max(maxHeight, maxWidth), Math.max(nextPowerOfTwo(side), minimumSize));
    }

    /**
     * @return {@code 1 << bitLength(n - 1)}: the smallest power of two greater than or equal to n for n >= 1, and 2 for
     * n == 0, so an empty atlas is 2x2
     */
    static long nextPowerOfTwo(long n) {
        if (n < 0) {
            throw new IllegalArgumentException("Negative side length: " + n);
        }
        if (n == 0) {
            return 2;
        }
        if (n == 1) {
            return 1;
        }
        return Long.highestOneBit(n - 1) << 1;
    }

    private void validate(Atlas atlas) {
        var violations = atlas.validate();
        if (atlas.textures().size() != sources.size()) {
            violations = new ArrayList<>(violations);
            violations.add("Packed " + atlas.textures().size() + " of " + sources.size() + " textures");
        }
        if (!violations.isEmpty()) {
            violations.forEach(v -> log.error("Atlas validation: {}", v));
            throw new IllegalStateException("Atlas validation failed: " + violations.size() + " violations");
        }
    }

    /**
     * Flatten to RGBA bytes, row-major from the top-left corner.
     */
    static byte[] toRgba(BufferedImage image) {
        var width = image.getWidth();
        var height = image.getHeight();
        var argb = image.getRGB(0, 0, width, height, null, 0, width);
        var rgba = new byte[argb.length * 4];
        for (int i = 0; i < argb.length; i++) {
            var p = argb[i];
            var offset = i * 4;
            rgba[offset] = (byte) (p >>> 16);
            rgba[offset + 1] = (byte) (p >>> 8);
            rgba[offset + 2] = (byte) p;
            rgba[offset + 3] = (byte) (p >>> 24);
        }
        return rgba;
    }

    private void reportProgress(BuildPhase phase, int percent) {
        reportProgress(BuildProgress.of(phase, percent));
    }

    private void reportProgress(BuildProgress progress) {
        if (progressCallback != null) {
            progressCallback.accept(progress);
        }
    }
}
