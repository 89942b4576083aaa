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
package com.hellblazer.atlas.binpack;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A rectangular area that {@link Packable} rectangles are packed into using a guillotine split.
 *
 * <p>The area is a binary tree of regions. Each region holds at most one rectangle; when a rectangle lands in an empty
 * region it is placed at the region's origin and the remaining free space is cut into two children:
 * <ul>
 * <li><b>sub1</b>: the strip below the rectangle, as wide as the rectangle</li>
 * <li><b>sub2</b>: everything to the right of the rectangle, full region height</li>
 * </ul>
 * Later rectangles descend through occupied regions trying sub1 before sub2. Children are created exactly once and are
 * never resized.
 *
 * <p>Regions live in an arena and refer to their children by index, with {@link #ROOT} the whole area. Packing walks
 * the tree with an explicit stack, so a degenerate chain of regions cannot exhaust the call stack.
 *
 * <p>Not thread safe.
 *
 * @author hal.hildebrand
 */
public final class PackRegion {

    /**
     * Index of the region covering the whole area
     */
    public static final int ROOT = 0;

    /**
     * Child index of a region that has not been split
     */
    public static final int NONE = -1;

    private static final Logger log = LoggerFactory.getLogger(PackRegion.class);

    /**
     * Immutable snapshot of one region of the tree.
     *
     * @param index    arena index of the region
     * @param x        left edge of the free area
     * @param y        top edge of the free area
     * @param width    width of the free area
     * @param height   height of the free area
     * @param packable the rectangle occupying the region, or null
     * @param sub1     index of the strip below the occupant, or {@link #NONE}
     * @param sub2     index of the area right of the occupant, or {@link #NONE}
     */
    public record Region(int index, int x, int y, int width, int height, Packable packable, int sub1, int sub2) {

        public boolean isOccupied() {
            return packable != null;
        }

        public boolean hasChildren() {
            return sub1 != NONE;
        }
    }

    private static final class Node {
        final int x;
        final int y;
        final int width;
        final int height;
        Packable packable;
        int      sub1 = NONE;
        int      sub2 = NONE;

        Node(int x, int y, int width, int height) {
            this.x = x;
            this.y = y;
            this.width = width;
            this.height = height;
        }
    }

    private final List<Node> regions = new ArrayList<>();
    private       int        packed;

    public PackRegion(int x, int y, int width, int height) {
        if (x < 0 || y < 0) {
            throw new IllegalArgumentException("Origin must be non-negative: (" + x + ", " + y + ")");
        }
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Extent must be non-negative: " + width + "x" + height);
        }
        regions.add(new Node(x, y, width, height));
    }

    public int x() {
        return regions.get(ROOT).x;
    }

    public int y() {
        return regions.get(ROOT).y;
    }

    public int width() {
        return regions.get(ROOT).width;
    }

    public int height() {
        return regions.get(ROOT).height;
    }

    /**
     * Pack the rectangle into the first free region that can hold it, searching depth first, sub1 before sub2.
     *
     * @param packable an unplaced rectangle
     * @return true if the rectangle was placed, false if no free region can hold it; on false nothing is modified
     * @throws IllegalStateException if the rectangle has already been placed
     */
    public boolean pack(Packable packable) {
        Objects.requireNonNull(packable, "packable");
        if (packable.isPlaced()) {
            throw new IllegalStateException("Cannot pack a rectangle twice: " + packable);
        }

        var pending = new ArrayDeque<Integer>();
        pending.push(ROOT);
        while (!pending.isEmpty()) {
            int index = pending.pop();
            var node = regions.get(index);
            // children are contained in their parent, so a miss here prunes the subtree
            if (!packable.fitsWithin(node.width, node.height)) {
                continue;
            }
            if (node.packable == null) {
                place(node, packable);
                return true;
            }
            pending.push(node.sub2);
            pending.push(node.sub1);
        }
        log.trace("No room for {} in {}x{} region", packable, width(), height());
        return false;
    }

    private void place(Node node, Packable packable) {
        node.packable = packable;
        packable.place(node.x, node.y);

        node.sub1 = regions.size();
        regions.add(new Node(node.x, node.y + packable.height(), packable.width(), node.height - packable.height()));
        node.sub2 = regions.size();
        regions.add(new Node(node.x + packable.width(), node.y, node.width - packable.width(), node.height));
        packed++;
    }

    /**
     * @return every packed rectangle of the tree, in pre-order (region, sub1 subtree, sub2 subtree)
     */
    public List<Packable> getAllPackables() {
        var result = new ArrayList<Packable>(packed);
        var pending = new ArrayDeque<Integer>();
        pending.push(ROOT);
        while (!pending.isEmpty()) {
            var node = regions.get(pending.pop());
            if (node.packable == null) {
                continue;
            }
            result.add(node.packable);
            pending.push(node.sub2);
            pending.push(node.sub1);
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * @return the number of rectangles packed so far
     */
    public int packedCount() {
        return packed;
    }

    /**
     * @return the number of regions in the arena, occupied or free
     */
    public int regionCount() {
        return regions.size();
    }

    /**
     * @throws IndexOutOfBoundsException if the index is not in the arena
     */
    public Region region(int index) {
        var node = regions.get(index);
        return new Region(index, node.x, node.y, node.width, node.height, node.packable, node.sub1, node.sub2);
    }

    @Override
    public String toString() {
        return "PackRegion[" + x() + ", " + y() + ", " + width() + "x" + height() + ", packed=" + packed + ", regions="
        + regions.size() + "]";
    }
}
