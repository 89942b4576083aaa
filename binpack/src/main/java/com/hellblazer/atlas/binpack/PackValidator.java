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

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Checks a finished packing against the two placement invariants:
 * <ol>
 * <li><b>Containment</b>: every rectangle is placed and lies within [0, width) x [0, height)</li>
 * <li><b>No overlap</b>: no two placed rectangles intersect</li>
 * </ol>
 * The overlap check is pairwise, which is fine for verification and tests but not meant for hot paths.
 *
 * @author hal.hildebrand
 */
public final class PackValidator {

    private PackValidator() {
    }

    /**
     * @return a description of every violation found; empty when the packing is valid
     */
    public static List<String> validate(Collection<Packable> packables, int width, int height) {
        var violations = new ArrayList<String>();
        var placed = new ArrayList<Packable>(packables.size());
        for (var p : packables) {
            if (!p.isPlaced()) {
                violations.add("Unplaced: " + p);
                continue;
            }
            if (p.x() + p.width() > width || p.y() + p.height() > height) {
                violations.add("Outside " + width + "x" + height + ": " + p);
            }
            placed.add(p);
        }
        for (int i = 0; i < placed.size(); i++) {
            for (int j = i + 1; j < placed.size(); j++) {
                if (placed.get(i).overlaps(placed.get(j))) {
                    violations.add("Overlap: " + placed.get(i) + " and " + placed.get(j));
                }
            }
        }
        return violations;
    }

    public static boolean isValid(Collection<Packable> packables, int width, int height) {
        return validate(packables, width, height).isEmpty();
    }
}
