/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Lumen.
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
package com.hellblazer.lumen.multires;

/**
 * Normalized interval of a tile's texture that carries image content. The interval of a child is derived from its
 * parent's by doubling and shifting, so a range may leave [0, 1] before it is clamped.
 *
 * @author hal.hildebrand
 */
public record ClipRange(double min, double max) {

    public static final ClipRange UNIT = new ClipRange(0, 1);

    public ClipRange {
        if (Double.isNaN(min) || Double.isNaN(max)) {
            throw new IllegalArgumentException("Range bounds must be numbers: " + min + ", " + max);
        }
    }

    /**
     * @param shift 1 for the upper half of the parent, 0 for the lower half
     * @return the unclamped range of a child covering one half of this range's tile
     */
    public ClipRange forChild(int shift) {
        return new ClipRange(2 * min - shift, 2 * max - shift);
    }

    /**
     * @return true if no part of the range overlaps the open unit interval
     */
    public boolean outsideUnit() {
        return min >= 1 || max <= 0;
    }

    public ClipRange clamped() {
        return new ClipRange(clamp(min), clamp(max));
    }

    private static double clamp(double value) {
        return Math.max(0, Math.min(1, value));
    }
}
