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
 * Position of a child tile within its parent. The quadrant is a function of the child's node index alone, and fixes
 * the scene offset, the clipping range shift and the pixel region of the child. Scene and texture y point up, pixel
 * rows point down.
 *
 * @author hal.hildebrand
 */
public enum Quadrant {
    UPPER_LEFT(false, true), UPPER_RIGHT(true, true), LOWER_LEFT(false, false), LOWER_RIGHT(true, false);

    private final boolean right;
    private final boolean upper;

    Quadrant(boolean right, boolean upper) {
        this.right = right;
        this.upper = upper;
    }

    /**
     * @param nodeIndex index of a non-root node
     * @return the quadrant the node occupies within its parent
     */
    public static Quadrant of(int nodeIndex) {
        if (nodeIndex <= 0) {
            throw new IllegalArgumentException("The root has no quadrant: " + nodeIndex);
        }
        return switch (nodeIndex % 4) {
            case 1 -> UPPER_LEFT;
            case 2 -> UPPER_RIGHT;
            case 3 -> LOWER_LEFT;
            default -> LOWER_RIGHT;
        };
    }

    /** Sign of the scene x offset from the parent's centre */
    public int signX() {
        return right ? 1 : -1;
    }

    /** Sign of the scene y offset from the parent's centre */
    public int signY() {
        return upper ? 1 : -1;
    }

    /** Amount subtracted from the doubled parent x range */
    public int shiftX() {
        return right ? 1 : 0;
    }

    /** Amount subtracted from the doubled parent y range */
    public int shiftY() {
        return upper ? 1 : 0;
    }

    /** Column of the child within the parent's pixel region */
    public int column() {
        return right ? 1 : 0;
    }

    /** Row of the child within the parent's pixel region */
    public int row() {
        return upper ? 0 : 1;
    }
}
