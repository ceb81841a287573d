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
 * Index arithmetic of a complete quadtree stored level by level in a flat array. Level {@code i} holds {@code 4^i}
 * nodes starting at {@code (4^i - 1) / 3}.
 *
 * @author hal.hildebrand
 */
public final class QuadtreeIndex {

    /** Deepest pyramid whose node count still fits an int indexed array */
    public static final int MAX_LEVELS = 15;

    private QuadtreeIndex() {
    }

    /**
     * @param tileEdge edge of a tile in pixels
     * @param maxWidth width of the base image in pixels
     * @return the smallest n with {@code tileEdge * 2^(n-1) >= maxWidth}
     */
    public static int levelCount(int tileEdge, int maxWidth) {
        if (tileEdge <= 0 || maxWidth <= 0) {
            throw new IllegalArgumentException("Tile edge and width must be positive: " + tileEdge + ", " + maxWidth);
        }
        int levels = 1;
        long resolution = tileEdge;
        while (resolution < maxWidth) {
            resolution *= 2;
            levels++;
        }
        return levels;
    }

    public static int nodeCount(int levels) {
        checkLevels(levels);
        return (int) (((1L << (2 * levels)) - 1) / 3);
    }

    public static int levelStart(int level) {
        return nodeCount(level);
    }

    public static int nodesOnLevel(int level) {
        checkLevels(level + 1);
        return 1 << (2 * level);
    }

    /**
     * @return {@code ceil(k/4) - 1}, or -1 for the root
     */
    public static int parentOf(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("Negative node index: " + index);
        }
        return index == 0 ? -1 : (index + 3) / 4 - 1;
    }

    /**
     * Child slots are not laid out in index order: slot {@code c} lives at {@code 4k + 1 + ((c + 2) mod 4)}, giving
     * slots 0..3 the quadrants lower left, lower right, upper left, upper right.
     */
    public static int childOf(int index, int slot) {
        if (slot < 0 || slot > 3) {
            throw new IllegalArgumentException("Child slot must be in [0, 3]: " + slot);
        }
        return index * 4 + 1 + (slot + 2) % 4;
    }

    public static int levelOf(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("Negative node index: " + index);
        }
        int level = 0;
        while (levelStart(level + 1) <= index) {
            level++;
        }
        return level;
    }

    private static void checkLevels(int levels) {
        if (levels < 0 || levels > MAX_LEVELS) {
            throw new IllegalArgumentException("Level count must be in [0, " + MAX_LEVELS + "]: " + levels);
        }
    }
}
