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

import com.hellblazer.lumen.geometry.BoundingSphere;

import java.util.Optional;

/**
 * Read only view of a tile handed to the renderer
 *
 * @param <T> texture data type
 * @author hal.hildebrand
 */
public interface TileHandle<T> {

    int getIndex();

    int getLevel();

    TilePlacement getPlacement();

    /**
     * @return normalized x range of the tile's texture covered by image content
     */
    ClipRange getXRange();

    /**
     * @return normalized y range of the tile's texture covered by image content
     */
    ClipRange getYRange();

    /**
     * @return false if the tile lies entirely outside the content region and has nothing to draw
     */
    boolean hasContent();

    /**
     * @return the assembled surface, empty for content free or not yet loaded tiles
     */
    Optional<TileSurface<T>> getSurface();

    /**
     * @return the culling volume, present only when debug spheres are enabled
     */
    Optional<BoundingSphere> getDebugSphere();
}
