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

import java.util.List;

/**
 * The renderable result of a fully loaded tile: its layer textures in layer order and the content limits the shader
 * clips against.
 *
 * @param <T> texture data type
 * @author hal.hildebrand
 */
public record TileSurface<T>(int nodeIndex, List<T> layers, ClipRange xRange, ClipRange yRange) {

    public TileSurface {
        layers = List.copyOf(layers);
    }

    public int layerCount() {
        return layers.size();
    }

    public T layer(int layer) {
        return layers.get(layer);
    }
}
