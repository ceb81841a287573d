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

import javax.vecmath.Matrix4f;
import javax.vecmath.Point3f;
import javax.vecmath.Vector3f;

/**
 * Where a tile sits in the scene: the centre of its plane and the plane's extent
 *
 * @author hal.hildebrand
 */
public record TilePlacement(Point3f position, float width, float height) {

    public TilePlacement {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Tile extent must be positive: " + width + "x" + height);
        }
        position = new Point3f(position);
    }

    /**
     * @return placement of the child in the given quadrant, at half this tile's extent
     */
    public TilePlacement child(Quadrant quadrant) {
        float offsetX = quadrant.signX() * width / 4;
        float offsetY = quadrant.signY() * height / 4;
        return new TilePlacement(new Point3f(position.x + offsetX, position.y + offsetY, position.z), width / 2,
                                 height / 2);
    }

    @Override
    public Point3f position() {
        return new Point3f(position);
    }

    /**
     * @return the transform taking a unit plane centred at the origin onto this tile
     */
    public Matrix4f transform() {
        var transform = new Matrix4f();
        transform.setIdentity();
        transform.m00 = width;
        transform.m11 = height;
        transform.setTranslation(new Vector3f(position));
        return transform;
    }
}
