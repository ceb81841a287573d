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
package com.hellblazer.lumen.geometry;

import javax.vecmath.Point3f;

/**
 * Bounding sphere used as the culling volume of a tile
 *
 * @author hal.hildebrand
 */
public record BoundingSphere(Point3f center, float radius) {

    public BoundingSphere {
        if (radius < 0) {
            throw new IllegalArgumentException("Radius must be non-negative: " + radius);
        }
        center = new Point3f(center);
    }

    /**
     * Bounding sphere of an axis aligned rectangle lying in a plane of constant z
     *
     * @param center center of the rectangle
     * @param width  extent along x
     * @param height extent along y
     * @return sphere through the rectangle's corners
     */
    public static BoundingSphere ofRectangle(Point3f center, float width, float height) {
        float halfWidth = width / 2;
        float halfHeight = height / 2;
        return new BoundingSphere(center, (float) Math.sqrt(halfWidth * halfWidth + halfHeight * halfHeight));
    }

    @Override
    public Point3f center() {
        return new Point3f(center);
    }
}
