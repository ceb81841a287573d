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
import javax.vecmath.Vector3f;

/**
 * Represents a 3D plane using the equation ax + by + cz + d = 0. The normal (a, b, c) is kept at unit length, so
 * {@link #distanceToPoint(Point3f)} is a true signed distance.
 *
 * @author hal.hildebrand
 */
public record Plane3D(float a, float b, float c, float d) {

    /**
     * Create a plane from raw coefficients, normalizing so that the normal has unit length
     *
     * @param a x coefficient
     * @param b y coefficient
     * @param c z coefficient
     * @param d constant term
     * @return the normalized plane
     * @throws IllegalArgumentException if the normal is degenerate
     */
    public static Plane3D fromCoefficients(float a, float b, float c, float d) {
        float length = (float) Math.sqrt(a * a + b * b + c * c);
        if (length < 1e-12f) {
            throw new IllegalArgumentException("Normal vector cannot be zero");
        }
        return new Plane3D(a / length, b / length, c / length, d / length);
    }

    /**
     * Calculate the signed distance from a point to this plane. Positive distance means the point is on the side of
     * the plane the normal points to.
     *
     * @param point the point to test
     * @return signed distance from point to plane
     */
    public float distanceToPoint(Point3f point) {
        return a * point.x + b * point.y + c * point.z + d;
    }

    public Vector3f getNormal() {
        return new Vector3f(a, b, c);
    }
}
