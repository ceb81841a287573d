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

import javax.vecmath.Matrix4f;
import javax.vecmath.Point3f;

/**
 * Represents a 3D camera frustum defined by six planes. Plane normals point out of the frustum, so a point is inside
 * when it lies on the negative side of every plane.
 *
 * @author hal.hildebrand
 */
public class Frustum3D {

    public final Plane3D nearPlane;
    public final Plane3D farPlane;
    public final Plane3D leftPlane;
    public final Plane3D rightPlane;
    public final Plane3D topPlane;
    public final Plane3D bottomPlane;

    /**
     * Create a frustum from six planes
     *
     * @param nearPlane   near clipping plane
     * @param farPlane    far clipping plane
     * @param leftPlane   left clipping plane
     * @param rightPlane  right clipping plane
     * @param topPlane    top clipping plane
     * @param bottomPlane bottom clipping plane
     */
    public Frustum3D(Plane3D nearPlane, Plane3D farPlane, Plane3D leftPlane, Plane3D rightPlane, Plane3D topPlane,
                     Plane3D bottomPlane) {
        this.nearPlane = nearPlane;
        this.farPlane = farPlane;
        this.leftPlane = leftPlane;
        this.rightPlane = rightPlane;
        this.topPlane = topPlane;
        this.bottomPlane = bottomPlane;
    }

    /**
     * Extract the frustum of a combined projection * view matrix. The matrix maps world coordinates to clip space
     * using column vectors, as {@link Matrix4f#transform(javax.vecmath.Tuple4f)} does, and clip space is the OpenGL
     * cube [-w, w] on every axis.
     *
     * @param viewProjection projection matrix multiplied by the inverse world transform of the camera
     * @return the frustum bounding everything the matrix maps into clip space
     */
    public static Frustum3D fromViewProjection(Matrix4f viewProjection) {
        var m = viewProjection;
        // row3 + row_i bounds the negative side, row3 - row_i the positive side; negated for outward normals
        var left = Plane3D.fromCoefficients(-(m.m30 + m.m00), -(m.m31 + m.m01), -(m.m32 + m.m02), -(m.m33 + m.m03));
        var right = Plane3D.fromCoefficients(-(m.m30 - m.m00), -(m.m31 - m.m01), -(m.m32 - m.m02), -(m.m33 - m.m03));
        var bottom = Plane3D.fromCoefficients(-(m.m30 + m.m10), -(m.m31 + m.m11), -(m.m32 + m.m12),
                                              -(m.m33 + m.m13));
        var top = Plane3D.fromCoefficients(-(m.m30 - m.m10), -(m.m31 - m.m11), -(m.m32 - m.m12), -(m.m33 - m.m13));
        var near = Plane3D.fromCoefficients(-(m.m30 + m.m20), -(m.m31 + m.m21), -(m.m32 + m.m22), -(m.m33 + m.m23));
        var far = Plane3D.fromCoefficients(-(m.m30 - m.m20), -(m.m31 - m.m21), -(m.m32 - m.m22), -(m.m33 - m.m23));
        return new Frustum3D(near, far, left, right, top, bottom);
    }

    /**
     * Test if a point is inside the frustum
     *
     * @param point the point to test
     * @return true if point is inside the frustum
     */
    public boolean containsPoint(Point3f point) {
        for (var plane : getPlanes()) {
            if (plane.distanceToPoint(point) > 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * Get all six planes of the frustum
     *
     * @return array of the six frustum planes
     */
    public Plane3D[] getPlanes() {
        return new Plane3D[] { nearPlane, farPlane, leftPlane, rightPlane, topPlane, bottomPlane };
    }

    /**
     * Test if a sphere intersects the frustum. The test is conservative: a sphere is rejected only when it lies
     * entirely outside one of the planes, so spheres near the frustum corners may be reported as intersecting.
     *
     * @param sphere the sphere to test
     * @return true if the sphere may intersect the frustum
     */
    public boolean intersectsSphere(BoundingSphere sphere) {
        var center = sphere.center();
        for (var plane : getPlanes()) {
            if (plane.distanceToPoint(center) > sphere.radius()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return String.format("Frustum3D[near=%s, far=%s, left=%s, right=%s, top=%s, bottom=%s]", nearPlane, farPlane,
                             leftPlane, rightPlane, topPlane, bottomPlane);
    }
}
