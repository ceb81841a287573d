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

import org.junit.jupiter.api.Test;

import javax.vecmath.Matrix4f;
import javax.vecmath.Point3f;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for frustum extraction and sphere culling
 *
 * @author hal.hildebrand
 */
class Frustum3DTest {

    @Test
    void testIdentityFrustumIsUnitCube() {
        var identity = new Matrix4f();
        identity.setIdentity();
        var frustum = Frustum3D.fromViewProjection(identity);

        assertTrue(frustum.containsPoint(new Point3f(0, 0, 0)));
        assertTrue(frustum.containsPoint(new Point3f(0.99f, -0.99f, 0.5f)));
        assertFalse(frustum.containsPoint(new Point3f(1.01f, 0, 0)));
        assertFalse(frustum.containsPoint(new Point3f(0, -1.01f, 0)));
        assertFalse(frustum.containsPoint(new Point3f(0, 0, 1.5f)));
    }

    @Test
    void testPlanesAreNormalized() {
        var scaled = new Matrix4f();
        scaled.setIdentity();
        scaled.m00 = 4;
        scaled.m11 = 0.25f;
        var frustum = Frustum3D.fromViewProjection(scaled);

        for (var plane : frustum.getPlanes()) {
            assertEquals(1.0f, plane.getNormal().length(), 1e-5f);
        }
        // x in [-0.25, 0.25]
        assertEquals(0.0f, frustum.rightPlane.distanceToPoint(new Point3f(0.25f, 0, 0)), 1e-5f);
        assertEquals(0.0f, frustum.leftPlane.distanceToPoint(new Point3f(-0.25f, 0, 0)), 1e-5f);
    }

    @Test
    void testSphereIntersection() {
        var identity = new Matrix4f();
        identity.setIdentity();
        var frustum = Frustum3D.fromViewProjection(identity);

        assertTrue(frustum.intersectsSphere(new BoundingSphere(new Point3f(0, 0, 0), 0.1f)));
        // Outside, but overlapping the right plane
        assertTrue(frustum.intersectsSphere(new BoundingSphere(new Point3f(1.2f, 0, 0), 0.5f)));
        // Entirely beyond the right plane
        assertFalse(frustum.intersectsSphere(new BoundingSphere(new Point3f(2.0f, 0, 0), 0.5f)));
        // Enclosing the whole frustum
        assertTrue(frustum.intersectsSphere(new BoundingSphere(new Point3f(0, 0, 0), 100f)));
    }

    @Test
    void testRectangleSphere() {
        var sphere = BoundingSphere.ofRectangle(new Point3f(1, 2, 0), 6, 8);
        assertEquals(5.0f, sphere.radius(), 1e-6f);
        assertEquals(new Point3f(1, 2, 0), sphere.center());
    }

    @Test
    void testDegeneratePlaneRejected() {
        assertThrows(IllegalArgumentException.class, () -> Plane3D.fromCoefficients(0, 0, 0, 1));
    }
}
