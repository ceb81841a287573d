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
package com.hellblazer.lumen.camera;

import com.hellblazer.lumen.geometry.BoundingSphere;
import org.junit.jupiter.api.Test;

import javax.vecmath.Point3f;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for camera projection and frustum derivation
 *
 * @author hal.hildebrand
 */
class CameraTest {

    @Test
    void testOrthographicProjection() {
        var camera = new OrthographicCamera(-1, 1, -1, 1, 0.1f, 10);
        camera.setPosition(0, 0, 1);
        camera.lookAt(0, 0, 0);

        var projected = camera.project(new Point3f(0.5f, -0.25f, 0));
        assertEquals(0.5f, projected.x, 1e-5f);
        assertEquals(-0.25f, projected.y, 1e-5f);
    }

    @Test
    void testOrthographicFrustum() {
        var camera = new OrthographicCamera(-1, 1, -1, 1, 0.1f, 10);
        camera.setPosition(0, 0, 1);
        camera.lookAt(0, 0, 0);
        var frustum = camera.frustum();

        assertTrue(frustum.containsPoint(new Point3f(0, 0, 0)));
        assertTrue(frustum.intersectsSphere(new BoundingSphere(new Point3f(0.9f, 0.9f, 0), 0.01f)));
        assertFalse(frustum.intersectsSphere(new BoundingSphere(new Point3f(3, 0, 0), 1)));
        // Behind the camera
        assertFalse(frustum.containsPoint(new Point3f(0, 0, 2)));
    }

    @Test
    void testPerspectiveProjectionShrinksWithDistance() {
        var camera = new PerspectiveCamera(800, 800);
        camera.setPosition(0, 0, 5);
        camera.lookAt(0, 0, 0);
        var near = camera.project(new Point3f(1, 0, 0));

        camera.setPosition(0, 0, 10);
        var far = camera.project(new Point3f(1, 0, 0));

        assertTrue(near.x > 0);
        assertTrue(far.x > 0);
        assertEquals(near.x / 2, far.x, 1e-4f);
    }

    @Test
    void testPerspectiveFrustum() {
        var camera = new PerspectiveCamera(800, 600);
        camera.setPosition(0, 0, 5);
        camera.lookAt(0, 0, 0);
        var frustum = camera.frustum();

        assertTrue(frustum.containsPoint(new Point3f(0, 0, 0)));
        assertFalse(frustum.containsPoint(new Point3f(0, 0, 6)));
        assertFalse(frustum.intersectsSphere(new BoundingSphere(new Point3f(50, 0, 0), 1)));
        assertTrue(frustum.intersectsSphere(new BoundingSphere(new Point3f(2, 0, 0), 1)));
    }

    @Test
    void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new PerspectiveCamera(0, 600));
        assertThrows(IllegalArgumentException.class, () -> new OrthographicCamera(1, -1, -1, 1, 0.1f, 10));
        assertThrows(IllegalArgumentException.class, () -> new ScreenResolution(800, 0));
    }
}
