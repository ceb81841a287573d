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

import javax.vecmath.Matrix4f;
import javax.vecmath.Vector3f;

/**
 * Positioned camera looking at a target point. Subclasses supply the projection.
 *
 * @author hal.hildebrand
 */
public abstract class AbstractCamera implements Camera {

    protected final Matrix4f projMatrix = new Matrix4f();

    private final Vector3f position = new Vector3f(0, 0, 1);
    private final Vector3f target   = new Vector3f(0, 0, 0);
    private final Vector3f up       = new Vector3f(0, 1, 0);

    private final Matrix4f viewMatrix = new Matrix4f();
    private       boolean  dirty      = true;

    /**
     * Set camera position.
     *
     * @param x X coordinate
     * @param y Y coordinate
     * @param z Z coordinate
     */
    public void setPosition(float x, float y, float z) {
        position.set(x, y, z);
        dirty = true;
    }

    /**
     * Look at a target point.
     *
     * @param x Target X
     * @param y Target Y
     * @param z Target Z
     */
    public void lookAt(float x, float y, float z) {
        target.set(x, y, z);
        dirty = true;
    }

    public void setUp(float x, float y, float z) {
        up.set(x, y, z);
        dirty = true;
    }

    @Override
    public Matrix4f getProjection() {
        return new Matrix4f(projMatrix);
    }

    @Override
    public Matrix4f getView() {
        if (dirty) {
            computeLookAt(position, target, up, viewMatrix);
            dirty = false;
        }
        return new Matrix4f(viewMatrix);
    }

    /**
     * Compute look-at matrix (camera transformation).
     */
    private static void computeLookAt(Vector3f eye, Vector3f center, Vector3f up, Matrix4f result) {
        Vector3f f = new Vector3f(center);
        f.sub(eye);
        f.normalize();

        Vector3f s = new Vector3f();
        s.cross(f, up);
        s.normalize();

        Vector3f u = new Vector3f();
        u.cross(s, f);

        result.setIdentity();
        result.m00 = s.x;
        result.m01 = s.y;
        result.m02 = s.z;
        result.m10 = u.x;
        result.m11 = u.y;
        result.m12 = u.z;
        result.m20 = -f.x;
        result.m21 = -f.y;
        result.m22 = -f.z;

        result.m03 = -s.dot(eye);
        result.m13 = -u.dot(eye);
        result.m23 = f.dot(eye);
    }
}
