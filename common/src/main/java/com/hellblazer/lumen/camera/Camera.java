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

import com.hellblazer.lumen.geometry.Frustum3D;

import javax.vecmath.Matrix4f;
import javax.vecmath.Point3f;
import javax.vecmath.Vector4f;

/**
 * A camera as seen by consumers that need to cull or size content against the current view: a projection, the
 * inverse world transform of the camera, and what can be derived from the two.
 *
 * @author hal.hildebrand
 */
public interface Camera {

    /**
     * @return the projection matrix, mapping eye space to clip space
     */
    Matrix4f getProjection();

    /**
     * @return the view matrix, the inverse of the camera's world transform
     */
    Matrix4f getView();

    /**
     * @return projection * view
     */
    default Matrix4f getViewProjection() {
        var viewProj = new Matrix4f();
        viewProj.mul(getProjection(), getView());
        return viewProj;
    }

    /**
     * Project a world space point into normalized device coordinates, where the visible volume spans [-1, 1] on
     * every axis.
     *
     * @param point world space point
     * @return the point after projection and perspective divide
     */
    default Point3f project(Point3f point) {
        var clip = new Vector4f(point.x, point.y, point.z, 1.0f);
        getViewProjection().transform(clip);
        return new Point3f(clip.x / clip.w, clip.y / clip.w, clip.z / clip.w);
    }

    /**
     * @return the view frustum for the camera's current projection and view
     */
    default Frustum3D frustum() {
        return Frustum3D.fromViewProjection(getViewProjection());
    }
}
