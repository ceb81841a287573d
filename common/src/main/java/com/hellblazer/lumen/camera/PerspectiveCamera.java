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

/**
 * Perspective camera for a viewport.
 *
 * @author hal.hildebrand
 */
public class PerspectiveCamera extends AbstractCamera {

    private static final float FOV    = 45.0f;
    private static final float Z_NEAR = 0.1f;
    private static final float Z_FAR  = 1000.0f;

    private final float fov;
    private final float zNear;
    private final float zFar;
    private       float aspect;

    /**
     * Create a camera for a viewport.
     *
     * @param width  Viewport width
     * @param height Viewport height
     */
    public PerspectiveCamera(int width, int height) {
        this(width, height, FOV, Z_NEAR, Z_FAR);
    }

    /**
     * @param width  Viewport width
     * @param height Viewport height
     * @param fov    vertical field of view in degrees
     * @param zNear  distance to the near plane
     * @param zFar   distance to the far plane
     */
    public PerspectiveCamera(int width, int height, float fov, float zNear, float zFar) {
        if (fov <= 0 || fov >= 180) {
            throw new IllegalArgumentException("Field of view must be in (0, 180): " + fov);
        }
        if (zNear <= 0 || zFar <= zNear) {
            throw new IllegalArgumentException("Require 0 < near < far, got near=" + zNear + " far=" + zFar);
        }
        this.fov = fov;
        this.zNear = zNear;
        this.zFar = zFar;
        resize(width, height);
    }

    /**
     * Adapt the projection to a new viewport size.
     */
    public void resize(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Viewport must be positive: " + width + "x" + height);
        }
        aspect = (float) width / height;
        updateProjection();
    }

    private void updateProjection() {
        float fovRad = (float) Math.toRadians(fov);
        float f = (float) (1.0 / Math.tan(fovRad / 2.0));

        projMatrix.setZero();
        projMatrix.m00 = f / aspect;
        projMatrix.m11 = f;
        projMatrix.m22 = (zFar + zNear) / (zNear - zFar);
        projMatrix.m23 = (2 * zFar * zNear) / (zNear - zFar);
        projMatrix.m32 = -1;
    }
}
