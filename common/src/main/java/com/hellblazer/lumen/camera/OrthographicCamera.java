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
 * Orthographic camera. The view volume is a box given in eye space.
 *
 * @author hal.hildebrand
 */
public class OrthographicCamera extends AbstractCamera {

    /**
     * @param left   left boundary, must be less than right
     * @param right  right boundary
     * @param bottom bottom boundary, must be less than top
     * @param top    top boundary
     * @param zNear  distance to the near plane
     * @param zFar   distance to the far plane, must be greater than near
     */
    public OrthographicCamera(float left, float right, float bottom, float top, float zNear, float zFar) {
        setBounds(left, right, bottom, top, zNear, zFar);
    }

    public void setBounds(float left, float right, float bottom, float top, float zNear, float zFar) {
        if (left >= right || bottom >= top || zNear >= zFar) {
            throw new IllegalArgumentException(
            String.format("Invalid orthographic bounds l=%f r=%f b=%f t=%f n=%f f=%f", left, right, bottom, top,
                          zNear, zFar));
        }
        projMatrix.setIdentity();
        projMatrix.m00 = 2 / (right - left);
        projMatrix.m03 = -(right + left) / (right - left);
        projMatrix.m11 = 2 / (top - bottom);
        projMatrix.m13 = -(top + bottom) / (top - bottom);
        projMatrix.m22 = -2 / (zFar - zNear);
        projMatrix.m23 = -(zFar + zNear) / (zFar - zNear);
    }
}
