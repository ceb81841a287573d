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

import org.junit.jupiter.api.Test;

import javax.vecmath.Point3f;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
class TilePlacementTest {

    @Test
    void testChildQuadrants() {
        var root = new TilePlacement(new Point3f(0, 0, 0), 1, 1);

        var upperRight = root.child(Quadrant.UPPER_RIGHT);
        assertEquals(new Point3f(0.25f, 0.25f, 0), upperRight.position());
        assertEquals(0.5f, upperRight.width());
        assertEquals(new Point3f(-0.25f, -0.25f, 0), root.child(Quadrant.LOWER_LEFT).position());
        assertEquals(new Point3f(0.375f, 0.125f, 0), upperRight.child(Quadrant.LOWER_RIGHT).position());
    }

    @Test
    void testTransformMapsUnitPlaneOntoTile() {
        var placement = new TilePlacement(new Point3f(0, 0, 0), 1, 1).child(Quadrant.UPPER_RIGHT)
                                                                      .child(Quadrant.UPPER_RIGHT);
        var transform = placement.transform();

        var center = new Point3f(0, 0, 0);
        transform.transform(center);
        assertEquals(0.375f, center.x, 1e-6f);
        assertEquals(0.375f, center.y, 1e-6f);

        var upperRight = new Point3f(0.5f, 0.5f, 0);
        transform.transform(upperRight);
        assertEquals(0.5f, upperRight.x, 1e-6f);
        assertEquals(0.5f, upperRight.y, 1e-6f);

        var lowerLeft = new Point3f(-0.5f, -0.5f, 0);
        transform.transform(lowerLeft);
        assertEquals(0.25f, lowerLeft.x, 1e-6f);
        assertEquals(0.25f, lowerLeft.y, 1e-6f);
        assertEquals(0f, lowerLeft.z);
    }

    @Test
    void testExtentMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new TilePlacement(new Point3f(), 0, 1));
    }
}
