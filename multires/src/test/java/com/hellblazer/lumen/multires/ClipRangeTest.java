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

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for content limits, quadrants and pixel regions of child tiles
 *
 * @author hal.hildebrand
 */
class ClipRangeTest {

    @Test
    void testChildRangesReassembleToParent() {
        var parents = new ClipRange[] { new ClipRange(0.1, 0.9), new ClipRange(0.45, 0.8), new ClipRange(0, 1),
                                        new ClipRange(-0.3, 0.2) };
        for (var parent : parents) {
            for (var quadrant : Quadrant.values()) {
                var x = parent.forChild(quadrant.shiftX());
                var y = parent.forChild(quadrant.shiftY());
                assertEquals(parent.min(), (x.min() + quadrant.shiftX()) / 2, 1e-12);
                assertEquals(parent.max(), (x.max() + quadrant.shiftX()) / 2, 1e-12);
                assertEquals(parent.min(), (y.min() + quadrant.shiftY()) / 2, 1e-12);
                assertEquals(parent.max(), (y.max() + quadrant.shiftY()) / 2, 1e-12);
            }
        }
    }

    @Test
    void testClampAndOutside() {
        var range = new ClipRange(0.2, 0.9).forChild(1);
        assertEquals(-0.6, range.min(), 1e-12);
        assertEquals(0.8, range.max(), 1e-12);
        assertFalse(range.outsideUnit());
        assertEquals(0, range.clamped().min());
        assertEquals(0.8, range.clamped().max(), 1e-12);

        var outside = new ClipRange(0.1, 0.4).forChild(1);
        assertTrue(outside.outsideUnit());
        assertEquals(new ClipRange(0, 0), outside.clamped());
        assertTrue(new ClipRange(0.6, 0.9).forChild(0).outsideUnit());
    }

    @Test
    void testQuadrantOfIndex() {
        assertEquals(Quadrant.UPPER_LEFT, Quadrant.of(1));
        assertEquals(Quadrant.UPPER_RIGHT, Quadrant.of(2));
        assertEquals(Quadrant.LOWER_LEFT, Quadrant.of(3));
        assertEquals(Quadrant.LOWER_RIGHT, Quadrant.of(4));
        assertEquals(Quadrant.UPPER_LEFT, Quadrant.of(5));
        assertThrows(IllegalArgumentException.class, () -> Quadrant.of(0));
    }

    @Test
    void testRegionQuadrants() {
        var root = new RegionRect(0, 0, 1000, 800);
        assertEquals(new RegionRect(0, 0, 500, 400), root.quadrant(Quadrant.UPPER_LEFT));
        assertEquals(new RegionRect(500, 0, 500, 400), root.quadrant(Quadrant.UPPER_RIGHT));
        assertEquals(new RegionRect(0, 400, 500, 400), root.quadrant(Quadrant.LOWER_LEFT));
        assertEquals(new RegionRect(500, 400, 500, 400), root.quadrant(Quadrant.LOWER_RIGHT));
    }

    @Test
    void testRegionRequestString() {
        assertEquals("0,0,1024,1024", new RegionRect(0, 0, 1024, 1024).toRequestString());
        assertEquals("937.5,0,62.5,62.5", new RegionRect(937.5, 0, 62.5, 62.5).toRequestString());
    }

    @Test
    void testCenteredRegion() {
        var region = RegionRect.centered(800, 600, 1024, 1024);
        assertEquals(112, region.x(), 1e-12);
        assertEquals(212, region.y(), 1e-12);
        assertEquals(912, region.maxX(), 1e-12);
        assertEquals(812, region.maxY(), 1e-12);
    }
}
