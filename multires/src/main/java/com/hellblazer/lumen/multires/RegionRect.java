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

import java.math.BigDecimal;

/**
 * Rectangle in base image pixels, origin at the upper left corner. Dimensions of deep levels may be fractional.
 *
 * @author hal.hildebrand
 */
public record RegionRect(double x, double y, double width, double height) {

    public RegionRect {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Region dimensions must be non-negative: " + width + "x" + height);
        }
    }

    /**
     * A content region of the given size centred in the base image
     */
    public static RegionRect centered(double contentWidth, double contentHeight, double maxWidth, double maxHeight) {
        return new RegionRect(maxWidth / 2 - contentWidth / 2, maxHeight / 2 - contentHeight / 2, contentWidth,
                              contentHeight);
    }

    /**
     * @return the quarter of this rectangle occupied by the given quadrant
     */
    public RegionRect quadrant(Quadrant quadrant) {
        double halfWidth = width / 2;
        double halfHeight = height / 2;
        return new RegionRect(x + quadrant.column() * halfWidth, y + quadrant.row() * halfHeight, halfWidth,
                              halfHeight);
    }

    public double maxX() {
        return x + width;
    }

    public double maxY() {
        return y + height;
    }

    /**
     * @return "x,y,w,h" with integral values printed without a fraction
     */
    public String toRequestString() {
        return format(x) + "," + format(y) + "," + format(width) + "," + format(height);
    }

    static String format(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
