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

/**
 * How tile resources are named on the server
 *
 * @author hal.hildebrand
 */
public enum TilingStrategy {
    /** One pre-cut file per node and layer, named by index */
    INDEXED,
    /** IIIF style region requests carrying absolute pixel rectangles */
    REGION_REQUEST;

    /**
     * @param identifier strategy name from the image metadata
     * @return {@link #REGION_REQUEST} for "IIIF", {@link #INDEXED} for anything else
     */
    public static TilingStrategy of(String identifier) {
        return identifier != null && identifier.trim().equalsIgnoreCase("IIIF") ? REGION_REQUEST : INDEXED;
    }
}
