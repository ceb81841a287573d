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

import java.util.Locale;

/**
 * Reflectance image variants and the number of data layers each tile of them carries
 *
 * @author hal.hildebrand
 */
public enum ImageVariant {
    /** Luminance PTM with RGB colour: two coefficient layers and a colour layer */
    LRGB_PTM(3),
    /** Luminance PTM with RGB colour and a specular green layer */
    LRGBG_PTM(4);

    private final int layerCount;

    ImageVariant(int layerCount) {
        this.layerCount = layerCount;
    }

    /**
     * @param identifier variant name as published in image metadata, e.g. "LRGB_PTM"
     * @return the variant
     * @throws IllegalArgumentException for unknown variants
     */
    public static ImageVariant of(String identifier) {
        try {
            return valueOf(identifier.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported image variant: " + identifier, e);
        }
    }

    public int getLayerCount() {
        return layerCount;
    }
}
