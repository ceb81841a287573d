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

import java.util.List;

/**
 * IIIF style image requests: {@code <prefix>/<x,y,w,h>/<edge,edge>/0/default.<format>}, where the region is the
 * absolute pixel rectangle of the tile in the base image.
 *
 * @author hal.hildebrand
 */
public class RegionAddressScheme implements AddressScheme {

    private final List<String> prefixes;
    private final String       format;
    private final String       size;
    private final RegionRect[] regions;

    /**
     * @param prefixes one prefix per layer
     * @param format   file extension
     * @param tileEdge edge of the requested tile
     * @param regions  pixel rectangle of every node, by index
     */
    public RegionAddressScheme(List<String> prefixes, String format, int tileEdge, RegionRect[] regions) {
        this.prefixes = List.copyOf(prefixes);
        this.format = format;
        this.size = tileEdge + "," + tileEdge;
        this.regions = regions.clone();
    }

    @Override
    public String address(int nodeIndex, int layer) {
        return prefixes.get(layer) + "/" + regions[nodeIndex].toRequestString() + "/" + size + "/0/default." + format;
    }

    public RegionRect region(int nodeIndex) {
        return regions[nodeIndex];
    }
}
