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
 * Pre-cut tiles named {@code <prefix><index+1>_<layer+1>.<format>}.
 *
 * @author hal.hildebrand
 */
public class IndexedAddressScheme implements AddressScheme {

    private final List<String> prefixes;
    private final String       format;

    public IndexedAddressScheme(List<String> prefixes, String format) {
        this.prefixes = List.copyOf(prefixes);
        this.format = format;
    }

    @Override
    public String address(int nodeIndex, int layer) {
        return prefixes.get(layer) + (nodeIndex + 1) + "_" + (layer + 1) + "." + format;
    }
}
