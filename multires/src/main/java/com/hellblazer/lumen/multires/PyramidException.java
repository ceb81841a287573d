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
 * Sealed exception hierarchy for tile pyramid failures.
 * <p>
 * Exception types:
 * <ul>
 * <li>{@link UnsupportedGeometryException} - the image asks for a geometry the pyramid cannot lay out</li>
 * <li>{@link LayerCountMismatchException} - the image description and the configuration disagree on layers</li>
 * <li>{@link LayerFetchException} - one layer of one tile could not be fetched</li>
 * </ul>
 * Construction failures are reported by {@link TilePyramid#create} as an empty result. Fetch failures are recorded
 * on the tile and never leave it.
 *
 * @author hal.hildebrand
 */
public sealed class PyramidException extends RuntimeException
    permits PyramidException.UnsupportedGeometryException, PyramidException.LayerCountMismatchException,
            PyramidException.LayerFetchException {

    public PyramidException(String message) {
        super(message);
    }

    public PyramidException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * The image geometry has no pyramid layout.
     */
    public static final class UnsupportedGeometryException extends PyramidException {
        private final GeometryType geometryType;

        public UnsupportedGeometryException(GeometryType geometryType) {
            super("Geometry type " + geometryType + " currently not supported");
            this.geometryType = geometryType;
        }

        public GeometryType getGeometryType() {
            return geometryType;
        }
    }

    /**
     * The image variant implies a different number of data layers than the configuration provides.
     */
    public static final class LayerCountMismatchException extends PyramidException {

        public LayerCountMismatchException(ImageVariant variant, int configured) {
            super(String.format("Image variant %s carries %d layers, configuration declares %d", variant,
                                variant.getLayerCount(), configured));
        }
    }

    /**
     * A single layer of a tile failed to load.
     */
    public static final class LayerFetchException extends PyramidException {
        private final String address;
        private final int    nodeIndex;
        private final int    layer;

        public LayerFetchException(String address, int nodeIndex, int layer, Throwable cause) {
            super(String.format("Unable to load layer %d of node %d from %s", layer, nodeIndex, address), cause);
            this.address = address;
            this.nodeIndex = nodeIndex;
            this.layer = layer;
        }

        public String getAddress() {
            return address;
        }

        public int getNodeIndex() {
            return nodeIndex;
        }

        public int getLayer() {
            return layer;
        }
    }
}
