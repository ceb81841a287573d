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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Tiling of one image as published by the image description: base resolution, content region, tile size, layers
 * and where the layer resources live.
 *
 * @param maxWidth         width of the base image in pixels
 * @param maxHeight        height of the base image in pixels
 * @param contentRegion    part of the base image carrying data
 * @param tileEdge         edge of the square tiles in pixels
 * @param layerCount       data layers per tile
 * @param tilingStrategy   naming scheme of tile resources
 * @param imageFormat      file extension of tile resources, without the dot
 * @param resourcePrefixes one resource prefix per layer
 * @author hal.hildebrand
 */
public record PyramidConfig(int maxWidth, int maxHeight, RegionRect contentRegion, int tileEdge, int layerCount,
                            TilingStrategy tilingStrategy, String imageFormat, List<String> resourcePrefixes) {

    public PyramidConfig {
        if (maxWidth <= 0 || maxHeight <= 0) {
            throw new IllegalArgumentException("Base resolution must be positive: " + maxWidth + "x" + maxHeight);
        }
        if (tileEdge <= 0) {
            throw new IllegalArgumentException("Tile edge must be positive: " + tileEdge);
        }
        if (layerCount <= 0) {
            throw new IllegalArgumentException("Layer count must be positive: " + layerCount);
        }
        Objects.requireNonNull(contentRegion, "contentRegion");
        Objects.requireNonNull(tilingStrategy, "tilingStrategy");
        if (imageFormat == null || imageFormat.isBlank()) {
            throw new IllegalArgumentException("Image format is required");
        }
        resourcePrefixes = List.copyOf(resourcePrefixes);
        if (resourcePrefixes.size() < layerCount) {
            throw new IllegalArgumentException(
            String.format("Need a resource prefix per layer: %d layers, %d prefixes", layerCount,
                          resourcePrefixes.size()));
        }
        int levels = QuadtreeIndex.levelCount(tileEdge, maxWidth);
        if (levels > QuadtreeIndex.MAX_LEVELS) {
            throw new IllegalArgumentException(
            String.format("Base width %d needs more than %d levels of %d pixel tiles", maxWidth,
                          QuadtreeIndex.MAX_LEVELS, tileEdge));
        }
        // finest level resolution must fit an int
        if ((long) tileEdge << (levels - 1) > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(
            String.format("Finest level of %d pixel tiles over base width %d exceeds %d pixels", tileEdge, maxWidth,
                          Integer.MAX_VALUE));
        }
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static class Builder {
        private int            maxWidth;
        private int            maxHeight;
        private RegionRect     contentRegion;
        private double         contentWidth     = -1;
        private double         contentHeight    = -1;
        private int            tileEdge         = 256;
        private int            layerCount;
        private TilingStrategy tilingStrategy   = TilingStrategy.INDEXED;
        private String         imageFormat      = "jpg";
        private List<String>   resourcePrefixes = new ArrayList<>();

        public Builder setMaxResolution(int width, int height) {
            this.maxWidth = width;
            this.maxHeight = height;
            return this;
        }

        /**
         * Content region as an explicit rectangle of base image pixels
         */
        public Builder setContentRegion(RegionRect contentRegion) {
            this.contentRegion = contentRegion;
            return this;
        }

        /**
         * Content of the given size centred in the base image. Ignored if an explicit region is set.
         */
        public Builder setContentSize(double width, double height) {
            this.contentWidth = width;
            this.contentHeight = height;
            return this;
        }

        public Builder setTileEdge(int tileEdge) {
            this.tileEdge = tileEdge;
            return this;
        }

        public Builder setLayerCount(int layerCount) {
            this.layerCount = layerCount;
            return this;
        }

        public Builder setVariant(ImageVariant variant) {
            this.layerCount = variant.getLayerCount();
            return this;
        }

        public Builder setTilingStrategy(TilingStrategy tilingStrategy) {
            this.tilingStrategy = tilingStrategy;
            return this;
        }

        public Builder setImageFormat(String imageFormat) {
            this.imageFormat = imageFormat;
            return this;
        }

        public Builder setResourcePrefixes(List<String> resourcePrefixes) {
            this.resourcePrefixes = new ArrayList<>(resourcePrefixes);
            return this;
        }

        public Builder addResourcePrefix(String prefix) {
            resourcePrefixes.add(prefix);
            return this;
        }

        public PyramidConfig build() {
            var region = contentRegion;
            if (region == null) {
                region = contentWidth < 0 ? new RegionRect(0, 0, maxWidth, maxHeight)
                                          : RegionRect.centered(contentWidth, contentHeight, maxWidth, maxHeight);
            }
            return new PyramidConfig(maxWidth, maxHeight, region, tileEdge, layerCount, tilingStrategy, imageFormat,
                                     resourcePrefixes);
        }
    }
}
