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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;

/**
 * Viewer side settings of the pyramid, independent of any particular image.
 * <p>
 * Loaded from the classpath resource {@value #RESOURCE}; missing keys take their defaults.
 *
 * @param sceneScale          edge length of the root tile in scene units
 * @param showBoundingSpheres expose each tile's culling sphere for debug drawing
 * @param cacheTextures       share fetched layer data between requests until the pyramid is disposed
 * @author hal.hildebrand
 */
public record PyramidSettings(float sceneScale, boolean showBoundingSpheres, boolean cacheTextures) {

    public static final  String       RESOURCE            = "/lumen-multires.json";
    public static final  float        DEFAULT_SCENE_SCALE = 7.5f;
    private static final Logger       log                 = LoggerFactory.getLogger(PyramidSettings.class);
    private static final ObjectMapper objectMapper        = new ObjectMapper();

    public PyramidSettings {
        if (!(sceneScale > 0) || Float.isInfinite(sceneScale)) {
            throw new IllegalArgumentException("Scene scale must be positive: " + sceneScale);
        }
    }

    public static PyramidSettings defaults() {
        return new PyramidSettings(DEFAULT_SCENE_SCALE, false, true);
    }

    /**
     * Load settings from the classpath, falling back to {@link #defaults()} if the resource is absent or unreadable
     */
    public static PyramidSettings load() {
        try (var is = PyramidSettings.class.getResourceAsStream(RESOURCE)) {
            if (is == null) {
                log.debug("Settings resource not found: {}, using defaults", RESOURCE);
                return defaults();
            }
            var settings = load(is);
            log.info("Loaded pyramid settings: {}", settings);
            return settings;
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Failed to load pyramid settings {}: {}", RESOURCE, e.getMessage());
            return defaults();
        }
    }

    /**
     * Parse settings from a JSON document
     *
     * @throws IOException if the document is not valid JSON
     */
    public static PyramidSettings load(InputStream is) throws IOException {
        var root = objectMapper.readTree(is);
        if (root == null || !root.isObject()) {
            throw new IOException("Settings must be a JSON object");
        }
        var defaults = defaults();
        return new PyramidSettings(floatOr(root.get("sceneScale"), defaults.sceneScale()),
                                   boolOr(root.get("showBoundingSpheres"), defaults.showBoundingSpheres()),
                                   boolOr(root.get("cacheTextures"), defaults.cacheTextures()));
    }

    public PyramidSettings withSceneScale(float sceneScale) {
        return new PyramidSettings(sceneScale, showBoundingSpheres, cacheTextures);
    }

    public PyramidSettings withShowBoundingSpheres(boolean showBoundingSpheres) {
        return new PyramidSettings(sceneScale, showBoundingSpheres, cacheTextures);
    }

    public PyramidSettings withCacheTextures(boolean cacheTextures) {
        return new PyramidSettings(sceneScale, showBoundingSpheres, cacheTextures);
    }

    private static float floatOr(JsonNode node, float fallback) {
        return node == null || !node.isNumber() ? fallback : (float) node.asDouble();
    }

    private static boolean boolOr(JsonNode node, boolean fallback) {
        return node == null || !node.isBoolean() ? fallback : node.asBoolean();
    }
}
