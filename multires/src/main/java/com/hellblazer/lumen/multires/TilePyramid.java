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

import com.hellblazer.lumen.camera.Camera;
import com.hellblazer.lumen.camera.ScreenResolution;
import com.hellblazer.lumen.geometry.Frustum3D;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point3f;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * A pyramid of progressively finer tilings of one image, stored as a complete quadtree in a flat array.
 * <p>
 * Level 0 is a single tile covering the whole image; level {@code i} has {@code 4^i} tiles and a total resolution of
 * {@code tileEdge * 2^i} pixels per axis. Parent and child relations are array indices, see {@link QuadtreeIndex}.
 * <p>
 * The pyramid answers two questions per viewport. {@link #requestTextures} starts fetching the visible tiles of the
 * level that matches the projected size of the image on screen. {@link #getAvailableTiles} returns the finest set of
 * visible tiles that has finished loading, walking towards the root while finer tiles are still in flight. Neither
 * call blocks. The root is requested on creation so there is always something to fall back to.
 * <p>
 * Both operations, and {@link #dispose()}, belong to a single control thread. Layer completions are handled on the
 * completion executor given at creation and only touch the state of their own tile.
 *
 * @param <T> texture data type
 * @author hal.hildebrand
 */
public class TilePyramid<T> {
    private static final Logger log = LoggerFactory.getLogger(TilePyramid.class);

    private final    PyramidConfig     config;
    private final    int               levelCount;
    private final    int[]             levelResolutions;
    private final    List<TileNode<T>> nodes;
    private final    AddressScheme     addresses;
    private final    TileFetcher<T>    fetcher;
    private final    Executor          completions;
    private final    TileLoadListener  listener;
    private final    Point3f           upperLeft;
    private final    Point3f           lowerRight;
    private volatile boolean           disposed;

    private TilePyramid(PyramidConfig config, ImageDescription description, TileFetcher<T> fetcher,
                        Executor completions, PyramidSettings settings, TileLoadListener listener) {
        if (description.geometryType() != GeometryType.PLANE) {
            throw new PyramidException.UnsupportedGeometryException(description.geometryType());
        }
        if (description.layerCount() != config.layerCount()) {
            throw new PyramidException.LayerCountMismatchException(description.variant(), config.layerCount());
        }
        this.config = config;
        this.completions = completions;
        this.listener = listener;
        this.fetcher = settings.cacheTextures() && !(fetcher instanceof CachingTileFetcher)
                       ? new CachingTileFetcher<>(fetcher) : fetcher;

        levelCount = QuadtreeIndex.levelCount(config.tileEdge(), config.maxWidth());
        levelResolutions = new int[levelCount];
        for (int level = 0; level < levelCount; level++) {
            levelResolutions[level] = config.tileEdge() << level;
        }

        var nodeCount = QuadtreeIndex.nodeCount(levelCount);
        var regions = config.tilingStrategy() == TilingStrategy.REGION_REQUEST ? new RegionRect[nodeCount] : null;
        nodes = new ArrayList<>(nodeCount);
        buildNodes(settings, regions);

        addresses = regions == null ? new IndexedAddressScheme(config.resourcePrefixes(), config.imageFormat())
                                    : new RegionAddressScheme(config.resourcePrefixes(), config.imageFormat(),
                                                              config.tileEdge(), regions);

        float half = settings.sceneScale() / 2;
        var center = nodes.get(0).getPlacement().position();
        upperLeft = new Point3f(center.x - half, center.y + half, center.z);
        lowerRight = new Point3f(center.x + half, center.y - half, center.z);

        log.info("Created pyramid: {}x{} px, {} px tiles, {} levels, {} nodes, {} layers, {} addressing",
                 config.maxWidth(), config.maxHeight(), config.tileEdge(), levelCount, nodeCount,
                 config.layerCount(), config.tilingStrategy());
    }

    /**
     * Build the pyramid for an image and request its root tile.
     *
     * @return the pyramid, or empty if the image cannot be tiled; the reason is logged
     */
    public static <T> Optional<TilePyramid<T>> create(PyramidConfig config, ImageDescription description,
                                                      TileFetcher<T> fetcher, PyramidSettings settings) {
        return create(config, description, fetcher, Runnable::run, settings, (index, success) -> {
        });
    }

    /**
     * Build the pyramid for an image and request its root tile.
     *
     * @param config      tiling of the image
     * @param description content of the image
     * @param fetcher     source of layer data
     * @param completions executor fetch completions are handled on, normally the control thread's
     * @param settings    viewer settings
     * @param listener    notified as each requested tile finishes loading
     * @return the pyramid, or empty if the image cannot be tiled; the reason is logged
     */
    public static <T> Optional<TilePyramid<T>> create(PyramidConfig config, ImageDescription description,
                                                      TileFetcher<T> fetcher, Executor completions,
                                                      PyramidSettings settings, TileLoadListener listener) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(fetcher, "fetcher");
        Objects.requireNonNull(completions, "completions");
        Objects.requireNonNull(settings, "settings");
        Objects.requireNonNull(listener, "listener");
        TilePyramid<T> pyramid;
        try {
            pyramid = new TilePyramid<>(config, description, fetcher, completions, settings, listener);
        } catch (PyramidException.UnsupportedGeometryException | PyramidException.LayerCountMismatchException e) {
            log.error("Unable to create tile pyramid: {}", e.getMessage());
            return Optional.empty();
        }
        pyramid.requestRoot();
        return Optional.of(pyramid);
    }

    /**
     * Start fetching every visible tile of the level the viewport needs. Tiles already requested or loaded are left
     * alone.
     *
     * @param screen size of the drawing surface
     * @param camera current camera
     */
    public void requestTextures(ScreenResolution screen, Camera camera) {
        checkNotDisposed();
        int level = getRequiredLevel(screen, camera);
        var visible = visibleNodes(level, camera.frustum());
        int issued = 0;
        for (var node : visible) {
            if (node.requestTextures(addresses, fetcher, completions, this::loadResponse)) {
                issued++;
            }
        }
        log.debug("Required level {}: {} visible tiles, {} newly requested", level, visible.size(), issued);
    }

    /**
     * The finest fully loaded set of visible tiles, starting at the level the viewport needs and falling back one
     * level at a time towards the root. A level qualifies once every visible tile on it has settled, whether it
     * loaded, failed or has no content. Tiles that failed are left out; in their place the closest loaded ancestor is
     * returned, ahead of the level's own tiles, so the renderer can draw it underneath. Never issues a fetch.
     *
     * @param screen size of the drawing surface
     * @param camera current camera
     * @return tiles to draw, empty only if not even the root has loaded
     */
    public List<TileHandle<T>> getAvailableTiles(ScreenResolution screen, Camera camera) {
        checkNotDisposed();
        var frustum = camera.frustum();
        for (int level = getRequiredLevel(screen, camera); level >= 0; level--) {
            var visible = visibleNodes(level, frustum);
            if (visible.stream().allMatch(TileNode::isLoaded)) {
                return renderable(visible);
            }
        }
        return Collections.emptyList();
    }

    /**
     * The lowest level whose resolution covers the number of screen pixels the image currently spans. The span is
     * estimated by projecting the upper left and lower right corners of the image plane.
     *
     * @param screen size of the drawing surface
     * @param camera current camera
     * @return level in [0, levelCount)
     */
    public int getRequiredLevel(ScreenResolution screen, Camera camera) {
        var ul = camera.project(upperLeft);
        var lr = camera.project(lowerRight);
        double requiredX = screen.width() * Math.abs(lr.x - ul.x) / 2;
        double requiredY = screen.height() * Math.abs(lr.y - ul.y) / 2;
        if (!Double.isFinite(requiredX) || !Double.isFinite(requiredY)) {
            return 0;
        }
        for (int level = 0; level < levelCount; level++) {
            if (levelResolutions[level] >= requiredX && levelResolutions[level] >= requiredY) {
                return level;
            }
        }
        return levelCount - 1;
    }

    /**
     * Re-assemble the surfaces of all loaded tiles after the renderer rebuilt its materials, and drop cached fetches.
     *
     * @return number of surfaces rebuilt
     */
    public int rebuildSurfaces() {
        checkNotDisposed();
        fetcher.clearCache();
        int rebuilt = 0;
        for (var node : nodes) {
            if (node.rebuildSurface()) {
                rebuilt++;
            }
        }
        log.debug("Rebuilt {} tile surfaces", rebuilt);
        return rebuilt;
    }

    /**
     * Release every tile and the cached fetches. Fetches still in flight complete into disposed tiles and are
     * discarded. The pyramid cannot be used afterwards.
     */
    public void dispose() {
        if (disposed) {
            return;
        }
        disposed = true;
        int count = nodes.size();
        for (var node : nodes) {
            node.dispose();
        }
        nodes.clear();
        fetcher.clearCache();
        log.info("Disposed pyramid of {} nodes", count);
    }

    public boolean isDisposed() {
        return disposed;
    }

    public PyramidConfig getConfig() {
        return config;
    }

    public int getLevelCount() {
        return levelCount;
    }

    public int getNodeCount() {
        return nodes.size();
    }

    public TileNode<T> getNode(int index) {
        return nodes.get(index);
    }

    public TileNode<T> getRoot() {
        return nodes.get(0);
    }

    public int getLevelStart(int level) {
        Objects.checkIndex(level, levelCount);
        return QuadtreeIndex.levelStart(level);
    }

    /**
     * @return total resolution of a level along each axis, in pixels
     */
    public int getLevelResolution(int level) {
        return levelResolutions[level];
    }

    public Point3f getCenter() {
        return getRoot().getPlacement().position();
    }

    public AddressScheme getAddressScheme() {
        return addresses;
    }

    /**
     * @return the tiles of a level whose bounding sphere intersects the frustum
     */
    public List<TileNode<T>> visibleNodes(int level, Frustum3D frustum) {
        int start = getLevelStart(level);
        int end = start + QuadtreeIndex.nodesOnLevel(level);
        var visible = new ArrayList<TileNode<T>>();
        for (int index = start; index < end; index++) {
            var node = nodes.get(index);
            if (frustum.intersectsSphere(node.getBoundingSphere())) {
                visible.add(node);
            }
        }
        return visible;
    }

    private void buildNodes(PyramidSettings settings, RegionRect[] regions) {
        var content = config.contentRegion();
        var rootX = new ClipRange(content.x() / config.maxWidth(), content.maxX() / config.maxWidth());
        // texture y runs bottom up, pixel rows top down
        var rootY = new ClipRange(1 - content.maxY() / config.maxHeight(), 1 - content.y() / config.maxHeight());
        float scale = settings.sceneScale();

        int index = 0;
        for (int level = 0; level < levelCount; level++) {
            int count = QuadtreeIndex.nodesOnLevel(level);
            for (int i = 0; i < count; i++, index++) {
                var children = new int[] { -1, -1, -1, -1 };
                if (level < levelCount - 1) {
                    for (int slot = 0; slot < 4; slot++) {
                        children[slot] = QuadtreeIndex.childOf(index, slot);
                    }
                }

                TileNode<T> node;
                if (index == 0) {
                    var placement = new TilePlacement(new Point3f(0, 0, 0), scale, scale);
                    node = new TileNode<>(index, level, config.layerCount(), children, placement, rootX.clamped(),
                                          rootY.clamped(), !rootX.outsideUnit() && !rootY.outsideUnit(),
                                          settings.showBoundingSpheres());
                    if (regions != null) {
                        regions[index] = new RegionRect(0, 0, config.maxWidth(), config.maxHeight());
                    }
                } else {
                    var parent = nodes.get(QuadtreeIndex.parentOf(index));
                    var quadrant = Quadrant.of(index);
                    var xRange = parent.getXRange().forChild(quadrant.shiftX());
                    var yRange = parent.getYRange().forChild(quadrant.shiftY());
                    boolean hasContent = parent.hasContent() && !xRange.outsideUnit() && !yRange.outsideUnit();
                    node = new TileNode<>(index, level, config.layerCount(), children,
                                          parent.getPlacement().child(quadrant), xRange.clamped(), yRange.clamped(),
                                          hasContent, settings.showBoundingSpheres());
                    if (regions != null) {
                        regions[index] = regions[parent.getIndex()].quadrant(quadrant);
                    }
                }
                nodes.add(node);
            }
        }
    }

    private List<TileHandle<T>> renderable(List<TileNode<T>> visible) {
        var fallbacks = new LinkedHashSet<TileNode<T>>();
        var tiles = new ArrayList<TileHandle<T>>(visible.size());
        for (var node : visible) {
            if (!node.hasLoadError()) {
                tiles.add(node);
            } else {
                renderableAncestor(node).ifPresent(fallbacks::add);
            }
        }
        if (fallbacks.isEmpty()) {
            return tiles;
        }
        var result = new ArrayList<TileHandle<T>>(fallbacks.size() + tiles.size());
        result.addAll(fallbacks);
        result.addAll(tiles);
        return result;
    }

    private Optional<TileNode<T>> renderableAncestor(TileNode<T> node) {
        for (int index = node.getParentIndex(); index >= 0; index = QuadtreeIndex.parentOf(index)) {
            var ancestor = nodes.get(index);
            if (ancestor.hasContent() && ancestor.isRenderable()) {
                return Optional.of(ancestor);
            }
        }
        return Optional.empty();
    }

    private void requestRoot() {
        getRoot().requestTextures(addresses, fetcher, completions, this::initialLoadResponse);
    }

    private void initialLoadResponse(int nodeIndex, boolean success) {
        if (!success) {
            var urls = IntStream.range(0, config.layerCount())
                                .mapToObj(layer -> addresses.address(nodeIndex, layer))
                                .collect(Collectors.joining("\n"));
            log.error("Unable to load image data for node: {}, urls:\n{}", nodeIndex, urls);
        }
        loadResponse(nodeIndex, success);
    }

    private void loadResponse(int nodeIndex, boolean success) {
        listener.tileLoaded(nodeIndex, success);
    }

    private void checkNotDisposed() {
        if (disposed) {
            throw new IllegalStateException("Tile pyramid has been disposed");
        }
    }
}
