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

import com.hellblazer.lumen.geometry.BoundingSphere;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * One tile of the pyramid: its place in the quadtree and the scene, its content limits, and the per layer texture
 * slots filled by asynchronous fetches.
 * <p>
 * Topology and geometry are fixed at construction. Only the texture slots and the load state change afterwards.
 * Requests are issued from the control thread; layer completions arrive on the completion executor and may run
 * concurrently with each other, so the settle count is atomic and the transition to {@link LoadState#LOADED} happens
 * exactly once, on the completion that settles the last layer.
 *
 * @param <T> texture data type
 * @author hal.hildebrand
 */
public class TileNode<T> implements TileHandle<T> {
    private static final Logger log = LoggerFactory.getLogger(TileNode.class);

    private final int            index;
    private final int            parentIndex;
    private final int            level;
    private final int[]          childIndices;
    private final int            layerCount;
    private final TilePlacement  placement;
    private final BoundingSphere boundingSphere;
    private final ClipRange      xRange;
    private final ClipRange      yRange;
    private final boolean        hasContent;
    private final boolean        showBoundingSphere;

    private final    AtomicReferenceArray<T>               textures;
    private final    AtomicInteger                         settledLayers = new AtomicInteger();
    private volatile LoadState                             loadState     = LoadState.INIT;
    private volatile boolean                               loadError;
    private volatile PyramidException.LayerFetchException loadFailure;
    private volatile TileSurface<T>                        surface;
    private volatile boolean                               disposed;

    TileNode(int index, int level, int layerCount, int[] childIndices, TilePlacement placement, ClipRange xRange,
             ClipRange yRange, boolean hasContent, boolean showBoundingSphere) {
        this.index = index;
        this.parentIndex = QuadtreeIndex.parentOf(index);
        this.level = level;
        this.layerCount = layerCount;
        this.childIndices = childIndices.clone();
        this.placement = placement;
        this.boundingSphere = BoundingSphere.ofRectangle(placement.position(), placement.width(), placement.height());
        this.xRange = xRange;
        this.yRange = yRange;
        this.hasContent = hasContent;
        this.showBoundingSphere = showBoundingSphere;
        this.textures = new AtomicReferenceArray<>(layerCount);
    }

    /**
     * Start fetching every layer of this tile. Does nothing unless the tile is still in {@link LoadState#INIT}. A tile
     * without content moves straight to {@link LoadState#LOADED} without fetching.
     *
     * @param addresses   address scheme of the pyramid
     * @param fetcher     source of layer data
     * @param completions executor layer completions are handled on
     * @param listener    notified when the last layer settles
     * @return true if this call moved the tile out of {@link LoadState#INIT}
     */
    boolean requestTextures(AddressScheme addresses, TileFetcher<T> fetcher, Executor completions,
                            TileLoadListener listener) {
        if (disposed || loadState != LoadState.INIT) {
            return false;
        }
        if (!hasContent) {
            loadState = LoadState.LOADED;
            log.trace("Node {} has no content, loaded empty", index);
            return true;
        }

        loadState = LoadState.REQUESTED;
        settledLayers.set(0);
        loadError = false;
        loadFailure = null;

        for (int layer = 0; layer < layerCount; layer++) {
            final int current = layer;
            final var address = addresses.address(index, layer);
            log.debug("Requesting node {} layer {}: {}", index, layer, address);
            CompletableFuture<T> pending;
            try {
                pending = fetcher.fetch(address);
                if (pending == null) {
                    pending = CompletableFuture.failedFuture(new NullPointerException("Fetcher returned no future"));
                }
            } catch (RuntimeException e) {
                pending = CompletableFuture.failedFuture(e);
            }
            pending.whenCompleteAsync((texture, error) -> layerSettled(current, address, texture, error, listener),
                                      completions);
        }
        return true;
    }

    /**
     * Release the textures and surface. Safe in any load state; completions arriving afterwards are discarded.
     */
    void dispose() {
        disposed = true;
        surface = null;
        for (int layer = 0; layer < layerCount; layer++) {
            textures.set(layer, null);
        }
    }

    /**
     * Re-assemble the surface from the loaded textures, for a renderer that has rebuilt its materials
     *
     * @return true if a surface was rebuilt
     */
    boolean rebuildSurface() {
        if (disposed || !hasContent || !isRenderable()) {
            return false;
        }
        surface = assembleSurface();
        return true;
    }

    public int getParentIndex() {
        return parentIndex;
    }

    /**
     * @param slot child slot in [0, 3]
     * @return index of the child, or -1 for leaves
     */
    public int getChildIndex(int slot) {
        return childIndices[slot];
    }

    public int[] getChildIndices() {
        return childIndices.clone();
    }

    public int getLayerCount() {
        return layerCount;
    }

    public BoundingSphere getBoundingSphere() {
        return boundingSphere;
    }

    public LoadState getLoadState() {
        return loadState;
    }

    /**
     * @return true once any layer of the last request failed
     */
    public boolean hasLoadError() {
        return loadError;
    }

    /**
     * @return the first layer failure of the last request, if any
     */
    public Optional<PyramidException.LayerFetchException> getLoadFailure() {
        return Optional.ofNullable(loadFailure);
    }

    public boolean isLoaded() {
        return loadState == LoadState.LOADED;
    }

    /**
     * @return loaded without error, content bearing or not
     */
    public boolean isRenderable() {
        return loadState == LoadState.LOADED && !loadError;
    }

    public boolean isDisposed() {
        return disposed;
    }

    /**
     * @return the texture of a layer, or null if it has not arrived
     */
    public T getTexture(int layer) {
        return textures.get(layer);
    }

    @Override
    public int getIndex() {
        return index;
    }

    @Override
    public int getLevel() {
        return level;
    }

    @Override
    public TilePlacement getPlacement() {
        return placement;
    }

    @Override
    public ClipRange getXRange() {
        return xRange;
    }

    @Override
    public ClipRange getYRange() {
        return yRange;
    }

    @Override
    public boolean hasContent() {
        return hasContent;
    }

    @Override
    public Optional<TileSurface<T>> getSurface() {
        return Optional.ofNullable(surface);
    }

    @Override
    public Optional<BoundingSphere> getDebugSphere() {
        return showBoundingSphere ? Optional.of(boundingSphere) : Optional.empty();
    }

    @Override
    public String toString() {
        return String.format("TileNode[index=%d, level=%d, parent=%d, children=%s, state=%s, error=%s, content=%s]",
                             index, level, parentIndex, Arrays.toString(childIndices), loadState, loadError,
                             hasContent);
    }

    private void layerSettled(int layer, String address, T texture, Throwable error, TileLoadListener listener) {
        if (disposed) {
            log.trace("Discarding layer {} of disposed node {}", layer, index);
            return;
        }
        if (error != null || texture == null) {
            var cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
            var failure = new PyramidException.LayerFetchException(address, index, layer, cause);
            log.warn("{}: {}", failure.getMessage(), cause == null ? "no data" : cause.toString());
            if (loadFailure == null) {
                loadFailure = failure;
            }
            loadError = true;
        } else {
            textures.set(layer, texture);
            log.trace("Loaded node {} layer {}", index, layer);
        }

        if (settledLayers.incrementAndGet() == layerCount) {
            complete(listener);
        }
    }

    private void complete(TileLoadListener listener) {
        boolean success = !loadError;
        if (success) {
            surface = assembleSurface();
            log.debug("Node {} loaded, all {} layers present", index, layerCount);
        } else {
            log.debug("Node {} loaded with errors, excluded from rendering", index);
        }
        loadState = LoadState.LOADED;
        try {
            listener.tileLoaded(index, success);
        } catch (RuntimeException e) {
            log.error("Load listener failed for node {}", index, e);
        }
    }

    private TileSurface<T> assembleSurface() {
        var layers = new ArrayList<T>(layerCount);
        for (int layer = 0; layer < layerCount; layer++) {
            layers.add(textures.get(layer));
        }
        return new TileSurface<>(index, layers, xRange, yRange);
    }
}
