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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;

/**
 * The image currently shown by a viewer, owning the tile pyramid that streams it.
 * <p>
 * The viewer calls {@link #viewportChanged} whenever the camera or the drawing surface changes, and
 * {@link #updateTiles} once per frame to pick up whatever has finished loading. Loading another image replaces the
 * pyramid only if the new one could be built. All calls belong to the viewer's control thread.
 *
 * @param <T> texture data type
 * @author hal.hildebrand
 */
public class MultiresImage<T> implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MultiresImage.class);

    private final TileFetcher<T>   fetcher;
    private final Executor         completions;
    private final PyramidSettings  settings;
    private final TileLoadListener listener;

    private TilePyramid<T>      pyramid;
    private ImageDescription    description;
    private List<TileHandle<T>> activeTiles = Collections.emptyList();
    private boolean             closed;

    public MultiresImage(TileFetcher<T> fetcher, PyramidSettings settings) {
        this(fetcher, Runnable::run, settings, (index, success) -> {
        });
    }

    /**
     * @param fetcher     source of layer data; wrapped in one cache shared by every image loaded here when the
     *                    settings enable texture caching
     * @param completions executor fetch completions are handled on, normally the control thread's
     * @param settings    viewer settings
     * @param listener    notified as each requested tile finishes loading, typically to schedule a redraw
     */
    public MultiresImage(TileFetcher<T> fetcher, Executor completions, PyramidSettings settings,
                         TileLoadListener listener) {
        Objects.requireNonNull(fetcher, "fetcher");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.fetcher = settings.cacheTextures() && !(fetcher instanceof CachingTileFetcher)
                       ? new CachingTileFetcher<>(fetcher) : fetcher;
        this.completions = Objects.requireNonNull(completions, "completions");
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    /**
     * Replace the current image. If the new pyramid cannot be built, the current image stays. The new pyramid is
     * built before the current one is disposed, so layers the two share are taken from the cache.
     *
     * @return true if the new image was loaded
     */
    public boolean load(PyramidConfig config, ImageDescription description) {
        checkOpen();
        var created = TilePyramid.create(config, description, fetcher, completions, settings, listener);
        if (created.isEmpty()) {
            log.warn("Keeping current image, new image could not be loaded");
            return false;
        }
        disposePyramid();
        pyramid = created.get();
        this.description = description;
        return true;
    }

    /**
     * Fetch what the new viewport needs.
     */
    public void viewportChanged(ScreenResolution screen, Camera camera) {
        if (pyramid != null) {
            pyramid.requestTextures(screen, camera);
        }
    }

    /**
     * Refresh the active tiles from the current load state. Call once per frame.
     *
     * @return the tiles to draw this frame
     */
    public List<TileHandle<T>> updateTiles(ScreenResolution screen, Camera camera) {
        activeTiles = pyramid == null ? Collections.emptyList() : pyramid.getAvailableTiles(screen, camera);
        return activeTiles;
    }

    public List<TileHandle<T>> getActiveTiles() {
        return activeTiles;
    }

    /**
     * Rebuild tile surfaces after the renderer changed its materials.
     */
    public void rebuildSurfaces() {
        if (pyramid != null) {
            pyramid.rebuildSurfaces();
        }
    }

    public Optional<TilePyramid<T>> getPyramid() {
        return Optional.ofNullable(pyramid);
    }

    public Optional<ImageDescription> getDescription() {
        return Optional.ofNullable(description);
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        disposePyramid();
    }

    private void disposePyramid() {
        activeTiles = Collections.emptyList();
        if (pyramid != null) {
            pyramid.dispose();
            pyramid = null;
            description = null;
        }
    }

    private void checkOpen() {
        if (closed) {
            throw new IllegalStateException("Image has been closed");
        }
    }
}
