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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Shares fetches of the same address between callers. In-flight and completed fetches are retained until
 * {@link #clearCache()}; failures are dropped as soon as they settle so a later request tries again.
 *
 * @param <T> texture data type
 * @author hal.hildebrand
 */
public class CachingTileFetcher<T> implements TileFetcher<T> {
    private static final Logger log = LoggerFactory.getLogger(CachingTileFetcher.class);

    private final TileFetcher<T>                                  delegate;
    private final ConcurrentHashMap<String, CompletableFuture<T>> cache  = new ConcurrentHashMap<>();
    private final AtomicLong                                      hits   = new AtomicLong();
    private final AtomicLong                                      misses = new AtomicLong();

    public CachingTileFetcher(TileFetcher<T> delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public CompletableFuture<T> fetch(String address) {
        var cached = cache.get(address);
        if (cached != null) {
            hits.incrementAndGet();
            return cached.copy();
        }
        var future = cache.computeIfAbsent(address, a -> {
            misses.incrementAndGet();
            return delegate.fetch(a);
        });
        future.whenComplete((texture, error) -> {
            if (error != null && cache.remove(address, future)) {
                log.debug("Evicted failed fetch of {}", address);
            }
        });
        return future.copy();
    }

    @Override
    public void clearCache() {
        int size = cache.size();
        cache.clear();
        delegate.clearCache();
        log.debug("Cleared {} cached tile fetches", size);
    }

    public int size() {
        return cache.size();
    }

    public long getHits() {
        return hits.get();
    }

    public long getMisses() {
        return misses.get();
    }
}
