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

import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous source of tile layer data. Implementations own the transport and the decoding; the pyramid only asks
 * for an address and waits for the future to settle.
 *
 * @param <T> texture data type handed to the renderer
 * @author hal.hildebrand
 */
@FunctionalInterface
public interface TileFetcher<T> {

    /**
     * Start fetching one resource. Must not block.
     *
     * @param address resource identifier produced by an {@link AddressScheme}
     * @return future completing with the decoded layer, or exceptionally if it cannot be loaded
     */
    CompletableFuture<T> fetch(String address);

    /**
     * Drop any retained results. No-op unless the fetcher caches.
     */
    default void clearCache() {
    }
}
