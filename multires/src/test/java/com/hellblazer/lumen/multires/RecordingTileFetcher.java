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

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Fetcher whose fetches stay pending until the test settles them. The texture of a layer is its address.
 *
 * @author hal.hildebrand
 */
class RecordingTileFetcher implements TileFetcher<String> {

    private final Map<String, CompletableFuture<String>> pending  = new LinkedHashMap<>();
    private final List<String>                           requests = new ArrayList<>();
    private       int                                    cacheClears;

    @Override
    public synchronized CompletableFuture<String> fetch(String address) {
        requests.add(address);
        var future = new CompletableFuture<String>();
        pending.put(address, future);
        return future;
    }

    @Override
    public synchronized void clearCache() {
        cacheClears++;
    }

    synchronized List<String> requests() {
        return List.copyOf(requests);
    }

    synchronized List<String> pendingAddresses() {
        return List.copyOf(pending.keySet());
    }

    void succeed(String address) {
        take(address).complete(address);
    }

    void fail(String address) {
        take(address).completeExceptionally(new IOException("404: " + address));
    }

    /**
     * Settle every pending fetch for the given node successfully
     */
    void succeedNode(AddressScheme addresses, int nodeIndex, int layerCount) {
        for (int layer = 0; layer < layerCount; layer++) {
            succeed(addresses.address(nodeIndex, layer));
        }
    }

    void failNode(AddressScheme addresses, int nodeIndex, int layerCount) {
        for (int layer = 0; layer < layerCount; layer++) {
            fail(addresses.address(nodeIndex, layer));
        }
    }

    void succeedAll() {
        for (var address : pendingAddresses()) {
            succeed(address);
        }
    }

    synchronized int cacheClears() {
        return cacheClears;
    }

    private synchronized CompletableFuture<String> take(String address) {
        var future = pending.remove(address);
        if (future == null) {
            throw new IllegalStateException("No pending fetch for " + address);
        }
        return future;
    }
}
