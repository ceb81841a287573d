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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * @author hal.hildebrand
 */
class CachingTileFetcherTest {

    private TileFetcher<String>        delegate;
    private CachingTileFetcher<String> cache;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        delegate = mock(TileFetcher.class);
        cache = new CachingTileFetcher<>(delegate);
    }

    @Test
    void testSharesFetchesOfSameAddress() throws Exception {
        var source = new CompletableFuture<String>();
        when(delegate.fetch("t1_1.jpg")).thenReturn(source);

        var first = cache.fetch("t1_1.jpg");
        var second = cache.fetch("t1_1.jpg");
        verify(delegate, times(1)).fetch("t1_1.jpg");
        assertFalse(first.isDone());

        source.complete("texture");
        assertEquals("texture", first.get());
        assertEquals("texture", second.get());
        assertEquals("texture", cache.fetch("t1_1.jpg").get());

        verify(delegate, times(1)).fetch("t1_1.jpg");
        assertEquals(1, cache.getMisses());
        assertEquals(2, cache.getHits());
        assertEquals(1, cache.size());
    }

    @Test
    void testCallersCannotCompleteSharedFetch() throws Exception {
        var source = new CompletableFuture<String>();
        when(delegate.fetch("t1_1.jpg")).thenReturn(source);

        var first = cache.fetch("t1_1.jpg");
        first.cancel(true);
        assertFalse(source.isDone());

        var second = cache.fetch("t1_1.jpg");
        source.complete("texture");
        assertEquals("texture", second.get());
    }

    @Test
    void testFailedFetchIsEvicted() {
        when(delegate.fetch("t1_1.jpg")).thenReturn(CompletableFuture.failedFuture(new IOException("404")))
                                        .thenReturn(CompletableFuture.completedFuture("texture"));

        var failed = cache.fetch("t1_1.jpg");
        var e = assertThrows(ExecutionException.class, failed::get);
        assertInstanceOf(IOException.class, e.getCause());
        assertEquals(0, cache.size());

        assertEquals("texture", cache.fetch("t1_1.jpg").join());
        verify(delegate, times(2)).fetch("t1_1.jpg");
    }

    @Test
    void testClearCache() {
        when(delegate.fetch(anyString())).thenAnswer(inv -> CompletableFuture.completedFuture(inv.getArgument(0)));
        cache.fetch("t1_1.jpg");
        cache.fetch("t2_1.jpg");
        assertEquals(2, cache.size());

        cache.clearCache();
        assertEquals(0, cache.size());
        verify(delegate).clearCache();

        cache.fetch("t1_1.jpg");
        verify(delegate, times(2)).fetch("t1_1.jpg");
    }
}
