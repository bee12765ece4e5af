/*
 * Copyright 2026 TesseraDB.
 *
 * This file is part of Tessera.
 *
 * Tessera is free software: you can redistribute it and/or modify
 * it under the terms of the Affero GNU General Public License as
 * published by the Free Software Foundation, either version 3 of
 * the License, or (at your option) any later version.
 *
 * Tessera is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * Affero GNU General Public License for more details.
 *
 * You should have received a copy of the Affero GNU General Public
 * License along with Tessera.  If not, see
 * <https://www.gnu.org/licenses/>.
 */
package io.tesseradb.tessera.core.encoding;

import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

public class TestValueDictionary
{
    @Test
    public void testAcquireAndRelease()
    {
        ValueDictionary<String> dict = new ValueDictionary<>(16);
        int a = dict.acquire("a");
        int b = dict.acquire("b");
        assertNotEquals(a, b);
        assertEquals(a, dict.acquire("a"));
        assertEquals(2, dict.refCount(a));
        assertEquals(2, dict.size());

        assertFalse(dict.release(a));
        assertEquals(1, dict.refCountOf("a"));
        assertTrue(dict.release(a));
        assertEquals(0, dict.refCountOf("a"));
        assertEquals(-1, dict.handleOf("a"));
        assertFalse(dict.isLive(a));
        assertEquals(1, dict.size());
        assertEquals("b", dict.valueOf(b));
    }

    @Test
    public void testHandlesAreRecycled()
    {
        ValueDictionary<Integer> dict = new ValueDictionary<>(16);
        int first = dict.acquire(1);
        dict.acquire(2);
        dict.release(first);
        int recycled = dict.acquire(3);
        assertEquals(first, recycled);
        assertEquals(Integer.valueOf(3), dict.valueOf(recycled));
        assertEquals(2, dict.handleBound());
    }

    @Test(expected = IllegalStateException.class)
    public void testDeadHandle()
    {
        ValueDictionary<Integer> dict = new ValueDictionary<>(16);
        int handle = dict.acquire(1);
        dict.release(handle);
        dict.valueOf(handle);
    }

    @Test
    public void testEntriesAreSorted() throws Exception
    {
        ValueDictionary<Integer> dict = new ValueDictionary<>(16);
        for (int v : new int[] {7, 5, 9, 5, 7, 5})
        {
            dict.acquire(v);
        }
        assertEquals(Arrays.asList(new DictionaryEntry<>(5, 3), new DictionaryEntry<>(7, 2),
                new DictionaryEntry<>(9, 1)), dict.entries());

        List<Integer> visited = new ArrayList<>();
        dict.visit((handle, value, refCount) -> {
            assertEquals(value, dict.valueOf(handle));
            visited.add(value);
        });
        assertEquals(Arrays.asList(5, 7, 9), visited);
    }

    @Test
    public void testRestore()
    {
        ValueDictionary<String> dict = new ValueDictionary<>(16);
        int handle = dict.restore("x", 4);
        assertEquals(4, dict.refCount(handle));
        assertEquals(handle, dict.acquire("x"));
        assertEquals(5, dict.refCountOf("x"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRestoreDuplicate()
    {
        ValueDictionary<String> dict = new ValueDictionary<>(16);
        dict.restore("x", 1);
        dict.restore("x", 2);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRestoreZeroRefCount()
    {
        new ValueDictionary<String>(16).restore("x", 0);
    }

    @Test
    public void testCopyIsIndependent()
    {
        ValueDictionary<String> dict = new ValueDictionary<>(16);
        int a = dict.acquire("a");
        ValueDictionary<String> copy = dict.copy();
        copy.acquire("a");
        copy.acquire("c");
        dict.release(a);
        assertTrue(dict.isEmpty());
        assertEquals(2, copy.refCountOf("a"));
        assertEquals(1, copy.refCountOf("c"));
    }

    @Test
    public void testClear()
    {
        ValueDictionary<String> dict = new ValueDictionary<>(16);
        dict.acquire("a");
        dict.clear();
        assertTrue(dict.isEmpty());
        assertEquals(0, dict.handleBound());
        assertEquals(0, dict.acquire("b"));
    }
}
