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
package io.tesseradb.tessera.core;

import io.tesseradb.tessera.core.utils.DynamicIntArray;

/**
 * An ordered list of tuple ids, owned by the caller of a bulk column operation.
 * The column never modifies a given list.
 * @create 2026-10-18
 */
public class TidList
{
    private final DynamicIntArray tids;

    public TidList()
    {
        this.tids = new DynamicIntArray(1024);
    }

    public static TidList of(int... tids)
    {
        TidList list = new TidList();
        for (int tid : tids)
        {
            list.add(tid);
        }
        return list;
    }

    /**
     * Create a list holding the tuple ids from start (inclusive) to end (exclusive).
     */
    public static TidList range(int start, int end)
    {
        TidList list = new TidList();
        for (int tid = start; tid < end; ++tid)
        {
            list.add(tid);
        }
        return list;
    }

    public void add(int tid)
    {
        this.tids.add(tid);
    }

    public int get(int index)
    {
        return this.tids.get(index);
    }

    public int size()
    {
        return this.tids.size();
    }

    public boolean isEmpty()
    {
        return this.tids.size() == 0;
    }

    /**
     * @return a copy of the tuple ids in list order
     */
    public int[] toArray()
    {
        return this.tids.toArray();
    }

    @Override
    public String toString()
    {
        return this.tids.toString();
    }
}
