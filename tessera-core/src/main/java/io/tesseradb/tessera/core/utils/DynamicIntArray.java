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
package io.tesseradb.tessera.core.utils;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Dynamic int array that uses primitive types and chunks to avoid copying
 * large number of integers when it resizes.
 * <p>
 * Besides appending, it supports removing elements with compaction: all the
 * elements after a removed one are shifted to the left, so that the indexes
 * stay dense. This is what the position index of a dictionary compressed
 * column needs.
 * <p>
 * NOTE: Like standard Collection implementations/arrays, this class is not
 * synchronized.
 */
public final class DynamicIntArray
{
    static final int DEFAULT_CHUNKSIZE = 8 * 1024;
    static final int INIT_CHUNKS = 16;

    private final int chunkSize;       // our allocation size
    private int[][] data;              // the real data
    private int length;                // max set element index +1
    private int initializedChunks = 0; // the number of created chunks

    public DynamicIntArray()
    {
        this(DEFAULT_CHUNKSIZE);
    }

    public DynamicIntArray(int chunkSize)
    {
        checkArgument(chunkSize > 0, "chunkSize must be positive");
        this.chunkSize = chunkSize;

        data = new int[INIT_CHUNKS][];
    }

    /**
     * Create a deep copy of the other array, sharing no chunk with it.
     * @param other the array to copy
     */
    public DynamicIntArray(DynamicIntArray other)
    {
        this.chunkSize = other.chunkSize;
        this.length = other.length;
        this.initializedChunks = other.initializedChunks;
        this.data = new int[other.data.length][];
        for (int i = 0; i < other.initializedChunks; ++i)
        {
            this.data[i] = other.data[i].clone();
        }
    }

    /**
     * Ensure that the given index is valid.
     */
    private void grow(int chunkIndex)
    {
        if (chunkIndex >= initializedChunks)
        {
            if (chunkIndex >= data.length)
            {
                int newSize = Math.max(chunkIndex + 1, 2 * data.length);
                int[][] newChunk = new int[newSize][];
                System.arraycopy(data, 0, newChunk, 0, data.length);
                data = newChunk;
            }
            for (int i = initializedChunks; i <= chunkIndex; ++i)
            {
                data[i] = new int[chunkSize];
            }
            initializedChunks = chunkIndex + 1;
        }
    }

    private void checkIndex(int index)
    {
        if (index < 0 || index >= length)
        {
            throw new IndexOutOfBoundsException("Index " + index +
                    " is outside of 0.." + (length - 1));
        }
    }

    public int get(int index)
    {
        checkIndex(index);
        return data[index / chunkSize][index % chunkSize];
    }

    /**
     * Overwrite an existing element. Unlike {@link #add(int)}, this method
     * never extends the array.
     */
    public void set(int index, int value)
    {
        checkIndex(index);
        data[index / chunkSize][index % chunkSize] = value;
    }

    public void increment(int index, int value)
    {
        checkIndex(index);
        data[index / chunkSize][index % chunkSize] += value;
    }

    public void add(int value)
    {
        int i = length / chunkSize;
        int j = length % chunkSize;
        grow(i);
        data[i][j] = value;
        length += 1;
    }

    /**
     * Remove the element at index and shift all the elements after it one slot to the left.
     * The cost is linear in the number of elements after index.
     * @param index the index of the element to remove
     * @return the removed element
     */
    public int remove(int index)
    {
        checkIndex(index);
        int i = index / chunkSize;
        int j = index % chunkSize;
        int removed = data[i][j];
        int lastChunk = (length - 1) / chunkSize;
        while (i <= lastChunk)
        {
            // the last valid slot of chunk i
            int end = i == lastChunk ? (length - 1) % chunkSize : chunkSize - 1;
            System.arraycopy(data[i], j + 1, data[i], j, end - j);
            if (i < lastChunk)
            {
                data[i][chunkSize - 1] = data[i + 1][0];
            }
            i++;
            j = 0;
        }
        length -= 1;
        return removed;
    }

    /**
     * Remove the elements at the given indexes in a single compaction pass,
     * so that each surviving element is moved at most once.
     * @param indexes the indexes to remove, must be sorted in ascending order,
     *                distinct and within 0..size()-1
     */
    public void removeAll(int[] indexes)
    {
        if (indexes.length == 0)
        {
            return;
        }
        checkIndex(indexes[0]);
        checkIndex(indexes[indexes.length - 1]);
        for (int k = 1; k < indexes.length; ++k)
        {
            checkArgument(indexes[k - 1] < indexes[k], "indexes are not sorted and distinct");
        }
        int write = indexes[0];
        int next = 0;
        for (int read = indexes[0]; read < length; ++read)
        {
            if (next < indexes.length && indexes[next] == read)
            {
                next++;
                continue;
            }
            data[write / chunkSize][write % chunkSize] = data[read / chunkSize][read % chunkSize];
            write++;
        }
        length = write;
    }

    public int size()
    {
        return length;
    }

    /**
     * @return the number of elements the allocated chunks can hold
     */
    public long capacity()
    {
        return (long) initializedChunks * chunkSize;
    }

    public void clear()
    {
        length = 0;
        for (int i = 0; i < data.length; ++i)
        {
            data[i] = null;
        }
        initializedChunks = 0;
    }

    @Override
    public String toString()
    {
        StringBuilder sb = new StringBuilder(length * 4);
        sb.append('{');
        for (int i = 0; i < length; i++)
        {
            if (i > 0)
            {
                sb.append(',');
            }
            sb.append(get(i));
        }
        sb.append('}');
        return sb.toString();
    }

    /**
     * Convert this to an integer array of exactly size() elements.
     * The returned array is a copy and owned by the caller.
     */
    public int[] toArray()
    {
        int[] array = new int[length];
        int copied = 0;
        for (int i = 0; copied < length; i++)
        {
            int n = Math.min(chunkSize, length - copied);
            System.arraycopy(data[i], 0, array, copied, n);
            copied += n;
        }
        return array;
    }
}
