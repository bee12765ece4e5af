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

import com.google.common.collect.ImmutableList;
import io.tesseradb.tessera.core.utils.DynamicIntArray;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Map;
import java.util.TreeMap;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

/**
 * The reference counted dictionary of a dictionary compressed column.
 * <p>
 * Each distinct value is stored once, in a slot of an arena identified by an int handle.
 * The position index of the column holds handles instead of values. A handle is stable
 * as long as its entry lives, i.e., as long as its reference count is positive. When the
 * reference count drops to zero, the entry is deleted immediately and the handle is recycled
 * for a later value.
 * </p>
 * <p>
 * Entries are kept in a sorted map from value to handle, thus they are visited in the
 * ascending order of their values.
 * </p>
 * This class is not thread safe.
 * @create 2026-10-18
 */
public class ValueDictionary<T extends Comparable<? super T>>
{
    private static final int FREE_HANDLES_CHUNK_SIZE = 1024;

    private final TreeMap<T, Integer> handles;
    /**
     * The value of each handle, null for free handles.
     */
    private final ArrayList<T> values;
    /**
     * The reference count of each handle, 0 for free handles.
     */
    private final DynamicIntArray refCounts;
    /**
     * The stack of free handles.
     */
    private final DynamicIntArray freeHandles;

    public ValueDictionary(int initialCapacity)
    {
        checkArgument(initialCapacity > 0, "initialCapacity must be positive");
        this.handles = new TreeMap<>();
        this.values = new ArrayList<>(initialCapacity);
        this.refCounts = new DynamicIntArray(initialCapacity);
        this.freeHandles = new DynamicIntArray(FREE_HANDLES_CHUNK_SIZE);
    }

    private ValueDictionary(ValueDictionary<T> other)
    {
        this.handles = new TreeMap<>(other.handles);
        this.values = new ArrayList<>(other.values);
        this.refCounts = new DynamicIntArray(other.refCounts);
        this.freeHandles = new DynamicIntArray(other.freeHandles);
    }

    /**
     * Add a reference to the value. The entry of the value is created with reference count 1
     * if it does not exist, otherwise its reference count is incremented.
     * @param value the value
     * @return the handle of the entry of the value
     */
    public int acquire(T value)
    {
        requireNonNull(value, "value is null");
        Integer handle = this.handles.get(value);
        if (handle != null)
        {
            this.refCounts.increment(handle, 1);
            return handle;
        }
        return allocate(value, 1);
    }

    /**
     * Remove a reference from the entry of the handle. The entry is deleted if
     * its reference count drops to zero.
     * @param handle the handle of a live entry
     * @return true if the entry is deleted
     */
    public boolean release(int handle)
    {
        int refCount = refCount(handle);
        if (refCount > 1)
        {
            this.refCounts.set(handle, refCount - 1);
            return false;
        }
        T value = this.values.get(handle);
        this.handles.remove(value);
        this.values.set(handle, null);
        this.refCounts.set(handle, 0);
        this.freeHandles.add(handle);
        return true;
    }

    /**
     * Create the entry of a value with the given reference count. This is used when a
     * column is loaded from its stored artifacts, where reference counts are written explicitly.
     * @param value the value, must not be in this dictionary
     * @param refCount the reference count, must be positive
     * @return the handle of the new entry
     */
    public int restore(T value, int refCount)
    {
        requireNonNull(value, "value is null");
        checkArgument(refCount > 0, "refCount must be positive");
        checkArgument(!this.handles.containsKey(value), "value %s is already in the dictionary", value);
        return allocate(value, refCount);
    }

    private int allocate(T value, int refCount)
    {
        int handle;
        int numFree = this.freeHandles.size();
        if (numFree > 0)
        {
            handle = this.freeHandles.remove(numFree - 1);
            this.values.set(handle, value);
            this.refCounts.set(handle, refCount);
        }
        else
        {
            handle = this.values.size();
            this.values.add(value);
            this.refCounts.add(refCount);
        }
        this.handles.put(value, handle);
        return handle;
    }

    /**
     * @param handle the handle of a live entry
     * @return the value of the entry
     */
    public T valueOf(int handle)
    {
        checkLive(handle);
        return this.values.get(handle);
    }

    /**
     * @param handle the handle of a live entry
     * @return the reference count of the entry
     */
    public int refCount(int handle)
    {
        checkLive(handle);
        return this.refCounts.get(handle);
    }

    /**
     * @return the handle of the value's entry, or -1 if the value is not in this dictionary
     */
    public int handleOf(T value)
    {
        Integer handle = this.handles.get(value);
        return handle == null ? -1 : handle;
    }

    /**
     * @return the reference count of the value, or 0 if the value is not in this dictionary
     */
    public int refCountOf(T value)
    {
        Integer handle = this.handles.get(value);
        return handle == null ? 0 : this.refCounts.get(handle);
    }

    /**
     * @return true if the handle refers to a live entry
     */
    public boolean isLive(int handle)
    {
        return handle >= 0 && handle < this.values.size() && this.values.get(handle) != null;
    }

    private void checkLive(int handle)
    {
        checkState(isLive(handle), "handle %s does not refer to a live dictionary entry", handle);
    }

    /**
     * @return the number of distinct values in this dictionary
     */
    public int size()
    {
        return this.handles.size();
    }

    public boolean isEmpty()
    {
        return this.handles.isEmpty();
    }

    /**
     * @return the upper bound (exclusive) of the handles that have been allocated
     */
    public int handleBound()
    {
        return this.values.size();
    }

    public void clear()
    {
        this.handles.clear();
        this.values.clear();
        this.refCounts.clear();
        this.freeHandles.clear();
    }

    /**
     * @return a deep copy of this dictionary, the handles are preserved
     */
    public ValueDictionary<T> copy()
    {
        return new ValueDictionary<>(this);
    }

    /**
     * @return the snapshots of the entries in the ascending order of their values
     */
    public ImmutableList<DictionaryEntry<T>> entries()
    {
        ImmutableList.Builder<DictionaryEntry<T>> builder = ImmutableList.builderWithExpectedSize(size());
        for (Map.Entry<T, Integer> entry : this.handles.entrySet())
        {
            builder.add(new DictionaryEntry<>(entry.getKey(), this.refCounts.get(entry.getValue())));
        }
        return builder.build();
    }

    /**
     * Call {@link Visitor#visit(int, Object, int)} for each entry in this dictionary,
     * in the ascending order of the values. The dictionary must not be modified by the visitor.
     * @param visitor the visitor, e.g., the one serializing the entries
     * @throws IOException if the visitor fails
     */
    public void visit(Visitor<T> visitor) throws IOException
    {
        for (Map.Entry<T, Integer> entry : this.handles.entrySet())
        {
            int handle = entry.getValue();
            visitor.visit(handle, entry.getKey(), this.refCounts.get(handle));
        }
    }

    /**
     * The interface for dictionary visitors.
     */
    public interface Visitor<T>
    {
        /**
         * Called exactly once for each entry in the dictionary.
         * @param handle the handle of the entry
         * @param value the value of the entry
         * @param refCount the reference count of the entry
         * @throws IOException
         */
        void visit(int handle, T value, int refCount) throws IOException;
    }
}
