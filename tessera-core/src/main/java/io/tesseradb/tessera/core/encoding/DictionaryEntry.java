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

import com.google.common.base.MoreObjects;

import java.util.Objects;

/**
 * An immutable snapshot of an entry in a {@link ValueDictionary}:
 * a distinct value and the number of tuples referencing it.
 */
public final class DictionaryEntry<T>
{
    private final T value;
    private final int refCount;

    public DictionaryEntry(T value, int refCount)
    {
        this.value = value;
        this.refCount = refCount;
    }

    public T getValue()
    {
        return value;
    }

    public int getRefCount()
    {
        return refCount;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o)
        {
            return true;
        }
        if (!(o instanceof DictionaryEntry))
        {
            return false;
        }
        DictionaryEntry<?> that = (DictionaryEntry<?>) o;
        return refCount == that.refCount && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(value, refCount);
    }

    @Override
    public String toString()
    {
        return MoreObjects.toStringHelper(this)
                .add("value", value)
                .add("refCount", refCount)
                .toString();
    }
}
