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

import io.tesseradb.tessera.core.exception.NoValueException;

import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * A dynamically typed value container. It either holds exactly one value,
 * or is empty. The runtime type of the container is the class of its value.
 * <p>
 * It is used by the type-erased entry points of a column.
 * </p>
 * @create 2026-10-18
 */
public final class AnyValue
{
    private static final AnyValue EMPTY = new AnyValue(null);

    private final Object value;

    private AnyValue(Object value)
    {
        this.value = value;
    }

    public static AnyValue of(Object value)
    {
        requireNonNull(value, "value is null, use AnyValue.empty() instead");
        return new AnyValue(value);
    }

    public static AnyValue empty()
    {
        return EMPTY;
    }

    public boolean isEmpty()
    {
        return value == null;
    }

    /**
     * @return the class of the value, or {@link Void} if this container is empty
     */
    public Class<?> getType()
    {
        return value == null ? Void.class : value.getClass();
    }

    /**
     * @return the value
     * @throws NoValueException if this container is empty
     */
    public Object get()
    {
        if (value == null)
        {
            throw new NoValueException("the value container is empty");
        }
        return value;
    }

    /**
     * Get the value as an instance of the given type.
     * @throws NoValueException if this container is empty
     * @throws ClassCastException if the value is not an instance of type
     */
    public <T> T get(Class<T> type)
    {
        return type.cast(get());
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o)
        {
            return true;
        }
        if (!(o instanceof AnyValue))
        {
            return false;
        }
        return Objects.equals(value, ((AnyValue) o).value);
    }

    @Override
    public int hashCode()
    {
        return Objects.hashCode(value);
    }

    @Override
    public String toString()
    {
        return value == null ? "AnyValue.empty" : "AnyValue[" + value + "]";
    }
}
