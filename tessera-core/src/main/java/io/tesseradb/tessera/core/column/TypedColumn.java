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
package io.tesseradb.tessera.core.column;

import io.tesseradb.tessera.core.AnyValue;
import io.tesseradb.tessera.core.AttributeType;
import io.tesseradb.tessera.core.TidList;
import io.tesseradb.tessera.core.exception.NoValueException;
import io.tesseradb.tessera.core.exception.TidOutOfRangeException;
import io.tesseradb.tessera.core.exception.TypeMismatchException;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * The base of the columns with values of Java type T.
 * <p>
 * It implements the type-erased methods of {@link Column} by checking the given
 * {@link AnyValue} and delegating to the typed methods, so that the values reaching
 * the typed methods are never empty and always of type T.
 * </p>
 * @param <T> the Java type of the values
 * @create 2026-10-18
 */
public abstract class TypedColumn<T extends Comparable<? super T>> implements Column
{
    protected final String name;
    protected final AttributeType type;
    protected final Class<T> javaType;

    protected TypedColumn(String name, AttributeType type, Class<T> javaType)
    {
        this.name = requireNonNull(name, "name is null");
        this.type = requireNonNull(type, "type is null");
        this.javaType = requireNonNull(javaType, "javaType is null");
        checkArgument(type.getJavaType() == javaType,
                "attribute type %s does not hold values of %s", type, javaType.getName());
    }

    @Override
    public String getName()
    {
        return name;
    }

    @Override
    public AttributeType getType()
    {
        return type;
    }

    public Class<T> getJavaType()
    {
        return javaType;
    }

    /**
     * Check that the container holds a value of type T.
     * @param value the container
     * @return the value in the container
     */
    protected T checkValue(AnyValue value)
    {
        requireNonNull(value, "value is null");
        if (value.isEmpty())
        {
            throw new NoValueException("can not store an empty value in column " + name);
        }
        if (value.getType() != javaType)
        {
            throw new TypeMismatchException(javaType, value.getType());
        }
        return javaType.cast(value.get());
    }

    protected void checkTid(int tid)
    {
        if (tid < 0 || tid >= size())
        {
            throw new TidOutOfRangeException(tid, size());
        }
    }

    @Override
    public int insert(AnyValue value)
    {
        return insert(checkValue(value));
    }

    @Override
    public void insertAll(List<AnyValue> values)
    {
        requireNonNull(values, "values is null");
        for (AnyValue value : values)
        {
            insert(checkValue(value));
        }
    }

    /**
     * Append the values in the iteration order.
     */
    public void insertAll(Iterable<? extends T> values)
    {
        requireNonNull(values, "values is null");
        for (T value : values)
        {
            insert(value);
        }
    }

    @Override
    public void update(int tid, AnyValue value)
    {
        update(tid, checkValue(value));
    }

    @Override
    public void update(TidList tids, AnyValue value)
    {
        requireNonNull(tids, "tids is null");
        T checked = checkValue(value);
        for (int i = 0; i < tids.size(); ++i)
        {
            update(tids.get(i), checked);
        }
    }

    @Override
    public AnyValue get(int tid)
    {
        return AnyValue.of(getValue(tid));
    }

    /**
     * Append a value to the end of this column.
     * @param value the value, not null
     * @return the tid of the new tuple
     */
    public abstract int insert(T value);

    /**
     * Replace the value of a tuple, the size of this column is not changed.
     */
    public abstract void update(int tid, T value);

    /**
     * Read the value of a tuple. Values are immutable, so the returned value
     * can not be used to modify this column.
     * @throws TidOutOfRangeException if tid is not in [0, size())
     */
    public abstract T getValue(int tid);

    @Override
    public abstract TypedColumn<T> copy();
}
