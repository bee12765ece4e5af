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

import io.tesseradb.tessera.core.AttributeType;

import static java.util.Objects.requireNonNull;

/**
 * Create dictionary compressed columns from attribute types, so that the callers
 * holding only an {@link AttributeType} do not need to name the Java type of the values.
 * @create 2026-10-18
 */
public final class ColumnFactory
{
    private ColumnFactory()
    {
    }

    /**
     * @param name the name of the column
     * @param type the declared type of the column
     * @return a new empty column
     */
    public static TypedColumn<?> createDictionaryColumn(String name, AttributeType type)
    {
        requireNonNull(type, "type is null");
        switch (type)
        {
            case INT:
                return new DictionaryCompressedColumn<>(name, type, Integer.class);
            case LONG:
                return new DictionaryCompressedColumn<>(name, type, Long.class);
            case FLOAT:
                return new DictionaryCompressedColumn<>(name, type, Float.class);
            case DOUBLE:
                return new DictionaryCompressedColumn<>(name, type, Double.class);
            case BOOLEAN:
                return new DictionaryCompressedColumn<>(name, type, Boolean.class);
            case CHAR:
                return new DictionaryCompressedColumn<>(name, type, Character.class);
            case VARCHAR:
                return new DictionaryCompressedColumn<>(name, type, String.class);
            default:
                throw new IllegalArgumentException("unsupported attribute type " + type);
        }
    }

    /**
     * @param name the name of the column
     * @param typeName the name or alias of the declared type, e.g., "integer" or "string"
     * @return a new empty column
     */
    public static TypedColumn<?> createDictionaryColumn(String name, String typeName)
    {
        return createDictionaryColumn(name, AttributeType.fromName(typeName));
    }

    /**
     * @param name the name of the column
     * @param javaType the Java type of the values
     * @return a new empty column
     */
    public static <T extends Comparable<? super T>> DictionaryCompressedColumn<T> createDictionaryColumn(
            String name, Class<T> javaType)
    {
        return new DictionaryCompressedColumn<>(name, AttributeType.fromJavaType(javaType), javaType);
    }
}
