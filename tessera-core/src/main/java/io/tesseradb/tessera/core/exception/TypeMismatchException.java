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
package io.tesseradb.tessera.core.exception;

import io.tesseradb.tessera.common.exception.TesseraRuntimeException;

/**
 * Thrown when the runtime type of a value does not match the declared type of a column.
 */
public class TypeMismatchException
        extends TesseraRuntimeException
{
    private static final long serialVersionUID = -3362817449047207385L;

    private final Class<?> expectedType;
    private final Class<?> actualType;

    public TypeMismatchException(Class<?> expectedType, Class<?> actualType)
    {
        super("expected a value of type " + expectedType.getName() +
                ", but got " + actualType.getName());
        this.expectedType = expectedType;
        this.actualType = actualType;
    }

    public Class<?> getExpectedType()
    {
        return expectedType;
    }

    public Class<?> getActualType()
    {
        return actualType;
    }
}
