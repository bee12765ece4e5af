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
 * Thrown when an empty {@link io.tesseradb.tessera.core.AnyValue} is given to a column.
 */
public class NoValueException
        extends TesseraRuntimeException
{
    private static final long serialVersionUID = 6195340217651320841L;

    public NoValueException(String message)
    {
        super(message);
    }
}
