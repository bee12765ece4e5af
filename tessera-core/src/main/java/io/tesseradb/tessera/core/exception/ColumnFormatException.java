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

import java.io.IOException;

/**
 * Thrown when the stored artifacts of a column are malformed,
 * or when a column holds values that cannot be written in the stored format.
 * @create 2026-10-18
 */
public class ColumnFormatException extends IOException
{
    private static final long serialVersionUID = -8127045396337270523L;

    public ColumnFormatException(String message)
    {
        super(message);
    }

    public ColumnFormatException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
