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
 * Thrown when a tuple id is negative or not less than the size of the column.
 */
public class TidOutOfRangeException
        extends TesseraRuntimeException
{
    private static final long serialVersionUID = 4457209935602871160L;

    private final int tid;
    private final int size;

    public TidOutOfRangeException(int tid, int size)
    {
        super("tid " + tid + " is out of range, the column has " + size + " tuples");
        this.tid = tid;
        this.size = size;
    }

    public int getTid()
    {
        return tid;
    }

    public int getSize()
    {
        return size;
    }
}
