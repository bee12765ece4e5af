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

import java.io.IOException;
import java.util.List;

/**
 * A column holds the values of one attribute of a table, one value per tuple.
 * Tuples are addressed by their tuple id (tid), i.e., the 0-based position of the tuple
 * in the column. Tids are positional: removing a tuple decrements the tids of all the
 * tuples after it by one.
 * <p>
 * The methods of this interface are type-erased. They accept and return {@link AnyValue}
 * and check the runtime type of the given values against the declared type of the column.
 * </p>
 * Columns are not thread safe, the caller must serialize all the calls on a column.
 * @create 2026-10-18
 */
public interface Column
{
    String getName();

    AttributeType getType();

    /**
     * Append a value to the end of this column.
     * @param value the value to append
     * @return the tid of the new tuple
     * @throws io.tesseradb.tessera.core.exception.NoValueException if value is empty
     * @throws io.tesseradb.tessera.core.exception.TypeMismatchException if the type of value
     * does not match the type of this column
     */
    int insert(AnyValue value);

    /**
     * Append the values in order. If a value fails the type check, the exception is thrown
     * and the values before it remain in this column.
     * @param values the values to append
     */
    void insertAll(List<AnyValue> values);

    /**
     * Replace the value of a tuple, the size of this column is not changed.
     * @throws io.tesseradb.tessera.core.exception.TidOutOfRangeException if tid is not in [0, size())
     */
    void update(int tid, AnyValue value);

    /**
     * Replace the values of the tuples in tids, in list order. The tids are not renumbered.
     * The first failure aborts the remaining tids, the updates before it remain.
     */
    void update(TidList tids, AnyValue value);

    /**
     * Remove a tuple. The tids of the tuples after it are decremented by one.
     * @throws io.tesseradb.tessera.core.exception.TidOutOfRangeException if tid is not in [0, size())
     */
    void remove(int tid);

    /**
     * Remove all the tuples whose tids (before the removal) are in tids.
     * Duplicated tids are removed once.
     * @throws io.tesseradb.tessera.core.exception.TidOutOfRangeException if any tid is not in
     * [0, size()), in which case nothing is removed
     */
    void remove(TidList tids);

    /**
     * Remove all the tuples.
     */
    void clear();

    /**
     * @throws io.tesseradb.tessera.core.exception.TidOutOfRangeException if tid is not in [0, size())
     */
    AnyValue get(int tid);

    /**
     * @return the number of tuples in this column
     */
    int size();

    /**
     * @return the approximate number of bytes used by this column
     */
    long getSizeInBytes();

    /**
     * @return an independent deep copy of this column
     */
    Column copy();

    /**
     * Write the content of this column to the artifacts under the given path prefix.
     * @param path the path prefix of the artifacts
     * @throws IOException if the artifacts can not be written
     */
    void store(String path) throws IOException;

    /**
     * Read the content of this column from the artifacts written by {@link #store(String)}.
     * This column must be empty. If this method fails, this column must be discarded.
     * @param path the path prefix of the artifacts
     * @throws IOException if the artifacts can not be read or are malformed
     */
    void load(String path) throws IOException;
}
