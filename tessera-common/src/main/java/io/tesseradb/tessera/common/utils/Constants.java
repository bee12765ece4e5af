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
package io.tesseradb.tessera.common.utils;

/**
 * @create 2026-10-18
 */
public final class Constants
{
    /**
     * The suffixes appended to the path given to store and load a dictionary compressed column.
     * They are part of the persisted layout and must not be changed.
     */
    public static final String DICT_VALUES_FILE_SUFFIX = "_values";
    public static final String DICT_POSITION_FILE_SUFFIX = "_position";

    public static final int INIT_DICT_SIZE = 4096;
    public static final int DEFAULT_POSITION_CHUNK_SIZE = 8 * 1024;

    public static final String POSITION_CHUNK_SIZE_KEY = "column.position.chunk.size";
    public static final String DICT_INITIAL_CAPACITY_KEY = "column.dictionary.initial.capacity";
    public static final String LOAD_VERIFY_REFCOUNTS_KEY = "column.load.verify.refcounts";

    private Constants()
    {
    }
}
