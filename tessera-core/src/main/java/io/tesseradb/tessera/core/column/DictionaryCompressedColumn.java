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

import com.google.common.base.CharMatcher;
import com.google.common.base.MoreObjects;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import io.tesseradb.tessera.common.utils.ConfigFactory;
import io.tesseradb.tessera.common.utils.Constants;
import io.tesseradb.tessera.core.AttributeType;
import io.tesseradb.tessera.core.TidList;
import io.tesseradb.tessera.core.encoding.DictionaryEntry;
import io.tesseradb.tessera.core.encoding.ValueDictionary;
import io.tesseradb.tessera.core.exception.ColumnFormatException;
import io.tesseradb.tessera.core.exception.TidOutOfRangeException;
import io.tesseradb.tessera.core.utils.DynamicIntArray;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.CharsetEncoder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;

import static com.google.common.base.Preconditions.checkState;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * The dictionary encoded column. Each distinct value is stored once in a
 * {@link ValueDictionary} together with the number of tuples referencing it,
 * and the position index maps each tid to the handle of its value in the dictionary.
 * <p>
 * The column is stored as two text artifacts sharing a path prefix:
 * <ul>
 *     <li>path_values: one line per distinct value, "refCount value", in the
 *     ascending order of the values;</li>
 *     <li>path_position: one line per tuple, in tid order, holding the 0-based
 *     line number of the tuple's value in path_values.</li>
 * </ul>
 * Values whose text form is empty or contains whitespace can not be stored.
 * </p>
 * This class is not thread safe.
 * @param <T> the Java type of the values
 * @create 2026-10-18
 */
public class DictionaryCompressedColumn<T extends Comparable<? super T>> extends TypedColumn<T>
{
    private static final Logger logger = LogManager.getLogger(DictionaryCompressedColumn.class);

    private static final Splitter TOKEN_SPLITTER = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

    private final ValueDictionary<T> dictionary;
    /**
     * The handle in the dictionary of each tuple, indexed by tid.
     */
    private final DynamicIntArray positions;

    public DictionaryCompressedColumn(String name, AttributeType type, Class<T> javaType)
    {
        super(name, type, javaType);
        ConfigFactory config = ConfigFactory.Instance();
        int dictCapacity = config.getIntProperty(Constants.DICT_INITIAL_CAPACITY_KEY, Constants.INIT_DICT_SIZE);
        int chunkSize = config.getIntProperty(Constants.POSITION_CHUNK_SIZE_KEY, Constants.DEFAULT_POSITION_CHUNK_SIZE);
        this.dictionary = new ValueDictionary<>(dictCapacity);
        this.positions = new DynamicIntArray(chunkSize);
    }

    private DictionaryCompressedColumn(DictionaryCompressedColumn<T> other)
    {
        super(other.name, other.type, other.javaType);
        this.dictionary = other.dictionary.copy();
        this.positions = new DynamicIntArray(other.positions);
    }

    @Override
    public int insert(T value)
    {
        requireNonNull(value, "value is null");
        this.positions.add(this.dictionary.acquire(value));
        return this.positions.size() - 1;
    }

    @Override
    public void update(int tid, T value)
    {
        requireNonNull(value, "value is null");
        checkTid(tid);
        this.dictionary.release(this.positions.get(tid));
        this.positions.set(tid, this.dictionary.acquire(value));
    }

    @Override
    public void remove(int tid)
    {
        checkTid(tid);
        this.dictionary.release(this.positions.remove(tid));
    }

    /**
     * The tids are sorted and deduplicated, then the tuples are removed in a single
     * compaction pass over the position index. Every tid refers to the tuple it addressed
     * before this call.
     */
    @Override
    public void remove(TidList tids)
    {
        requireNonNull(tids, "tids is null");
        if (tids.isEmpty())
        {
            return;
        }
        int[] sorted = tids.toArray();
        Arrays.sort(sorted);
        int distinct = 1;
        for (int i = 1; i < sorted.length; ++i)
        {
            if (sorted[i] != sorted[distinct - 1])
            {
                sorted[distinct++] = sorted[i];
            }
        }
        int[] unique = Arrays.copyOf(sorted, distinct);
        int size = size();
        if (unique[0] < 0)
        {
            throw new TidOutOfRangeException(unique[0], size);
        }
        if (unique[distinct - 1] >= size)
        {
            throw new TidOutOfRangeException(unique[distinct - 1], size);
        }
        for (int tid : unique)
        {
            this.dictionary.release(this.positions.get(tid));
        }
        this.positions.removeAll(unique);
    }

    @Override
    public void clear()
    {
        this.positions.clear();
        this.dictionary.clear();
    }

    @Override
    public T getValue(int tid)
    {
        checkTid(tid);
        return this.dictionary.valueOf(this.positions.get(tid));
    }

    @Override
    public int size()
    {
        return this.positions.size();
    }

    /**
     * This is only an estimation: the capacity of the position index times the size of a handle,
     * plus the number of distinct values times the size of a reference count and a value.
     * The overhead of the dictionary's map and of the objects is not counted.
     */
    @Override
    public long getSizeInBytes()
    {
        long size = this.positions.capacity() * Integer.BYTES;
        size += (long) this.dictionary.size() * (Integer.BYTES + this.type.getFixedWidth());
        return size;
    }

    /**
     * @return the snapshots of the dictionary entries in the ascending order of their values
     */
    public ImmutableList<DictionaryEntry<T>> getDictionaryEntries()
    {
        return this.dictionary.entries();
    }

    /**
     * @return the number of tuples holding the value, 0 if no tuple holds it
     */
    public int getRefCount(T value)
    {
        requireNonNull(value, "value is null");
        return this.dictionary.refCountOf(value);
    }

    /**
     * @return the number of distinct values in this column
     */
    public int getDistinctCount()
    {
        return this.dictionary.size();
    }

    ValueDictionary<T> getDictionary()
    {
        return dictionary;
    }

    @Override
    public DictionaryCompressedColumn<T> copy()
    {
        return new DictionaryCompressedColumn<>(this);
    }

    @Override
    public void store(String path) throws IOException
    {
        requireNonNull(path, "path is null");
        checkStorable();
        Path valuesPath = Paths.get(path + Constants.DICT_VALUES_FILE_SUFFIX);
        Path positionPath = Paths.get(path + Constants.DICT_POSITION_FILE_SUFFIX);

        // the line number in the values artifact of each handle
        int[] lineOfHandle = new int[this.dictionary.handleBound()];
        try (BufferedWriter writer = Files.newBufferedWriter(valuesPath, UTF_8))
        {
            int[] line = {0};
            this.dictionary.visit((handle, value, refCount) -> {
                writer.write(Integer.toString(refCount));
                writer.write(' ');
                writer.write(this.type.format(value));
                writer.newLine();
                lineOfHandle[handle] = line[0]++;
            });
        }

        try (BufferedWriter writer = Files.newBufferedWriter(positionPath, UTF_8))
        {
            for (int tid = 0; tid < this.positions.size(); ++tid)
            {
                writer.write(Integer.toString(lineOfHandle[this.positions.get(tid)]));
                writer.newLine();
            }
        }
        logger.debug("stored column " + this.name + " with " + this.positions.size() + " tuples and " +
                this.dictionary.size() + " distinct values to " + valuesPath + " and " + positionPath);
    }

    /**
     * Check that the text form of every value can be framed in the values artifact
     * and encoded in UTF-8, so that no artifact is touched if any value can not be stored.
     */
    private void checkStorable() throws IOException
    {
        CharsetEncoder encoder = UTF_8.newEncoder();
        try
        {
            this.dictionary.visit((handle, value, refCount) -> {
                String text = this.type.format(value);
                if (text.isEmpty() || CharMatcher.whitespace().matchesAnyOf(text))
                {
                    throw new ColumnFormatException("value '" + text + "' of column " + this.name +
                            " is empty or contains whitespace and can not be stored");
                }
                if (!encoder.canEncode(text))
                {
                    throw new ColumnFormatException("value '" + text + "' of column " + this.name +
                            " is not valid unicode and can not be stored in UTF-8");
                }
            });
        }
        catch (ColumnFormatException e)
        {
            logger.error(e.getMessage());
            throw e;
        }
    }

    @Override
    public void load(String path) throws IOException
    {
        requireNonNull(path, "path is null");
        checkState(this.positions.size() == 0 && this.dictionary.isEmpty(),
                "column %s is not empty, load does not merge", this.name);
        Path valuesPath = Paths.get(path + Constants.DICT_VALUES_FILE_SUFFIX);
        Path positionPath = Paths.get(path + Constants.DICT_POSITION_FILE_SUFFIX);

        // the handle created for each line of the values artifact
        DynamicIntArray handleOfLine = new DynamicIntArray();
        try (BufferedReader reader = Files.newBufferedReader(valuesPath, UTF_8))
        {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null)
            {
                lineNumber++;
                List<String> tokens = TOKEN_SPLITTER.splitToList(line);
                if (tokens.size() != 2)
                {
                    throw formatError(valuesPath, lineNumber, "expected 'refCount value', found '" + line + "'");
                }
                int refCount = parseInt(tokens.get(0), valuesPath, lineNumber);
                if (refCount < 1)
                {
                    throw formatError(valuesPath, lineNumber, "reference count " + refCount + " is not positive");
                }
                T value;
                try
                {
                    value = this.javaType.cast(this.type.parse(tokens.get(1)));
                }
                catch (IllegalArgumentException e)
                {
                    throw formatError(valuesPath, lineNumber, "invalid " + this.type.getPrimaryName() +
                            " value '" + tokens.get(1) + "'");
                }
                if (this.dictionary.handleOf(value) >= 0)
                {
                    throw formatError(valuesPath, lineNumber, "duplicate value '" + tokens.get(1) + "'");
                }
                handleOfLine.add(this.dictionary.restore(value, refCount));
            }
        }

        try (BufferedReader reader = Files.newBufferedReader(positionPath, UTF_8))
        {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null)
            {
                lineNumber++;
                List<String> tokens = TOKEN_SPLITTER.splitToList(line);
                if (tokens.size() != 1)
                {
                    throw formatError(positionPath, lineNumber, "expected a line index, found '" + line + "'");
                }
                int index = parseInt(tokens.get(0), positionPath, lineNumber);
                if (index < 0 || index >= handleOfLine.size())
                {
                    throw formatError(positionPath, lineNumber, "line index " + index +
                            " is out of range, there are " + handleOfLine.size() + " values");
                }
                this.positions.add(handleOfLine.get(index));
            }
        }
        logger.debug("loaded column " + this.name + " with " + this.positions.size() + " tuples and " +
                this.dictionary.size() + " distinct values from " + valuesPath + " and " + positionPath);

        if (ConfigFactory.Instance().getBooleanProperty(Constants.LOAD_VERIFY_REFCOUNTS_KEY, false))
        {
            verifyRefCounts();
        }
    }

    /**
     * Reference counts are trusted as written when loading. This recounts the references
     * in the position index and warns about the entries with a different reference count.
     * @return the number of entries whose reference count differs
     */
    int verifyRefCounts()
    {
        int[] counted = new int[this.dictionary.handleBound()];
        for (int tid = 0; tid < this.positions.size(); ++tid)
        {
            counted[this.positions.get(tid)]++;
        }
        int mismatches = 0;
        for (int handle = 0; handle < counted.length; ++handle)
        {
            if (!this.dictionary.isLive(handle))
            {
                continue;
            }
            int written = this.dictionary.refCount(handle);
            if (written != counted[handle])
            {
                mismatches++;
                logger.warn("value '" + this.dictionary.valueOf(handle) + "' of column " + this.name +
                        " has reference count " + written + ", but is referenced by " + counted[handle] + " tuples");
            }
        }
        return mismatches;
    }

    private int parseInt(String token, Path file, int lineNumber) throws ColumnFormatException
    {
        try
        {
            return Integer.parseInt(token);
        }
        catch (NumberFormatException e)
        {
            throw formatError(file, lineNumber, "invalid integer '" + token + "'");
        }
    }

    private ColumnFormatException formatError(Path file, int lineNumber, String message)
    {
        String fullMessage = file + ":" + lineNumber + ": " + message;
        logger.error("failed to load column " + this.name + ", " + fullMessage);
        return new ColumnFormatException(fullMessage);
    }

    @Override
    public String toString()
    {
        return MoreObjects.toStringHelper(this)
                .add("name", name)
                .add("type", type)
                .add("size", size())
                .add("distinctValues", dictionary.size())
                .toString();
    }
}
