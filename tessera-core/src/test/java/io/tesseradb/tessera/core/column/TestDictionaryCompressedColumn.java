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

import io.tesseradb.tessera.common.utils.ConfigFactory;
import io.tesseradb.tessera.common.utils.Constants;
import io.tesseradb.tessera.core.AnyValue;
import io.tesseradb.tessera.core.AttributeType;
import io.tesseradb.tessera.core.TidList;
import io.tesseradb.tessera.core.encoding.DictionaryEntry;
import io.tesseradb.tessera.core.exception.NoValueException;
import io.tesseradb.tessera.core.exception.TidOutOfRangeException;
import io.tesseradb.tessera.core.exception.TypeMismatchException;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class TestDictionaryCompressedColumn
{
    @Before
    public void setUp()
    {
        // small chunks, so that removals shift elements across chunk boundaries
        ConfigFactory.Instance().addProperty(Constants.POSITION_CHUNK_SIZE_KEY, "4");
    }

    @After
    public void tearDown()
    {
        ConfigFactory.Instance().addProperty(Constants.POSITION_CHUNK_SIZE_KEY,
                Integer.toString(Constants.DEFAULT_POSITION_CHUNK_SIZE));
    }

    private static DictionaryCompressedColumn<Integer> intColumn(int... values)
    {
        DictionaryCompressedColumn<Integer> column =
                new DictionaryCompressedColumn<>("id", AttributeType.INT, Integer.class);
        for (int value : values)
        {
            column.insert(value);
        }
        return column;
    }

    private static DictionaryCompressedColumn<String> stringColumn(String... values)
    {
        DictionaryCompressedColumn<String> column =
                new DictionaryCompressedColumn<>("name", AttributeType.VARCHAR, String.class);
        column.insertAll(Arrays.asList(values));
        return column;
    }

    private static <T extends Comparable<? super T>> List<T> values(DictionaryCompressedColumn<T> column)
    {
        List<T> values = new ArrayList<>(column.size());
        for (int tid = 0; tid < column.size(); ++tid)
        {
            values.add(column.getValue(tid));
        }
        return values;
    }

    /**
     * The sum of the reference counts equals the size, and no entry has a reference count of zero.
     */
    private static void assertConsistent(DictionaryCompressedColumn<?> column)
    {
        int sum = 0;
        for (DictionaryEntry<?> entry : column.getDictionary().entries())
        {
            assertTrue("dead entry " + entry, entry.getRefCount() >= 1);
            sum += entry.getRefCount();
        }
        assertEquals(column.size(), sum);
    }

    @Test
    public void testWorkedExample()
    {
        DictionaryCompressedColumn<Integer> column = intColumn(5, 7, 5);
        assertEquals(3, column.size());
        assertEquals(Arrays.asList(5, 7, 5), values(column));
        assertEquals(Arrays.asList(new DictionaryEntry<>(5, 2), new DictionaryEntry<>(7, 1)),
                column.getDictionary().entries());

        column.remove(0);
        assertEquals(2, column.size());
        assertEquals(Arrays.asList(7, 5), values(column));
        assertEquals(Arrays.asList(new DictionaryEntry<>(5, 1), new DictionaryEntry<>(7, 1)),
                column.getDictionary().entries());
        assertConsistent(column);
    }

    @Test
    public void testInsertThenGet()
    {
        DictionaryCompressedColumn<String> column = stringColumn("a", "b");
        int tid = column.insert(AnyValue.of("x"));
        assertEquals(2, tid);
        assertEquals("x", column.getValue(tid));
        assertEquals(AnyValue.of("x"), column.get(tid));
    }

    @Test
    public void testDeduplication()
    {
        DictionaryCompressedColumn<String> column = stringColumn("v", "w", "v");
        assertEquals(2, column.getDictionary().refCountOf("v"));
        column.remove(2);
        assertEquals(1, column.getDictionary().refCountOf("v"));
        column.remove(0);
        assertEquals(0, column.getDictionary().refCountOf("v"));
        assertEquals(1, column.getDictionary().size());
        assertConsistent(column);
    }

    @Test
    public void testRemoveRenumbers()
    {
        DictionaryCompressedColumn<Integer> column = intColumn(0, 1, 2, 3, 4, 5, 6, 7, 8, 9);
        List<Integer> before = values(column);
        column.remove(0);
        assertEquals(9, column.size());
        for (int i = 0; i < column.size(); ++i)
        {
            assertEquals(before.get(i + 1), column.getValue(i));
        }
        column.remove(3);
        assertEquals(Arrays.asList(1, 2, 3, 5, 6, 7, 8, 9), values(column));
        column.remove(7);
        assertEquals(Arrays.asList(1, 2, 3, 5, 6, 7, 8), values(column));
        assertConsistent(column);
    }

    @Test
    public void testUpdatePreservesSize()
    {
        DictionaryCompressedColumn<Integer> column = intColumn(5, 7, 5);
        column.update(1, 5);
        assertEquals(3, column.size());
        assertEquals(Arrays.asList(5, 5, 5), values(column));
        assertEquals(0, column.getDictionary().refCountOf(7));
        assertEquals(3, column.getDictionary().refCountOf(5));

        column.update(0, AnyValue.of(9));
        assertEquals(3, column.size());
        assertEquals(Arrays.asList(9, 5, 5), values(column));
        assertConsistent(column);
    }

    @Test
    public void testUpdateSameValue()
    {
        DictionaryCompressedColumn<Integer> column = intColumn(5);
        column.update(0, 5);
        assertEquals(1, column.size());
        assertEquals(Integer.valueOf(5), column.getValue(0));
        assertEquals(1, column.getDictionary().refCountOf(5));
    }

    @Test
    public void testUpdateList()
    {
        DictionaryCompressedColumn<Integer> column = intColumn(1, 2, 3, 4, 5);
        column.update(TidList.of(4, 0, 2), AnyValue.of(0));
        assertEquals(Arrays.asList(0, 2, 0, 4, 0), values(column));
        assertConsistent(column);
    }

    @Test
    public void testUpdateListStopsAtFirstFailure()
    {
        DictionaryCompressedColumn<Integer> column = intColumn(1, 2, 3);
        try
        {
            column.update(TidList.of(0, 3, 1), AnyValue.of(9));
            fail();
        }
        catch (TidOutOfRangeException e)
        {
            assertEquals(3, e.getTid());
        }
        assertEquals(Arrays.asList(9, 2, 3), values(column));
        assertConsistent(column);
    }

    @Test
    public void testRemoveList()
    {
        DictionaryCompressedColumn<Integer> column = intColumn(10, 11, 12, 13, 14, 15, 16, 17, 18, 19);
        // unsorted and duplicated, all tids refer to the tuples before the removal
        column.remove(TidList.of(7, 1, 3, 1, 9));
        assertEquals(Arrays.asList(10, 12, 14, 15, 16, 18), values(column));
        assertConsistent(column);

        column.remove(TidList.range(0, column.size()));
        assertEquals(0, column.size());
        assertTrue(column.getDictionary().isEmpty());
    }

    @Test
    public void testRemoveListMatchesDescendingRemoval()
    {
        DictionaryCompressedColumn<String> bulk = stringColumn("a", "b", "a", "c", "d", "b", "e", "a", "f");
        DictionaryCompressedColumn<String> single = bulk.copy();
        int[] tids = {0, 2, 5, 6, 8};
        bulk.remove(TidList.of(tids));
        for (int i = tids.length - 1; i >= 0; --i)
        {
            single.remove(tids[i]);
        }
        assertEquals(values(single), values(bulk));
        assertEquals(single.getDictionary().entries(), bulk.getDictionary().entries());
    }

    @Test
    public void testRemoveListOutOfRangeRemovesNothing()
    {
        DictionaryCompressedColumn<Integer> column = intColumn(1, 2, 3);
        try
        {
            column.remove(TidList.of(0, 3));
            fail();
        }
        catch (TidOutOfRangeException e)
        {
            assertEquals(3, e.getTid());
            assertEquals(3, e.getSize());
        }
        assertEquals(Arrays.asList(1, 2, 3), values(column));

        column.remove(new TidList());
        assertEquals(3, column.size());
    }

    @Test
    public void testOutOfRange()
    {
        DictionaryCompressedColumn<Integer> column = intColumn(1, 2);
        for (int tid : new int[] {2, 3, -1})
        {
            try
            {
                column.getValue(tid);
                fail();
            }
            catch (TidOutOfRangeException expected)
            {
            }
            try
            {
                column.update(tid, 5);
                fail();
            }
            catch (TidOutOfRangeException expected)
            {
            }
            try
            {
                column.remove(tid);
                fail();
            }
            catch (TidOutOfRangeException expected)
            {
            }
        }
        assertEquals(Arrays.asList(1, 2), values(column));
        assertEquals(0, column.getDictionary().refCountOf(5));
    }

    @Test
    public void testInvalidValuesLeaveColumnUnchanged()
    {
        DictionaryCompressedColumn<Integer> column = intColumn(1);
        try
        {
            column.insert(AnyValue.empty());
            fail();
        }
        catch (NoValueException expected)
        {
        }
        try
        {
            column.insert(AnyValue.of("1"));
            fail();
        }
        catch (TypeMismatchException e)
        {
            assertEquals(Integer.class, e.getExpectedType());
            assertEquals(String.class, e.getActualType());
        }
        try
        {
            column.insert(AnyValue.of(1L));
            fail();
        }
        catch (TypeMismatchException expected)
        {
        }
        try
        {
            column.update(0, AnyValue.empty());
            fail();
        }
        catch (NoValueException expected)
        {
        }
        try
        {
            column.update(TidList.of(0), AnyValue.of(2.0));
            fail();
        }
        catch (TypeMismatchException expected)
        {
        }
        assertEquals(1, column.size());
        assertEquals(Integer.valueOf(1), column.getValue(0));
        assertEquals(1, column.getDictionary().size());
    }

    @Test
    public void testInsertAllKeepsPrefixOnFailure()
    {
        DictionaryCompressedColumn<Integer> column = intColumn();
        try
        {
            column.insertAll(Arrays.asList(AnyValue.of(1), AnyValue.of(2), AnyValue.of("3"), AnyValue.of(4)));
            fail();
        }
        catch (TypeMismatchException expected)
        {
        }
        assertEquals(Arrays.asList(1, 2), values(column));
    }

    @Test
    public void testClearTwice()
    {
        DictionaryCompressedColumn<Integer> column = intColumn(1, 2, 2);
        column.clear();
        assertEquals(0, column.size());
        column.clear();
        assertEquals(0, column.size());
        assertTrue(column.getDictionary().isEmpty());
        assertEquals(0, column.insert(3));
    }

    @Test
    public void testCopyIsIndependent()
    {
        DictionaryCompressedColumn<String> column = stringColumn("a", "b", "a");
        DictionaryCompressedColumn<String> copy = column.copy();
        assertNotSame(column.getDictionary(), copy.getDictionary());
        assertEquals("name", copy.getName());
        assertEquals(AttributeType.VARCHAR, copy.getType());

        copy.update(0, "z");
        copy.remove(1);
        copy.insert("c");
        column.remove(2);

        assertEquals(Arrays.asList("a", "b"), values(column));
        assertEquals(Arrays.asList("z", "a", "c"), values(copy));
        assertEquals(1, column.getDictionary().refCountOf("a"));
        assertEquals(1, copy.getDictionary().refCountOf("a"));
        assertEquals(0, column.getDictionary().refCountOf("z"));
        assertConsistent(column);
        assertConsistent(copy);
    }

    @Test
    public void testSizeInBytes()
    {
        DictionaryCompressedColumn<Integer> column = intColumn();
        assertEquals(0, column.getSizeInBytes());
        column.insert(5);
        column.insert(7);
        column.insert(5);
        // one chunk of four handles, two distinct values of four bytes with a four bytes reference count
        assertEquals(4 * Integer.BYTES + 2 * (Integer.BYTES + Integer.BYTES), column.getSizeInBytes());
    }

    @Test
    public void testInvariantsUnderMixedOperations()
    {
        DictionaryCompressedColumn<Integer> column = intColumn();
        List<Integer> expected = new ArrayList<>();
        for (int i = 0; i < 200; ++i)
        {
            int value = (i * 31) % 17;
            column.insert(value);
            expected.add(value);
            if (i % 7 == 3)
            {
                int tid = (i * 13) % expected.size();
                column.remove(tid);
                expected.remove(tid);
            }
            if (i % 5 == 1)
            {
                int tid = (i * 11) % expected.size();
                column.update(tid, i % 23);
                expected.set(tid, i % 23);
            }
            assertConsistent(column);
        }
        assertEquals(expected, values(column));
    }

    @Test
    public void testDictionaryViewIsReadOnly()
    {
        DictionaryCompressedColumn<String> column = stringColumn("b", "a", "b");
        List<DictionaryEntry<String>> entries = column.getDictionaryEntries();
        assertEquals(Arrays.asList(new DictionaryEntry<>("a", 1), new DictionaryEntry<>("b", 2)), entries);
        assertEquals(2, column.getRefCount("b"));
        assertEquals(0, column.getRefCount("c"));
        assertEquals(2, column.getDistinctCount());
        try
        {
            entries.add(new DictionaryEntry<>("c", 1));
            fail();
        }
        catch (UnsupportedOperationException expected)
        {
        }
        // the snapshot does not follow later changes of the column
        column.remove(1);
        assertEquals(2, entries.size());
        assertEquals(1, column.getDistinctCount());
        assertConsistent(column);
    }

    @Test
    public void testDictionaryIsNotPublic() throws NoSuchMethodException
    {
        Method method = DictionaryCompressedColumn.class.getDeclaredMethod("getDictionary");
        assertFalse(Modifier.isPublic(method.getModifiers()));
        assertFalse(Modifier.isProtected(method.getModifiers()));
    }

    @Test
    public void testToString()
    {
        String text = intColumn(1, 1, 2).toString();
        assertTrue(text, text.contains("name=id"));
        assertTrue(text, text.contains("size=3"));
        assertTrue(text, text.contains("distinctValues=2"));
    }
}
