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

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class TestConfigFactory
{
    @Test
    public void testDefaultsFromClassPath()
    {
        ConfigFactory config = ConfigFactory.Instance();
        assertEquals(Constants.DEFAULT_POSITION_CHUNK_SIZE,
                config.getIntProperty(Constants.POSITION_CHUNK_SIZE_KEY, -1));
        assertEquals(Constants.INIT_DICT_SIZE,
                config.getIntProperty(Constants.DICT_INITIAL_CAPACITY_KEY, -1));
        assertFalse(config.getBooleanProperty(Constants.LOAD_VERIFY_REFCOUNTS_KEY, true));
    }

    @Test
    public void testMissingKeys()
    {
        ConfigFactory config = ConfigFactory.Instance();
        assertNull(config.getProperty("test.missing.key"));
        assertEquals(42, config.getIntProperty("test.missing.key", 42));
        assertTrue(config.getBooleanProperty("test.missing.key", true));
    }

    @Test
    public void testAddProperty()
    {
        ConfigFactory config = ConfigFactory.Instance();
        config.addProperty("test.added.key", " 17 ");
        assertEquals(17, config.getIntProperty("test.added.key", 0));
        config.addProperty("test.added.flag", "true");
        assertTrue(config.getBooleanProperty("test.added.flag", false));
    }

    @Test(expected = NumberFormatException.class)
    public void testInvalidIntProperty()
    {
        ConfigFactory config = ConfigFactory.Instance();
        config.addProperty("test.invalid.int", "many");
        config.getIntProperty("test.invalid.int", 0);
    }
}
