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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * The process-wide configuration of Tessera.
 * <p>
 * The properties are loaded from the file named by the environment variable TESSERA_CONFIG.
 * If it is not set, etc/tessera.properties under TESSERA_HOME is used. If neither is set,
 * tessera.properties on the class path is used.
 * </p>
 * @create 2026-10-18
 */
public class ConfigFactory
{
    private static final Logger logger = LogManager.getLogger(ConfigFactory.class);

    private static ConfigFactory instance = null;

    public static ConfigFactory Instance()
    {
        if (instance == null)
        {
            instance = new ConfigFactory();
        }
        return instance;
    }

    // Properties is thread safe, so we do not add synchronization to it.
    private final Properties prop;

    private ConfigFactory()
    {
        prop = new Properties();
        String tesseraConfig = System.getenv("TESSERA_CONFIG");
        String tesseraHome = System.getenv("TESSERA_HOME");
        if (tesseraHome != null)
        {
            prop.setProperty("tessera.home", tesseraHome);
        }
        if (tesseraConfig == null && tesseraHome != null)
        {
            if (!(tesseraHome.endsWith("/") || tesseraHome.endsWith("\\")))
            {
                tesseraHome += "/";
            }
            tesseraConfig = tesseraHome + "etc/tessera.properties";
        }

        InputStream in = null;
        try
        {
            if (tesseraConfig == null)
            {
                in = this.getClass().getResourceAsStream("/tessera.properties");
            }
            else
            {
                in = new FileInputStream(tesseraConfig);
            }
            if (in != null)
            {
                prop.load(in);
            }
            else
            {
                logger.warn("tessera.properties is not found, using the built-in defaults");
            }
        }
        catch (IOException e)
        {
            logger.error("failed to load the configuration from " + tesseraConfig, e);
        }
        finally
        {
            if (in != null)
            {
                try
                {
                    in.close();
                }
                catch (IOException e)
                {
                    logger.error("failed to close the configuration file", e);
                }
            }
        }
    }

    /**
     * Set a property. Columns read their properties when they are created,
     * so the new value applies to the columns created afterwards.
     */
    public synchronized void addProperty(String key, String value)
    {
        this.prop.setProperty(key, value);
    }

    public synchronized String getProperty(String key)
    {
        return this.prop.getProperty(key);
    }

    /**
     * @param key the property key
     * @param defaultValue returned if the key is absent
     * @return the integer value of the property
     * @throws NumberFormatException if the property is present but not an integer
     */
    public synchronized int getIntProperty(String key, int defaultValue)
    {
        String value = this.prop.getProperty(key);
        if (value == null)
        {
            return defaultValue;
        }
        return Integer.parseInt(value.trim());
    }

    public synchronized boolean getBooleanProperty(String key, boolean defaultValue)
    {
        String value = this.prop.getProperty(key);
        if (value == null)
        {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }
}
