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
package io.tesseradb.tessera.core;

import com.google.common.collect.ImmutableSet;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.function.Function;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * The declared type of the values in a column.
 * <p>
 * Each type is bound to the immutable, comparable Java class of its values, an estimated
 * width in bytes of one value, and the text form used when a column is stored.
 * </p>
 * @create 2026-10-18
 */
public enum AttributeType
{
    INT(Integer.class, Integer.BYTES, Integer::valueOf, "int", "integer"),
    LONG(Long.class, Long.BYTES, Long::valueOf, "bigint", "long", "oid"),
    FLOAT(Float.class, Float.BYTES, Float::valueOf, "float", "real"),
    DOUBLE(Double.class, Double.BYTES, Double::valueOf, "double"),
    BOOLEAN(Boolean.class, 1, AttributeType::parseBoolean, "boolean"),
    CHAR(Character.class, Character.BYTES, AttributeType::parseChar, "char"),
    /**
     * The width of a varchar value is estimated as the size of an object reference,
     * the characters of the string are not counted.
     */
    VARCHAR(String.class, Long.BYTES, Function.identity(), "varchar", "string");

    private final Class<? extends Comparable<?>> javaType;
    private final int fixedWidth;
    private final Function<String, ? extends Comparable<?>> parser;
    private final String primaryName;
    private final Set<String> allNames = new HashSet<>();

    /**
     * Ensure that all elements in names are in <b>lowercase</b>.
     */
    AttributeType(Class<? extends Comparable<?>> javaType, int fixedWidth,
                  Function<String, ? extends Comparable<?>> parser, String... names)
    {
        checkArgument(names != null && names.length > 0,
                "names is null or empty");
        this.javaType = javaType;
        this.fixedWidth = fixedWidth;
        this.parser = parser;
        this.primaryName = names[0];
        this.allNames.addAll(Arrays.asList(names));
    }

    public Class<? extends Comparable<?>> getJavaType()
    {
        return javaType;
    }

    /**
     * @return the estimated number of bytes of one value of this type
     */
    public int getFixedWidth()
    {
        return fixedWidth;
    }

    public String getPrimaryName()
    {
        return primaryName;
    }

    public Set<String> getAllNames()
    {
        return ImmutableSet.copyOf(this.allNames);
    }

    public boolean match(String name)
    {
        return this.allNames.contains(name.toLowerCase(Locale.ENGLISH));
    }

    /**
     * Get the text form of a value of this type. The text form is parsed back to
     * an equal value by {@link #parse(String)}.
     * @param value the value, must be an instance of the java type of this type
     * @return the text form
     */
    public String format(Object value)
    {
        requireNonNull(value, "value is null");
        checkArgument(javaType.isInstance(value),
                "value is not an instance of %s", javaType.getName());
        return value.toString();
    }

    /**
     * Parse the text form of a value of this type.
     * @param text the text form
     * @return the value
     * @throws IllegalArgumentException if the text is not a valid value of this type
     */
    public Comparable<?> parse(String text)
    {
        requireNonNull(text, "text is null");
        return parser.apply(text);
    }

    /**
     * @param name the name or alias of the type, case-insensitive
     * @return the attribute type
     * @throws IllegalArgumentException if no type matches the name
     */
    public static AttributeType fromName(String name)
    {
        requireNonNull(name, "name is null");
        for (AttributeType type : values())
        {
            if (type.match(name))
            {
                return type;
            }
        }
        throw new IllegalArgumentException("unknown attribute type '" + name + "'");
    }

    /**
     * @param javaType the java class of the values
     * @return the attribute type bound to the class
     * @throws IllegalArgumentException if no type is bound to the class
     */
    public static AttributeType fromJavaType(Class<?> javaType)
    {
        requireNonNull(javaType, "javaType is null");
        for (AttributeType type : values())
        {
            if (type.javaType == javaType)
            {
                return type;
            }
        }
        throw new IllegalArgumentException("no attribute type for " + javaType.getName());
    }

    private static Boolean parseBoolean(String text)
    {
        if ("true".equals(text))
        {
            return Boolean.TRUE;
        }
        if ("false".equals(text))
        {
            return Boolean.FALSE;
        }
        throw new IllegalArgumentException("invalid boolean '" + text + "'");
    }

    private static Character parseChar(String text)
    {
        checkArgument(text.length() == 1, "invalid char '%s'", text);
        return text.charAt(0);
    }
}
