/*
 * Licensed to Crate.io GmbH ("Crate") under one or more contributor
 * license agreements.  See the NOTICE file distributed with this work for
 * additional information regarding copyright ownership.  Crate licenses
 * this file to you under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.  You may
 * obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.  See the
 * License for the specific language governing permissions and limitations
 * under the License.
 *
 * However, if you have executed another commercial license agreement
 * with Crate these terms will supersede the license and you may use the
 * software solely pursuant to the terms of the relevant commercial agreement.
 */

package io.onlineagg.common.settings;

import java.util.Locale;
import java.util.function.Function;

/**
 * A typed setting with a key and a default value.
 * Values are parsed from the string representation stored in {@link Settings}.
 */
public class Setting<T> {

    private final String key;
    private final String defaultValue;
    private final Function<String, T> parser;

    public Setting(String key, String defaultValue, Function<String, T> parser) {
        this.key = key;
        this.defaultValue = defaultValue;
        this.parser = parser;
    }

    public static Setting<Integer> intSetting(String key, int defaultValue, int minValue) {
        return new Setting<>(key, Integer.toString(defaultValue), s -> parseInt(s, minValue, key));
    }

    public static Setting<Boolean> boolSetting(String key, boolean defaultValue) {
        return new Setting<>(key, Boolean.toString(defaultValue), s -> parseBoolean(s, key));
    }

    public static int parseInt(String s, int minValue, String key) {
        int value;
        try {
            value = Integer.parseInt(s.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                "Failed to parse value [" + s + "] for setting [" + key + "]", e);
        }
        if (value < minValue) {
            throw new IllegalArgumentException(String.format(
                Locale.ENGLISH,
                "Failed to parse value [%s] for setting [%s] must be >= %d",
                s,
                key,
                minValue
            ));
        }
        return value;
    }

    static boolean parseBoolean(String s, String key) {
        String value = s.trim().toLowerCase(Locale.ENGLISH);
        return switch (value) {
            case "true" -> true;
            case "false" -> false;
            default -> throw new IllegalArgumentException(
                "Failed to parse value [" + s + "] as only [true] or [false] are allowed for setting [" + key + "]");
        };
    }

    public String getKey() {
        return key;
    }

    /**
     * Returns the value of this setting in {@code settings} or the default if it isn't set.
     *
     * @throws IllegalArgumentException if the value can't be parsed
     */
    public T get(Settings settings) {
        return parser.apply(settings.get(key, defaultValue));
    }

    @Override
    public String toString() {
        return "{key=" + key + ", default=" + defaultValue + "}";
    }
}
