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

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.TreeMap;

import org.jetbrains.annotations.Nullable;

/**
 * An immutable map of setting keys to their string values.
 */
public final class Settings {

    public static final Settings EMPTY = new Settings(Map.of());

    private final Map<String, String> settings;

    private Settings(Map<String, String> settings) {
        this.settings = Map.copyOf(settings);
    }

    @Nullable
    public String get(String key) {
        return settings.get(key);
    }

    public String get(String key, String defaultValue) {
        String value = settings.get(key);
        return value == null ? defaultValue : value;
    }

    public Set<String> keySet() {
        return settings.keySet();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Settings fromProperties(Properties properties) {
        Builder builder = builder();
        for (String key : properties.stringPropertyNames()) {
            builder.put(key, properties.getProperty(key));
        }
        return builder.build();
    }

    /**
     * Loads settings from a properties file on the class path, returns {@link #EMPTY} if it doesn't exist.
     */
    public static Settings fromClasspath(String resource) throws IOException {
        try (InputStream in = Settings.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                return EMPTY;
            }
            Properties properties = new Properties();
            properties.load(in);
            return fromProperties(properties);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return settings.equals(((Settings) o).settings);
    }

    @Override
    public int hashCode() {
        return settings.hashCode();
    }

    @Override
    public String toString() {
        return new TreeMap<>(settings).toString();
    }

    public static class Builder {

        private final Map<String, String> map = new TreeMap<>();

        private Builder() {
        }

        public Builder put(String key, String value) {
            map.put(key, value);
            return this;
        }

        public Builder put(String key, int value) {
            return put(key, Integer.toString(value));
        }

        public Builder put(String key, boolean value) {
            return put(key, Boolean.toString(value));
        }

        public Builder put(Settings settings) {
            for (String key : settings.keySet()) {
                map.put(key, settings.get(key));
            }
            return this;
        }

        public Settings build() {
            return new Settings(map);
        }
    }
}
