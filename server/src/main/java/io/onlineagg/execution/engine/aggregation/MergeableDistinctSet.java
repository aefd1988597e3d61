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

package io.onlineagg.execution.engine.aggregation;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.StringJoiner;

import com.carrotsearch.hppc.ObjectHashSet;
import com.carrotsearch.hppc.cursors.ObjectCursor;

import io.onlineagg.exceptions.AggregationTypeMismatchException;
import io.onlineagg.types.DataType;

/**
 * A set of distinct key tuples which can be merged with other sets of the same key types.
 *
 * <p>
 * Used both to collect the distinct keys of a single partition and to union the sets of all partitions.
 * Adding keys and {@link #union(MergeableDistinctSet) union} commute: the content only depends on which keys
 * have been seen, never on the order or partitioning of the rows they came from.
 * </p>
 *
 * <p>
 * Keys with a null component are ignored. Components are normalized so that value-equal
 * decimals of different scale are the same key, as are {@code 0.0} and {@code -0.0}.
 * </p>
 *
 * Not thread-safe; a set is owned by a single accumulator.
 */
public final class MergeableDistinctSet implements Iterable<List<Object>> {

    public static final int DEFAULT_EXPECTED_ELEMENTS = 16;

    private final List<DataType<?>> keyTypes;
    private final ObjectHashSet<List<Object>> keys;

    public MergeableDistinctSet(List<DataType<?>> keyTypes) {
        this(keyTypes, DEFAULT_EXPECTED_ELEMENTS);
    }

    public MergeableDistinctSet(List<DataType<?>> keyTypes, int expectedElements) {
        if (keyTypes.isEmpty()) {
            throw new IllegalArgumentException("A distinct set requires at least one key type");
        }
        this.keyTypes = List.copyOf(keyTypes);
        this.keys = new ObjectHashSet<>(expectedElements);
    }

    public List<DataType<?>> keyTypes() {
        return keyTypes;
    }

    /**
     * Adds the key to the set. Keys containing a null component are ignored.
     *
     * @return true if the set changed
     * @throws AggregationTypeMismatchException if the key doesn't match the key types of this set
     */
    public boolean add(Object ... key) {
        if (key.length != keyTypes.size()) {
            throw new AggregationTypeMismatchException(String.format(
                Locale.ENGLISH,
                "Distinct key %s has %d components, but the set expects %d: %s",
                Arrays.toString(key),
                key.length,
                keyTypes.size(),
                keyTypes
            ));
        }
        Object[] normalized = new Object[key.length];
        for (int i = 0; i < key.length; i++) {
            Object component = key[i];
            if (component == null) {
                return false;
            }
            AggregationTypeMismatchException.checkValue("distinct set of " + keyTypes, keyTypes.get(i), component);
            normalized[i] = normalize(component);
        }
        return keys.add(List.of(normalized));
    }

    /**
     * Adds all keys of {@code other} to this set.
     * {@code other} must not be used by the caller afterwards.
     */
    public void union(MergeableDistinctSet other) {
        if (!keyTypes.equals(other.keyTypes)) {
            throw new AggregationTypeMismatchException(String.format(
                Locale.ENGLISH,
                "Cannot union distinct sets with different key types: %s and %s",
                keyTypes,
                other.keyTypes
            ));
        }
        if (other.isEmpty()) {
            return;
        }
        keys.addAll(other.keys);
    }

    public int size() {
        return keys.size();
    }

    public boolean isEmpty() {
        return keys.isEmpty();
    }

    public boolean contains(Object ... key) {
        Object[] normalized = new Object[key.length];
        for (int i = 0; i < key.length; i++) {
            if (key[i] == null) {
                return false;
            }
            normalized[i] = normalize(key[i]);
        }
        return keys.contains(List.of(normalized));
    }

    /**
     * Returns a new iterator over the keys on every call. The iteration order is unspecified.
     */
    @Override
    public Iterator<List<Object>> iterator() {
        Iterator<ObjectCursor<List<Object>>> it = keys.iterator();
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return it.hasNext();
            }

            @Override
            public List<Object> next() {
                return it.next().value;
            }
        };
    }

    /**
     * Maps value-equal components to one representation: decimals lose trailing zeros,
     * {@code -0.0} becomes {@code 0.0} and every NaN becomes {@link Double#NaN}.
     */
    static Object normalize(Object component) {
        if (component instanceof BigDecimal bigDecimal) {
            return bigDecimal.stripTrailingZeros();
        }
        if (component instanceof Double d) {
            if (d.isNaN()) {
                return Double.NaN;
            }
            if (d == 0.0d) {
                return 0.0d;
            }
        }
        return component;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        MergeableDistinctSet that = (MergeableDistinctSet) o;
        return keyTypes.equals(that.keyTypes) && keys.equals(that.keys);
    }

    @Override
    public int hashCode() {
        return 31 * keyTypes.hashCode() + keys.hashCode();
    }

    @Override
    public String toString() {
        StringJoiner joiner = new StringJoiner(", ", "{", "}");
        for (List<Object> key : this) {
            joiner.add(key.size() == 1 ? String.valueOf(key.get(0)) : key.toString());
        }
        return joiner.toString();
    }
}
