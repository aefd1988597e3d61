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

package io.onlineagg.types;

import java.io.IOException;
import java.util.List;
import java.util.stream.Collectors;

import io.onlineagg.Streamer;
import io.onlineagg.common.io.stream.StreamInput;
import io.onlineagg.common.io.stream.StreamOutput;
import io.onlineagg.execution.engine.aggregation.MergeableDistinctSet;

/**
 * Type of the partial result of a distinct aggregation: a {@link MergeableDistinctSet} of keys with the given types.
 */
public class DistinctSetType extends DataType<MergeableDistinctSet> implements Streamer<MergeableDistinctSet> {

    public static final int ID = 100;
    public static final String NAME = "distinct_set";

    private final List<DataType<?>> keyTypes;

    public DistinctSetType(List<DataType<?>> keyTypes) {
        if (keyTypes.isEmpty()) {
            throw new IllegalArgumentException("A distinct_set type requires at least one key type");
        }
        this.keyTypes = List.copyOf(keyTypes);
    }

    public List<DataType<?>> keyTypes() {
        return keyTypes;
    }

    @Override
    public int id() {
        return ID;
    }

    @Override
    public Precedence precedence() {
        return Precedence.DISTINCT_SET;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Streamer<MergeableDistinctSet> streamer() {
        return this;
    }

    @Override
    public Class<MergeableDistinctSet> valueClass() {
        return MergeableDistinctSet.class;
    }

    @Override
    public MergeableDistinctSet implicitCast(Object value) throws IllegalArgumentException, ClassCastException {
        if (value == null) {
            return null;
        }
        if (value instanceof MergeableDistinctSet set && set.keyTypes().equals(keyTypes)) {
            return set;
        }
        throw new ClassCastException("Can't cast '" + value + "' to " + this);
    }

    @Override
    public MergeableDistinctSet sanitizeValue(Object value) {
        return (MergeableDistinctSet) value;
    }

    @Override
    public int compare(MergeableDistinctSet o1, MergeableDistinctSet o2) {
        throw new UnsupportedOperationException("Values of type `" + this + "` cannot be compared");
    }

    @Override
    public MergeableDistinctSet readValueFrom(StreamInput in) throws IOException {
        if (!in.readBoolean()) {
            return null;
        }
        int size = in.readVInt();
        MergeableDistinctSet set = new MergeableDistinctSet(keyTypes, size);
        Object[] key = new Object[keyTypes.size()];
        for (int i = 0; i < size; i++) {
            for (int k = 0; k < key.length; k++) {
                key[k] = keyTypes.get(k).streamer().readValueFrom(in);
            }
            set.add(key);
        }
        return set;
    }

    @Override
    @SuppressWarnings("unchecked")
    public void writeValueTo(StreamOutput out, MergeableDistinctSet v) throws IOException {
        if (v == null) {
            out.writeBoolean(false);
            return;
        }
        out.writeBoolean(true);
        out.writeVInt(v.size());
        for (List<Object> key : v) {
            for (int k = 0; k < key.size(); k++) {
                Streamer<Object> streamer = (Streamer<Object>) keyTypes.get(k).streamer();
                streamer.writeValueTo(out, key.get(k));
            }
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
        return keyTypes.equals(((DistinctSetType) o).keyTypes);
    }

    @Override
    public int hashCode() {
        return 31 * ID + keyTypes.hashCode();
    }

    @Override
    public String toString() {
        return keyTypes.stream()
            .map(DataType::toString)
            .collect(Collectors.joining(",", NAME + "(", ")"));
    }
}
