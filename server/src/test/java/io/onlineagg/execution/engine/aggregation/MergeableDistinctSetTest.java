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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import org.junit.Test;

import io.onlineagg.common.io.stream.BytesStreamOutput;
import io.onlineagg.exceptions.AggregationTypeMismatchException;
import io.onlineagg.types.DataType;
import io.onlineagg.types.DataTypes;
import io.onlineagg.types.DistinctSetType;

public class MergeableDistinctSetTest {

    private static final List<DataType<?>> LONG_KEY = List.of(DataTypes.LONG);

    private static MergeableDistinctSet setOf(Object ... values) {
        MergeableDistinctSet set = new MergeableDistinctSet(LONG_KEY);
        for (Object value : values) {
            set.add(value);
        }
        return set;
    }

    @Test
    public void test_equal_keys_are_stored_once_and_null_keys_are_skipped() {
        MergeableDistinctSet set = new MergeableDistinctSet(LONG_KEY);
        assertThat(set.add(1L)).isTrue();
        assertThat(set.add(1L)).isFalse();
        assertThat(set.add((Object) null)).isFalse();
        assertThat(set.add(2L)).isTrue();

        assertThat(set.size()).isEqualTo(2);
        assertThat(set.contains(1L)).isTrue();
        assertThat(set.contains(3L)).isFalse();
        assertThat(set.contains((Object) null)).isFalse();
    }

    @Test
    public void test_key_with_any_null_component_is_skipped() {
        MergeableDistinctSet set = new MergeableDistinctSet(List.of(DataTypes.LONG, DataTypes.STRING));
        assertThat(set.add(1L, null)).isFalse();
        assertThat(set.add(1L, "a")).isTrue();
        assertThat(set.add(1L, "b")).isTrue();
        assertThat(set.size()).isEqualTo(2);
    }

    @Test
    public void test_numerically_equal_decimals_are_the_same_key() {
        MergeableDistinctSet set = new MergeableDistinctSet(List.of(DataTypes.NUMERIC));
        set.add(new BigDecimal("1.50"));
        set.add(new BigDecimal("1.5"));
        assertThat(set.size()).isEqualTo(1);
        assertThat(set.contains(new BigDecimal("1.500"))).isTrue();
    }

    @Test
    public void test_signed_zeros_and_nans_are_the_same_key() {
        MergeableDistinctSet set = new MergeableDistinctSet(List.of(DataTypes.DOUBLE));
        assertThat(set.add(0.0d)).isTrue();
        assertThat(set.add(-0.0d)).isFalse();
        assertThat(set.add(Double.NaN)).isTrue();
        assertThat(set.add(Double.longBitsToDouble(0x7ff8000000000001L))).isFalse();

        assertThat(set.size()).isEqualTo(2);
        assertThat(set.contains(-0.0d)).isTrue();
        assertThat(set).containsExactlyInAnyOrder(List.of(0.0d), List.of(Double.NaN));
    }

    @Test
    public void test_union_of_signed_zeros_keeps_one_key() {
        MergeableDistinctSet positive = new MergeableDistinctSet(List.of(DataTypes.DOUBLE));
        positive.add(0.0d);
        MergeableDistinctSet negative = new MergeableDistinctSet(List.of(DataTypes.DOUBLE));
        negative.add(-0.0d);
        positive.union(negative);
        assertThat(positive.size()).isEqualTo(1);
    }

    @Test
    public void test_union_contains_the_keys_of_both_sets() {
        MergeableDistinctSet left = setOf(1L, 2L);
        MergeableDistinctSet right = setOf(2L, 3L);
        left.union(right);

        assertThat(left).isEqualTo(setOf(3L, 2L, 1L));
        assertThat(left.size()).isEqualTo(3);
    }

    @Test
    public void test_union_with_empty_set_changes_nothing() {
        MergeableDistinctSet set = setOf(1L, 2L);
        set.union(new MergeableDistinctSet(LONG_KEY));
        assertThat(set).isEqualTo(setOf(1L, 2L));
    }

    @Test
    public void test_union_is_commutative() {
        MergeableDistinctSet ab = setOf(1L, 2L);
        ab.union(setOf(2L, 3L));
        MergeableDistinctSet ba = setOf(2L, 3L);
        ba.union(setOf(1L, 2L));
        assertThat(ab).isEqualTo(ba);
    }

    @Test
    public void test_iteration_is_restartable() {
        MergeableDistinctSet set = setOf(1L, 2L, 3L);
        List<Object> first = new ArrayList<>();
        for (List<Object> key : set) {
            first.add(key.get(0));
        }
        List<Object> second = new ArrayList<>();
        for (List<Object> key : set) {
            second.add(key.get(0));
        }
        assertThat(first).containsExactlyInAnyOrder(1L, 2L, 3L);
        assertThat(second).containsExactlyElementsOf(first);
    }

    @Test
    public void test_key_of_wrong_type_is_rejected() {
        MergeableDistinctSet set = new MergeableDistinctSet(LONG_KEY);
        assertThatThrownBy(() -> set.add("a"))
            .isExactlyInstanceOf(AggregationTypeMismatchException.class)
            .hasMessageContaining("expected a value of type `bigint` but got `a` of class `String`");
    }

    @Test
    public void test_key_of_wrong_arity_is_rejected() {
        MergeableDistinctSet set = new MergeableDistinctSet(LONG_KEY);
        assertThatThrownBy(() -> set.add(1L, 2L))
            .isExactlyInstanceOf(AggregationTypeMismatchException.class)
            .hasMessageContaining("has 2 components, but the set expects 1");
    }

    @Test
    public void test_union_of_sets_with_different_key_types_is_rejected() {
        MergeableDistinctSet set = new MergeableDistinctSet(LONG_KEY);
        MergeableDistinctSet other = new MergeableDistinctSet(List.of(DataTypes.STRING));
        assertThatThrownBy(() -> set.union(other))
            .isExactlyInstanceOf(AggregationTypeMismatchException.class)
            .hasMessage("Cannot union distinct sets with different key types: [bigint] and [text]");
    }

    @Test
    public void test_distinct_set_streaming() throws IOException {
        DistinctSetType type = new DistinctSetType(List.of(DataTypes.LONG, DataTypes.STRING));
        MergeableDistinctSet set = new MergeableDistinctSet(type.keyTypes());
        set.add(1L, "a");
        set.add(2L, "b");
        try (BytesStreamOutput out = new BytesStreamOutput()) {
            type.writeValueTo(out, set);
            type.writeValueTo(out, null);

            var in = out.toStreamInput();
            assertThat(type.readValueFrom(in)).isEqualTo(set);
            assertThat(type.readValueFrom(in)).isNull();
        }
    }

    @Test
    public void test_distinct_set_type_name() {
        assertThat(new DistinctSetType(List.of(DataTypes.LONG, DataTypes.STRING)))
            .hasToString("distinct_set(bigint,text)");
    }
}
