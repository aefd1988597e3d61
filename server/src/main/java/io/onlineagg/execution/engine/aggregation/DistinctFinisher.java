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

import java.util.List;

import org.jetbrains.annotations.Nullable;

import io.onlineagg.types.DataType;
import io.onlineagg.types.DataTypes;
import io.onlineagg.types.NumericArithmetic;

/**
 * Computes the result of a distinct aggregation from its set of distinct keys.
 */
@FunctionalInterface
interface DistinctFinisher {

    DistinctFinisher COUNT = set -> (long) set.size();

    DistinctFinisher SET = set -> set;

    @Nullable
    Object finish(MergeableDistinctSet set);

    /**
     * Sums up the single column of the keys in the calculation type of {@code keyType} and casts
     * the result to {@code returnType}. Yields null for an empty set.
     */
    @SuppressWarnings("unchecked")
    static DistinctFinisher sum(DataType<?> keyType, DataType<?> returnType) {
        NumericArithmetic<Object> arithmetic =
            (NumericArithmetic<Object>) NumericArithmetic.of(DataTypes.sumCalculationType(keyType));
        return set -> {
            if (set.isEmpty()) {
                return null;
            }
            Object sum = arithmetic.zero();
            for (List<Object> key : set) {
                sum = arithmetic.plus(sum, arithmetic.type().implicitCast(key.get(0)));
            }
            return returnType.implicitCast(sum);
        };
    }
}
