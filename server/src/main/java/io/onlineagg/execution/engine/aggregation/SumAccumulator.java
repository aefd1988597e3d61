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

import java.io.IOException;

import org.jetbrains.annotations.Nullable;

import io.onlineagg.common.io.stream.StreamInput;
import io.onlineagg.common.io.stream.StreamOutput;
import io.onlineagg.data.Row;
import io.onlineagg.exceptions.AggregationTypeMismatchException;
import io.onlineagg.expression.ExpressionsInput;
import io.onlineagg.expression.aggregation.Sum;
import io.onlineagg.types.DataType;
import io.onlineagg.types.DataTypes;
import io.onlineagg.types.NumericArithmetic;

/**
 * Sums up values in the calculation type of the argument, fixed decimals are summed up unlimited.
 * The running sum is cast to the result type on {@link #eval(Row)} only.
 */
final class SumAccumulator implements Accumulator {

    private final Sum aggregation;
    private final ExpressionsInput<?> input;
    private final DataType<?> argumentType;
    private final DataType<?> returnType;
    private final NumericArithmetic<Object> arithmetic;

    @Nullable
    private Object sum;

    @SuppressWarnings("unchecked")
    SumAccumulator(Sum aggregation, ExpressionsInput<?> input) {
        this.aggregation = aggregation;
        this.input = input;
        this.argumentType = aggregation.argument().valueType();
        this.returnType = aggregation.valueType();
        this.arithmetic = (NumericArithmetic<Object>) NumericArithmetic.of(DataTypes.sumCalculationType(argumentType));
    }

    SumAccumulator(Sum aggregation, ExpressionsInput<?> input, StreamInput in) throws IOException {
        this(aggregation, input);
        this.sum = arithmetic.type().streamer().readValueFrom(in);
    }

    @Override
    public Sum aggregation() {
        return aggregation;
    }

    @Override
    public void update(Row row) {
        Object value = AggregationTypeMismatchException.checkValue(aggregation, argumentType, input.value(row));
        if (value == null) {
            return;
        }
        Object current = sum == null ? arithmetic.zero() : sum;
        sum = arithmetic.plus(current, arithmetic.type().implicitCast(value));
    }

    @Override
    public Object eval(Row row) {
        if (sum == null) {
            return null;
        }
        return returnType.implicitCast(sum);
    }

    @Override
    public void writeTo(StreamOutput out) throws IOException {
        arithmetic.type().streamer().writeValueTo(out, sum);
    }
}
