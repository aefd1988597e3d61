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
import io.onlineagg.expression.aggregation.Min;
import io.onlineagg.types.DataType;

/**
 * Keeps the smallest value seen. Equal values don't replace the current one.
 */
final class MinAccumulator implements Accumulator {

    private final Min aggregation;
    private final ExpressionsInput<?> input;
    private final DataType<Object> type;

    @Nullable
    private Object currentMin;

    @SuppressWarnings("unchecked")
    MinAccumulator(Min aggregation, ExpressionsInput<?> input) {
        this.aggregation = aggregation;
        this.input = input;
        this.type = (DataType<Object>) aggregation.valueType();
    }

    MinAccumulator(Min aggregation, ExpressionsInput<?> input, StreamInput in) throws IOException {
        this(aggregation, input);
        this.currentMin = type.streamer().readValueFrom(in);
    }

    @Override
    public Min aggregation() {
        return aggregation;
    }

    @Override
    public void update(Row row) {
        Object value = AggregationTypeMismatchException.checkValue(aggregation, type, input.value(row));
        if (value == null) {
            return;
        }
        if (currentMin == null || type.compare(value, currentMin) < 0) {
            currentMin = value;
        }
    }

    @Override
    public Object eval(Row row) {
        return currentMin;
    }

    @Override
    public void writeTo(StreamOutput out) throws IOException {
        type.streamer().writeValueTo(out, currentMin);
    }
}
