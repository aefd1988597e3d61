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
import io.onlineagg.expression.aggregation.Max;
import io.onlineagg.types.DataType;

final class MaxAccumulator implements Accumulator {

    private final Max aggregation;
    private final ExpressionsInput<?> input;
    private final DataType<Object> type;

    @Nullable
    private Object currentMax;

    @SuppressWarnings("unchecked")
    MaxAccumulator(Max aggregation, ExpressionsInput<?> input) {
        this.aggregation = aggregation;
        this.input = input;
        this.type = (DataType<Object>) aggregation.valueType();
    }

    MaxAccumulator(Max aggregation, ExpressionsInput<?> input, StreamInput in) throws IOException {
        this(aggregation, input);
        this.currentMax = type.streamer().readValueFrom(in);
    }

    @Override
    public Max aggregation() {
        return aggregation;
    }

    @Override
    public void update(Row row) {
        Object value = AggregationTypeMismatchException.checkValue(aggregation, type, input.value(row));
        if (value == null) {
            return;
        }
        if (currentMax == null || type.compare(value, currentMax) > 0) {
            currentMax = value;
        }
    }

    @Override
    public Object eval(Row row) {
        return currentMax;
    }

    @Override
    public void writeTo(StreamOutput out) throws IOException {
        type.streamer().writeValueTo(out, currentMax);
    }
}
