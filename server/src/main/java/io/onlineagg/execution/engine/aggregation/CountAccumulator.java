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

import io.onlineagg.common.io.stream.StreamInput;
import io.onlineagg.common.io.stream.StreamOutput;
import io.onlineagg.data.Row;
import io.onlineagg.expression.ExpressionsInput;
import io.onlineagg.expression.aggregation.Count;

final class CountAccumulator implements Accumulator {

    private final Count aggregation;
    private final ExpressionsInput<?> input;
    private long count;

    CountAccumulator(Count aggregation, ExpressionsInput<?> input) {
        this.aggregation = aggregation;
        this.input = input;
    }

    CountAccumulator(Count aggregation, ExpressionsInput<?> input, StreamInput in) throws IOException {
        this(aggregation, input);
        this.count = in.readVLong();
    }

    @Override
    public Count aggregation() {
        return aggregation;
    }

    @Override
    public void update(Row row) {
        if (input.value(row) != null) {
            count++;
        }
    }

    @Override
    public Long eval(Row row) {
        return count;
    }

    @Override
    public void writeTo(StreamOutput out) throws IOException {
        out.writeVLong(count);
    }
}
