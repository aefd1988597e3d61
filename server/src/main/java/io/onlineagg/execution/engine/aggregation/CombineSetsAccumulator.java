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
import io.onlineagg.data.Row;
import io.onlineagg.exceptions.AggregationTypeMismatchException;
import io.onlineagg.expression.ExpressionsInput;
import io.onlineagg.expression.aggregation.Aggregation;
import io.onlineagg.types.DistinctSetType;

/**
 * Unions the partial distinct sets arriving as input values into its own set.
 * Arriving sets are copied, never retained.
 */
final class CombineSetsAccumulator extends DistinctAccumulator {

    private final ExpressionsInput<?> input;

    CombineSetsAccumulator(Aggregation aggregation,
                           ExpressionsInput<?> input,
                           DistinctSetType setType,
                           DistinctFinisher finisher,
                           int expectedElements,
                           int warnThreshold) {
        super(aggregation, setType, finisher, expectedElements, warnThreshold);
        this.input = input;
    }

    CombineSetsAccumulator(Aggregation aggregation,
                           ExpressionsInput<?> input,
                           DistinctSetType setType,
                           DistinctFinisher finisher,
                           int expectedElements,
                           int warnThreshold,
                           StreamInput in) throws IOException {
        super(aggregation, setType, finisher, expectedElements, warnThreshold, in);
        this.input = input;
    }

    @Override
    public void update(Row row) {
        MergeableDistinctSet partial = AggregationTypeMismatchException.checkValue(aggregation(), setType(), input.value(row));
        if (partial == null) {
            return;
        }
        set.union(partial);
        checkSize();
    }
}
