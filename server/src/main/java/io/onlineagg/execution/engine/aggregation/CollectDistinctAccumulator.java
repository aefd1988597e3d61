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
import java.util.List;

import io.onlineagg.common.io.stream.StreamInput;
import io.onlineagg.data.Row;
import io.onlineagg.data.RowN;
import io.onlineagg.exceptions.AggregationTypeMismatchException;
import io.onlineagg.expression.ExpressionsInput;
import io.onlineagg.expression.aggregation.Aggregation;
import io.onlineagg.types.DataType;
import io.onlineagg.types.DistinctSetType;

/**
 * Adds the key tuple of every row to the distinct set, keys with a null component are skipped.
 * Used for COUNT(DISTINCT), SUM(DISTINCT) and the partial phase of both.
 */
final class CollectDistinctAccumulator extends DistinctAccumulator {

    private final List<ExpressionsInput<?>> keyInputs;
    private final List<DataType<?>> keyTypes;

    CollectDistinctAccumulator(Aggregation aggregation,
                               List<ExpressionsInput<?>> keyInputs,
                               DistinctSetType setType,
                               DistinctFinisher finisher,
                               int expectedElements,
                               int warnThreshold) {
        super(aggregation, setType, finisher, expectedElements, warnThreshold);
        this.keyInputs = keyInputs;
        this.keyTypes = setType.keyTypes();
    }

    CollectDistinctAccumulator(Aggregation aggregation,
                               List<ExpressionsInput<?>> keyInputs,
                               DistinctSetType setType,
                               DistinctFinisher finisher,
                               int expectedElements,
                               int warnThreshold,
                               StreamInput in) throws IOException {
        super(aggregation, setType, finisher, expectedElements, warnThreshold, in);
        this.keyInputs = keyInputs;
        this.keyTypes = setType.keyTypes();
    }

    @Override
    public void update(Row row) {
        RowN key = RowN.ofSize(keyInputs.size());
        for (int i = 0; i < keyInputs.size(); i++) {
            key.set(i, keyInputs.get(i).value(row));
        }
        if (key.anyNull()) {
            return;
        }
        for (int i = 0; i < keyTypes.size(); i++) {
            AggregationTypeMismatchException.checkValue(aggregation(), keyTypes.get(i), key.get(i));
        }
        if (set.add(key.materialize())) {
            checkSize();
        }
    }
}
