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

import java.util.ArrayList;
import java.util.List;

import io.onlineagg.data.Row;
import io.onlineagg.expression.aggregation.Aggregation;
import io.onlineagg.planner.SplitEvaluation;

/**
 * Runs the partial aggregations of a {@link SplitEvaluation} over the rows of one partition.
 */
public final class PartialAggregator {

    private final AccumulatorFactory accumulatorFactory;
    private final List<Aggregation> partials;

    public PartialAggregator(AccumulatorFactory accumulatorFactory, SplitEvaluation splitEvaluation) {
        this.accumulatorFactory = accumulatorFactory;
        this.partials = splitEvaluation.partialAggregations();
    }

    /**
     * Feeds all rows to fresh accumulators, one per partial aggregation.
     */
    public List<Accumulator> accumulate(Iterable<? extends Row> rows) {
        List<Accumulator> accumulators = new ArrayList<>(partials.size());
        for (Aggregation partial : partials) {
            accumulators.add(accumulatorFactory.create(partial));
        }
        for (Row row : rows) {
            for (int i = 0; i < accumulators.size(); i++) {
                accumulators.get(i).update(row);
            }
        }
        return accumulators;
    }

    /**
     * @return the partial row of the partition, with one column per partial aggregation
     */
    public Object[] aggregate(Iterable<? extends Row> rows) {
        List<Accumulator> accumulators = accumulate(rows);
        Object[] cells = new Object[accumulators.size()];
        for (int i = 0; i < cells.length; i++) {
            cells[i] = accumulators.get(i).eval(Row.EMPTY);
        }
        return cells;
    }
}
