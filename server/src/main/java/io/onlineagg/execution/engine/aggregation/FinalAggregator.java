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
import io.onlineagg.data.RowN;
import io.onlineagg.expression.ExpressionsInput;
import io.onlineagg.expression.InputFactory;
import io.onlineagg.expression.aggregation.Aggregation;
import io.onlineagg.expression.symbol.InputColumn;
import io.onlineagg.expression.symbol.Symbol;
import io.onlineagg.expression.symbol.Symbols;
import io.onlineagg.planner.SplitEvaluation;

/**
 * Evaluates the final expression of a {@link SplitEvaluation} over the partial rows of all partitions.
 *
 * <p>
 * The partial attributes are bound to the columns of the partial rows. Every aggregation within the final
 * expression gets its own accumulator, the scalar expression around them is evaluated once on the results.
 * </p>
 */
public final class FinalAggregator {

    private final AccumulatorFactory accumulatorFactory;
    private final List<Aggregation> aggregations;
    private final ExpressionsInput<?> resultInput;

    public FinalAggregator(AccumulatorFactory accumulatorFactory,
                           InputFactory inputFactory,
                           SplitEvaluation splitEvaluation) {
        this.accumulatorFactory = accumulatorFactory;
        Symbol bound = Symbols.bindAttributes(
            splitEvaluation.finalExpression(), splitEvaluation.partialAttributes());
        List<Aggregation> aggregations = new ArrayList<>();
        Symbol outer = Symbols.replace(bound, symbol -> {
            if (symbol instanceof Aggregation aggregation) {
                aggregations.add(aggregation);
                return new InputColumn(aggregations.size() - 1, aggregation.valueType());
            }
            return null;
        });
        this.aggregations = List.copyOf(aggregations);
        this.resultInput = inputFactory.bind(outer);
    }

    public Object finish(Iterable<? extends Row> partialRows) {
        List<Accumulator> accumulators = new ArrayList<>(aggregations.size());
        for (Aggregation aggregation : aggregations) {
            accumulators.add(accumulatorFactory.create(aggregation));
        }
        for (Row partialRow : partialRows) {
            for (int i = 0; i < accumulators.size(); i++) {
                accumulators.get(i).update(partialRow);
            }
        }
        Object[] results = new Object[accumulators.size()];
        for (int i = 0; i < results.length; i++) {
            results[i] = accumulators.get(i).eval(Row.EMPTY);
        }
        return resultInput.value(new RowN(results));
    }
}
