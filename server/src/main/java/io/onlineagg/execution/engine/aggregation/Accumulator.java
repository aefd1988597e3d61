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

import org.jetbrains.annotations.Nullable;

import io.onlineagg.common.io.stream.Writeable;
import io.onlineagg.data.Row;
import io.onlineagg.expression.aggregation.Aggregation;

/**
 * The running state of one {@link Aggregation} over the rows of one partition.
 *
 * <p>
 * An accumulator starts empty, consumes rows via {@link #update(Row)} and can be read via
 * {@link #eval(Row)} at any time, also in between updates. {@link #writeTo} writes the running state
 * so that it can be restored with {@link AccumulatorFactory#readFrom}.
 * </p>
 *
 * Accumulators are not thread-safe. Every instance is driven by a single sequential scan.
 */
public sealed interface Accumulator extends Writeable
    permits MinAccumulator, MaxAccumulator, CountAccumulator, SumAccumulator, AverageAccumulator, DistinctAccumulator {

    Aggregation aggregation();

    /**
     * Folds {@code row} into the running state.
     * Failures evaluating the arguments of the aggregation propagate unchanged.
     */
    void update(Row row);

    /**
     * Returns the result for the rows seen so far without changing the state.
     *
     * @param row unused by all aggregations, the state is self-contained
     */
    @Nullable
    Object eval(Row row);
}
