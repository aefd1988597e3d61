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

package io.onlineagg.expression.aggregation;

/**
 * Dispatches on the kind of an {@link Aggregation}.
 * There is no fallback, every visitor handles every kind.
 */
public interface AggregationVisitor<C, R> {

    R visitMin(Min min, C context);

    R visitMax(Max max, C context);

    R visitCount(Count count, C context);

    R visitCountDistinct(CountDistinct countDistinct, C context);

    R visitSum(Sum sum, C context);

    R visitSumDistinct(SumDistinct sumDistinct, C context);

    R visitAverage(Average average, C context);

    R visitCollectSet(CollectSet collectSet, C context);

    R visitCombineSetsAndCount(CombineSetsAndCount combineSetsAndCount, C context);

    R visitCombineSetsAndSum(CombineSetsAndSum combineSetsAndSum, C context);
}
