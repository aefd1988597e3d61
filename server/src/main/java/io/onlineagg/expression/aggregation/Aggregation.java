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

import java.util.List;
import java.util.stream.Collectors;

import io.onlineagg.expression.symbol.Symbol;
import io.onlineagg.expression.symbol.SymbolVisitor;

/**
 * An aggregate over the rows of one or more partitions.
 *
 * <p>
 * The set of kinds is closed. {@link Min}, {@link Max}, {@link Count}, {@link CountDistinct}, {@link Sum},
 * {@link SumDistinct} and {@link Average} are the user facing aggregates. {@link CollectSet},
 * {@link CombineSetsAndCount} and {@link CombineSetsAndSum} only appear in the partial and final expressions
 * created by {@link io.onlineagg.planner.AggregationSplitter}.
 * </p>
 */
public sealed interface Aggregation extends Symbol
    permits Min, Max, Count, CountDistinct, Sum, SumDistinct, Average, CollectSet, CombineSetsAndCount, CombineSetsAndSum {

    /**
     * The expressions evaluated for every row the aggregation consumes.
     */
    List<Symbol> arguments();

    /**
     * Returns a copy of the same kind over {@code newArguments}.
     */
    Aggregation withArguments(List<Symbol> newArguments);

    /**
     * @return false if the aggregation yields a value even if it didn't see any rows
     */
    boolean nullable();

    <C, R> R accept(AggregationVisitor<C, R> visitor, C context);

    @Override
    default <C, R> R accept(SymbolVisitor<C, R> visitor, C context) {
        return visitor.visitAggregation(this, context);
    }

    static String joinArguments(List<Symbol> arguments) {
        return arguments.stream()
            .map(Symbol::toString)
            .collect(Collectors.joining(","));
    }

    static Symbol singleArgument(List<Symbol> arguments, String kind) {
        if (arguments.size() != 1) {
            throw new IllegalArgumentException(kind + " expects exactly one argument, got " + arguments);
        }
        return arguments.get(0);
    }
}
