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

package io.onlineagg.planner;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

import io.onlineagg.exceptions.InvalidSplitEvaluationException;
import io.onlineagg.expression.aggregation.Aggregation;
import io.onlineagg.expression.symbol.AliasSymbol;
import io.onlineagg.expression.symbol.AttributeReference;
import io.onlineagg.expression.symbol.Symbol;
import io.onlineagg.expression.symbol.Symbols;

/**
 * The two-phase form of an aggregation.
 *
 * <p>
 * Every partition evaluates the {@code partials} aggregations, which results in one partial row per partition
 * with a column per partial. The {@code finalExpression} aggregates over the partial rows, referring to the
 * columns by the {@link AliasSymbol#toAttribute() attributes} of the partials.
 * </p>
 *
 * The attributes referenced by {@code finalExpression} are exactly the attributes of the partials,
 * compared by id.
 */
public record SplitEvaluation(Symbol finalExpression, List<AliasSymbol> partials) {

    public SplitEvaluation {
        partials = List.copyOf(partials);
        if (partials.isEmpty()) {
            throw new InvalidSplitEvaluationException("A split evaluation requires at least one partial aggregation");
        }
        Set<Long> partialIds = new HashSet<>();
        for (AliasSymbol partial : partials) {
            if (!(partial.symbol() instanceof Aggregation)) {
                throw new InvalidSplitEvaluationException("Partial `" + partial + "` is not an aggregation");
            }
            if (!partialIds.add(partial.id())) {
                throw new InvalidSplitEvaluationException("Partial `" + partial + "` is listed twice");
            }
        }
        Set<Long> referencedIds = Symbols.collectAttributes(finalExpression).stream()
            .map(AttributeReference::id)
            .collect(Collectors.toSet());
        if (!referencedIds.equals(partialIds)) {
            throw new InvalidSplitEvaluationException(String.format(
                Locale.ENGLISH,
                "Final expression `%s` must reference exactly the partials %s",
                finalExpression,
                partials
            ));
        }
    }

    /**
     * The attributes of the partials, in the order of the columns of a partial row.
     */
    public List<AttributeReference> partialAttributes() {
        return partials.stream().map(AliasSymbol::toAttribute).toList();
    }

    public List<Aggregation> partialAggregations() {
        return partials.stream().map(p -> (Aggregation) p.symbol()).toList();
    }
}
