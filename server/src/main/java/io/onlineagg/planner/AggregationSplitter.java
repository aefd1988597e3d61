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

import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.onlineagg.exceptions.UnsupportedAggregationSplitException;
import io.onlineagg.expression.aggregation.Aggregation;
import io.onlineagg.expression.aggregation.AggregationVisitor;
import io.onlineagg.expression.aggregation.Average;
import io.onlineagg.expression.aggregation.CollectSet;
import io.onlineagg.expression.aggregation.CombineSetsAndCount;
import io.onlineagg.expression.aggregation.CombineSetsAndSum;
import io.onlineagg.expression.aggregation.Count;
import io.onlineagg.expression.aggregation.CountDistinct;
import io.onlineagg.expression.aggregation.Max;
import io.onlineagg.expression.aggregation.Min;
import io.onlineagg.expression.aggregation.Sum;
import io.onlineagg.expression.aggregation.SumDistinct;
import io.onlineagg.expression.scalar.CastFunction;
import io.onlineagg.expression.scalar.CoalesceFunction;
import io.onlineagg.expression.scalar.DivideFunction;
import io.onlineagg.expression.symbol.AliasSymbol;
import io.onlineagg.expression.symbol.Literal;
import io.onlineagg.expression.symbol.Symbol;
import io.onlineagg.types.DataType;
import io.onlineagg.types.DataTypes;

/**
 * Rewrites an aggregation into aggregations computed per partition and a final expression which merges
 * the partial results.
 *
 * <ul>
 *     <li>MIN/MAX: the same aggregation over the partial minima/maxima.</li>
 *     <li>COUNT: the sum of the partial counts, 0 if there are none.</li>
 *     <li>SUM: the sum of the partial sums. Fixed decimals are summed up unlimited and cast back at the end.</li>
 *     <li>AVG: partial counts and sums, the sum of the sums divided by the sum of the counts.</li>
 *     <li>COUNT(DISTINCT)/SUM(DISTINCT): a distinct set per partition, the final phase unions the sets.</li>
 * </ul>
 */
public final class AggregationSplitter {

    private static final Logger LOGGER = LogManager.getLogger(AggregationSplitter.class);

    static final String PARTIAL_MIN = "PartialMin";
    static final String PARTIAL_MAX = "PartialMax";
    static final String PARTIAL_COUNT = "PartialCount";
    static final String PARTIAL_SUM = "PartialSum";
    static final String PARTIAL_SETS = "partialSets";

    private static final Visitor VISITOR = new Visitor();

    private AggregationSplitter() {
    }

    /**
     * @throws UnsupportedAggregationSplitException for aggregations which are the result of a split themselves
     */
    public static SplitEvaluation split(Aggregation aggregation) {
        SplitEvaluation splitEvaluation = aggregation.accept(VISITOR, null);
        if (LOGGER.isTraceEnabled()) {
            LOGGER.trace("Split {} into partials={} final={}",
                aggregation, splitEvaluation.partials(), splitEvaluation.finalExpression());
        }
        return splitEvaluation;
    }

    private static class Visitor implements AggregationVisitor<Void, SplitEvaluation> {

        @Override
        public SplitEvaluation visitMin(Min min, Void context) {
            AliasSymbol partialMin = new AliasSymbol(PARTIAL_MIN, min);
            return new SplitEvaluation(new Min(partialMin.toAttribute()), List.of(partialMin));
        }

        @Override
        public SplitEvaluation visitMax(Max max, Void context) {
            AliasSymbol partialMax = new AliasSymbol(PARTIAL_MAX, max);
            return new SplitEvaluation(new Max(partialMax.toAttribute()), List.of(partialMax));
        }

        @Override
        public SplitEvaluation visitCount(Count count, Void context) {
            AliasSymbol partialCount = new AliasSymbol(PARTIAL_COUNT, count);
            Symbol finalExpression = CoalesceFunction.of(new Sum(partialCount.toAttribute()), Literal.of(0L));
            return new SplitEvaluation(finalExpression, List.of(partialCount));
        }

        @Override
        public SplitEvaluation visitSum(Sum sum, Void context) {
            Symbol argument = sum.argument();
            if (DataTypes.isFixedDecimal(argument.valueType())) {
                AliasSymbol partialSum = new AliasSymbol(
                    PARTIAL_SUM, new Sum(CastFunction.cast(argument, DataTypes.NUMERIC)));
                Symbol finalExpression = CastFunction.cast(new Sum(partialSum.toAttribute()), sum.valueType());
                return new SplitEvaluation(finalExpression, List.of(partialSum));
            }
            AliasSymbol partialSum = new AliasSymbol(PARTIAL_SUM, sum);
            return new SplitEvaluation(new Sum(partialSum.toAttribute()), List.of(partialSum));
        }

        @Override
        public SplitEvaluation visitAverage(Average average, Void context) {
            Symbol argument = average.argument();
            DataType<?> argumentType = argument.valueType();
            DataType<?> returnType = average.valueType();
            AliasSymbol partialCount = new AliasSymbol(PARTIAL_COUNT, new Count(argument));
            AliasSymbol partialSum = new AliasSymbol(
                PARTIAL_SUM, new Sum(CastFunction.cast(argument, DataTypes.averageCalculationType(argumentType))));
            Symbol finalExpression;
            if (DataTypes.isFixedDecimal(argumentType)) {
                Symbol castedSum = CastFunction.cast(new Sum(partialSum.toAttribute()), DataTypes.NUMERIC);
                Symbol castedCount = CastFunction.cast(new Sum(partialCount.toAttribute()), DataTypes.NUMERIC);
                finalExpression = CastFunction.cast(DivideFunction.of(castedSum, castedCount), returnType);
            } else {
                Symbol castedSum = CastFunction.cast(new Sum(partialSum.toAttribute()), returnType);
                Symbol castedCount = CastFunction.cast(new Sum(partialCount.toAttribute()), returnType);
                finalExpression = DivideFunction.of(castedSum, castedCount);
            }
            return new SplitEvaluation(finalExpression, List.of(partialCount, partialSum));
        }

        @Override
        public SplitEvaluation visitCountDistinct(CountDistinct countDistinct, Void context) {
            AliasSymbol partialSets = new AliasSymbol(PARTIAL_SETS, new CollectSet(countDistinct.arguments()));
            return new SplitEvaluation(new CombineSetsAndCount(partialSets.toAttribute()), List.of(partialSets));
        }

        @Override
        public SplitEvaluation visitSumDistinct(SumDistinct sumDistinct, Void context) {
            AliasSymbol partialSets = new AliasSymbol(PARTIAL_SETS, new CollectSet(sumDistinct.arguments()));
            return new SplitEvaluation(
                new CombineSetsAndSum(partialSets.toAttribute(), sumDistinct.valueType()),
                List.of(partialSets)
            );
        }

        @Override
        public SplitEvaluation visitCollectSet(CollectSet collectSet, Void context) {
            throw new UnsupportedAggregationSplitException(collectSet);
        }

        @Override
        public SplitEvaluation visitCombineSetsAndCount(CombineSetsAndCount combineSetsAndCount, Void context) {
            throw new UnsupportedAggregationSplitException(combineSetsAndCount);
        }

        @Override
        public SplitEvaluation visitCombineSetsAndSum(CombineSetsAndSum combineSetsAndSum, Void context) {
            throw new UnsupportedAggregationSplitException(combineSetsAndSum);
        }
    }
}
