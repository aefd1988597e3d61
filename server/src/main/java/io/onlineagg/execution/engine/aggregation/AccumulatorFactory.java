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
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

import org.jetbrains.annotations.Nullable;

import io.onlineagg.common.io.stream.StreamInput;
import io.onlineagg.common.settings.Setting;
import io.onlineagg.common.settings.Settings;
import io.onlineagg.data.Row;
import io.onlineagg.expression.ExpressionsInput;
import io.onlineagg.expression.InputFactory;
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
import io.onlineagg.expression.symbol.Symbol;
import io.onlineagg.types.DataType;
import io.onlineagg.types.DistinctSetType;

/**
 * Creates the {@link Accumulator} of an {@link Aggregation}.
 *
 * <p>
 * The arguments of the aggregation must only refer to {@link io.onlineagg.expression.symbol.InputColumn}s
 * of the rows the accumulator is fed with.
 * </p>
 */
public final class AccumulatorFactory {

    public static final Setting<Integer> DISTINCT_INITIAL_CAPACITY = Setting.intSetting(
        "aggregation.distinct.initial_capacity", MergeableDistinctSet.DEFAULT_EXPECTED_ELEMENTS, 1);

    public static final Setting<Integer> DISTINCT_WARN_THRESHOLD = Setting.intSetting(
        "aggregation.distinct.warn_threshold", 1_000_000, 1);

    private final InputFactory inputFactory;
    private final int distinctInitialCapacity;
    private final int distinctWarnThreshold;
    private final Creator creator = new Creator();

    public AccumulatorFactory(InputFactory inputFactory, Settings settings) {
        this.inputFactory = inputFactory;
        this.distinctInitialCapacity = DISTINCT_INITIAL_CAPACITY.get(settings);
        this.distinctWarnThreshold = DISTINCT_WARN_THRESHOLD.get(settings);
    }

    /**
     * Creates an empty accumulator for {@code aggregation}.
     */
    public Accumulator create(Aggregation aggregation) {
        return aggregation.accept(creator, null);
    }

    /**
     * Restores an accumulator for {@code aggregation} from the state written by {@link Accumulator#writeTo}.
     */
    public Accumulator readFrom(Aggregation aggregation, StreamInput in) throws IOException {
        try {
            return aggregation.accept(creator, in);
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    @FunctionalInterface
    private interface StateReader {
        Accumulator read(StreamInput in) throws IOException;
    }

    private static Accumulator createOrRestore(@Nullable StreamInput in,
                                               Supplier<Accumulator> fresh,
                                               StateReader restore) {
        if (in == null) {
            return fresh.get();
        }
        try {
            return restore.read(in);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private class Creator implements AggregationVisitor<StreamInput, Accumulator> {

        private ExpressionsInput<?> bind(Symbol argument) {
            return inputFactory.bind(argument);
        }

        private List<ExpressionsInput<?>> bindAll(List<Symbol> arguments) {
            List<ExpressionsInput<?>> inputs = new ArrayList<>(arguments.size());
            for (Symbol argument : arguments) {
                inputs.add(bind(argument));
            }
            return inputs;
        }

        private Accumulator collectDistinct(Aggregation aggregation,
                                            DistinctFinisher finisher,
                                            @Nullable StreamInput in) {
            List<ExpressionsInput<?>> keyInputs = bindAll(aggregation.arguments());
            DistinctSetType setType = new DistinctSetType(
                aggregation.arguments().stream().<DataType<?>>map(Symbol::valueType).toList());
            return createOrRestore(
                in,
                () -> new CollectDistinctAccumulator(
                    aggregation, keyInputs, setType, finisher, distinctInitialCapacity, distinctWarnThreshold),
                s -> new CollectDistinctAccumulator(
                    aggregation, keyInputs, setType, finisher, distinctInitialCapacity, distinctWarnThreshold, s)
            );
        }

        private Accumulator combineSets(Aggregation aggregation,
                                        Symbol inputSet,
                                        DistinctSetType setType,
                                        DistinctFinisher finisher,
                                        @Nullable StreamInput in) {
            ExpressionsInput<?> input = bind(inputSet);
            return createOrRestore(
                in,
                () -> new CombineSetsAccumulator(
                    aggregation, input, setType, finisher, distinctInitialCapacity, distinctWarnThreshold),
                s -> new CombineSetsAccumulator(
                    aggregation, input, setType, finisher, distinctInitialCapacity, distinctWarnThreshold, s)
            );
        }

        @Override
        public Accumulator visitMin(Min min, StreamInput in) {
            ExpressionsInput<?> input = bind(min.argument());
            return createOrRestore(in, () -> new MinAccumulator(min, input), s -> new MinAccumulator(min, input, s));
        }

        @Override
        public Accumulator visitMax(Max max, StreamInput in) {
            ExpressionsInput<?> input = bind(max.argument());
            return createOrRestore(in, () -> new MaxAccumulator(max, input), s -> new MaxAccumulator(max, input, s));
        }

        @Override
        public Accumulator visitCount(Count count, StreamInput in) {
            ExpressionsInput<?> input = bind(count.argument());
            return createOrRestore(
                in, () -> new CountAccumulator(count, input), s -> new CountAccumulator(count, input, s));
        }

        @Override
        public Accumulator visitSum(Sum sum, StreamInput in) {
            ExpressionsInput<?> input = bind(sum.argument());
            return createOrRestore(in, () -> new SumAccumulator(sum, input), s -> new SumAccumulator(sum, input, s));
        }

        @Override
        public Accumulator visitAverage(Average average, StreamInput in) {
            ExpressionsInput<?> input = bind(average.argument());
            return createOrRestore(
                in, () -> new AverageAccumulator(average, input), s -> new AverageAccumulator(average, input, s));
        }

        @Override
        public Accumulator visitCountDistinct(CountDistinct countDistinct, StreamInput in) {
            return collectDistinct(countDistinct, DistinctFinisher.COUNT, in);
        }

        @Override
        public Accumulator visitSumDistinct(SumDistinct sumDistinct, StreamInput in) {
            DataType<?> keyType = sumDistinct.argument().valueType();
            return collectDistinct(sumDistinct, DistinctFinisher.sum(keyType, sumDistinct.valueType()), in);
        }

        @Override
        public Accumulator visitCollectSet(CollectSet collectSet, StreamInput in) {
            return collectDistinct(collectSet, DistinctFinisher.SET, in);
        }

        @Override
        public Accumulator visitCombineSetsAndCount(CombineSetsAndCount combine, StreamInput in) {
            return combineSets(combine, combine.inputSet(), combine.setType(), DistinctFinisher.COUNT, in);
        }

        @Override
        public Accumulator visitCombineSetsAndSum(CombineSetsAndSum combine, StreamInput in) {
            DistinctFinisher finisher = DistinctFinisher.sum(combine.keyType(), combine.returnType());
            return combineSets(combine, combine.inputSet(), combine.setType(), finisher, in);
        }
    }
}
