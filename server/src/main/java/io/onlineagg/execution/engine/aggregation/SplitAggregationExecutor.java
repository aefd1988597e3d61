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
import java.util.Arrays;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.onlineagg.common.io.stream.BytesStreamOutput;
import io.onlineagg.common.settings.Setting;
import io.onlineagg.common.settings.Settings;
import io.onlineagg.data.Row;
import io.onlineagg.data.RowN;
import io.onlineagg.expression.Functions;
import io.onlineagg.expression.InputFactory;
import io.onlineagg.expression.aggregation.Aggregation;
import io.onlineagg.expression.symbol.AttributeReference;
import io.onlineagg.planner.AggregationSplitter;
import io.onlineagg.planner.SplitEvaluation;
import io.onlineagg.types.DataType;

/**
 * Computes an aggregation in two phases: a partial aggregation per partition and a final aggregation
 * over the partial rows.
 *
 * <p>
 * If {@link #SERIALIZE_PARTIALS} is enabled every partial row is written to bytes and read back before
 * it is merged, as if it were sent to another node.
 * </p>
 *
 * <p>
 * A failure in any partition aborts the whole aggregation. The partial rows of the other partitions are discarded.
 * </p>
 */
public final class SplitAggregationExecutor {

    private static final Logger LOGGER = LogManager.getLogger(SplitAggregationExecutor.class);

    public static final Setting<Boolean> SERIALIZE_PARTIALS = Setting.boolSetting(
        "aggregation.transport.serialize_partials", true);

    private final InputFactory inputFactory;
    private final AccumulatorFactory accumulatorFactory;
    private final boolean serializePartials;

    public SplitAggregationExecutor(Settings settings) {
        this(new InputFactory(new Functions()), settings);
    }

    public SplitAggregationExecutor(InputFactory inputFactory, Settings settings) {
        this.inputFactory = inputFactory;
        this.accumulatorFactory = new AccumulatorFactory(inputFactory, settings);
        this.serializePartials = SERIALIZE_PARTIALS.get(settings);
    }

    /**
     * Computes {@code aggregation} over the rows of all partitions using its {@link SplitEvaluation}.
     */
    public Object execute(Aggregation aggregation, List<? extends Iterable<? extends Row>> partitions) {
        SplitEvaluation splitEvaluation = AggregationSplitter.split(aggregation);
        PartialAggregator partialAggregator = new PartialAggregator(accumulatorFactory, splitEvaluation);
        PartialRowStreamer streamer = new PartialRowStreamer(
            splitEvaluation.partialAttributes().stream().<DataType<?>>map(AttributeReference::valueType).toList());

        List<Row> partialRows = new ArrayList<>(partitions.size());
        for (int i = 0; i < partitions.size(); i++) {
            Object[] cells;
            try {
                cells = partialAggregator.aggregate(partitions.get(i));
            } catch (RuntimeException e) {
                LOGGER.debug(
                    "Partial aggregation of {} failed on partition {}, discarding {} partial results",
                    aggregation,
                    i,
                    partialRows.size()
                );
                throw e;
            }
            if (serializePartials) {
                cells = transport(streamer, cells);
            }
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("Partition {} of {} computed partial row {}", i, aggregation, Arrays.toString(cells));
            }
            partialRows.add(new RowN(cells));
        }
        FinalAggregator finalAggregator = new FinalAggregator(accumulatorFactory, inputFactory, splitEvaluation);
        return finalAggregator.finish(partialRows);
    }

    /**
     * Computes {@code aggregation} in a single phase over all rows.
     */
    public Object aggregate(Aggregation aggregation, Iterable<? extends Row> rows) {
        Accumulator accumulator = accumulatorFactory.create(aggregation);
        for (Row row : rows) {
            accumulator.update(row);
        }
        return accumulator.eval(Row.EMPTY);
    }

    private static Object[] transport(PartialRowStreamer streamer, Object[] cells) {
        try (BytesStreamOutput out = new BytesStreamOutput()) {
            streamer.writeValueTo(out, cells);
            return streamer.readValueFrom(out.toStreamInput());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to stream partial row", e);
        }
    }
}
