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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.onlineagg.common.io.stream.StreamInput;
import io.onlineagg.common.io.stream.StreamOutput;
import io.onlineagg.data.Row;
import io.onlineagg.expression.aggregation.Aggregation;
import io.onlineagg.types.DistinctSetType;

/**
 * Base for accumulators whose state is a {@link MergeableDistinctSet}.
 *
 * <p>
 * The set grows with every distinct key and is never spilled or evicted. Once it holds more keys than the
 * warn threshold a warning is logged, once per accumulator.
 * </p>
 */
abstract sealed class DistinctAccumulator implements Accumulator permits CollectDistinctAccumulator, CombineSetsAccumulator {

    private static final Logger LOGGER = LogManager.getLogger(DistinctAccumulator.class);

    private final Aggregation aggregation;
    private final DistinctSetType setType;
    private final DistinctFinisher finisher;
    private final int warnThreshold;
    protected final MergeableDistinctSet set;
    private boolean warned = false;

    DistinctAccumulator(Aggregation aggregation,
                        DistinctSetType setType,
                        DistinctFinisher finisher,
                        int expectedElements,
                        int warnThreshold) {
        this.aggregation = aggregation;
        this.setType = setType;
        this.finisher = finisher;
        this.warnThreshold = warnThreshold;
        this.set = new MergeableDistinctSet(setType.keyTypes(), expectedElements);
    }

    DistinctAccumulator(Aggregation aggregation,
                        DistinctSetType setType,
                        DistinctFinisher finisher,
                        int expectedElements,
                        int warnThreshold,
                        StreamInput in) throws IOException {
        this(aggregation, setType, finisher, expectedElements, warnThreshold);
        MergeableDistinctSet restored = setType.readValueFrom(in);
        if (restored != null) {
            set.union(restored);
        }
    }

    @Override
    public Aggregation aggregation() {
        return aggregation;
    }

    protected DistinctSetType setType() {
        return setType;
    }

    protected void checkSize() {
        if (!warned && set.size() > warnThreshold) {
            warned = true;
            LOGGER.warn(
                "Distinct set of {} holds {} keys which exceeds the warn threshold of {}, its memory usage is not bounded",
                aggregation,
                set.size(),
                warnThreshold
            );
        }
    }

    @Override
    public Object eval(Row row) {
        return finisher.finish(set);
    }

    @Override
    public void writeTo(StreamOutput out) throws IOException {
        setType.writeValueTo(out, set);
    }
}
