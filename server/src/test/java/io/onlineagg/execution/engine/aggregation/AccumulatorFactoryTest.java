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

import static io.onlineagg.testing.TestingHelpers.row;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.List;

import org.junit.Test;

import io.onlineagg.common.io.stream.BytesStreamOutput;
import io.onlineagg.common.settings.Settings;
import io.onlineagg.data.Row;
import io.onlineagg.expression.Functions;
import io.onlineagg.expression.InputFactory;
import io.onlineagg.expression.aggregation.Aggregation;
import io.onlineagg.expression.aggregation.Average;
import io.onlineagg.expression.aggregation.CountDistinct;
import io.onlineagg.expression.aggregation.Max;
import io.onlineagg.expression.aggregation.Min;
import io.onlineagg.expression.aggregation.Sum;
import io.onlineagg.expression.aggregation.SumDistinct;
import io.onlineagg.expression.symbol.AttributeReference;
import io.onlineagg.expression.symbol.InputColumn;
import io.onlineagg.types.DataTypes;
import io.onlineagg.types.NumericType;

public class AccumulatorFactoryTest {

    private static final InputColumn LONG_COL = new InputColumn(0, DataTypes.LONG);

    private final AccumulatorFactory factory = new AccumulatorFactory(new InputFactory(new Functions()), Settings.EMPTY);

    /**
     * Feeds {@code before} to a fresh accumulator, restores a copy from its streamed state and feeds {@code after}
     * to the copy.
     */
    private Object streamInBetween(Aggregation aggregation, List<Row> before, List<Row> after) throws IOException {
        Accumulator accumulator = factory.create(aggregation);
        for (Row row : before) {
            accumulator.update(row);
        }
        try (BytesStreamOutput out = new BytesStreamOutput()) {
            accumulator.writeTo(out);
            Accumulator restored = factory.readFrom(aggregation, out.toStreamInput());
            assertThat(restored.aggregation()).isEqualTo(aggregation);
            assertThat(restored.eval(Row.EMPTY)).isEqualTo(accumulator.eval(Row.EMPTY));
            for (Row row : after) {
                restored.update(row);
            }
            return restored.eval(Row.EMPTY);
        }
    }

    @Test
    public void test_restored_accumulators_continue_with_the_streamed_state() throws IOException {
        List<Row> before = List.of(row(3L), row(1L), row(3L));
        List<Row> after = List.of(row(4L), row((Object) null));

        assertThat(streamInBetween(new Sum(LONG_COL), before, after)).isEqualTo(11L);
        assertThat(streamInBetween(new Min(LONG_COL), before, after)).isEqualTo(1L);
        assertThat(streamInBetween(new Max(LONG_COL), before, after)).isEqualTo(4L);
        assertThat(streamInBetween(new Average(LONG_COL), before, after)).isEqualTo(2.75d);
        assertThat(streamInBetween(new CountDistinct(LONG_COL), before, after)).isEqualTo(3L);
        assertThat(streamInBetween(new SumDistinct(LONG_COL), before, after)).isEqualTo(8L);
    }

    @Test
    public void test_empty_state_is_restored_as_empty() throws IOException {
        assertThat(streamInBetween(new Sum(LONG_COL), List.of(), List.of())).isNull();
        assertThat(streamInBetween(new Average(LONG_COL), List.of(), List.of())).isNull();
        assertThat(streamInBetween(new Min(LONG_COL), List.of(), List.of(row(2L)))).isEqualTo(2L);
    }

    @Test
    public void test_decimal_sum_state_keeps_every_digit() throws IOException {
        InputColumn decimal = new InputColumn(0, NumericType.of(5, 2));
        Object result = streamInBetween(
            new Sum(decimal),
            List.of(row(new BigDecimal("999.99"))),
            List.of(row(new BigDecimal("0.01")))
        );
        assertThat(result).hasToString("1000.00");
    }

    @Test
    public void test_arguments_must_be_bound_to_input_columns() {
        AttributeReference attribute = new AttributeReference(1L, "x", DataTypes.LONG);
        assertThatThrownBy(() -> factory.create(new Sum(attribute)))
            .isExactlyInstanceOf(UnsupportedOperationException.class)
            .hasMessage("Can't handle Symbol [AttributeReference: x#1]");
    }

    @Test
    public void test_invalid_distinct_settings_are_rejected() {
        Settings settings = Settings.builder()
            .put(AccumulatorFactory.DISTINCT_WARN_THRESHOLD.getKey(), 0)
            .build();
        assertThatThrownBy(() -> new AccumulatorFactory(new InputFactory(new Functions()), settings))
            .isExactlyInstanceOf(IllegalArgumentException.class)
            .hasMessage("Failed to parse value [0] for setting [aggregation.distinct.warn_threshold] must be >= 1");
    }

    @Test
    public void test_distinct_set_beyond_warn_threshold_keeps_accumulating() {
        Settings settings = Settings.builder()
            .put(AccumulatorFactory.DISTINCT_INITIAL_CAPACITY.getKey(), 1)
            .put(AccumulatorFactory.DISTINCT_WARN_THRESHOLD.getKey(), 2)
            .build();
        AccumulatorFactory smallSets = new AccumulatorFactory(new InputFactory(new Functions()), settings);
        Accumulator accumulator = smallSets.create(new CountDistinct(LONG_COL));
        for (long i = 0; i < 10; i++) {
            accumulator.update(row(i));
        }
        assertThat(accumulator.eval(Row.EMPTY)).isEqualTo(10L);
    }
}
