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
import static io.onlineagg.testing.TestingHelpers.singleColumnRows;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.util.List;

import org.junit.Test;

import io.onlineagg.common.settings.Settings;
import io.onlineagg.data.Row;
import io.onlineagg.exceptions.AggregationTypeMismatchException;
import io.onlineagg.exceptions.ConversionException;
import io.onlineagg.expression.Functions;
import io.onlineagg.expression.InputFactory;
import io.onlineagg.expression.aggregation.Aggregation;
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
import io.onlineagg.expression.symbol.InputColumn;
import io.onlineagg.types.DataTypes;
import io.onlineagg.types.NumericType;

public class AccumulatorTest {

    private static final InputColumn LONG_COL = new InputColumn(0, DataTypes.LONG);

    private final AccumulatorFactory factory = new AccumulatorFactory(new InputFactory(new Functions()), Settings.EMPTY);

    private Object aggregate(Aggregation aggregation, List<Row> rows) {
        Accumulator accumulator = factory.create(aggregation);
        for (Row row : rows) {
            accumulator.update(row);
        }
        return accumulator.eval(Row.EMPTY);
    }

    @Test
    public void test_aggregations_over_values_with_a_null() {
        List<Row> rows = singleColumnRows(10L, null, 20L, 30L);

        assertThat(aggregate(new Count(LONG_COL), rows)).isEqualTo(3L);
        assertThat(aggregate(Count.star(), rows)).isEqualTo(4L);
        assertThat(aggregate(new Sum(LONG_COL), rows)).isEqualTo(60L);
        assertThat(aggregate(new Average(LONG_COL), rows)).isEqualTo(20.0d);
        assertThat(aggregate(new Min(LONG_COL), rows)).isEqualTo(10L);
        assertThat(aggregate(new Max(LONG_COL), rows)).isEqualTo(30L);
    }

    @Test
    public void test_empty_input() {
        List<Row> rows = List.of();

        assertThat(aggregate(new Count(LONG_COL), rows)).isEqualTo(0L);
        assertThat(aggregate(new Sum(LONG_COL), rows)).isNull();
        assertThat(aggregate(new Average(LONG_COL), rows)).isNull();
        assertThat(aggregate(new Min(LONG_COL), rows)).isNull();
        assertThat(aggregate(new Max(LONG_COL), rows)).isNull();
        assertThat(aggregate(new CountDistinct(LONG_COL), rows)).isEqualTo(0L);
        assertThat(aggregate(new SumDistinct(LONG_COL), rows)).isNull();
    }

    @Test
    public void test_only_nulls_behave_like_empty_input() {
        List<Row> rows = singleColumnRows(null, null, null);

        assertThat(aggregate(new Count(LONG_COL), rows)).isEqualTo(0L);
        assertThat(aggregate(new Sum(LONG_COL), rows)).isNull();
        assertThat(aggregate(new Average(LONG_COL), rows)).isNull();
        assertThat(aggregate(new Min(LONG_COL), rows)).isNull();
        assertThat(aggregate(new Max(LONG_COL), rows)).isNull();
        assertThat(aggregate(new CountDistinct(LONG_COL), rows)).isEqualTo(0L);
        assertThat(aggregate(new SumDistinct(LONG_COL), rows)).isNull();
    }

    @Test
    public void test_distinct_aggregations_ignore_duplicates_and_nulls() {
        List<Row> rows = singleColumnRows(1L, 1L, 2L, null, 2L, 3L);

        assertThat(aggregate(new CountDistinct(LONG_COL), rows)).isEqualTo(3L);
        assertThat(aggregate(new SumDistinct(LONG_COL), rows)).isEqualTo(6L);
    }

    @Test
    public void test_count_distinct_over_multiple_columns() {
        InputColumn text = new InputColumn(1, DataTypes.STRING);
        List<Row> rows = List.of(
            row(1L, "a"),
            row(1L, "a"),
            row(1L, "b"),
            row(2L, "a"),
            row(2L, null)
        );
        CountDistinct countDistinct = new CountDistinct(LONG_COL, text);

        assertThat(countDistinct).hasToString("COUNT(DISTINCT INPUT(0),INPUT(1))");
        assertThat(aggregate(countDistinct, rows)).isEqualTo(3L);
    }

    @Test
    public void test_min_max_ties_keep_an_equal_value() {
        InputColumn decimal = new InputColumn(0, DataTypes.NUMERIC);
        List<Row> rows = singleColumnRows(new BigDecimal("1.00"), new BigDecimal("1.0"), new BigDecimal("1"));

        assertThat((BigDecimal) aggregate(new Min(decimal), rows)).isEqualByComparingTo(BigDecimal.ONE);
        assertThat((BigDecimal) aggregate(new Max(decimal), rows)).isEqualByComparingTo(BigDecimal.ONE);
    }

    @Test
    public void test_min_and_max_of_text() {
        InputColumn text = new InputColumn(0, DataTypes.STRING);
        List<Row> rows = singleColumnRows("b", "a", null, "c");

        assertThat(aggregate(new Min(text), rows)).isEqualTo("a");
        assertThat(aggregate(new Max(text), rows)).isEqualTo("c");
    }

    @Test
    public void test_sum_and_average_of_fixed_decimals_are_widened() {
        InputColumn decimal = new InputColumn(0, NumericType.of(5, 2));
        List<Row> rows = singleColumnRows(new BigDecimal("1.25"), null, new BigDecimal("2.50"));

        Sum sum = new Sum(decimal);
        assertThat(sum.valueType()).isEqualTo(NumericType.of(15, 2));
        assertThat(aggregate(sum, rows)).hasToString("3.75");

        Average average = new Average(decimal);
        assertThat(average.valueType()).isEqualTo(NumericType.of(9, 6));
        assertThat(aggregate(average, rows)).hasToString("1.875000");
    }

    @Test
    public void test_average_of_integers_is_a_double() {
        InputColumn integer = new InputColumn(0, DataTypes.INTEGER);
        List<Row> rows = singleColumnRows(1, 2);

        assertThat(aggregate(new Average(integer), rows)).isEqualTo(1.5d);
    }

    @Test
    public void test_integer_sum_overflow_raises_an_error() {
        InputColumn integer = new InputColumn(0, DataTypes.INTEGER);
        List<Row> rows = singleColumnRows(Integer.MAX_VALUE, 1);

        assertThatThrownBy(() -> aggregate(new Sum(integer), rows))
            .isExactlyInstanceOf(ArithmeticException.class);
    }

    @Test
    public void test_eval_does_not_change_the_state() {
        Accumulator accumulator = factory.create(new Sum(LONG_COL));
        accumulator.update(row(1L));
        assertThat(accumulator.eval(Row.EMPTY)).isEqualTo(1L);
        assertThat(accumulator.eval(Row.EMPTY)).isEqualTo(1L);

        accumulator.update(row(2L));
        assertThat(accumulator.eval(Row.EMPTY)).isEqualTo(3L);
    }

    @Test
    public void test_collect_set_and_combine_sets() {
        CollectSet collectSet = new CollectSet(List.of(LONG_COL));
        MergeableDistinctSet left = (MergeableDistinctSet) aggregate(collectSet, singleColumnRows(1L, 2L, 2L));
        MergeableDistinctSet right = (MergeableDistinctSet) aggregate(collectSet, singleColumnRows(2L, 3L));
        assertThat(left.size()).isEqualTo(2);
        assertThat(right.size()).isEqualTo(2);

        InputColumn setColumn = new InputColumn(0, collectSet.valueType());
        List<Row> partialRows = singleColumnRows(left, right);
        assertThat(aggregate(new CombineSetsAndCount(setColumn), partialRows)).isEqualTo(3L);
        assertThat(aggregate(new CombineSetsAndSum(setColumn, DataTypes.LONG), partialRows)).isEqualTo(6L);
    }

    @Test
    public void test_value_of_unexpected_type_is_a_type_mismatch() {
        assertThatThrownBy(() -> aggregate(new Sum(LONG_COL), singleColumnRows(10)))
            .isExactlyInstanceOf(AggregationTypeMismatchException.class)
            .hasMessage("Type mismatch in `SUM(INPUT(0))`: expected a value of type `bigint` but got `10` of class `Integer`");
    }

    @Test
    public void test_evaluation_failure_of_the_argument_propagates() {
        InputColumn text = new InputColumn(0, DataTypes.STRING);
        Sum sum = new Sum(CastFunction.cast(text, DataTypes.LONG));

        assertThatThrownBy(() -> aggregate(sum, singleColumnRows("1", "foo")))
            .isExactlyInstanceOf(ConversionException.class)
            .hasMessage("Cannot cast value `foo` to type `bigint`");
    }

    @Test
    public void test_combine_and_sum_validates_the_set_type() {
        InputColumn textSet = new InputColumn(0, new CollectSet(List.of(new InputColumn(0, DataTypes.STRING))).valueType());
        assertThatThrownBy(() -> new CombineSetsAndSum(textSet, DataTypes.STRING))
            .isExactlyInstanceOf(IllegalArgumentException.class)
            .hasMessage("CombineAndSum expects a distinct set of a single numeric column, got `distinct_set(text)`");

        InputColumn decimalSet = new InputColumn(0, new CollectSet(List.of(new InputColumn(0, NumericType.of(5, 2)))).valueType());
        assertThatThrownBy(() -> new CombineSetsAndSum(decimalSet, NumericType.of(5, 2)))
            .isExactlyInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("must return `numeric(15,2)`");
    }

    @Test
    public void test_sum_of_text_is_rejected() {
        assertThatThrownBy(() -> new Sum(new InputColumn(0, DataTypes.STRING)))
            .isExactlyInstanceOf(IllegalArgumentException.class)
            .hasMessage("Cannot compute SUM of values of type `text`");
    }
}
