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

package io.onlineagg.types;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;

import org.junit.Test;

public class NumericArithmeticTest {

    @Test
    public void test_zero_and_plus_per_type() {
        NumericArithmetic<Integer> integers = NumericArithmetic.of(DataTypes.INTEGER);
        assertThat(integers.plus(integers.zero(), 3)).isEqualTo(3);

        NumericArithmetic<Long> longs = NumericArithmetic.of(DataTypes.LONG);
        assertThat(longs.plus(longs.zero(), 3L)).isEqualTo(3L);

        NumericArithmetic<Double> doubles = NumericArithmetic.of(DataTypes.DOUBLE);
        assertThat(doubles.plus(doubles.zero(), 0.5d)).isEqualTo(0.5d);
    }

    @Test
    public void test_decimal_plus_is_exact() {
        NumericArithmetic<BigDecimal> decimals = NumericArithmetic.of(DataTypes.NUMERIC);
        BigDecimal sum = decimals.plus(new BigDecimal("99999999999999999999.99"), new BigDecimal("0.001"));
        assertThat(sum).isEqualTo(new BigDecimal("99999999999999999999.991"));
        assertThat(decimals.type()).isEqualTo(DataTypes.NUMERIC);
    }

    @Test
    public void test_integral_overflow_raises_an_error() {
        NumericArithmetic<Integer> integers = NumericArithmetic.of(DataTypes.INTEGER);
        assertThatThrownBy(() -> integers.plus(Integer.MAX_VALUE, 1))
            .isExactlyInstanceOf(ArithmeticException.class);
    }

    @Test
    public void test_non_numeric_types_have_no_arithmetic() {
        assertThatThrownBy(() -> NumericArithmetic.of(DataTypes.STRING))
            .isExactlyInstanceOf(IllegalArgumentException.class)
            .hasMessage("Cannot apply arithmetic to values of non-numeric type `text`");
    }
}
