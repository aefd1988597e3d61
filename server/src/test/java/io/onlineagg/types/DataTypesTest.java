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

import org.junit.Test;

public class DataTypesTest {

    @Test
    public void test_sum_of_fixed_decimal_adds_ten_digits_of_precision() {
        assertThat(DataTypes.sumType(NumericType.of(5, 2))).isEqualTo(NumericType.of(15, 2));
        assertThat(DataTypes.sumCalculationType(NumericType.of(5, 2))).isEqualTo(DataTypes.NUMERIC);
    }

    @Test
    public void test_average_of_fixed_decimal_adds_four_digits_after_the_decimal_point() {
        assertThat(DataTypes.averageType(NumericType.of(5, 2))).isEqualTo(NumericType.of(9, 6));
        assertThat(DataTypes.averageCalculationType(NumericType.of(5, 2))).isEqualTo(DataTypes.NUMERIC);
    }

    @Test
    public void test_unlimited_decimal_stays_unlimited() {
        assertThat(DataTypes.sumType(DataTypes.NUMERIC)).isEqualTo(DataTypes.NUMERIC);
        assertThat(DataTypes.averageType(DataTypes.NUMERIC)).isEqualTo(DataTypes.NUMERIC);
    }

    @Test
    public void test_non_decimal_types_use_their_natural_types() {
        assertThat(DataTypes.sumType(DataTypes.INTEGER)).isEqualTo(DataTypes.INTEGER);
        assertThat(DataTypes.sumType(DataTypes.LONG)).isEqualTo(DataTypes.LONG);
        assertThat(DataTypes.sumType(DataTypes.DOUBLE)).isEqualTo(DataTypes.DOUBLE);

        assertThat(DataTypes.averageType(DataTypes.INTEGER)).isEqualTo(DataTypes.DOUBLE);
        assertThat(DataTypes.averageType(DataTypes.LONG)).isEqualTo(DataTypes.DOUBLE);
        assertThat(DataTypes.averageCalculationType(DataTypes.INTEGER)).isEqualTo(DataTypes.LONG);
        assertThat(DataTypes.averageCalculationType(DataTypes.DOUBLE)).isEqualTo(DataTypes.DOUBLE);
    }

    @Test
    public void test_numeric_classification() {
        assertThat(DataTypes.isNumeric(DataTypes.STRING)).isFalse();
        assertThat(DataTypes.isNumeric(NumericType.of(3, 1))).isTrue();
        assertThat(DataTypes.isIntegral(DataTypes.DOUBLE)).isFalse();
        assertThat(DataTypes.isFixedDecimal(DataTypes.NUMERIC)).isFalse();
        assertThat(DataTypes.isFixedDecimal(NumericType.of(3, 1))).isTrue();
    }
}
