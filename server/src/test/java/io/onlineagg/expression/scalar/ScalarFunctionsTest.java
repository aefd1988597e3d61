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

package io.onlineagg.expression.scalar;

import static io.onlineagg.testing.TestingHelpers.row;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.util.List;

import org.junit.Test;

import io.onlineagg.data.Row;
import io.onlineagg.exceptions.ConversionException;
import io.onlineagg.expression.Functions;
import io.onlineagg.expression.InputFactory;
import io.onlineagg.expression.symbol.Function;
import io.onlineagg.expression.symbol.InputColumn;
import io.onlineagg.expression.symbol.Literal;
import io.onlineagg.expression.symbol.Symbol;
import io.onlineagg.types.DataTypes;
import io.onlineagg.types.NumericType;

public class ScalarFunctionsTest {

    private final InputFactory inputFactory = new InputFactory(new Functions());

    private Object evaluate(Symbol symbol, Row row) {
        return inputFactory.bind(symbol).value(row);
    }

    @Test
    public void test_cast_to_the_same_type_is_a_no_op() {
        InputColumn column = new InputColumn(0, DataTypes.LONG);
        assertThat(CastFunction.cast(column, DataTypes.LONG)).isSameAs(column);
    }

    @Test
    public void test_cast_converts_values() {
        Symbol cast = CastFunction.cast(new InputColumn(0, DataTypes.LONG), NumericType.of(5, 2));
        assertThat(cast).hasToString("_cast(INPUT(0))");
        assertThat(evaluate(cast, row(12L))).hasToString("12.00");
        assertThat(evaluate(cast, row((Object) null))).isNull();
    }

    @Test
    public void test_failing_cast_raises_conversion_exception() {
        Symbol cast = CastFunction.cast(new InputColumn(0, DataTypes.STRING), DataTypes.INTEGER);
        assertThatThrownBy(() -> evaluate(cast, row("x")))
            .isExactlyInstanceOf(ConversionException.class)
            .hasMessage("Cannot cast value `x` to type `integer`");
    }

    @Test
    public void test_divide_uses_the_type_of_higher_precedence() {
        Function divide = DivideFunction.of(new InputColumn(0, DataTypes.LONG), Literal.of(4.0d));
        assertThat(divide.valueType()).isEqualTo(DataTypes.DOUBLE);
        assertThat(evaluate(divide, row(10L))).isEqualTo(2.5d);
    }

    @Test
    public void test_decimal_division_is_rounded_to_decimal128() {
        Function divide = DivideFunction.of(Literal.of(BigDecimal.ONE), Literal.of(new BigDecimal("3")));
        BigDecimal result = (BigDecimal) evaluate(divide, Row.EMPTY);
        assertThat(result.precision()).isEqualTo(34);
        assertThat(result).isEqualByComparingTo(new BigDecimal("0.3333333333333333333333333333333333"));
    }

    @Test
    public void test_division_by_null_is_null() {
        Function divide = DivideFunction.of(new InputColumn(0, DataTypes.LONG), new InputColumn(1, DataTypes.LONG));
        assertThat(evaluate(divide, row(1L, null))).isNull();
        assertThat(evaluate(divide, row(null, 1L))).isNull();
    }

    @Test
    public void test_integral_division_by_zero_fails() {
        Function divide = DivideFunction.of(Literal.of(1L), Literal.of(0L));
        assertThatThrownBy(() -> evaluate(divide, Row.EMPTY))
            .isExactlyInstanceOf(ArithmeticException.class);
    }

    @Test
    public void test_coalesce_returns_the_first_non_null_value() {
        Function coalesce = CoalesceFunction.of(new InputColumn(0, DataTypes.LONG), Literal.of(0L));
        assertThat(evaluate(coalesce, row((Object) null))).isEqualTo(0L);
        assertThat(evaluate(coalesce, row(7L))).isEqualTo(7L);
    }

    @Test
    public void test_coalesce_arguments_must_have_the_same_type() {
        assertThatThrownBy(() -> CoalesceFunction.of(Literal.of(1L), Literal.of("a")))
            .isExactlyInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void test_unknown_function_is_rejected() {
        Function unknown = new Function("unknown", List.of(), DataTypes.LONG);
        assertThatThrownBy(() -> evaluate(unknown, Row.EMPTY))
            .isExactlyInstanceOf(IllegalArgumentException.class)
            .hasMessage("Unknown function: unknown");
    }
}
