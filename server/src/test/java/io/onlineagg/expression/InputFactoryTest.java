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


package io.onlineagg.expression;

import static io.onlineagg.testing.TestingHelpers.row;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.Test;

import io.onlineagg.expression.aggregation.Sum;
import io.onlineagg.expression.scalar.CoalesceFunction;
import io.onlineagg.expression.symbol.AttributeReference;
import io.onlineagg.expression.symbol.InputColumn;
import io.onlineagg.expression.symbol.Literal;
import io.onlineagg.types.DataTypes;

public class InputFactoryTest {

    private final InputFactory inputFactory = new InputFactory(new Functions());

    @Test
    public void test_bound_input_reads_the_current_row() {
        InputColumn column = new InputColumn(1, DataTypes.LONG);
        ExpressionsInput<?> input = inputFactory.bind(CoalesceFunction.of(column, column, Literal.of(-1L)));

        assertThat(input.value(row("a", 10L))).isEqualTo(10L);
        assertThat(input.value(row("b", null))).isEqualTo(-1L);
        assertThat(input).hasToString("ExpressionsInput{coalesce(INPUT(1), INPUT(1), -1)}");
    }

    @Test
    public void test_literal_is_independent_of_the_row() {
        ExpressionsInput<?> input = inputFactory.bind(Literal.of("x"));
        assertThat(input.value(row(1L))).isEqualTo("x");
    }

    @Test
    public void test_attributes_and_aggregations_must_be_bound_first() {
        AttributeReference attribute = new AttributeReference(1L, "x", DataTypes.LONG);
        assertThatThrownBy(() -> inputFactory.bind(attribute))
            .isExactlyInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> inputFactory.bind(new Sum(new InputColumn(0, DataTypes.LONG))))
            .isExactlyInstanceOf(UnsupportedOperationException.class);
    }
}
