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

package io.onlineagg.expression.symbol;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.Test;

import io.onlineagg.expression.aggregation.Min;
import io.onlineagg.expression.aggregation.Sum;
import io.onlineagg.expression.scalar.CoalesceFunction;
import io.onlineagg.expression.scalar.DivideFunction;
import io.onlineagg.types.DataTypes;

public class SymbolsTest {

    private final AliasSymbol sum = new AliasSymbol("PartialSum", new Sum(new InputColumn(0, DataTypes.LONG)));
    private final AliasSymbol count = new AliasSymbol("PartialCount", new Sum(new InputColumn(0, DataTypes.LONG)));

    @Test
    public void test_collect_attributes_walks_functions_and_aggregations() {
        Symbol tree = DivideFunction.of(new Sum(sum.toAttribute()), new Sum(count.toAttribute()));
        assertThat(Symbols.collectAttributes(tree)).containsExactly(sum.toAttribute(), count.toAttribute());
    }

    @Test
    public void test_collect_aggregations_returns_the_outermost_aggregations() {
        Sum first = new Sum(sum.toAttribute());
        Symbol tree = CoalesceFunction.of(first, Literal.of(0L));
        assertThat(Symbols.collectAggregations(tree)).containsExactly(first);
    }

    @Test
    public void test_bind_attributes_replaces_attributes_with_input_columns() {
        Symbol tree = DivideFunction.of(new Sum(sum.toAttribute()), new Sum(count.toAttribute()));
        Symbol bound = Symbols.bindAttributes(tree, List.of(count.toAttribute(), sum.toAttribute()));

        assertThat(bound).isEqualTo(DivideFunction.of(
            new Sum(new InputColumn(1, DataTypes.LONG)),
            new Sum(new InputColumn(0, DataTypes.LONG))
        ));
        assertThat(Symbols.collectAttributes(bound)).isEmpty();
    }

    @Test
    public void test_bind_of_unknown_attribute_fails() {
        Symbol tree = new Min(sum.toAttribute());
        assertThatThrownBy(() -> Symbols.bindAttributes(tree, List.of(count.toAttribute())))
            .isExactlyInstanceOf(IllegalArgumentException.class)
            .hasMessageStartingWith("Attribute PartialSum#");
    }

    @Test
    public void test_replace_does_not_descend_into_replaced_nodes() {
        Sum inner = new Sum(sum.toAttribute());
        Symbol tree = CoalesceFunction.of(inner, Literal.of(0L));
        Symbol replaced = Symbols.replace(tree, s -> s instanceof Sum ? new InputColumn(0, DataTypes.LONG) : null);
        assertThat(replaced).isEqualTo(CoalesceFunction.of(new InputColumn(0, DataTypes.LONG), Literal.of(0L)));
    }

    @Test
    public void test_alias_keeps_its_id_when_its_symbol_is_replaced() {
        AliasSymbol copy = sum.withSymbol(Literal.of(1L));
        assertThat(copy.id()).isEqualTo(sum.id());
        assertThat(copy.toAttribute()).isEqualTo(sum.toAttribute());
        assertThat(new AliasSymbol("PartialSum", sum.symbol()).id()).isNotEqualTo(sum.id());
    }
}
