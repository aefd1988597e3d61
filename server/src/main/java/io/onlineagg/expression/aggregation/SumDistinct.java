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

package io.onlineagg.expression.aggregation;

import java.util.List;
import java.util.Objects;

import io.onlineagg.expression.symbol.Symbol;
import io.onlineagg.types.DataType;
import io.onlineagg.types.DataTypes;

/**
 * Sums up the distinct non-null values of {@code argument}.
 */
public record SumDistinct(Symbol argument) implements Aggregation {

    public SumDistinct {
        Objects.requireNonNull(argument, "argument");
        Sum.requireNumeric(argument, "SUM(DISTINCT)");
    }

    @Override
    public DataType<?> valueType() {
        return DataTypes.sumType(argument.valueType());
    }

    @Override
    public List<Symbol> arguments() {
        return List.of(argument);
    }

    @Override
    public SumDistinct withArguments(List<Symbol> newArguments) {
        return new SumDistinct(Aggregation.singleArgument(newArguments, "SUM(DISTINCT)"));
    }

    @Override
    public boolean nullable() {
        return true;
    }

    @Override
    public <C, R> R accept(AggregationVisitor<C, R> visitor, C context) {
        return visitor.visitSumDistinct(this, context);
    }

    @Override
    public String toString() {
        return "SUM(DISTINCT " + argument + ")";
    }
}
