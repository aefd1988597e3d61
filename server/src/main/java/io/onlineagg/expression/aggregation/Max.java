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
import io.onlineagg.types.DistinctSetType;

public record Max(Symbol argument) implements Aggregation {

    public Max {
        Objects.requireNonNull(argument, "argument");
        if (argument.valueType() instanceof DistinctSetType) {
            throw new IllegalArgumentException("Cannot compute MAX of values of type `" + argument.valueType() + "`");
        }
    }

    @Override
    public DataType<?> valueType() {
        return argument.valueType();
    }

    @Override
    public List<Symbol> arguments() {
        return List.of(argument);
    }

    @Override
    public Max withArguments(List<Symbol> newArguments) {
        return new Max(Aggregation.singleArgument(newArguments, "MAX"));
    }

    @Override
    public boolean nullable() {
        return true;
    }

    @Override
    public <C, R> R accept(AggregationVisitor<C, R> visitor, C context) {
        return visitor.visitMax(this, context);
    }

    @Override
    public String toString() {
        return "MAX(" + argument + ")";
    }
}
