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

import io.onlineagg.expression.symbol.Symbol;
import io.onlineagg.types.DataType;
import io.onlineagg.types.DataTypes;

/**
 * Counts the distinct tuples of {@code arguments}. Tuples with a null component are not counted.
 */
public record CountDistinct(List<Symbol> arguments) implements Aggregation {

    public CountDistinct {
        if (arguments.isEmpty()) {
            throw new IllegalArgumentException("COUNT(DISTINCT) requires at least one argument");
        }
        arguments = List.copyOf(arguments);
    }

    public CountDistinct(Symbol ... arguments) {
        this(List.of(arguments));
    }

    @Override
    public DataType<?> valueType() {
        return DataTypes.LONG;
    }

    @Override
    public CountDistinct withArguments(List<Symbol> newArguments) {
        return new CountDistinct(newArguments);
    }

    @Override
    public boolean nullable() {
        return false;
    }

    @Override
    public <C, R> R accept(AggregationVisitor<C, R> visitor, C context) {
        return visitor.visitCountDistinct(this, context);
    }

    @Override
    public String toString() {
        return "COUNT(DISTINCT " + Aggregation.joinArguments(arguments) + ")";
    }
}
