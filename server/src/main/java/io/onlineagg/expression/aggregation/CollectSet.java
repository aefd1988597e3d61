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
import io.onlineagg.types.DistinctSetType;

/**
 * Collects the distinct tuples of {@code arguments} of one partition into a
 * {@link io.onlineagg.execution.engine.aggregation.MergeableDistinctSet}.
 */
public record CollectSet(List<Symbol> arguments) implements Aggregation {

    public CollectSet {
        if (arguments.isEmpty()) {
            throw new IllegalArgumentException("AddToHashSet requires at least one argument");
        }
        arguments = List.copyOf(arguments);
        for (Symbol argument : arguments) {
            if (argument.valueType() instanceof DistinctSetType) {
                throw new IllegalArgumentException("Cannot collect values of type `" + argument.valueType() + "`");
            }
        }
    }

    @Override
    public DistinctSetType valueType() {
        return new DistinctSetType(arguments.stream().<DataType<?>>map(Symbol::valueType).toList());
    }

    @Override
    public CollectSet withArguments(List<Symbol> newArguments) {
        return new CollectSet(newArguments);
    }

    @Override
    public boolean nullable() {
        return false;
    }

    @Override
    public <C, R> R accept(AggregationVisitor<C, R> visitor, C context) {
        return visitor.visitCollectSet(this, context);
    }

    @Override
    public String toString() {
        return "AddToHashSet(" + Aggregation.joinArguments(arguments) + ")";
    }
}
