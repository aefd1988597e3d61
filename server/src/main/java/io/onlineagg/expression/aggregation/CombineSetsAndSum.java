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
import io.onlineagg.types.DistinctSetType;

/**
 * Unions the distinct sets produced by {@link CollectSet} and sums up the single column of their keys.
 *
 * <p>
 * The element type of the set is validated against {@code returnType} on construction:
 * the set must have exactly one numeric key column and {@code returnType} must be the sum type of it.
 * </p>
 */
public record CombineSetsAndSum(Symbol inputSet, DataType<?> returnType) implements Aggregation {

    public CombineSetsAndSum {
        Objects.requireNonNull(inputSet, "inputSet");
        Objects.requireNonNull(returnType, "returnType");
        if (!(inputSet.valueType() instanceof DistinctSetType setType)) {
            throw new IllegalArgumentException(
                "CombineAndSum expects a distinct set, got `" + inputSet.valueType() + "`");
        }
        List<DataType<?>> keyTypes = setType.keyTypes();
        if (keyTypes.size() != 1 || !DataTypes.isNumeric(keyTypes.get(0))) {
            throw new IllegalArgumentException(
                "CombineAndSum expects a distinct set of a single numeric column, got `" + setType + "`");
        }
        DataType<?> expected = DataTypes.sumType(keyTypes.get(0));
        if (!expected.equals(returnType)) {
            throw new IllegalArgumentException(
                "CombineAndSum over `" + setType + "` must return `" + expected + "`, not `" + returnType + "`");
        }
    }

    public DistinctSetType setType() {
        return (DistinctSetType) inputSet.valueType();
    }

    public DataType<?> keyType() {
        return setType().keyTypes().get(0);
    }

    @Override
    public DataType<?> valueType() {
        return returnType;
    }

    @Override
    public List<Symbol> arguments() {
        return List.of(inputSet);
    }

    @Override
    public CombineSetsAndSum withArguments(List<Symbol> newArguments) {
        return new CombineSetsAndSum(Aggregation.singleArgument(newArguments, "CombineAndSum"), returnType);
    }

    @Override
    public boolean nullable() {
        return true;
    }

    @Override
    public <C, R> R accept(AggregationVisitor<C, R> visitor, C context) {
        return visitor.visitCombineSetsAndSum(this, context);
    }

    @Override
    public String toString() {
        return "CombineAndSum(" + inputSet + ")";
    }
}
