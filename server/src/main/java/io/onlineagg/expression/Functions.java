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

import java.util.Map;
import java.util.function.Function;

import io.onlineagg.expression.scalar.CastFunction;
import io.onlineagg.expression.scalar.CoalesceFunction;
import io.onlineagg.expression.scalar.DivideFunction;
import io.onlineagg.expression.scalar.Scalar;
import io.onlineagg.types.DataType;

/**
 * Resolves the {@link Scalar} implementation of a {@link io.onlineagg.expression.symbol.Function} symbol.
 */
public class Functions {

    private final Map<String, Function<DataType<?>, Scalar<?>>> implementations;

    public Functions() {
        this(Map.of(
            CastFunction.NAME, CastFunction::new,
            DivideFunction.NAME, DivideFunction::new,
            CoalesceFunction.NAME, CoalesceFunction::new
        ));
    }

    public Functions(Map<String, Function<DataType<?>, Scalar<?>>> implementations) {
        this.implementations = Map.copyOf(implementations);
    }

    public Scalar<?> get(io.onlineagg.expression.symbol.Function function) {
        Function<DataType<?>, Scalar<?>> factory = implementations.get(function.name());
        if (factory == null) {
            throw new IllegalArgumentException("Unknown function: " + function.name());
        }
        return factory.apply(function.valueType());
    }
}
