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

import java.util.List;

import io.onlineagg.data.Input;
import io.onlineagg.expression.symbol.Function;
import io.onlineagg.expression.symbol.Symbol;
import io.onlineagg.types.DataType;

/**
 * Returns the value of the first argument which is not null.
 */
public final class CoalesceFunction<T> extends Scalar<T> {

    public static final String NAME = "coalesce";

    public static Function of(Symbol ... arguments) {
        if (arguments.length == 0) {
            throw new IllegalArgumentException("coalesce requires at least one argument");
        }
        DataType<?> type = arguments[0].valueType();
        for (Symbol argument : arguments) {
            if (!argument.valueType().equals(type)) {
                throw new IllegalArgumentException(
                    "All arguments of coalesce must be of the same type, got " + List.of(arguments));
            }
        }
        return new Function(NAME, List.of(arguments), type);
    }

    public CoalesceFunction(DataType<T> returnType) {
        super(returnType);
    }

    @Override
    public final T evaluate(Input<?>... args) {
        for (Input<?> input : args) {
            Object value = input.value();
            if (value != null) {
                return returnType.sanitizeValue(value);
            }
        }
        return null;
    }
}
