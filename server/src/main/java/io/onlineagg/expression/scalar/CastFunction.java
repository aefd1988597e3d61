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
import io.onlineagg.exceptions.ConversionException;
import io.onlineagg.expression.symbol.Function;
import io.onlineagg.expression.symbol.Symbol;
import io.onlineagg.types.DataType;

public final class CastFunction<T> extends Scalar<T> {

    public static final String NAME = "_cast";

    /**
     * Returns a symbol casting {@code symbol} to {@code targetType}, or {@code symbol} itself if it is of that type already.
     */
    public static Symbol cast(Symbol symbol, DataType<?> targetType) {
        if (symbol.valueType().equals(targetType)) {
            return symbol;
        }
        return new Function(NAME, List.of(symbol), targetType);
    }

    public CastFunction(DataType<T> returnType) {
        super(returnType);
    }

    @Override
    public final T evaluate(Input<?>... args) {
        assert args.length == 1 : "number of args must be 1";
        Object value = args[0].value();
        try {
            return returnType.implicitCast(value);
        } catch (ClassCastException | IllegalArgumentException e) {
            throw new ConversionException(value, returnType, e);
        }
    }
}
