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

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.List;

import io.onlineagg.data.Input;
import io.onlineagg.expression.symbol.Function;
import io.onlineagg.expression.symbol.Symbol;
import io.onlineagg.types.DataType;
import io.onlineagg.types.DataTypes;
import io.onlineagg.types.DoubleType;
import io.onlineagg.types.IntegerType;
import io.onlineagg.types.LongType;
import io.onlineagg.types.NumericType;

/**
 * Division of two numeric values. Both arguments are converted to the return type first.
 *
 * <p>
 * Decimals are divided with {@link MathContext#DECIMAL128} precision and rounded to the return type if it is fixed.
 * Integral division by zero raises an {@link ArithmeticException}.
 * </p>
 */
public final class DivideFunction<T> extends Scalar<T> {

    public static final String NAME = "divide";

    /**
     * Creates a division of {@code dividend} by {@code divisor} typed with the argument type of higher precedence.
     */
    public static Function of(Symbol dividend, Symbol divisor) {
        DataType<?> leftType = dividend.valueType();
        DataType<?> rightType = divisor.valueType();
        if (!DataTypes.isNumeric(leftType) || !DataTypes.isNumeric(rightType)) {
            throw new IllegalArgumentException(
                "Cannot divide values of type `" + leftType + "` by values of type `" + rightType + "`");
        }
        DataType<?> returnType = rightType.precedes(leftType) ? rightType : leftType;
        return new Function(NAME, List.of(dividend, divisor), returnType);
    }

    public DivideFunction(DataType<T> returnType) {
        super(returnType);
        if (!DataTypes.isNumeric(returnType)) {
            throw new IllegalArgumentException("Cannot divide values of type `" + returnType + "`");
        }
    }

    @Override
    public final T evaluate(Input<?>... args) {
        assert args.length == 2 : "number of args must be 2";
        Object left = args[0].value();
        if (left == null) {
            return null;
        }
        Object right = args[1].value();
        if (right == null) {
            return null;
        }
        T dividend = returnType.implicitCast(left);
        T divisor = returnType.implicitCast(right);
        Object result = switch (returnType.id()) {
            case IntegerType.ID -> (Integer) dividend / (Integer) divisor;
            case LongType.ID -> (Long) dividend / (Long) divisor;
            case DoubleType.ID -> (Double) dividend / (Double) divisor;
            case NumericType.ID -> ((BigDecimal) dividend).divide((BigDecimal) divisor, MathContext.DECIMAL128);
            default -> throw new IllegalStateException("Unexpected return type " + returnType);
        };
        return returnType.implicitCast(result);
    }
}
