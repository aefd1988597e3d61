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

import java.math.BigDecimal;
import java.util.Objects;

import org.jetbrains.annotations.Nullable;

import io.onlineagg.data.Input;
import io.onlineagg.types.DataType;
import io.onlineagg.types.DataTypes;
import io.onlineagg.types.NumericType;

public class Literal<T> implements Symbol, Input<T> {

    private final DataType<T> type;
    @Nullable
    private final T value;

    public static <T> Literal<T> of(DataType<T> type, @Nullable T value) {
        return new Literal<>(type, value);
    }

    public static Literal<Long> of(long value) {
        return new Literal<>(DataTypes.LONG, value);
    }

    public static Literal<Integer> of(int value) {
        return new Literal<>(DataTypes.INTEGER, value);
    }

    public static Literal<Double> of(double value) {
        return new Literal<>(DataTypes.DOUBLE, value);
    }

    public static Literal<String> of(String value) {
        return new Literal<>(DataTypes.STRING, value);
    }

    public static Literal<BigDecimal> of(BigDecimal value) {
        return new Literal<>(NumericType.INSTANCE, value);
    }

    private Literal(DataType<T> type, @Nullable T value) {
        assert value == null || type.valueClass().isInstance(value)
            : "value " + value + " is not of type " + type;
        this.type = type;
        this.value = value;
    }

    @Override
    public T value() {
        return value;
    }

    @Override
    public DataType<T> valueType() {
        return type;
    }

    @Override
    public <C, R> R accept(SymbolVisitor<C, R> visitor, C context) {
        return visitor.visitLiteral(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Literal<?> literal = (Literal<?>) o;
        return type.equals(literal.type) && Objects.equals(value, literal.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value);
    }

    @Override
    public String toString() {
        if (value == null) {
            return "NULL";
        }
        if (value instanceof String) {
            return "'" + value + "'";
        }
        return value.toString();
    }
}
