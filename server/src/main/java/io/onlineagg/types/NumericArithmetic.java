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

package io.onlineagg.types;

import java.math.BigDecimal;

/**
 * Additive arithmetic for one numeric {@link DataType}.
 *
 * <p>
 * There is exactly one implementation per numeric type; {@link #of(DataType)} selects it once when a consumer
 * is created, so that the accumulation loop doesn't need to look at types anymore.
 * </p>
 *
 * <p>
 * Decimal arithmetic never rounds: it is exact for the unlimited {@code numeric} type and callers are responsible
 * for casting the result to a fixed {@code numeric(p,s)} type once, after accumulation.
 * </p>
 */
public sealed interface NumericArithmetic<T> {

    DataType<T> type();

    T zero();

    T plus(T a, T b);

    @SuppressWarnings("unchecked")
    static <T> NumericArithmetic<T> of(DataType<T> type) {
        NumericArithmetic<?> arithmetic = switch (type.id()) {
            case IntegerType.ID -> IntegerArithmetic.INSTANCE;
            case LongType.ID -> LongArithmetic.INSTANCE;
            case DoubleType.ID -> DoubleArithmetic.INSTANCE;
            case NumericType.ID -> new DecimalArithmetic((NumericType) type);
            default -> throw new IllegalArgumentException(
                "Cannot apply arithmetic to values of non-numeric type `" + type + "`");
        };
        return (NumericArithmetic<T>) arithmetic;
    }

    final class IntegerArithmetic implements NumericArithmetic<Integer> {

        static final IntegerArithmetic INSTANCE = new IntegerArithmetic();

        @Override
        public DataType<Integer> type() {
            return IntegerType.INSTANCE;
        }

        @Override
        public Integer zero() {
            return 0;
        }

        @Override
        public Integer plus(Integer a, Integer b) {
            return Math.addExact(a, b);
        }
    }

    final class LongArithmetic implements NumericArithmetic<Long> {

        static final LongArithmetic INSTANCE = new LongArithmetic();

        @Override
        public DataType<Long> type() {
            return LongType.INSTANCE;
        }

        @Override
        public Long zero() {
            return 0L;
        }

        @Override
        public Long plus(Long a, Long b) {
            return Math.addExact(a, b);
        }
    }

    final class DoubleArithmetic implements NumericArithmetic<Double> {

        static final DoubleArithmetic INSTANCE = new DoubleArithmetic();

        @Override
        public DataType<Double> type() {
            return DoubleType.INSTANCE;
        }

        @Override
        public Double zero() {
            return 0.0d;
        }

        @Override
        public Double plus(Double a, Double b) {
            return a + b;
        }
    }

    final class DecimalArithmetic implements NumericArithmetic<BigDecimal> {

        private final NumericType type;

        DecimalArithmetic(NumericType type) {
            this.type = type;
        }

        @Override
        public DataType<BigDecimal> type() {
            return type;
        }

        @Override
        public BigDecimal zero() {
            return BigDecimal.ZERO;
        }

        @Override
        public BigDecimal plus(BigDecimal a, BigDecimal b) {
            return a.add(b);
        }
    }
}
