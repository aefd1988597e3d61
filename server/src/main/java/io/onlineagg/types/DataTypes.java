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

import java.util.Set;

public final class DataTypes {

    private DataTypes() {
    }

    public static final StringType STRING = StringType.INSTANCE;
    public static final IntegerType INTEGER = IntegerType.INSTANCE;
    public static final LongType LONG = LongType.INSTANCE;
    public static final DoubleType DOUBLE = DoubleType.INSTANCE;
    /**
     * The unlimited numeric type.
     */
    public static final NumericType NUMERIC = NumericType.INSTANCE;

    public static final Set<Integer> NUMERIC_TYPE_IDS = Set.of(
        IntegerType.ID,
        LongType.ID,
        DoubleType.ID,
        NumericType.ID
    );

    /**
     * Precision added to the integral part of a fixed numeric when it is summed up.
     */
    public static final int SUM_PRECISION_INCREMENT = 10;

    /**
     * Digits added after the decimal point of a fixed numeric when it is averaged.
     */
    public static final int AVERAGE_SCALE_INCREMENT = 4;

    public static boolean isNumeric(DataType<?> type) {
        return NUMERIC_TYPE_IDS.contains(type.id());
    }

    public static boolean isIntegral(DataType<?> type) {
        return type.id() == IntegerType.ID || type.id() == LongType.ID;
    }

    /**
     * @return true for {@code numeric(p,s)}, false for the unlimited {@code numeric} and any other type.
     */
    public static boolean isFixedDecimal(DataType<?> type) {
        return type instanceof NumericType numericType && numericType.fixed();
    }

    /**
     * The result type of summing up values of {@code argumentType}.
     *
     * <ul>
     *     <li>numeric(p,s) -> numeric(p + 10, s)</li>
     *     <li>numeric -> numeric</li>
     *     <li>any other type -> itself</li>
     * </ul>
     */
    public static DataType<?> sumType(DataType<?> argumentType) {
        if (isFixedDecimal(argumentType)) {
            NumericType numericType = (NumericType) argumentType;
            return NumericType.of(numericType.numericPrecision() + SUM_PRECISION_INCREMENT, numericType.scale());
        }
        return argumentType;
    }

    /**
     * The type used while summing up values of {@code argumentType}.
     * Fixed decimals are summed up as unlimited decimals and cast to {@link #sumType(DataType)} at the end.
     */
    public static DataType<?> sumCalculationType(DataType<?> argumentType) {
        if (isFixedDecimal(argumentType)) {
            return NUMERIC;
        }
        return argumentType;
    }

    /**
     * The result type of averaging values of {@code argumentType}.
     *
     * <ul>
     *     <li>numeric(p,s) -> numeric(p + 4, s + 4)</li>
     *     <li>numeric -> numeric</li>
     *     <li>any other type -> double precision</li>
     * </ul>
     */
    public static DataType<?> averageType(DataType<?> argumentType) {
        if (argumentType instanceof NumericType numericType) {
            if (numericType.fixed()) {
                return NumericType.of(
                    numericType.numericPrecision() + AVERAGE_SCALE_INCREMENT,
                    numericType.scale() + AVERAGE_SCALE_INCREMENT
                );
            }
            return NUMERIC;
        }
        return DOUBLE;
    }

    /**
     * The type of the running sum while averaging values of {@code argumentType}.
     * Integral types are widened to bigint, decimals to the unlimited numeric.
     */
    public static DataType<?> averageCalculationType(DataType<?> argumentType) {
        if (argumentType instanceof NumericType) {
            return NUMERIC;
        }
        if (isIntegral(argumentType)) {
            return LONG;
        }
        return DOUBLE;
    }
}
