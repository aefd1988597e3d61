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

package io.onlineagg.exceptions;

import java.util.Locale;

import org.jetbrains.annotations.Nullable;

import io.onlineagg.types.DataType;

/**
 * Raised if a value reaching an aggregation doesn't match the type the aggregation was bound to.
 *
 * <p>
 * Values are cast to the bound types while planning, so a mismatch at execution time means the plan is broken.
 * It is never retried.
 * </p>
 */
public class AggregationTypeMismatchException extends IllegalStateException {

    public AggregationTypeMismatchException(Object source, DataType<?> expectedType, Object value) {
        super(String.format(
            Locale.ENGLISH,
            "Type mismatch in `%s`: expected a value of type `%s` but got `%s` of class `%s`",
            source,
            expectedType,
            value,
            value.getClass().getSimpleName()
        ));
    }

    public AggregationTypeMismatchException(String message) {
        super(message);
    }

    /**
     * Returns the value as a value of {@code type} or raises an {@link AggregationTypeMismatchException}
     */
    @Nullable
    public static <T> T checkValue(Object source, DataType<T> type, @Nullable Object value) {
        if (value == null) {
            return null;
        }
        Class<T> valueClass = type.valueClass();
        if (valueClass.isInstance(value)) {
            return valueClass.cast(value);
        }
        throw new AggregationTypeMismatchException(source, type, value);
    }
}
