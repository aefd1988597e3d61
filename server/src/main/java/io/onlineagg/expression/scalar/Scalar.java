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

import io.onlineagg.data.Input;
import io.onlineagg.types.DataType;

/**
 * Base class for scalar functions.
 * A scalar function has zero or more arguments and returns a single value.
 *
 * <p>
 * Implementations must be pure: given the same input they always return the same output.
 * </p>
 *
 * @param <ReturnType> the class of the returned value
 */
public abstract class Scalar<ReturnType> {

    protected final DataType<ReturnType> returnType;

    protected Scalar(DataType<ReturnType> returnType) {
        this.returnType = returnType;
    }

    public DataType<ReturnType> returnType() {
        return returnType;
    }

    /**
     * Evaluates the function for the values of the given inputs.
     * Inputs are evaluated lazily, implementations may skip the evaluation of some of them.
     */
    public abstract ReturnType evaluate(Input<?>... args);
}
