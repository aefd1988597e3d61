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

import java.util.List;

import io.onlineagg.data.Input;
import io.onlineagg.data.Row;
import io.onlineagg.execution.engine.collect.InputCollectExpression;
import io.onlineagg.expression.symbol.Symbol;

/**
 * A symbol bound to the columns of a {@link Row}.
 * Created by {@link InputFactory#bind(Symbol)}.
 */
public final class ExpressionsInput<T> {

    private final Symbol symbol;
    private final Input<T> input;
    private final InputCollectExpression[] columns;

    ExpressionsInput(Symbol symbol, Input<T> input, List<InputCollectExpression> columns) {
        this.symbol = symbol;
        this.input = input;
        this.columns = columns.toArray(new InputCollectExpression[0]);
    }

    /**
     * Evaluates the symbol on {@code row}.
     */
    public T value(Row row) {
        for (InputCollectExpression column : columns) {
            column.setNextRow(row);
        }
        return input.value();
    }

    @Override
    public String toString() {
        return "ExpressionsInput{" + symbol + '}';
    }
}
