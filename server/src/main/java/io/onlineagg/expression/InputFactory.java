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

import java.util.ArrayList;
import java.util.List;

import com.carrotsearch.hppc.IntObjectHashMap;
import com.carrotsearch.hppc.IntObjectMap;

import io.onlineagg.data.Input;
import io.onlineagg.data.Row;
import io.onlineagg.execution.engine.collect.InputCollectExpression;
import io.onlineagg.expression.symbol.InputColumn;
import io.onlineagg.expression.symbol.Symbol;

/**
 * Factory which can be used to create {@link Input}s from symbols.
 *
 * <p>
 *     Every InputColumn is read through one {@link InputCollectExpression} per column index, which
 *     {@link ExpressionsInput#value(Row)} points to the current row before evaluating the input.
 *     <br />
 *
 *     Inputs from symbols like Functions or Literals are "standalone" and won't have a linked expression.
 * </p>
 *
 * <p>
 *     Attribute references and aggregations can't be turned into inputs, they must be bound to input columns first.
 * </p>
 */
public class InputFactory {

    private final Functions functions;

    public InputFactory(Functions functions) {
        this.functions = functions;
    }

    /**
     * Creates an input evaluating {@code symbol} on the rows passed to {@link ExpressionsInput#value(Row)}
     *
     * @throws UnsupportedOperationException if {@code symbol} contains attribute references or aggregations
     */
    public ExpressionsInput<?> bind(Symbol symbol) {
        InputColumnVisitor visitor = new InputColumnVisitor(functions);
        Input<?> input = symbol.accept(visitor, null);
        return new ExpressionsInput<>(symbol, input, visitor.columns);
    }

    private static class InputColumnVisitor extends BaseImplementationSymbolVisitor<Void> {

        private final List<InputCollectExpression> columns = new ArrayList<>();
        private final IntObjectMap<InputCollectExpression> columnsByIndex = new IntObjectHashMap<>();

        InputColumnVisitor(Functions functions) {
            super(functions);
        }

        @Override
        public Input<?> visitInputColumn(InputColumn inputColumn, Void context) {
            int index = inputColumn.index();
            InputCollectExpression column = columnsByIndex.get(index);
            if (column == null) {
                column = new InputCollectExpression(index);
                columnsByIndex.put(index, column);
                columns.add(column);
            }
            return column;
        }
    }
}
