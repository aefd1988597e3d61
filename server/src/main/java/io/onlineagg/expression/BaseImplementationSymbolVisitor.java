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
import java.util.Locale;

import io.onlineagg.data.Input;
import io.onlineagg.expression.scalar.Scalar;
import io.onlineagg.expression.symbol.AliasSymbol;
import io.onlineagg.expression.symbol.Function;
import io.onlineagg.expression.symbol.Literal;
import io.onlineagg.expression.symbol.Symbol;
import io.onlineagg.expression.symbol.SymbolVisitor;

public class BaseImplementationSymbolVisitor<C> extends SymbolVisitor<C, Input<?>> {

    protected final Functions functions;

    public BaseImplementationSymbolVisitor(Functions functions) {
        this.functions = functions;
    }

    @Override
    public Input<?> visitFunction(Function function, C context) {
        Scalar<?> scalar = functions.get(function);
        List<Symbol> arguments = function.arguments();
        Input<?>[] argumentInputs = new Input<?>[arguments.size()];
        int i = 0;
        for (Symbol argument : arguments) {
            argumentInputs[i++] = argument.accept(this, context);
        }
        return new FunctionExpression<>(scalar, argumentInputs);
    }

    @Override
    public Input<?> visitLiteral(Literal<?> symbol, C context) {
        return symbol;
    }

    @Override
    public Input<?> visitAlias(AliasSymbol aliasSymbol, C context) {
        return aliasSymbol.symbol().accept(this, context);
    }

    @Override
    protected Input<?> visitSymbol(Symbol symbol, C context) {
        throw new UnsupportedOperationException(
            String.format(Locale.ENGLISH, "Can't handle Symbol [%s: %s]", symbol.getClass().getSimpleName(), symbol));
    }
}
