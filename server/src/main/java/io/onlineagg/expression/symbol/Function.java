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

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import io.onlineagg.types.DataType;

/**
 * A scalar function call. The implementation is looked up by name, see {@link io.onlineagg.expression.Functions}.
 */
public final class Function implements Symbol {

    private final String name;
    private final List<Symbol> arguments;
    private final DataType<?> returnType;

    public Function(String name, List<Symbol> arguments, DataType<?> returnType) {
        this.name = name;
        this.arguments = List.copyOf(arguments);
        this.returnType = returnType;
    }

    public String name() {
        return name;
    }

    public List<Symbol> arguments() {
        return arguments;
    }

    public Function withArguments(List<Symbol> newArguments) {
        return new Function(name, newArguments, returnType);
    }

    @Override
    public DataType<?> valueType() {
        return returnType;
    }

    @Override
    public <C, R> R accept(SymbolVisitor<C, R> visitor, C context) {
        return visitor.visitFunction(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Function function = (Function) o;
        return name.equals(function.name) &&
               arguments.equals(function.arguments) &&
               returnType.equals(function.returnType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, arguments, returnType);
    }

    @Override
    public String toString() {
        return arguments.stream()
            .map(Symbol::toString)
            .collect(Collectors.joining(", ", name + "(", ")"));
    }
}
