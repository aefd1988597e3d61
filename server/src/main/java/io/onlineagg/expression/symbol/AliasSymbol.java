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

import java.util.concurrent.atomic.AtomicLong;

import io.onlineagg.types.DataType;

/**
 * Gives a name and a unique id to an expression so that other expressions can refer to its output.
 */
public final class AliasSymbol implements Symbol {

    private static final AtomicLong ID_GENERATOR = new AtomicLong();

    private final long id;
    private final String name;
    private final Symbol symbol;

    public AliasSymbol(String name, Symbol symbol) {
        this(ID_GENERATOR.incrementAndGet(), name, symbol);
    }

    private AliasSymbol(long id, String name, Symbol symbol) {
        this.id = id;
        this.name = name;
        this.symbol = symbol;
    }

    public long id() {
        return id;
    }

    public String name() {
        return name;
    }

    public Symbol symbol() {
        return symbol;
    }

    /**
     * Returns a copy with the same name and id.
     */
    public AliasSymbol withSymbol(Symbol newSymbol) {
        return new AliasSymbol(id, name, newSymbol);
    }

    public AttributeReference toAttribute() {
        return new AttributeReference(id, name, symbol.valueType());
    }

    @Override
    public DataType<?> valueType() {
        return symbol.valueType();
    }

    @Override
    public <C, R> R accept(SymbolVisitor<C, R> visitor, C context) {
        return visitor.visitAlias(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        AliasSymbol that = (AliasSymbol) o;
        return id == that.id && name.equals(that.name) && symbol.equals(that.symbol);
    }

    @Override
    public int hashCode() {
        return Long.hashCode(id);
    }

    @Override
    public String toString() {
        return symbol + " AS " + name + "#" + id;
    }
}
