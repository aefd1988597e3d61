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

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.UnaryOperator;

import org.jetbrains.annotations.Nullable;

import io.onlineagg.expression.aggregation.Aggregation;

public final class Symbols {

    private Symbols() {
    }

    /**
     * Returns all attributes referenced within {@code symbol}, in order of their first appearance.
     */
    public static Set<AttributeReference> collectAttributes(Symbol symbol) {
        Set<AttributeReference> attributes = new LinkedHashSet<>();
        symbol.accept(AttributeCollector.INSTANCE, attributes);
        return attributes;
    }

    /**
     * Returns the outermost aggregations within {@code symbol}, in order of appearance.
     * Aggregations nested in the arguments of another aggregation are not included.
     */
    public static List<Aggregation> collectAggregations(Symbol symbol) {
        List<Aggregation> aggregations = new ArrayList<>();
        symbol.accept(AggregationCollector.INSTANCE, aggregations);
        return aggregations;
    }

    /**
     * Rewrites {@code tree} top-down. If {@code replacement} returns a symbol for a node the node is replaced
     * and its children are not visited. If it returns null the children of the node are rewritten.
     */
    public static Symbol replace(Symbol tree, UnaryOperator<Symbol> replacement) {
        return tree.accept(new Replacer(replacement), null);
    }

    /**
     * Replaces every attribute in {@code symbol} with an {@link InputColumn} pointing to the position of
     * the attribute in {@code inputs}.
     *
     * @throws IllegalArgumentException if {@code symbol} references an attribute that is not part of {@code inputs}
     */
    public static Symbol bindAttributes(Symbol symbol, List<AttributeReference> inputs) {
        return replace(symbol, s -> {
            if (s instanceof AttributeReference attribute) {
                int index = inputs.indexOf(attribute);
                if (index < 0) {
                    throw new IllegalArgumentException(
                        "Attribute " + attribute + " of " + symbol + " is not part of the inputs " + inputs);
                }
                return new InputColumn(index, attribute.valueType());
            }
            return null;
        });
    }

    private static class AttributeCollector extends SymbolVisitor<Set<AttributeReference>, Void> {

        static final AttributeCollector INSTANCE = new AttributeCollector();

        @Override
        public Void visitAttributeReference(AttributeReference attribute, Set<AttributeReference> context) {
            context.add(attribute);
            return null;
        }

        @Override
        public Void visitAlias(AliasSymbol aliasSymbol, Set<AttributeReference> context) {
            return aliasSymbol.symbol().accept(this, context);
        }

        @Override
        public Void visitFunction(Function function, Set<AttributeReference> context) {
            for (Symbol argument : function.arguments()) {
                argument.accept(this, context);
            }
            return null;
        }

        @Override
        public Void visitAggregation(Aggregation aggregation, Set<AttributeReference> context) {
            for (Symbol argument : aggregation.arguments()) {
                argument.accept(this, context);
            }
            return null;
        }
    }

    private static class AggregationCollector extends SymbolVisitor<List<Aggregation>, Void> {

        static final AggregationCollector INSTANCE = new AggregationCollector();

        @Override
        public Void visitAggregation(Aggregation aggregation, List<Aggregation> context) {
            context.add(aggregation);
            return null;
        }

        @Override
        public Void visitAlias(AliasSymbol aliasSymbol, List<Aggregation> context) {
            return aliasSymbol.symbol().accept(this, context);
        }

        @Override
        public Void visitFunction(Function function, List<Aggregation> context) {
            for (Symbol argument : function.arguments()) {
                argument.accept(this, context);
            }
            return null;
        }
    }

    private static class Replacer extends SymbolVisitor<Void, Symbol> {

        private final UnaryOperator<Symbol> replacement;

        Replacer(UnaryOperator<Symbol> replacement) {
            this.replacement = replacement;
        }

        @Nullable
        private Symbol replaced(Symbol symbol) {
            return replacement.apply(symbol);
        }

        @Override
        protected Symbol visitSymbol(Symbol symbol, Void context) {
            Symbol replaced = replaced(symbol);
            return replaced == null ? symbol : replaced;
        }

        @Override
        public Symbol visitAlias(AliasSymbol aliasSymbol, Void context) {
            Symbol replaced = replaced(aliasSymbol);
            if (replaced != null) {
                return replaced;
            }
            return aliasSymbol.withSymbol(aliasSymbol.symbol().accept(this, context));
        }

        @Override
        public Symbol visitFunction(Function function, Void context) {
            Symbol replaced = replaced(function);
            if (replaced != null) {
                return replaced;
            }
            return function.withArguments(replaceAll(function.arguments()));
        }

        @Override
        public Symbol visitAggregation(Aggregation aggregation, Void context) {
            Symbol replaced = replaced(aggregation);
            if (replaced != null) {
                return replaced;
            }
            return aggregation.withArguments(replaceAll(aggregation.arguments()));
        }

        private List<Symbol> replaceAll(List<Symbol> symbols) {
            List<Symbol> result = new ArrayList<>(symbols.size());
            for (Symbol symbol : symbols) {
                result.add(symbol.accept(this, null));
            }
            return result;
        }
    }
}
