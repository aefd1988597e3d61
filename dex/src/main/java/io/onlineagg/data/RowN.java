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


package io.onlineagg.data;

import java.util.Arrays;
import java.util.Objects;

/**
 * A row over a fixed number of cells. The cells are owned by the row, {@link #materialize()} returns a copy.
 */
public final class RowN implements Row {

    private final Object[] cells;

    public RowN(Object ... cells) {
        this.cells = Objects.requireNonNull(cells, "cells");
    }

    /**
     * A row with {@code numColumns} null cells, to be filled with {@link #set(int, Object)}.
     */
    public static RowN ofSize(int numColumns) {
        return new RowN(new Object[numColumns]);
    }

    public void set(int index, Object value) {
        cells[index] = value;
    }

    @Override
    public int numColumns() {
        return cells.length;
    }

    @Override
    public Object get(int index) {
        return cells[index];
    }

    @Override
    public Object[] materialize() {
        return Arrays.copyOf(cells, cells.length);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return Arrays.equals(cells, ((RowN) o).cells);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(cells);
    }

    @Override
    public String toString() {
        return Arrays.toString(cells);
    }
}
