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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.Test;

public class RowNTest {

    @Test
    public void test_materialize_returns_a_copy() {
        Object[] cells = new Object[] {1, "foo", null};
        RowN row = new RowN(cells);
        Object[] materialized = row.materialize();
        cells[0] = 2;

        assertThat(materialized).containsExactly(1, "foo", null);
        assertThat(row.get(0)).isEqualTo(2);
    }

    @Test
    public void test_row_of_size_is_filled_cell_by_cell() {
        RowN row = RowN.ofSize(2);
        assertThat(row.numColumns()).isEqualTo(2);
        assertThat(row.anyNull()).isTrue();
        row.set(0, 1);
        row.set(1, "a");
        assertThat(row.anyNull()).isFalse();
        assertThat(row).isEqualTo(new RowN(1, "a"));
        assertThat(row).hasToString("[1, a]");
    }

    @Test
    public void test_any_null_checks_all_cells() {
        assertThat(new RowN(1, null, "a").anyNull()).isTrue();
        assertThat(new RowN(1, 2).anyNull()).isFalse();
    }

    @Test
    public void test_empty_row_has_no_cells() {
        assertThat(Row.EMPTY.numColumns()).isZero();
        assertThat(Row.EMPTY.materialize()).isEmpty();
        assertThat(Row.EMPTY.anyNull()).isFalse();
        assertThatThrownBy(() -> Row.EMPTY.get(0))
            .isExactlyInstanceOf(IndexOutOfBoundsException.class);
    }
}
