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

package io.onlineagg.execution.engine.aggregation;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import io.onlineagg.Streamer;
import io.onlineagg.common.io.stream.StreamInput;
import io.onlineagg.common.io.stream.StreamOutput;
import io.onlineagg.types.DataType;

/**
 * Streams the partial row of a partition, every column with the streamer of its type.
 */
public final class PartialRowStreamer implements Streamer<Object[]> {

    private final List<Streamer<Object>> streamers;

    @SuppressWarnings("unchecked")
    public PartialRowStreamer(List<? extends DataType<?>> columnTypes) {
        streamers = new ArrayList<>(columnTypes.size());
        for (DataType<?> type : columnTypes) {
            streamers.add((Streamer<Object>) type.streamer());
        }
    }

    @Override
    public Object[] readValueFrom(StreamInput in) throws IOException {
        int numColumns = in.readVInt();
        if (numColumns != streamers.size()) {
            throw new IOException(String.format(
                Locale.ENGLISH,
                "Expected a partial row with %d columns, but got %d",
                streamers.size(),
                numColumns
            ));
        }
        Object[] cells = new Object[numColumns];
        for (int i = 0; i < numColumns; i++) {
            cells[i] = streamers.get(i).readValueFrom(in);
        }
        return cells;
    }

    @Override
    public void writeValueTo(StreamOutput out, Object[] cells) throws IOException {
        assert cells.length == streamers.size() : "partial row must have a column per streamer";
        out.writeVInt(cells.length);
        for (int i = 0; i < cells.length; i++) {
            streamers.get(i).writeValueTo(out, cells[i]);
        }
    }
}
