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

package io.onlineagg.common.io.stream;

import java.io.IOException;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

public class ByteBufStreamInput extends StreamInput {

    private final ByteBuf buffer;

    public ByteBufStreamInput(ByteBuf buffer) {
        this.buffer = buffer;
    }

    public static StreamInput wrap(byte[] bytes) {
        return new ByteBufStreamInput(Unpooled.wrappedBuffer(bytes));
    }

    @Override
    public byte readByte() throws IOException {
        ensureCanRead(buffer.readableBytes(), 1);
        return buffer.readByte();
    }

    @Override
    public void readBytes(byte[] b, int offset, int len) throws IOException {
        ensureCanRead(buffer.readableBytes(), len);
        buffer.readBytes(b, offset, len);
    }

    @Override
    public int available() {
        return buffer.readableBytes();
    }

    @Override
    public void close() {
        buffer.release();
    }
}
