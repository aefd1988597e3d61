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

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

/**
 * A {@link StreamOutput} that writes into a growing heap {@link ByteBuf}.
 */
public class BytesStreamOutput extends StreamOutput {

    private final ByteBuf buffer;

    public BytesStreamOutput() {
        this(256);
    }

    public BytesStreamOutput(int expectedSize) {
        this.buffer = Unpooled.buffer(expectedSize);
    }

    @Override
    public void writeByte(byte b) {
        buffer.writeByte(b);
    }

    @Override
    public void writeBytes(byte[] b, int offset, int length) {
        buffer.writeBytes(b, offset, length);
    }

    public int size() {
        return buffer.readableBytes();
    }

    /**
     * Returns a copy of the bytes written so far.
     */
    public byte[] bytes() {
        byte[] bytes = new byte[buffer.readableBytes()];
        buffer.getBytes(buffer.readerIndex(), bytes);
        return bytes;
    }

    /**
     * Creates a {@link StreamInput} reading the bytes written so far.
     * Writes after this call are not visible to the returned input.
     */
    public StreamInput toStreamInput() {
        return new ByteBufStreamInput(Unpooled.wrappedBuffer(bytes()));
    }

    @Override
    public void close() {
        buffer.release();
    }
}
