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

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * A stream from which values written by a {@link StreamOutput} can be read.
 */
public abstract class StreamInput extends InputStream {

    public abstract byte readByte() throws IOException;

    public abstract void readBytes(byte[] b, int offset, int len) throws IOException;

    @Override
    public int read() throws IOException {
        if (available() <= 0) {
            return -1;
        }
        return readByte() & 0xFF;
    }

    public byte[] readByteArray() throws IOException {
        int length = readVInt();
        byte[] bytes = new byte[length];
        readBytes(bytes, 0, length);
        return bytes;
    }

    public boolean readBoolean() throws IOException {
        byte value = readByte();
        if (value == 0) {
            return false;
        } else if (value == 1) {
            return true;
        }
        throw new IllegalStateException("unexpected byte [0x" + String.format(Locale.ENGLISH, "%02x", value) + "]");
    }

    public int readInt() throws IOException {
        return ((readByte() & 0xFF) << 24) | ((readByte() & 0xFF) << 16)
               | ((readByte() & 0xFF) << 8) | (readByte() & 0xFF);
    }

    public int readVInt() throws IOException {
        int result = 0;
        for (int shift = 0; shift < 32; shift += 7) {
            byte b = readByte();
            result |= (b & 0x7F) << shift;
            if ((b & 0x80) == 0) {
                return result;
            }
        }
        throw new IOException("Invalid vInt, more than 5 bytes");
    }

    public long readLong() throws IOException {
        return (((long) readInt()) << 32) | (readInt() & 0xFFFFFFFFL);
    }

    public long readVLong() throws IOException {
        long result = 0;
        for (int shift = 0; shift < 64; shift += 7) {
            byte b = readByte();
            result |= ((long) (b & 0x7F)) << shift;
            if ((b & 0x80) == 0) {
                return result;
            }
        }
        throw new IOException("Invalid vLong, more than 10 bytes");
    }

    public double readDouble() throws IOException {
        return Double.longBitsToDouble(readLong());
    }

    public String readString() throws IOException {
        return new String(readByteArray(), StandardCharsets.UTF_8);
    }

    public BigDecimal readBigDecimal() throws IOException {
        int scale = readVInt();
        return new BigDecimal(new BigInteger(readByteArray()), scale);
    }

    protected static void ensureCanRead(int available, int requested) throws EOFException {
        if (requested > available) {
            throw new EOFException("tried to read: " + requested + " bytes but only " + available + " remaining");
        }
    }
}
