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

package io.onlineagg.types;

import java.io.IOException;
import java.math.BigDecimal;

import io.onlineagg.Streamer;
import io.onlineagg.common.io.stream.StreamInput;
import io.onlineagg.common.io.stream.StreamOutput;

public class StringType extends DataType<String> implements Streamer<String> {

    public static final StringType INSTANCE = new StringType();
    public static final int ID = 4;

    private StringType() {
    }

    @Override
    public int id() {
        return ID;
    }

    @Override
    public Precedence precedence() {
        return Precedence.STRING;
    }

    @Override
    public String getName() {
        return "text";
    }

    @Override
    public Streamer<String> streamer() {
        return this;
    }

    @Override
    public Class<String> valueClass() {
        return String.class;
    }

    @Override
    public String implicitCast(Object value) throws IllegalArgumentException, ClassCastException {
        if (value == null) {
            return null;
        } else if (value instanceof String str) {
            return str;
        } else if (value instanceof BigDecimal bigDecimal) {
            return bigDecimal.toPlainString();
        } else if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        throw new ClassCastException("Can't cast '" + value + "' to " + getName());
    }

    @Override
    public String sanitizeValue(Object value) {
        return (String) value;
    }

    @Override
    public int compare(String val1, String val2) {
        return val1.compareTo(val2);
    }

    @Override
    public String readValueFrom(StreamInput in) throws IOException {
        return in.readBoolean() ? null : in.readString();
    }

    @Override
    public void writeValueTo(StreamOutput out, String v) throws IOException {
        out.writeBoolean(v == null);
        if (v != null) {
            out.writeString(v);
        }
    }
}
