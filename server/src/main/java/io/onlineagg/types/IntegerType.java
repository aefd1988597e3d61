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
import java.math.RoundingMode;

import io.onlineagg.Streamer;
import io.onlineagg.common.io.stream.StreamInput;
import io.onlineagg.common.io.stream.StreamOutput;

public class IntegerType extends DataType<Integer> implements Streamer<Integer> {

    public static final IntegerType INSTANCE = new IntegerType();
    public static final int ID = 9;

    private IntegerType() {
    }

    @Override
    public int id() {
        return ID;
    }

    @Override
    public Precedence precedence() {
        return Precedence.INTEGER;
    }

    @Override
    public String getName() {
        return "integer";
    }

    @Override
    public Streamer<Integer> streamer() {
        return this;
    }

    @Override
    public Class<Integer> valueClass() {
        return Integer.class;
    }

    @Override
    public Integer implicitCast(Object value) throws IllegalArgumentException, ClassCastException {
        if (value == null) {
            return null;
        } else if (value instanceof Integer i) {
            return i;
        } else if (value instanceof String str) {
            return Integer.parseInt(str);
        } else if (value instanceof BigDecimal bigDecimal) {
            try {
                return bigDecimal.setScale(0, RoundingMode.DOWN).intValueExact();
            } catch (ArithmeticException e) {
                throw new IllegalArgumentException(getName() + " value out of range: " + value);
            }
        } else if (value instanceof Number number) {
            double doubleValue = number.doubleValue();
            if (doubleValue > Integer.MAX_VALUE || doubleValue < Integer.MIN_VALUE) {
                throw new IllegalArgumentException(getName() + " value out of range: " + value);
            }
            return number.intValue();
        } else {
            throw new ClassCastException("Can't cast '" + value + "' to " + getName());
        }
    }

    @Override
    public Integer sanitizeValue(Object value) {
        if (value == null) {
            return null;
        } else if (value instanceof Integer i) {
            return i;
        } else {
            return ((Number) value).intValue();
        }
    }

    @Override
    public int compare(Integer val1, Integer val2) {
        return Integer.compare(val1, val2);
    }

    @Override
    public Integer readValueFrom(StreamInput in) throws IOException {
        return in.readBoolean() ? null : in.readInt();
    }

    @Override
    public void writeValueTo(StreamOutput out, Integer v) throws IOException {
        out.writeBoolean(v == null);
        if (v != null) {
            out.writeInt(v);
        }
    }
}
