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
import java.math.BigInteger;
import java.math.MathContext;
import java.util.Locale;
import java.util.Objects;

import org.jetbrains.annotations.Nullable;

import io.onlineagg.Streamer;
import io.onlineagg.common.io.stream.StreamInput;
import io.onlineagg.common.io.stream.StreamOutput;

/**
 * Arbitrary precision decimal type.
 *
 * <p>
 * Without precision the type is unlimited: values keep every digit they have.
 * With precision (and optionally scale) the type is fixed: casting rounds to {@code precision}
 * significant digits and sets the scale.
 * </p>
 */
public class NumericType extends DataType<BigDecimal> implements Streamer<BigDecimal> {

    public static final int ID = 22;
    public static final String NAME = "numeric";
    public static final NumericType INSTANCE = new NumericType(null, null); // unlimited

    public static NumericType of(int precision) {
        return new NumericType(precision, 0);
    }

    public static NumericType of(int precision, int scale) {
        return new NumericType(precision, scale);
    }

    @Nullable
    private final Integer scale;
    @Nullable
    private final Integer precision;

    private NumericType(@Nullable Integer precision, @Nullable Integer scale) {
        if (scale != null) {
            if (precision == null) {
                throw new IllegalArgumentException("If scale is set for NUMERIC, precision must be set too");
            }
            if (scale > precision) {
                throw new IllegalArgumentException(String.format(
                    Locale.ENGLISH,
                    "Scale of numeric must not exceed the precision. NUMERIC(%d, %d) is unsupported.",
                    precision,
                    scale
                ));
            }
            if (scale < 0) {
                throw new IllegalArgumentException("Scale of NUMERIC must not be negative");
            }
        }
        if (precision != null && precision < 1) {
            throw new IllegalArgumentException("Precision of NUMERIC must be at least 1");
        }
        this.precision = precision;
        this.scale = scale;
    }

    @Override
    public int id() {
        return ID;
    }

    @Override
    public Precedence precedence() {
        return Precedence.NUMERIC;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Streamer<BigDecimal> streamer() {
        return this;
    }

    @Override
    public Class<BigDecimal> valueClass() {
        return BigDecimal.class;
    }

    @Override
    public BigDecimal implicitCast(Object value) throws IllegalArgumentException, ClassCastException {
        if (value == null) {
            return null;
        }

        var mathContext = mathContext();
        BigDecimal bd;
        if (value instanceof BigDecimal bigDecimal) {
            bd = bigDecimal.round(mathContext);
        } else if (value instanceof String || value instanceof Float || value instanceof Double) {
            bd = new BigDecimal(value.toString(), mathContext);
        } else if (value instanceof Number number) {
            bd = new BigDecimal(BigInteger.valueOf(number.longValue()), mathContext);
        } else {
            throw new ClassCastException("Can't cast '" + value + "' to " + getName());
        }
        if (scale == null) {
            return bd;
        }
        return bd.setScale(scale, mathContext.getRoundingMode());
    }

    @Override
    public BigDecimal sanitizeValue(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Long longValue) {
            BigInteger bigInt = BigInteger.valueOf(longValue);
            return new BigDecimal(bigInt, mathContext()).setScale(scale == null ? 0 : scale);
        }
        return (BigDecimal) value;
    }

    @Nullable
    public Integer numericPrecision() {
        return precision;
    }

    @Nullable
    public Integer scale() {
        return scale;
    }

    /**
     * @return true if the type has a declared precision, false for the unlimited type.
     */
    public boolean fixed() {
        return precision != null;
    }

    public MathContext mathContext() {
        if (precision == null) {
            return MathContext.UNLIMITED;
        } else {
            return new MathContext(precision);
        }
    }

    @Override
    public int compare(BigDecimal o1, BigDecimal o2) {
        return o1.compareTo(o2);
    }

    @Override
    public BigDecimal readValueFrom(StreamInput in) throws IOException {
        if (in.readBoolean()) {
            return in.readBigDecimal();
        }
        return null;
    }

    @Override
    public void writeValueTo(StreamOutput out, BigDecimal v) throws IOException {
        if (v != null) {
            out.writeBoolean(true);
            out.writeBigDecimal(v);
        } else {
            out.writeBoolean(false);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        NumericType that = (NumericType) o;
        return Objects.equals(scale, that.scale) &&
               Objects.equals(precision, that.precision);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ID, scale, precision);
    }

    @Override
    public String toString() {
        if (precision == null) {
            return NAME;
        }
        return NAME + "(" + precision + "," + scale + ")";
    }
}
