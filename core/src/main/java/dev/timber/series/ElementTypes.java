/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.timber.series;

import java.util.regex.Pattern;

import dev.timber.error.CastException;
import dev.timber.error.ValueException;
import dev.timber.metadata.DType;

/**
 * The element types supported by {@link Series}, one per {@link DType}.
 */
public final class ElementTypes {

    public static final ElementType<Double> FLOAT64 = new Float64Type();
    public static final ElementType<Long> INT64 = new Int64Type();
    public static final ElementType<Float> FLOAT32 = new Float32Type();
    public static final ElementType<Integer> INT32 = new Int32Type();
    public static final ElementType<String> TEXT = new TextType();

    private static final Pattern DECIMAL = Pattern.compile("[+-]?(NaN|Infinity|(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?)");

    private ElementTypes() {
    }

    public static ElementType<?> forDType(DType dtype) {
        return switch (dtype) {
            case FLOAT64 -> FLOAT64;
            case INT64 -> INT64;
            case FLOAT32 -> FLOAT32;
            case INT32 -> INT32;
            case TEXT -> TEXT;
        };
    }

    /**
     * Infer the element type from a boxed value.
     *
     * @throws IllegalArgumentException if the value's class is not supported
     */
    public static ElementType<?> forValue(Object value) {
        if (value instanceof Double) {
            return FLOAT64;
        }
        if (value instanceof Long) {
            return INT64;
        }
        if (value instanceof Float) {
            return FLOAT32;
        }
        if (value instanceof Integer) {
            return INT32;
        }
        if (value instanceof String) {
            return TEXT;
        }
        throw new IllegalArgumentException("Unsupported element type: "
                + (value == null ? "null" : value.getClass().getName()));
    }

    private static String numericText(String text) {
        return text.trim();
    }

    /**
     * Trimmed text if it is a plain decimal number, {@code NaN} or {@code Infinity}.
     * Java literal forms such as {@code 1d}, {@code 2f} or {@code 0x1p3} are rejected.
     *
     * @throws NumberFormatException if the text is not a plain decimal number
     */
    private static String decimalText(String text) {
        String trimmed = numericText(text);
        if (!DECIMAL.matcher(trimmed).matches()) {
            throw new NumberFormatException("Not a decimal number: \"" + text + "\"");
        }
        return trimmed;
    }

    /**
     * Integral value of a floating text, or null if it has a fractional part or is out of range.
     */
    private static Long integralValue(String text) {
        try {
            double d = Double.parseDouble(decimalText(text));
            if (d == Math.rint(d) && d >= Long.MIN_VALUE && d <= Long.MAX_VALUE) {
                return (long) d;
            }
        }
        catch (NumberFormatException e) {
            // not a floating text either
        }
        return null;
    }

    private static final class Float64Type implements ElementType<Double> {

        @Override
        public DType dtype() {
            return DType.FLOAT64;
        }

        @Override
        public Class<Double> javaType() {
            return Double.class;
        }

        @Override
        public Double parse(String text) {
            try {
                return Double.parseDouble(decimalText(text));
            }
            catch (NumberFormatException e) {
                throw new CastException(text, DType.FLOAT64, e);
            }
        }

        @Override
        public String format(Double value) {
            return Double.toString(value);
        }

        @Override
        public int compare(Double a, Double b) {
            return Double.compare(a, b);
        }

        @Override
        public boolean isNumeric() {
            return true;
        }

        @Override
        public double toDouble(Double value) {
            return value;
        }

        @Override
        public Double add(Double a, Double b) {
            return a + b;
        }

        @Override
        public Double zero() {
            return 0.0;
        }

        @Override
        public boolean isNaN(Double value) {
            return value.isNaN();
        }

        @Override
        public String toString() {
            return "FLOAT64";
        }
    }

    private static final class Int64Type implements ElementType<Long> {

        @Override
        public DType dtype() {
            return DType.INT64;
        }

        @Override
        public Class<Long> javaType() {
            return Long.class;
        }

        @Override
        public Long parse(String text) {
            try {
                return Long.parseLong(numericText(text));
            }
            catch (NumberFormatException e) {
                throw new CastException(text, DType.INT64, e);
            }
        }

        @Override
        public Long coerce(String text) {
            try {
                return Long.parseLong(numericText(text));
            }
            catch (NumberFormatException e) {
                Long integral = integralValue(text);
                if (integral == null) {
                    throw new CastException(text, DType.INT64, e);
                }
                return integral;
            }
        }

        @Override
        public String format(Long value) {
            return Long.toString(value);
        }

        @Override
        public int compare(Long a, Long b) {
            return Long.compare(a, b);
        }

        @Override
        public boolean isNumeric() {
            return true;
        }

        @Override
        public double toDouble(Long value) {
            return value;
        }

        @Override
        public Long add(Long a, Long b) {
            return a + b;
        }

        @Override
        public Long zero() {
            return 0L;
        }

        @Override
        public String toString() {
            return "INT64";
        }
    }

    private static final class Float32Type implements ElementType<Float> {

        @Override
        public DType dtype() {
            return DType.FLOAT32;
        }

        @Override
        public Class<Float> javaType() {
            return Float.class;
        }

        @Override
        public Float parse(String text) {
            try {
                return Float.parseFloat(decimalText(text));
            }
            catch (NumberFormatException e) {
                throw new CastException(text, DType.FLOAT32, e);
            }
        }

        @Override
        public String format(Float value) {
            return Float.toString(value);
        }

        @Override
        public int compare(Float a, Float b) {
            return Float.compare(a, b);
        }

        @Override
        public boolean isNumeric() {
            return true;
        }

        @Override
        public double toDouble(Float value) {
            return value;
        }

        @Override
        public Float add(Float a, Float b) {
            return a + b;
        }

        @Override
        public Float zero() {
            return 0.0f;
        }

        @Override
        public boolean isNaN(Float value) {
            return value.isNaN();
        }

        @Override
        public String toString() {
            return "FLOAT32";
        }
    }

    private static final class Int32Type implements ElementType<Integer> {

        @Override
        public DType dtype() {
            return DType.INT32;
        }

        @Override
        public Class<Integer> javaType() {
            return Integer.class;
        }

        @Override
        public Integer parse(String text) {
            try {
                return Integer.parseInt(numericText(text));
            }
            catch (NumberFormatException e) {
                throw new CastException(text, DType.INT32, e);
            }
        }

        @Override
        public Integer coerce(String text) {
            try {
                return Integer.parseInt(numericText(text));
            }
            catch (NumberFormatException e) {
                Long integral = integralValue(text);
                if (integral == null || integral < Integer.MIN_VALUE || integral > Integer.MAX_VALUE) {
                    throw new CastException(text, DType.INT32, e);
                }
                return integral.intValue();
            }
        }

        @Override
        public String format(Integer value) {
            return Integer.toString(value);
        }

        @Override
        public int compare(Integer a, Integer b) {
            return Integer.compare(a, b);
        }

        @Override
        public boolean isNumeric() {
            return true;
        }

        @Override
        public double toDouble(Integer value) {
            return value;
        }

        @Override
        public Integer add(Integer a, Integer b) {
            return a + b;
        }

        @Override
        public Integer zero() {
            return 0;
        }

        @Override
        public String toString() {
            return "INT32";
        }
    }

    private static final class TextType implements ElementType<String> {

        @Override
        public DType dtype() {
            return DType.TEXT;
        }

        @Override
        public Class<String> javaType() {
            return String.class;
        }

        @Override
        public String parse(String text) {
            return text;
        }

        @Override
        public String format(String value) {
            return value;
        }

        @Override
        public int compare(String a, String b) {
            return a.compareTo(b);
        }

        @Override
        public boolean isNumeric() {
            return false;
        }

        @Override
        public double toDouble(String value) {
            throw new ValueException("TEXT value '" + value + "' is not numeric");
        }

        /**
         * Concatenation.
         */
        @Override
        public String add(String a, String b) {
            return a + b;
        }

        @Override
        public String zero() {
            return "";
        }

        @Override
        public String toString() {
            return "TEXT";
        }
    }
}
