/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.timber.series;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import java.util.function.DoubleBinaryOperator;
import java.util.function.Function;
import java.util.function.Supplier;

import dev.timber.TimberContext;
import dev.timber.error.ValueException;
import dev.timber.internal.ParallelTasks;
import dev.timber.internal.Positions;
import dev.timber.internal.serialization.SeriesCodec;
import dev.timber.internal.stats.Aggregations;
import dev.timber.metadata.DType;

/**
 * An ordered, optionally named column of non-null values of a single element type.
 *
 * <pre>{@code
 * Series<Integer> series = Series.arange(0, 5);
 * series.append(5);
 * int total = series.sum();              // 15
 * double mean = series.mean();           // 2.5
 * Series<Double> asDouble = series.astype(ElementTypes.FLOAT64);
 * }</pre>
 *
 * <p>The element type is known from construction, or fixed by the first
 * appended value for a series created from an empty list. Instances are not
 * thread-safe.</p>
 *
 * @param <T> the boxed Java type of the elements
 */
public final class Series<T> implements Iterable<T> {

    private static final int MAX_LENGTH = Integer.MAX_VALUE - 8;

    private ElementType<T> elementType;
    private final List<T> values;
    private String name;

    private Series(ElementType<T> elementType, List<T> values, String name) {
        this.elementType = elementType;
        this.values = values;
        this.name = name;
    }

    // ==================== Construction ====================

    /**
     * Consecutive integers from {@code start} inclusive to {@code stop} exclusive.
     */
    public static Series<Integer> arange(int start, int stop) {
        List<Integer> values = new ArrayList<>(Math.max(0, stop - start));
        for (int i = start; i < stop; i++) {
            values.add(i);
        }
        return new Series<>(ElementTypes.INT32, values, null);
    }

    /**
     * Consecutive longs from {@code start} inclusive to {@code stop} exclusive.
     *
     * @throws IllegalArgumentException if the range holds more values than a series can
     */
    public static Series<Long> arange(long start, long stop) {
        long count = stop > start ? stop - start : 0;
        if (count < 0 || count > MAX_LENGTH) {
            throw new IllegalArgumentException("Range [" + start + ", " + stop + ") exceeds the maximum series length of " + MAX_LENGTH);
        }
        List<Long> values = new ArrayList<>((int) count);
        for (long i = start; i < stop; i++) {
            values.add(i);
        }
        return new Series<>(ElementTypes.INT64, values, null);
    }

    @SafeVarargs
    public static <T> Series<T> of(T... values) {
        return of(List.of(values));
    }

    /**
     * Create a series from a list, inferring the element type from the first value.
     * The element type of a series created from an empty list is unknown until
     * the first value is appended.
     *
     * @throws IllegalArgumentException if the values are of unsupported or mixed types
     */
    @SuppressWarnings("unchecked")
    public static <T> Series<T> of(List<T> values) {
        if (values.isEmpty()) {
            return new Series<>(null, new ArrayList<>(), null);
        }
        ElementType<T> type = (ElementType<T>) ElementTypes.forValue(values.get(0));
        return of(type, values);
    }

    /**
     * Create a series of the given element type.
     *
     * @throws IllegalArgumentException if a value is null or not of the element type
     */
    public static <T> Series<T> of(ElementType<T> type, List<? extends T> values) {
        Objects.requireNonNull(type, "type");
        List<T> copy = new ArrayList<>(values.size());
        for (T value : values) {
            copy.add(type.cast(value));
        }
        return new Series<>(type, copy, null);
    }

    public static <T> Series<T> empty(ElementType<T> type) {
        return new Series<>(Objects.requireNonNull(type, "type"), new ArrayList<>(), null);
    }

    /**
     * Decode a series from a snapshot produced by {@link #encode()}.
     *
     * @throws ValueException if the snapshot is truncated or corrupt
     */
    public static Series<?> decode(byte[] snapshot) {
        return SeriesCodec.decode(snapshot);
    }

    // ==================== Metadata ====================

    /**
     * The series name, or null if unnamed.
     */
    public String name() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    /**
     * Returns this series with the given name, for chaining.
     */
    public Series<T> named(String name) {
        this.name = name;
        return this;
    }

    /**
     * The element type, or null while unknown.
     */
    public ElementType<T> elementType() {
        return elementType;
    }

    /**
     * The dtype, or null while unknown.
     */
    public DType dtype() {
        return elementType == null ? null : elementType.dtype();
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    // ==================== Element Access ====================

    /**
     * @throws IndexOutOfBoundsException if the position is outside the series
     */
    public T get(int position) {
        return values.get(position);
    }

    /**
     * Replace the value at a position.
     *
     * @throws IndexOutOfBoundsException if the position is outside the series
     */
    public void set(int position, T value) {
        Objects.checkIndex(position, values.size());
        values.set(position, checked(value));
    }

    public void append(T value) {
        values.add(checked(value));
    }

    @SuppressWarnings("unchecked")
    private T checked(T value) {
        if (elementType == null) {
            elementType = (ElementType<T>) ElementTypes.forValue(value);
        }
        return elementType.cast(value);
    }

    /**
     * Unmodifiable view of the values.
     */
    public List<T> values() {
        return Collections.unmodifiableList(values);
    }

    @Override
    public Iterator<T> iterator() {
        return values().iterator();
    }

    public List<String> toStrings() {
        List<String> strings = new ArrayList<>(values.size());
        for (T value : values) {
            strings.add(elementType.format(value));
        }
        return strings;
    }

    /**
     * View sharing this series' values. Changing the values through the view fails
     * with {@link UnsupportedOperationException}; renaming the view leaves this series unchanged.
     */
    public Series<T> unmodifiableView() {
        return new Series<>(elementType, Collections.unmodifiableList(values), name);
    }

    /**
     * Independent copy with the same name and element type.
     */
    public Series<T> copy() {
        return new Series<>(elementType, new ArrayList<>(values), name);
    }

    // ==================== Transformations ====================

    /**
     * Convert every value to the target element type through its text form.
     *
     * @throws dev.timber.error.CastException on the first value the target type cannot parse
     */
    public <U> Series<U> astype(ElementType<U> target) {
        List<U> converted = new ArrayList<>(values.size());
        for (T value : values) {
            converted.add(target.coerce(elementType.format(value)));
        }
        return new Series<>(target, converted, name);
    }

    /**
     * Remove the given positions, keeping the remaining values in order.
     * Duplicate positions are ignored.
     *
     * @throws IndexOutOfBoundsException if any position is outside the series;
     *         the series is left unchanged in that case
     */
    public void dropPositions(Collection<Integer> positions) {
        TreeSet<Integer> sorted = Positions.validate(positions, values.size());
        for (Integer position : sorted.descendingSet()) {
            values.remove((int) position);
        }
    }

    /**
     * Distinct values in ascending order. The order of first appearance is not preserved.
     */
    public Series<T> unique() {
        if (elementType == null) {
            return copy();
        }
        TreeSet<T> distinct = new TreeSet<>(elementType::compare);
        distinct.addAll(values);
        return new Series<>(elementType, new ArrayList<>(distinct), name);
    }

    /**
     * One flag per value, set for floating NaN.
     */
    public boolean[] isna() {
        boolean[] flags = new boolean[values.size()];
        for (int i = 0; i < flags.length; i++) {
            flags[i] = elementType.isNaN(values.get(i));
        }
        return flags;
    }

    /**
     * Apply a function to every value.
     */
    public <U> Series<U> map(ElementType<U> target, Function<? super T, ? extends U> function) {
        List<U> mapped = new ArrayList<>(values.size());
        for (T value : values) {
            mapped.add(target.cast(function.apply(value)));
        }
        return new Series<>(target, mapped, name);
    }

    /**
     * Apply a pure function to every value on the context's worker pool,
     * one disjoint chunk per worker.
     */
    public <U> Series<U> map(ElementType<U> target, Function<? super T, ? extends U> function, TimberContext context) {
        int chunkSize = Math.max(1, (values.size() + context.parallelism() - 1) / context.parallelism());
        List<Supplier<List<U>>> tasks = new ArrayList<>();
        for (int start = 0; start < values.size(); start += chunkSize) {
            List<T> chunk = values.subList(start, Math.min(values.size(), start + chunkSize));
            tasks.add(() -> {
                List<U> mapped = new ArrayList<>(chunk.size());
                for (T value : chunk) {
                    mapped.add(target.cast(function.apply(value)));
                }
                return mapped;
            });
        }
        List<U> mapped = new ArrayList<>(values.size());
        for (List<U> chunk : ParallelTasks.invokeAll(tasks, context)) {
            mapped.addAll(chunk);
        }
        return new Series<>(target, mapped, name);
    }

    // ==================== Scalar Arithmetic ====================

    /**
     * Add a value of the element type to every value, keeping the element type.
     * Text values concatenate.
     */
    public Series<T> plus(T scalar) {
        T operand = elementType.cast(scalar);
        List<T> result = new ArrayList<>(values.size());
        for (T value : values) {
            result.add(elementType.add(value, operand));
        }
        return new Series<>(elementType, result, name);
    }

    public Series<Double> add(double scalar) {
        return arithmetic(scalar, Double::sum);
    }

    public Series<Double> subtract(double scalar) {
        return arithmetic(scalar, (a, b) -> a - b);
    }

    public Series<Double> multiply(double scalar) {
        return arithmetic(scalar, (a, b) -> a * b);
    }

    public Series<Double> divide(double scalar) {
        return arithmetic(scalar, (a, b) -> a / b);
    }

    private Series<Double> arithmetic(double scalar, DoubleBinaryOperator operator) {
        requireNumeric("arithmetic");
        List<Double> result = new ArrayList<>(values.size());
        for (T value : values) {
            result.add(operator.applyAsDouble(elementType.toDouble(value), scalar));
        }
        return new Series<>(ElementTypes.FLOAT64, result, name);
    }

    private void requireNumeric(String operation) {
        if (elementType != null && !elementType.isNumeric()) {
            throw new ValueException("Cannot apply " + operation + " to " + elementType.dtype() + " series " + name);
        }
    }

    // ==================== Aggregations ====================

    public T sum() {
        return Aggregations.sum(values, elementType);
    }

    public double mean() {
        return Aggregations.mean(values, elementType);
    }

    /**
     * @param ddof 0 for population variance, 1 for sample variance
     */
    public double var(int ddof) {
        return Aggregations.variance(values, elementType, ddof);
    }

    public double std(int ddof) {
        return Aggregations.std(values, elementType, ddof);
    }

    public double median() {
        return Aggregations.median(values, elementType);
    }

    public double quantile(double q) {
        return Aggregations.quantile(values, elementType, q);
    }

    /**
     * All values attaining the highest frequency, in ascending order.
     */
    public Series<T> mode() {
        return new Series<>(elementType, Aggregations.mode(values, elementType), name);
    }

    public T min() {
        return Aggregations.min(values, elementType);
    }

    public T max() {
        return Aggregations.max(values, elementType);
    }

    // ==================== Grouping and Windows ====================

    /**
     * Split this series by a parallel key series.
     *
     * @throws dev.timber.error.LengthMismatchException if the key series has a different length
     */
    public <K> SeriesGroupBy<T> groupby(Series<K> keys) {
        return SeriesGroupBy.split(this, keys);
    }

    /**
     * Sliding-window aggregations over windows of the given size.
     *
     * @throws IllegalArgumentException if the window is smaller than 1
     */
    public Rolling<T> rolling(int window) {
        return new Rolling<>(this, window);
    }

    // ==================== Serialization ====================

    /**
     * Encode this series as a binary snapshot.
     *
     * @throws ValueException if the element type is still unknown
     */
    public byte[] encode() {
        return SeriesCodec.encode(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Series<?> other)) {
            return false;
        }
        return Objects.equals(dtype(), other.dtype())
                && Objects.equals(name, other.name)
                && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dtype(), name, values);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Series(");
        if (name != null) {
            sb.append(name).append(", ");
        }
        sb.append(dtype() == null ? "unknown" : dtype().name().toLowerCase());
        sb.append(", ").append(values.size()).append(")");
        int shown = Math.min(values.size(), 10);
        sb.append(values.subList(0, shown));
        if (shown < values.size()) {
            sb.setLength(sb.length() - 1);
            sb.append(", ...]");
        }
        return sb.toString();
    }
}
