/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.timber.internal.serialization;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import dev.timber.error.ValueException;
import dev.timber.series.ElementTypes;
import dev.timber.series.Series;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class SeriesCodecTest {

    @Test
    void testSnapshotKeepsNameTypeAndValues() {
        Series<Float> series = Series.of(1.5f, -2.25f, Float.NaN).named("readings");

        Series<?> decoded = SeriesCodec.decode(SeriesCodec.encode(series));

        assertThat(decoded).isEqualTo(series);
        assertThat(decoded.name()).isEqualTo("readings");
    }

    @Test
    void testTextWithMultiByteCharacters() {
        Series<String> series = Series.of("grüße", "", "日本");

        assertThat(Series.decode(series.encode())).isEqualTo(series);
    }

    @Test
    void testEmptyTypedSeries() {
        Series<Long> series = Series.empty(ElementTypes.INT64);

        Series<?> decoded = Series.decode(series.encode());

        assertThat(decoded.isEmpty()).isTrue();
        assertThat(decoded.elementType()).isSameAs(ElementTypes.INT64);
        assertThat(decoded.name()).isNull();
    }

    @Test
    void testSeriesOfUnknownTypeCannotBeEncoded() {
        Series<Integer> series = Series.of(List.of());

        assertThatThrownBy(series::encode).isInstanceOf(ValueException.class);
    }

    @Test
    void testTruncatedSnapshot() {
        byte[] snapshot = Series.arange(0, 10).encode();
        byte[] truncated = Arrays.copyOf(snapshot, snapshot.length - 3);

        assertThatThrownBy(() -> SeriesCodec.decode(truncated))
                .isInstanceOf(ValueException.class)
                .hasMessageContaining("Truncated");
    }

    @Test
    void testUnknownTypeTag() {
        byte[] snapshot = { 0, 42, 0, 0, 0, 0 };

        assertThatThrownBy(() -> SeriesCodec.decode(snapshot))
                .isInstanceOf(ValueException.class)
                .hasMessageContaining("Corrupt");
    }
}
