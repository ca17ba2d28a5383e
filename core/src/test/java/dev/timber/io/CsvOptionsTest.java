/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.timber.io;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class CsvOptionsTest {

    @Test
    void testDefaults() {
        CsvOptions options = CsvOptions.defaults();

        assertThat(options.delimiter()).isEqualTo(',');
        assertThat(options.quote()).isEqualTo('"');
        assertThat(options.terminator()).isEqualTo(Terminator.any());
        assertThat(options.hasHeaders()).isTrue();
        assertThat(options.headers()).isNull();
    }

    @Test
    void testDelimiterMustDifferFromQuote() {
        assertThatThrownBy(() -> CsvOptions.builder().delimiter('"').build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testDelimiterMustNotBeTerminator() {
        assertThatThrownBy(() -> CsvOptions.builder().delimiter('\n').build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CsvOptions.builder().terminator(Terminator.of(';')).delimiter(';').build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testHeadersAreCopied() {
        List<String> headers = new ArrayList<>(List.of("a", "b"));
        CsvOptions options = CsvOptions.builder().hasHeaders(false).headers(headers).build();
        headers.add("c");

        assertThat(options.headers()).containsExactly("a", "b");
    }

    @Test
    void testTerminator() {
        assertThat(Terminator.any().isAny()).isTrue();
        assertThat(Terminator.any().sequence()).isEqualTo("\r\n");
        assertThat(Terminator.of(';').custom()).isEqualTo(';');
        assertThat(Terminator.of(';')).isEqualTo(Terminator.of(';'));
        assertThatThrownBy(() -> Terminator.any().custom()).isInstanceOf(IllegalStateException.class);
    }
}
