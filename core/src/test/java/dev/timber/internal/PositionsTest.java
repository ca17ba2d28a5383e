/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.timber.internal;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class PositionsTest {

    @Test
    void testSortedAndDeduplicated() {
        assertThat(Positions.validate(List.of(3, 0, 3, 1), 4)).containsExactly(0, 1, 3);
        assertThat(Positions.validate(List.of(), 0)).isEmpty();
    }

    @Test
    void testOutOfRange() {
        assertThatThrownBy(() -> Positions.validate(List.of(0, 4), 4))
                .isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> Positions.validate(List.of(-1), 4))
                .isInstanceOf(IndexOutOfBoundsException.class);
    }
}
