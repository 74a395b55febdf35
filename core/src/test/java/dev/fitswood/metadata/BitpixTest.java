/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitswood.metadata;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import dev.fitswood.FitsFormatException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BitpixTest {

    @Test
    void testEveryDefinedCodeMapsToOneVariant() throws Exception {
        assertThat(Bitpix.fromCode(8)).isEqualTo(Bitpix.BYTE);
        assertThat(Bitpix.fromCode(16)).isEqualTo(Bitpix.SHORT);
        assertThat(Bitpix.fromCode(32)).isEqualTo(Bitpix.INT);
        assertThat(Bitpix.fromCode(64)).isEqualTo(Bitpix.LONG);
        assertThat(Bitpix.fromCode(-32)).isEqualTo(Bitpix.FLOAT);
        assertThat(Bitpix.fromCode(-64)).isEqualTo(Bitpix.DOUBLE);

        for (Bitpix bitpix : Bitpix.values()) {
            assertThat(Bitpix.fromCode(bitpix.code())).isSameAs(bitpix);
            assertThat(bitpix.byteWidth() * 8).isEqualTo(Math.abs(bitpix.code()));
        }
    }

    @ParameterizedTest
    @ValueSource(ints = { 0, 1, 12, 24, -8, -16, 128 })
    void testUnknownCodeIsFormatError(int code) {
        assertThatThrownBy(() -> Bitpix.fromCode(code))
                .isInstanceOf(FitsFormatException.class)
                .hasMessageContaining("Unknown BITPIX: " + code);
    }

    @Test
    void testElementTypeNames() {
        assertThat(Bitpix.BYTE.elementTypeName()).isEqualTo("u8");
        assertThat(Bitpix.FLOAT.elementTypeName()).isEqualTo("f32");
        assertThat(Bitpix.DOUBLE.isFloatingPoint()).isTrue();
        assertThat(Bitpix.LONG.isFloatingPoint()).isFalse();
    }
}
