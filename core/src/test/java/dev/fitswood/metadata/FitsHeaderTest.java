/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitswood.metadata;

import org.junit.jupiter.api.Test;

import dev.fitswood.FitsFormatException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FitsHeaderTest {

    @Test
    void testTypedGetters() throws Exception {
        FitsHeader header = new FitsHeader()
                .add(HeaderCard.of("NAXIS", 2))
                .add(HeaderCard.of("EXTEND", true))
                .add(HeaderCard.of("OBJECT", "M31"))
                .add(HeaderCard.of("EXPTIME", 12.5));

        assertThat(header.requireInt("NAXIS")).isEqualTo(2);
        assertThat(header.getLong("NAXIS", -1)).isEqualTo(2L);
        assertThat(header.getBoolean("EXTEND", false)).isTrue();
        assertThat(header.requireString("OBJECT")).isEqualTo("M31");
        assertThat(header.getValue("EXPTIME")).isEqualTo(12.5);
        assertThat(header.getInt("EXPTIME", 7)).isEqualTo(7);
        assertThat(header.getString("MISSING")).isNull();
    }

    @Test
    void testSetReplacesInPlaceAndKeepsComment() {
        FitsHeader header = new FitsHeader()
                .add(HeaderCard.of("BITPIX", 8, "bits per element"))
                .add(HeaderCard.of("NAXIS", 0));

        header.set("BITPIX", -32).set("ORIGIN", "fitswood");

        assertThat(header.cards()).extracting(HeaderCard::keyword).containsExactly("BITPIX", "NAXIS", "ORIGIN");
        assertThat(header.getCard("BITPIX")).isEqualTo(new HeaderCard("BITPIX", -32L, "bits per element"));
        assertThat(header.remove("ORIGIN")).isTrue();
        assertThat(header.contains("ORIGIN")).isFalse();
    }

    @Test
    void testMissingOrMistypedMandatoryKeyword() {
        FitsHeader header = new FitsHeader().add(HeaderCard.of("NAXIS", "two"));

        assertThatThrownBy(() -> header.requireLong("BITPIX"))
                .isInstanceOf(FitsFormatException.class)
                .hasMessage("Mandatory keyword BITPIX is missing");
        assertThatThrownBy(() -> header.requireInt("NAXIS"))
                .isInstanceOf(FitsFormatException.class)
                .hasMessage("Keyword NAXIS must be an integer but is two");
    }

    @Test
    void testRejectsInvalidKeyword() {
        assertThatThrownBy(() -> HeaderCard.of("TOOLONGKEY", 1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> HeaderCard.of("lower", 1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
