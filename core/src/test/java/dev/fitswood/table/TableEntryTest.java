/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitswood.table;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TableEntryTest {

    private static final TableEntryFormat.IntFormat I5 = new TableEntryFormat.IntFormat(5);
    private static final TableEntryFormat.FloatFormat F6_2 = new TableEntryFormat.FloatFormat(6, 2);

    @Test
    void testTextKeepsLeadingBlanks() {
        assertThat(TableEntry.fromParts(" ab  ", new TableEntryFormat.CharFormat(5)))
                .isEqualTo(new TableEntry.CharEntry(" ab"));
    }

    @Test
    void testIntegers() {
        assertThat(TableEntry.fromParts("   42", I5)).isEqualTo(new TableEntry.IntEntry(42L));
        assertThat(TableEntry.fromParts("  -7 ", I5)).isEqualTo(new TableEntry.IntEntry(-7L));
        assertThat(TableEntry.fromParts("  +3 ", I5)).isEqualTo(new TableEntry.IntEntry(3L));
    }

    @Test
    void testBlankNumericFieldIsUndefined() {
        assertThat(TableEntry.fromParts("     ", I5).value()).isNull();
        assertThat(TableEntry.fromParts("      ", F6_2).value()).isNull();
    }

    @Test
    void testFixedPoint() {
        assertThat(TableEntry.fromParts("  3.25", F6_2)).isEqualTo(new TableEntry.FloatEntry(3.25));
        assertThat(TableEntry.fromParts(" -0.5 ", F6_2)).isEqualTo(new TableEntry.FloatEntry(-0.5));
        assertThat(TableEntry.fromParts("1.5D2 ", F6_2)).isEqualTo(new TableEntry.FloatEntry(150.0));
        assertThat(TableEntry.fromParts("2.5E-1", F6_2)).isEqualTo(new TableEntry.FloatEntry(0.25));
    }

    @Test
    void testNegativeZeroKeepsSign() {
        // record equality compares the sign of zero
        assertThat(TableEntry.fromParts("-0.000", F6_2)).isEqualTo(new TableEntry.FloatEntry(-0.0));
        assertThat(TableEntry.fromParts("   -00", F6_2)).isEqualTo(new TableEntry.FloatEntry(-0.0));
        assertThat(TableEntry.fromParts(" 0.000", F6_2)).isNotEqualTo(new TableEntry.FloatEntry(-0.0));
    }

    @Test
    void testImplicitDecimalPoint() {
        assertThat(TableEntry.fromParts("  1234", F6_2)).isEqualTo(new TableEntry.FloatEntry(12.34));
    }

    @Test
    void testNonNumericTextInNumericField() {
        assertThatThrownBy(() -> TableEntry.fromParts("  abc", I5)).isInstanceOf(NumberFormatException.class);
        assertThatThrownBy(() -> TableEntry.fromParts("1.2.3 ", F6_2)).isInstanceOf(NumberFormatException.class);
        assertThatThrownBy(() -> TableEntry.fromParts("   NaN", F6_2)).isInstanceOf(NumberFormatException.class);
    }
}
