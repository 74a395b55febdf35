/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitswood.internal.header;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import dev.fitswood.FitsFormatException;
import dev.fitswood.internal.io.BlockReader;
import dev.fitswood.internal.io.BlockWriter;
import dev.fitswood.internal.io.Blocks;
import dev.fitswood.metadata.FitsHeader;
import dev.fitswood.metadata.HeaderCard;

/**
 * Reads and writes header records: 80 character ASCII cards, 36 per block,
 * terminated by an {@code END} card and padded with blanks to the block boundary.
 */
public final class HeaderCodec {

    private static final int CARDS_PER_BLOCK = Blocks.BLOCK_SIZE / HeaderCard.LENGTH;
    private static final int VALUE_START = 10;
    private static final int FIXED_VALUE_WIDTH = 20;

    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");
    private static final Pattern REAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([EeDd][+-]?\\d+)?");

    private HeaderCodec() {
        // Utility class
    }

    /**
     * Reads header blocks until the block containing the {@code END} card.
     */
    public static FitsHeader read(BlockReader reader) throws IOException {
        List<HeaderCard> cards = new ArrayList<>();
        byte[] block = new byte[Blocks.BLOCK_SIZE];
        while (true) {
            reader.readBlocks(block);
            for (int i = 0; i < CARDS_PER_BLOCK; i++) {
                String image = toAscii(block, i * HeaderCard.LENGTH, reader.position());
                HeaderCard card = parseCard(image);
                if (card.isEnd()) {
                    return new FitsHeader(cards);
                }
                cards.add(card);
            }
        }
    }

    /**
     * Writes all cards followed by {@code END}, padded with blanks.
     */
    public static void write(FitsHeader header, BlockWriter writer) throws IOException {
        StringBuilder builder = new StringBuilder((header.size() + 1) * HeaderCard.LENGTH);
        for (HeaderCard card : header.cards()) {
            builder.append(formatCard(card));
        }
        builder.append(formatCard(HeaderCard.end()));
        writer.writePadded(builder.toString().getBytes(StandardCharsets.US_ASCII), (byte) ' ');
    }

    static HeaderCard parseCard(String image) throws FitsFormatException {
        String keyword = image.substring(0, HeaderCard.KEYWORD_LENGTH).stripTrailing();
        boolean hasValueIndicator = image.startsWith("= ", HeaderCard.KEYWORD_LENGTH);
        if (!hasValueIndicator || keyword.equals("COMMENT") || keyword.equals("HISTORY") || keyword.isEmpty()) {
            String text = image.substring(HeaderCard.KEYWORD_LENGTH).stripTrailing();
            return createCard(keyword, null, text.isEmpty() ? null : text);
        }

        String field = image.substring(VALUE_START);
        String trimmed = field.stripLeading();
        if (trimmed.startsWith("'")) {
            return parseStringCard(keyword, trimmed);
        }

        int slash = trimmed.indexOf('/');
        String token = (slash < 0 ? trimmed : trimmed.substring(0, slash)).strip();
        String comment = slash < 0 ? null : trimmed.substring(slash + 1).strip();
        return createCard(keyword, parseValue(keyword, token), comment);
    }

    private static HeaderCard parseStringCard(String keyword, String field) throws FitsFormatException {
        StringBuilder value = new StringBuilder();
        int i = 1;
        while (true) {
            if (i >= field.length()) {
                throw new FitsFormatException("Unterminated string value for keyword " + keyword);
            }
            char c = field.charAt(i);
            if (c == '\'') {
                if (i + 1 < field.length() && field.charAt(i + 1) == '\'') {
                    value.append('\'');
                    i += 2;
                    continue;
                }
                break;
            }
            value.append(c);
            i++;
        }
        String rest = field.substring(i + 1);
        int slash = rest.indexOf('/');
        String comment = slash < 0 ? null : rest.substring(slash + 1).strip();
        // Trailing blanks in strings are not significant
        return createCard(keyword, value.toString().stripTrailing(), comment);
    }

    private static Object parseValue(String keyword, String token) throws FitsFormatException {
        if (token.isEmpty()) {
            return null;
        }
        if (token.equals("T")) {
            return Boolean.TRUE;
        }
        if (token.equals("F")) {
            return Boolean.FALSE;
        }
        if (INTEGER.matcher(token).matches()) {
            try {
                return Long.parseLong(token);
            }
            catch (NumberFormatException e) {
                return Double.parseDouble(token);
            }
        }
        if (REAL.matcher(token).matches()) {
            return Double.parseDouble(token.replace('D', 'E').replace('d', 'e'));
        }
        // Complex values and other free-format content are kept verbatim
        return token;
    }

    private static HeaderCard createCard(String keyword, Object value, String comment) throws FitsFormatException {
        try {
            return new HeaderCard(keyword, value, comment);
        }
        catch (IllegalArgumentException e) {
            throw new FitsFormatException("Invalid header card: " + e.getMessage(), e);
        }
    }

    static String formatCard(HeaderCard card) {
        StringBuilder image = new StringBuilder(HeaderCard.LENGTH);
        image.append(pad(card.keyword(), HeaderCard.KEYWORD_LENGTH));

        if (!card.hasValue()) {
            if (card.comment() != null) {
                image.append(card.comment());
            }
            return fit(image, card);
        }

        image.append("= ");
        Object value = card.value();
        if (value instanceof String s) {
            String quoted = s.replace("'", "''");
            image.append('\'').append(pad(quoted, 8)).append('\'');
        }
        else {
            String text = value instanceof Boolean b ? (b ? "T" : "F") : value.toString();
            image.append(" ".repeat(Math.max(0, FIXED_VALUE_WIDTH - text.length()))).append(text);
        }
        if (image.length() > HeaderCard.LENGTH) {
            throw new IllegalArgumentException("Value of keyword " + card.keyword() + " does not fit in one card");
        }
        if (card.comment() != null && !card.comment().isEmpty()) {
            image.append(" / ").append(card.comment());
        }
        return fit(image, card);
    }

    private static String fit(StringBuilder image, HeaderCard card) {
        if (image.length() > HeaderCard.LENGTH) {
            image.setLength(HeaderCard.LENGTH);
        }
        while (image.length() < HeaderCard.LENGTH) {
            image.append(' ');
        }
        for (int i = 0; i < image.length(); i++) {
            char c = image.charAt(i);
            if (c < 0x20 || c > 0x7E) {
                throw new IllegalArgumentException("Card " + card.keyword() + " contains a non printable character");
            }
        }
        return image.toString();
    }

    private static String pad(String text, int width) {
        if (text.length() >= width) {
            return text;
        }
        return text + " ".repeat(width - text.length());
    }

    private static String toAscii(byte[] block, int offset, long blockEnd) throws FitsFormatException {
        for (int i = offset; i < offset + HeaderCard.LENGTH; i++) {
            if (block[i] < 0x20 || block[i] > 0x7E) {
                throw new FitsFormatException("Header card at offset " + (blockEnd - Blocks.BLOCK_SIZE + offset)
                        + " contains a non ASCII text byte: 0x" + Integer.toHexString(block[i] & 0xFF));
            }
        }
        return new String(block, offset, HeaderCard.LENGTH, StandardCharsets.US_ASCII);
    }
}
