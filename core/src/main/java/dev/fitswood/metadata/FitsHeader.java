/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitswood.metadata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import dev.fitswood.FitsFormatException;

/**
 * The keyword records of one HDU, in file order, without the {@code END} card.
 * <p>
 * Only access to the raw keyword values is offered here; interpreting them
 * beyond what is needed to decode the payload is up to the caller.
 * </p>
 */
public final class FitsHeader {

    private final List<HeaderCard> cards;

    public FitsHeader() {
        this.cards = new ArrayList<>();
    }

    public FitsHeader(List<HeaderCard> cards) {
        this.cards = new ArrayList<>(cards);
    }

    public List<HeaderCard> cards() {
        return Collections.unmodifiableList(cards);
    }

    public int size() {
        return cards.size();
    }

    public FitsHeader add(HeaderCard card) {
        cards.add(card);
        return this;
    }

    /**
     * Replaces the value of the first card with the given keyword, keeping its
     * position and comment, or appends a new card.
     */
    public FitsHeader set(String keyword, Object value) {
        int index = indexOf(keyword);
        if (index < 0) {
            cards.add(HeaderCard.of(keyword, value));
        }
        else {
            cards.set(index, HeaderCard.of(keyword, value, cards.get(index).comment()));
        }
        return this;
    }

    public FitsHeader set(String keyword, Object value, String comment) {
        int index = indexOf(keyword);
        if (index < 0) {
            cards.add(HeaderCard.of(keyword, value, comment));
        }
        else {
            cards.set(index, HeaderCard.of(keyword, value, comment));
        }
        return this;
    }

    /** Removes all cards with the given keyword. */
    public boolean remove(String keyword) {
        return cards.removeIf(card -> card.keyword().equals(keyword));
    }

    public boolean contains(String keyword) {
        return indexOf(keyword) >= 0;
    }

    /** The first card with the given keyword, or null. */
    public HeaderCard getCard(String keyword) {
        int index = indexOf(keyword);
        return index < 0 ? null : cards.get(index);
    }

    /** The value of the first card with the given keyword, or null. */
    public Object getValue(String keyword) {
        HeaderCard card = getCard(keyword);
        return card == null ? null : card.value();
    }

    public String getString(String keyword) {
        Object value = getValue(keyword);
        return value instanceof String s ? s : null;
    }

    public long getLong(String keyword, long defaultValue) {
        Object value = getValue(keyword);
        return value instanceof Long l ? l : defaultValue;
    }

    public int getInt(String keyword, int defaultValue) {
        Object value = getValue(keyword);
        return value instanceof Long l ? Math.toIntExact(l) : defaultValue;
    }

    public boolean getBoolean(String keyword, boolean defaultValue) {
        Object value = getValue(keyword);
        return value instanceof Boolean b ? b : defaultValue;
    }

    public long requireLong(String keyword) throws FitsFormatException {
        Object value = getValue(keyword);
        if (value instanceof Long l) {
            return l;
        }
        throw missing(keyword, "an integer", value);
    }

    public int requireInt(String keyword) throws FitsFormatException {
        long value = requireLong(keyword);
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new FitsFormatException("Value of " + keyword + " out of range: " + value);
        }
        return (int) value;
    }

    public String requireString(String keyword) throws FitsFormatException {
        Object value = getValue(keyword);
        if (value instanceof String s) {
            return s;
        }
        throw missing(keyword, "a string", value);
    }

    private static FitsFormatException missing(String keyword, String expected, Object actual) {
        if (actual == null) {
            return new FitsFormatException("Mandatory keyword " + keyword + " is missing");
        }
        return new FitsFormatException("Keyword " + keyword + " must be " + expected + " but is " + actual);
    }

    private int indexOf(String keyword) {
        for (int i = 0; i < cards.size(); i++) {
            if (cards.get(i).keyword().equals(keyword)) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public String toString() {
        return "FitsHeader[" + cards.size() + " cards]";
    }
}
