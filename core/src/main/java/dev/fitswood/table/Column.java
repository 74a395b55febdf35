/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitswood.table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered cells of one table column. Cell order is row order; a null cell is an
 * undefined value.
 *
 * @param <T> the cell type
 */
public abstract class Column<T> implements AsciiColumn {

    private final String label;
    private final List<T> cells;

    protected Column(String label, int expectedRows) {
        this.label = label;
        this.cells = new ArrayList<>(Math.max(expectedRows, 0));
    }

    @Override
    public String label() {
        return label;
    }

    @Override
    public int length() {
        return cells.size();
    }

    public void add(T value) {
        cells.add(value);
    }

    public T get(int row) {
        return cells.get(row);
    }

    public List<T> values() {
        return Collections.unmodifiableList(cells);
    }

    @Override
    public String render(int row) {
        T value = cells.get(row);
        return value == null ? "" : renderValue(value);
    }

    @Override
    public void padTo(int length) {
        while (cells.size() < length) {
            cells.add(null);
        }
    }

    protected abstract String renderValue(T value);

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[label=" + label + ", format=" + format().code() + ", length=" + length() + "]";
    }
}
