/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitswood.internal.table;

import jdk.jfr.Category;
import jdk.jfr.DataAmount;
import jdk.jfr.Description;
import jdk.jfr.Event;
import jdk.jfr.Label;
import jdk.jfr.Name;

/**
 * JFR event emitted for each decoded ASCII table.
 */
@Name("dev.fitswood.TableDecode")
@Label("ASCII Table Decode")
@Category({"Fitswood", "Decoding"})
@Description("Decoding of an ASCII table extension into typed columns")
public class TableDecodeEvent extends Event {

    @Label("Rows")
    @Description("Number of rows declared by NAXIS2")
    public int rows;

    @Label("Fields")
    @Description("Number of fields per row")
    public int fields;

    @Label("Size")
    @DataAmount
    @Description("Size of the block-aligned table payload")
    public long size;

    @Label("Tasks")
    @Description("Number of parallel row decoding tasks")
    public int tasks;
}
