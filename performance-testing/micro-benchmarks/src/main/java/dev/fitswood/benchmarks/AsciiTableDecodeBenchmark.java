/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitswood.benchmarks;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.concurrent.TimeUnit;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.TearDown;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import dev.fitswood.hdu.Extension;
import dev.fitswood.internal.io.BlockReader;
import dev.fitswood.internal.io.BlockWriter;
import dev.fitswood.internal.table.AsciiTableCodec;
import dev.fitswood.reader.FitsContext;
import dev.fitswood.table.AsciiTable;
import dev.fitswood.table.AsciiTableLayout;
import dev.fitswood.table.FloatColumn;
import dev.fitswood.table.IntColumn;
import dev.fitswood.table.TextColumn;

/**
 * Measures decoding of an in-memory ASCII table with varying thread and task sizes.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@State(Scope.Benchmark)
@Fork(value = 2, jvmArgs = { "-Xms1g", "-Xmx1g" })
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
public class AsciiTableDecodeBenchmark {

    @Param({ "100000", "1000000" })
    private int rowCount;

    @Param({ "1", "4" })
    private int threads;

    @Param({ "1024", "16384" })
    private int rowsPerTask;

    private FitsContext context;
    private AsciiTableLayout layout;
    private byte[] encoded;

    @Setup
    public void setup() throws IOException {
        TextColumn names = new TextColumn(12, "NAME");
        IntColumn ids = new IntColumn(10, "ID");
        FloatColumn ra = new FloatColumn(12, 6, "RA");
        FloatColumn dec = new FloatColumn(12, 6, "DEC");
        for (int i = 0; i < rowCount; i++) {
            names.add("SRC-" + i);
            ids.add((long) i);
            ra.add((i * 0.000361) % 360.0);
            dec.add(((i * 0.000173) % 180.0) - 90.0);
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (BlockWriter writer = BlockWriter.of(out)) {
            layout = AsciiTableCodec.encode(AsciiTable.of(names, ids, ra, dec), writer);
        }
        encoded = out.toByteArray();
        context = FitsContext.create(threads, rowsPerTask);
    }

    @TearDown
    public void tearDown() {
        context.close();
    }

    @Benchmark
    public void decodeTable(Blackhole blackhole) throws IOException {
        BlockReader reader = BlockReader.of(new ByteArrayInputStream(encoded));
        Extension.AsciiTableData data = AsciiTableCodec.decode(reader, layout, context);
        AsciiTable table = data.table();
        blackhole.consume(table.intColumn(1).get(rowCount - 1));
        blackhole.consume(table.floatColumn(2).values());
    }
}
