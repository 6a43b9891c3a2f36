package com.depgraph.paths.io;

import com.depgraph.paths.api.DependencyPath;
import org.junit.Test;

import java.io.IOException;
import java.io.StringWriter;
import java.util.List;

import static org.junit.Assert.*;

public class PathsJsonWriterTest {

    @Test
    public void testPrettyLayout() {
        String out = new PathsJsonWriter().toJson(List.of(
                DependencyPath.of("a:x", "b:y"),
                DependencyPath.of("a:x")));

        assertEquals("[\n"
                + "  [\n"
                + "    \"a:x\",\n"
                + "    \"b:y\"\n"
                + "  ],\n"
                + "  [\n"
                + "    \"a:x\"\n"
                + "  ]\n"
                + "]\n", out);
    }

    @Test
    public void testEmptyResult() {
        assertEquals("[]\n", new PathsJsonWriter().toJson(List.of()));
    }

    @Test
    public void testEscapesAddresses() {
        String out = new PathsJsonWriter().toJson(List.of(DependencyPath.of("odd\"name")));
        assertTrue(out.contains("\"odd\\\"name\""));
    }

    @Test
    public void testWriterLeftOpen() throws IOException {
        StringWriter sw = new StringWriter();
        PathsJsonWriter writer = new PathsJsonWriter();
        writer.write(List.of(), sw);
        writer.write(List.of(), sw);
        assertEquals("[]\n[]\n", sw.toString());
    }
}
