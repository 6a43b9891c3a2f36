package com.depgraph.paths.io;

import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class NodeSelectorTest {
    private static final List<String> NODES = List.of(
            "app/one:main", "app/two:main", "lib:shared", "lib/x:d1", "lib/y:d2", "tools:lint", "library:other");

    @Test
    public void testExactAddress() {
        assertEquals(List.of("lib:shared"), NodeSelector.select("lib:shared", NODES));
        assertEquals(List.of("lib:shared"), NodeSelector.select("  lib:shared ", NODES));
    }

    @Test
    public void testSingleDirectory() {
        assertEquals(List.of("lib:shared"), NodeSelector.select("lib:", NODES));
        assertEquals(List.of("app/one:main"), NodeSelector.select("app/one:", NODES));
    }

    @Test
    public void testRecursiveDirectory() {
        assertEquals(List.of("lib:shared", "lib/x:d1", "lib/y:d2"), NodeSelector.select("lib::", NODES));
        assertEquals(List.of("app/one:main", "app/two:main"), NodeSelector.select("app::", NODES));
    }

    @Test
    public void testRecursiveSelectorRespectsDirectoryBoundaries() {
        assertTrue(NodeSelector.select("li::", NODES).isEmpty());
        assertEquals(List.of("library:other"), NodeSelector.select("library::", NODES));
    }

    @Test
    public void testEverything() {
        assertEquals(NODES, NodeSelector.select("::", NODES));
    }

    @Test
    public void testNoMatchIsEmpty() {
        assertTrue(NodeSelector.select("nowhere:main", NODES).isEmpty());
        assertTrue(NodeSelector.select("nowhere::", NODES).isEmpty());
        assertTrue(NodeSelector.select("::", List.of()).isEmpty());
    }

    @Test
    public void testDirectoryOf() {
        assertEquals("lib/x", NodeSelector.directoryOf("lib/x:d1"));
        assertEquals("plain", NodeSelector.directoryOf("plain"));
    }
}
