package com.depgraph.paths.io;

import org.junit.Test;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.Assert.*;

public class JsonDependencyGraphTest {

    private static String json(String nodes) {
        return ("{'graph': {'name': 'test', 'nodes': [" + nodes + "]}}").replace('\'', '"');
    }

    static Path resource(String name) {
        try {
            return Path.of(JsonDependencyGraphTest.class.getResource("/graphs/" + name).toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    @Test
    public void testLoadFromFile() throws IOException {
        JsonDependencyGraph graph = JsonDependencyGraph.load(resource("diamond.json"));

        assertEquals("diamond", graph.name());
        assertEquals("1", graph.version());
        assertEquals(4, graph.nodeCount());
        assertEquals(List.of("src/app:a", "src/lib:b", "src/lib:c", "src/core:d"), graph.nodes());
        assertEquals(List.of("src/lib:b", "src/lib:c"), graph.dependenciesOf("src/app:a"));
        assertTrue(graph.dependenciesOf("src/core:d").isEmpty());
    }

    @Test
    public void testUnknownPropertiesIgnored() throws IOException {
        JsonDependencyGraph graph = JsonDependencyGraph.load(resource("multi.json"));
        assertEquals(6, graph.nodeCount());
        assertNull(graph.version());
        assertTrue(graph.dependenciesOf("tools:lint").isEmpty());
    }

    @Test
    public void testClosureInBreadthFirstOrder() throws IOException {
        JsonDependencyGraph graph = JsonDependencyGraph.parse(json(
                "{'name': 'a', 'dependencies': ['b', 'c']},"
                        + "{'name': 'b', 'dependencies': ['d']},"
                        + "{'name': 'c', 'dependencies': ['a']},"
                        + "{'name': 'd'},"
                        + "{'name': 'other', 'dependencies': ['a']}"));

        assertEquals(List.of("a", "b", "c", "d"), List.copyOf(graph.closure("a")));
        assertEquals(Set.of("d"), graph.closure("d"));
    }

    @Test
    public void testSuccessorsOfClosure() throws IOException {
        JsonDependencyGraph graph = JsonDependencyGraph.load(resource("multi.json"));
        Set<String> closure = graph.closure("app/two:main");
        Map<String, List<String>> successors = graph.successors(closure);

        assertEquals(closure, successors.keySet());
        assertEquals(List.of("lib/x:d1", "lib/y:d2"), successors.get("lib:shared"));
        assertEquals(List.of("lib:shared"), successors.get("lib/x:d1"));
        assertTrue(successors.get("lib/y:d2").isEmpty());
    }

    @Test
    public void testUnknownNode() throws IOException {
        JsonDependencyGraph graph = JsonDependencyGraph.parse(json("{'name': 'a'}"));
        try {
            graph.closure("b");
            fail("Should have rejected unknown node");
        } catch (IllegalArgumentException e) {
            assertEquals("Unknown node: b", e.getMessage());
        }
    }

    @Test
    public void testDuplicateNodeName() throws IOException {
        try {
            JsonDependencyGraph.parse(json("{'name': 'a'}, {'name': 'a'}"));
            fail("Should have rejected duplicate node");
        } catch (IllegalArgumentException e) {
            assertEquals("Duplicate node name: a", e.getMessage());
        }
    }

    @Test
    public void testUndeclaredDependency() throws IOException {
        try {
            JsonDependencyGraph.parse(json("{'name': 'a', 'dependencies': ['ghost']}"));
            fail("Should have rejected undeclared dependency");
        } catch (IllegalArgumentException e) {
            assertEquals("Node a depends on undeclared node ghost", e.getMessage());
        }
    }

    @Test
    public void testNodeWithoutName() throws IOException {
        try {
            JsonDependencyGraph.parse(json("{'dependencies': []}"));
            fail("Should have rejected nameless node");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().startsWith("Node without a name"));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMissingGraphKey() throws IOException {
        JsonDependencyGraph.parse("{\"nodes\": []}");
    }

    @Test
    public void testEmptyGraph() throws IOException {
        JsonDependencyGraph graph = JsonDependencyGraph.parse("{\"graph\": {\"name\": \"empty\"}}");
        assertEquals(0, graph.nodeCount());
        assertTrue(graph.nodes().isEmpty());
    }

    @Test(expected = IOException.class)
    public void testMalformedJson() throws IOException {
        JsonDependencyGraph.parse("{\"graph\": [");
    }
}
