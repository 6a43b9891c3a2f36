package com.depgraph.paths.io;

import com.depgraph.paths.api.DependencyPath;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders paths as a JSON array of arrays of node addresses.
 *
 * <p>
 * Output is indented by two spaces per level, one element per line, and
 * terminated by a newline; an empty result is written as {@code []}. The
 * target writer is flushed but never closed.
 */
public final class PathsJsonWriter {
    private final ObjectWriter writer;

    public PathsJsonWriter() {
        ObjectMapper mapper = new ObjectMapper(JsonFactory.builder()
                .disable(StreamWriteFeature.AUTO_CLOSE_TARGET)
                .build());
        this.writer = mapper.writer(new PathsPrettyPrinter());
    }

    public void write(List<DependencyPath> paths, Writer out) throws IOException {
        List<List<String>> rows = new ArrayList<>(paths.size());
        for (DependencyPath path : paths)
            rows.add(path.nodes());
        writer.writeValue(out, rows);
        out.write('\n');
        out.flush();
    }

    public String toJson(List<DependencyPath> paths) {
        StringWriter sw = new StringWriter();
        try {
            write(paths, sw);
        } catch (IOException e) {
            throw new IllegalStateException("StringWriter failed", e);
        }
        return sw.toString();
    }

    /**
     * Line-per-element array layout; empty arrays print as {@code []}
     * rather than Jackson's default {@code [ ]}.
     */
    static final class PathsPrettyPrinter extends DefaultPrettyPrinter {
        private static final long serialVersionUID = 1L;

        PathsPrettyPrinter() {
            DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
            indentArraysWith(indenter);
            indentObjectsWith(indenter);
        }

        private PathsPrettyPrinter(PathsPrettyPrinter base) {
            super(base);
        }

        @Override
        public DefaultPrettyPrinter createInstance() {
            return new PathsPrettyPrinter(this);
        }

        @Override
        public void writeEndArray(JsonGenerator g, int nrOfValues) throws IOException {
            if (nrOfValues > 0) {
                super.writeEndArray(g, nrOfValues);
                return;
            }
            if (!_arrayIndenter.isInline())
                --_nesting;
            g.writeRaw(']');
        }
    }
}
