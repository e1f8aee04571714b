package com.slsa.tree;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.stream.JsonWriter;

import java.io.BufferedWriter;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Machine-readable tree dump:
 * <pre>
 * {"lines":3,"root":{"values":[{"text":"[ROOT]","occurrences":1,"subword":false,"special":false}],
 *                    "terminalCount":0,"children":[...]}}
 * </pre>
 * Streams through Gson's {@link JsonWriter} so deep trees need no recursion.
 */
public final class JsonTreeWriter implements TreeWriter {
    private static final int CLOSE = -1;

    private final Writer out;
    private final boolean ownsWriter;
    private final Gson gson;

    public JsonTreeWriter(Path file, boolean pretty) throws IOException {
        this(new BufferedWriter(new OutputStreamWriter(new FileOutputStream(file.toFile()), StandardCharsets.UTF_8)),
                pretty, true);
    }

    /**
     * Writes to {@code writer}, which is flushed but not closed on close().
     */
    public JsonTreeWriter(Writer writer, boolean pretty) {
        this(writer, pretty, false);
    }

    private JsonTreeWriter(Writer writer, boolean pretty, boolean ownsWriter) {
        this.out = writer;
        this.ownsWriter = ownsWriter;
        GsonBuilder builder = new GsonBuilder().disableHtmlEscaping();
        if (pretty) {
            builder.setPrettyPrinting();
        }
        this.gson = builder.create();
    }

    @Override
    public void write(StructureTree tree) throws IOException {
        JsonWriter json = gson.newJsonWriter(out);
        json.beginObject();
        json.name("lines").value(tree.totalTerminalCount());
        json.name("root");

        Deque<Integer> work = new ArrayDeque<>();
        work.push(tree.root());
        while (!work.isEmpty()) {
            int id = work.pop();
            if (id == CLOSE) {
                json.endArray();
                json.endObject();
                continue;
            }
            TreeNode n = tree.node(id);
            json.beginObject();
            json.name("values").beginArray();
            for (TokenValue v : n.values) {
                json.beginObject();
                json.name("text").value(v.getText());
                json.name("occurrences").value(v.getOccurrences());
                json.name("subword").value(v.isSubword());
                json.name("special").value(v.isSpecial());
                json.endObject();
            }
            json.endArray();
            json.name("terminalCount").value(n.getTerminalCount());
            json.name("children").beginArray();
            work.push(CLOSE);
            List<Integer> children = tree.children(id);
            for (int i = children.size() - 1; i >= 0; i--) {
                work.push(children.get(i));
            }
        }

        json.endObject();
        json.flush();
        out.write('\n');
        out.flush();
    }

    @Override
    public void close() throws IOException {
        if (ownsWriter) {
            out.close();
        } else {
            out.flush();
        }
    }
}
