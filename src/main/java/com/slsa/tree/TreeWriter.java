package com.slsa.tree;

import java.io.Closeable;
import java.io.IOException;

/**
 * Serializes a {@link StructureTree}. Every implementation walks the tree in
 * the same order: a node, then its children, then its next sibling.
 */
public interface TreeWriter extends Closeable {
    void write(StructureTree tree) throws IOException;

    @Override
    void close() throws IOException;
}
