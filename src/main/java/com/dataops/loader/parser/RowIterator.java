package com.dataops.loader.parser;

import com.dataops.loader.model.Row;

import java.util.Iterator;

/**
 * Lazy iteration over the rows of a parsed file. Holds an open stream until closed.
 */
public interface RowIterator extends Iterator<Row>, AutoCloseable {

    @Override
    void close();
}
