package com.dataops.loader.parser;

import com.dataops.loader.exception.FatalParseException;
import com.dataops.loader.model.FileType;

import java.io.IOException;

/**
 * Converts a raw file into rows numbered from 1 in file order.
 */
public interface FileParser {

    FileType getFileType();

    /**
     * Reads the whole file once to check its framing.
     *
     * @throws FatalParseException if the framing is malformed; no row has been emitted
     * @throws IOException if the source cannot be read
     */
    ParsedFile parse(StreamSource source) throws IOException;
}
