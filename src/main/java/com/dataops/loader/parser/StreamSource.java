package com.dataops.loader.parser;

import java.io.IOException;
import java.io.InputStream;

/**
 * Opens the raw bytes of a file from the start. Called once per parse pass.
 */
@FunctionalInterface
public interface StreamSource {

    InputStream open() throws IOException;
}
