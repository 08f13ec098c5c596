package com.dataops.loader.storage;

import java.io.IOException;
import java.io.InputStream;

/**
 * Byte storage for uploaded source files.
 */
public interface SourceFileStorage {

    /**
     * Stores the content of an uploaded file.
     * @param content the file data
     * @param originalName the name the file was uploaded under
     * @return the key under which the file was stored
     */
    String save(byte[] content, String originalName) throws IOException;

    /**
     * Opens a stored file from its first byte. Each call returns an independent stream;
     * compressed files are returned decompressed.
     * @param storedName the key returned by {@link #save}
     */
    InputStream open(String storedName) throws IOException;

    boolean exists(String storedName);
}
