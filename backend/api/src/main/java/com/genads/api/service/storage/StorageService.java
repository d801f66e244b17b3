package com.genads.api.service.storage;

import java.io.InputStream;

/**
 * Storage for client uploads.
 */
public interface StorageService {

    /**
     * Stores the stream under the given filename, replacing any existing file.
     *
     * @param filename client-supplied filename
     * @param inputStream file contents
     * @return public path the file is served from
     */
    String upload(String filename, InputStream inputStream);
}
