package io.hireflow.forms.storage;

import java.io.InputStream;
import java.util.Map;

public interface StorageService {

    /**
     * Stores the bytes under {@code blobPath} and returns the URL they can be fetched from.
     */
    String store(String blobPath, InputStream data, long size, String contentType, Map<String, String> metadata);
}
