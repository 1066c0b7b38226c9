package com.eyelevel.documentvault.storage;

import com.eyelevel.documentvault.exception.StorageException;
import com.eyelevel.documentvault.exception.StorageObjectNotFoundException;
import com.eyelevel.documentvault.exception.StorageProviderException;

import java.io.InputStream;
import java.net.URL;
import java.nio.file.Path;

/**
 * Uniform blob storage over interchangeable backends.
 *
 * <p>Keys are opaque, slash-separated strings built by {@link StorageKeys}. Writing to an existing key
 * overwrites it, and deleting a missing key is not an error, so retried operations are safe.
 * Failures surface as {@link StorageException}.
 */
public interface StorageProvider {

    /**
     * Stores an in-memory payload.
     *
     * @return the key the payload was stored under.
     */
    String upload(byte[] content, String key, String mimeType);

    /**
     * Stores the contents of a local file without loading it fully into memory.
     *
     * @return the key the file was stored under.
     */
    String uploadFile(Path source, String key, String mimeType);

    /**
     * @throws StorageObjectNotFoundException if nothing is stored under {@code key}.
     */
    byte[] download(String key);

    /**
     * Opens the object as a stream. The caller closes it.
     *
     * @throws StorageObjectNotFoundException if nothing is stored under {@code key}.
     */
    InputStream downloadStream(String key);

    /**
     * Opens the object as a stream starting at byte {@code offset}, fetching nothing before it. The
     * caller closes it.
     *
     * @throws StorageObjectNotFoundException if nothing is stored under {@code key}.
     */
    InputStream downloadRange(String key, long offset);

    /**
     * Issues a time-limited URL granting read access to a single object.
     *
     * @throws StorageProviderException if the backend cannot issue signed URLs.
     */
    URL getSignedUrl(String key, long ttlSeconds);

    /**
     * @return {@code false} only when the backend positively reports the object as absent.
     *
     * @throws StorageException if existence cannot be determined.
     */
    boolean exists(String key);

    /**
     * Removes an object. Missing objects are ignored.
     */
    void delete(String key);

    /**
     * @throws StorageObjectNotFoundException if nothing is stored under {@code key}.
     */
    StorageObjectMetadata getMetadata(String key);

    StorageType getStorageType();
}
