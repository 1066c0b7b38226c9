package com.eyelevel.documentvault.storage.local;

import com.eyelevel.documentvault.exception.StorageException;
import com.eyelevel.documentvault.exception.StorageObjectNotFoundException;
import com.eyelevel.documentvault.exception.StorageProviderException;
import com.eyelevel.documentvault.storage.StorageObjectMetadata;
import com.eyelevel.documentvault.storage.StorageProvider;
import com.eyelevel.documentvault.storage.StorageType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.nio.channels.Channels;
import java.nio.channels.SeekableByteChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;

/**
 * Stores objects as files under a base directory, one file per key.
 *
 * <p>Writes go to a temporary sibling first and are then moved into place, so readers never see a
 * half-written object. Keys that would resolve outside the base directory are rejected.
 */
@Slf4j
public class LocalStorageProvider implements StorageProvider {

    private static final String DEFAULT_MIME_TYPE = "application/octet-stream";

    private final Path basePath;

    public LocalStorageProvider(Path basePath) {
        this.basePath = basePath.toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.basePath);
        } catch (IOException e) {
            throw new StorageException("Failed to create local storage directory " + this.basePath, e);
        }
        log.info("Local storage initialized at {}", this.basePath);
    }

    @Override
    public String upload(byte[] content, String key, String mimeType) {
        Path target = resolve(key);
        try {
            writeAtomically(target, temp -> Files.write(temp, content));
            log.debug("Stored {} bytes at local key '{}'.", content.length, key);
            return key;
        } catch (IOException e) {
            throw new StorageException("Failed to write local object '" + key + "'", e);
        }
    }

    @Override
    public String uploadFile(Path source, String key, String mimeType) {
        Path target = resolve(key);
        try {
            writeAtomically(target, temp -> Files.copy(source, temp, StandardCopyOption.REPLACE_EXISTING));
            log.debug("Stored file '{}' at local key '{}'.", source.getFileName(), key);
            return key;
        } catch (IOException e) {
            throw new StorageException("Failed to write local object '" + key + "'", e);
        }
    }

    @Override
    public byte[] download(String key) {
        try {
            return Files.readAllBytes(resolve(key));
        } catch (NoSuchFileException e) {
            throw new StorageObjectNotFoundException("Local object not found: " + key, e);
        } catch (IOException e) {
            throw new StorageException("Failed to read local object '" + key + "'", e);
        }
    }

    @Override
    public InputStream downloadStream(String key) {
        try {
            return Files.newInputStream(resolve(key));
        } catch (NoSuchFileException e) {
            throw new StorageObjectNotFoundException("Local object not found: " + key, e);
        } catch (IOException e) {
            throw new StorageException("Failed to open local object '" + key + "'", e);
        }
    }

    @Override
    public InputStream downloadRange(String key, long offset) {
        try {
            SeekableByteChannel channel = Files.newByteChannel(resolve(key), StandardOpenOption.READ);
            try {
                channel.position(offset);
            } catch (IOException | IllegalArgumentException e) {
                channel.close();
                throw e;
            }
            return Channels.newInputStream(channel);
        } catch (NoSuchFileException e) {
            throw new StorageObjectNotFoundException("Local object not found: " + key, e);
        } catch (IOException | IllegalArgumentException e) {
            throw new StorageException("Failed to open local object '" + key + "' at byte " + offset, e);
        }
    }

    @Override
    public URL getSignedUrl(String key, long ttlSeconds) {
        throw new StorageProviderException("Signed URLs are not supported by local storage");
    }

    @Override
    public boolean exists(String key) {
        return Files.isRegularFile(resolve(key));
    }

    @Override
    public void delete(String key) {
        try {
            boolean deleted = Files.deleteIfExists(resolve(key));
            log.debug("Delete of local key '{}' {}.", key, deleted ? "removed the object" : "found nothing");
        } catch (IOException e) {
            throw new StorageException("Failed to delete local object '" + key + "'", e);
        }
    }

    @Override
    public StorageObjectMetadata getMetadata(String key) {
        Path path = resolve(key);
        try {
            BasicFileAttributes attributes = Files.readAttributes(path, BasicFileAttributes.class);
            String mimeType = Files.probeContentType(path);
            return new StorageObjectMetadata(attributes.size(), mimeType != null ? mimeType : DEFAULT_MIME_TYPE,
                                             attributes.lastModifiedTime().toInstant(), null);
        } catch (NoSuchFileException e) {
            throw new StorageObjectNotFoundException("Local object not found: " + key, e);
        } catch (IOException e) {
            throw new StorageException("Failed to read metadata for local object '" + key + "'", e);
        }
    }

    @Override
    public StorageType getStorageType() {
        return StorageType.LOCAL;
    }

    private Path resolve(String key) {
        if (!StringUtils.hasText(key)) {
            throw new StorageException("Storage key must not be empty");
        }
        Path resolved = basePath.resolve(key).normalize();
        if (!resolved.startsWith(basePath) || resolved.equals(basePath)) {
            throw new StorageException("Storage key escapes the storage directory: " + key);
        }
        return resolved;
    }

    private static void writeAtomically(Path target, TempFileWriter writer) throws IOException {
        Files.createDirectories(target.getParent());
        Path temp = Files.createTempFile(target.getParent(), ".upload-", ".tmp");
        try {
            writer.write(temp);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException e) {
                log.warn("Failed to remove temporary upload file {}", temp, e);
            }
        }
    }

    @FunctionalInterface
    private interface TempFileWriter {
        void write(Path temp) throws IOException;
    }
}
