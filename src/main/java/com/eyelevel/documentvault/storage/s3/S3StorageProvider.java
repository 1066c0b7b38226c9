package com.eyelevel.documentvault.storage.s3;

import com.eyelevel.documentvault.exception.StorageException;
import com.eyelevel.documentvault.exception.StorageObjectNotFoundException;
import com.eyelevel.documentvault.exception.StorageProviderException;
import com.eyelevel.documentvault.storage.StorageObjectMetadata;
import com.eyelevel.documentvault.storage.StorageProvider;
import com.eyelevel.documentvault.storage.StorageType;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;
import software.amazon.awssdk.transfer.s3.S3TransferManager;
import software.amazon.awssdk.transfer.s3.model.FileUpload;
import software.amazon.awssdk.transfer.s3.model.UploadFileRequest;

import java.io.InputStream;
import java.net.URL;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CompletionException;

/**
 * {@link StorageProvider} backed by an S3 bucket.
 *
 * <p>Small payloads go through the synchronous {@link S3Client}; files go through the
 * {@link S3TransferManager} so large uploads are split into parts. Read access for clients is
 * granted through pre-signed GET URLs.
 */
@Slf4j
public class S3StorageProvider implements StorageProvider {

    private static final int NOT_FOUND = 404;

    private final S3Client s3Client;
    private final S3Presigner s3Presigner;
    private final S3TransferManager transferManager;
    private final String bucketName;

    public S3StorageProvider(final S3Client s3Client, final S3Presigner s3Presigner,
                             final S3TransferManager transferManager, final String bucketName) {
        this.s3Client = s3Client;
        this.s3Presigner = s3Presigner;
        this.transferManager = transferManager;
        this.bucketName = bucketName;
        log.info("S3StorageProvider initialized for bucket '{}'.", bucketName);
    }

    @Override
    public String upload(final byte[] content, final String key, final String mimeType) {
        log.debug("Uploading {} bytes to S3 key: {}", content.length, key);
        try {
            final PutObjectRequest request = PutObjectRequest.builder().bucket(bucketName).key(key)
                                                             .contentType(mimeType).build();
            s3Client.putObject(request, RequestBody.fromBytes(content));
            log.info("Successfully uploaded object to S3 key: {}", key);
            return key;
        } catch (SdkException e) {
            throw new StorageException("Failed to upload object to S3 key '" + key + "'", e);
        }
    }

    @Override
    public String uploadFile(final Path source, final String key, final String mimeType) {
        log.debug("Uploading file {} to S3 key: {}", source.getFileName(), key);
        try {
            final UploadFileRequest uploadFileRequest = UploadFileRequest.builder().putObjectRequest(
                    req -> req.bucket(bucketName).key(key).contentType(mimeType)).source(source).build();

            final FileUpload upload = transferManager.uploadFile(uploadFileRequest);
            // block so callers see a completed write or an exception
            upload.completionFuture().join();

            log.info("Successfully uploaded file to S3 key: {}", key);
            return key;
        } catch (CompletionException | SdkException e) {
            final Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
            throw new StorageException("Failed to upload file to S3 key '" + key + "'", cause);
        }
    }

    @Override
    public byte[] download(final String key) {
        log.debug("Downloading object from S3 key: {}", key);
        try {
            return s3Client.getObjectAsBytes(getObjectRequest(key)).asByteArray();
        } catch (NoSuchKeyException e) {
            throw new StorageObjectNotFoundException("S3 object not found: " + key, e);
        } catch (SdkException e) {
            throw new StorageException("Failed to download S3 object '" + key + "'", e);
        }
    }

    @Override
    public InputStream downloadStream(final String key) {
        log.debug("Opening stream for S3 key: {}", key);
        try {
            return s3Client.getObject(getObjectRequest(key));
        } catch (NoSuchKeyException e) {
            throw new StorageObjectNotFoundException("S3 object not found: " + key, e);
        } catch (SdkException e) {
            throw new StorageException("Failed to open S3 object '" + key + "'", e);
        }
    }

    @Override
    public InputStream downloadRange(final String key, final long offset) {
        log.debug("Opening stream for S3 key: {} from byte {}", key, offset);
        try {
            return s3Client.getObject(GetObjectRequest.builder().bucket(bucketName).key(key)
                                                      .range("bytes=" + offset + "-").build());
        } catch (NoSuchKeyException e) {
            throw new StorageObjectNotFoundException("S3 object not found: " + key, e);
        } catch (SdkException e) {
            throw new StorageException("Failed to open S3 object '" + key + "' at byte " + offset, e);
        }
    }

    @Override
    public URL getSignedUrl(final String key, final long ttlSeconds) {
        log.debug("Generating pre-signed download URL for S3 key: {} ({}s)", key, ttlSeconds);
        try {
            final GetObjectPresignRequest presignRequest = GetObjectPresignRequest.builder().signatureDuration(
                    Duration.ofSeconds(ttlSeconds)).getObjectRequest(getObjectRequest(key)).build();
            return s3Presigner.presignGetObject(presignRequest).url();
        } catch (SdkException | IllegalArgumentException e) {
            throw new StorageProviderException("Failed to sign URL for S3 key '" + key + "'", e);
        }
    }

    @Override
    public boolean exists(final String key) {
        try {
            s3Client.headObject(headObjectRequest(key));
            return true;
        } catch (NoSuchKeyException e) {
            return false;
        } catch (S3Exception e) {
            if (e.statusCode() == NOT_FOUND) {
                return false;
            }
            throw new StorageException("Failed to check existence of S3 key '" + key + "'", e);
        } catch (SdkException e) {
            throw new StorageException("Failed to check existence of S3 key '" + key + "'", e);
        }
    }

    @Override
    public void delete(final String key) {
        log.debug("Deleting S3 key: {}", key);
        try {
            s3Client.deleteObject(DeleteObjectRequest.builder().bucket(bucketName).key(key).build());
        } catch (SdkException e) {
            throw new StorageException("Failed to delete S3 object '" + key + "'", e);
        }
    }

    @Override
    public StorageObjectMetadata getMetadata(final String key) {
        try {
            final HeadObjectResponse response = s3Client.headObject(headObjectRequest(key));
            return new StorageObjectMetadata(response.contentLength(), response.contentType(),
                                             response.lastModified(), response.eTag());
        } catch (NoSuchKeyException e) {
            throw new StorageObjectNotFoundException("S3 object not found: " + key, e);
        } catch (S3Exception e) {
            if (e.statusCode() == NOT_FOUND) {
                throw new StorageObjectNotFoundException("S3 object not found: " + key, e);
            }
            throw new StorageException("Failed to read metadata for S3 key '" + key + "'", e);
        } catch (SdkException e) {
            throw new StorageException("Failed to read metadata for S3 key '" + key + "'", e);
        }
    }

    @Override
    public StorageType getStorageType() {
        return StorageType.CLOUD;
    }

    private GetObjectRequest getObjectRequest(final String key) {
        return GetObjectRequest.builder().bucket(bucketName).key(key).build();
    }

    private HeadObjectRequest headObjectRequest(final String key) {
        return HeadObjectRequest.builder().bucket(bucketName).key(key).build();
    }
}
