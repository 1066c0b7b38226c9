package com.eyelevel.documentvault.crypto;

import com.eyelevel.documentvault.exception.DecryptionException;

import javax.crypto.Cipher;
import javax.crypto.spec.SecretKeySpec;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.security.GeneralSecurityException;
import java.util.Objects;

/**
 * Streams the plaintext of a chunked ciphertext, decrypting and authenticating one chunk at a time.
 *
 * <p>No plaintext byte of a chunk is returned before that chunk's tag has been verified. A failed tag,
 * a truncated source or a missing final chunk surfaces as {@link DecryptionException}.
 */
final class ChunkedDecryptingInputStream extends InputStream {

    private final CiphertextSource source;
    private final SecretKeySpec documentKey;
    private final CipherMetadata metadata;
    private final byte[] noncePrefix;
    private final Cipher cipher;

    private long nextChunk;
    private int skipInFirstChunk;
    private long remaining;
    private byte[] plaintext = new byte[0];
    private int position;
    private boolean closed;

    ChunkedDecryptingInputStream(CiphertextSource source, SecretKeySpec documentKey, CipherMetadata metadata,
                                 byte[] noncePrefix, long offset, long length)
    throws IOException, GeneralSecurityException {
        this.source = source;
        this.documentKey = documentKey;
        this.metadata = metadata;
        this.noncePrefix = noncePrefix;
        this.cipher = Cipher.getInstance(KeyManager.CIPHER_TRANSFORMATION);
        this.nextChunk = offset / metadata.chunkSize();
        this.skipInFirstChunk = (int) (offset % metadata.chunkSize());
        this.remaining = length;

        if (metadata.plaintextLength() == 0) {
            // an empty document is still one sealed chunk; authenticate it up front
            loadNextChunk();
        }
    }

    @Override
    public int read() throws IOException {
        byte[] single = new byte[1];
        int read = read(single, 0, 1);
        return read < 0 ? -1 : single[0] & 0xff;
    }

    @Override
    public int read(byte[] buffer, int offset, int length) throws IOException {
        Objects.checkFromIndexSize(offset, length, buffer.length);
        if (closed) {
            throw new IOException("Stream closed");
        }
        if (length == 0) {
            return 0;
        }
        if (remaining == 0) {
            return -1;
        }
        if (position >= plaintext.length) {
            loadNextChunk();
        }
        int count = (int) Math.min(Math.min(length, plaintext.length - position), remaining);
        System.arraycopy(plaintext, position, buffer, offset, count);
        position += count;
        remaining -= count;
        return count;
    }

    @Override
    public void close() throws IOException {
        if (!closed) {
            closed = true;
            source.close();
        }
    }

    private void loadNextChunk() throws IOException {
        if (nextChunk >= metadata.chunkCount()) {
            throw new DecryptionException("Ciphertext has fewer chunks than its metadata declares");
        }
        boolean lastChunk = nextChunk == metadata.chunkCount() - 1;
        long plaintextOffset = nextChunk * metadata.chunkSize();
        int plaintextLength = lastChunk
                ? (int) (metadata.plaintextLength() - plaintextOffset)
                : metadata.chunkSize();

        byte[] sealed = new byte[plaintextLength + KeyManager.TAG_LENGTH_BYTES];
        try {
            source.readFully(nextChunk * ((long) metadata.chunkSize() + KeyManager.TAG_LENGTH_BYTES), sealed);
        } catch (EOFException e) {
            throw new DecryptionException("Ciphertext is truncated at chunk " + nextChunk, e);
        }

        plaintext = KeyManager.openChunk(cipher, documentKey, noncePrefix, nextChunk, lastChunk, sealed);
        position = skipInFirstChunk;
        skipInFirstChunk = 0;
        nextChunk++;
    }
}
