package com.eyelevel.documentvault.crypto;

import org.apache.commons.io.IOUtils;

import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Random-access view over a chunked ciphertext, so that range reads only touch the chunks they need.
 */
public interface CiphertextSource extends Closeable {

    /**
     * Fills {@code target} with the bytes starting at {@code position}.
     *
     * @throws EOFException if the source ends before {@code target} is full.
     */
    void readFully(long position, byte[] target) throws IOException;

    static CiphertextSource ofFile(Path path) throws IOException {
        return new FileCiphertextSource(FileChannel.open(path, StandardOpenOption.READ));
    }

    static CiphertextSource ofBytes(byte[] ciphertext) {
        return new ByteArrayCiphertextSource(ciphertext);
    }

    /**
     * Wraps a stream whose first byte is ciphertext byte {@code basePosition}. Reads must move forward;
     * gaps between them are skipped.
     */
    static CiphertextSource ofStream(InputStream stream, long basePosition) {
        return new StreamCiphertextSource(stream, basePosition);
    }

    final class FileCiphertextSource implements CiphertextSource {

        private final FileChannel channel;

        private FileCiphertextSource(FileChannel channel) {
            this.channel = channel;
        }

        @Override
        public void readFully(long position, byte[] target) throws IOException {
            ByteBuffer buffer = ByteBuffer.wrap(target);
            long offset = position;
            while (buffer.hasRemaining()) {
                int read = channel.read(buffer, offset);
                if (read < 0) {
                    throw new EOFException("Ciphertext ended at byte " + offset);
                }
                offset += read;
            }
        }

        @Override
        public void close() throws IOException {
            channel.close();
        }
    }

    final class StreamCiphertextSource implements CiphertextSource {

        private final InputStream stream;
        private long streamPosition;

        private StreamCiphertextSource(InputStream stream, long basePosition) {
            this.stream = stream;
            this.streamPosition = basePosition;
        }

        @Override
        public void readFully(long position, byte[] target) throws IOException {
            if (position < streamPosition) {
                throw new IOException("Cannot seek back from byte " + streamPosition + " to " + position);
            }
            IOUtils.skipFully(stream, position - streamPosition);
            streamPosition = position;
            IOUtils.readFully(stream, target);
            streamPosition += target.length;
        }

        @Override
        public void close() throws IOException {
            stream.close();
        }
    }

    final class ByteArrayCiphertextSource implements CiphertextSource {

        private final byte[] ciphertext;

        private ByteArrayCiphertextSource(byte[] ciphertext) {
            this.ciphertext = ciphertext;
        }

        @Override
        public void readFully(long position, byte[] target) throws IOException {
            if (position < 0 || position + target.length > ciphertext.length) {
                throw new EOFException("Ciphertext ended at byte " + ciphertext.length);
            }
            System.arraycopy(ciphertext, (int) position, target, 0, target.length);
        }

        @Override
        public void close() {
            // nothing to release
        }
    }
}
