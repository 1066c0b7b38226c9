package com.eyelevel.documentvault.dto;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.io.InputStream;
import java.net.URL;

/**
 * Result of a read request: a redirect to a signed URL, a plaintext stream to proxy, or not-found.
 *
 * <p>When the kind is {@link Kind#CONTENT} the caller owns {@link #getContent()} and must close it.
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class DocumentAccess {

    public enum Kind {
        REDIRECT,
        CONTENT,
        NOT_FOUND
    }

    private static final DocumentAccess NOT_FOUND = new DocumentAccess(Kind.NOT_FOUND, null, null, null, null, -1);

    private final Kind kind;
    private final URL redirectUrl;
    private final InputStream content;
    private final String fileName;
    private final String mimeType;
    private final long contentLength;

    public static DocumentAccess redirect(URL url, String fileName, String mimeType) {
        return new DocumentAccess(Kind.REDIRECT, url, null, fileName, mimeType, -1);
    }

    public static DocumentAccess content(InputStream content, String fileName, String mimeType, long contentLength) {
        return new DocumentAccess(Kind.CONTENT, null, content, fileName, mimeType, contentLength);
    }

    public static DocumentAccess notFound() {
        return NOT_FOUND;
    }

    public boolean isFound() {
        return kind != Kind.NOT_FOUND;
    }
}
