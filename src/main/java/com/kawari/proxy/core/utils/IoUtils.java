package com.kawari.proxy.core.utils;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stream helpers for HTTP/1.1 framing: bounded line reads, fixed-length and chunked
 * bodies, and quiet closing.
 */
public final class IoUtils {
    private static final Logger log = LoggerFactory.getLogger(IoUtils.class);

    /** Longest request, status or header line accepted. */
    public static final int MAX_LINE_LENGTH = 8192;

    private IoUtils() {
    }

    /**
     * A body grew past its permitted size while being read.
     */
    public static class LimitExceededException extends IOException {
        public LimitExceededException(String message) {
            super(message);
        }
    }

    /**
     * Reads one line of at most {@link #MAX_LINE_LENGTH} characters.
     *
     * @param in source stream.
     * @return the line without its terminator, or {@code null} at end of stream.
     * @throws IOException on I/O errors or an overlong line.
     */
    public static String readLine(InputStream in) throws IOException {
        return readLine(in, MAX_LINE_LENGTH);
    }

    /**
     * Reads one LF or CRLF terminated line, decoded as ISO-8859-1. Bare CR bytes are dropped.
     *
     * @param in        source stream.
     * @param maxLength longest line accepted, terminator excluded.
     * @return the line, or {@code null} when the stream ends before any byte.
     * @throws IOException on I/O errors or an overlong line.
     */
    public static String readLine(InputStream in, int maxLength) throws IOException {
        ByteArrayOutputStream line = new ByteArrayOutputStream(128);
        boolean sawAny = false;
        for (int b = in.read(); b != -1; b = in.read()) {
            sawAny = true;
            if (b == '\n') {
                return line.toString(StandardCharsets.ISO_8859_1);
            }
            if (b == '\r') {
                continue;
            }
            if (line.size() >= maxLength) {
                throw new IOException("Line longer than " + maxLength + " characters");
            }
            line.write(b);
        }
        return sawAny ? line.toString(StandardCharsets.ISO_8859_1) : null;
    }

    /**
     * Reads exactly {@code length} bytes.
     *
     * @param in     source stream.
     * @param length number of bytes expected.
     * @return the bytes.
     * @throws IOException if the stream ends early.
     */
    public static byte[] readFully(InputStream in, int length) throws IOException {
        byte[] data = in.readNBytes(length);
        if (data.length < length) {
            throw new IOException("Unexpected end of stream after " + data.length + " of " + length + " bytes");
        }
        return data;
    }

    /**
     * Decodes a chunked transfer-coded body, discarding trailers.
     *
     * @param in       stream positioned at the first chunk-size line.
     * @param maxBytes upper bound on the decoded size.
     * @return the decoded body.
     * @throws LimitExceededException if the body exceeds {@code maxBytes}.
     * @throws IOException            if the framing is malformed.
     */
    public static byte[] readChunked(InputStream in, long maxBytes) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        while (true) {
            String sizeLine = readLine(in);
            if (sizeLine == null) {
                throw new IOException("Unexpected end of stream in chunked body");
            }
            int ext = sizeLine.indexOf(';');
            String hex = (ext >= 0 ? sizeLine.substring(0, ext) : sizeLine).trim();
            long size;
            try {
                size = Long.parseLong(hex, 16);
            } catch (NumberFormatException e) {
                throw new IOException("Invalid chunk size: " + sizeLine, e);
            }
            if (size < 0) {
                throw new IOException("Invalid chunk size: " + sizeLine);
            }
            if (out.size() + size > maxBytes) {
                throw new LimitExceededException("Chunked body exceeds limit of " + maxBytes + " bytes");
            }
            if (size == 0) {
                String trailer;
                while ((trailer = readLine(in)) != null && !trailer.isEmpty()) {
                    log.trace("Discarding chunk trailer: {}", trailer);
                }
                return out.toByteArray();
            }
            out.write(readFully(in, (int) size));
            readLine(in);
        }
    }

    /**
     * Closes {@code closeable}, ignoring {@code null} and logging failures at debug.
     */
    public static void closeQuietly(AutoCloseable closeable) {
        closeQuietly(closeable, "resource");
    }

    /**
     * Closes {@code closeable}, ignoring {@code null} and logging failures at debug.
     *
     * @param closeable resource to close.
     * @param name      description used in the log line.
     */
    public static void closeQuietly(AutoCloseable closeable, String name) {
        if (closeable == null) {
            return;
        }
        try {
            closeable.close();
        } catch (Exception e) {
            log.debug("Failed to close {}: {}", name, e.getMessage());
        }
    }
}
