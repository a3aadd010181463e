package com.mypodcasts.mime.io;

import java.io.ByteArrayOutputStream;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * Input stream with binary line reading capability.
 *
 * <p>Returns lines with their EOL bytes intact and counts lines.
 * <br>A lone CR, a lone LF and CRLF all terminate a line.
 */
public class LineInputStream extends FilterInputStream {

    /**
     * Carrige return byte.
     */
    private static final int CR = 13; // \r

    /**
     * Line feed byte.
     */
    private static final int LF = 10; // \n

    /**
     * Default internal read buffer size.
     */
    private static final int DEFAULT_BUFFER_SIZE = 8192;

    /**
     * Current line number.
     */
    private int lineNumber = 0;

    /**
     * Internal read buffer for bulk reads.
     */
    private final byte[] readBuffer;

    /**
     * Current position in read buffer.
     */
    private int bufferPos = 0;

    /**
     * Number of valid bytes in read buffer.
     */
    private int bufferLimit = 0;

    /**
     * Reusable line buffer to reduce allocations.
     */
    private final ByteArrayOutputStream lineBuffer = new ByteArrayOutputStream(1024);

    /**
     * Constructs a new LineInputStream instance.
     *
     * @param stream InputStream instance.
     */
    public LineInputStream(InputStream stream) {
        this(stream, DEFAULT_BUFFER_SIZE);
    }

    /**
     * Constructs a new LineInputStream instance with given read buffer size.
     *
     * @param stream InputStream instance.
     * @param size   Read buffer size.
     */
    public LineInputStream(InputStream stream, int size) {
        super(stream);
        this.readBuffer = new byte[Math.max(256, size)];
    }

    /**
     * Gets line number.
     *
     * @return Number of lines read so far.
     */
    public int getLineNumber() {
        return lineNumber;
    }

    /**
     * Read line as byte array.
     *
     * @return Byte array including EOL or null at end of stream.
     * @throws IOException Unable to read.
     */
    @SuppressWarnings("squid:S1168")
    public byte[] readLine() throws IOException {
        lineBuffer.reset();

        boolean foundCR = false;
        while (true) {
            if (bufferPos >= bufferLimit && !fill()) {
                break;
            }

            int intByte = readBuffer[bufferPos] & 0xFF;

            // Have CR but LF doesn't follow so the line ends before this byte.
            if (foundCR && intByte != LF) {
                lineNumber++;
                return lineBuffer.toByteArray();
            }

            bufferPos++;
            lineBuffer.write(intByte);

            if (intByte == LF) {
                lineNumber++;
                return lineBuffer.toByteArray();
            }

            foundCR = intByte == CR;
        }

        // Return null if nothing was read.
        if (lineBuffer.size() == 0) {
            return null;
        }

        lineNumber++;
        return lineBuffer.toByteArray();
    }

    @Override
    public int read() throws IOException {
        if (bufferPos >= bufferLimit && !fill()) {
            return -1;
        }
        return readBuffer[bufferPos++] & 0xFF;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        if (len == 0) {
            return 0;
        }
        if (bufferPos >= bufferLimit && !fill()) {
            return -1;
        }
        int count = Math.min(len, bufferLimit - bufferPos);
        System.arraycopy(readBuffer, bufferPos, b, off, count);
        bufferPos += count;
        return count;
    }

    @Override
    public boolean markSupported() {
        return false;
    }

    /**
     * Refills the internal buffer.
     *
     * @return False at end of stream.
     * @throws IOException Unable to read.
     */
    private boolean fill() throws IOException {
        bufferLimit = in.read(readBuffer, 0, readBuffer.length);
        bufferPos = 0;
        if (bufferLimit <= 0) {
            bufferLimit = 0;
            return false;
        }
        return true;
    }
}
