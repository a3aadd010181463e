package com.mypodcasts.util;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayOutputStream;

/**
 * Lenient quoted-printable decoder.
 *
 * <p>Unlike a strict RFC 2045 decoder this keeps hard line breaks as they are,
 * <br>accepts LF only line endings and passes malformed escapes through literally.
 * <p>Trailing whitespace before a line break is dropped as the transport may have added it.
 */
public class QuotedPrintableDecoder {
    private static final Logger log = LogManager.getLogger(QuotedPrintableDecoder.class);

    private static final byte ESCAPE = '=';
    private static final byte CR = '\r';
    private static final byte LF = '\n';

    /**
     * Private constructor.
     */
    private QuotedPrintableDecoder() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Decodes quoted-printable bytes.
     *
     * @param bytes Encoded bytes.
     * @return Decoded bytes.
     */
    public static byte[] decode(byte[] bytes) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(bytes.length);
        int invalid = 0;

        int lineStart = 0;
        while (lineStart < bytes.length) {
            // Find end of line content and the EOL that follows it.
            int eol = lineStart;
            while (eol < bytes.length && bytes[eol] != CR && bytes[eol] != LF) {
                eol++;
            }
            int next = eol;
            if (next < bytes.length && bytes[next] == CR) {
                next++;
            }
            if (next < bytes.length && bytes[next] == LF) {
                next++;
            }

            int end = eol;
            while (end > lineStart && (bytes[end - 1] == ' ' || bytes[end - 1] == '\t')) {
                end--;
            }

            boolean softBreak = end > lineStart && bytes[end - 1] == ESCAPE;
            if (softBreak) {
                end--;
            }

            for (int i = lineStart; i < end; i++) {
                byte b = bytes[i];
                if (b == ESCAPE && i + 2 < end) {
                    int hi = Character.digit(bytes[i + 1], 16);
                    int lo = Character.digit(bytes[i + 2], 16);
                    if (hi >= 0 && lo >= 0) {
                        out.write((hi << 4) + lo);
                        i += 2;
                        continue;
                    }
                }
                if (b == ESCAPE) {
                    invalid++;
                }
                out.write(b);
            }

            if (!softBreak && next > eol) {
                out.write(bytes, eol, next - eol);
            }

            lineStart = next;
        }

        if (invalid > 0) {
            log.warn("Quoted-printable payload had {} invalid escape(s) kept literally", invalid);
        }

        return out.toByteArray();
    }
}
