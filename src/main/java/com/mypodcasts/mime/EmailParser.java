package com.mypodcasts.mime;

import com.mypodcasts.exceptions.MalformedMessageException;
import com.mypodcasts.mime.headers.MimeHeader;
import com.mypodcasts.mime.headers.MimeHeaders;
import com.mypodcasts.mime.io.LineInputStream;
import com.mypodcasts.mime.parts.FileMimePart;
import com.mypodcasts.mime.parts.MessageMimePart;
import com.mypodcasts.mime.parts.MimePart;
import com.mypodcasts.mime.parts.MultipartMimePart;
import com.mypodcasts.mime.parts.TextMimePart;
import com.mypodcasts.util.QuotedPrintableDecoder;
import org.apache.commons.codec.binary.Base64;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * EmailParser is a standalone MIME email parser that builds a part tree from RFC 5322 formatted messages.
 * <p>
 * This parser handles:
 * <ul>
 *     <li>Multi-line headers with proper folding support</li>
 *     <li>Single and multipart MIME messages</li>
 *     <li>Content encodings (Base64, Quoted-Printable, plain)</li>
 *     <li>Nested multipart structures and embedded messages (message/rfc822)</li>
 * </ul>
 * <p>
 * Parsing is lenient in the way mail readers are: a missing close delimiter ends the multipart at end of input
 * and a stray non-header line ends a part's header block. Only input lacking header framing altogether,
 * or a multipart without a boundary, is rejected.
 * <p>
 * Example usage:
 * <pre>
 * EmailMessage message = new EmailParser(bytes).parse();
 * String subject = message.getHeader("Subject", "No Subject");
 * </pre>
 *
 * @see EmailMessage
 * @see MimePart
 * @see LineInputStream
 */
public class EmailParser {
    private static final Logger log = LogManager.getLogger(EmailParser.class);

    /**
     * Header field line: printable ASCII name without colon, then a colon.
     */
    private static final Pattern HEADER_LINE = Pattern.compile("^[\\x21-\\x39\\x3B-\\x7E]+:");

    /**
     * Nesting limit for multipart and embedded messages.
     */
    private static final int MAX_DEPTH = 64;

    /**
     * Email input stream with line-based reading.
     */
    private final LineInputStream stream;

    /**
     * Constructs a new EmailParser instance from raw bytes.
     *
     * @param bytes Raw message bytes.
     */
    public EmailParser(byte[] bytes) {
        this(new LineInputStream(new ByteArrayInputStream(bytes)));
    }

    /**
     * Constructs a new EmailParser instance from a file path.
     *
     * @param path Path to the email file (.eml format).
     * @throws IOException If the email file cannot be opened.
     */
    public EmailParser(Path path) throws IOException {
        this(new LineInputStream(Files.newInputStream(path)));
    }

    /**
     * Constructs a new EmailParser instance from an existing LineInputStream.
     * <p>The stream is closed once parsing completes.
     *
     * @param stream LineInputStream for reading email content.
     */
    public EmailParser(LineInputStream stream) {
        this.stream = stream;
    }

    /**
     * Parses the complete message.
     * <p>Parsing is a single-pass operation; the stream is closed afterwards.
     *
     * @return EmailMessage instance.
     * @throws IOException               If reading the stream fails.
     * @throws MalformedMessageException If the input has no header framing.
     */
    public EmailMessage parse() throws IOException, MalformedMessageException {
        List<byte[]> lines;
        try (InputStream ignored = stream) {
            lines = readLines(stream);
        }

        int start = 0;
        if (!lines.isEmpty() && ascii(lines.get(0)).startsWith("From ")) {
            // mbox envelope line.
            start = 1;
        }

        if (start >= lines.size() || StringUtils.isBlank(ascii(lines.get(start)))) {
            throw new MalformedMessageException("Message is empty or has no header block");
        }

        if (!HEADER_LINE.matcher(ascii(lines.get(start))).find()) {
            throw new MalformedMessageException("Message does not start with a header field on line " + (start + 1));
        }

        MimePart root = parseEntity(lines.subList(start, lines.size()), "text/plain", 0);
        EmailMessage message = new EmailMessage(root);
        log.debug("Parsed message of {} lines into {} parts with root {}", lines.size(), message.walk().size(), root.getContentType());

        return message;
    }

    /**
     * Parses one entity: its header block then its body according to content type.
     *
     * @param lines       Entity lines including EOLs.
     * @param defaultType Content type used when none is declared.
     * @param depth       Current nesting depth.
     * @return MimePart instance.
     * @throws MalformedMessageException If a multipart has no boundary or nesting is too deep.
     */
    private MimePart parseEntity(List<byte[]> lines, String defaultType, int depth) throws MalformedMessageException {
        if (depth > MAX_DEPTH) {
            throw new MalformedMessageException("MIME nesting deeper than " + MAX_DEPTH + " levels");
        }

        MimeHeaders headers = new MimeHeaders();
        int pos = parseHeaders(lines, headers);
        List<byte[]> body = lines.subList(pos, lines.size());

        Optional<MimeHeader> contentTypeHeader = headers.get("Content-Type");
        String contentType = contentTypeHeader
                .map(MimeHeader::getCleanValue)
                .filter(t -> t.matches("[^/\\s]+/[^/\\s]+"))
                .orElse(contentTypeHeader.isPresent() ? "text/plain" : defaultType);

        if (contentType.startsWith("multipart/")) {
            String boundary = contentTypeHeader.map(h -> h.getParameter("boundary")).orElse(null);
            if (StringUtils.isEmpty(boundary)) {
                throw new MalformedMessageException(contentType + " entity declares no boundary");
            }

            String childDefault = contentType.equals("multipart/digest") ? "message/rfc822" : "text/plain";
            List<MimePart> parts = new ArrayList<>();
            for (List<byte[]> partLines : splitParts(body, boundary)) {
                parts.add(parseEntity(partLines, childDefault, depth + 1));
            }

            return new MultipartMimePart(headers, contentType, parts);
        }

        byte[] content = decodeTransfer(headers, join(body));

        if (contentType.equals("message/rfc822")) {
            List<byte[]> embedded = splitLines(content);
            MimePart root = parseEntity(embedded, "text/plain", depth + 1);
            return new MessageMimePart(headers, contentType, root);
        }

        if (contentType.startsWith("text/")) {
            return new TextMimePart(headers, contentType, content);
        }

        return new FileMimePart(headers, contentType, content);
    }

    /**
     * Parses a header block into the given container.
     * <p>Continuation lines starting with whitespace are unfolded into the previous header.
     * <br>The block ends at the first blank line, which is consumed, or at the first line that is not a header.
     *
     * @param lines   Entity lines.
     * @param headers Container to fill.
     * @return Index of the first body line.
     */
    private int parseHeaders(List<byte[]> lines, MimeHeaders headers) {
        StringBuilder header = new StringBuilder();
        int pos = 0;

        while (pos < lines.size()) {
            byte[] bytes = lines.get(pos);
            String line = new String(bytes, StandardCharsets.UTF_8);

            // Break if found end of headers.
            if (StringUtils.isBlank(line)) {
                pos++;
                break;
            }

            boolean continuation = bytes[0] == ' ' || bytes[0] == '\t';
            if (continuation && header.length() > 0) {
                header.append(line);
                pos++;
                continue;
            }

            if (!HEADER_LINE.matcher(line).find()) {
                log.debug("Header block ended by non-header line {}", pos + 1);
                break;
            }

            if (header.length() > 0) {
                headers.put(new MimeHeader(header.toString()));
                header = new StringBuilder();
            }
            header.append(line);
            pos++;
        }

        // Last header.
        if (header.length() > 0) {
            headers.put(new MimeHeader(header.toString()));
        }

        return pos;
    }

    /**
     * Splits a multipart body on its delimiter lines.
     * <p>Preamble and epilogue are dropped. The EOL preceding a delimiter belongs to the delimiter.
     *
     * @param body     Multipart body lines.
     * @param boundary Boundary parameter.
     * @return List of body part line lists.
     */
    private List<List<byte[]>> splitParts(List<byte[]> body, String boundary) {
        String delimiter = "--" + boundary;
        String closeDelimiter = delimiter + "--";

        List<List<byte[]>> parts = new ArrayList<>();
        List<byte[]> current = null;
        boolean closed = false;

        for (byte[] bytes : body) {
            String line = StringUtils.stripEnd(ascii(bytes), " \t\r\n");

            if (line.equals(closeDelimiter)) {
                closed = true;
                break;
            }

            if (line.equals(delimiter)) {
                if (current != null) {
                    parts.add(stripFinalEol(current));
                }
                current = new ArrayList<>();
                continue;
            }

            if (current != null) {
                current.add(bytes);
            }
        }

        if (current != null) {
            parts.add(closed ? stripFinalEol(current) : current);
        }

        if (!closed) {
            log.debug("Multipart boundary {} was never closed", boundary);
        }

        return parts;
    }

    /**
     * Decodes Content-Transfer-Encoding.
     *
     * @param headers Entity headers.
     * @param bytes   Raw body bytes.
     * @return Decoded bytes.
     */
    private byte[] decodeTransfer(MimeHeaders headers, byte[] bytes) {
        String encoding = headers.get("Content-Transfer-Encoding")
                .map(MimeHeader::getCleanValue)
                .orElse("7bit");

        switch (encoding) {
            case "base64":
                return Base64.decodeBase64(bytes);

            case "quoted-printable":
                return QuotedPrintableDecoder.decode(bytes);

            default:
                return bytes;
        }
    }

    /**
     * Reads all lines from the stream.
     *
     * @param stream LineInputStream instance.
     * @return List of lines including EOLs.
     * @throws IOException If reading fails.
     */
    private static List<byte[]> readLines(LineInputStream stream) throws IOException {
        List<byte[]> lines = new ArrayList<>();
        byte[] bytes;
        while ((bytes = stream.readLine()) != null) {
            lines.add(bytes);
        }
        return lines;
    }

    /**
     * Splits bytes into lines including EOLs.
     *
     * @param bytes Byte array.
     * @return List of lines.
     */
    private static List<byte[]> splitLines(byte[] bytes) {
        try (LineInputStream in = new LineInputStream(new ByteArrayInputStream(bytes))) {
            return readLines(in);
        } catch (IOException e) {
            // Byte array streams do not fail.
            throw new IllegalStateException(e);
        }
    }

    /**
     * Joins lines into a single byte array.
     *
     * @param lines List of lines.
     * @return Byte array.
     */
    private static byte[] join(List<byte[]> lines) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (byte[] line : lines) {
            out.write(line, 0, line.length);
        }
        return out.toByteArray();
    }

    /**
     * Removes the EOL of the last line.
     *
     * @param lines List of lines.
     * @return Same list.
     */
    private static List<byte[]> stripFinalEol(List<byte[]> lines) {
        if (!lines.isEmpty()) {
            byte[] last = lines.get(lines.size() - 1);
            int end = last.length;
            if (end > 0 && last[end - 1] == '\n') {
                end--;
            }
            if (end > 0 && last[end - 1] == '\r') {
                end--;
            }
            if (end == 0) {
                lines.remove(lines.size() - 1);
            } else if (end < last.length) {
                byte[] trimmed = new byte[end];
                System.arraycopy(last, 0, trimmed, 0, end);
                lines.set(lines.size() - 1, trimmed);
            }
        }
        return lines;
    }

    /**
     * Byte line as ISO-8859-1 string for structural matching.
     *
     * @param bytes Line bytes.
     * @return String.
     */
    private static String ascii(byte[] bytes) {
        return new String(bytes, StandardCharsets.ISO_8859_1);
    }
}
