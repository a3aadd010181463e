package com.mypodcasts.speech;

import com.mypodcasts.exceptions.ContentDecodeException;
import com.mypodcasts.exceptions.NoRenderableContentException;
import com.mypodcasts.mime.EmailMessage;
import com.mypodcasts.mime.parts.MimePart;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Optional;

/**
 * Picks the part of a message that gets read aloud.
 *
 * <p>Walks the part tree depth-first in document order and returns the first HTML part, decoded to text.
 * <br>Decoding uses the declared charset, UTF-8 when none is declared.
 */
public class ContentSelector {
    private static final Logger log = LogManager.getLogger(ContentSelector.class);

    /**
     * Renderable markup content type.
     */
    public static final String RENDERABLE_TYPE = "text/html";

    /**
     * Selects and decodes the first renderable part.
     *
     * @param message EmailMessage instance.
     * @return Decoded HTML string.
     * @throws NoRenderableContentException If the message has no HTML part.
     * @throws ContentDecodeException       If the part cannot be decoded in its charset.
     */
    public String select(EmailMessage message) throws NoRenderableContentException, ContentDecodeException {
        Optional<MimePart> part = findFirst(message, RENDERABLE_TYPE);
        if (part.isEmpty()) {
            throw new NoRenderableContentException("No HTML part found in the email");
        }

        return decode(part.get());
    }

    /**
     * Finds the first part of the given content type.
     *
     * @param message     EmailMessage instance.
     * @param contentType Lowercase content type.
     * @return Optional of MimePart.
     */
    public Optional<MimePart> findFirst(EmailMessage message, String contentType) {
        return message.walk().stream()
                .filter(p -> !p.isContainer())
                .filter(p -> p.getContentType().equals(contentType))
                .findFirst();
    }

    /**
     * Finds the first part of the given content type and decodes it leniently.
     * <p>Malformed sequences are replaced rather than reported.
     *
     * @param message     EmailMessage instance.
     * @param contentType Lowercase content type.
     * @return Optional of decoded text.
     */
    public Optional<String> findFirstText(EmailMessage message, String contentType) {
        return findFirst(message, contentType).map(ContentSelector::decodeLenient);
    }

    /**
     * Decodes part payload strictly.
     *
     * @param part MimePart instance.
     * @return Decoded string.
     * @throws ContentDecodeException If the charset is unknown or the bytes are invalid in it.
     */
    public static String decode(MimePart part) throws ContentDecodeException {
        String charsetName = part.getCharset().orElse(StandardCharsets.UTF_8.name());

        Charset charset;
        try {
            charset = Charset.forName(charsetName);
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            throw new ContentDecodeException(charsetName, "Unsupported charset: " + charsetName, e);
        }

        try {
            return charset.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(part.getBytes()))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new ContentDecodeException(charsetName, "Payload is not valid " + charsetName + " text", e);
        }
    }

    /**
     * Decodes part payload replacing anything undecodable.
     *
     * @param part MimePart instance.
     * @return Decoded string.
     */
    public static String decodeLenient(MimePart part) {
        Charset charset = StandardCharsets.UTF_8;
        Optional<String> declared = part.getCharset();
        if (declared.isPresent()) {
            try {
                charset = Charset.forName(declared.get());
            } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
                log.warn("Unsupported charset {} on {} part, falling back to UTF-8", declared.get(), part.getContentType());
            }
        }

        return new String(part.getBytes(), charset);
    }
}
