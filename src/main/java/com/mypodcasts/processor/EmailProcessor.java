package com.mypodcasts.processor;

import com.mypodcasts.exceptions.ContentDecodeException;
import com.mypodcasts.exceptions.DanglingFootnoteException;
import com.mypodcasts.exceptions.MalformedMessageException;
import com.mypodcasts.exceptions.NoRenderableContentException;
import com.mypodcasts.metadata.EmailMetadata;
import com.mypodcasts.metadata.MetadataExtractor;
import com.mypodcasts.mime.EmailMessage;
import com.mypodcasts.mime.EmailParser;
import com.mypodcasts.speech.ContentSelector;
import com.mypodcasts.speech.FootnoteInliner;
import com.mypodcasts.speech.StructuralCleaner;
import com.mypodcasts.speech.WhitespaceNormalizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Email processor.
 *
 * <p>Parses a raw newsletter once and turns it into a {@link ProcessedEmail}:
 * <pre>
 * ProcessedEmail email = new EmailProcessor(bytes).parse();
 * </pre>
 * <p>Processing runs content selection, structural cleaning, whitespace normalization and footnote inlining
 * on the body while the metadata is taken from the headers.
 * It keeps no state between calls so repeated calls yield equal records.
 */
public class EmailProcessor {
    private static final Logger log = LogManager.getLogger(EmailProcessor.class);

    /**
     * Default directory for text files.
     */
    public static final Path DEFAULT_OUTPUT_DIR = Paths.get("emails");

    /**
     * Parsed message.
     */
    private final EmailMessage message;

    private final ContentSelector selector = new ContentSelector();
    private final StructuralCleaner cleaner = new StructuralCleaner();
    private final WhitespaceNormalizer normalizer = new WhitespaceNormalizer();
    private final FootnoteInliner inliner = new FootnoteInliner();
    private final MetadataExtractor extractor = new MetadataExtractor();

    /**
     * Constructs a new EmailProcessor instance from raw bytes.
     *
     * @param bytes Raw message bytes.
     * @throws IOException               Unable to read input.
     * @throws MalformedMessageException Input is not a MIME message.
     */
    public EmailProcessor(byte[] bytes) throws IOException, MalformedMessageException {
        this.message = new EmailParser(bytes).parse();
    }

    /**
     * Constructs a new EmailProcessor instance from message text.
     * <p>The text is encoded as UTF-8 before parsing.
     *
     * @param text Raw message string.
     * @throws IOException               Unable to read input.
     * @throws MalformedMessageException Input is not a MIME message.
     */
    public EmailProcessor(String text) throws IOException, MalformedMessageException {
        this(text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Gets parsed message.
     *
     * @return EmailMessage instance.
     */
    public EmailMessage getMessage() {
        return message;
    }

    /**
     * Processes the message.
     *
     * @return ProcessedEmail instance.
     * @throws NoRenderableContentException No HTML part.
     * @throws ContentDecodeException       HTML part cannot be decoded with its charset.
     * @throws DanglingFootnoteException    Footnote pointer without definition.
     */
    public ProcessedEmail parse() throws NoRenderableContentException, ContentDecodeException, DanglingFootnoteException {
        EmailMetadata metadata = extractor.extract(message);

        String html = selector.select(message);
        String text = normalizer.normalize(cleaner.cleanToText(html));
        String body = inliner.inline(text);

        ProcessedEmail email = new ProcessedEmail(metadata.date(), metadata.subjectSlug(), metadata.subjectRaw(), body);
        log.debug("Processed {}", email);

        return email;
    }

    /**
     * Writes the body to the default directory.
     *
     * @return Written file path.
     * @throws IOException                  Unable to write file.
     * @throws NoRenderableContentException No HTML part.
     * @throws ContentDecodeException       HTML part cannot be decoded with its charset.
     * @throws DanglingFootnoteException    Footnote pointer without definition.
     */
    public Path writeTextFile() throws IOException, NoRenderableContentException, ContentDecodeException, DanglingFootnoteException {
        return writeTextFile(DEFAULT_OUTPUT_DIR);
    }

    /**
     * Writes the body to <i>outputDir/date-slug.txt</i> as UTF-8.
     * <p>The directory is created if missing and an existing file is replaced.
     *
     * @param outputDir Output directory.
     * @return Written file path.
     * @throws IOException                  Unable to write file.
     * @throws NoRenderableContentException No HTML part.
     * @throws ContentDecodeException       HTML part cannot be decoded with its charset.
     * @throws DanglingFootnoteException    Footnote pointer without definition.
     */
    public Path writeTextFile(Path outputDir) throws IOException, NoRenderableContentException, ContentDecodeException, DanglingFootnoteException {
        ProcessedEmail email = parse();

        Files.createDirectories(outputDir);
        Path path = outputDir.resolve(email.getStem() + ".txt");
        Files.writeString(path, email.getBody(), StandardCharsets.UTF_8);
        log.info("Body text saved to {}", path);

        return path;
    }
}
