package com.mypodcasts;

import com.mypodcasts.config.ProcessorConfig;
import com.mypodcasts.exceptions.EmailProcessingException;
import com.mypodcasts.exceptions.NoRenderableContentException;
import com.mypodcasts.pipeline.EpisodeDraft;
import com.mypodcasts.pipeline.HttpRedirectResolver;
import com.mypodcasts.pipeline.NewsletterPreset;
import com.mypodcasts.pipeline.Presets;
import com.mypodcasts.pipeline.SourceAdapters;
import com.mypodcasts.processor.EmailProcessor;
import com.mypodcasts.processor.ProcessedEmail;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.cli.help.HelpFormatter;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.config.Configurator;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;

/**
 * Main runnable.
 *
 * <p>Processes one newsletter email given as file, argument or standard input.
 * <p>Exit codes: 0 on success, 1 when the message has no HTML part, 2 on any other failure.
 */
public class Main {

    /**
     * Application jar name.
     */
    private static final String NAME = "mypodcasts.jar";

    /**
     * Application jar usage.
     */
    public static final String USAGE = "java -jar " + NAME;

    /**
     * Application description.
     */
    public static final String DESCRIPTION = "Newsletter email to speech-ready text processor";

    private final String[] args;
    private final InputStream in;
    private final PrintStream out;
    private final PrintStream err;

    /**
     * Main runnable.
     *
     * @param args String array.
     */
    public static void main(String[] args) {
        int status = new Main(args, System.in, System.out, System.err).run();
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Constructs a new Main instance.
     *
     * @param args String array.
     * @param in   Standard input.
     * @param out  Standard output.
     * @param err  Standard error.
     */
    Main(String[] args, InputStream in, PrintStream out, PrintStream err) {
        this.args = args;
        this.in = in;
        this.out = out;
        this.err = err;
    }

    /**
     * Runs the command.
     *
     * @return Exit status.
     */
    int run() {
        // Disable logging.
        Configurator.setAllLevels(LogManager.getRootLogger().getName(), Level.OFF);

        // Parse options.
        Options options = options();
        Optional<CommandLine> opt = parseArgs(options);
        if (opt.isEmpty()) {
            return 2;
        }

        CommandLine cmd = opt.get();
        if (cmd.hasOption("help")) {
            optionsUsage(options);
            return 0;
        }

        if (cmd.hasOption("verbose")) {
            Configurator.setAllLevels(LogManager.getRootLogger().getName(), Level.DEBUG);
        }

        try {
            ProcessorConfig config = cmd.hasOption("config")
                    ? new ProcessorConfig(Paths.get(cmd.getOptionValue("config")))
                    : new ProcessorConfig();

            EmailProcessor processor = processor(cmd);
            ProcessedEmail email = processor.parse();

            if (cmd.hasOption("json")) {
                log(email.toJson());
            }

            if (cmd.hasOption("write-text-file")) {
                Path outputDir = cmd.hasOption("output-dir") ? Paths.get(cmd.getOptionValue("output-dir")) : config.getOutputDir();
                Path path = processor.writeTextFile(outputDir);
                log("Body text saved to " + path);
            }

            if (cmd.hasOption("feed")) {
                NewsletterPreset preset = Presets.resolve(cmd.getOptionValue("feed"));
                EpisodeDraft draft = EpisodeDraft.prepare(processor, preset,
                        SourceAdapters.forFeed(preset.feedSlug(), new HttpRedirectResolver(config)));

                log("Title: " + draft.getTitle());
                log("Feed: " + draft.getFeedSlug());
                log("Key: " + draft.getObjectKey());
                log("Voice: " + draft.getTtsModel() + "/" + draft.getTtsVoice());
                log("Source: " + draft.getSourceUrl().orElse("none"));
            }

            if (!cmd.hasOption("json") && !cmd.hasOption("write-text-file")) {
                log("Processing complete. Use --json or --write-text-file to output the results.");
            }

            return 0;

        } catch (NoRenderableContentException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (EmailProcessingException | IOException e) {
            err.println("Error: " + e.getMessage());
            return 2;
        }
    }

    /**
     * Reads input into a processor.
     * <p>Files are read as text unless binary is requested or they have an <i>.eml</i> extension.
     *
     * @param cmd CommandLine instance.
     * @return EmailProcessor instance.
     * @throws IOException              Unable to read input.
     * @throws EmailProcessingException Input is not a MIME message.
     */
    private EmailProcessor processor(CommandLine cmd) throws IOException, EmailProcessingException {
        if (cmd.hasOption("input-file")) {
            Path path = Paths.get(cmd.getOptionValue("input-file"));
            if (cmd.hasOption("binary") || path.getFileName().toString().toLowerCase().endsWith(".eml")) {
                return new EmailProcessor(Files.readAllBytes(path));
            }
            return new EmailProcessor(Files.readString(path, StandardCharsets.UTF_8));
        }

        List<String> positional = cmd.getArgList();
        if (!positional.isEmpty()) {
            return new EmailProcessor(positional.get(0));
        }

        return new EmailProcessor(in.readAllBytes());
    }

    /**
     * CLI options.
     * <p>Listing order will be alphabetical.
     *
     * @return Options instance.
     */
    private Options options() {
        Options options = new Options();
        options.addOption("i", "input-file", true, "Read the email from this file");
        options.addOption("b", "binary", false, "Read the input file as raw bytes");
        options.addOption("j", "json", false, "Print the result as JSON");
        options.addOption("w", "write-text-file", false, "Write the body to <output-dir>/<date>-<subject>.txt");
        options.addOption("o", "output-dir", true, "Directory for text files (default: emails)");
        options.addOption("f", "feed", true, "Newsletter tag to prepare an episode for");
        options.addOption("c", "config", true, "Path to JSON5 configuration file");
        options.addOption("v", "verbose", false, "Enable logging");
        options.addOption("h", "help", false, "Show usage");
        return options;
    }

    /**
     * CLI usage.
     *
     * @param options CLI options.
     */
    private void optionsUsage(Options options) {
        log(USAGE + " [options] [raw_email]");
        log(" " + DESCRIPTION);
        log("");
        log("Examples:");
        log("  # Print a newsletter as JSON");
        log("  " + USAGE + " --input-file newsletter.eml --json");
        log("");
        log("  # Save the body to emails/");
        log("  " + USAGE + " --input-file newsletter.eml --write-text-file");
        log("");
        log("  # Prepare a Money Stuff episode");
        log("  " + USAGE + " --input-file newsletter.eml --feed levine");
        log("");

        // Capture System.out to get help output.
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        PrintStream ps = new PrintStream(baos, true, StandardCharsets.UTF_8);
        PrintStream oldOut = System.out;
        System.setOut(ps);

        try {
            HelpFormatter formatter = HelpFormatter.builder()
                    .setShowSince(false)
                    .get();
            formatter.printHelp(" ", "", options, "", true);
            System.out.flush();
        } catch (IOException e) {
            // Should not happen with ByteArrayOutputStream.
            throw new IllegalStateException(e);
        } finally {
            System.setOut(oldOut);
        }

        log(baos.toString(StandardCharsets.UTF_8));
    }

    /**
     * Parser for CLI arguments.
     *
     * @param options Options instance.
     * @return Optional of CommandLine.
     */
    private Optional<CommandLine> parseArgs(Options options) {
        CommandLine cmd = null;

        try {
            cmd = new DefaultParser().parse(options, args, true);
        } catch (ParseException e) {
            log("Ran into a problem: " + e.getMessage());
            log("");
            optionsUsage(options);
        }

        return Optional.ofNullable(cmd);
    }

    /**
     * Logging wrapper.
     *
     * @param string String.
     */
    void log(String string) {
        out.println(string);
    }
}
