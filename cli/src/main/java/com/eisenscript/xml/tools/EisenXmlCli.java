package com.eisenscript.xml.tools;

import com.eisenscript.xml.EisenScriptTranslator;
import com.eisenscript.xml.TranslationException;
import com.eisenscript.xml.TranslationMessage;
import com.eisenscript.xml.TranslationResult;
import com.eisenscript.xml.Version;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Command-line translator from EisenScript to EisenXML.
 *
 * <pre>
 * EisenXmlCli &lt;file.es&gt; [outputDir]     writes file.es.xml beside the source or into outputDir
 * EisenXmlCli &lt;directory&gt; [outputDir]   translates every *.es file, into xml_translate by default
 * </pre>
 */
public final class EisenXmlCli {
    static final String USAGE = "Usage: EisenXmlCli <file.es|directory> [outputDir]";
    static final String DEFAULT_BATCH_DIR = "xml_translate";

    private final EisenScriptTranslator translator = new EisenScriptTranslator();
    private final PrintStream out;
    private final PrintStream err;

    EisenXmlCli(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        int status = new EisenXmlCli(System.out, System.err).run(args);
        if (status != 0) {
            System.exit(status);
        }
    }

    /** Returns the process exit status: 0 on success, on usage errors and on rejected scripts; 1 on I/O failure. */
    int run(String[] args) {
        if (args.length == 0 || args.length > 2) {
            out.println(USAGE);
            out.println("EisenXML " + Version.RUNTIME);
            return 0;
        }
        Path source = Path.of(args[0]);
        Path outputDir = args.length > 1 ? Path.of(args[1]) : null;
        try {
            if (Files.isDirectory(source)) {
                return translateBatch(source, outputDir != null ? outputDir : Path.of(DEFAULT_BATCH_DIR));
            }
            TranslationResult result = translator.translate(source, outputDir);
            printWarnings(result.getMessages());
            out.println("Wrote " + result.getOutputPath());
            return 0;
        } catch (TranslationException ex) {
            if (ex.isGrammarError()) {
                err.println("Unable to parse EisenScript: " + ex.getCause().getMessage());
                return 0;
            }
            err.println(ex.getMessage());
            return 1;
        }
    }

    private int translateBatch(Path sourceDir, Path outputDir) throws TranslationException {
        List<TranslationResult> results = translator.translateDirectory(sourceDir, outputDir);
        int failures = 0;
        for (TranslationResult result : results) {
            out.println(result.getSourcePath());
            if (!result.isSuccess()) {
                failures++;
                out.println("failed");
                for (TranslationMessage message : result.getMessages()) {
                    err.println("  " + message.getMessage());
                }
            }
        }
        out.println("Translated " + (results.size() - failures) + " of " + results.size() + " files into " + outputDir);
        return 0;
    }

    private void printWarnings(List<TranslationMessage> messages) {
        for (TranslationMessage message : messages) {
            if (message.getLevel() == TranslationMessage.Level.WARNING) {
                err.println("warning: " + message.getMessage());
            } else if (message.getLevel() == TranslationMessage.Level.INFO && message.getMessage().startsWith("[")) {
                err.println(message.getMessage());
            }
        }
    }
}
