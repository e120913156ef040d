package org.calista.formalizer;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.formalizer.core.FormalizerComposer;
import org.calista.formalizer.core.FormalizerKernel;
import org.calista.formalizer.pipeline.BatchRunner;
import org.calista.formalizer.pipeline.FormalizationPipeline;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * FormalizerApp — batch runner.
 *
 * <pre>
 * --config &lt;file&gt;      config JSON, created with defaults when missing (config/formalizer.json)
 * --input &lt;jsonl&gt;      problem set (required)
 * --output-dir &lt;dir&gt;   results (default &lt;baseDir&gt;/&lt;artifact.outputDir&gt;/&lt;timestamp&gt;)
 * --limit &lt;n&gt;          first n problems only
 * </pre>
 *
 * Lifecycle: build kernel, load verified knowledge, compose pipeline, run, close pipeline.
 */
public final class FormalizerApp {

    private static final Logger log = LogManager.getLogger(FormalizerApp.class);

    private Path cfgPath = Path.of("config/formalizer.json");
    private Path input;
    private Path outputDir;
    private int limit = -1;

    public static void main(String[] args) throws Exception {
        FormalizerApp app;
        try {
            app = parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println("usage: FormalizerApp --input <jsonl> [--config <file>] [--output-dir <dir>] [--limit <n>]");
            System.exit(2);
            return;
        }
        BatchRunner.Summary s = app.run();
        System.exit(s.total > 0 && s.errors == s.total ? 1 : 0);
    }

    static FormalizerApp parse(String[] args) {
        FormalizerApp app = new FormalizerApp();
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            switch (a) {
                case "--config":
                    app.cfgPath = Path.of(value(args, ++i, a));
                    break;
                case "--input":
                    app.input = Path.of(value(args, ++i, a));
                    break;
                case "--output-dir":
                case "--output_dir":
                    app.outputDir = Path.of(value(args, ++i, a));
                    break;
                case "--limit":
                    try {
                        app.limit = Integer.parseInt(value(args, ++i, a));
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("--limit expects a number: " + args[i]);
                    }
                    break;
                default:
                    throw new IllegalArgumentException("unknown argument: " + a);
            }
        }
        if (app.input == null) throw new IllegalArgumentException("--input is required");
        return app;
    }

    private static String value(String[] args, int i, String flag) {
        if (i >= args.length) throw new IllegalArgumentException(flag + " expects a value");
        return args[i];
    }

    public BatchRunner.Summary run() throws IOException {
        FormalizerKernel kernel = FormalizerKernel.builder().root(Path.of(".")).build(cfgPath);
        kernel.loadKnowledge();

        Path out = outputDir != null
                ? outputDir.toAbsolutePath().normalize()
                : kernel.io().resolve(kernel.config().artifact.outputDir)
                        .resolve(LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss")));

        try (FormalizationPipeline pipeline = new FormalizerComposer(kernel).buildPipeline()) {
            BatchRunner.Summary s = new BatchRunner(kernel.io(), kernel.mapper(), pipeline)
                    .run(input.toAbsolutePath().normalize(), out, limit);
            log.info("Batch finished: {}. Results in {}", s, out);
            return s;
        }
    }

    Path cfgPath() { return cfgPath; }
    Path input() { return input; }
    Path outputDir() { return outputDir; }
    int limit() { return limit; }
}
