package com.example.embedstore;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Command-line front end. Runs one command per invocation:
 * <pre>
 *   store &lt;key&gt; &lt;text&gt;
 *   get &lt;key&gt;
 *   search &lt;query&gt; [--limit=N] [--min-similarity=X]
 *   import &lt;jsonl-file&gt;
 * </pre>
 * Without a command it does nothing, so the context can start for other uses.
 * Disable with {@code store.cli.enabled=false}.
 */
@Component
@ConditionalOnProperty(name = "store.cli.enabled", havingValue = "true", matchIfMissing = true)
public class StoreCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(StoreCommandRunner.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE = String.join("\n",
            "Usage:",
            "  store <key> <text>",
            "  get <key>",
            "  search <query> [--limit=N] [--min-similarity=X]",
            "  import <jsonl-file>");

    private final StorageEngine engine;
    private final double defaultMinSimilarity;
    private final PrintStream out;
    private final PrintStream err;
    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private int exitCode = EXIT_OK;

    @Autowired
    public StoreCommandRunner(StorageEngine engine, Environment env) {
        this(engine, env.getProperty("search.min-similarity", Double.class, 0.0), System.out, System.err);
    }

    StoreCommandRunner(StorageEngine engine, double defaultMinSimilarity, PrintStream out, PrintStream err) {
        this.engine = engine;
        this.defaultMinSimilarity = defaultMinSimilarity;
        this.out = out;
        this.err = err;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> params = args.getNonOptionArgs();
        if (params.isEmpty()) {
            log.debug("No command given; nothing to do");
            return;
        }
        String command = params.get(0).toLowerCase(Locale.ROOT);
        List<String> rest = params.subList(1, params.size());
        try {
            switch (command) {
                case "store":
                    exitCode = store(rest);
                    break;
                case "get":
                    exitCode = get(rest);
                    break;
                case "search":
                    exitCode = search(rest, args);
                    break;
                case "import":
                    exitCode = importJsonLines(rest);
                    break;
                default:
                    err.println("Unknown command: " + command);
                    exitCode = usage();
            }
        } catch (IllegalArgumentException | EmbeddingStoreException | IOException e) {
            log.debug("Command {} failed", command, e);
            err.println("Error: " + e.getMessage());
            exitCode = EXIT_FAILED;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private int store(List<String> params) throws IOException {
        if (params.size() != 2) return usage();
        String key = params.get(0);
        engine.store(key, params.get(1));
        out.println("Stored embedding for key: " + key);
        return EXIT_OK;
    }

    private int get(List<String> params) throws IOException {
        if (params.size() != 1) return usage();
        String key = params.get(0);
        Optional<StoredEntry> entry = engine.get(key);
        if (entry.isEmpty()) {
            out.println("Key \"" + key + "\" not found");
            return EXIT_FAILED;
        }
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("key", entry.get().getKey());
        doc.put("text", entry.get().getText());
        doc.put("embeddingDimensions", entry.get().getEmbedding().length);
        doc.put("timestamp", Instant.ofEpochMilli(entry.get().getTimestamp()).toString());
        out.println(mapper.writeValueAsString(doc));
        return EXIT_OK;
    }

    private int search(List<String> params, ApplicationArguments args) throws IOException {
        if (params.size() != 1) return usage();
        int limit = intOption(args, "limit", StorageEngine.DEFAULT_SEARCH_LIMIT);
        double minSimilarity = doubleOption(args, "min-similarity", defaultMinSimilarity);

        List<SearchResult> results = engine.search(params.get(0), limit, minSimilarity);
        if (results.isEmpty()) {
            out.println("No results found");
            return EXIT_OK;
        }
        out.println("Found " + results.size() + " result(s):");
        out.println();
        for (SearchResult r : results) {
            out.println(String.format(Locale.ROOT, "[%.4f] %s", r.getSimilarity(), r.getKey()));
        }
        return EXIT_OK;
    }

    private int importJsonLines(List<String> params) throws IOException {
        if (params.size() != 1) return usage();
        int imported = engine.importJsonLines(Path.of(params.get(0)));
        out.println("Imported " + imported + " entries");
        return EXIT_OK;
    }

    private int usage() {
        err.println(USAGE);
        return EXIT_USAGE;
    }

    private static int intOption(ApplicationArguments args, String name, int defaultValue) {
        String v = lastOption(args, name);
        if (v == null) return defaultValue;
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + name + " expects an integer, got " + v, e);
        }
    }

    private static double doubleOption(ApplicationArguments args, String name, double defaultValue) {
        String v = lastOption(args, name);
        if (v == null) return defaultValue;
        try {
            return Double.parseDouble(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + name + " expects a number, got " + v, e);
        }
    }

    private static String lastOption(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? null : values.get(values.size() - 1);
    }
}
