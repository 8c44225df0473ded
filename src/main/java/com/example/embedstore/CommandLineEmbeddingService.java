package com.example.embedstore;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Lazy;
import org.springframework.core.env.Environment;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * EmbeddingService that shells out to a configured command (default: `ollama`).
 * The whole batch goes through one process: texts are written to stdin one per
 * line and each non-empty output line is parsed as one vector, either a JSON
 * array of floats or whitespace/comma separated floats.
 */
@Lazy
@Service
@ConditionalOnProperty(prefix = "embedding", name = "cli.enabled", havingValue = "true")
public class CommandLineEmbeddingService implements EmbeddingService {

    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(CommandLineEmbeddingService.class);

    private final String command;
    private final String model;
    private final long timeoutSeconds;
    private final ProcessRunner runner;
    private final CustomizableThreadFactory ioThreads = new CustomizableThreadFactory("embedding-io-");

    @Autowired
    public CommandLineEmbeddingService(Environment env, ProcessRunner runner) {
        this.command = env.getProperty("embedding.command", "ollama");
        this.model = env.getProperty("embedding.model", "nomic-embed-text");
        this.timeoutSeconds = env.getProperty("embedding.timeout-seconds", Long.class, 120L);
        this.runner = runner;
        this.ioThreads.setDaemon(true);
    }

    @Override
    public List<float[]> embed(List<String> texts) {
        if (texts.isEmpty()) return new ArrayList<>();

        List<String> cmd = new ArrayList<>();
        cmd.add(command);
        cmd.add("embed");
        cmd.add(model);
        log.debug("Running embedding command: {} [texts={}]", String.join(" ", cmd), texts.size());

        ExecutorService io = Executors.newFixedThreadPool(3, ioThreads);
        Process p = null;
        try {
            Process process = runner.start(cmd);
            p = process;
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(timeoutSeconds);

            // all three pipes are drained concurrently
            Future<?> input = io.submit(() -> {
                writeInput(process, texts);
                return null;
            });
            Future<List<String>> output = io.submit(() -> readLines(process.getInputStream()));
            Future<List<String>> errors = io.submit(() -> readLines(process.getErrorStream()));

            if (!process.waitFor(remaining(deadline), TimeUnit.NANOSECONDS)) {
                throw timeout(process);
            }
            input.get(remaining(deadline), TimeUnit.NANOSECONDS);
            List<String> lines = output.get(remaining(deadline), TimeUnit.NANOSECONDS);
            List<String> errorLines = errors.get(remaining(deadline), TimeUnit.NANOSECONDS);

            int exit = process.exitValue();
            if (exit != 0) {
                throw new EmbeddingProviderException("Embedding command exited with code " + exit + ": "
                        + String.join("\n", errorLines).trim());
            }

            List<float[]> vectors = new ArrayList<>(lines.size());
            for (String line : lines) {
                if (!line.isBlank()) vectors.add(VectorUtils.parseFloats(line));
            }
            log.debug("Embedding command returned {} vectors", vectors.size());
            return vectors;
        } catch (TimeoutException e) {
            throw timeout(p);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            throw new EmbeddingProviderException("Embedding command failed: " + cause.getMessage(), cause);
        } catch (IOException e) {
            throw new EmbeddingProviderException("Embedding command failed: " + e.getMessage(), e);
        } catch (NumberFormatException e) {
            throw new EmbeddingProviderException("Unparsable embedding output: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (p != null) p.destroyForcibly();
            throw new EmbeddingProviderException("Interrupted while waiting for embedding command", e);
        } finally {
            io.shutdownNow();
        }
    }

    private EmbeddingProviderException timeout(Process p) {
        p.destroyForcibly();
        return new EmbeddingProviderException("Embedding command timed out after " + timeoutSeconds + "s");
    }

    private static long remaining(long deadline) {
        return Math.max(0L, deadline - System.nanoTime());
    }

    private static void writeInput(Process p, List<String> texts) throws IOException {
        try (OutputStream os = p.getOutputStream()) {
            for (String text : texts) {
                // one text per line; embedded newlines would split a text in two
                os.write(text.replace('\r', ' ').replace('\n', ' ').getBytes(StandardCharsets.UTF_8));
                os.write('\n');
            }
            os.flush();
        }
    }

    private static List<String> readLines(InputStream in) throws IOException {
        List<String> lines = new ArrayList<>();
        try (BufferedReader r = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String l;
            while ((l = r.readLine()) != null) {
                lines.add(l);
            }
        }
        return lines;
    }
}
