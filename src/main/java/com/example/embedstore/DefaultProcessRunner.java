package com.example.embedstore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.util.List;

/**
 * Starts embedding commands as OS processes, optionally inside {@code embedding.working-dir}.
 */
@Component
public class DefaultProcessRunner implements ProcessRunner {

    private static final Logger log = LoggerFactory.getLogger(DefaultProcessRunner.class);

    private final File workingDirectory;

    @Autowired
    public DefaultProcessRunner(Environment env) {
        this(env.getProperty("embedding.working-dir"));
    }

    DefaultProcessRunner(String workingDirectory) {
        this.workingDirectory = workingDirectory == null || workingDirectory.isBlank() ? null : new File(workingDirectory);
    }

    @Override
    public Process start(List<String> command) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(command);
        if (workingDirectory != null) {
            if (!workingDirectory.isDirectory()) {
                throw new IOException("Embedding working directory does not exist: " + workingDirectory);
            }
            pb.directory(workingDirectory);
        }
        log.debug("Starting process {}", command.get(0));
        return pb.start();
    }
}
