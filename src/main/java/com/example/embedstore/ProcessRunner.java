package com.example.embedstore;

import java.io.IOException;
import java.util.List;

/**
 * Seam between the command-line embedding provider and the OS, replaced by a canned process in tests.
 */
public interface ProcessRunner {
    Process start(List<String> command) throws IOException;
}
