package org.calista.formalizer.search;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.formalizer.core.CollaboratorException;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Search through a local LeanSearch installation: runs {@code <command...> <query>} in
 * {@code workingDir} and reads the LeanSearch result JSON from stdout. A non-zero exit,
 * a timeout or a missing executable count as the collaborator being unavailable.
 */
public final class LocalSearchClient implements SearchClient {

    private static final Logger log = LogManager.getLogger(LocalSearchClient.class);
    private static final String NAME = "local-search";

    private final List<String> command;
    private final Path workingDir;
    private final ObjectMapper mapper;
    private final Duration timeout;

    public LocalSearchClient(List<String> command, Path workingDir, ObjectMapper mapper, Duration timeout) {
        Objects.requireNonNull(command, "command");
        if (command.isEmpty()) throw new IllegalArgumentException("local search command is empty");
        this.command = List.copyOf(command);
        this.workingDir = Objects.requireNonNull(workingDir, "workingDir").toAbsolutePath().normalize();
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    @Override
    public List<SearchHit> search(String query, int limit) throws CollaboratorException {
        if (query == null || query.isBlank() || limit <= 0) return List.of();

        List<String> cmd = new ArrayList<>(command);
        cmd.add(query);
        Process p;
        try {
            p = new ProcessBuilder(cmd).directory(workingDir.toFile()).start();
            p.getOutputStream().close();
        } catch (IOException e) {
            throw CollaboratorException.unavailable(NAME, "cannot start " + cmd.get(0), e);
        }

        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> readAll(p.getInputStream()));
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> readAll(p.getErrorStream()));
        String out;
        try {
            if (!p.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                p.destroyForcibly();
                throw CollaboratorException.unavailable(NAME, "timed out after " + timeout.toSeconds() + "s", null);
            }
            out = stdout.get(5, TimeUnit.SECONDS);
            String err = stderr.get(5, TimeUnit.SECONDS);
            if (!err.isBlank()) log.debug("local search stderr: {}", err.strip());
            if (p.exitValue() != 0) {
                throw CollaboratorException.unavailable(NAME, "exit code " + p.exitValue(), null);
            }
        } catch (InterruptedException e) {
            p.destroyForcibly();
            Thread.currentThread().interrupt();
            throw CollaboratorException.unavailable(NAME, "interrupted", e);
        } catch (ExecutionException | TimeoutException e) {
            throw CollaboratorException.unavailable(NAME, "cannot read search output", e);
        }

        List<SearchHit> hits = SearchResponses.parse(mapper, NAME, out.strip());
        log.debug("local search '{}' -> {} hits", query, hits.size());
        return hits.size() > limit ? List.copyOf(hits.subList(0, limit)) : hits;
    }

    private static String readAll(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
