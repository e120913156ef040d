package org.calista.formalizer.compiler;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.formalizer.core.CollaboratorException;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Compiler-in-the-loop through {@code lake env lean src/Scratch_<requestId>.lean} inside a
 * Lake sandbox. The scratch file is private to the request and deleted afterwards.
 */
public final class LeanCompilerClient implements CompilerClient {

    private static final Logger log = LogManager.getLogger(LeanCompilerClient.class);
    private static final String NAME = "compiler";

    private static final String[] NOISE_PREFIXES = {
            "ELAN=", "LAKE=", "LEAN=", "PATH=", "DYLD_LIBRARY_PATH=", "LD_LIBRARY_PATH=",
            "info:", "Build", "Compiling", "Linking", "trace:"
    };

    private final Path sandboxDir;
    private final String lakeExecutable;
    private final String leanExecutable;
    private final Duration timeout;

    public LeanCompilerClient(Path sandboxDir, String lakeExecutable, String leanExecutable, Duration timeout) {
        this.sandboxDir = Objects.requireNonNull(sandboxDir, "sandboxDir").toAbsolutePath().normalize();
        this.lakeExecutable = Objects.requireNonNull(lakeExecutable, "lakeExecutable");
        this.leanExecutable = Objects.requireNonNull(leanExecutable, "leanExecutable");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        if (!Files.isRegularFile(this.sandboxDir.resolve("lakefile.lean"))
                && !Files.isRegularFile(this.sandboxDir.resolve("lakefile.toml"))) {
            log.warn("Lean sandbox {} has no lakefile; compilation will likely fail", this.sandboxDir);
        }
    }

    @Override
    public CompilationResult check(CompilationUnit unit, String requestId) throws CollaboratorException {
        String fileName = "Scratch_" + sanitize(requestId) + ".lean";
        Path srcDir = sandboxDir.resolve("src");
        Path scratch = srcDir.resolve(fileName);

        try {
            Files.createDirectories(srcDir);
            Files.writeString(scratch, unit.render(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw CollaboratorException.unavailable(NAME, "cannot write scratch unit " + scratch, e);
        }

        try {
            return run(List.of(lakeExecutable, "env", leanExecutable, "src/" + fileName), fileName);
        } finally {
            try {
                Files.deleteIfExists(scratch);
            } catch (IOException e) {
                log.warn("Cannot delete scratch unit {}: {}", scratch, e.toString());
            }
        }
    }

    private CompilationResult run(List<String> command, String fileName) throws CollaboratorException {
        Process p;
        try {
            p = new ProcessBuilder(command)
                    .directory(sandboxDir.toFile())
                    .redirectErrorStream(true)
                    .redirectInput(ProcessBuilder.Redirect.from(nullDevice()))
                    .start();
        } catch (IOException e) {
            throw CollaboratorException.unavailable(NAME, "cannot start " + command.get(0), e);
        }

        CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> readAll(p.getInputStream()));
        try {
            if (!p.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                p.destroyForcibly();
                return CompilationResult.failure("compilation timed out after " + timeout.toSeconds() + "s");
            }
            String out = output.get(5, TimeUnit.SECONDS);
            if (p.exitValue() == 0) return CompilationResult.success();
            return CompilationResult.failure(parseDiagnostics(out, fileName));
        } catch (InterruptedException e) {
            p.destroyForcibly();
            Thread.currentThread().interrupt();
            throw CollaboratorException.unavailable(NAME, "interrupted", e);
        } catch (ExecutionException | TimeoutException e) {
            throw CollaboratorException.unavailable(NAME, "cannot read compiler output", e);
        }
    }

    /**
     * Keeps the messages that belong to the scratch file ({@code src/Scratch_x.lean:L:C: error: ...}
     * plus continuation lines). Falls back to the first 15 non-noise lines.
     */
    static List<Diagnostic> parseDiagnostics(String raw, String fileName) {
        if (raw == null || raw.isBlank()) return List.of(Diagnostic.of("unknown compilation error"));

        Pattern located = Pattern.compile("^(?:.*[/\\\\])?" + Pattern.quote(fileName) + ":(\\d+):(\\d+):\\s*(error|warning):\\s*(.*)$");

        ArrayList<Diagnostic> out = new ArrayList<>();
        String[] lines = raw.split("\\R");
        int line = 0, col = 0;
        StringBuilder msg = null;

        for (String l : lines) {
            String t = l.strip();
            Matcher m = located.matcher(t);
            if (m.matches()) {
                if (msg != null) out.add(new Diagnostic(msg.toString().trim(), line, col));
                msg = null;
                if ("error".equals(m.group(3))) {
                    line = Integer.parseInt(m.group(1));
                    col = Integer.parseInt(m.group(2));
                    msg = new StringBuilder(m.group(4));
                }
                continue;
            }
            if (msg != null && !t.isEmpty() && !isNoise(t)) msg.append('\n').append(l);
        }
        if (msg != null) out.add(new Diagnostic(msg.toString().trim(), line, col));
        if (!out.isEmpty()) return out;

        ArrayList<String> kept = new ArrayList<>();
        for (String l : lines) {
            if (!l.isBlank() && !isNoise(l.strip())) kept.add(l);
            if (kept.size() >= 15) break;
        }
        return List.of(Diagnostic.of(kept.isEmpty() ? "unknown compilation error" : String.join("\n", kept)));
    }

    private static boolean isNoise(String t) {
        for (String p : NOISE_PREFIXES) if (t.startsWith(p)) return true;
        return false;
    }

    private static String readAll(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static java.io.File nullDevice() {
        return new java.io.File(System.getProperty("os.name", "").startsWith("Windows") ? "NUL" : "/dev/null");
    }

    private static String sanitize(String requestId) {
        String s = requestId == null ? "" : requestId.replaceAll("[^A-Za-z0-9_]", "_");
        return s.isEmpty() ? "anon" : s;
    }
}
