package org.calista.formalizer.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Prompt templates with {@code {placeholder}} slots.
 *
 * <p>Looked up in the override directory first (if configured), then on the classpath
 * under {@code /prompts/}. Templates are cached after the first load.</p>
 */
public final class PromptLibrary {

    private static final Logger log = LoggerFactory.getLogger(PromptLibrary.class);

    public static final String SYSTEM = "system";
    public static final String GROUNDING = "grounding_reasoner";
    public static final String EXPANSION = "expansion";
    public static final String SYNTHESIS = "synthesis";
    public static final String REFLECTION = "reflection";
    public static final String BACK_TRANSLATION = "back_translation";
    public static final String MERGE_BACK_TRANSLATIONS = "merge_back_translations";
    public static final String SEMANTIC_CHECK = "semantic_check";

    private final Path overrideDir;
    private final ConcurrentHashMap<String, String> cache = new ConcurrentHashMap<>();

    public PromptLibrary() {
        this(null);
    }

    public PromptLibrary(Path overrideDir) {
        this.overrideDir = overrideDir;
    }

    public String template(String name) {
        Objects.requireNonNull(name, "name");
        return cache.computeIfAbsent(name, this::load);
    }

    /** Template with every {@code {key}} replaced; values are inserted verbatim. */
    public String render(String name, Map<String, String> values) {
        String t = template(name);
        StringBuilder sb = new StringBuilder(t.length() + 256);
        int i = 0;
        while (i < t.length()) {
            char c = t.charAt(i);
            if (c == '{') {
                int end = t.indexOf('}', i + 1);
                if (end > i + 1) {
                    String key = t.substring(i + 1, end);
                    if (values.containsKey(key)) {
                        String v = values.get(key);
                        sb.append(v == null ? "" : v);
                        i = end + 1;
                        continue;
                    }
                }
            }
            sb.append(c);
            i++;
        }
        return sb.toString();
    }

    /** System message + rendered user message. */
    public List<ChatMessage> conversation(String name, Map<String, String> values) {
        return List.of(ChatMessage.system(template(SYSTEM).trim()), ChatMessage.user(render(name, values)));
    }

    private String load(String name) {
        String file = name + ".txt";
        if (overrideDir != null) {
            Path p = overrideDir.resolve(file);
            if (Files.isRegularFile(p)) {
                try {
                    log.debug("Prompt '{}' loaded from {}", name, p);
                    return Files.readString(p, StandardCharsets.UTF_8);
                } catch (IOException e) {
                    throw new IllegalStateException("Cannot read prompt " + p, e);
                }
            }
        }
        try (InputStream in = PromptLibrary.class.getResourceAsStream("/prompts/" + file)) {
            if (in == null) throw new IllegalStateException("Prompt template not found: " + file);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read prompt resource " + file, e);
        }
    }
}
