package org.calista.formalizer.llm;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * ModelOutputs — deterministic cleanup of raw completions.
 *
 * <ul>
 *   <li>prefers a {@code ```lean} fenced block, then {@code ```json}/{@code ```python}, then any fence;</li>
 *   <li>without fences, cuts at an echoed dependency marker ({@code -- [Dep]}) or a late
 *       {@code import Mathlib} (the model re-pasting its context);</li>
 *   <li>splits import lines off a code candidate so they can be hoisted into the header.</li>
 * </ul>
 */
public final class ModelOutputs {
    private ModelOutputs() {}

    private static final Pattern LEAN_FENCE = Pattern.compile("```lean4?\\s*([\\s\\S]*?)\\s*```");
    private static final Pattern DATA_FENCE = Pattern.compile("```(?:json|python)\\s*([\\s\\S]*?)\\s*```");
    private static final Pattern ANY_FENCE = Pattern.compile("```[a-zA-Z0-9]*\\s*([\\s\\S]*?)\\s*```");
    private static final Pattern IMPORT_LINE = Pattern.compile("^\\s*import\\s+\\S.*$");

    /** Extracts the payload of a completion (code or data), trimmed. */
    public static String extractBlock(String response) {
        if (response == null) return "";
        String s = response.trim();
        if (s.isEmpty()) return "";

        Matcher m = LEAN_FENCE.matcher(s);
        if (m.find()) return m.group(1).trim();
        m = DATA_FENCE.matcher(s);
        if (m.find()) return m.group(1).trim();
        m = ANY_FENCE.matcher(s);
        if (m.find()) return m.group(1).trim();

        if (s.length() > 1 && s.startsWith("`") && s.endsWith("`")) s = s.substring(1, s.length() - 1);

        String[] lines = s.split("\\R", -1);
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < lines.length; i++) {
            String t = lines[i].strip();
            if (t.contains("-- [Dep]") || t.contains("--[Dep]")) break;
            if (i > 5 && t.startsWith("import Mathlib")) break;
            if (sb.length() > 0) sb.append('\n');
            sb.append(lines[i]);
        }
        return sb.toString().trim();
    }

    /** Code candidate with its import lines separated. */
    public static final class Candidate {
        public final List<String> imports;
        public final String body;

        Candidate(List<String> imports, String body) {
            this.imports = List.copyOf(imports);
            this.body = body;
        }

        public boolean isEmpty() {
            return body.isBlank();
        }
    }

    public static Candidate splitImports(String code) {
        if (code == null || code.isBlank()) return new Candidate(List.of(), "");
        ArrayList<String> imports = new ArrayList<>();
        StringBuilder body = new StringBuilder(code.length());
        for (String line : code.split("\\R", -1)) {
            if (IMPORT_LINE.matcher(line).matches()) {
                imports.add(line.trim().replaceAll("\\s+", " "));
            } else {
                body.append(line).append('\n');
            }
        }
        return new Candidate(imports, body.toString().trim());
    }

    /** Single-line, length-capped rendition for logs and placeholders. */
    public static String oneLine(String s, int maxChars) {
        if (s == null) return "";
        String x = s.replaceAll("\\s+", " ").trim();
        return x.length() > maxChars ? x.substring(0, Math.max(0, maxChars - 3)) + "..." : x;
    }
}
