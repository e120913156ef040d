package org.calista.formalizer.compiler;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.Test;

public class LeanCompilerClientTest {

  private static final String FILE = "Scratch_n3_a2_w0.lean";

  @Test
  public void testErrorsOfTheScratchFileAreKept() {
    String raw = String.join("\n",
        "info: downloading component",
        "src/" + FILE + ":4:27: error: type mismatch",
        "  h",
        "has type",
        "  ℕ : Type",
        "src/" + FILE + ":9:0: warning: declaration uses 'sorry'",
        "src/" + FILE + ":12:2: error: unknown identifier 'isEven'");

    List<Diagnostic> d = LeanCompilerClient.parseDiagnostics(raw, FILE);

    assertThat(d).hasSize(2);
    assertThat(d.get(0).line).isEqualTo(4);
    assertThat(d.get(0).column).isEqualTo(27);
    assertThat(d.get(0).message).startsWith("type mismatch").contains("ℕ : Type");
    assertThat(d.get(1).render()).isEqualTo("12:2: unknown identifier 'isEven'");
  }

  @Test
  public void testUnlocatedOutputFallsBackToFirstLines() {
    List<Diagnostic> d = LeanCompilerClient.parseDiagnostics("info: noise\nuncaught exception: no such file", FILE);
    assertThat(d).hasSize(1);
    assertThat(d.get(0).message).isEqualTo("uncaught exception: no such file");
    assertThat(d.get(0).hasLocation()).isFalse();
  }

  @Test
  public void testBlankOutput() {
    assertThat(LeanCompilerClient.parseDiagnostics("", FILE))
        .extracting(x -> x.message).containsExactly("unknown compilation error");
  }

  @Test
  public void testUnitRendering() {
    CompilationUnit u = new CompilationUnit(List.of("import Mathlib", "import Mathlib"),
        List.of("def a := 1", "def b := 2"), "def c := a + b");
    assertThat(u.render()).isEqualTo("import Mathlib\n\ndef a := 1\n\ndef b := 2\n\ndef c := a + b\n");
    assertThat(CompilationResult.failure(List.of()).diagnostics).hasSize(1);
  }
}
