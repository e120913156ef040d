package org.calista.formalizer.io;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class FileIOTest {

  @Test
  public void testResolveStaysInsideBaseDir(@TempDir Path dir) {
    FileIO io = new FileIO(dir);
    assertThat(io.resolve("a/b.txt")).isEqualTo(dir.toAbsolutePath().normalize().resolve("a/b.txt"));
    assertThatThrownBy(() -> io.resolve("../escape.txt")).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> io.resolve(dir.resolve("x").toAbsolutePath().toString()))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  public void testResolveExternal(@TempDir Path dir) {
    FileIO io = new FileIO(dir);
    Path abs = dir.resolve("elsewhere").toAbsolutePath();
    assertThat(io.resolveExternal(abs.toString())).isEqualTo(abs.normalize());
    assertThat(io.resolveExternal("../sibling")).isEqualTo(dir.toAbsolutePath().normalize().resolveSibling("sibling"));
  }

  @Test
  public void testAtomicWriteAndJsonl(@TempDir Path dir) throws Exception {
    FileIO io = new FileIO(dir);
    Path f = io.resolve("out/report.json");

    io.writeString(f, "{}");
    io.writeString(f, "{}");

    assertThat(io.readString(f)).isEqualTo("{}");
    assertThat(Files.exists(dir.resolve("out/report.json.tmp"))).isFalse();

    Path log = io.resolve("events.jsonl");
    io.appendJsonl(log, "{\"a\":1}");
    io.appendJsonl(log, "   ");
    io.appendJsonl(log, "{\"a\":2}");
    assertThat(io.readJsonl(log)).containsExactly("{\"a\":1}", "{\"a\":2}");
  }

  @Test
  public void testRollbackLeavesTargetUntouched(@TempDir Path dir) throws Exception {
    FileIO io = new FileIO(dir);
    Path f = io.resolve("kb.jsonl");
    io.writeString(f, "old");

    FileIO.WriterHandle h = io.openWriter(f);
    h.writer.write("new");
    io.rollback(h);

    assertThat(io.readString(f)).isEqualTo("old");
    assertThat(io.exists(io.resolve("kb.jsonl.tmp"))).isFalse();
  }
}
