package org.calista.formalizer.events;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;

import org.calista.formalizer.io.FileIO;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class EventStoreTest {

  @Test
  public void testAppendAndReadBack(@TempDir Path dir) throws Exception {
    FileIO io = new FileIO(dir);
    EventStore store = new EventStore(io, new ObjectMapper(), io.resolve("events.jsonl"));

    assertThat(store.readAll()).isEmpty();
    store.append(RunEvent.of(RunEvent.STAGE1_DONE, "run-1", null, "stmt").with("nodes", 3));
    store.appendQuietly(RunEvent.of(RunEvent.NODE_FAILED, "run-1", "n2", "parity").with("attempts", 16));

    List<RunEvent> events = store.readAll();
    assertThat(events).extracting(e -> e.type).containsExactly(RunEvent.STAGE1_DONE, RunEvent.NODE_FAILED);
    assertThat(events.get(0).data).containsEntry("nodes", 3);
    assertThat(events.get(1).nodeId).isEqualTo("n2");
  }
}
