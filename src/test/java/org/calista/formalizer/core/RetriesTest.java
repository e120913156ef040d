package org.calista.formalizer.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

public class RetriesTest {

  @Test
  public void testSucceedsAfterTransientFailure() throws Exception {
    AtomicInteger calls = new AtomicInteger();
    String r = new Retries(2, 0).call("x", () -> {
      if (calls.incrementAndGet() < 2) throw CollaboratorException.unavailable("llm", "timeout", null);
      return "ok";
    });
    assertThat(r).isEqualTo("ok");
    assertThat(calls).hasValue(2);
  }

  @Test
  public void testRethrowsLastFailure() {
    AtomicInteger calls = new AtomicInteger();
    assertThatThrownBy(() -> new Retries(1, 0).call("x", () -> {
      throw CollaboratorException.malformed("llm", "bad " + calls.incrementAndGet());
    })).isInstanceOf(CollaboratorException.class).hasMessage("llm: bad 2");
    assertThat(Retries.none().retries()).isZero();
  }
}
