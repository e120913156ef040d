package org.calista.formalizer.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;

import org.calista.formalizer.core.CollaboratorException;
import org.junit.jupiter.api.Test;

public class LeanSearchClientTest {

  private final LeanSearchClient client = new LeanSearchClient(HttpClient.newHttpClient(), new ObjectMapper(),
      URI.create("http://localhost:1/search"), Duration.ofSeconds(1));

  @Test
  public void testNestedResponseIsRanked() throws Exception {
    String body = "[[{\"result\": {\"name\": [\"Nat\", \"Prime\"], \"informal_description\": \"p is prime\"},"
        + " \"distance\": 0.31},"
        + " {\"result\": {\"name\": \"Even\", \"informal_description\": \"[TRANSLATION_FAILED]\","
        + " \"docstring\": \"Even n\"}, \"distance\": 0.12}]]";

    List<SearchHit> hits = client.parse(body);

    assertThat(hits).extracting(h -> h.canonicalId).containsExactly("Even", "Nat.Prime");
    assertThat(hits.get(0).informalDescription).isEqualTo("(Docstring): Even n");
    assertThat(hits.get(1).distance).isEqualTo(0.31);
  }

  @Test
  public void testEmptyArrayIsNoHits() throws Exception {
    assertThat(client.parse("[]")).isEmpty();
  }

  @Test
  public void testWrongEnvelopeIsMalformed() {
    for (String body : new String[] {"", "{\"hits\": []}", "not json", "[[{\"result\": {}}]]"}) {
      assertThatThrownBy(() -> client.parse(body)).as(body)
          .isInstanceOfSatisfying(CollaboratorException.class,
              e -> assertThat(e.kind()).isEqualTo(CollaboratorException.Kind.MALFORMED_RESPONSE));
    }
  }

  @Test
  public void testMultiQueryMergeKeepsFirstAndReRanks() throws Exception {
    SearchClient s = (q, limit) -> q.equals("a")
        ? List.of(SearchHit.of("X", "", 0.5), SearchHit.of("Y", "", 0.4))
        : List.of(SearchHit.of("X", "", 0.1), SearchHit.of("Z", "", 0.2));

    List<SearchHit> merged = s.search(List.of("a", " ", "b"), 2);

    assertThat(merged).extracting(h -> h.canonicalId).containsExactly("Z", "Y");
  }
}
