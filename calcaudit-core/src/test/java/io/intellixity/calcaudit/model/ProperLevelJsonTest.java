package io.intellixity.calcaudit.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class ProperLevelJsonTest {
  private static final ObjectMapper JSON = new ObjectMapper();

  @Test
  void writesLevelsAsNumbersAndCycleAsToken() throws Exception {
    assertEquals("3", JSON.writeValueAsString(ProperLevel.of(3)));
    assertEquals("\"cycle\"", JSON.writeValueAsString(ProperLevel.CYCLE));
  }

  @Test
  void readsBothForms() throws Exception {
    assertEquals(ProperLevel.of(2), JSON.readValue("2", ProperLevel.class));
    assertSame(ProperLevel.CYCLE, JSON.readValue("\"cycle\"", ProperLevel.class));
    assertThrows(MismatchedInputException.class, () -> JSON.readValue("\"loop\"", ProperLevel.class));
  }

  @Test
  void violationSerializesWithNestedLevel() throws Exception {
    Violation v = new Violation("F!DG!A!current", ProblemKind.CYCLIC_DEPENDENCY, "F!DG!B!current",
        Context.CURRENT, 1, 2, ProperLevel.CYCLE);
    JsonNode n = JSON.readTree(JSON.writeValueAsString(v));
    assertEquals("CYCLIC_DEPENDENCY", n.get("kind").asText());
    assertEquals("cycle", n.get("properLevel").asText());
    assertEquals(1, n.get("dependencyLevel").asInt());
    assertEquals("CURRENT", n.get("dependencyContext").asText());
  }

  @Test
  void largeLevelsAreEqualByValue() {
    assertEquals(ProperLevel.of(1000), ProperLevel.of(999).next());
    assertEquals(ProperLevel.of(7), ProperLevel.of(7).max(ProperLevel.of(3)));
    assertTrue(ProperLevel.of(7).max(ProperLevel.CYCLE).isCycle());
    assertTrue(ProperLevel.CYCLE.next().isCycle());
  }
}
