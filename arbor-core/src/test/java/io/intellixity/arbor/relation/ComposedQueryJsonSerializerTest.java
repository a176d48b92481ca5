package io.intellixity.arbor.relation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.arbor.TestModels;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.intellixity.arbor.query.Expressions.*;
import static org.junit.jupiter.api.Assertions.*;

final class ComposedQueryJsonSerializerTest {
  private static final ObjectMapper JSON = new ObjectMapper();

  @Test
  void equivalentJoinSpecsSerializeIdentically() throws Exception {
    Object where = path("children", "children", "parent").attr("name").eq("Ernie");
    String nested = JSON.writeValueAsString(TestModels.person()
        .joins(hash("children", hash("children", "parent"))).where(where).build());
    String keypath = JSON.writeValueAsString(TestModels.person()
        .joins("children.children.parent").where(where).build());
    String listed = JSON.writeValueAsString(TestModels.person()
        .joins(List.of(hash("children", List.of(hash("children", List.of("parent")))))).where(where).build());

    assertEquals(nested, keypath);
    assertEquals(nested, listed);
  }

  @Test
  void writesJoinsAndFragments() throws Exception {
    ComposedQuery q = TestModels.person()
        .joins("children")
        .where(hash("children", hash("name", List.of("a", "b"))))
        .order(attr("name").desc())
        .page(0, 5)
        .build();

    JsonNode n = JSON.readTree(JSON.writeValueAsString(q));
    assertEquals("Person", n.get("type").asText());
    assertEquals("children_people", n.get("joins").get(0).get("table").get("alias").asText());
    assertEquals("INNER", n.get("joins").get(0).get("joinType").asText());

    JsonNode where = n.get("where").get(0);
    assertEquals("<root>", where.get("context").asText());
    JsonNode in = where.get("node").get("in");
    assertEquals("children_people.name", in.get("left").get("column").asText());
    assertEquals("b", in.get("right").get("values").get(1).get("value").asText());

    assertEquals("people.name", n.get("order").get(0).get("node").get("desc").get("column").asText());
    assertEquals(5, n.get("page").get("limit").asInt());
  }
}
