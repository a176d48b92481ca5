package io.intellixity.arbor.relation;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import io.intellixity.arbor.ast.*;
import io.intellixity.arbor.join.JoinNode;

import java.io.IOException;
import java.util.List;
import java.util.Locale;

/** Canonical JSON serializer for {@link ComposedQuery}. */
public final class ComposedQueryJsonSerializer extends JsonSerializer<ComposedQuery> {
  @Override
  public void serialize(ComposedQuery q, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (q == null) {
      g.writeNull();
      return;
    }

    g.writeStartObject();
    g.writeStringField("type", q.rootType());
    g.writeFieldName("root");
    writeTable(q.root(), g);

    if (!q.joins().isEmpty()) {
      g.writeArrayFieldStart("joins");
      for (JoinNode j : q.joins()) {
        g.writeStartObject();
        g.writeStringField("path", j.path().toString());
        g.writeFieldName("table");
        writeTable(j.table(), g);
        g.writeStringField("joinType", j.joinType().name());
        g.writeStringField("origin", j.origin().name());
        g.writeFieldName("on");
        writeNode(j.on(), g, serializers);
        g.writeEndObject();
      }
      g.writeEndArray();
    }

    if (!q.rawJoins().isEmpty()) {
      g.writeObjectField("rawJoins", q.rawJoins());
    }

    writeFragments("where", q.wheres(), g, serializers);
    writeFragments("having", q.havings(), g, serializers);
    writeFragments("group", q.groups(), g, serializers);
    writeFragments("order", q.orders(), g, serializers);
    writeFragments("select", q.selects(), g, serializers);

    if (!q.preloads().isEmpty()) {
      g.writeArrayFieldStart("preload");
      for (Object p : q.preloads()) g.writeString(String.valueOf(p));
      g.writeEndArray();
    }

    if (q.eagerLoading()) g.writeBooleanField("eagerLoading", true);

    if (q.page() != null) {
      g.writeObjectFieldStart("page");
      g.writeNumberField("offset", q.page().offset());
      g.writeNumberField("limit", q.page().limit());
      g.writeEndObject();
    }

    g.writeEndObject();
  }

  private static void writeFragments(String field, List<ContextualizedFragment> fragments, JsonGenerator g,
                                     SerializerProvider serializers) throws IOException {
    if (fragments.isEmpty()) return;
    g.writeArrayFieldStart(field);
    for (ContextualizedFragment f : fragments) {
      g.writeStartObject();
      g.writeStringField("context", f.context().path().toString());
      g.writeFieldName("node");
      writeNode(f.node(), g, serializers);
      g.writeEndObject();
    }
    g.writeEndArray();
  }

  private static void writeTable(TableRef t, JsonGenerator g) throws IOException {
    g.writeStartObject();
    g.writeStringField("name", t.name());
    g.writeStringField("alias", t.alias());
    g.writeEndObject();
  }

  private static void writeNode(SqlNode n, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (n == null) {
      g.writeNull();
      return;
    }

    if (n instanceof Column c) {
      g.writeStartObject();
      g.writeStringField("column", c.table().alias() + "." + c.name());
      g.writeEndObject();
      return;
    }

    if (n instanceof Value v) {
      g.writeStartObject();
      g.writeFieldName("value");
      serializers.defaultSerializeValue(v.value(), g);
      g.writeEndObject();
      return;
    }

    if (n instanceof ValueList vl) {
      writeList("values", vl.values(), g, serializers);
      return;
    }

    if (n instanceof NodeList nl) {
      writeList("list", nl.nodes(), g, serializers);
      return;
    }

    if (n instanceof Comparison c) {
      writeBinary(c.operator().name().toLowerCase(Locale.ROOT), c.left(), c.right(), g, serializers);
      return;
    }

    if (n instanceof Infix i) {
      g.writeStartObject();
      g.writeObjectFieldStart("infix");
      g.writeStringField("op", i.operator());
      g.writeFieldName("left");
      writeNode(i.left(), g, serializers);
      g.writeFieldName("right");
      writeNode(i.right(), g, serializers);
      g.writeEndObject();
      g.writeEndObject();
      return;
    }

    if (n instanceof Between b) {
      g.writeStartObject();
      g.writeObjectFieldStart("between");
      if (b.negated()) g.writeBooleanField("not", true);
      g.writeFieldName("operand");
      writeNode(b.operand(), g, serializers);
      g.writeFieldName("lower");
      writeNode(b.lower(), g, serializers);
      g.writeFieldName("upper");
      writeNode(b.upper(), g, serializers);
      g.writeEndObject();
      g.writeEndObject();
      return;
    }

    if (n instanceof Conjunction c) {
      writeList(c.clause().name().toLowerCase(Locale.ROOT), c.nodes(), g, serializers);
      return;
    }

    if (n instanceof Not x) {
      writeUnary("not", x.operand(), g, serializers);
      return;
    }

    if (n instanceof Negate x) {
      writeUnary("negate", x.operand(), g, serializers);
      return;
    }

    if (n instanceof Grouping x) {
      writeUnary("group", x.node(), g, serializers);
      return;
    }

    if (n instanceof Function f) {
      g.writeStartObject();
      g.writeObjectFieldStart("function");
      g.writeStringField("name", f.name());
      g.writeArrayFieldStart("args");
      for (SqlNode a : f.args()) writeNode(a, g, serializers);
      g.writeEndArray();
      g.writeEndObject();
      g.writeEndObject();
      return;
    }

    if (n instanceof Ordered o) {
      writeUnary(o.direction().name().toLowerCase(Locale.ROOT), o.node(), g, serializers);
      return;
    }

    if (n instanceof Aliased a) {
      g.writeStartObject();
      g.writeObjectFieldStart("as");
      g.writeStringField("alias", a.alias());
      g.writeFieldName("node");
      writeNode(a.node(), g, serializers);
      g.writeEndObject();
      g.writeEndObject();
      return;
    }

    if (n instanceof Raw r) {
      g.writeStartObject();
      g.writeStringField("sql", r.sql());
      g.writeEndObject();
      return;
    }

    if (n instanceof Subquery s) {
      g.writeStartObject();
      g.writeFieldName("subquery");
      serializers.defaultSerializeValue(s.query(), g);
      g.writeEndObject();
      return;
    }

    throw new IllegalArgumentException("Unsupported SqlNode: " + n.getClass().getName());
  }

  private static void writeBinary(String key, SqlNode left, SqlNode right, JsonGenerator g,
                                  SerializerProvider serializers) throws IOException {
    g.writeStartObject();
    g.writeObjectFieldStart(key);
    g.writeFieldName("left");
    writeNode(left, g, serializers);
    g.writeFieldName("right");
    writeNode(right, g, serializers);
    g.writeEndObject();
    g.writeEndObject();
  }

  private static void writeUnary(String key, SqlNode operand, JsonGenerator g, SerializerProvider serializers)
      throws IOException {
    g.writeStartObject();
    g.writeFieldName(key);
    writeNode(operand, g, serializers);
    g.writeEndObject();
  }

  private static void writeList(String key, List<SqlNode> nodes, JsonGenerator g, SerializerProvider serializers)
      throws IOException {
    g.writeStartObject();
    g.writeArrayFieldStart(key);
    for (SqlNode x : nodes) writeNode(x, g, serializers);
    g.writeEndArray();
    g.writeEndObject();
  }
}
