package io.intellixity.arbor.join;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/** Identity of a join node: the association steps from the root, without join types. */
public record JoinPath(List<PathSegment> segments) {
  private static final JoinPath ROOT = new JoinPath(List.of());

  public JoinPath {
    segments = List.copyOf(segments == null ? List.of() : segments);
  }

  public static JoinPath root() { return ROOT; }

  public static JoinPath of(PathSegment... segments) { return new JoinPath(List.of(segments)); }

  public boolean isRoot() { return segments.isEmpty(); }

  public int depth() { return segments.size(); }

  public JoinPath child(PathSegment segment) {
    List<PathSegment> out = new ArrayList<>(segments.size() + 1);
    out.addAll(segments);
    out.add(segment);
    return new JoinPath(out);
  }

  public JoinPath concat(JoinPath other) {
    if (other.isRoot()) return this;
    if (isRoot()) return other;
    List<PathSegment> out = new ArrayList<>(segments);
    out.addAll(other.segments());
    return new JoinPath(out);
  }

  public PathSegment last() {
    if (isRoot()) throw new IllegalStateException("root path has no last segment");
    return segments.get(segments.size() - 1);
  }

  @Override
  public String toString() {
    if (isRoot()) return "<root>";
    return segments.stream().map(PathSegment::toString).collect(Collectors.joining("."));
  }
}
