package io.intellixity.arbor.relation;

import io.intellixity.arbor.ast.Column;
import io.intellixity.arbor.ast.Comparison;
import io.intellixity.arbor.ast.Conjunction;
import io.intellixity.arbor.ast.SqlNode;
import io.intellixity.arbor.ast.Value;
import io.intellixity.arbor.authoring.AssociationDef;
import io.intellixity.arbor.authoring.AuthoringRegistry;
import io.intellixity.arbor.authoring.EntityAuthoring;
import io.intellixity.arbor.join.*;
import io.intellixity.arbor.query.Clause;
import io.intellixity.arbor.query.Expression;
import io.intellixity.arbor.query.HashSpec;
import io.intellixity.arbor.query.Operator;
import io.intellixity.arbor.query.ResolutionException;
import io.intellixity.arbor.visit.AttributeVisitor;
import io.intellixity.arbor.visit.PredicateVisitor;

import java.util.*;
import java.util.function.Consumer;

/**
 * Immutable query under construction for one root entity.
 *
 * <p>Every clause method returns a new relation, so a base relation can be shared and refined freely.
 * Clause values are stored as authored; {@link #build()} resolves joins and contextualizes them against a
 * fresh {@link ContextRegistry}.</p>
 *
 * <pre>
 *   Relation.from(authoring, "Person")
 *       .joins(hash("children", hash("children", "parent")))
 *       .where(path("children", "children").attr("name").eq("Ernie"))
 *       .order(attr("name").desc())
 *       .build();
 * </pre>
 *
 * <p>Clause values:</p>
 * <ul>
 *   <li>{@code String}: raw SQL, sanitized when binds are given</li>
 *   <li>{@code Map}/{@link HashSpec}: hash literal, keys are associations or attributes; a map is stored
 *   as authored and read as a {@link HashSpec} at build time</li>
 *   <li>{@link Expression}: expression tree</li>
 * </ul>
 */
public final class Relation {
  private final AuthoringRegistry authoring;
  private final EntityAuthoring entity;
  private final RelationOptions options;

  private final List<ScopedValue> joins;
  private final List<ScopedValue> includes;
  private final List<ScopedValue> eagerLoads;
  private final List<ScopedValue> preloads;
  private final List<ScopedValue> wheres;
  private final List<ScopedValue> havings;
  private final List<ScopedValue> orders;
  private final List<ScopedValue> selects;
  private final List<ScopedValue> groups;
  private final boolean reordered;
  private final OffsetPage page;

  private Relation(AuthoringRegistry authoring, EntityAuthoring entity, RelationOptions options,
                   List<ScopedValue> joins, List<ScopedValue> includes, List<ScopedValue> eagerLoads,
                   List<ScopedValue> preloads, List<ScopedValue> wheres, List<ScopedValue> havings,
                   List<ScopedValue> orders, List<ScopedValue> selects, List<ScopedValue> groups,
                   boolean reordered, OffsetPage page) {
    this.authoring = authoring;
    this.entity = entity;
    this.options = options;
    this.joins = List.copyOf(joins);
    this.includes = List.copyOf(includes);
    this.eagerLoads = List.copyOf(eagerLoads);
    this.preloads = List.copyOf(preloads);
    this.wheres = List.copyOf(wheres);
    this.havings = List.copyOf(havings);
    this.orders = List.copyOf(orders);
    this.selects = List.copyOf(selects);
    this.groups = List.copyOf(groups);
    this.reordered = reordered;
    this.page = page;
  }

  public static Relation from(AuthoringRegistry authoring, String type) {
    return from(authoring, type, RelationOptions.defaults());
  }

  public static Relation from(AuthoringRegistry authoring, String type, RelationOptions options) {
    Objects.requireNonNull(authoring, "authoring");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(options, "options");
    return new Relation(authoring, authoring.getEntityAuthoring(type), options,
        List.of(), List.of(), List.of(), List.of(), List.of(), List.of(), List.of(), List.of(), List.of(),
        false, null);
  }

  public AuthoringRegistry authoring() { return authoring; }
  public EntityAuthoring entity() { return entity; }
  public RelationOptions options() { return options; }
  public OffsetPage page() { return page; }

  // ---- joins ----

  /** INNER joins (unless a {@link JoinKey} says otherwise). Strings with whitespace are raw SQL joins. */
  public Relation joins(Object... specs) {
    return with(b -> b.joins = append(b.joins, specs));
  }

  /** Associations loaded with the records; joined (OUTER) only when a clause references them. */
  public Relation includes(Object... specs) {
    return with(b -> b.includes = append(b.includes, specs));
  }

  /** Associations always loaded through OUTER joins. */
  public Relation eagerLoad(Object... specs) {
    return with(b -> b.eagerLoads = append(b.eagerLoads, specs));
  }

  /** Associations loaded by separate queries; never joined. */
  public Relation preload(Object... specs) {
    return with(b -> b.preloads = append(b.preloads, specs));
  }

  // ---- conditions ----

  public Relation where(Object clause) {
    Object stored = normalizeCondition(clause);
    return with(b -> b.wheres = append(b.wheres, stored));
  }

  /** Raw SQL condition with positional {@code ?} binds. */
  public Relation where(String sql, Object... binds) {
    return where(binds.length == 0 ? sql : SqlSanitizer.sanitize(sql, binds));
  }

  /** Raw SQL condition with named {@code :name} binds. */
  public Relation where(String sql, Map<String, ?> named) {
    return where(SqlSanitizer.sanitize(sql, named));
  }

  public Relation having(Object clause) {
    Object stored = normalizeCondition(clause);
    return with(b -> b.havings = append(b.havings, stored));
  }

  public Relation having(String sql, Object... binds) {
    return having(binds.length == 0 ? sql : SqlSanitizer.sanitize(sql, binds));
  }

  // ---- projections ----

  public Relation order(Object... specs) {
    return with(b -> b.orders = append(b.orders, specs));
  }

  /** Replaces every earlier order. Merging a reordered relation replaces the receiver's orders as well. */
  public Relation reorder(Object... specs) {
    return with(b -> {
      b.orders = append(List.of(), specs);
      b.reordered = true;
    });
  }

  public Relation select(Object... specs) {
    return with(b -> b.selects = append(b.selects, specs));
  }

  public Relation group(Object... specs) {
    return with(b -> b.groups = append(b.groups, specs));
  }

  public Relation page(int offset, int limit) {
    OffsetPage p = new OffsetPage(offset, limit);
    return with(b -> b.page = p);
  }

  // ---- stored values ----

  public List<Object> joinValues() { return values(joins); }
  public List<Object> includeValues() { return values(includes); }
  public List<Object> eagerLoadValues() { return values(eagerLoads); }
  public List<Object> preloadValues() { return values(preloads); }
  /** WHERE values as stored: sanitized SQL strings, hash literals as authored and expressions. */
  public List<Object> whereValues() { return values(wheres); }
  public List<Object> havingValues() { return values(havings); }
  public List<Object> orderValues() { return values(orders); }
  public List<Object> selectValues() { return values(selects); }
  public List<Object> groupValues() { return values(groups); }

  /**
   * Column to value map from root equality conditions, used as defaults for new records.
   * A column constrained more than once keeps the last value.
   */
  public Map<String, Object> whereValuesHash() {
    ComposedQuery q = build();
    Map<String, Object> out = new LinkedHashMap<>();
    for (ContextualizedFragment f : q.wheres()) {
      if (!f.context().isRoot()) continue;
      collectEqualities(f.node(), q, out);
    }
    return out;
  }

  private static void collectEqualities(SqlNode node, ComposedQuery q, Map<String, Object> out) {
    if (node instanceof Conjunction and && and.clause() == Clause.AND) {
      for (SqlNode n : and.nodes()) collectEqualities(n, q, out);
    } else if (node instanceof Comparison c && c.operator() == Operator.EQ
        && c.left() instanceof Column col && col.table().equals(q.root())
        && c.right() instanceof Value v) {
      out.remove(col.name());
      out.put(col.name(), v.value());
    }
  }

  // ---- merge ----

  /**
   * Combines {@code other} into this relation.
   * <p>
   * With the same root entity the clause lists are concatenated. Otherwise the first non-polymorphic
   * association of this entity targeting the other entity is INNER joined and every clause of
   * {@code other} is scoped under it.
   */
  public Relation merge(Relation other) {
    Objects.requireNonNull(other, "other");
    if (other.entity.type().equals(entity.type())) {
      return mergeUnder(other, JoinPath.root(), List.of());
    }

    AssociationDef assoc = entity.associations().values().stream()
        .filter(a -> !a.polymorphic() && other.entity.type().equals(a.target()))
        .findFirst()
        .orElseThrow(() -> new ResolutionException("Cannot merge relation on '" + other.entity.type() +
            "' into '" + entity.type() + "': no association from '" + entity.type() + "' to it"));
    JoinPath prefix = JoinPath.of(new PathSegment(assoc.name(), null));
    return mergeUnder(other, prefix, List.of(ScopedValue.root(JoinKey.of(assoc.name()).inner())));
  }

  private Relation mergeUnder(Relation other, JoinPath prefix, List<ScopedValue> connecting) {
    return with(b -> {
      List<ScopedValue> j = new ArrayList<>(b.joins);
      j.addAll(connecting);
      j.addAll(scoped(other.joins, prefix));
      b.joins = j;
      b.includes = concat(b.includes, scoped(other.includes, prefix));
      b.eagerLoads = concat(b.eagerLoads, scoped(other.eagerLoads, prefix));
      b.preloads = concat(b.preloads, scoped(other.preloads, prefix));
      b.wheres = concat(b.wheres, scoped(other.wheres, prefix));
      b.havings = concat(b.havings, scoped(other.havings, prefix));
      b.selects = concat(b.selects, scoped(other.selects, prefix));
      b.groups = concat(b.groups, scoped(other.groups, prefix));
      if (other.reordered) {
        b.orders = scoped(other.orders, prefix);
        b.reordered = true;
      } else {
        b.orders = concat(b.orders, scoped(other.orders, prefix));
      }
      if (other.page != null) b.page = other.page;
    });
  }

  // ---- build ----

  /** A fresh registry with every join, eager load and include of this relation registered. */
  public ContextRegistry contextRegistry() {
    List<String> raw = new ArrayList<>();
    for (ScopedValue sv : joins) raw.addAll(JoinResolver.rawJoins(sv.value()));

    ContextRegistry registry = new ContextRegistry(authoring, entity, raw, options.tableAliasLength());
    JoinResolver resolver = new JoinResolver(registry);
    resolveAll(resolver, registry, joins, JoinType.INNER, JoinOrigin.JOIN);
    resolveAll(resolver, registry, eagerLoads, JoinType.OUTER, JoinOrigin.EAGER_LOAD);
    resolveAll(resolver, registry, includes, JoinType.OUTER, JoinOrigin.INCLUDE);
    return registry;
  }

  public PredicateVisitor predicateVisitor() {
    return new PredicateVisitor(contextRegistry());
  }

  public AttributeVisitor attributeVisitor() {
    return new AttributeVisitor(contextRegistry());
  }

  /**
   * Resolves joins and contextualizes every clause.
   *
   * @throws ResolutionException when an association, attribute or join path cannot be resolved
   */
  public ComposedQuery build() {
    ContextRegistry registry = contextRegistry();
    PredicateVisitor predicates = new PredicateVisitor(registry);
    AttributeVisitor attributes = new AttributeVisitor(registry);
    ClauseComposer composer = new ClauseComposer(registry);

    for (ScopedValue sv : wheres) {
      JoinNode ctx = registry.lookup(sv.scope());
      composer.where(new ContextualizedFragment(ctx, predicates.accept(sv.value(), ctx)));
    }
    for (ScopedValue sv : havings) {
      JoinNode ctx = registry.lookup(sv.scope());
      composer.having(new ContextualizedFragment(ctx, predicates.accept(sv.value(), ctx)));
    }
    for (ScopedValue sv : groups) {
      JoinNode ctx = registry.lookup(sv.scope());
      for (SqlNode n : attributes.acceptAll(sv.value(), ctx)) composer.group(new ContextualizedFragment(ctx, n));
    }
    for (ScopedValue sv : orders) {
      JoinNode ctx = registry.lookup(sv.scope());
      for (SqlNode n : attributes.acceptAll(sv.value(), ctx)) composer.order(new ContextualizedFragment(ctx, n));
    }
    for (ScopedValue sv : selects) {
      JoinNode ctx = registry.lookup(sv.scope());
      for (SqlNode n : attributes.acceptAll(sv.value(), ctx)) composer.select(new ContextualizedFragment(ctx, n));
    }

    return composer.compose(values(preloads), values(includes), !eagerLoads.isEmpty(), page);
  }

  private static void resolveAll(JoinResolver resolver, ContextRegistry registry, List<ScopedValue> specs,
                                 JoinType type, JoinOrigin origin) {
    for (ScopedValue sv : specs) {
      resolver.resolve(sv.value(), registry.lookup(sv.scope()), type, origin);
    }
  }

  // Hash literals are kept as authored (validated up front); [sql, binds...] lists are sanitized.
  private static Object normalizeCondition(Object clause) {
    Objects.requireNonNull(clause, "clause");
    if (clause instanceof Map<?, ?> m) {
      HashSpec.of(m);
      return Collections.unmodifiableMap(new LinkedHashMap<>(m));
    }
    if (clause instanceof Object[] arr) return normalizeCondition(Arrays.asList(arr));
    if (clause instanceof List<?> l) {
      if (l.isEmpty() || !(l.get(0) instanceof String sql)) {
        throw new IllegalArgumentException("Condition list must start with an SQL string: " + l);
      }
      return SqlSanitizer.sanitize(sql, l.subList(1, l.size()).toArray());
    }
    if (clause instanceof String || clause instanceof Expression) return clause;
    throw new IllegalArgumentException("Unsupported condition: " + clause.getClass().getName());
  }

  private static List<Object> values(List<ScopedValue> scoped) {
    List<Object> out = new ArrayList<>(scoped.size());
    for (ScopedValue sv : scoped) out.add(sv.value());
    return Collections.unmodifiableList(out);
  }

  private static List<ScopedValue> append(List<ScopedValue> base, Object... values) {
    List<ScopedValue> out = new ArrayList<>(base);
    for (Object v : values) out.add(ScopedValue.root(Objects.requireNonNull(v, "clause value")));
    return out;
  }

  private static List<ScopedValue> concat(List<ScopedValue> a, List<ScopedValue> b) {
    List<ScopedValue> out = new ArrayList<>(a);
    out.addAll(b);
    return out;
  }

  private static List<ScopedValue> scoped(List<ScopedValue> values, JoinPath prefix) {
    List<ScopedValue> out = new ArrayList<>(values.size());
    for (ScopedValue sv : values) out.add(sv.under(prefix));
    return out;
  }

  private Relation with(Consumer<Builder> change) {
    Builder b = new Builder(this);
    change.accept(b);
    return b.build();
  }

  private static final class Builder {
    private final Relation base;
    private List<ScopedValue> joins;
    private List<ScopedValue> includes;
    private List<ScopedValue> eagerLoads;
    private List<ScopedValue> preloads;
    private List<ScopedValue> wheres;
    private List<ScopedValue> havings;
    private List<ScopedValue> orders;
    private List<ScopedValue> selects;
    private List<ScopedValue> groups;
    private boolean reordered;
    private OffsetPage page;

    private Builder(Relation r) {
      this.base = r;
      this.joins = r.joins;
      this.includes = r.includes;
      this.eagerLoads = r.eagerLoads;
      this.preloads = r.preloads;
      this.wheres = r.wheres;
      this.havings = r.havings;
      this.orders = r.orders;
      this.selects = r.selects;
      this.groups = r.groups;
      this.reordered = r.reordered;
      this.page = r.page;
    }

    private Relation build() {
      return new Relation(base.authoring, base.entity, base.options, joins, includes, eagerLoads, preloads,
          wheres, havings, orders, selects, groups, reordered, page);
    }
  }
}
