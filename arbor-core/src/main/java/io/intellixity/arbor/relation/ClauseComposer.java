package io.intellixity.arbor.relation;

import io.intellixity.arbor.ast.SqlNodes;
import io.intellixity.arbor.ast.TableRef;
import io.intellixity.arbor.join.ContextRegistry;
import io.intellixity.arbor.join.JoinNode;
import io.intellixity.arbor.join.JoinOrigin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Collects contextualized fragments for one build and assembles the {@link ComposedQuery}.
 *
 * <p>Included associations are only joined when any fragment (WHERE, HAVING, ORDER, GROUP or SELECT)
 * references one of their tables, or eager loading was requested. Otherwise their join nodes are dropped and the include
 * specs are reported as preloads.</p>
 */
public final class ClauseComposer {
  private static final Logger log = LoggerFactory.getLogger(ClauseComposer.class);

  private final ContextRegistry registry;
  private final List<ContextualizedFragment> wheres = new ArrayList<>();
  private final List<ContextualizedFragment> havings = new ArrayList<>();
  private final List<ContextualizedFragment> groups = new ArrayList<>();
  private final List<ContextualizedFragment> orders = new ArrayList<>();
  private final List<ContextualizedFragment> selects = new ArrayList<>();

  public ClauseComposer(ContextRegistry registry) {
    this.registry = Objects.requireNonNull(registry, "registry");
  }

  public ClauseComposer where(ContextualizedFragment f) { wheres.add(f); return this; }
  public ClauseComposer having(ContextualizedFragment f) { havings.add(f); return this; }
  public ClauseComposer group(ContextualizedFragment f) { groups.add(f); return this; }
  public ClauseComposer order(ContextualizedFragment f) { orders.add(f); return this; }
  public ClauseComposer select(ContextualizedFragment f) { selects.add(f); return this; }

  public ComposedQuery compose(List<Object> preloads, List<Object> includes, boolean eagerLoadRequested,
                               OffsetPage page) {
    List<JoinNode> all = registry.joinNodes();
    List<JoinNode> included = new ArrayList<>();
    for (JoinNode n : all) {
      if (n.origin() == JoinOrigin.INCLUDE) included.add(n);
    }

    boolean eager = eagerLoadRequested || (!included.isEmpty() && referencesAny(included));
    List<JoinNode> emitted = new ArrayList<>(all);
    List<Object> outPreloads = new ArrayList<>(preloads);
    if (!eager) {
      emitted.removeAll(included);
      outPreloads.addAll(includes);
    }

    JoinNode root = registry.root();
    ComposedQuery q = new ComposedQuery(root.entity().type(), root.table(), emitted, registry.rawJoins(),
        wheres, havings, groups, orders, selects, outPreloads, eager, page);
    log.debug("arbor.build type={} joins={} rawJoins={} wheres={} havings={} orders={} eagerLoading={} preloads={}",
        q.rootType(), emitted.size(), q.rawJoins().size(), wheres.size(), havings.size(), orders.size(),
        q.eagerLoading(), outPreloads.size());
    return q;
  }

  private boolean referencesAny(List<JoinNode> included) {
    Set<TableRef> tables = new HashSet<>();
    for (JoinNode n : included) tables.add(n.table());

    List<ContextualizedFragment> scanned = new ArrayList<>(wheres);
    scanned.addAll(havings);
    scanned.addAll(orders);
    scanned.addAll(groups);
    scanned.addAll(selects);
    for (ContextualizedFragment f : scanned) {
      for (TableRef t : SqlNodes.referencedTables(f.node())) {
        if (tables.contains(t)) return true;
      }
      for (String raw : SqlNodes.rawSql(f.node())) {
        for (TableRef t : tables) {
          if (qualifierPattern(t.alias()).matcher(raw).find()) return true;
        }
      }
    }
    return false;
  }

  // alias. or "alias". not preceded by another identifier character
  private static Pattern qualifierPattern(String alias) {
    return Pattern.compile("(?:^|[^\\w\"])\"?" + Pattern.quote(alias) + "\"?\\.", Pattern.CASE_INSENSITIVE);
  }
}
