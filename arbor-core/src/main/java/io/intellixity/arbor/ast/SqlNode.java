package io.intellixity.arbor.ast;

/**
 * Node of a contextualized, fully table-qualified SQL tree.
 *
 * <p>All implementations are records, so two trees are equal exactly when their structure and values are.
 * Dialects lower these nodes to SQL text.</p>
 */
public interface SqlNode {
}
