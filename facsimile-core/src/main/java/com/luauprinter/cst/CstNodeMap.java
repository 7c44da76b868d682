package com.luauprinter.cst;

import com.luauprinter.InternalConsistencyException;
import com.luauprinter.ast.Node;

import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Maps AST nodes to their concrete syntax tree decoration. Lookups are by node
 * identity: two equal records at the same location are still distinct keys.
 */
public final class CstNodeMap {

    private static final CstNodeMap DISABLED = new CstNodeMap(null);

    private final Map<Node, CstNode> nodes;

    public CstNodeMap() {
        this(new IdentityHashMap<>());
    }

    private CstNodeMap(Map<Node, CstNode> nodes) {
        this.nodes = nodes;
    }

    /**
     * A map that holds nothing and ignores insertions.
     */
    public static CstNodeMap disabled() {
        return DISABLED;
    }

    public boolean isEnabled() {
        return nodes != null;
    }

    public void put(Node node, CstNode cstNode) {
        if (nodes == null) {
            return;
        }
        if (!cstNode.cstKind().canDecorate(node)) {
            throw new InternalConsistencyException(
                "CST node " + cstNode.cstKind() + " cannot decorate " + node.kind() + " at " + node.location());
        }
        nodes.put(node, cstNode);
    }

    public Optional<CstNode> get(Node node) {
        if (nodes == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(nodes.get(node));
    }

    /**
     * Looks up the decoration of {@code node}, which must be of the given type
     * when present.
     *
     * @throws InternalConsistencyException if the stored node has another kind
     */
    public <T extends CstNode> Optional<T> get(Node node, Class<T> type) {
        Optional<CstNode> found = get(node);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        CstNode cstNode = found.get();
        return Optional.of(cstNode.as(type).orElseThrow(() -> new InternalConsistencyException(
            "expected " + type.getSimpleName() + " for " + node.kind() + " at " + node.location()
                + " but found " + cstNode.cstKind())));
    }

    public int size() {
        return nodes == null ? 0 : nodes.size();
    }
}
