package io.bptree.collections.bplustree;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Side-effect-free checks of the structural invariants of a tree of a given order:
 *
 * <ul>
 *   <li>sortedness: every node's keys are strictly increasing;
 *   <li>separator validity: every key below child {@code i} of a branch lies in {@code [keys[i-1], keys[i])};
 *   <li>balance: all children of a branch have equal height;
 *   <li>fanout: leaves hold at most {@code order - 1} keys and branches at most {@code order} children.
 * </ul>
 *
 * Violations are described with the path of child indexes from the root, e.g. {@code root/1/0}.
 */
class InvariantValidator<K, V> {
    private static final Logger logger = LoggerFactory.getLogger(InvariantValidator.class);

    private final int order;
    private final Comparator<? super K> comparator;

    InvariantValidator(int order, Comparator<? super K> comparator) {
        this.order = order;
        this.comparator = comparator;
    }

    boolean isSorted(Node<K, V> node) {
        final List<String> out = new ArrayList<>();
        checkSorted(node, "root", out);
        return out.isEmpty();
    }

    boolean separatorsValid(Node<K, V> node) {
        final List<String> out = new ArrayList<>();
        checkSeparators(node, null, null, "root", out);
        return out.isEmpty();
    }

    boolean balanced(Node<K, V> node) {
        final List<String> out = new ArrayList<>();
        checkBalance(node, "root", out);
        return out.isEmpty();
    }

    boolean fanoutRespected(Node<K, V> node) {
        final List<String> out = new ArrayList<>();
        checkFanout(node, "root", out);
        return out.isEmpty();
    }

    boolean valid(Node<K, V> root) {
        return report(root).isValid();
    }

    ValidationReport report(Node<K, V> root) {
        final List<String> out = new ArrayList<>();
        checkSorted(root, "root", out);
        checkSeparators(root, null, null, "root", out);
        checkBalance(root, "root", out);
        checkFanout(root, "root", out);
        for (String violation : out) {
            logger.debug("invariant violation: {}", violation);
        }
        return new ValidationReport(out);
    }

    private void checkSorted(Node<K, V> node, String path, List<String> out) {
        final ArrayLike<K> keys = node.getKeys();
        for (int i = 1; i < keys.size(); i++) {
            if (comparator.compare(keys.get(i - 1), keys.get(i)) >= 0) {
                out.add(String.format("%s: keys not strictly increasing at %d (%s, %s)",
                        path, i, keys.get(i - 1), keys.get(i)));
            }
        }
        if (!node.isLeaf()) {
            final ArrayLike<Node<K, V>> children = ((Branch<K, V>) node).getChildren();
            for (int i = 0; i < children.size(); i++) {
                checkSorted(children.get(i), path + "/" + i, out);
            }
        }
    }

    // lb is inclusive, ub exclusive, null means unbounded; bounds narrow on the way down
    private void checkSeparators(Node<K, V> node, K lb, K ub, String path, List<String> out) {
        final ArrayLike<K> keys = node.getKeys();
        final int n = keys.size();
        for (int i = 0; i < n; i++) {
            final K key = keys.get(i);
            if ((lb != null && comparator.compare(key, lb) < 0) || (ub != null && comparator.compare(key, ub) >= 0)) {
                out.add(String.format("%s: key %s outside separator bounds [%s, %s)", path, key, lb, ub));
            }
        }
        if (node.isLeaf()) {
            return;
        }
        // Branch's constructor guarantees n + 1 children
        final ArrayLike<Node<K, V>> children = ((Branch<K, V>) node).getChildren();
        for (int i = 0; i <= n; i++) {
            checkSeparators(children.get(i), i > 0 ? keys.get(i - 1) : lb, i < n ? keys.get(i) : ub, path + "/" + i, out);
        }
    }

    // returns the height of node as seen through its first child
    private int checkBalance(Node<K, V> node, String path, List<String> out) {
        if (node.isLeaf()) {
            return 0;
        }
        final ArrayLike<Node<K, V>> children = ((Branch<K, V>) node).getChildren();
        final int height = checkBalance(children.get(0), path + "/0", out);
        for (int i = 1; i < children.size(); i++) {
            final int h = checkBalance(children.get(i), path + "/" + i, out);
            if (h != height) {
                out.add(String.format("%s: child %d has height %d, child 0 has height %d", path, i, h, height));
            }
        }
        return height + 1;
    }

    private void checkFanout(Node<K, V> node, String path, List<String> out) {
        if (node.isLeaf()) {
            if (node.getKeys().size() > order - 1) {
                out.add(String.format("%s: leaf holds %d keys, at most %d allowed",
                        path, node.getKeys().size(), order - 1));
            }
            return;
        }
        final ArrayLike<Node<K, V>> children = ((Branch<K, V>) node).getChildren();
        if (children.size() > order) {
            out.add(String.format("%s: branch holds %d children, at most %d allowed", path, children.size(), order));
        }
        for (int i = 0; i < children.size(); i++) {
            checkFanout(children.get(i), path + "/" + i, out);
        }
    }
}
