package net.seitter.heapstore.btree;

import net.seitter.heapstore.schema.Row;
import net.seitter.heapstore.schema.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * In-memory B+Tree of order {@code k}: every node holds at most {@code k - 1} keys and an
 * inner node at most {@code k} children. Rows live only in the leaves, which are chained
 * left to right for range scans.
 *
 * <p>Nodes are kept in an arena and refer to each other by their position in it. Each
 * distinct key has one bucket of rows; rows inserted under an equal key are appended to
 * that bucket, so lookups return duplicates in insertion order.
 */
public class BPlusTree {
    private static final int NONE = -1;

    private final int order;
    private final List<Node> nodes = new ArrayList<>();
    private int root;
    private long size;

    /**
     * Creates an empty tree.
     *
     * @param order The maximum number of children per node, at least 3
     */
    public BPlusTree(int order) {
        if (order < 3) {
            throw new IllegalArgumentException("B+Tree order must be at least 3: " + order);
        }
        this.order = order;
        this.root = newNode(true);
    }

    public int getOrder() {
        return order;
    }

    /**
     * Gets the number of rows in the tree, counting duplicates.
     *
     * @return The entry count
     */
    public long size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public int getNodeCount() {
        return nodes.size();
    }

    /**
     * Gets the number of levels from the root to the leaves.
     *
     * @return The height, 1 for a tree that is a single leaf
     */
    public int getHeight() {
        int height = 1;
        Node node = nodes.get(root);
        while (!node.leaf) {
            node = nodes.get(node.children.get(0));
            height++;
        }
        return height;
    }

    /**
     * Inserts a row under a key. Duplicate keys are allowed.
     *
     * @param key The key; use {@link Value#NULL} for a NULL key
     * @param row The row
     */
    public void insert(Value key, Row row) {
        if (key == null || row == null) {
            throw new IllegalArgumentException("Key and row must not be null");
        }

        List<Integer> path = new ArrayList<>();
        int current = root;
        while (!nodes.get(current).leaf) {
            path.add(current);
            Node inner = nodes.get(current);
            current = inner.children.get(childIndex(inner, key));
        }

        Node leaf = nodes.get(current);
        int position = 0;
        while (position < leaf.keys.size() && leaf.keys.get(position).compareTo(key) < 0) {
            position++;
        }
        if (position < leaf.keys.size() && leaf.keys.get(position).compareTo(key) == 0) {
            leaf.buckets.get(position).add(row);
        } else {
            List<Row> bucket = new ArrayList<>(1);
            bucket.add(row);
            leaf.keys.add(position, key);
            leaf.buckets.add(position, bucket);
        }
        size++;

        if (leaf.keys.size() > order - 1) {
            splitLeaf(current, path);
        }
    }

    /**
     * Finds all rows stored under a key.
     *
     * @param key The key
     * @return The rows in insertion order, empty if the key is absent
     */
    public List<Row> find(Value key) {
        if (key == null) {
            throw new IllegalArgumentException("Key must not be null");
        }
        Node leaf = nodes.get(findLeaf(key));
        for (int i = 0; i < leaf.keys.size(); i++) {
            int cmp = leaf.keys.get(i).compareTo(key);
            if (cmp == 0) {
                return Collections.unmodifiableList(new ArrayList<>(leaf.buckets.get(i)));
            } else if (cmp > 0) {
                break;
            }
        }
        return Collections.emptyList();
    }

    /**
     * Scans the rows whose keys fall between two bounds, in ascending key order.
     *
     * @param lower The lower bound, or null for none
     * @param upper The upper bound, or null for none
     * @param lowerInclusive Whether a key equal to the lower bound is included
     * @param upperInclusive Whether a key equal to the upper bound is included
     * @return A lazy iterator over the matching rows
     */
    public Iterator<Row> range(Value lower, Value upper, boolean lowerInclusive, boolean upperInclusive) {
        int start = lower == null ? leftmostLeaf() : findLeaf(lower);
        return new RangeIterator(start, lower, upper, lowerInclusive, upperInclusive);
    }

    /**
     * Scans every row in key order.
     *
     * @return A lazy iterator over all rows
     */
    public Iterator<Row> iterator() {
        return range(null, null, true, true);
    }

    /**
     * Gets the distinct keys in ascending order.
     *
     * @return The keys
     */
    public List<Value> keys() {
        List<Value> keys = new ArrayList<>();
        for (int leaf = leftmostLeaf(); leaf != NONE; leaf = nodes.get(leaf).next) {
            keys.addAll(nodes.get(leaf).keys);
        }
        return keys;
    }

    private int findLeaf(Value key) {
        int current = root;
        while (!nodes.get(current).leaf) {
            Node inner = nodes.get(current);
            current = inner.children.get(childIndex(inner, key));
        }
        return current;
    }

    private int leftmostLeaf() {
        int current = root;
        while (!nodes.get(current).leaf) {
            current = nodes.get(current).children.get(0);
        }
        return current;
    }

    // Keys equal to a separator belong to its right subtree
    private static int childIndex(Node inner, Value key) {
        int i = 0;
        while (i < inner.keys.size() && key.compareTo(inner.keys.get(i)) >= 0) {
            i++;
        }
        return i;
    }

    private void splitLeaf(int leafIndex, List<Integer> path) {
        Node leaf = nodes.get(leafIndex);
        int mid = leaf.keys.size() / 2;

        int rightIndex = newNode(true);
        Node right = nodes.get(rightIndex);
        moveTail(leaf.keys, right.keys, mid);
        moveTail(leaf.buckets, right.buckets, mid);
        right.next = leaf.next;
        leaf.next = rightIndex;

        insertIntoParent(leafIndex, right.keys.get(0), rightIndex, path);
    }

    private void splitInner(int nodeIndex, List<Integer> path) {
        Node node = nodes.get(nodeIndex);
        int mid = node.keys.size() / 2;
        Value separator = node.keys.get(mid);

        int rightIndex = newNode(false);
        Node right = nodes.get(rightIndex);
        moveTail(node.keys, right.keys, mid + 1);
        moveTail(node.children, right.children, mid + 1);
        node.keys.remove(mid);

        insertIntoParent(nodeIndex, separator, rightIndex, path);
    }

    private void insertIntoParent(int leftIndex, Value separator, int rightIndex, List<Integer> path) {
        if (path.isEmpty()) {
            int newRoot = newNode(false);
            Node rootNode = nodes.get(newRoot);
            rootNode.keys.add(separator);
            rootNode.children.add(leftIndex);
            rootNode.children.add(rightIndex);
            root = newRoot;
            return;
        }

        int parentIndex = path.remove(path.size() - 1);
        Node parent = nodes.get(parentIndex);
        int position = parent.children.indexOf(leftIndex);
        parent.keys.add(position, separator);
        parent.children.add(position + 1, rightIndex);

        if (parent.keys.size() > order - 1) {
            splitInner(parentIndex, path);
        }
    }

    private static <T> void moveTail(List<T> from, List<T> to, int fromIndex) {
        List<T> tail = from.subList(fromIndex, from.size());
        to.addAll(tail);
        tail.clear();
    }

    private int newNode(boolean leaf) {
        nodes.add(new Node(leaf));
        return nodes.size() - 1;
    }

    /**
     * Checks the structural invariants: keys strictly ascending within and across leaves,
     * node occupancy within the order, separators bounding their subtrees, all leaves on
     * the same level.
     *
     * @throws IllegalStateException If an invariant is violated
     */
    void checkInvariants() {
        checkNode(root, null, null, 1, getHeight(), true);

        Value previous = null;
        long rows = 0;
        for (int leaf = leftmostLeaf(); leaf != NONE; leaf = nodes.get(leaf).next) {
            Node node = nodes.get(leaf);
            for (int i = 0; i < node.keys.size(); i++) {
                if (previous != null && previous.compareTo(node.keys.get(i)) >= 0) {
                    throw new IllegalStateException("Leaf chain out of order at key " + node.keys.get(i));
                }
                previous = node.keys.get(i);
                rows += node.buckets.get(i).size();
            }
        }
        if (rows != size) {
            throw new IllegalStateException("Leaf chain holds " + rows + " rows, expected " + size);
        }
    }

    private void checkNode(int index, Value low, Value high, int depth, int height, boolean isRoot) {
        Node node = nodes.get(index);
        if (node.keys.size() > order - 1 || (!isRoot && node.keys.isEmpty())) {
            throw new IllegalStateException("Node " + index + " holds " + node.keys.size() + " keys");
        }
        for (Value key : node.keys) {
            if ((low != null && key.compareTo(low) < 0) || (high != null && key.compareTo(high) >= 0)) {
                throw new IllegalStateException("Key " + key + " of node " + index + " is outside [" +
                        low + ", " + high + ")");
            }
        }
        if (node.leaf) {
            if (depth != height) {
                throw new IllegalStateException("Leaf " + index + " at depth " + depth + ", expected " + height);
            }
            return;
        }
        if (node.children.size() != node.keys.size() + 1) {
            throw new IllegalStateException("Inner node " + index + " has " + node.children.size() +
                    " children for " + node.keys.size() + " keys");
        }
        for (int i = 0; i < node.children.size(); i++) {
            Value childLow = i == 0 ? low : node.keys.get(i - 1);
            Value childHigh = i == node.keys.size() ? high : node.keys.get(i);
            checkNode(node.children.get(i), childLow, childHigh, depth + 1, height, false);
        }
    }

    private static final class Node {
        final boolean leaf;
        final List<Value> keys = new ArrayList<>();
        // Leaf nodes only
        final List<List<Row>> buckets;
        int next = NONE;
        // Inner nodes only
        final List<Integer> children;

        Node(boolean leaf) {
            this.leaf = leaf;
            this.buckets = leaf ? new ArrayList<>() : Collections.emptyList();
            this.children = leaf ? Collections.emptyList() : new ArrayList<>();
        }
    }

    private final class RangeIterator implements Iterator<Row> {
        private final Value lower;
        private final Value upper;
        private final boolean lowerInclusive;
        private final boolean upperInclusive;

        private int leaf;
        private int position;
        private Iterator<Row> bucket = Collections.emptyIterator();
        private boolean started;
        private boolean finished;

        RangeIterator(int startLeaf, Value lower, Value upper, boolean lowerInclusive, boolean upperInclusive) {
            this.leaf = startLeaf;
            this.lower = lower;
            this.upper = upper;
            this.lowerInclusive = lowerInclusive;
            this.upperInclusive = upperInclusive;
            this.started = lower == null;
        }

        @Override
        public boolean hasNext() {
            while (!bucket.hasNext()) {
                if (finished || !advance()) {
                    finished = true;
                    return false;
                }
            }
            return true;
        }

        @Override
        public Row next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return bucket.next();
        }

        // Moves to the bucket of the next key inside the range
        private boolean advance() {
            while (leaf != NONE) {
                Node node = nodes.get(leaf);
                while (position < node.keys.size()) {
                    Value key = node.keys.get(position);
                    List<Row> rows = node.buckets.get(position);
                    position++;

                    if (!started) {
                        int cmp = key.compareTo(lower);
                        if (cmp < 0 || (cmp == 0 && !lowerInclusive)) {
                            continue;
                        }
                        started = true;
                    }
                    if (upper != null) {
                        int cmp = key.compareTo(upper);
                        if (cmp > 0 || (cmp == 0 && !upperInclusive)) {
                            leaf = NONE;
                            return false;
                        }
                    }
                    bucket = rows.iterator();
                    return true;
                }
                leaf = node.next;
                position = 0;
            }
            return false;
        }
    }
}
