/*
 *  Licensed to GraphHopper GmbH under one or more contributor
 *  license agreements. See the NOTICE file distributed with this work for
 *  additional information regarding copyright ownership.
 *
 *  GraphHopper GmbH licenses this file to you under the Apache License,
 *  Version 2.0 (the "License"); you may not use this file except in
 *  compliance with the License. You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */
package com.fibheap.coll;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * A heap-ordered multi-way tree as used by the {@link FibonacciHeap}. Every tree owns its children exclusively, there
 * are no parent or sibling links as the heap never walks upwards.
 * <p>
 * A tree is intact until {@link #extract()} is called. Extraction hands out the payload together with the now
 * orphaned children, after that the tree must not be compared, merged or traversed anymore.
 */
public class FibonacciTree<T> {
    private final List<FibonacciTree<T>> children = new ArrayList<>();
    private T payload;
    private int degree;

    public FibonacciTree(T payload) {
        this.payload = Objects.requireNonNull(payload, "payload cannot be null");
    }

    /**
     * @return true if the payload of tree1 is smaller or equal to the payload of tree2
     */
    public static <T> boolean isSmallerOrEqual(FibonacciTree<T> tree1, FibonacciTree<T> tree2, Comparator<? super T> comparator) {
        return comparator.compare(tree1.peekPayload(), tree2.peekPayload()) <= 0;
    }

    /**
     * Links two trees. The tree with the smaller or equal payload becomes the parent, on a tie the first argument wins.
     * Both arguments are consumed, the loser is owned by the returned tree afterwards.
     */
    public static <T> FibonacciTree<T> merge(FibonacciTree<T> tree1, FibonacciTree<T> tree2, Comparator<? super T> comparator) {
        if (tree1 == tree2)
            throw new IllegalArgumentException("Cannot merge a tree with itself");

        if (isSmallerOrEqual(tree1, tree2, comparator)) {
            tree1.addChild(tree2);
            return tree1;
        } else {
            tree2.addChild(tree1);
            return tree2;
        }
    }

    void addChild(FibonacciTree<T> tree) {
        checkIntact();
        children.add(tree);
        degree++;
    }

    public int getDegree() {
        return degree;
    }

    public T peekPayload() {
        checkIntact();
        return payload;
    }

    public boolean isExtracted() {
        return payload == null;
    }

    /**
     * Consumes this tree: removes the payload and releases all direct children which keep their own subtrees. Can
     * be called only once per tree.
     */
    public Extraction<T> extract() {
        checkIntact();
        T result = payload;
        payload = null;
        List<FibonacciTree<T>> orphans = new ArrayList<>(children);
        children.clear();
        return new Extraction<>(result, orphans);
    }

    List<FibonacciTree<T>> getChildren() {
        return Collections.unmodifiableList(children);
    }

    /**
     * Depth-first pre-order traversal: this node, then every child in insertion order. The returned Iterable can be
     * iterated multiple times, each iteration is lazy and uses an explicit stack instead of recursion.
     */
    public Iterable<T> preorder() {
        checkIntact();
        return () -> new PreorderIterator<>(this);
    }

    private void checkIntact() {
        // only reachable if a tree handle is reused after extract, i.e. a bug in the caller
        if (payload == null)
            throw new IllegalStateException("Payload was already extracted from this tree");
    }

    /**
     * @return the space separated pre-order listing of the payloads
     */
    @Override
    public String toString() {
        if (payload == null)
            return "extracted";

        StringBuilder sb = new StringBuilder();
        for (T value : preorder()) {
            if (sb.length() > 0)
                sb.append(' ');
            sb.append(value);
        }
        return sb.toString();
    }

    /**
     * The result of {@link #extract()}: the payload of the former root and its direct children in their original order.
     */
    public record Extraction<T>(T payload, List<FibonacciTree<T>> children) {
    }

    private static class PreorderIterator<T> implements Iterator<T> {
        private final Deque<FibonacciTree<T>> stack = new ArrayDeque<>();

        PreorderIterator(FibonacciTree<T> root) {
            stack.push(root);
        }

        @Override
        public boolean hasNext() {
            return !stack.isEmpty();
        }

        @Override
        public T next() {
            if (stack.isEmpty())
                throw new NoSuchElementException();

            FibonacciTree<T> tree = stack.pop();
            List<FibonacciTree<T>> list = tree.children;
            // push in reverse order so that the first child is visited first
            for (int i = list.size() - 1; i >= 0; i--) {
                stack.push(list.get(i));
            }
            return tree.peekPayload();
        }
    }
}
