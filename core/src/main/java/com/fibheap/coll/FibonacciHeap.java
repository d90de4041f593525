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
import java.util.Comparator;
import java.util.Deque;
import java.util.List;

/**
 * A mergeable minimum priority queue (https://en.wikipedia.org/wiki/Fibonacci_heap). Insertion and merging are O(1),
 * the structural work is deferred to {@link #pop()} which consolidates the root list in O(log(N)) amortized.
 * <p>
 * The tree holding the minimum is kept outside of the root list. There is no decrease-key and no removal of arbitrary
 * elements, for a shortest path search use lazy deletion instead, see {@link com.fibheap.routing.Dijkstra}.
 * <p>
 * This class is not thread-safe.
 */
public class FibonacciHeap<T> {
    private static final double LOG_PHI = Math.log(1.61803);
    private final Comparator<? super T> comparator;
    private final Deque<FibonacciTree<T>> roots = new ArrayDeque<>();
    private FibonacciTree<T> min;
    private int size;

    /**
     * Creates a heap ordering its elements by their natural ordering, i.e. the elements must implement Comparable.
     */
    @SuppressWarnings("unchecked")
    public FibonacciHeap() {
        this((Comparator<? super T>) Comparator.naturalOrder());
    }

    public FibonacciHeap(Comparator<? super T> comparator) {
        if (comparator == null)
            throw new IllegalArgumentException("comparator cannot be null");
        this.comparator = comparator;
    }

    /**
     * Adds the value as a new singleton tree. No consolidation happens here.
     */
    public void push(T value) {
        addRoot(new FibonacciTree<>(value));
        size++;
    }

    /**
     * Merges two heaps into one. Both heaps are consumed by this operation: the returned heap contains all elements
     * and the other argument is left empty and must not be used afterwards. If one of the heaps is empty the other one
     * is returned unchanged.
     * <p>
     * Both heaps must order their elements with an equal comparator, e.g. the same Comparator instance or both the
     * natural ordering, otherwise the trees of one heap would violate the heap order of the other.
     *
     * @throws IllegalArgumentException if both arguments are the same heap or if their comparators are not equal
     */
    public static <T> FibonacciHeap<T> merge(FibonacciHeap<T> heap1, FibonacciHeap<T> heap2) {
        if (heap1 == heap2)
            throw new IllegalArgumentException("Cannot merge a heap with itself");
        if (!heap1.comparator.equals(heap2.comparator))
            throw new IllegalArgumentException("Cannot merge heaps with different comparators: " + heap1.comparator + " vs. " + heap2.comparator);
        if (heap1.isEmpty())
            return heap2;
        if (heap2.isEmpty())
            return heap1;

        heap1.roots.addAll(heap2.roots);
        heap2.roots.clear();
        FibonacciTree<T> otherMin = heap2.min;
        if (FibonacciTree.isSmallerOrEqual(otherMin, heap1.min, heap1.comparator)) {
            heap1.roots.addLast(heap1.min);
            heap1.min = otherMin;
            heap1.size += heap2.size;
        } else {
            // the element is re-pushed which counts it again
            heap1.size += heap2.size - 1;
            FibonacciTree.Extraction<T> extraction = otherMin.extract();
            heap1.push(extraction.payload());
            heap1.roots.addAll(extraction.children());
        }
        heap2.min = null;
        heap2.size = 0;
        return heap1;
    }

    /**
     * Removes the minimum element
     *
     * @return the smallest element or null if the heap is empty
     */
    public T pop() {
        if (isEmpty())
            return null;

        FibonacciTree<T> minTree = min;
        min = null;
        size--;
        FibonacciTree.Extraction<T> extraction = minTree.extract();
        roots.addAll(extraction.children());
        if (!isEmpty()) {
            // any root works as provisional minimum, consolidation finds the real one
            min = roots.pollFirst();
            consolidate();
        }
        return extraction.payload();
    }

    /**
     * @return the smallest element without removing it or null if the heap is empty
     */
    public T peek() {
        return min == null ? null : min.peekPayload();
    }

    /**
     * Links roots of equal degree until all root degrees are distinct and then determines the new minimum.
     */
    @SuppressWarnings("unchecked")
    void consolidate() {
        if (isEmpty())
            return;

        // the maximum degree of a tree with size elements is log(size) with base 1.61803
        int bucketCount = (int) Math.ceil(Math.log(size) / LOG_PHI) + 1;
        FibonacciTree<T>[] buckets = new FibonacciTree[bucketCount];
        roots.addFirst(min);
        min = null;
        while (!roots.isEmpty()) {
            FibonacciTree<T> tree = roots.pollFirst();
            int degree = tree.getDegree();
            while (buckets[degree] != null) {
                tree = FibonacciTree.merge(tree, buckets[degree], comparator);
                buckets[degree] = null;
                degree = tree.getDegree();
            }
            buckets[degree] = tree;
        }

        for (FibonacciTree<T> tree : buckets) {
            if (tree != null)
                addRoot(tree);
        }
    }

    private void addRoot(FibonacciTree<T> tree) {
        if (min == null) {
            min = tree;
        } else if (FibonacciTree.isSmallerOrEqual(tree, min, comparator)) {
            roots.addLast(min);
            min = tree;
        } else {
            roots.addLast(tree);
        }
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    FibonacciTree<T> getMinTree() {
        return min;
    }

    List<FibonacciTree<T>> getRoots() {
        return new ArrayList<>(roots);
    }

    /**
     * Makes the internal shape visible: one line for the tree holding the minimum ("Min:") and one line per remaining
     * root ("Tree k:"), each listing the payloads of the tree in pre-order.
     *
     * @return the dump or an empty string if the heap is empty
     */
    public String preorder() {
        StringBuilder sb = new StringBuilder();
        if (min != null)
            sb.append("Min: ").append(min).append('\n');

        int index = 1;
        for (FibonacciTree<T> tree : roots) {
            sb.append("Tree ").append(index++).append(": ").append(tree).append('\n');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "size=" + size + ", min=" + peek();
    }
}
