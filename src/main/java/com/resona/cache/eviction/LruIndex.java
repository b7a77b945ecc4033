package com.resona.cache.eviction;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Bounded least-recently-used index: a hash map over an intrusive doubly linked list.
 *
 * The head is the most recently used entry and the tail the least recently used one.
 * {@link #get} moves the entry to the head, {@link #put} inserts at the head and evicts
 * from the tail while the index would exceed its capacity. Eviction therefore follows
 * access recency, not insertion order.
 *
 * Not thread-safe. Tiers guard every call with their own lock.
 *
 * @param <K> key type
 * @param <V> value type
 */
public class LruIndex<K, V> {

    private final int capacity;
    private final Map<K, Node<K, V>> nodes;
    private Node<K, V> head;
    private Node<K, V> tail;

    public LruIndex(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.nodes = new HashMap<>();
    }

    /**
     * Look up a value and mark it most recently used.
     *
     * @return the value, or {@code null} if absent
     */
    public V get(K key) {
        Node<K, V> node = nodes.get(key);
        if (node == null) {
            return null;
        }
        moveToHead(node);
        return node.value;
    }

    /**
     * Look up a value without touching its recency.
     */
    public V peek(K key) {
        Node<K, V> node = nodes.get(key);
        return node == null ? null : node.value;
    }

    public boolean contains(K key) {
        return nodes.containsKey(key);
    }

    /**
     * Insert or replace a value as most recently used.
     *
     * @return entries evicted to stay within capacity, least recent first (never the inserted key)
     */
    public List<Evicted<K, V>> put(K key, V value) {
        Node<K, V> existing = nodes.get(key);
        if (existing != null) {
            existing.value = value;
            moveToHead(existing);
            return List.of();
        }

        List<Evicted<K, V>> evicted = new ArrayList<>(1);
        while (nodes.size() >= capacity) {
            Node<K, V> eldest = tail;
            unlink(eldest);
            nodes.remove(eldest.key);
            evicted.add(new Evicted<>(eldest.key, eldest.value));
        }

        Node<K, V> node = new Node<>(key, value);
        nodes.put(key, node);
        linkAtHead(node);
        return evicted;
    }

    /**
     * @return the removed value, or {@code null} if absent
     */
    public V remove(K key) {
        Node<K, V> node = nodes.remove(key);
        if (node == null) {
            return null;
        }
        unlink(node);
        return node.value;
    }

    /**
     * Key that the next eviction would remove, or {@code null} when empty.
     */
    public K eldestKey() {
        return tail == null ? null : tail.key;
    }

    /**
     * Snapshot of the keys ordered from least to most recently used.
     */
    public List<K> keysFromEldest() {
        List<K> keys = new ArrayList<>(nodes.size());
        for (Node<K, V> node = tail; node != null; node = node.prev) {
            keys.add(node.key);
        }
        return keys;
    }

    public int size() {
        return nodes.size();
    }

    public int capacity() {
        return capacity;
    }

    public void clear() {
        nodes.clear();
        head = null;
        tail = null;
    }

    private void moveToHead(Node<K, V> node) {
        if (node == head) {
            return;
        }
        unlink(node);
        linkAtHead(node);
    }

    private void linkAtHead(Node<K, V> node) {
        node.prev = null;
        node.next = head;
        if (head != null) {
            head.prev = node;
        }
        head = node;
        if (tail == null) {
            tail = node;
        }
    }

    private void unlink(Node<K, V> node) {
        if (node.prev != null) {
            node.prev.next = node.next;
        } else {
            head = node.next;
        }
        if (node.next != null) {
            node.next.prev = node.prev;
        } else {
            tail = node.prev;
        }
        node.prev = null;
        node.next = null;
    }

    /**
     * An entry pushed out of the index by {@link #put}.
     */
    public record Evicted<K, V>(K key, V value) {
    }

    private static final class Node<K, V> {
        private final K key;
        private V value;
        private Node<K, V> prev;
        private Node<K, V> next;

        private Node(K key, V value) {
            this.key = key;
            this.value = value;
        }
    }
}
