package com.ryuqq.typeguard.adapter.inmemory.repository;

import com.ryuqq.typeguard.core.model.Documents;
import com.ryuqq.typeguard.core.spi.UserRepository;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory implementation of {@link UserRepository} SPI.
 *
 * <p>Documents are kept in a {@link LinkedHashMap} so that {@link #findAll()} returns them in
 * insertion order; replacing a document does not move it. All methods are {@code synchronized}.</p>
 *
 * <p><strong>Copy Semantics:</strong></p>
 * <ul>
 *   <li>save: stores a deep, unmodifiable copy of the given document</li>
 *   <li>findById / findAll: return fresh top-level copies</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>No indexes; findAll is O(N)</li>
 * </ul>
 *
 * @author TypeGuard Team
 * @since 1.0.0
 */
public class InMemoryUserRepository implements UserRepository {

    /**
     * Key: user id, Value: frozen user document.
     */
    private final Map<String, Map<String, Object>> documents = new LinkedHashMap<>();

    @Override
    public synchronized void save(String id, Map<String, Object> document) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (document == null) {
            throw new IllegalArgumentException("document cannot be null");
        }
        documents.put(id, Documents.freeze(document));
    }

    @Override
    public synchronized Optional<Map<String, Object>> findById(String id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        Map<String, Object> document = documents.get(id);
        return document == null ? Optional.empty() : Optional.of(new LinkedHashMap<>(document));
    }

    @Override
    public synchronized boolean existsById(String id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        return documents.containsKey(id);
    }

    @Override
    public synchronized boolean delete(String id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        return documents.remove(id) != null;
    }

    @Override
    public synchronized List<Map<String, Object>> findAll() {
        List<Map<String, Object>> copies = new ArrayList<>(documents.size());
        for (Map<String, Object> document : documents.values()) {
            copies.add(new LinkedHashMap<>(document));
        }
        return copies;
    }

    @Override
    public synchronized int count() {
        return documents.size();
    }

    /**
     * Clears all stored documents.
     */
    @Override
    public synchronized void clear() {
        documents.clear();
    }
}
