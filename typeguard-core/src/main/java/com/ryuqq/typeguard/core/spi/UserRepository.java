package com.ryuqq.typeguard.core.spi;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Document storage SPI for user records.
 *
 * <p>The repository stores untyped user documents keyed by id. It performs no validation of its own:
 * callers narrow every document they read, which lets them detect records that were corrupted
 * inside the storage layer.</p>
 *
 * <p><strong>Ordering:</strong> {@link #findAll()} returns documents in original insertion order.
 * Replacing an existing document keeps its original position.</p>
 *
 * <p><strong>Ownership:</strong> Implementations must store and return copies. A caller mutating a
 * document it passed in, or one it received, must never change stored state.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: every method may be called from multiple threads</li>
 *   <li>Null arguments are rejected with {@link IllegalArgumentException}</li>
 * </ul>
 *
 * @author TypeGuard Team
 * @since 1.0.0
 */
public interface UserRepository {

    /**
     * Inserts or replaces the document stored under {@code id}.
     *
     * @param id the user id
     * @param document the user document
     * @throws IllegalArgumentException if id or document is null
     */
    void save(String id, Map<String, Object> document);

    /**
     * Finds the document stored under {@code id}.
     *
     * @param id the user id
     * @return a copy of the stored document, or empty if absent
     * @throws IllegalArgumentException if id is null
     */
    Optional<Map<String, Object>> findById(String id);

    boolean existsById(String id);

    /**
     * Removes the document stored under {@code id}.
     *
     * @param id the user id
     * @return true if a document was removed
     * @throws IllegalArgumentException if id is null
     */
    boolean delete(String id);

    /**
     * Returns copies of all documents in insertion order.
     *
     * @return documents, oldest insertion first
     */
    List<Map<String, Object>> findAll();

    int count();

    void clear();
}
