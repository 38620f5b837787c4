package com.opro.optimization.api;

import com.opro.optimization.model.Session;

import java.util.List;
import java.util.Optional;

/**
 * Key/value store of whole sessions. Every read returns an independent copy; callers mutate that copy
 * and write it back with {@link #put(Session)}. Writes are last-writer-wins.
 */
public interface SessionStore {

    Optional<Session> get(String id);

    void put(Session session);

    void delete(String id);

    List<Session> listAll();
}
