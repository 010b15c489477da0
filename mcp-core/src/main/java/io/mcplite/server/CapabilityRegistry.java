/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcplite.server;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

import io.mcplite.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A keyed collection of capability entries shared between registering code and the
 * session dispatcher.
 *
 * <p>
 * Readers run in parallel and writers are exclusive. The lock is fair so a steady stream
 * of list requests cannot starve a registration. Entries keep their registration order.
 * Registering under an existing key replaces the entry in place.
 *
 * @param <T> the entry type
 */
public class CapabilityRegistry<T> {

	private static final Logger logger = LoggerFactory.getLogger(CapabilityRegistry.class);

	private final String kind;

	private final Map<String, T> entries = new LinkedHashMap<>();

	private final ReadWriteLock lock = new ReentrantReadWriteLock(true);

	/**
	 * @param kind the capability kind used in log messages, e.g. {@code "tool"}
	 */
	public CapabilityRegistry(String kind) {
		Assert.hasText(kind, "kind must not be empty");
		this.kind = kind;
	}

	/**
	 * Registers an entry, replacing any entry under the same key.
	 * @param key the entry key
	 * @param entry the entry
	 * @return the replaced entry, if there was one
	 */
	public Optional<T> register(String key, T entry) {
		Assert.hasText(key, this.kind + " key must not be empty");
		Assert.notNull(entry, this.kind + " entry must not be null");

		T previous;
		this.lock.writeLock().lock();
		try {
			previous = this.entries.put(key, entry);
		}
		finally {
			this.lock.writeLock().unlock();
		}

		if (previous != null) {
			logger.warn("Replaced existing {} registration '{}'", this.kind, key);
		}
		else {
			logger.debug("Registered {} '{}'", this.kind, key);
		}
		return Optional.ofNullable(previous);
	}

	/**
	 * Removes the entry registered under the key.
	 * @param key the entry key
	 * @return the removed entry, if there was one
	 */
	public Optional<T> unregister(String key) {
		T removed;
		this.lock.writeLock().lock();
		try {
			removed = this.entries.remove(key);
		}
		finally {
			this.lock.writeLock().unlock();
		}
		if (removed != null) {
			logger.debug("Removed {} '{}'", this.kind, key);
		}
		return Optional.ofNullable(removed);
	}

	/**
	 * Looks up an entry by exact key.
	 * @param key the entry key
	 * @return the entry, or empty
	 */
	public Optional<T> lookup(String key) {
		if (key == null) {
			return Optional.empty();
		}
		return read(map -> Optional.ofNullable(map.get(key)));
	}

	/**
	 * Returns a point-in-time copy of all entries in registration order. Later
	 * registrations never show up in a returned list.
	 * @return an immutable snapshot
	 */
	public List<T> list() {
		return read(map -> List.copyOf(map.values()));
	}

	public int size() {
		return read(Map::size);
	}

	/**
	 * Runs the reader function against the entries while holding the read lock. The
	 * function must not keep a reference to the map.
	 */
	protected <R> R read(Function<Map<String, T>, R> reader) {
		this.lock.readLock().lock();
		try {
			return reader.apply(this.entries);
		}
		finally {
			this.lock.readLock().unlock();
		}
	}

}
