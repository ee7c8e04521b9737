package com.codeheadsystems.p9sk.keystore;

import com.codeheadsystems.p9sk.common.Attributes;
import com.codeheadsystems.p9sk.exceptions.KeyResolutionException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link KeyStore}.
 * <p>
 * Keys are matched in the order they were added. {@code role} in a query only matches keys that
 * declare a role; keys without one serve either role. Queries for private attributes
 * ({@code !password?}) are satisfied by any key, since every stored key carries its derived
 * private part.
 * <p>
 * Every acquisition hands out a fresh copy. The store counts the copies of each stored key that
 * are still outstanding.
 */
public class InMemoryKeyStore implements KeyStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryKeyStore.class);

  private final List<KeyRecord> keys = new CopyOnWriteArrayList<>();
  // acquired copy -> stored key it was copied from
  private final Map<KeyRecord, KeyRecord> outstanding = new ConcurrentHashMap<>();
  private final Map<KeyRecord, Integer> acquisitions = new ConcurrentHashMap<>();

  /**
   * Adds a key given in attribute syntax, e.g.
   * {@code proto=p9sk1 dom=example user=alice !password=secret}.
   *
   * @param text the key
   * @return the stored record
   * @throws KeyResolutionException if the key has no usable private part
   */
  public KeyRecord addKey(String text) {
    return addKey(Attributes.parse(text));
  }

  /**
   * Adds a key.
   *
   * @param attributes the key attributes, including private ones
   * @return the stored record
   * @throws KeyResolutionException if the key has no usable private part
   */
  public KeyRecord addKey(Attributes attributes) {
    KeyRecord record = KeyRecord.fromAttributes(attributes);
    keys.add(record);
    log.debug("Added key {}", record.attributes());
    return record;
  }

  @Override
  public KeyRecord acquire(KeyQuery query) {
    Attributes pattern = publicPattern(query.pattern());
    Optional<KeyRecord> match = keys.stream()
        .filter(k -> roleMatches(k, query))
        .filter(k -> k.attributes().satisfies(pattern))
        .findFirst();
    if (match.isEmpty()) {
      throw new KeyResolutionException("key not found: " + query);
    }
    KeyRecord stored = match.get();
    KeyRecord owned = stored.copy();
    outstanding.put(owned, stored);
    int count = acquisitions.merge(stored, 1, Integer::sum);
    log.debug("Acquired key {} ({} outstanding for this key)", owned.attributes(), count);
    return owned;
  }

  @Override
  public void release(KeyRecord record) {
    KeyRecord stored = outstanding.remove(record);
    if (stored == null) {
      log.warn("Ignoring release of a key record this store does not hold: {}", record);
      return;
    }
    record.close();
    Integer count = acquisitions.computeIfPresent(stored, (k, n) -> n == 1 ? null : n - 1);
    log.debug("Released key {} ({} outstanding for this key)", record.attributes(), count == null ? 0 : count);
  }

  /**
   * Number of acquired records not yet released, across all keys.
   *
   * @return the int
   */
  public int outstanding() {
    return outstanding.size();
  }

  /**
   * Number of copies of one stored key that are acquired and not yet released.
   *
   * @param stored a record returned by {@link #addKey}
   * @return the int
   */
  public int outstanding(KeyRecord stored) {
    return acquisitions.getOrDefault(stored, 0);
  }

  private static boolean roleMatches(KeyRecord key, KeyQuery query) {
    return key.attributes().find("role")
        .map(r -> r.equals(query.role().attributeValue()))
        .orElse(true);
  }

  private static Attributes publicPattern(Attributes pattern) {
    return pattern.publicAttributes().without("role");
  }
}
