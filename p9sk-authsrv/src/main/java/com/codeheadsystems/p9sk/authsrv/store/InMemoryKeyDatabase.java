package com.codeheadsystems.p9sk.authsrv.store;

import com.codeheadsystems.p9sk.authsrv.config.AuthServerConfiguration;
import com.codeheadsystems.p9sk.authsrv.config.UserEntry;
import com.codeheadsystems.p9sk.crypto.DesCipher;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link KeyDatabase} backed by {@link ConcurrentHashMap}s.
 * <p>
 * Populated from the configuration file at startup; changes made at runtime are lost on restart.
 */
public class InMemoryKeyDatabase implements KeyDatabase {

  private static final Logger log = LoggerFactory.getLogger(InMemoryKeyDatabase.class);
  private static final String ANY_USER = "*";

  private final ConcurrentHashMap<String, byte[]> keys = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, Set<String>> speaksFor = new ConcurrentHashMap<>();

  public InMemoryKeyDatabase() {
    log.warn("Using InMemoryKeyDatabase: keys added at runtime will NOT survive restarts.");
  }

  /**
   * Builds a database holding every user and speaks-for entry in the configuration.
   *
   * @param configuration the configuration
   * @return the in memory key database
   * @throws IllegalArgumentException if a user's hexKey is malformed
   */
  public static InMemoryKeyDatabase fromConfiguration(AuthServerConfiguration configuration) {
    InMemoryKeyDatabase database = new InMemoryKeyDatabase();
    for (UserEntry user : configuration.getUsers()) {
      if (user.hexKey() != null) {
        database.addUser(user.name(), decodeHexKey(user));
      } else {
        database.addUserWithPassword(user.name(), user.password());
      }
    }
    configuration.getSpeaksFor().forEach((host, uids) -> uids.forEach(uid -> database.allowSpeaksFor(host, uid)));
    log.info("Loaded {} users for domain {}", database.keys.size(), configuration.getDomain());
    return database;
  }

  private static byte[] decodeHexKey(UserEntry user) {
    byte[] key;
    try {
      key = Hex.decode(user.hexKey());
    } catch (DecoderException e) {
      throw new IllegalArgumentException("malformed hexKey for user " + user.name(), e);
    }
    if (key.length != DesCipher.DESKEYLEN) {
      throw new IllegalArgumentException("hexKey for user " + user.name() + " must be "
          + 2 * DesCipher.DESKEYLEN + " hex digits");
    }
    return key;
  }

  /**
   * Adds or replaces a principal.
   *
   * @param user the user
   * @param key  the 7-byte key; the database keeps its own copy
   */
  public void addUser(String user, byte[] key) {
    if (key.length != DesCipher.DESKEYLEN) {
      throw new IllegalArgumentException("Key must be " + DesCipher.DESKEYLEN + " bytes");
    }
    keys.put(user, key.clone());
    log.debug("Added user {}", user);
  }

  /**
   * Adds or replaces a principal whose key is derived from a password.
   *
   * @param user     the user
   * @param password the password
   */
  public void addUserWithPassword(String user, String password) {
    addUser(user, DesCipher.passToKey(password));
  }

  /**
   * Lets {@code host} request tickets on behalf of {@code uid}; {@code "*"} allows any user.
   *
   * @param host the host
   * @param uid  the uid
   */
  public void allowSpeaksFor(String host, String uid) {
    speaksFor.computeIfAbsent(host, h -> ConcurrentHashMap.newKeySet()).add(uid);
  }

  @Override
  public Optional<byte[]> key(String user) {
    return Optional.ofNullable(keys.get(user)).map(byte[]::clone);
  }

  @Override
  public boolean speaksFor(String host, String uid) {
    if (host.equals(uid)) {
      return true;
    }
    Set<String> allowed = speaksFor.get(host);
    return allowed != null && (allowed.contains(uid) || allowed.contains(ANY_USER));
  }
}
