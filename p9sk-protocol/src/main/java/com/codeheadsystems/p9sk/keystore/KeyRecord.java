package com.codeheadsystems.p9sk.keystore;

import com.codeheadsystems.p9sk.codec.WireCodec;
import com.codeheadsystems.p9sk.common.Attributes;
import com.codeheadsystems.p9sk.common.ByteUtils;
import com.codeheadsystems.p9sk.crypto.DesCipher;
import com.codeheadsystems.p9sk.exceptions.KeyResolutionException;
import java.util.Arrays;
import java.util.Optional;
import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;

/**
 * A p9sk1 key: its public attributes plus the 7-byte DES key derived from its private part.
 * <p>
 * Implements {@link AutoCloseable} so the private key can be zeroed once the owner is done.
 * Equality is identity: two records for the same key are different owners.
 */
public final class KeyRecord implements AutoCloseable {

  private final Attributes attributes;
  private final byte[] privateKey;

  /**
   * Instantiates a new Key record.
   *
   * @param attributes the public attributes
   * @param privateKey the 7-byte key; the record takes ownership of the array
   */
  public KeyRecord(Attributes attributes, byte[] privateKey) {
    if (privateKey == null || privateKey.length != DesCipher.DESKEYLEN) {
      throw new IllegalArgumentException("Key must be " + DesCipher.DESKEYLEN + " bytes");
    }
    this.attributes = attributes.publicAttributes();
    this.privateKey = privateKey;
  }

  /**
   * Builds a record from a full attribute set, deriving the private key from {@code !hex}
   * (14 hex digits) or else from {@code !password}.
   *
   * @param attributes the attributes, including private ones
   * @return the key record
   * @throws KeyResolutionException if there is no key data, the hex is malformed, or the user
   *                                or domain is too long for its wire field
   */
  public static KeyRecord fromAttributes(Attributes attributes) {
    requireFits(attributes, "user", WireCodec.ANAMELEN);
    requireFits(attributes, "dom", WireCodec.DOMLEN);
    Optional<String> hex = attributes.find("!hex");
    if (hex.isPresent()) {
      byte[] key;
      try {
        key = Hex.decode(hex.get());
      } catch (DecoderException e) {
        throw new KeyResolutionException("malformed key data", e);
      }
      if (key.length != DesCipher.DESKEYLEN) {
        Arrays.fill(key, (byte) 0);
        throw new KeyResolutionException("malformed key data");
      }
      return new KeyRecord(attributes, key);
    }
    Optional<String> password = attributes.find("!password");
    if (password.isPresent()) {
      return new KeyRecord(attributes, DesCipher.passToKey(password.get()));
    }
    throw new KeyResolutionException("no key data");
  }

  private static void requireFits(Attributes attributes, String name, int fieldLength) {
    attributes.find(name)
        .filter(value -> !ByteUtils.fitsField(value, fieldLength))
        .ifPresent(value -> {
          throw new KeyResolutionException(name + " longer than " + (fieldLength - 1) + " bytes: " + value);
        });
  }

  /**
   * The public attributes.
   *
   * @return the attributes
   */
  public Attributes attributes() {
    return attributes;
  }

  /**
   * The {@code user} attribute.
   *
   * @return the user, or empty
   */
  public Optional<String> user() {
    return attributes.find("user");
  }

  /**
   * The {@code dom} attribute.
   *
   * @return the domain, or empty
   */
  public Optional<String> domain() {
    return attributes.find("dom");
  }

  /**
   * The 7-byte DES key. Owned by this record; do not retain it past {@link #close()}.
   *
   * @return the byte [ ]
   */
  public byte[] privateKey() {
    return privateKey;
  }

  /**
   * A new record for the same key with its own copy of the key material.
   *
   * @return the key record
   */
  public KeyRecord copy() {
    return new KeyRecord(attributes, privateKey.clone());
  }

  @Override
  public void close() {
    Arrays.fill(privateKey, (byte) 0);
  }

  @Override
  public String toString() {
    return "KeyRecord[" + attributes + "]";
  }
}
