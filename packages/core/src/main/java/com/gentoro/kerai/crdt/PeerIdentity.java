package com.gentoro.kerai.crdt;

import com.gentoro.kerai.exception.KeraiErrorCode;
import com.gentoro.kerai.exception.KeraiException;
import com.gentoro.kerai.utility.HashUtility;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.Signature;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;
import java.util.Map;

/** Ed25519 key pair of one peer. */
public final class PeerIdentity {
  private static final String ALGORITHM = "Ed25519";

  private final String peerId;
  private final KeyPair keyPair;

  private PeerIdentity(String peerId, KeyPair keyPair) {
    this.peerId = peerId;
    this.keyPair = keyPair;
  }

  public static PeerIdentity generate(String peerId) {
    try {
      return new PeerIdentity(peerId, KeyPairGenerator.getInstance(ALGORITHM).generateKeyPair());
    } catch (GeneralSecurityException e) {
      throw signatureError("Failed to generate Ed25519 key pair", peerId, e);
    }
  }

  /** Restore from base64 PKCS#8 private and X.509 public key encodings. */
  public static PeerIdentity fromEncoded(String peerId, String publicKey, String privateKey) {
    try {
      KeyFactory kf = KeyFactory.getInstance(ALGORITHM);
      PublicKey pub =
          kf.generatePublic(new X509EncodedKeySpec(Base64.getDecoder().decode(publicKey)));
      PrivateKey priv =
          kf.generatePrivate(new PKCS8EncodedKeySpec(Base64.getDecoder().decode(privateKey)));
      return new PeerIdentity(peerId, new KeyPair(pub, priv));
    } catch (GeneralSecurityException | IllegalArgumentException e) {
      throw signatureError("Invalid Ed25519 key material", peerId, e);
    }
  }

  public static PublicKey decodePublicKey(String encoded) {
    try {
      return KeyFactory.getInstance(ALGORITHM)
          .generatePublic(new X509EncodedKeySpec(Base64.getDecoder().decode(encoded)));
    } catch (GeneralSecurityException | IllegalArgumentException e) {
      throw new KeraiException(KeraiErrorCode.SIGNATURE_ERROR, "Invalid Ed25519 public key", e);
    }
  }

  public String peerId() {
    return peerId;
  }

  public PublicKey publicKey() {
    return keyPair.getPublic();
  }

  public String encodedPublicKey() {
    return Base64.getEncoder().encodeToString(keyPair.getPublic().getEncoded());
  }

  public String encodedPrivateKey() {
    return Base64.getEncoder().encodeToString(keyPair.getPrivate().getEncoded());
  }

  /** Base64 SHA-256 of the encoded public key. */
  public String fingerprint() {
    return fingerprint(keyPair.getPublic());
  }

  public static String fingerprint(PublicKey key) {
    return HashUtility.sha256Base64(key.getEncoded());
  }

  public byte[] sign(byte[] message) {
    try {
      Signature s = Signature.getInstance(ALGORITHM);
      s.initSign(keyPair.getPrivate());
      s.update(message);
      return s.sign();
    } catch (GeneralSecurityException e) {
      throw signatureError("Failed to sign", peerId, e);
    }
  }

  public static boolean verify(PublicKey key, byte[] message, byte[] signature) {
    try {
      Signature s = Signature.getInstance(ALGORITHM);
      s.initVerify(key);
      s.update(message);
      return s.verify(signature);
    } catch (GeneralSecurityException e) {
      return false;
    }
  }

  private static KeraiException signatureError(String message, String peerId, Exception cause) {
    return new KeraiException(
        KeraiErrorCode.SIGNATURE_ERROR, message, Map.of("peer", String.valueOf(peerId)), cause);
  }
}
