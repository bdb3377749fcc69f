package io.ledgerflow.testing;

import io.ledgerflow.spi.WalletSigner;
import io.ledgerflow.util.Ed25519;
import io.ledgerflow.util.StrKey;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.Signature;
import java.security.interfaces.EdECPublicKey;
import java.util.Base64;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wallet backed by a fresh Ed25519 key pair. Envelope "signatures" are the envelope plus the
 * signer's address, which {@link InMemoryLedger} checks; message signatures are real.
 */
public final class RecordingSigner implements WalletSigner {
  private final KeyPair keyPair;
  private final String address;
  private final List<String> signedEnvelopes = new CopyOnWriteArrayList<>();
  private final List<String> signedMessages = new CopyOnWriteArrayList<>();
  private final AtomicInteger rejections = new AtomicInteger();

  public RecordingSigner() {
    try {
      this.keyPair = KeyPairGenerator.getInstance("Ed25519").generateKeyPair();
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException(e);
    }
    this.address = StrKey.encodeAccountId(Ed25519.rawPublicKey((EdECPublicKey) keyPair.getPublic()));
  }

  /** The next {@code count} signing requests are declined. */
  public RecordingSigner rejectNext(int count) {
    rejections.set(count);
    return this;
  }

  @Override
  public String sign(String envelope) {
    declineIfScripted();
    signedEnvelopes.add(envelope);
    return envelope + "|" + address;
  }

  @Override
  public String getPublicKey() {
    return address;
  }

  @Override
  public String signMessage(String text) {
    declineIfScripted();
    signedMessages.add(text);
    return sign(text.getBytes(StandardCharsets.UTF_8));
  }

  /** Raw Ed25519 signature, bypassing the recording. */
  public String sign(byte[] message) {
    try {
      Signature signature = Signature.getInstance("Ed25519");
      signature.initSign(keyPair.getPrivate());
      signature.update(message);
      return Base64.getEncoder().encodeToString(signature.sign());
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException(e);
    }
  }

  public List<String> signedEnvelopes() {
    return List.copyOf(signedEnvelopes);
  }

  public List<String> signedMessages() {
    return List.copyOf(signedMessages);
  }

  private void declineIfScripted() {
    if (rejections.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
      throw new IllegalStateException("User declined the request");
    }
  }
}
