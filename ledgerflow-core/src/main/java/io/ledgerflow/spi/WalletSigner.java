package io.ledgerflow.spi;

/**
 * External wallet. Key material never leaves it.
 *
 * <p>A user declining a request should surface as a {@link io.ledgerflow.LedgerException}
 * with {@code USER_REJECTED}, or as any exception whose message mentions "declined" or
 * "rejected".
 */
public interface WalletSigner {

    /**
     * Signs a transaction envelope.
     *
     * @return the signed envelope
     */
    String sign(String envelope);

    /**
     * @return the strkey account id of the signing key
     */
    String getPublicKey();

    /**
     * Signs an arbitrary text message (UTF-8) with the account key.
     *
     * @return base64 encoded Ed25519 signature
     */
    String signMessage(String text);
}
