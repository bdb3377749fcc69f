package io.ledgerflow.spi;

import java.util.Map;

/**
 * Request/response transport to an anchor (fiat on/off-ramp) service.
 *
 * <p>Bodies are flat string maps; nested response members are flattened with dotted keys
 * ({@code transaction.status}). A non-success HTTP status is thrown as a classified
 * {@link io.ledgerflow.LedgerException}.
 */
public interface AnchorTransport {

    /**
     * @param url         absolute endpoint URL
     * @param query       query parameters (may be empty)
     * @param bearerToken token for the {@code Authorization} header, or {@code null}
     */
    Map<String, String> get(String url, Map<String, String> query, String bearerToken);

    /**
     * @param url         absolute endpoint URL
     * @param body        JSON body members
     * @param bearerToken token for the {@code Authorization} header, or {@code null}
     */
    Map<String, String> post(String url, Map<String, String> body, String bearerToken);
}
