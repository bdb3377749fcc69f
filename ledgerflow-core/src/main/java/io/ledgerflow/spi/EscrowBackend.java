package io.ledgerflow.spi;

import io.ledgerflow.bid.SignedBidProposal;
import io.ledgerflow.model.BackendResponse;

import java.util.List;

/**
 * Marketplace service that stores bids and brokers their acceptance.
 *
 * <p>A mutating call may return an unsigned envelope; the caller signs and submits it on
 * the client's account queue. An escrow that already has a provider is reported as
 * {@code CONFLICT}.
 */
public interface EscrowBackend {

    BackendResponse submitBid(SignedBidProposal bid);

    List<SignedBidProposal> fetchBids(String escrowId);

    BackendResponse acceptBid(String escrowId, SignedBidProposal bid, String clientAddress);
}
