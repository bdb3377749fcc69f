package io.ledgerflow.spi;

import io.ledgerflow.model.AccountInfo;
import io.ledgerflow.model.ContractCall;
import io.ledgerflow.model.EventFilter;
import io.ledgerflow.model.SimulationResult;
import io.ledgerflow.model.SubmitResult;
import io.ledgerflow.model.UnsignedTransaction;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Access to the ledger network: accounts, transaction building and submission,
 * contract state and the event feed.
 *
 * <p>Implementations throw {@link io.ledgerflow.LedgerException} (or any exception, which
 * is classified by {@link io.ledgerflow.ErrorClassifier}) on transport failures. A
 * transaction rejected by the ledger is not an exception: it comes back as a
 * {@link SubmitResult} with {@code success == false} and a result code.
 */
public interface LedgerClient {

    /**
     * Loads the account with its current sequence number and balances.
     *
     * @throws io.ledgerflow.LedgerException with {@code NOT_FOUND} if the account does not exist
     */
    AccountInfo loadAccount(String address);

    /**
     * Builds a transaction for {@code source} using its current sequence number.
     *
     * @param source account paying for and sequencing the transaction
     * @param calls  contract invocations, applied in order
     * @param expiry time from now after which the ledger rejects the transaction
     */
    UnsignedTransaction buildTransaction(String source, List<ContractCall> calls, Duration expiry);

    /**
     * Dry-runs an unsigned envelope against current ledger state.
     */
    SimulationResult simulate(String envelope);

    /**
     * Submits a signed envelope and waits for the ledger's verdict.
     */
    SubmitResult submit(String signedEnvelope);

    /**
     * Opens a push subscription to the event feed, starting after {@code cursor}
     * (or at the live tip when {@code cursor} is {@code null}).
     */
    EventStream streamEvents(EventFilter filter, String cursor, LedgerEventCallback callback);

    /**
     * Reads one entry of a contract's persistent state.
     *
     * @return the stored value, or empty if the key is unset
     */
    Optional<String> readContractState(String contractId, String key);
}
