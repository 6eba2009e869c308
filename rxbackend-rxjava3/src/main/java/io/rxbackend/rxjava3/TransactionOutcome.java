package io.rxbackend.rxjava3;

import io.rxbackend.vendor.database.DataSnapshot;

import java.util.Optional;

/**
 * Result of a completed transaction.
 *
 * @param committed whether the handler's data was written; false if the handler aborted
 * @param snapshot data at the location after the transaction, when the SDK reported it
 */
public record TransactionOutcome(boolean committed, Optional<DataSnapshot> snapshot) {
}
