package com.skanga.sqlbridge.db;

/**
 * How a tool's transaction is run: the access mode it begins in and whether a successful
 * execution is committed. Anything not committed is discarded by the cleanup rollback.
 *
 * @param isolationMode Access mode for the transaction
 * @param commitOnSuccess Whether a successful execution is committed
 */
public record TransactionPolicy(IsolationMode isolationMode, boolean commitOnSuccess) {
    public static final TransactionPolicy READ_ONLY = new TransactionPolicy(IsolationMode.READ_ONLY, false);
    public static final TransactionPolicy READ_WRITE_COMMIT = new TransactionPolicy(IsolationMode.READ_WRITE, true);
    public static final TransactionPolicy READ_WRITE_NO_COMMIT = new TransactionPolicy(IsolationMode.READ_WRITE, false);

    public TransactionPolicy {
        if (isolationMode == null) {
            throw new IllegalArgumentException("Isolation mode cannot be null");
        }
    }
}
