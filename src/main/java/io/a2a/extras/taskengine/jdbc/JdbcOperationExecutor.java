package io.a2a.extras.taskengine.jdbc;

import io.a2a.extras.taskengine.storage.StorageUnavailableException;
import io.a2a.extras.taskengine.storage.TaskStoreException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.TransactionTimedOutException;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Duration;

/**
 * Runs each storage operation in its own transaction and retries it when the failure is transient.
 * A retried operation starts over with a fresh connection from the pool.
 */
@Slf4j
public class JdbcOperationExecutor {

    private final TransactionOperations transactions;
    private final TransactionOperations readOnlyTransactions;
    private final RetryPolicy retryPolicy;

    public JdbcOperationExecutor(TransactionOperations transactions,
                                 TransactionOperations readOnlyTransactions,
                                 RetryPolicy retryPolicy) {
        this.transactions = transactions;
        this.readOnlyTransactions = readOnlyTransactions;
        this.retryPolicy = retryPolicy;
    }

    public <T> T write(String operation, TransactionCallback<T> action) {
        return execute(operation, transactions, action);
    }

    public <T> T read(String operation, TransactionCallback<T> action) {
        return execute(operation, readOnlyTransactions, action);
    }

    private <T> T execute(String operation, TransactionOperations tx, TransactionCallback<T> action) {
        int retry = 0;
        while (true) {
            try {
                return tx.execute(action);
            } catch (TaskStoreException e) {
                throw e;
            } catch (RuntimeException e) {
                if (!isTransient(e)) {
                    throw new TaskStoreException("Storage operation " + operation + " failed", e);
                }
                retry++;
                if (!retryPolicy.shouldRetry(retry)) {
                    throw new StorageUnavailableException(
                            "Storage operation " + operation + " failed after " + retryPolicy.getMaxRetries() + " retries", e);
                }
                Duration delay = retryPolicy.calculateDelay(retry);
                log.warn("Transient failure in {} (retry {}/{} in {} ms): {}",
                        operation, retry, retryPolicy.getMaxRetries(), delay.toMillis(), e.getMessage());
                pause(operation, delay, e);
            }
        }
    }

    static boolean isTransient(Throwable error) {
        return error instanceof TransientDataAccessException
                || error instanceof RecoverableDataAccessException
                || error instanceof DataAccessResourceFailureException
                || error instanceof CannotCreateTransactionException
                || error instanceof TransactionTimedOutException;
    }

    private void pause(String operation, Duration delay, RuntimeException cause) {
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageUnavailableException("Interrupted while retrying " + operation, cause);
        }
    }
}
