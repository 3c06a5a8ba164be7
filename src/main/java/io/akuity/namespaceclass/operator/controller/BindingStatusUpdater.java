package io.akuity.namespaceclass.operator.controller;

import io.akuity.namespaceclass.operator.config.OperatorProperties;
import io.akuity.namespaceclass.operator.error.ErrorKind;
import io.akuity.namespaceclass.operator.model.NamespaceClassBinding;
import io.akuity.namespaceclass.operator.model.NamespaceClassBindingStatus;
import io.akuity.namespaceclass.operator.store.NamespaceClassBindingStore;
import io.akuity.namespaceclass.operator.store.StoreResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.function.Consumer;

/**
 * Read-modify-write of the binding status with bounded retry on optimistic-lock conflicts.
 * Nothing is written when the mutation leaves the status unchanged.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class BindingStatusUpdater {
    private static final int BACKOFF_FACTOR = 5;

    private final NamespaceClassBindingStore bindingStore;
    private final OperatorProperties properties;

    public StoreResult<NamespaceClassBinding> update(String namespace, String name,
                                                     Consumer<NamespaceClassBindingStatus> mutation) {
        int attempts = Math.max(1, properties.getStatusUpdateAttempts());
        long backoffMillis = properties.getStatusRetryBackoff().toMillis();
        StoreResult<NamespaceClassBinding> written = null;

        for (int attempt = 1; attempt <= attempts; attempt++) {
            StoreResult<NamespaceClassBinding> current = bindingStore.get(namespace, name);
            if (!current.isSuccess()) {
                return current;
            }

            NamespaceClassBinding binding = current.getObject();
            NamespaceClassBindingStatus before = NamespaceClassBindingStatus.copyOf(binding.getStatus());
            NamespaceClassBindingStatus after = NamespaceClassBindingStatus.copyOf(binding.getStatus());
            mutation.accept(after);
            if (after.equals(before)) {
                log.debug("Status of NamespaceClassBinding {}/{} unchanged, skipping write", namespace, name);
                return current;
            }

            binding.setStatus(after);
            written = bindingStore.updateStatus(binding);
            if (!written.is(ErrorKind.CONFLICT)) {
                return written;
            }

            log.warn("Conflict updating status of NamespaceClassBinding {}/{} (attempt {}/{})",
                    namespace, name, attempt, attempts);
            if (attempt < attempts) {
                try {
                    Thread.sleep(backoffMillis);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return StoreResult.failure(ErrorKind.CANCELLED,
                            "interrupted while retrying status update of " + namespace + "/" + name);
                }
                backoffMillis *= BACKOFF_FACTOR;
            }
        }
        return written;
    }
}
