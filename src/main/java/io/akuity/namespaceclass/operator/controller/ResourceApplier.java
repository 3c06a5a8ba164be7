package io.akuity.namespaceclass.operator.controller;

import io.akuity.namespaceclass.operator.config.OperatorProperties;
import io.akuity.namespaceclass.operator.error.ErrorKind;
import io.akuity.namespaceclass.operator.model.Manifest;
import io.akuity.namespaceclass.operator.model.NamespaceClassBinding;
import io.akuity.namespaceclass.operator.model.ResourceKey;
import io.akuity.namespaceclass.operator.store.ManagedResourceStore;
import io.akuity.namespaceclass.operator.store.StoreResult;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Predicate;

/**
 * Idempotent upsert of a managed resource.
 * <p>
 * A plain server-side apply is tried first. Failures then walk an ordered list of recovery
 * tiers; a tier runs only when its precondition matches the latest failure:
 * <ol>
 *     <li>field-manager conflict: apply again, forcing ownership of contested fields;</li>
 *     <li>immutable field: if this binding controls the live object, delete it, wait for it
 *     to disappear and create it again.</li>
 * </ol>
 * Any other failure is returned unchanged.
 */
@Component
@Slf4j
public class ResourceApplier {
    private final ManagedResourceStore resourceStore;
    private final String fieldManager;
    private final Duration deletionTimeout;
    private final Duration deletionPollInterval;
    private final List<RecoveryTier> tiers;

    public ResourceApplier(ManagedResourceStore resourceStore, OperatorProperties properties) {
        this.resourceStore = resourceStore;
        this.fieldManager = properties.getFieldManager();
        this.deletionTimeout = properties.getDeletionTimeout();
        this.deletionPollInterval = properties.getDeletionPollInterval();
        this.tiers = List.of(
                new RecoveryTier("force-ownership", ResourceApplier::isFieldManagerConflict, this::forceApply),
                new RecoveryTier("recreate", ResourceApplier::isImmutableFieldError, this::recreate));
    }

    public StoreResult<Manifest> upsert(Manifest desired, NamespaceClassBinding owner) {
        StoreResult<Manifest> result = resourceStore.apply(desired, fieldManager, false);
        for (RecoveryTier tier : tiers) {
            if (result.isSuccess()) {
                break;
            }
            if (tier.getPrecondition().test(result)) {
                log.info("Apply of {} in {} failed with {}, trying {}",
                        desired.key(), desired.getNamespace(), result.getErrorKind(), tier.getName());
                result = tier.getAction().apply(desired, owner);
            }
        }
        return result;
    }

    static boolean isFieldManagerConflict(StoreResult<?> result) {
        return result.is(ErrorKind.FIELD_MANAGER_CONFLICT);
    }

    static boolean isImmutableFieldError(StoreResult<?> result) {
        return result.is(ErrorKind.IMMUTABLE_FIELD);
    }

    List<RecoveryTier> getTiers() {
        return tiers;
    }

    private StoreResult<Manifest> forceApply(Manifest desired, NamespaceClassBinding owner) {
        return resourceStore.apply(desired, fieldManager, true);
    }

    private StoreResult<Manifest> recreate(Manifest desired, NamespaceClassBinding owner) {
        ResourceKey key = desired.key();
        String namespace = desired.getNamespace();

        StoreResult<Manifest> live = resourceStore.get(key, namespace);
        if (live.getErrorKind() != null && live.getErrorKind().isInterruption()) {
            return live;
        }
        if (!live.isSuccess() || !live.getObject().isControlledBy(owner.name(), owner.getMetadata().getUid())) {
            return StoreResult.failure(ErrorKind.PERMANENT,
                    "cannot recreate " + key + " in " + namespace + ": not controlled by NamespaceClassBinding "
                            + owner.name());
        }

        log.info("Recreating {} in {} to change immutable fields", key, namespace);
        StoreResult<Void> deleted = resourceStore.delete(key, namespace, true);
        if (!deleted.isSuccess()) {
            return deleted.asFailure();
        }

        StoreResult<Void> gone = waitForDeletion(key, namespace);
        if (!gone.isSuccess()) {
            return gone.asFailure();
        }
        return resourceStore.apply(desired, fieldManager, false);
    }

    /**
     * Polls until the resource is gone, the timeout passes, or the worker is interrupted.
     * <p>
     * Running out of time yields {@link ErrorKind#TIMEOUT}, which the pass records as an apply
     * failure and retries. An interrupt yields {@link ErrorKind#CANCELLED} with the interrupt flag
     * restored; that is an interruption, not an apply failure, and leaves status untouched.
     */
    StoreResult<Void> waitForDeletion(ResourceKey key, String namespace) {
        long deadline = System.nanoTime() + deletionTimeout.toNanos();
        while (true) {
            StoreResult<Manifest> current = resourceStore.get(key, namespace);
            if (current.isNotFound()) {
                return StoreResult.ok();
            }
            if (current.getErrorKind() != null && current.getErrorKind().isInterruption()) {
                return current.asFailure();
            }
            if (System.nanoTime() >= deadline) {
                return StoreResult.failure(ErrorKind.TIMEOUT,
                        "timed out after " + deletionTimeout + " waiting for deletion of " + key);
            }
            try {
                Thread.sleep(deletionPollInterval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return StoreResult.failure(ErrorKind.CANCELLED, "interrupted waiting for deletion of " + key);
            }
        }
    }

    @Getter
    @RequiredArgsConstructor
    static final class RecoveryTier {
        private final String name;
        private final Predicate<StoreResult<?>> precondition;
        private final BiFunction<Manifest, NamespaceClassBinding, StoreResult<Manifest>> action;
    }
}
