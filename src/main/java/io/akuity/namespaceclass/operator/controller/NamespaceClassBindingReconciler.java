package io.akuity.namespaceclass.operator.controller;

import io.akuity.namespaceclass.operator.error.ConditionReason;
import io.akuity.namespaceclass.operator.error.ReconcileException;
import io.akuity.namespaceclass.operator.model.AppliedResource;
import io.akuity.namespaceclass.operator.model.Manifest;
import io.akuity.namespaceclass.operator.model.NamespaceClass;
import io.akuity.namespaceclass.operator.model.NamespaceClassBinding;
import io.akuity.namespaceclass.operator.model.NamespaceClassBindingStatus;
import io.akuity.namespaceclass.operator.model.ResourceKey;
import io.akuity.namespaceclass.operator.store.NamespaceClassBindingStore;
import io.akuity.namespaceclass.operator.store.NamespaceClassStore;
import io.akuity.namespaceclass.operator.store.StoreResult;
import io.kubernetes.client.extended.controller.reconciler.Reconciler;
import io.kubernetes.client.extended.controller.reconciler.Request;
import io.kubernetes.client.extended.controller.reconciler.Result;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Drives a NamespaceClassBinding and the resources it owns towards its NamespaceClass.
 * <p>
 * A pass fetches the class, stops early when the binding has already observed this class
 * generation, deletes what is no longer wanted, applies every entry of the class in order and
 * finally records what was applied. A failed pass leaves the previously applied list in place so
 * that the next pass starts from the same baseline.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class NamespaceClassBindingReconciler implements Reconciler {
    private final NamespaceClassBindingStore bindingStore;
    private final NamespaceClassStore classStore;
    private final ResourcePruner pruner;
    private final ResourceApplier applier;
    private final BindingStatusUpdater statusUpdater;
    private final BindingEvents events;

    public enum Outcome {
        BINDING_NOT_FOUND,
        CLEANED_UP,
        UP_TO_DATE,
        APPLIED
    }

    @Override
    public Result reconcile(Request request) {
        log.info("Reconciling NamespaceClassBinding {}/{}", request.getNamespace(), request.getName());
        try {
            Outcome outcome = reconcileBinding(request.getNamespace(), request.getName());
            log.debug("NamespaceClassBinding {}/{} reconciled: {}", request.getNamespace(), request.getName(), outcome);
            return new Result(false);
        } catch (ReconcileException e) {
            if (e.isInterruption()) {
                log.info("Reconciliation of NamespaceClassBinding {}/{} interrupted: {}",
                        request.getNamespace(), request.getName(), e.getMessage());
            } else {
                log.error("Error reconciling NamespaceClassBinding {}/{}: {}",
                        request.getNamespace(), request.getName(), e.getMessage());
            }
            return new Result(true);
        }
    }

    Outcome reconcileBinding(String namespace, String name) {
        StoreResult<NamespaceClassBinding> fetched = bindingStore.get(namespace, name);
        if (fetched.isNotFound()) {
            return Outcome.BINDING_NOT_FOUND;
        }
        NamespaceClassBinding binding = fetched.orElseThrow(null, "failed to get NamespaceClassBinding");
        String className = binding.className();

        StoreResult<NamespaceClass> classResult = classStore.get(className);
        if (classResult.isNotFound()) {
            handleClassNotFound(binding);
            return Outcome.CLEANED_UP;
        }
        NamespaceClass namespaceClass = classResult.orElseThrow(null, "failed to get NamespaceClass " + className);
        NamespaceClassBindingStatus status = binding.statusOrEmpty();

        if (isUpToDate(status, namespaceClass)) {
            log.debug("NamespaceClassBinding {}/{} already observed generation {} of class {}",
                    namespace, name, namespaceClass.generation(), className);
            return Outcome.UP_TO_DATE;
        }

        log.info("Applying class {} generation {} ({} entries, previously observed {} generation {}) to {}",
                className, namespaceClass.generation(), manifests(namespaceClass).size(),
                status.observedClassNameOrEmpty(), status.observedGeneration(), namespace);

        List<Manifest> manifests = manifests(namespaceClass);
        runStep(binding, ConditionReason.PRUNE_FAILED, "Failed to prune resources",
                () -> prune(binding, namespaceClass, manifests));

        List<AppliedResource> applied = new ArrayList<>();
        runStep(binding, ConditionReason.APPLY_FAILED, "Failed to apply resources",
                () -> applied.addAll(applyAll(binding, manifests)));

        commit(binding, namespaceClass, applied);
        return Outcome.APPLIED;
    }

    static boolean isUpToDate(NamespaceClassBindingStatus status, NamespaceClass namespaceClass) {
        return status.observedGeneration() == namespaceClass.generation()
                && status.observedClassNameOrEmpty().equals(namespaceClass.getMetadata().getName());
    }

    /**
     * A switch means resources of another class are still applied in the namespace.
     */
    static boolean isClassSwitch(NamespaceClassBindingStatus status, NamespaceClass namespaceClass) {
        return !status.observedClassNameOrEmpty().isEmpty()
                && !status.appliedOrEmpty().isEmpty()
                && !status.observedClassNameOrEmpty().equals(namespaceClass.getMetadata().getName());
    }

    private void handleClassNotFound(NamespaceClassBinding binding) {
        String namespace = binding.namespace();
        String className = binding.className();
        log.info("NamespaceClass {} not found, removing resources and binding {}/{}",
                className, namespace, binding.name());

        markNotReady(binding, ConditionReason.CLASS_NOT_FOUND, "NamespaceClass " + className + " not found");

        List<ResourceKey> applied = ResourcePruner.keys(binding.statusOrEmpty().appliedOrEmpty());
        runStep(binding, ConditionReason.CLASS_NOT_FOUND, "NamespaceClass " + className + " not found", () -> {
            pruner.deleteAll(namespace, applied, ConditionReason.CLASS_NOT_FOUND);
            bindingStore.delete(namespace, binding.name(), true)
                    .orElseThrow(ConditionReason.CLASS_NOT_FOUND, "failed to delete NamespaceClassBinding");
        });

        events.cleanedUp(binding, className);
    }

    private void prune(NamespaceClassBinding binding, NamespaceClass namespaceClass, List<Manifest> manifests) {
        NamespaceClassBindingStatus status = binding.statusOrEmpty();
        if (isClassSwitch(status, namespaceClass)) {
            log.info("Binding {}/{} switched from class {} to {}, removing previously applied resources",
                    binding.namespace(), binding.name(), status.getObservedClassName(),
                    namespaceClass.getMetadata().getName());
            pruner.deleteAll(binding.namespace(), ResourcePruner.keys(status.appliedOrEmpty()),
                    ConditionReason.PRUNE_FAILED);
            return;
        }

        Set<ResourceKey> desired = ResourcePruner.desiredKeys(manifests);
        pruner.deleteAll(binding.namespace(), ResourcePruner.staleKeys(status.appliedOrEmpty(), desired),
                ConditionReason.PRUNE_FAILED);
    }

    private List<AppliedResource> applyAll(NamespaceClassBinding binding, List<Manifest> manifests) {
        Set<ResourceKey> applied = new LinkedHashSet<>();
        for (Manifest entry : manifests) {
            if (entry.isEmpty() || !entry.hasIdentity()) {
                log.debug("Skipping class entry without apiVersion, kind and name");
                continue;
            }

            Manifest desired = entry.copy()
                    .withNamespace(binding.namespace())
                    .withControllerOwner(binding);

            StoreResult<Manifest> result = applier.upsert(desired, binding);
            if (!result.isSuccess()) {
                throw result.toException(ConditionReason.APPLY_FAILED, "apply " + desired.key());
            }
            applied.add(desired.key());
            log.info("Applied {} to namespace {}", desired.key(), binding.namespace());
        }
        return applied.stream().map(AppliedResource::of).collect(Collectors.toList());
    }

    private void commit(NamespaceClassBinding binding, NamespaceClass namespaceClass, List<AppliedResource> applied) {
        String className = namespaceClass.getMetadata().getName();
        String message = "Successfully applied " + applied.size() + " resources from class " + className;

        StoreResult<NamespaceClassBinding> written = statusUpdater.update(binding.namespace(), binding.name(), s -> {
            s.setObservedClassName(className);
            s.setObservedClassGeneration(namespaceClass.generation());
            s.setAppliedResources(new ArrayList<>(applied));
            Conditions.set(s.getConditions(), Conditions.READY, true,
                    ConditionReason.RECONCILE_SUCCESS.getCode(), message, OffsetDateTime.now());
        });
        if (written.isNotFound()) {
            log.info("NamespaceClassBinding {}/{} was deleted during reconciliation", binding.namespace(), binding.name());
            return;
        }
        written.orElseThrow(null, "failed to update NamespaceClassBinding status");

        log.info("Reconciled NamespaceClassBinding {}/{}: {} resources applied from class {}",
                binding.namespace(), binding.name(), applied.size(), className);
        events.reconcileSucceeded(binding, applied.size(), className);
    }

    /**
     * Runs a pass step; on failure records the failure's reason (or the step's own when the failure
     * carries none) on the Ready condition and rethrows. Interruptions are rethrown without touching status.
     */
    private void runStep(NamespaceClassBinding binding, ConditionReason stepReason, String summary, Runnable step) {
        try {
            step.run();
        } catch (ReconcileException e) {
            if (!e.isInterruption()) {
                ConditionReason reason = e.getReason() == null ? stepReason : e.getReason();
                markNotReady(binding, reason, summary + ": " + e.getMessage());
            }
            throw e;
        }
    }

    private void markNotReady(NamespaceClassBinding binding, ConditionReason reason, String message) {
        StoreResult<NamespaceClassBinding> written = statusUpdater.update(binding.namespace(), binding.name(),
                s -> Conditions.set(s.getConditions(), Conditions.READY, false, reason.getCode(), message,
                        OffsetDateTime.now()));
        if (!written.isSuccess() && !written.isNotFound()) {
            log.warn("Could not record {} on NamespaceClassBinding {}/{}: {}",
                    reason.getCode(), binding.namespace(), binding.name(), written.getMessage());
        }
    }

    private static List<Manifest> manifests(NamespaceClass namespaceClass) {
        if (namespaceClass.getSpec() == null || namespaceClass.getSpec().getResources() == null) {
            return List.of();
        }
        return namespaceClass.getSpec().getResources().stream()
                .map(Manifest::of)
                .collect(Collectors.toList());
    }
}
