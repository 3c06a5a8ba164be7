package io.akuity.namespaceclass.operator.controller;

import io.akuity.namespaceclass.operator.config.OperatorProperties;
import io.akuity.namespaceclass.operator.error.ReconcileException;
import io.akuity.namespaceclass.operator.model.NamespaceClassBinding;
import io.akuity.namespaceclass.operator.model.NamespaceClassBindingSpec;
import io.akuity.namespaceclass.operator.store.NamespaceClassBindingStore;
import io.akuity.namespaceclass.operator.store.NamespaceStore;
import io.akuity.namespaceclass.operator.store.StoreResult;
import io.kubernetes.client.extended.controller.reconciler.Reconciler;
import io.kubernetes.client.extended.controller.reconciler.Request;
import io.kubernetes.client.extended.controller.reconciler.Result;
import io.kubernetes.client.openapi.models.V1Namespace;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import io.kubernetes.client.openapi.models.V1OwnerReference;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Keeps exactly one NamespaceClassBinding per namespace in line with the namespace's class label.
 * Only the binding is written here; managed resources are left to the binding reconciler and
 * to owner-based garbage collection.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class NamespaceReconciler implements Reconciler {
    private final NamespaceStore namespaceStore;
    private final NamespaceClassBindingStore bindingStore;
    private final BindingEvents events;
    private final OperatorProperties properties;

    public enum Action {
        NONE,
        CREATED,
        UPDATED,
        DELETED
    }

    @Override
    public Result reconcile(Request request) {
        String namespaceName = request.getName();
        try {
            Action action = syncBinding(namespaceName);
            log.debug("Namespace {} reconciled: {}", namespaceName, action);
            return new Result(false);
        } catch (ReconcileException e) {
            if (e.isInterruption()) {
                log.info("Reconciliation of namespace {} interrupted: {}", namespaceName, e.getMessage());
            } else {
                log.error("Error reconciling namespace {}: {}", namespaceName, e.getMessage());
            }
            return new Result(true);
        }
    }

    Action syncBinding(String namespaceName) {
        StoreResult<V1Namespace> fetched = namespaceStore.get(namespaceName);
        if (fetched.isNotFound()) {
            return Action.NONE;
        }
        V1Namespace namespace = fetched.orElseThrow(null, "failed to get namespace " + namespaceName);

        if (namespace.getMetadata().getDeletionTimestamp() != null) {
            log.debug("Namespace {} is terminating, leaving cleanup to garbage collection", namespaceName);
            return Action.NONE;
        }

        String desiredClass = classLabel(namespace);

        StoreResult<NamespaceClassBinding> existing = bindingStore.get(namespaceName, namespaceName);
        if (!existing.isSuccess() && !existing.isNotFound()) {
            throw existing.toException(null, "failed to get NamespaceClassBinding " + namespaceName);
        }
        NamespaceClassBinding binding = existing.getObject();

        if (desiredClass.isEmpty()) {
            return binding == null ? Action.NONE : removeBinding(namespace, binding);
        }
        if (binding == null) {
            return createBinding(namespace, desiredClass);
        }
        if (desiredClass.equals(binding.className())) {
            return Action.NONE;
        }
        return updateBinding(namespace, binding, desiredClass);
    }

    private Action removeBinding(V1Namespace namespace, NamespaceClassBinding binding) {
        String namespaceName = namespace.getMetadata().getName();
        log.info("Removing NamespaceClassBinding {} as the class label was removed", namespaceName);

        bindingStore.delete(namespaceName, binding.name(), true)
                .orElseThrow(null, "failed to delete NamespaceClassBinding " + namespaceName);

        events.bindingRemoved(namespace, binding.className());
        return Action.DELETED;
    }

    private Action createBinding(V1Namespace namespace, String className) {
        String namespaceName = namespace.getMetadata().getName();
        log.info("Creating NamespaceClassBinding {} for class {}", namespaceName, className);

        NamespaceClassBinding binding = new NamespaceClassBinding();
        binding.setMetadata(new V1ObjectMeta()
                .name(namespaceName)
                .namespace(namespaceName)
                .ownerReferences(List.of(namespaceOwner(namespace))));
        binding.setSpec(new NamespaceClassBindingSpec(className));

        bindingStore.create(binding)
                .orElseThrow(null, "failed to create NamespaceClassBinding " + namespaceName);

        events.bindingCreated(namespace, className);
        return Action.CREATED;
    }

    private Action updateBinding(V1Namespace namespace, NamespaceClassBinding binding, String className) {
        String namespaceName = namespace.getMetadata().getName();
        String previousClass = binding.className();
        log.info("Updating NamespaceClassBinding {} from class {} to class {}",
                namespaceName, previousClass, className);

        if (binding.getSpec() == null) {
            binding.setSpec(new NamespaceClassBindingSpec());
        }
        binding.getSpec().setClassName(className);
        bindingStore.update(binding)
                .orElseThrow(null, "failed to update NamespaceClassBinding " + namespaceName);

        events.bindingUpdated(namespace, previousClass, className);
        return Action.UPDATED;
    }

    private String classLabel(V1Namespace namespace) {
        Map<String, String> labels = namespace.getMetadata().getLabels();
        if (labels == null) {
            return "";
        }
        String value = labels.get(properties.getClassLabel());
        return value == null ? "" : value;
    }

    private static V1OwnerReference namespaceOwner(V1Namespace namespace) {
        return new V1OwnerReference()
                .apiVersion("v1")
                .kind("Namespace")
                .name(namespace.getMetadata().getName())
                .uid(namespace.getMetadata().getUid())
                .controller(true)
                .blockOwnerDeletion(true);
    }
}
