package io.akuity.namespaceclass.operator.controller;

import io.akuity.namespaceclass.operator.model.NamespaceClass;
import io.akuity.namespaceclass.operator.store.BindingLookup;
import io.kubernetes.client.extended.controller.ControllerWatch;
import io.kubernetes.client.extended.controller.reconciler.Request;
import io.kubernetes.client.extended.workqueue.WorkQueue;
import io.kubernetes.client.informer.ResourceEventHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;

/**
 * Feeds the binding work queue from NamespaceClass events: every binding that selects the
 * changed class is enqueued.
 */
@Slf4j
@RequiredArgsConstructor
public class NamespaceClassWatch implements ControllerWatch<NamespaceClass> {
    private final WorkQueue<Request> workQueue;
    private final BindingLookup bindingLookup;

    @Override
    public Class<NamespaceClass> getResourceClass() {
        return NamespaceClass.class;
    }

    @Override
    public ResourceEventHandler<NamespaceClass> getResourceEventHandler() {
        return new ResourceEventHandler<>() {
            @Override
            public void onAdd(NamespaceClass namespaceClass) {
                enqueueBindings(namespaceClass);
            }

            @Override
            public void onUpdate(NamespaceClass oldClass, NamespaceClass newClass) {
                if (oldClass.generation() != newClass.generation()) {
                    enqueueBindings(newClass);
                }
            }

            @Override
            public void onDelete(NamespaceClass namespaceClass, boolean deletedFinalStateUnknown) {
                enqueueBindings(namespaceClass);
            }
        };
    }

    @Override
    public Duration getResyncPeriod() {
        return Duration.ZERO;
    }

    void enqueueBindings(NamespaceClass namespaceClass) {
        if (namespaceClass == null || namespaceClass.getMetadata() == null) {
            return;
        }
        String className = namespaceClass.getMetadata().getName();
        List<Request> requests = bindingLookup.bindingsReferencing(className);
        log.debug("NamespaceClass {} changed, enqueueing {} bindings", className, requests.size());
        requests.forEach(workQueue::add);
    }
}
