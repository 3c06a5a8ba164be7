package io.akuity.namespaceclass.operator.config;

import io.akuity.namespaceclass.operator.controller.NamespaceClassBindingReconciler;
import io.akuity.namespaceclass.operator.controller.NamespaceClassWatch;
import io.akuity.namespaceclass.operator.controller.NamespaceLabelFilter;
import io.akuity.namespaceclass.operator.controller.NamespaceReconciler;
import io.akuity.namespaceclass.operator.model.NamespaceClass;
import io.akuity.namespaceclass.operator.model.NamespaceClassBinding;
import io.akuity.namespaceclass.operator.model.NamespaceClassBindingList;
import io.akuity.namespaceclass.operator.model.NamespaceClassList;
import io.akuity.namespaceclass.operator.store.BindingLookup;
import io.akuity.namespaceclass.operator.store.IndexedBindingLookup;
import io.kubernetes.client.extended.controller.Controller;
import io.kubernetes.client.extended.controller.ControllerManager;
import io.kubernetes.client.extended.controller.builder.ControllerBuilder;
import io.kubernetes.client.extended.event.legacy.EventRecorder;
import io.kubernetes.client.extended.event.legacy.LegacyEventBroadcaster;
import io.kubernetes.client.informer.SharedIndexInformer;
import io.kubernetes.client.informer.SharedInformerFactory;
import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.openapi.apis.CoreV1Api;
import io.kubernetes.client.openapi.models.V1EventSource;
import io.kubernetes.client.openapi.models.V1Namespace;
import io.kubernetes.client.openapi.models.V1NamespaceList;
import io.kubernetes.client.util.generic.GenericKubernetesApi;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration for the namespace and binding controllers.
 */
@Configuration
@EnableConfigurationProperties(OperatorProperties.class)
public class ControllerConfig {
    private static final String EVENT_COMPONENT = "namespaceclass-operator";

    @Bean
    public SharedInformerFactory informerFactory(ApiClient apiClient) {
        return new SharedInformerFactory(apiClient);
    }

    @Bean
    public SharedIndexInformer<V1Namespace> namespaceInformer(
            SharedInformerFactory informerFactory,
            GenericKubernetesApi<V1Namespace, V1NamespaceList> namespaceApi) {
        return informerFactory.sharedIndexInformerFor(namespaceApi, V1Namespace.class, 0);
    }

    @Bean
    public SharedIndexInformer<NamespaceClassBinding> bindingInformer(
            SharedInformerFactory informerFactory,
            GenericKubernetesApi<NamespaceClassBinding, NamespaceClassBindingList> bindingApi) {
        SharedIndexInformer<NamespaceClassBinding> informer =
                informerFactory.sharedIndexInformerFor(bindingApi, NamespaceClassBinding.class, 0);
        informer.addIndexers(IndexedBindingLookup.indexers());
        return informer;
    }

    @Bean
    public SharedIndexInformer<NamespaceClass> namespaceClassInformer(
            SharedInformerFactory informerFactory,
            GenericKubernetesApi<NamespaceClass, NamespaceClassList> namespaceClassApi) {
        return informerFactory.sharedIndexInformerFor(namespaceClassApi, NamespaceClass.class, 0);
    }

    @Bean
    public BindingLookup bindingLookup(SharedIndexInformer<NamespaceClassBinding> bindingInformer) {
        return new IndexedBindingLookup(bindingInformer);
    }

    @Bean
    public LegacyEventBroadcaster eventBroadcaster(ApiClient apiClient) {
        return new LegacyEventBroadcaster(new CoreV1Api(apiClient));
    }

    @Bean
    public EventRecorder eventRecorder(LegacyEventBroadcaster eventBroadcaster) {
        return eventBroadcaster.newRecorder(new V1EventSource().component(EVENT_COMPONENT));
    }

    @Bean
    public Controller namespaceController(
            SharedInformerFactory informerFactory,
            NamespaceReconciler reconciler,
            SharedIndexInformer<V1Namespace> namespaceInformer,
            SharedIndexInformer<NamespaceClassBinding> bindingInformer,
            OperatorProperties properties) {
        NamespaceLabelFilter filter = new NamespaceLabelFilter(properties.getClassLabel());

        return ControllerBuilder.defaultBuilder(informerFactory)
                .watch(workQueue -> ControllerBuilder.controllerWatchBuilder(V1Namespace.class, workQueue)
                        .withOnAddFilter(filter::onAdd)
                        .withOnUpdateFilter(filter::onUpdate)
                        .withOnDeleteFilter(filter::onDelete)
                        .withResyncPeriod(Duration.ZERO)
                        .build())
                .withWorkerCount(properties.getNamespaceWorkers())
                .withReadyFunc(() -> namespaceInformer.hasSynced() && bindingInformer.hasSynced())
                .withReconciler(reconciler)
                .withName("NamespaceController")
                .build();
    }

    @Bean
    public Controller bindingController(
            SharedInformerFactory informerFactory,
            NamespaceClassBindingReconciler reconciler,
            SharedIndexInformer<NamespaceClassBinding> bindingInformer,
            SharedIndexInformer<NamespaceClass> namespaceClassInformer,
            BindingLookup bindingLookup,
            OperatorProperties properties) {

        return ControllerBuilder.defaultBuilder(informerFactory)
                .watch(workQueue -> ControllerBuilder.controllerWatchBuilder(NamespaceClassBinding.class, workQueue)
                        .withResyncPeriod(Duration.ZERO)
                        .build())
                .watch(workQueue -> new NamespaceClassWatch(workQueue, bindingLookup))
                .withWorkerCount(properties.getBindingWorkers())
                .withReadyFunc(() -> bindingInformer.hasSynced() && namespaceClassInformer.hasSynced())
                .withReconciler(reconciler)
                .withName("NamespaceClassBindingController")
                .build();
    }

    @Bean
    public ControllerManager controllerManager(
            SharedInformerFactory informerFactory,
            @Qualifier("namespaceController") Controller namespaceController,
            @Qualifier("bindingController") Controller bindingController) {
        return new ControllerManager(informerFactory, namespaceController, bindingController);
    }
}
