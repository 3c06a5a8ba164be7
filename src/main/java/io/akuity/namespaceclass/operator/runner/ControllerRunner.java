package io.akuity.namespaceclass.operator.runner;

import io.kubernetes.client.extended.controller.ControllerManager;
import io.kubernetes.client.extended.event.legacy.LegacyEventBroadcaster;
import io.kubernetes.client.informer.SharedInformerFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * Runner to start event recording, the informers and the controller manager.
 */
@Component
@Slf4j
public class ControllerRunner implements CommandLineRunner {
    private final SharedInformerFactory informerFactory;
    private final ControllerManager controllerManager;
    private final LegacyEventBroadcaster eventBroadcaster;

    @Autowired
    public ControllerRunner(
            SharedInformerFactory informerFactory,
            ControllerManager controllerManager,
            LegacyEventBroadcaster eventBroadcaster) {
        this.informerFactory = informerFactory;
        this.controllerManager = controllerManager;
        this.eventBroadcaster = eventBroadcaster;
    }

    @Override
    public void run(String... args) throws Exception {
        log.info("Starting event broadcaster, informer factory and controller manager");

        eventBroadcaster.startRecording();
        informerFactory.startAllRegisteredInformers();
        try {
            controllerManager.run();
        } finally {
            log.info("Controller manager stopped, shutting down");
            controllerManager.shutdown();
            eventBroadcaster.shutdown();
        }
    }
}
