package io.akuity.namespaceclass.operator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Tunables for the namespace and binding controllers, bound from {@code namespaceclass.*}.
 */
@Data
@ConfigurationProperties(prefix = "namespaceclass")
public class OperatorProperties {

    /**
     * Namespace label whose value names the desired NamespaceClass.
     */
    private String classLabel = "namespaceclass.akuity.io/name";

    /**
     * Field manager used for server-side apply of managed resources.
     */
    private String fieldManager = "namespaceclassbinding-controller";

    private int namespaceWorkers = 2;

    private int bindingWorkers = 4;

    /**
     * How long to wait for a resource to disappear before recreating it.
     */
    private Duration deletionTimeout = Duration.ofSeconds(30);

    private Duration deletionPollInterval = Duration.ofSeconds(1);

    /**
     * Attempts for a status write that keeps hitting optimistic-lock conflicts.
     */
    private int statusUpdateAttempts = 5;

    private Duration statusRetryBackoff = Duration.ofMillis(10);

    private Duration apiReadTimeout = Duration.ofSeconds(60);
}
