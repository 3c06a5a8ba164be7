package io.akuity.namespaceclass.operator.config;

import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.util.ClientBuilder;
import io.kubernetes.client.util.KubeConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.FileReader;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Configuration for the Kubernetes client.
 */
@Slf4j
@Configuration
public class KubernetesClientConfig {

    @Bean
    public ApiClient kubernetesApiClient(OperatorProperties properties) throws IOException {
        int readTimeout = (int) properties.getApiReadTimeout().toMillis();
        // In-cluster service account first
        try {
            ApiClient client = ClientBuilder.cluster().build();
            client.setReadTimeout(readTimeout);
            log.info("Using in-cluster Kubernetes configuration");
            return client;
        } catch (IOException e) {
            // Fallback to kubeconfig file for local development
            Path kubeConfigPath = Paths.get(System.getProperty("user.home"), ".kube", "config");
            log.info("In-cluster configuration unavailable ({}), loading {}", e.getMessage(), kubeConfigPath);
            try (FileReader reader = new FileReader(kubeConfigPath.toFile())) {
                KubeConfig kubeConfig = KubeConfig.loadKubeConfig(reader);
                ApiClient client = ClientBuilder.kubeconfig(kubeConfig).build();
                client.setReadTimeout(readTimeout);
                return client;
            }
        }
    }
}
