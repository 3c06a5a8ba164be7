package io.akuity.namespaceclass.operator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the NamespaceClass operator.
 */
@SpringBootApplication
public class NamespaceClassOperatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(NamespaceClassOperatorApplication.class, args);
    }
}
