package eu.virtualparadox.ctxstore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ContextStoreApplication {

    public static void main(final String[] args) {
        SpringApplication.run(ContextStoreApplication.class, args);
    }
}
