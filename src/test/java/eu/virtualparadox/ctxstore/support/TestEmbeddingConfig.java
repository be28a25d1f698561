package eu.virtualparadox.ctxstore.support;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.context.annotation.Profile;

@TestConfiguration
@Profile("test")
public class TestEmbeddingConfig {

    @Bean
    @Primary
    public PrefixBagEmbeddingService prefixBagEmbeddingService() {
        return new PrefixBagEmbeddingService();
    }
}
