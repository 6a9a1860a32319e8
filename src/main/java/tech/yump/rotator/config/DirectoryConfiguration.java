package tech.yump.rotator.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;
import tech.yump.rotator.directory.graph.GraphDirectoryClientFactory;
import tech.yump.rotator.directory.memory.InMemoryCredentialDirectory;

import java.time.Clock;

/**
 * Wires the directory backend selected by {@code rotator.directory.backend} and the clock used
 * for expiry decisions.
 */
@Configuration
@Slf4j
public class DirectoryConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(name = "rotator.directory.backend", havingValue = "graph", matchIfMissing = true)
    public GraphDirectoryClientFactory graphDirectoryClientFactory(
            RotatorProperties properties,
            RestClient.Builder restClientBuilder,
            Clock clock) {
        RotatorProperties.GraphProperties graph = properties.directory().graph();
        log.info("Configuring Microsoft Graph directory backend at {}", graph.baseUrl());
        return new GraphDirectoryClientFactory(restClientBuilder, graph, clock);
    }

    @Bean
    @ConditionalOnProperty(name = "rotator.directory.backend", havingValue = "in-memory")
    public InMemoryCredentialDirectory inMemoryCredentialDirectory(Clock clock) {
        log.warn("Configuring in-memory directory backend. Credentials are lost on restart and never reach a real identity provider.");
        return new InMemoryCredentialDirectory(clock);
    }
}
