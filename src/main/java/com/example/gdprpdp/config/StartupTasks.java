package com.example.gdprpdp.config;

import com.example.gdprpdp.models.ChainVerification;
import com.example.gdprpdp.models.Policy;
import com.example.gdprpdp.models.PolicySet;
import com.example.gdprpdp.service.AuditLogService;
import com.example.gdprpdp.service.PolicyStoreService;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;

/**
 * Work done once the context is up, in order: create missing tables, seed policies, verify the
 * audit chain. Each step is switched on by configuration.
 */
@Slf4j
@Configuration
public class StartupTasks {

    @Bean
    @Order(Ordered.HIGHEST_PRECEDENCE)
    public ApplicationRunner tableInitializer(DynamoDbClient dynamo,
                                              @Value("${server.aws.create-tables:false}") boolean createTables) {
        return args -> {
            if (createTables) {
                DynamoTables.ensureAll(dynamo);
            }
        };
    }

    @Bean
    @Order(Ordered.HIGHEST_PRECEDENCE + 10)
    public ApplicationRunner policySeeder(PolicySeedProperties properties,
                                          PolicyStoreService policyStore,
                                          ResourceLoader resourceLoader,
                                          ObjectMapper objectMapper) {
        return args -> {
            if (properties.isEnabled()) {
                seedPolicies(properties.getLocation(), policyStore, resourceLoader, objectMapper);
            }
        };
    }

    @Bean
    @Order(Ordered.HIGHEST_PRECEDENCE + 20)
    public ApplicationRunner auditChainVerifier(AuditLogProperties properties, AuditLogService auditLogService) {
        return (ApplicationArguments args) -> {
            if (properties.isVerifyOnStartup()) {
                ChainVerification result = auditLogService.verifyOrThrow();
                log.info("audit log={} verified: {} entries", auditLogService.logId(), result.entriesChecked());
            }
        };
    }

    static PolicySet seedPolicies(String location,
                                  PolicyStoreService policyStore,
                                  ResourceLoader resourceLoader,
                                  ObjectMapper objectMapper) {
        Resource resource = resourceLoader.getResource(location);
        try (InputStream in = resource.getInputStream()) {
            List<Policy> definitions = objectMapper.readValue(in, new TypeReference<List<Policy>>() { });
            PolicySet loaded = policyStore.load(definitions);
            log.info("seeded {} policies from {}", loaded.size(), location);
            return loaded;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read policy seed file " + location, e);
        }
    }
}
