package tech.yump.rotator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tech.yump.rotator.audit.AuditBackend;
import tech.yump.rotator.audit.FileAuditBackend;
import tech.yump.rotator.audit.LogAuditBackend;

@Configuration
@Slf4j
public class AuditConfiguration {

    private final ObjectMapper objectMapper;

    public AuditConfiguration(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Bean
    @ConditionalOnProperty(name = "rotator.audit.backend", havingValue = "slf4j", matchIfMissing = true)
    public AuditBackend logAuditBackend() {
        log.info("Configuring SLF4j Audit Backend");
        return new LogAuditBackend(objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = "rotator.audit.backend", havingValue = "file")
    public AuditBackend fileAuditBackend() {
        // The file location is owned by logback-spring.xml, not by this bean.
        log.info("Configuring File Audit Backend. Ensure Logback is configured correctly for logger '{}' and path property '{}'.",
                FileAuditBackend.AUDIT_LOGGER_NAME, RotatorProperties.AuditProperties.FileAuditProperties.PATH_PROPERTY);
        return new FileAuditBackend(objectMapper);
    }
}
