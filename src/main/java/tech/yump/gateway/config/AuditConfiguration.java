package tech.yump.gateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import tech.yump.gateway.audit.AuditBackend;
import tech.yump.gateway.audit.FileAuditBackend;
import tech.yump.gateway.audit.LogAuditBackend;

@Configuration
@RequiredArgsConstructor
@Slf4j
public class AuditConfiguration {

    /** Profile that enables the audit file appender in logback-spring.xml. */
    public static final String AUDIT_FILE_PROFILE = "audit-file";

    private final ObjectMapper objectMapper;
    private final Environment environment;

    @Bean
    @ConditionalOnProperty(name = "gateway.audit.backend", havingValue = "slf4j", matchIfMissing = true)
    public AuditBackend logAuditBackend() {
        log.info("Configuring SLF4j Audit Backend");
        return new LogAuditBackend(objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = "gateway.audit.backend", havingValue = "file")
    public AuditBackend fileAuditBackend() {
        if (environment.acceptsProfiles(Profiles.of(AUDIT_FILE_PROFILE))) {
            log.info("Configuring File Audit Backend, writing to {}",
                    environment.getProperty(FileAuditBackend.PATH_PROPERTY, "logs/audit.log"));
        } else {
            log.warn("gateway.audit.backend=file is set but profile '{}' is not active: logger '{}' has no file appender "
                            + "and audit events will go to the root logger. Activate the '{}' profile to write {}.",
                    AUDIT_FILE_PROFILE, FileAuditBackend.AUDIT_LOGGER_NAME, AUDIT_FILE_PROFILE,
                    environment.getProperty(FileAuditBackend.PATH_PROPERTY, "logs/audit.log"));
        }
        return new FileAuditBackend(objectMapper);
    }
}
