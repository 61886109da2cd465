package tech.yump.gateway.audit;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FileAuditBackendTest {

    @Mock
    private ObjectMapper mockObjectMapper;

    private FileAuditBackend fileAuditBackend;

    private ListAppender<ILoggingEvent> listAppender;
    private Logger auditLogger;

    @BeforeEach
    void setUp() {
        fileAuditBackend = new FileAuditBackend(mockObjectMapper);

        auditLogger = (Logger) LoggerFactory.getLogger(FileAuditBackend.AUDIT_LOGGER_NAME);
        listAppender = new ListAppender<>();
        listAppender.start();
        auditLogger.addAppender(listAppender);
        auditLogger.setAdditive(false);
    }

    @AfterEach
    void tearDown() {
        auditLogger.detachAppender(listAppender);
        listAppender.stop();
    }

    @Test
    @DisplayName("logEvent: Should serialize event and log JSON to dedicated audit logger")
    void logEvent_Success() throws JsonProcessingException {
        // Arrange
        AuditEvent event = AuditEvent.builder().timestamp(Instant.now()).type("static_secret").action("update_key").outcome("success").build();
        String expectedJson = "{\"type\":\"static_secret\",\"action\":\"update_key\",\"outcome\":\"success\"}";
        when(mockObjectMapper.writeValueAsString(event)).thenReturn(expectedJson);

        // Act
        fileAuditBackend.logEvent(event);

        // Assert
        List<ILoggingEvent> logsList = listAppender.list;
        assertThat(logsList).hasSize(1);
        assertThat(logsList.get(0).getLevel()).isEqualTo(Level.INFO);
        assertThat(logsList.get(0).getFormattedMessage()).isEqualTo(expectedJson);
        assertThat(logsList.get(0).getLoggerName()).isEqualTo(FileAuditBackend.AUDIT_LOGGER_NAME);
    }

    @Test
    @DisplayName("logEvent: Should write nothing to the audit logger when serialization fails")
    void logEvent_SerializationFailure() throws JsonProcessingException {
        // Arrange
        AuditEvent event = AuditEvent.builder().timestamp(Instant.now()).type("fail").build();
        when(mockObjectMapper.writeValueAsString(event)).thenThrow(new JsonProcessingException("Test exception") {});

        // Act
        fileAuditBackend.logEvent(event);

        // Assert
        assertThat(listAppender.list).isEmpty();
    }

    @Test
    @DisplayName("logEvent: Should handle null event gracefully")
    void logEvent_NullEvent() throws JsonProcessingException {
        fileAuditBackend.logEvent(null);

        verify(mockObjectMapper, never()).writeValueAsString(any());
        assertThat(listAppender.list).isEmpty();
    }
}
