package com.phillippitts.scriptorium.logging;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.Logger;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.filter.AbstractFilter;
import org.apache.logging.log4j.core.layout.PatternLayout;
import org.apache.logging.log4j.util.ReadOnlyStringMap;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * Verifies that reservation audit lines carry the requestId, userId and assetId set by MdcFilter.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class LoggingFormatIntegrationTest {

    private static final String LISTENER_LOGGER =
            "com.phillippitts.scriptorium.service.events.WorkflowEventsListener";

    @Autowired
    private TestRestTemplate restTemplate;

    private InMemoryAppender appender;
    private Logger logger;

    @BeforeEach
    void setUpAppender() {
        LoggerContext ctx = (LoggerContext) LogManager.getContext(false);
        logger = ctx.getLogger(LISTENER_LOGGER);
        appender = new InMemoryAppender("test-appender");
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void tearDownAppender() {
        if (logger != null && appender != null) {
            logger.removeAppender(appender);
            appender.stop();
        }
    }

    @Test
    void shouldIncludeRequestUserAndAssetInReservationLogs() {
        HttpHeaders headers = new HttpHeaders();
        headers.add("X-Request-ID", "abc123");
        headers.add("X-User-ID", "demo");

        ResponseEntity<String> response = restTemplate.exchange(
                "/api/assets/log-asset-1/reservation",
                HttpMethod.POST,
                new HttpEntity<>(headers),
                String.class
        );

        assertThat(response.getStatusCode().is2xxSuccessful()).isTrue();

        await().atMost(3, SECONDS).until(() ->
                appender.getEvents().stream().anyMatch(e -> e.getMessage().getFormattedMessage()
                        .contains("Reservation obtained")));

        LogEvent event = appender.getEvents().stream()
                .filter(e -> e.getMessage().getFormattedMessage().contains("Reservation obtained"))
                .findFirst()
                .orElseThrow();

        ReadOnlyStringMap contextData = event.getContextData();
        assertThat((String) contextData.getValue("requestId")).isEqualTo("abc123");
        assertThat((String) contextData.getValue("userId")).isEqualTo("demo");
        assertThat((String) contextData.getValue("assetId")).isEqualTo("log-asset-1");
        assertThat(event.getLoggerName()).isEqualTo(LISTENER_LOGGER);
    }

    private static class InMemoryAppender extends AbstractAppender {
        private final List<LogEvent> events = new CopyOnWriteArrayList<>();

        protected InMemoryAppender(String name) {
            super(name, new AbstractFilter() {}, PatternLayout.createDefaultLayout(), true, null);
        }

        @Override
        public void append(LogEvent event) {
            events.add(event.toImmutable());
        }

        List<LogEvent> getEvents() {
            return Collections.unmodifiableList(events);
        }
    }
}
