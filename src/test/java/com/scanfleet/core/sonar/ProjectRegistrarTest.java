package com.scanfleet.core.sonar;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.scanfleet.core.model.RegistrationResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ProjectRegistrarTest {

    private final ProjectRegistrar registrar = new ProjectRegistrar();

    @Test
    @DisplayName("existing project is not created again")
    void existingProject() {
        var api = mock(SonarApi.class);
        when(api.projectExists("acme_widgets")).thenReturn(true);

        assertEquals(RegistrationResult.EXISTING, registrar.ensureProject(api, "acme_widgets", "acme-widgets"));
        verify(api, never()).createProject(anyString(), anyString());
    }

    @Test
    @DisplayName("missing project is created with key and display name")
    void missingProject() {
        var api = mock(SonarApi.class);

        assertEquals(RegistrationResult.CREATED, registrar.ensureProject(api, "acme_widgets", "acme-widgets"));
        verify(api).createProject("acme_widgets", "acme-widgets");
    }

    @Test
    @DisplayName("creation failure propagates")
    void creationFailurePropagates() {
        var api = mock(SonarApi.class);
        doThrow(new SonarApiException("forbidden", 403)).when(api).createProject(anyString(), anyString());

        var ex = assertThrows(SonarApiException.class,
                () -> registrar.ensureProject(api, "acme_widgets", "acme-widgets"));
        assertEquals(403, ex.getStatusCode());
    }

    @Test
    @DisplayName("concurrent registrations of one key create the project once")
    void concurrentSameKey() throws Exception {
        var server = new InMemorySonar();
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        var start = new CountDownLatch(1);
        try {
            List<Future<RegistrationResult>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return registrar.ensureProject(server, "acme_widgets", "acme-widgets");
                }));
            }
            start.countDown();
            int created = 0;
            for (var f : futures) {
                if (f.get(10, TimeUnit.SECONDS) == RegistrationResult.CREATED) {
                    created++;
                }
            }
            assertEquals(1, created);
            assertEquals(1, server.createCalls.get());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("branch and metadata updates never propagate failures")
    void bestEffortUpdates() {
        var api = mock(SonarApi.class);
        doThrow(new SonarApiException("not found", 404)).when(api).renameDefaultBranch(anyString(), anyString());
        doThrow(new SonarApiException("boom", 500)).when(api).updateMetadata(anyString(), anyString(), anyString());

        assertDoesNotThrow(() -> registrar.syncDefaultBranch(api, "k", "develop"));
        assertDoesNotThrow(() -> registrar.updateMetadata(api, "k", "n", "d"));
        verify(api).renameDefaultBranch("k", "develop");
    }

    @Test
    @DisplayName("log messages leave the level to the log pattern")
    void messagesCarryNoLevelPrefix() {
        var logger = (Logger) LoggerFactory.getLogger(ProjectRegistrar.class);
        var appender = new ListAppender<ILoggingEvent>();
        appender.start();
        logger.addAppender(appender);
        try {
            var api = mock(SonarApi.class);
            doThrow(new SonarApiException("not found", 404)).when(api).renameDefaultBranch(anyString(), anyString());

            registrar.ensureProject(api, "acme_widgets", "acme-widgets");
            registrar.syncDefaultBranch(api, "acme_widgets", "main");

            assertFalse(appender.list.isEmpty());
            for (ILoggingEvent event : appender.list) {
                assertFalse(event.getFormattedMessage().matches("^\\[(INFO|WARN|OK|ERROR)\\].*"),
                        event.getFormattedMessage());
            }
        } finally {
            logger.detachAppender(appender);
        }
    }

    @Test
    void configOnlyNameIsIdempotent() {
        assertEquals("acme-perf (config-only)", ProjectRegistrar.configOnlyName("acme-perf"));
        assertEquals("acme-perf (config-only)", ProjectRegistrar.configOnlyName("acme-perf (config-only)"));
    }

    /** Non-atomic check-then-create server, so only the registrar's locking prevents duplicates. */
    private static final class InMemorySonar implements SonarApi {
        final Set<String> projects = ConcurrentHashMap.newKeySet();
        final AtomicInteger createCalls = new AtomicInteger();

        @Override
        public boolean projectExists(String projectKey) {
            return projects.contains(projectKey);
        }

        @Override
        public void createProject(String projectKey, String name) {
            createCalls.incrementAndGet();
            try {
                Thread.sleep(5);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            projects.add(projectKey);
        }

        @Override
        public void renameDefaultBranch(String projectKey, String branch) {
        }

        @Override
        public void updateMetadata(String projectKey, String name, String description) {
        }
    }
}
