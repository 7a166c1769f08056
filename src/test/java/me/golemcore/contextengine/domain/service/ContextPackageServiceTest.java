package me.golemcore.contextengine.domain.service;

import me.golemcore.contextengine.domain.model.AgentRole;
import me.golemcore.contextengine.domain.model.ContextPackage;
import me.golemcore.contextengine.domain.model.PackagePriority;
import me.golemcore.contextengine.domain.model.PackageType;
import me.golemcore.contextengine.infrastructure.config.ContextEngineProperties;
import me.golemcore.contextengine.port.outbound.ContextStorePort;
import me.golemcore.contextengine.security.SecretRedactor;
import me.golemcore.contextengine.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class ContextPackageServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private ContextStorePort storePort;
    private ContextPackageService service;

    @BeforeEach
    void setUp() {
        storePort = mock(ContextStorePort.class);
        service = new ContextPackageService(storePort, new SecretRedactor(),
                new ContextSettingsService(new ContextEngineProperties()), new MutableClock(NOW));
    }

    @Test
    void shouldCompleteAndStorePackage() {
        ContextPackage registered = service.register(ContextPackage.builder()
                .sessionId("S1")
                .priority(PackagePriority.HIGH)
                .packageType(PackageType.DECISIONS)
                .summary("  Use the existing retry helper  ")
                .consumerRoles(null)
                .build());

        assertNotNull(registered.getId());
        assertEquals(NOW, registered.getCreatedAt());
        assertEquals("Use the existing retry helper", registered.getSummary());
        assertTrue(registered.getConsumerRoles().isEmpty());
        verify(storePort).savePackage(registered);
    }

    @Test
    void shouldKeepProvidedIdAndTimestamp() {
        Instant created = NOW.minusSeconds(60);

        ContextPackage registered = service.register(ContextPackage.builder()
                .id("pkg-1")
                .sessionId("S1")
                .priority(PackagePriority.LOW)
                .summary("notes")
                .consumerRoles(List.of(AgentRole.QA_EXPERT))
                .createdAt(created)
                .build());

        assertEquals("pkg-1", registered.getId());
        assertEquals(created, registered.getCreatedAt());
    }

    @Test
    void shouldRedactSummaryBeforeStoring() {
        service.register(ContextPackage.builder()
                .sessionId("S1")
                .priority(PackagePriority.CRITICAL)
                .summary("connect with postgres://app:s3cretpass@db:5432/main")
                .build());

        ArgumentCaptor<ContextPackage> captor = ArgumentCaptor.forClass(ContextPackage.class);
        verify(storePort).savePackage(captor.capture());
        assertFalse(captor.getValue().getSummary().contains("s3cretpass"));
    }

    @Test
    void shouldRejectIncompletePackages() {
        assertThrows(IllegalArgumentException.class, () -> service.register(null));
        assertThrows(IllegalArgumentException.class, () -> service.register(ContextPackage.builder()
                .priority(PackagePriority.HIGH).summary("s").build()));
        assertThrows(IllegalArgumentException.class, () -> service.register(ContextPackage.builder()
                .sessionId("S1").summary("s").build()));
        assertThrows(IllegalArgumentException.class, () -> service.register(ContextPackage.builder()
                .sessionId("S1").priority(PackagePriority.HIGH).summary(" ").build()));
        verify(storePort, never()).savePackage(any());
    }
}
