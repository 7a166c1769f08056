package me.golemcore.contextengine.adapter.inbound.web.controller;

import me.golemcore.contextengine.adapter.inbound.web.dto.AssembleContextRequest;
import me.golemcore.contextengine.adapter.inbound.web.dto.ContextBlockResponse;
import me.golemcore.contextengine.adapter.inbound.web.dto.RegisterPackageRequest;
import me.golemcore.contextengine.domain.model.AgentRole;
import me.golemcore.contextengine.domain.model.BudgetZone;
import me.golemcore.contextengine.domain.model.ConsumptionRecord;
import me.golemcore.contextengine.domain.model.ContextBlock;
import me.golemcore.contextengine.domain.model.ContextPackage;
import me.golemcore.contextengine.domain.model.ContextRequest;
import me.golemcore.contextengine.domain.model.PackagePriority;
import me.golemcore.contextengine.domain.model.PackageType;
import me.golemcore.contextengine.domain.model.Strategy;
import me.golemcore.contextengine.domain.service.ConsumptionTracker;
import me.golemcore.contextengine.domain.service.ContextAssembler;
import me.golemcore.contextengine.domain.service.ContextPackageService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import reactor.test.StepVerifier;

class ContextControllerTest {

    private ContextAssembler contextAssembler;
    private ContextPackageService contextPackageService;
    private ConsumptionTracker consumptionTracker;
    private ContextController controller;

    @BeforeEach
    void setUp() {
        contextAssembler = mock(ContextAssembler.class);
        contextPackageService = mock(ContextPackageService.class);
        consumptionTracker = mock(ConsumptionTracker.class);
        controller = new ContextController(contextAssembler, contextPackageService, consumptionTracker);
    }

    @Test
    void shouldAssembleContext() {
        ContextBlock block = ContextBlock.builder()
                .renderedContext("# Context for developer\n")
                .zone(BudgetZone.SOFT_WARNING)
                .usageFraction(0.65)
                .includedPackages(List.of(ContextPackage.builder().id("p1").build()))
                .overflowCount(2)
                .strategies(List.of(Strategy.builder().id("s1").topic("builds").insight("cache").build()))
                .estimatedTokens(12)
                .build();
        when(contextAssembler.assemble(any(ContextRequest.class))).thenReturn(block);

        StepVerifier.create(controller.assemble(AssembleContextRequest.builder()
                .sessionId("S1")
                .groupId("G1")
                .role("Developer")
                .modelId("gpt-4o")
                .currentTokenUsage(1000)
                .iteration(2)
                .build()))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    ContextBlockResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals("SOFT_WARNING", body.getZone());
                    assertEquals(List.of("p1"), body.getPackageIds());
                    assertEquals(2, body.getOverflowCount());
                    assertEquals("builds", body.getStrategies().get(0).getTopic());
                    assertEquals(false, body.isCheckpointRequired());
                })
                .verifyComplete();

        ArgumentCaptor<ContextRequest> captor = ArgumentCaptor.forClass(ContextRequest.class);
        verify(contextAssembler).assemble(captor.capture());
        assertEquals(AgentRole.DEVELOPER, captor.getValue().getRole());
        assertEquals(2, captor.getValue().getIteration());
        assertTrue(captor.getValue().getRecentErrors().isEmpty());
    }

    @Test
    void shouldFlagCheckpointInEmergency() {
        when(contextAssembler.assemble(any(ContextRequest.class))).thenReturn(ContextBlock.builder()
                .renderedContext("halt")
                .zone(BudgetZone.EMERGENCY)
                .build());

        StepVerifier.create(controller.assemble(AssembleContextRequest.builder()
                .sessionId("S1")
                .role("qa_expert")
                .build()))
                .assertNext(response -> assertTrue(response.getBody().isCheckpointRequired()))
                .verifyComplete();
    }

    @Test
    void shouldRejectAssembleWithoutSession() {
        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> controller.assemble(AssembleContextRequest.builder().role("developer").build()));

        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
        verify(contextAssembler, never()).assemble(any(ContextRequest.class));
    }

    @Test
    void shouldRejectUnknownRole() {
        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> controller.assemble(AssembleContextRequest.builder().sessionId("S1").role("janitor").build()));

        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
    }

    @Test
    void shouldRegisterPackage() {
        when(contextPackageService.register(any(ContextPackage.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));

        StepVerifier.create(controller.registerPackage(RegisterPackageRequest.builder()
                .sessionId("S1")
                .groupId("G1")
                .packageType("research")
                .priority("HIGH")
                .summary("Found the root cause")
                .producerRole("investigator")
                .consumerRoles(List.of("developer", "tech-lead"))
                .build()))
                .assertNext(response -> {
                    assertEquals(HttpStatus.CREATED, response.getStatusCode());
                    ContextPackage body = response.getBody();
                    assertNotNull(body);
                    assertEquals(PackageType.RESEARCH, body.getPackageType());
                    assertEquals(PackagePriority.HIGH, body.getPriority());
                    assertEquals(AgentRole.INVESTIGATOR, body.getProducerRole());
                    assertEquals(List.of(AgentRole.DEVELOPER, AgentRole.TECH_LEAD), body.getConsumerRoles());
                })
                .verifyComplete();
    }

    @Test
    void shouldRejectPackageWithoutPriority() {
        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> controller.registerPackage(RegisterPackageRequest.builder()
                        .sessionId("S1")
                        .summary("s")
                        .build()));

        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
        verify(contextPackageService, never()).register(any());
    }

    @Test
    void shouldRejectUnknownPriority() {
        assertThrows(ResponseStatusException.class, () -> controller.registerPackage(RegisterPackageRequest.builder()
                .sessionId("S1")
                .summary("s")
                .priority("urgent")
                .build()));
    }

    @Test
    void shouldReturnConsumption() {
        ConsumptionRecord row = ConsumptionRecord.builder()
                .sessionId("S1")
                .role(AgentRole.DEVELOPER)
                .iteration(1)
                .packageId("p1")
                .build();
        when(consumptionTracker.deliveries("S1")).thenReturn(List.of(row));

        StepVerifier.create(controller.getConsumption("S1"))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals(List.of(row), response.getBody());
                })
                .verifyComplete();
    }
}
