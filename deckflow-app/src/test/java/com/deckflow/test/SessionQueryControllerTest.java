package com.deckflow.test;

import com.deckflow.config.ApiAuthFilter;
import com.deckflow.domain.identity.adapter.gateway.IIdentityGateway;
import com.deckflow.domain.session.model.entity.WorkflowSessionEntity;
import com.deckflow.domain.session.model.valobj.ClarificationQuestion;
import com.deckflow.domain.session.model.valobj.PendingRequest;
import com.deckflow.infrastructure.collaborator.MockCollaboratorGateway;
import com.deckflow.infrastructure.identity.ConfiguredTokenIdentityGateway;
import com.deckflow.infrastructure.repository.session.WorkflowSessionRepositoryImpl;
import com.deckflow.test.support.FakeClientChannel;
import com.deckflow.test.support.TestSupport;
import com.deckflow.trigger.application.common.EnvelopeFactory;
import com.deckflow.trigger.application.query.SessionQueryService;
import com.deckflow.trigger.connection.ConnectionManager;
import com.deckflow.trigger.http.GlobalApiExceptionHandler;
import com.deckflow.trigger.http.HealthController;
import com.deckflow.trigger.http.SessionQueryController;
import com.deckflow.types.enums.QuestionKindEnum;
import com.deckflow.types.enums.ResponseCode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class SessionQueryControllerTest {

    private MockMvc mockMvc;
    private WorkflowSessionRepositoryImpl sessionRepository;
    private ConnectionManager connectionManager;

    @BeforeEach
    public void setUp() {
        EnvelopeFactory envelopeFactory = new EnvelopeFactory();
        IIdentityGateway identityGateway = new ConfiguredTokenIdentityGateway(
                Map.of("dev-token-alice", "alice", "dev-token-bob", "bob"));
        this.sessionRepository = new WorkflowSessionRepositoryImpl();
        this.connectionManager = new ConnectionManager(identityGateway, envelopeFactory, new ObjectMapper(),
                TestSupport.meterRegistryProvider(new SimpleMeterRegistry()), 45000L);
        SessionQueryService sessionQueryService = new SessionQueryService(sessionRepository, envelopeFactory);
        this.mockMvc = MockMvcBuilders
                .standaloneSetup(
                        new SessionQueryController(sessionQueryService),
                        new HealthController(connectionManager, sessionQueryService, new MockCollaboratorGateway(Runnable::run, 0L)))
                .setControllerAdvice(new GlobalApiExceptionHandler())
                .addFilters(new ApiAuthFilter(new ObjectMapper(), identityGateway))
                .build();
    }

    @Test
    public void shouldReturnSessionSnapshotToOwner() throws Exception {
        WorkflowSessionEntity session = WorkflowSessionEntity.create("s1", "alice", Instant.now());
        session.beginAnalysis("deck", new PendingRequest("m1", "deck", null, Instant.now()));
        session.openClarificationRound(List.of(ClarificationQuestion.builder()
                .questionId("audience").prompt("Who is the audience?").kind(QuestionKindEnum.TEXT).build()), 3, Instant.now());
        session.currentRound().putAnswer("audience", "board");
        sessionRepository.save(session);

        mockMvc.perform(get("/api/sessions/s1").header("Authorization", "Bearer dev-token-alice"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.SUCCESS.getCode()))
                .andExpect(jsonPath("$.data.sessionId").value("s1"))
                .andExpect(jsonPath("$.data.phase").value("clarifying"))
                .andExpect(jsonPath("$.data.clarificationRoundCount").value(1))
                .andExpect(jsonPath("$.data.rounds[0].questions[0].question_id").value("audience"))
                .andExpect(jsonPath("$.data.rounds[0].answers.audience").value("board"))
                .andExpect(jsonPath("$.data.rounds[0].complete").value(true));
    }

    @Test
    public void shouldHideSessionOfAnotherUser() throws Exception {
        sessionRepository.save(WorkflowSessionEntity.create("s1", "alice", Instant.now()));

        mockMvc.perform(get("/api/sessions/s1").header("Authorization", "Bearer dev-token-bob"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value(ResponseCode.NOT_FOUND.getCode()));
    }

    @Test
    public void shouldReportMissingSession() throws Exception {
        mockMvc.perform(get("/api/sessions/nope").header("Authorization", "Bearer dev-token-alice"))
                .andExpect(status().isNotFound());
    }

    @Test
    public void shouldRequireCredential() throws Exception {
        mockMvc.perform(get("/api/sessions/s1"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    public void shouldReportHealthWithoutCredential() throws Exception {
        sessionRepository.save(WorkflowSessionEntity.create("s1", "alice", Instant.now()));
        connectionManager.accept("dev-token-alice", new FakeClientChannel("c1"));

        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("UP"))
                .andExpect(jsonPath("$.data.collaboratorMode").value("mock"))
                .andExpect(jsonPath("$.data.activeConnections").value(1))
                .andExpect(jsonPath("$.data.liveSessions").value(1));
    }
}
