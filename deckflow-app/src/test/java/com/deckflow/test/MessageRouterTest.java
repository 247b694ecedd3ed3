package com.deckflow.test;

import com.deckflow.domain.session.model.entity.WorkflowSessionEntity;
import com.deckflow.domain.workflow.model.valobj.WorkflowPolicy;
import com.deckflow.infrastructure.identity.ConfiguredTokenIdentityGateway;
import com.deckflow.infrastructure.repository.session.WorkflowSessionRepositoryImpl;
import com.deckflow.test.support.FakeClientChannel;
import com.deckflow.test.support.TestSupport;
import com.deckflow.trigger.application.command.WorkflowOrchestratorService;
import com.deckflow.trigger.application.common.EnvelopeFactory;
import com.deckflow.trigger.connection.ConnectionManager;
import com.deckflow.trigger.router.EnvelopeValidator;
import com.deckflow.trigger.router.MessageRouter;
import com.deckflow.trigger.router.SessionMailboxDispatcher;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

public class MessageRouterTest {

    private static final String TS = "2026-10-19T08:00:00Z";

    private final ObjectMapper objectMapper = new ObjectMapper();

    private EnvelopeFactory envelopeFactory;
    private WorkflowSessionRepositoryImpl sessionRepository;
    private WorkflowOrchestratorService orchestratorService;
    private ConnectionManager connectionManager;
    private MessageRouter messageRouter;
    private FakeClientChannel channel;

    @BeforeEach
    public void setUp() {
        this.envelopeFactory = new EnvelopeFactory();
        this.sessionRepository = new WorkflowSessionRepositoryImpl();
        this.orchestratorService = mock(WorkflowOrchestratorService.class);
        this.connectionManager = new ConnectionManager(
                new ConfiguredTokenIdentityGateway(Map.of("tok-alice", "alice", "tok-bob", "bob")),
                envelopeFactory,
                objectMapper,
                TestSupport.meterRegistryProvider(new SimpleMeterRegistry()),
                45000L);
        this.messageRouter = newRouter(new SessionMailboxDispatcher(Runnable::run));
        this.channel = new FakeClientChannel("c1");
        connectionManager.accept("tok-alice", channel);
    }

    @Test
    public void shouldAnswerPingWithPong() throws Exception {
        messageRouter.route("c1", control(null, "ping", null));

        JsonNode frame = lastFrame();
        assertEquals("control", frame.get("type").asText());
        assertEquals("pong", frame.get("payload").get("action").asText());
        verifyNoInteractions(orchestratorService);
    }

    @Test
    public void shouldStartSessionWithGeneratedId() {
        messageRouter.route("c1", control(null, "start", "quarterly deck"));

        ArgumentCaptor<String> sessionId = ArgumentCaptor.forClass(String.class);
        verify(orchestratorService).start(sessionId.capture(), eq("alice"), eq("m1"), eq("quarterly deck"));
        assertTrue(sessionId.getValue().startsWith("sess_"));
        assertTrue(connectionManager.isBound(sessionId.getValue(), "c1"));
    }

    @Test
    public void shouldRejectMalformedClientSessionId() throws Exception {
        messageRouter.route("c1", control("bad id!", "start", null));

        assertEquals("INVALID_ENVELOPE", lastFrame().get("payload").get("code").asText());
        verifyNoInteractions(orchestratorService);
    }

    @Test
    public void shouldResumeOwnSessionOnStart() {
        sessionRepository.save(WorkflowSessionEntity.create("s1", "alice", Instant.now()));

        messageRouter.route("c1", control("s1", "start", null));

        verify(orchestratorService).resume("s1", "alice");
        verify(orchestratorService, never()).start(anyString(), anyString(), anyString(), any());
    }

    @Test
    public void shouldForbidStartOnForeignSession() throws Exception {
        sessionRepository.save(WorkflowSessionEntity.create("s1", "bob", Instant.now()));

        messageRouter.route("c1", control("s1", "start", null));

        assertEquals("SESSION_FORBIDDEN", lastFrame().get("payload").get("code").asText());
        verifyNoInteractions(orchestratorService);
    }

    @Test
    public void shouldReportUnknownSessionForInput() throws Exception {
        messageRouter.route("c1", input("missing", "hello"));

        JsonNode frame = lastFrame();
        assertEquals("SESSION_NOT_FOUND", frame.get("payload").get("code").asText());
        assertEquals("missing", frame.get("session_id").asText());
        verifyNoInteractions(orchestratorService);
    }

    @Test
    public void shouldForbidInputOnForeignSession() throws Exception {
        sessionRepository.save(WorkflowSessionEntity.create("s1", "bob", Instant.now()));

        messageRouter.route("c1", input("s1", "hello"));

        assertEquals("SESSION_FORBIDDEN", lastFrame().get("payload").get("code").asText());
        verifyNoInteractions(orchestratorService);
    }

    @Test
    public void shouldResumeBeforeInputOnNewConnection() {
        sessionRepository.save(WorkflowSessionEntity.create("s1", "alice", Instant.now()));

        messageRouter.route("c1", input("s1", "hello"));

        InOrder order = inOrder(orchestratorService);
        order.verify(orchestratorService).resume("s1", "alice");
        order.verify(orchestratorService).handleInput(eq("s1"), eq("m1"), eq("hello"), isNull());
        assertTrue(connectionManager.isBound("s1", "c1"));
    }

    @Test
    public void shouldForbidSecondUserFromSessionStillBeingCreated() throws Exception {
        List<Runnable> pendingDrains = new ArrayList<>();
        MessageRouter deferringRouter = newRouter(new SessionMailboxDispatcher(pendingDrains::add));
        FakeClientChannel bobChannel = new FakeClientChannel("c2");
        connectionManager.accept("tok-bob", bobChannel);

        deferringRouter.route("c1", control("s1", "start", "deck"));
        // alice 的 start 尚未执行，会话还未写入仓储
        deferringRouter.route("c2", control("s1", "start", null));
        deferringRouter.route("c2", input("s1", "hello"));
        deferringRouter.route("c2", control("s1", "cancel", null));
        pendingDrains.forEach(Runnable::run);

        assertEquals(List.of("SESSION_FORBIDDEN", "SESSION_FORBIDDEN", "SESSION_FORBIDDEN"), errorCodes(bobChannel));
        assertTrue(connectionManager.isBound("s1", "c1"));
        assertFalse(connectionManager.isBound("s1", "c2"));
        verify(orchestratorService).start("s1", "alice", "m1", "deck");
        verify(orchestratorService, never()).resume(anyString(), anyString());
        verify(orchestratorService, never()).handleInput(anyString(), anyString(), any(), any());
        verify(orchestratorService, never()).cancel(anyString());
    }

    @Test
    public void shouldCheckOwnershipEvenWhenConnectionIsBound() throws Exception {
        messageRouter.route("c1", control("s1", "start", null));
        assertTrue(connectionManager.isBound("s1", "c1"));
        // 会话被销毁后同一 ID 由 bob 重新创建
        sessionRepository.deleteById("s1");
        sessionRepository.save(WorkflowSessionEntity.create("s1", "bob", Instant.now()));

        messageRouter.route("c1", input("s1", "hello"));

        assertEquals("SESSION_FORBIDDEN", lastFrame().get("payload").get("code").asText());
        verify(orchestratorService, never()).handleInput(anyString(), anyString(), any(), any());
    }

    @Test
    public void shouldReportProtocolErrorForBrokenJson() throws Exception {
        messageRouter.route("c1", "{\"message_id\":");

        JsonNode frame = lastFrame();
        assertEquals("error", frame.get("type").asText());
        assertEquals("INVALID_ENVELOPE", frame.get("payload").get("code").asText());
        assertTrue(frame.get("payload").get("recoverable").asBoolean());
        verifyNoInteractions(orchestratorService);
    }

    @Test
    public void shouldRouteCancelToSession() {
        sessionRepository.save(WorkflowSessionEntity.create("s1", "alice", Instant.now()));

        messageRouter.route("c1", control("s1", "cancel", null));

        verify(orchestratorService).cancel("s1");
    }

    @Test
    public void shouldSuspendSessionWhenChannelDrops() {
        sessionRepository.save(WorkflowSessionEntity.create("s1", "alice", Instant.now()));
        messageRouter.route("c1", control("s1", "start", null));

        connectionManager.teardown("c1", ConnectionManager.TeardownReason.CLIENT_CLOSED);

        verify(orchestratorService).suspend("s1");
    }

    @Test
    public void shouldIgnoreFramesFromUnknownConnection() {
        messageRouter.route("c404", control(null, "start", "deck"));

        verifyNoInteractions(orchestratorService);
        assertTrue(channel.sent().isEmpty());
    }

    private MessageRouter newRouter(SessionMailboxDispatcher dispatcher) {
        return new MessageRouter(
                connectionManager,
                new EnvelopeValidator(objectMapper, WorkflowPolicy.builder().build()),
                dispatcher,
                orchestratorService,
                sessionRepository,
                envelopeFactory);
    }

    private List<String> errorCodes(FakeClientChannel target) throws Exception {
        List<String> codes = new ArrayList<>();
        for (String text : target.sent()) {
            JsonNode frame = objectMapper.readTree(text);
            if ("error".equals(frame.get("type").asText())) {
                codes.add(frame.get("payload").get("code").asText());
            }
        }
        return codes;
    }

    private String control(String sessionId, String action, String text) {
        StringBuilder json = new StringBuilder("{\"message_id\":\"m1\",\"timestamp\":\"" + TS + "\",\"type\":\"control\"");
        if (sessionId != null) {
            json.append(",\"session_id\":\"").append(sessionId).append('"');
        }
        json.append(",\"payload\":{\"action\":\"").append(action).append('"');
        if (text != null) {
            json.append(",\"text\":\"").append(text).append('"');
        }
        return json.append("}}").toString();
    }

    private String input(String sessionId, String text) {
        return "{\"message_id\":\"m1\",\"session_id\":\"" + sessionId + "\",\"timestamp\":\"" + TS
                + "\",\"type\":\"input\",\"payload\":{\"text\":\"" + text + "\"}}";
    }

    private JsonNode lastFrame() throws Exception {
        return objectMapper.readTree(channel.sent().get(channel.sent().size() - 1));
    }
}
