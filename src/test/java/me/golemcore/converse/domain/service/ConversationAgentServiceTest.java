package me.golemcore.converse.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.converse.adapter.outbound.history.InMemoryConversationHistoryAdapter;
import me.golemcore.converse.domain.agent.AgentEngineFactory;
import me.golemcore.converse.domain.agent.AgentStreamEvent;
import me.golemcore.converse.domain.agent.RunResult;
import me.golemcore.converse.domain.model.LlmRequest;
import me.golemcore.converse.domain.model.LlmResponse;
import me.golemcore.converse.domain.model.Message;
import me.golemcore.converse.domain.model.ToolCall;
import me.golemcore.converse.infrastructure.config.AgentProperties;
import me.golemcore.converse.port.outbound.ConversationHistoryPort.StoredMessage;
import me.golemcore.converse.port.outbound.LlmException;
import me.golemcore.converse.port.outbound.LlmPort;
import me.golemcore.converse.tools.TerminateTool;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.core.Disposable;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ConversationAgentServiceTest {

    private LlmPort llmPort;
    private InMemoryConversationHistoryAdapter history;
    private ConversationAgentService service;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        llmPort = mock(LlmPort.class);
        AgentProperties properties = new AgentProperties();
        properties.setMaxSteps(3);
        AgentEngineFactory factory = new AgentEngineFactory(llmPort, ToolRegistry.of(new TerminateTool()),
                properties, new ObjectMapper());
        history = new InMemoryConversationHistoryAdapter();
        service = new ConversationAgentService(factory, history);
    }

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    private static CompletableFuture<LlmResponse> reply(String content, ToolCall... calls) {
        return CompletableFuture.completedFuture(LlmResponse.builder()
                .choices(List.of(LlmResponse.Choice.builder()
                        .finishReason("end_turn")
                        .message(LlmResponse.ChoiceMessage.builder()
                                .role("assistant")
                                .content(content)
                                .toolCalls(calls.length > 0 ? List.of(calls) : null)
                                .build())
                        .build()))
                .build());
    }

    @Test
    void chatReturnsReplyAndRecordsTurn() {
        when(llmPort.chat(any())).thenReturn(reply("Hi there"));

        ConversationReply result = service.chat("alice", "hello");

        assertEquals("alice", result.getConversationKey());
        assertEquals("Hi there", result.getReply());
        assertEquals(RunResult.Termination.FINISHED, result.getTermination());
        assertEquals(1, result.getSteps());
        assertFalse(result.isFailed());

        List<StoredMessage> stored = history.loadMessages("alice");
        assertEquals(2, stored.size());
        assertEquals(StoredMessage.of("user", "hello"), stored.get(0));
        assertEquals(StoredMessage.of("assistant", "Hi there"), stored.get(1));
    }

    @Test
    void secondTurnSeesStoredHistory() {
        when(llmPort.chat(any())).thenReturn(reply("first answer"), reply("second answer"));

        service.chat("alice", "one");
        service.chat("alice", "two");

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort, times(2)).chat(captor.capture());
        List<Message> sent = captor.getAllValues().get(1).getMessages();
        assertEquals(List.of("one", "first answer", "two"), sent.stream().map(Message::getContent).toList());
        assertEquals(4, history.loadMessages("alice").size());
    }

    @Test
    void blankKeyUsesGuestConversation() {
        when(llmPort.chat(any())).thenReturn(reply("hello guest"));

        ConversationReply result = service.chat(" ", "hi");

        assertEquals(ConversationAgentService.GUEST_KEY, result.getConversationKey());
        assertEquals(2, history.loadMessages(ConversationAgentService.GUEST_KEY).size());
    }

    @Test
    void rehydratesExplicitHistoryAndSkipsInvalidEntries() {
        when(llmPort.chat(any())).thenReturn(reply("sure"));
        List<StoredMessage> stored = List.of(
                StoredMessage.of("user", "earlier question"),
                StoredMessage.of("robot", "not a role"),
                new StoredMessage("tool", "orphan result", null, null),
                StoredMessage.of("assistant", "earlier answer"));

        service.chat("bob", stored, "follow up");

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort).chat(captor.capture());
        assertEquals(List.of("earlier question", "earlier answer", "follow up"),
                captor.getValue().getMessages().stream().map(Message::getContent).toList());
    }

    @Test
    void fallsBackWhenRunProducesNoReplyText() {
        when(llmPort.chat(any())).thenReturn(
                reply(null, ToolCall.function("c1", "terminate", "{\"status\":\"success\"}")));

        ConversationReply result = service.chat("carol", List.of(), "finish");

        assertEquals(ConversationAgentService.FALLBACK_REPLY, result.getReply());
        assertFalse(result.isFailed());
    }

    @Test
    void reportsRunFailureAsErrorReply() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.failedFuture(new LlmException("backend down")));

        ConversationReply result = service.chat("dave", "hello");

        assertTrue(result.isFailed());
        assertNull(result.getTermination());
        assertTrue(result.getReply().startsWith(ConversationAgentService.ERROR_REPLY_PREFIX));
        assertTrue(result.getReply().contains("backend down"));
        assertEquals(List.of(StoredMessage.of("user", "hello")), history.loadMessages("dave"));
    }

    @Test
    void reusesEnginePerConversation() {
        when(llmPort.chat(any())).thenReturn(reply("ok"));

        service.chat("a", List.of(), "1");
        service.chat("a", List.of(), "2");
        service.chat("b", List.of(), "3");

        assertEquals(2, service.activeConversations());
    }

    @Test
    void evictsIdleConversation() {
        when(llmPort.chat(any())).thenReturn(reply("ok"));
        service.chat("a", List.of(), "1");

        assertTrue(service.evict("a"));
        assertFalse(service.evict("a"));
        assertEquals(0, service.activeConversations());
    }

    @Test
    void serializesTurnsOfSameConversation() throws Exception {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        when(llmPort.chat(any())).thenAnswer(invocation -> {
            int current = inFlight.incrementAndGet();
            maxInFlight.accumulateAndGet(current, Math::max);
            Thread.sleep(50);
            inFlight.decrementAndGet();
            return reply("ok");
        });
        executor = Executors.newFixedThreadPool(4);

        List<Future<ConversationReply>> futures = List.of(
                executor.submit(() -> service.chat("same", List.of(), "1")),
                executor.submit(() -> service.chat("same", List.of(), "2")),
                executor.submit(() -> service.chat("same", List.of(), "3")));
        for (Future<ConversationReply> future : futures) {
            assertFalse(future.get(5, TimeUnit.SECONDS).isFailed());
        }

        assertEquals(1, maxInFlight.get());
    }

    @Test
    void streamedTurnReleasesConversation() {
        when(llmPort.chat(any())).thenReturn(reply("streamed"), reply("after"));

        StepVerifier.create(service.chatStream("erin", List.of(), "hi"))
                .expectNextMatches(event -> event.getType() == AgentStreamEvent.Type.STEP_STARTED)
                .expectNextMatches(event -> event.getType() == AgentStreamEvent.Type.STEP_COMPLETED)
                .assertNext(event -> assertEquals("streamed", event.getText()))
                .verifyComplete();

        assertEquals("after", service.chat("erin", List.of(), "again").getReply());
        assertTrue(service.evict("erin"));
    }

    @Test
    void streamedTurnPropagatesFailure() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.failedFuture(new LlmException("boom")));

        StepVerifier.create(service.chatStream("frank", List.of(), "hi"))
                .expectNextCount(1)
                .expectErrorMessage("Agent run failed at step 1: boom")
                .verify();

        assertTrue(service.evict("frank"));
    }

    @Test
    void cancelledStreamKeepsConversationLockedUntilStepEnds() throws Exception {
        CompletableFuture<LlmResponse> pending = new CompletableFuture<>();
        CountDownLatch modelCalled = new CountDownLatch(1);
        when(llmPort.chat(any())).thenAnswer(invocation -> {
            modelCalled.countDown();
            return pending;
        }).thenReturn(reply("fresh"));

        Disposable subscription = service.chatStream("gina", List.of(), "hi").subscribe();
        assertTrue(modelCalled.await(5, TimeUnit.SECONDS));
        subscription.dispose();

        executor = Executors.newSingleThreadExecutor();
        Future<ConversationReply> next = executor.submit(() -> service.chat("gina", List.of(), "again"));
        assertThrows(TimeoutException.class, () -> next.get(200, TimeUnit.MILLISECONDS));

        pending.complete(reply("late").join());

        ConversationReply reply = next.get(5, TimeUnit.SECONDS);
        assertFalse(reply.isFailed());
        assertEquals("fresh", reply.getReply());
        assertTrue(service.evict("gina"));
    }
}
