package br.edu.ifba.mindgraph.understanding;

import br.edu.ifba.mindgraph.resolve.RelationshipVocabulary;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for the REST and LLM understanding adapters with mocked clients.
 */
class TextUnderstandingServicesTest {

    private final RelationshipVocabulary vocabulary =
        new RelationshipVocabulary(List.of("causes", "enjoys"), Map.of(), true);

    private final UnderstandingThreads threads = new UnderstandingThreads(2, 2);

    @AfterEach
    void shutdownThreads() {
        threads.shutdown();
    }

    @Nested
    @DisplayName("REST provider")
    class RestProviderTests {

        private RestTextUnderstandingService service;
        private TextUnderstandingClient client;

        @BeforeEach
        void setUp() {
            client = mock(TextUnderstandingClient.class);
            service = new RestTextUnderstandingService();
            service.client = client;
            service.vocabulary = vocabulary;
            service.threads = threads;
        }

        @Test
        @DisplayName("Sends entity types and the vocabulary with the turn")
        void testSendsRequest() {
            when(client.understand(any())).thenReturn("{\"entities\": []}");

            String raw = service.understand("I love yoga", List.of("hi")).join();

            assertEquals("{\"entities\": []}", raw);
            ArgumentCaptor<UnderstandingRequest> captor = ArgumentCaptor.forClass(UnderstandingRequest.class);
            verify(client).understand(captor.capture());
            UnderstandingRequest request = captor.getValue();
            assertEquals("I love yoga", request.text());
            assertEquals(List.of("hi"), request.contextWindow());
            assertEquals(List.of("causes", "enjoys"), request.relationshipTypes());
            assertTrue(request.entityTypes().contains("Person"));
            assertEquals("rest", service.providerName());
        }

        @Test
        @DisplayName("Client failures surface as TextUnderstandingException")
        void testClientFailure() {
            when(client.understand(any())).thenThrow(new RuntimeException("connection refused"));

            CompletionException e = assertThrows(CompletionException.class,
                () -> service.understand("hello", List.of()).join());

            assertInstanceOf(TextUnderstandingException.class, e.getCause());
        }
    }

    @Nested
    @DisplayName("Understanding pool")
    class PoolTests {

        @Test
        @DisplayName("Calls beyond the running and pending limits are refused at submission")
        void testSaturatedPoolRejects() throws Exception {
            UnderstandingThreads single = new UnderstandingThreads(1, 1);
            TextUnderstandingClient client = mock(TextUnderstandingClient.class);
            CountDownLatch started = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            when(client.understand(any())).thenAnswer(invocation -> {
                started.countDown();
                release.await(5, TimeUnit.SECONDS);
                return "{}";
            });
            RestTextUnderstandingService service = new RestTextUnderstandingService();
            service.client = client;
            service.vocabulary = vocabulary;
            service.threads = single;
            try {
                CompletableFuture<String> running = service.understand("one", List.of());
                assertTrue(started.await(5, TimeUnit.SECONDS));
                CompletableFuture<String> pending = service.understand("two", List.of());

                assertThrows(RejectedExecutionException.class, () -> service.understand("three", List.of()));
                assertEquals(1, single.activeCalls());

                release.countDown();
                assertEquals("{}", running.get(5, TimeUnit.SECONDS));
                assertEquals("{}", pending.get(5, TimeUnit.SECONDS));
            } finally {
                release.countDown();
                single.shutdown();
            }
        }

        @Test
        @DisplayName("Limits must be positive")
        void testInvalidLimits() {
            assertThrows(IllegalArgumentException.class, () -> new UnderstandingThreads(0, 4));
            assertThrows(IllegalArgumentException.class, () -> new UnderstandingThreads(4, 0));
        }
    }

    @Nested
    @DisplayName("LLM provider")
    class LlmProviderTests {

        private LlmTextUnderstandingService service;
        private LlmChatClient chatClient;

        @BeforeEach
        void setUp() {
            chatClient = mock(LlmChatClient.class);
            service = new LlmTextUnderstandingService();
            service.chatClient = chatClient;
            service.vocabulary = vocabulary;
            service.threads = threads;
            service.model = "test-model";
            service.temperature = 0.0;
            service.maxTokens = 256;
        }

        private LlmChatResponse response(String content) {
            return new LlmChatResponse("r1", "test-model",
                List.of(new LlmChatResponse.Choice(0, ChatMessage.user(content), "stop")),
                new LlmChatResponse.Usage(10, 5, 15));
        }

        @Test
        @DisplayName("Returns the first choice's content")
        void testReturnsContent() {
            when(chatClient.chat(any())).thenReturn(response("{\"entities\": []}"));

            assertEquals("{\"entities\": []}", service.understand("hello", List.of()).join());
            assertEquals("llm", service.providerName());
        }

        @Test
        @DisplayName("A response without choices is malformed")
        void testNoChoices() {
            when(chatClient.chat(any())).thenReturn(new LlmChatResponse("r1", "test-model", List.of(), null));

            CompletionException e = assertThrows(CompletionException.class,
                () -> service.understand("hello", List.of()).join());

            assertInstanceOf(MalformedUnderstandingException.class, e.getCause());
        }

        @Test
        @DisplayName("A rejected call keeps its status")
        void testRejectedCall() {
            when(chatClient.chat(any())).thenThrow(new UnderstandingRejectedException(401, "bad key"));

            CompletionException e = assertThrows(CompletionException.class,
                () -> service.understand("hello", List.of()).join());

            assertInstanceOf(UnderstandingRejectedException.class, e.getCause());
        }
    }
}
