package me.golemcore.bridge.adapter.inbound.slack;

import me.golemcore.bridge.adapter.inbound.slack.event.InboundEvent;
import me.golemcore.bridge.adapter.inbound.slack.event.SlackEventClassifier;
import me.golemcore.bridge.adapter.outbound.slack.SlackApiException;
import me.golemcore.bridge.domain.service.CommandExecutionService;
import me.golemcore.bridge.domain.service.CommandRegistry;
import me.golemcore.bridge.domain.service.CommandRequestParser;
import me.golemcore.bridge.domain.service.ReplyFormatter;
import me.golemcore.bridge.domain.service.ShellCommandRunner;
import me.golemcore.bridge.domain.service.TemplateRenderer;
import me.golemcore.bridge.infrastructure.config.BridgeProperties;
import me.golemcore.bridge.port.outbound.ChatPoster;
import me.golemcore.bridge.port.outbound.ConnectionProvider;
import me.golemcore.bridge.security.AllowlistValidator;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class SlackSocketModeAdapterTest {

    private static final String WSS_URL = "wss://wss-primary.slack.com/link/?ticket=abc";
    private static final String APP_TOKEN = "xapp-test";
    private static final long WAIT_MILLIS = 5000;

    private ConnectionProvider connectionProvider;
    private SlackCommandHandler commandHandler;
    private BridgeProperties properties;
    private FakeTransport transport;
    private List<String> timeline;
    private ObjectMapper objectMapper;
    private SlackSocketModeAdapter adapter;

    @BeforeEach
    void setUp() {
        connectionProvider = mock(ConnectionProvider.class);
        commandHandler = mock(SlackCommandHandler.class);
        properties = new BridgeProperties();
        properties.getSlack().setAppToken(APP_TOKEN);
        timeline = new CopyOnWriteArrayList<>();
        transport = new FakeTransport(timeline);
        objectMapper = new ObjectMapper();

        when(connectionProvider.open(APP_TOKEN)).thenReturn(WSS_URL);

        adapter = createAdapter(commandHandler);
    }

    @AfterEach
    void tearDown() {
        adapter.stop();
    }

    private SlackSocketModeAdapter createAdapter(SlackCommandHandler handler) {
        return new SlackSocketModeAdapter(connectionProvider, transport, new SocketModeFrameParser(objectMapper),
                new SlackEventClassifier(), handler, properties, objectMapper);
    }

    private void connect() {
        adapter.start();
        adapter.onOpen(101, List.of("Upgrade", "Connection"));
    }

    @Test
    void shouldConnectThroughOpenedEndpoint() {
        assertEquals(ConnectionState.DISCONNECTED, adapter.getState());
        assertEquals("slack", adapter.getChannelType());

        adapter.start();

        assertEquals(ConnectionState.CONNECTING, adapter.getState());
        assertEquals(WSS_URL, transport.url);
        assertSame(adapter, transport.listener);
        assertFalse(adapter.isRunning());

        adapter.onOpen(101, List.of("Upgrade"));

        assertEquals(ConnectionState.CONNECTED, adapter.getState());
        assertTrue(adapter.isRunning());
    }

    @Test
    void shouldIgnoreSecondStart() {
        adapter.start();
        adapter.start();

        verify(connectionProvider).open(APP_TOKEN);
        assertEquals(1, transport.connects);
    }

    @Test
    void shouldNotSendAnythingForHelloAndDisconnect() {
        connect();

        adapter.onText(SlackFrames.HELLO);
        adapter.onText(SlackFrames.DISCONNECT);

        assertTrue(transport.connection.sent.isEmpty());
        assertEquals(ConnectionState.CONNECTED, adapter.getState());
    }

    @Test
    void shouldAckReactionExactlyOnceWithoutExecuting() {
        connect();

        adapter.onText(SlackFrames.reaction("env-r"));

        assertEquals(List.of("{\"envelope_id\":\"env-r\"}"), transport.connection.sent);
        verifyNoInteractions(commandHandler);
        assertEquals(ConnectionState.CONNECTED, adapter.getState());
    }

    @Test
    void shouldAckNonCommandEventsWithoutExecuting() {
        connect();

        adapter.onText(SlackFrames.threadReply("env-1"));
        adapter.onText(SlackFrames.botMessage("env-2"));
        adapter.onText(SlackFrames.messageDeleted("env-3"));
        adapter.onText(SlackFrames.unknownEvent("env-4"));

        assertEquals(List.of(
                "{\"envelope_id\":\"env-1\"}",
                "{\"envelope_id\":\"env-2\"}",
                "{\"envelope_id\":\"env-3\"}",
                "{\"envelope_id\":\"env-4\"}"), transport.connection.sent);
        verifyNoInteractions(commandHandler);
    }

    @Test
    void shouldAckBeforeSubmittingInAsyncMode() {
        properties.getExecution().setAsync(true);
        doAnswer(invocation -> timeline.add("submit")).when(commandHandler).submit(any());
        connect();

        adapter.onText(SlackFrames.channelMessage("env-a", "```# executor: echo\nhi```"));

        assertEquals(List.of("send:{\"envelope_id\":\"env-a\"}", "submit"), timeline);
        verify(commandHandler, never()).handle(any());
    }

    @Test
    void shouldHandleBeforeAckInSyncMode() throws Exception {
        properties.getExecution().setAsync(false);
        doAnswer(invocation -> timeline.add("handle")).when(commandHandler).handle(any());
        connect();

        adapter.onText(SlackFrames.channelMessage("env-s", "```# executor: echo\nhi```"));

        transport.connection.awaitSent(1);
        assertEquals(List.of("handle", "send:{\"envelope_id\":\"env-s\"}"), timeline);
        verify(commandHandler, never()).submit(any());
    }

    @Test
    void shouldKeepReadingWhileSyncCommandRuns() throws Exception {
        properties.getExecution().setAsync(false);
        CountDownLatch release = new CountDownLatch(1);
        doAnswer(invocation -> {
            release.await(WAIT_MILLIS, TimeUnit.MILLISECONDS);
            timeline.add("handle");
            return null;
        }).when(commandHandler).handle(any());
        connect();

        adapter.onText(SlackFrames.channelMessage("env-long", "```# executor: echo\nhi```"));
        adapter.onText(SlackFrames.reaction("env-after"));

        assertTrue(transport.connection.sent.isEmpty());
        assertTrue(adapter.isRunning());

        release.countDown();
        transport.connection.awaitSent(2);
        assertEquals(List.of("{\"envelope_id\":\"env-long\"}", "{\"envelope_id\":\"env-after\"}"),
                transport.connection.sent);
        assertEquals(List.of("handle", "send:{\"envelope_id\":\"env-long\"}",
                "send:{\"envelope_id\":\"env-after\"}"), timeline);
    }

    @Test
    void shouldStillAckWhenSyncHandlerThrows() throws Exception {
        properties.getExecution().setAsync(false);
        doAnswer(invocation -> {
            throw new IllegalStateException("formatter exploded");
        }).when(commandHandler).handle(any());
        connect();

        adapter.onText(SlackFrames.channelMessage("env-boom", "```# executor: echo\nhi```"));
        adapter.onText(SlackFrames.reaction("env-next"));

        transport.connection.awaitSent(2);
        assertEquals(List.of("{\"envelope_id\":\"env-boom\"}", "{\"envelope_id\":\"env-next\"}"),
                transport.connection.sent);
        assertTrue(adapter.isRunning());
    }

    @Test
    void shouldPassClassifiedMentionToHandler() {
        connect();

        adapter.onText(SlackFrames.mention("env-m", "<@UBOT> ```# executor: echo\nhi```"));

        ArgumentCaptor<InboundEvent.CommandMessage> captor = ArgumentCaptor.forClass(InboundEvent.CommandMessage.class);
        verify(commandHandler).submit(captor.capture());
        InboundEvent.Mention mention = assertInstanceOf(InboundEvent.Mention.class, captor.getValue());
        assertEquals("C1", mention.channel());
        assertEquals("U1", mention.user());
        assertEquals("1700000000.000200", mention.replyThread());
    }

    @Test
    void shouldAckMalformedFrameWhenEnvelopeIdRecoverableAndKeepGoing() {
        connect();

        adapter.onText("{\"envelope_id\":\"env-bad\",\"type\":\"events_api\",\"payload\":[1,2]}");
        adapter.onText(SlackFrames.reaction("env-next"));

        assertEquals(List.of("{\"envelope_id\":\"env-bad\"}", "{\"envelope_id\":\"env-next\"}"),
                transport.connection.sent);
        assertEquals(ConnectionState.CONNECTED, adapter.getState());
        verifyNoInteractions(commandHandler);
    }

    @Test
    void shouldSkipMalformedFrameWithoutEnvelopeId() {
        connect();

        adapter.onText("not json at all");

        assertTrue(transport.connection.sent.isEmpty());
        assertEquals(ConnectionState.CONNECTED, adapter.getState());
    }

    @Test
    void shouldAckRetriedEnvelopeAgain() {
        connect();

        adapter.onText(SlackFrames.reaction("env-dup"));
        adapter.onText(SlackFrames.reaction("env-dup"));

        assertEquals(2, transport.connection.sent.size());
        assertEquals(ConnectionState.CONNECTED, adapter.getState());
    }

    @Test
    void shouldTerminateWhenAckCannotBeSent() {
        connect();
        transport.connection.accepting = false;

        adapter.onText(SlackFrames.reaction("env-x"));

        assertEquals(ConnectionState.CLOSED, adapter.getState());
        assertEquals("acknowledgement failed", transport.connection.closeReason);
        SocketModeException e = assertThrows(SocketModeException.class, adapter::awaitTermination);
        assertTrue(e.getMessage().contains("env-x"));
    }

    @Test
    void shouldDropFramesAfterClose() {
        connect();
        adapter.stop();

        adapter.onText(SlackFrames.reaction("env-late"));

        assertTrue(transport.connection.sent.isEmpty());
    }

    @Test
    void shouldFailWhenEndpointCannotBeOpened() {
        when(connectionProvider.open(APP_TOKEN)).thenThrow(new SlackApiException("apps.connections.open",
                "invalid_auth"));

        assertThrows(SlackApiException.class, adapter::start);

        assertEquals(ConnectionState.CLOSED, adapter.getState());
        assertEquals(0, transport.connects);
        SocketModeException e = assertThrows(SocketModeException.class, adapter::awaitTermination);
        assertInstanceOf(SlackApiException.class, e.getCause());
    }

    @Test
    void shouldFailOnTransportFailure() {
        connect();

        adapter.onFailure(new java.io.IOException("connection reset"));

        assertEquals(ConnectionState.CLOSED, adapter.getState());
        assertFalse(adapter.isRunning());
        assertThrows(SocketModeException.class, adapter::awaitTermination);
    }

    @Test
    void shouldFailOnUnexpectedServerClose() {
        connect();

        adapter.onClosed(1001, "going away");

        SocketModeException e = assertThrows(SocketModeException.class, adapter::awaitTermination);
        assertTrue(e.getMessage().contains("1001"));
    }

    @Test
    void shouldTerminateNormallyOnStop() {
        connect();

        adapter.stop();
        adapter.onClosed(1000, "shutdown");

        assertEquals(ConnectionState.CLOSED, adapter.getState());
        assertEquals(1000, transport.connection.closeCode);
        assertEquals("shutdown", transport.connection.closeReason);
        assertDoesNotThrow(adapter::awaitTermination);
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void shouldRunEchoAndAckInSyncMode() throws Exception {
        properties.getExecution().setAsync(false);
        ChatPoster chatPoster = mockChatPoster();
        ShellCommandRunner runner = new ShellCommandRunner(properties);
        SlackCommandHandler handler = realHandler(chatPoster, runner);
        adapter = createAdapter(handler);
        try {
            connect();

            adapter.onText(SlackFrames.channelMessage("env-echo", "```# executor: echo\nhi```"));

            transport.connection.awaitSent(1);
            assertEquals(List.of("{\"envelope_id\":\"env-echo\"}"), transport.connection.sent);
            ArgumentCaptor<String> reply = ArgumentCaptor.forClass(String.class);
            verify(chatPoster).post(eq("C1"), reply.capture(), eq("1700000000.000100"));
            assertTrue(reply.getValue().startsWith(":white_check_mark: `echo`"));
            assertTrue(reply.getValue().contains("```\nhi\n```"));
        } finally {
            handler.shutdown();
            runner.shutdown();
        }
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void shouldAckThenRunEchoInAsyncMode() {
        properties.getExecution().setAsync(true);
        ChatPoster chatPoster = mockChatPoster();
        ShellCommandRunner runner = new ShellCommandRunner(properties);
        SlackCommandHandler handler = realHandler(chatPoster, runner);
        adapter = createAdapter(handler);
        try {
            connect();

            adapter.onText(SlackFrames.mention("env-echo", "<@UBOT> ```# executor: echo\nhi```"));

            assertEquals(List.of("{\"envelope_id\":\"env-echo\"}"), transport.connection.sent);
            ArgumentCaptor<String> reply = ArgumentCaptor.forClass(String.class);
            verify(chatPoster, timeout(WAIT_MILLIS)).post(eq("C1"), reply.capture(), eq("1700000000.000200"));
            assertTrue(reply.getValue().contains("```\nhi\n```"));
        } finally {
            handler.shutdown();
            runner.shutdown();
        }
    }

    private static ChatPoster mockChatPoster() {
        ChatPoster chatPoster = mock(ChatPoster.class);
        when(chatPoster.post(anyString(), anyString(), anyString()))
                .thenReturn(CompletableFuture.completedFuture("1700000000.999999"));
        return chatPoster;
    }

    private SlackCommandHandler realHandler(ChatPoster chatPoster, ShellCommandRunner runner) {
        CommandRegistry registry = CommandRegistry.fromMap(Map.of("echo", "echo {{payload}}"));
        CommandExecutionService executionService = new CommandExecutionService(registry, new TemplateRenderer(),
                runner);
        return new SlackCommandHandler(new CommandRequestParser(), executionService, chatPoster,
                new ReplyFormatter(), new AllowlistValidator(properties), properties);
    }

    @Test
    void shouldRejectAckWhenNotConnected() {
        assertThrows(SocketModeException.class, () -> adapter.acknowledge("env-1"));
    }

    private static final class FakeTransport implements SocketModeTransport {

        private final List<String> timeline;
        private String url;
        private SocketModeListener listener;
        private FakeConnection connection;
        private int connects;

        FakeTransport(List<String> timeline) {
            this.timeline = timeline;
        }

        @Override
        public SocketConnection connect(String url, SocketModeListener listener) {
            this.url = url;
            this.listener = listener;
            this.connects++;
            this.connection = new FakeConnection(timeline);
            return connection;
        }
    }

    private static final class FakeConnection implements SocketConnection {

        private final List<String> timeline;
        private final List<String> sent = new CopyOnWriteArrayList<>();
        private volatile boolean accepting = true;
        private volatile int closeCode;
        private volatile String closeReason;

        FakeConnection(List<String> timeline) {
            this.timeline = timeline;
        }

        @Override
        public boolean send(String text) {
            if (!accepting) {
                return false;
            }
            sent.add(text);
            timeline.add("send:" + text);
            return true;
        }

        @Override
        public void close(int code, String reason) {
            closeCode = code;
            closeReason = reason;
        }

        void awaitSent(int count) throws InterruptedException {
            long deadline = System.currentTimeMillis() + WAIT_MILLIS;
            while (sent.size() < count && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
            assertEquals(count, sent.size(), "acknowledgements sent: " + sent);
        }
    }
}
