package me.golemcore.bridge.adapter.outbound.slack;

import me.golemcore.bridge.infrastructure.config.BridgeProperties;
import me.golemcore.bridge.infrastructure.http.FeignClientFactory;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SlackWebApiAdapterTest {

    private static final String CONTENT_TYPE = "Content-Type";
    private static final String APPLICATION_JSON = "application/json";
    private static final String APP_TOKEN = "xapp-1-test";
    private static final String BOT_TOKEN = "xoxb-test";
    private static final String WSS_URL = "wss://wss-primary.slack.com/link/?ticket=abc&app_id=A0123";

    private MockWebServer mockServer;
    private BridgeProperties properties;
    private ObjectMapper objectMapper;
    private SlackWebApiAdapter adapter;

    @BeforeEach
    void setUp() throws IOException {
        mockServer = new MockWebServer();
        mockServer.start();

        properties = new BridgeProperties();
        properties.getSlack().setApiBaseUrl(mockServer.url("/api").toString());
        properties.getSlack().setBotToken(BOT_TOKEN);

        objectMapper = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        adapter = new SlackWebApiAdapter(new FeignClientFactory(new OkHttpClient(), objectMapper), properties);
        adapter.init();
    }

    @AfterEach
    void tearDown() throws IOException {
        mockServer.shutdown();
    }

    private void enqueueJson(String body) {
        mockServer.enqueue(new MockResponse().setBody(body).setHeader(CONTENT_TYPE, APPLICATION_JSON));
    }

    @Test
    void shouldOpenConnectionWithAppToken() throws Exception {
        enqueueJson("{\"ok\":true,\"url\":\"" + WSS_URL + "\"}");

        String url = adapter.open(APP_TOKEN);

        assertEquals(WSS_URL, url);
        RecordedRequest request = mockServer.takeRequest(5, TimeUnit.SECONDS);
        assertNotNull(request);
        assertEquals("POST", request.getMethod());
        assertEquals("/api/apps.connections.open", request.getPath());
        assertEquals("Bearer " + APP_TOKEN, request.getHeader("Authorization"));
        assertTrue(request.getHeader(CONTENT_TYPE).startsWith("application/x-www-form-urlencoded"));
    }

    @Test
    void shouldAppendDebugReconnectsWhenEnabled() {
        properties.getSlack().setDebugReconnects(true);
        enqueueJson("{\"ok\":true,\"url\":\"" + WSS_URL + "\"}");

        assertEquals(WSS_URL + "&debug_reconnects=true", adapter.open(APP_TOKEN));
    }

    @Test
    void shouldRejectNotOkOpenResponse() {
        enqueueJson("{\"ok\":false,\"error\":\"invalid_auth\"}");

        SlackApiException e = assertThrows(SlackApiException.class, () -> adapter.open(APP_TOKEN));

        assertEquals("invalid_auth", e.getError());
        assertEquals(SlackWebApiAdapter.OPEN_METHOD, e.getMethod());
    }

    @Test
    void shouldRejectOpenResponseWithoutUrl() {
        enqueueJson("{\"ok\":true}");

        assertThrows(SlackApiException.class, () -> adapter.open(APP_TOKEN));
    }

    @Test
    void shouldWrapHttpErrorOnOpen() {
        mockServer.enqueue(new MockResponse().setResponseCode(500));

        SlackApiException e = assertThrows(SlackApiException.class, () -> adapter.open(APP_TOKEN));

        assertTrue(e.getMessage().contains("HTTP 500"));
        assertNotNull(e.getCause());
    }

    @Test
    void shouldPostMessageInThreadWithBotToken() throws Exception {
        enqueueJson("{\"ok\":true,\"channel\":\"C1\",\"ts\":\"1700000000.000900\",\"message\":{\"text\":\"ok\"}}");

        String ts = adapter.post("C1", "hello", "1700000000.000100").join();

        assertEquals("1700000000.000900", ts);
        RecordedRequest request = mockServer.takeRequest(5, TimeUnit.SECONDS);
        assertNotNull(request);
        assertEquals("/api/chat.postMessage", request.getPath());
        assertEquals("Bearer " + BOT_TOKEN, request.getHeader("Authorization"));
        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        assertEquals("C1", body.get("channel").asText());
        assertEquals("hello", body.get("text").asText());
        assertEquals("1700000000.000100", body.get("thread_ts").asText());
    }

    @Test
    void shouldOmitThreadWhenPostingTopLevel() throws Exception {
        enqueueJson("{\"ok\":true,\"ts\":\"1700000000.000901\"}");

        adapter.post("C1", "hello", null).join();

        RecordedRequest request = mockServer.takeRequest(5, TimeUnit.SECONDS);
        assertNotNull(request);
        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        assertFalse(body.has("thread_ts"));
    }

    @Test
    void shouldFailFutureWhenPostRejected() {
        enqueueJson("{\"ok\":false,\"error\":\"channel_not_found\"}");

        CompletionException e = assertThrows(CompletionException.class,
                () -> adapter.post("C404", "hello", null).join());

        SlackApiException cause = assertInstanceOf(SlackApiException.class, e.getCause());
        assertEquals("channel_not_found", cause.getError());
        assertEquals(SlackWebApiAdapter.POST_METHOD, cause.getMethod());
    }
}
