/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.bridge.adapter.inbound.slack;

import me.golemcore.bridge.infrastructure.config.BridgeProperties;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import okio.ByteString;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.concurrent.TimeUnit;

/**
 * Socket Mode transport on top of OkHttp's WebSocket client.
 *
 * <p>
 * The WebSocket client is derived from the shared {@link OkHttpClient} with
 * the read timeout disabled, since the connection idles between events, and a
 * ping interval from {@code bridge.slack.ping-interval}. OkHttp answers server
 * pings itself; binary frames are ignored.
 */
@Component
@Slf4j
public class OkHttpSocketModeTransport implements SocketModeTransport {

    static final int NORMAL_CLOSURE = 1000;

    private final OkHttpClient webSocketClient;

    public OkHttpSocketModeTransport(OkHttpClient okHttpClient, BridgeProperties properties) {
        this.webSocketClient = okHttpClient.newBuilder()
                .readTimeout(0, TimeUnit.MILLISECONDS)
                .pingInterval(properties.getSlack().getPingInterval(), TimeUnit.MILLISECONDS)
                .build();
    }

    @Override
    public SocketConnection connect(String url, SocketModeListener listener) {
        Request request = new Request.Builder().url(url).build();
        WebSocket webSocket = webSocketClient.newWebSocket(request, new Listener(listener));
        return new OkHttpSocketConnection(webSocket);
    }

    private static final class Listener extends WebSocketListener {

        private final SocketModeListener delegate;

        Listener(SocketModeListener delegate) {
            this.delegate = delegate;
        }

        @Override
        public void onOpen(WebSocket webSocket, Response response) {
            delegate.onOpen(response.code(), new ArrayList<>(response.headers().names()));
        }

        @Override
        public void onMessage(WebSocket webSocket, String text) {
            delegate.onText(text);
        }

        @Override
        public void onMessage(WebSocket webSocket, ByteString bytes) {
            log.debug("[Slack] Ignoring binary frame of {} bytes", bytes.size());
        }

        @Override
        public void onClosing(WebSocket webSocket, int code, String reason) {
            log.info("[Slack] Server is closing the connection: {} {}", code, reason);
            webSocket.close(NORMAL_CLOSURE, null);
        }

        @Override
        public void onClosed(WebSocket webSocket, int code, String reason) {
            delegate.onClosed(code, reason);
        }

        @Override
        public void onFailure(WebSocket webSocket, Throwable t, Response response) {
            if (response != null) {
                log.warn("[Slack] WebSocket failure with HTTP {}", response.code());
            }
            delegate.onFailure(t);
        }
    }

    private record OkHttpSocketConnection(WebSocket webSocket) implements SocketConnection {

        @Override
        public boolean send(String text) {
            return webSocket.send(text);
        }

        @Override
        public void close(int code, String reason) {
            webSocket.close(code, reason);
        }
    }
}
