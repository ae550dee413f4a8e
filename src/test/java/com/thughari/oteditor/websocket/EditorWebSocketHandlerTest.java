package com.thughari.oteditor.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.thughari.oteditor.message.CollabMessage;
import com.thughari.oteditor.message.MessageCodec;
import com.thughari.oteditor.service.DocumentHub;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class EditorWebSocketHandlerTest {

    private DocumentHub hub;
    private EditorWebSocketHandler handler;
    private WebSocketSession session;

    @BeforeEach
    void setUp() {
        hub = mock(DocumentHub.class);
        handler = new EditorWebSocketHandler(new MessageCodec(new ObjectMapper()), hub);
        session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn("s1");
        when(session.isOpen()).thenReturn(true);
    }

    @Test
    void registersSessionForDocumentInPath() throws Exception {
        when(session.getUri()).thenReturn(URI.create("ws://localhost:8080/collaborate/doc-7"));
        when(hub.getDocIdFromUri("/collaborate/doc-7")).thenReturn("doc-7");

        handler.afterConnectionEstablished(session);

        verify(hub).registerSession(session, "doc-7");
    }

    @Test
    void closesConnectionWithoutDocumentId() throws Exception {
        when(session.getUri()).thenReturn(URI.create("ws://localhost:8080/collaborate/"));
        when(hub.getDocIdFromUri("/collaborate/")).thenReturn(null);

        handler.afterConnectionEstablished(session);

        ArgumentCaptor<CloseStatus> status = ArgumentCaptor.forClass(CloseStatus.class);
        verify(session).close(status.capture());
        assertThat(status.getValue().getCode()).isEqualTo(CloseStatus.BAD_DATA.getCode());
        verify(hub, never()).registerSession(any(), anyString());
    }

    @Test
    void forwardsDecodedMessagesToHub() throws Exception {
        String json = "{\"type\":\"user_join\",\"payload\":{\"id\":\"alice\",\"name\":\"Alice\"},\"userId\":\"alice\",\"timestamp\":1}";

        handler.handleMessage(session, new TextMessage(json));

        ArgumentCaptor<CollabMessage> message = ArgumentCaptor.forClass(CollabMessage.class);
        verify(hub).handleMessage(eq(session), message.capture());
        assertThat(message.getValue().getUserId()).isEqualTo("alice");
    }

    @Test
    void answersMalformedMessagesWithError() throws Exception {
        handler.handleMessage(session, new TextMessage("{\"type\":\"chat_message\",\"payload\":{}}"));

        verify(hub).sendErrorMessage(session, "Invalid message format.");
        verify(hub, never()).handleMessage(any(), any());
    }

    @Test
    void unregistersOnClose() throws Exception {
        when(hub.unregisterSession(session)).thenReturn(new DocumentHub.SessionDetails("doc-7", "alice"));

        handler.afterConnectionClosed(session, CloseStatus.NORMAL);

        verify(hub).unregisterSession(session);
    }
}
