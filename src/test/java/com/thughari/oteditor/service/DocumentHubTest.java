package com.thughari.oteditor.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.thughari.oteditor.config.CollabProperties;
import com.thughari.oteditor.message.CollabMessage;
import com.thughari.oteditor.message.Collaborator;
import com.thughari.oteditor.message.CursorChange;
import com.thughari.oteditor.message.MessageCodec;
import com.thughari.oteditor.message.SaveRequest;
import com.thughari.oteditor.message.UserLeave;
import com.thughari.oteditor.model.DocumentEntity;
import com.thughari.oteditor.model.Operation;
import com.thughari.oteditor.model.Position;
import com.thughari.oteditor.ot.PositionCodec;
import com.thughari.oteditor.repo.DocumentRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.thughari.oteditor.TestOperations.insert;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DocumentHubTest {

    private static final String DOC_ID = "doc-1";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final MessageCodec codec = new MessageCodec(objectMapper);
    private DocumentRepository repository;
    private DocumentHub hub;

    @BeforeEach
    void setUp() {
        repository = mock(DocumentRepository.class);
        DocumentEntity stored = new DocumentEntity(DOC_ID);
        stored.setContent(new ArrayList<>(List.of("abcdef")));
        when(repository.findById(DOC_ID)).thenReturn(Optional.of(stored));
        when(repository.findById("fresh")).thenReturn(Optional.empty());
        when(repository.save(any(DocumentEntity.class))).thenAnswer(inv -> inv.getArgument(0));
        hub = new DocumentHub(codec, repository, new PositionCodec(), new CollabProperties(),
                Clock.fixed(Instant.ofEpochMilli(5_000), ZoneOffset.UTC));
    }

    @Test
    void extractsDocumentIdFromPath() {
        assertThat(hub.getDocIdFromUri("/collaborate/abc")).isEqualTo("abc");
        assertThat(hub.getDocIdFromUri("/collaborate/")).isNull();
        assertThat(hub.getDocIdFromUri("/other/abc")).isNull();
        assertThat(hub.getDocIdFromUri(null)).isNull();
    }

    @Test
    void unknownDocumentIsCreatedOnFirstSession() {
        WebSocketSession session = session("s1");

        hub.registerSession(session, "fresh");

        verify(repository).save(any(DocumentEntity.class));
        assertThat(hub.getHostedDocument("fresh").snapshot().getContent()).containsExactly("");
    }

    @Test
    void joinSendsSnapshotToJoinerAndAnnouncesToOthers() throws Exception {
        WebSocketSession alice = joined("s1", "alice");
        WebSocketSession bob = session("s2");
        hub.registerSession(bob, DOC_ID);

        hub.handleMessage(bob, join("bob"));

        List<JsonNode> toBob = sent(bob);
        assertThat(toBob).hasSize(1);
        assertThat(toBob.get(0).path("type").asText()).isEqualTo("version_sync");
        assertThat(toBob.get(0).path("payload").path("content").get(0).asText()).isEqualTo("abcdef");
        assertThat(types(sent(alice))).containsExactly("version_sync", "user_join");
        assertThat(hub.getCurrentCollaborators(DOC_ID)).containsExactlyInAnyOrder("alice", "bob");
    }

    @Test
    void documentChangeIsAppliedAcknowledgedAndRelayed() throws Exception {
        WebSocketSession alice = joined("s1", "alice");
        WebSocketSession bob = joined("s2", "bob");
        Operation op = insert("alice", 0, 6, "!", 10);

        hub.handleMessage(alice, CollabMessage.of(op, "alice", 10));

        assertThat(hub.getHostedDocument(DOC_ID).snapshot().getContent()).containsExactly("abcdef!");
        JsonNode ack = last(sent(alice));
        assertThat(ack.path("type").asText()).isEqualTo("operation_ack");
        assertThat(ack.path("payload").path("operationId").asText()).isEqualTo(op.getId());
        assertThat(ack.path("payload").path("version").asLong()).isEqualTo(1);
        JsonNode relayed = last(sent(bob));
        assertThat(relayed.path("type").asText()).isEqualTo("document_change");
        assertThat(relayed.path("payload").path("id").asText()).isEqualTo(op.getId());
        assertThat(types(sent(alice))).doesNotContain("document_change");
    }

    @Test
    void concurrentChangesAreTransformedOnTheServer() throws Exception {
        WebSocketSession alice = joined("s1", "alice");
        WebSocketSession bob = joined("s2", "bob");

        hub.handleMessage(alice, CollabMessage.of(insert("alice", 0, 1, "X", 10), "alice", 10));
        hub.handleMessage(bob, CollabMessage.of(insert("bob", 0, 4, "Y", 11), "bob", 11));

        assertThat(hub.getHostedDocument(DOC_ID).snapshot().getContent()).containsExactly("aXbcdYef");
        assertThat(hub.getHostedDocument(DOC_ID).snapshot().getVersion()).isEqualTo(2);
    }

    @Test
    void changeBeforeJoinIsRejected() throws Exception {
        WebSocketSession stranger = session("s9");
        hub.registerSession(stranger, DOC_ID);

        hub.handleMessage(stranger, CollabMessage.of(insert("eve", 0, 0, "x", 1), "eve", 1));

        assertThat(types(sent(stranger))).containsExactly("error");
        assertThat(hub.getHostedDocument(DOC_ID).snapshot().getVersion()).isZero();
    }

    @Test
    void changeClaimingAnotherUserIsRejected() throws Exception {
        WebSocketSession alice = joined("s1", "alice");

        hub.handleMessage(alice, CollabMessage.of(insert("bob", 0, 0, "x", 1), "alice", 1));

        assertThat(last(sent(alice)).path("type").asText()).isEqualTo("error");
        assertThat(hub.getHostedDocument(DOC_ID).snapshot().getVersion()).isZero();
    }

    @Test
    void messageFromUnregisteredSessionGetsError() throws Exception {
        WebSocketSession unknown = session("s0");

        hub.handleMessage(unknown, join("ghost"));

        assertThat(types(sent(unknown))).containsExactly("error");
    }

    @Test
    void cursorMovesAreRelayedToOthersOnly() throws Exception {
        WebSocketSession alice = joined("s1", "alice");
        WebSocketSession bob = joined("s2", "bob");

        hub.handleMessage(alice, CollabMessage.of(
                CursorChange.builder().userId("alice").cursor(Position.of(0, 3)).build(), "alice", 3));

        assertThat(last(sent(bob)).path("type").asText()).isEqualTo("cursor_change");
        assertThat(types(sent(alice))).doesNotContain("cursor_change");
    }

    @Test
    void saveRequestPersistsHostedState() throws Exception {
        WebSocketSession alice = joined("s1", "alice");
        hub.handleMessage(alice, CollabMessage.of(insert("alice", 0, 0, ">", 10), "alice", 10));

        hub.handleMessage(alice, CollabMessage.of(SaveRequest.builder().title("Notes").build(), "alice", 11));

        ArgumentCaptor<DocumentEntity> saved = ArgumentCaptor.forClass(DocumentEntity.class);
        verify(repository).save(saved.capture());
        assertThat(saved.getValue().getId()).isEqualTo(DOC_ID);
        assertThat(saved.getValue().getTitle()).isEqualTo("Notes");
        assertThat(saved.getValue().getContent()).containsExactly(">abcdef");
        assertThat(saved.getValue().getVersion()).isEqualTo(1);
    }

    @Test
    void leavingUserIsAnnouncedAndLastLeavePersists() throws Exception {
        WebSocketSession alice = joined("s1", "alice");
        WebSocketSession bob = joined("s2", "bob");

        DocumentHub.SessionDetails details = hub.unregisterSession(bob);

        assertThat(details.getUserId()).isEqualTo("bob");
        assertThat(details.getDocId()).isEqualTo(DOC_ID);
        assertThat(last(sent(alice)).path("type").asText()).isEqualTo("user_leave");
        verify(repository, never()).save(any(DocumentEntity.class));

        hub.unregisterSession(alice);

        verify(repository, times(1)).save(any(DocumentEntity.class));
        assertThat(hub.getHostedDocument(DOC_ID)).isNull();
    }

    @Test
    void explicitLeaveMessageIsRelayed() throws Exception {
        WebSocketSession alice = joined("s1", "alice");
        WebSocketSession bob = joined("s2", "bob");

        hub.handleMessage(bob, CollabMessage.of(UserLeave.builder().userId("bob").build(), "bob", 20));

        assertThat(last(sent(alice)).path("payload").path("userId").asText()).isEqualTo("bob");
        assertThat(hub.getUserIdForSession(bob)).isNull();
    }

    @Test
    void snapshotsAreBroadcastToEverySession() throws Exception {
        WebSocketSession alice = joined("s1", "alice");
        WebSocketSession bob = joined("s2", "bob");

        hub.broadcastSnapshots();

        assertThat(last(sent(alice)).path("type").asText()).isEqualTo("version_sync");
        assertThat(last(sent(bob)).path("type").asText()).isEqualTo("version_sync");
    }

    private WebSocketSession joined(String sessionId, String userId) throws Exception {
        WebSocketSession session = session(sessionId);
        hub.registerSession(session, DOC_ID);
        hub.handleMessage(session, join(userId));
        return session;
    }

    private static CollabMessage join(String userId) {
        return CollabMessage.of(Collaborator.builder().id(userId).name(userId).build(), userId, 1);
    }

    private static WebSocketSession session(String id) {
        WebSocketSession session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn(id);
        when(session.isOpen()).thenReturn(true);
        return session;
    }

    private List<JsonNode> sent(WebSocketSession session) throws Exception {
        ArgumentCaptor<TextMessage> captor = ArgumentCaptor.forClass(TextMessage.class);
        verify(session, atLeast(0)).sendMessage(captor.capture());
        List<JsonNode> messages = new ArrayList<>();
        for (TextMessage message : captor.getAllValues()) {
            messages.add(objectMapper.readTree(message.getPayload()));
        }
        return messages;
    }

    private static List<String> types(List<JsonNode> messages) {
        List<String> types = new ArrayList<>();
        for (JsonNode message : messages) {
            types.add(message.path("type").asText());
        }
        return types;
    }

    private static JsonNode last(List<JsonNode> messages) {
        assertThat(messages).isNotEmpty();
        return messages.get(messages.size() - 1);
    }
}
