package com.flowdesk.chatbotcore.conversation.service;

import static com.flowdesk.chatbotcore.support.GraphFixtures.conversation;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flowdesk.chatbotcore.channel.state.ConnectionManager;
import com.flowdesk.chatbotcore.common.web.NotFoundException;
import com.flowdesk.chatbotcore.conversation.domain.CloseReason;
import com.flowdesk.chatbotcore.conversation.domain.Conversation;
import com.flowdesk.chatbotcore.conversation.domain.ConversationStatus;
import com.flowdesk.chatbotcore.dispatch.DispatchResult;
import com.flowdesk.chatbotcore.dispatch.ResponseDispatcher;
import com.flowdesk.chatbotcore.events.EventFanout;
import com.flowdesk.chatbotcore.events.EventKind;
import com.flowdesk.chatbotcore.events.SessionEventPublisher;
import com.flowdesk.chatbotcore.flow.response.BotResponse;
import com.flowdesk.chatbotcore.graph.domain.NodeKind;
import com.flowdesk.chatbotcore.graph.service.NodeGraphStore;
import com.flowdesk.chatbotcore.support.GraphFixtures;
import com.flowdesk.chatbotcore.support.InMemoryConversationStateStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class InactivityReaperTest {

  private static final Instant NOW = Instant.parse("2026-01-01T10:00:00Z");
  private static final Instant STALE = NOW.minus(Duration.ofMinutes(3));

  @Mock ConnectionManager connections;
  @Mock ResponseDispatcher dispatcher;
  @Mock NodeGraphStore graphs;
  @Mock SessionEventPublisher publisher;

  private InMemoryConversationStateStore store;
  private ConversationCloser closer;
  private InactivityReaper reaper;

  @BeforeEach
  void setUp() {
    store = new InMemoryConversationStateStore();
    Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    closer =
        new ConversationCloser(
            store,
            new ConversationLocks(),
            connections,
            dispatcher,
            graphs,
            new ClosingMessageSelector(new Random(7)),
            new EventFanout(publisher),
            clock);
    reaper = new InactivityReaper(store, closer, Runnable::run, clock, Duration.ofMinutes(2));
  }

  @Test
  void closesEveryIdleConversationButNotifiesOnlyLiveTenants() {
    store.put(conversation("c-live", "tenant-live", "111@s.whatsapp.net", 1L, 1L, STALE));
    store.put(conversation("c-down", "tenant-down", "222@s.whatsapp.net", 2L, 1L, STALE));
    store.put(conversation("c-fresh", "tenant-live", "333@s.whatsapp.net", 1L, 1L, NOW.minusSeconds(30)));
    when(connections.isLive("tenant-live")).thenReturn(true);
    when(connections.isLive("tenant-down")).thenReturn(false);
    when(graphs.load(1L)).thenReturn(Optional.empty());
    when(dispatcher.dispatch(eq("tenant-live"), eq("111@s.whatsapp.net"), any()))
        .thenReturn(DispatchResult.sent(List.of("m-1")));

    assertThat(reaper.sweep().join()).isEqualTo(2);

    assertThat(store.find("c-live").orElseThrow().status()).isEqualTo(ConversationStatus.FINISHED);
    assertThat(store.find("c-live").orElseThrow().closeReason()).isEqualTo(CloseReason.INACTIVITY);
    assertThat(store.find("c-live").orElseThrow().finishedAt()).isEqualTo(NOW);
    assertThat(store.find("c-down").orElseThrow().status()).isEqualTo(ConversationStatus.FINISHED);
    assertThat(store.find("c-fresh").orElseThrow().status()).isEqualTo(ConversationStatus.ACTIVE);
    verify(dispatcher, never()).dispatch(eq("tenant-down"), anyString(), any());
    verify(publisher)
        .publish(
            "tenant-down",
            EventKind.CONVERSATION_CLOSED,
            Map.of(
                "conversationId", "c-down",
                "contactAddress", "222@s.whatsapp.net",
                "reason", "INACTIVITY"));
  }

  @Test
  void tenantClosingMessageIsPreferred() {
    store.put(conversation("c-1", "tenant-1", "111@s.whatsapp.net", 5L, 1L, STALE));
    when(connections.isLive("tenant-1")).thenReturn(true);
    when(graphs.load(5L))
        .thenReturn(
            Optional.of(
                GraphFixtures.graph(5L, "tenant-1")
                    .start(1, NodeKind.MESSAGE, "hi")
                    .closingMessage("Bye from Acme")
                    .build()));
    when(dispatcher.dispatch(any(), any(), any())).thenReturn(DispatchResult.sent(List.of()));

    reaper.sweep().join();

    verify(dispatcher).dispatch("tenant-1", "111@s.whatsapp.net", BotResponse.text("Bye from Acme"));
  }

  @Test
  void failingNoticeDoesNotPreventClose() {
    store.put(conversation("c-1", "tenant-1", "111@s.whatsapp.net", 1L, 1L, STALE));
    when(connections.isLive("tenant-1")).thenReturn(true);
    when(graphs.load(1L)).thenReturn(Optional.empty());
    when(dispatcher.dispatch(any(), any(), any())).thenThrow(new IllegalStateException("boom"));

    assertThat(reaper.sweep().join()).isEqualTo(1);
    assertThat(store.find("c-1").orElseThrow().status()).isEqualTo(ConversationStatus.FINISHED);
  }

  @Test
  void pausedAndEscalatedConversationsAreNotReaped() {
    Conversation base = conversation("c-1", "tenant-1", "111@s.whatsapp.net", 1L, 1L, STALE);
    store.put(base);
    store.advance("c-1", 6L, true, STALE);

    assertThat(reaper.sweep().join()).isZero();
    assertThat(store.find("c-1").orElseThrow().status()).isEqualTo(ConversationStatus.ESCALATED);
  }

  @Test
  void sweepHandsClosesToTheChannelExecutor() {
    store.put(conversation("c-1", "tenant-1", "111@s.whatsapp.net", 1L, 1L, STALE));
    store.put(conversation("c-2", "tenant-2", "222@s.whatsapp.net", 1L, 1L, STALE));
    when(connections.isLive(anyString())).thenReturn(false);
    List<Runnable> handedOff = new ArrayList<>();
    InactivityReaper deferred =
        new InactivityReaper(
            store, closer, handedOff::add, Clock.fixed(NOW, ZoneOffset.UTC), Duration.ofMinutes(2));

    CompletableFuture<Integer> closed = deferred.sweep();

    assertThat(closed).isNotDone();
    assertThat(handedOff).hasSize(2);
    assertThat(store.find("c-1").orElseThrow().status()).isEqualTo(ConversationStatus.ACTIVE);

    handedOff.forEach(Runnable::run);

    assertThat(closed.join()).isEqualTo(2);
    assertThat(store.find("c-2").orElseThrow().status()).isEqualTo(ConversationStatus.FINISHED);
  }

  @Test
  void conversationTouchedAfterSelectionIsSkipped() {
    Conversation candidate = store.put(conversation("c-1", "tenant-1", "111@s.whatsapp.net", 1L, 1L, STALE));
    store.touch("c-1", NOW);

    assertThat(closer.closeIdle(candidate, NOW.minus(Duration.ofMinutes(2)))).isFalse();
    assertThat(store.find("c-1").orElseThrow().status()).isEqualTo(ConversationStatus.ACTIVE);
  }

  @Test
  void manualCloseOfUnknownConversationIsNotFound() {
    assertThatThrownBy(() -> closer.closeConversation("nope", null))
        .isInstanceOf(NotFoundException.class);
  }

  @Test
  void manualCloseDefaultsReasonAndIsIdempotent() {
    store.put(conversation("c-1", "tenant-1", "111@s.whatsapp.net", 1L, 1L, NOW));
    when(connections.isLive("tenant-1")).thenReturn(false);

    Conversation closed = closer.closeConversation("c-1", null);
    Conversation again = closer.closeConversation("c-1", CloseReason.INACTIVITY);

    assertThat(closed.status()).isEqualTo(ConversationStatus.FINISHED);
    assertThat(closed.closeReason()).isEqualTo(CloseReason.MANUAL);
    assertThat(again.closeReason()).isEqualTo(CloseReason.MANUAL);
  }

  @Test
  void defaultClosingMessagesRotate() {
    ClosingMessageSelector selector = new ClosingMessageSelector(new Random(1));

    for (int i = 0; i < 20; i++) {
      assertThat(ClosingMessageSelector.DEFAULT_MESSAGES).contains(selector.select("  "));
    }
    assertThat(selector.select("Custom")).isEqualTo("Custom");
  }
}
