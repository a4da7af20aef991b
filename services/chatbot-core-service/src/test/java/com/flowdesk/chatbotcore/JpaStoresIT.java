package com.flowdesk.chatbotcore;

import static org.assertj.core.api.Assertions.assertThat;

import com.flowdesk.chatbotcore.channel.domain.SessionStatus;
import com.flowdesk.chatbotcore.channel.state.SessionState;
import com.flowdesk.chatbotcore.channel.store.ChannelSessionStore;
import com.flowdesk.chatbotcore.channel.store.CredentialStore;
import com.flowdesk.chatbotcore.conversation.domain.CloseReason;
import com.flowdesk.chatbotcore.conversation.domain.Conversation;
import com.flowdesk.chatbotcore.conversation.domain.ConversationStatus;
import com.flowdesk.chatbotcore.conversation.service.ConversationStateStore;
import com.flowdesk.chatbotcore.pending.OwedReply;
import com.flowdesk.chatbotcore.pending.PendingEntry;
import com.flowdesk.chatbotcore.pending.PendingResponseStore;
import com.flowdesk.chatbotcore.pending.PendingStatus;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

@Testcontainers
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
class JpaStoresIT {

  @Container
  static final PostgreSQLContainer<?> postgres =
      new PostgreSQLContainer<>("postgres:16-alpine")
          .withDatabaseName("flowdesk")
          .withUsername("flowdesk")
          .withPassword("flowdesk");

  @DynamicPropertySource
  static void props(DynamicPropertyRegistry r) {
    r.add("spring.datasource.url", postgres::getJdbcUrl);
    r.add("spring.datasource.username", postgres::getUsername);
    r.add("spring.datasource.password", postgres::getPassword);
    r.add("spring.data.redis.host", () -> "127.0.0.1");
    r.add("spring.data.redis.port", () -> "1");
  }

  // Postgres keeps microseconds
  private static final Instant T0 = Instant.now().truncatedTo(ChronoUnit.MILLIS);

  @Autowired ConversationStateStore conversations;
  @Autowired PendingResponseStore pending;
  @Autowired ChannelSessionStore sessions;
  @Autowired CredentialStore credentials;

  @Test
  void conversation_lifecycle() {
    Conversation c = conversations.start("t-conv", "111@s.whatsapp.net", 1L, 10L, T0);

    assertThat(conversations.findOpen("t-conv", "111@s.whatsapp.net")).contains(c);

    Conversation moved = conversations.advance(c.id(), 11L, false, T0.plusSeconds(5));
    assertThat(moved.currentNodeId()).isEqualTo(11L);
    assertThat(moved.lastActivityAt()).isEqualTo(T0.plusSeconds(5));

    assertThat(conversations.findIdle(T0.plusSeconds(60)))
        .extracting(Conversation::id)
        .contains(c.id());

    Conversation finished = conversations.finish(c.id(), CloseReason.INACTIVITY, T0.plusSeconds(120)).orElseThrow();
    assertThat(finished.status()).isEqualTo(ConversationStatus.FINISHED);
    assertThat(finished.closeReason()).isEqualTo(CloseReason.INACTIVITY);
    assertThat(conversations.finish(c.id(), CloseReason.MANUAL, T0.plusSeconds(130))).isEmpty();
    assertThat(conversations.findOpen("t-conv", "111@s.whatsapp.net")).isEmpty();

    Conversation next = conversations.start("t-conv", "111@s.whatsapp.net", 1L, 10L, T0.plusSeconds(200));
    assertThat(next.id()).isNotEqualTo(c.id());
  }

  @Test
  void escalated_conversation_stays_open_but_is_not_idle() {
    Conversation c = conversations.start("t-esc", "222@s.whatsapp.net", 1L, 10L, T0);

    conversations.advance(c.id(), 12L, true, T0);

    assertThat(conversations.findOpen("t-esc", "222@s.whatsapp.net"))
        .map(Conversation::status)
        .contains(ConversationStatus.ESCALATED);
    assertThat(conversations.findIdle(T0.plus(Duration.ofHours(1))))
        .extracting(Conversation::id)
        .doesNotContain(c.id());
  }

  @Test
  void pending_entries_move_through_claim_release_and_dead_letter() {
    OwedReply owed = new OwedReply("t-pend", "conv-1", "333@s.whatsapp.net", 7L, "1", 0);
    assertThat(pending.appendIfAbsent(owed, T0)).isTrue();
    assertThat(pending.appendIfAbsent(owed, T0)).isFalse();
    assertThat(pending.tenantsWithPending()).contains("t-pend");

    List<PendingEntry> claimed = pending.claim("t-pend");
    assertThat(claimed).singleElement().extracting(PendingEntry::status).isEqualTo(PendingStatus.SENDING);
    assertThat(claimed.get(0).fromNodeId()).isEqualTo(7L);
    assertThat(claimed.get(0).input()).isEqualTo("1");
    assertThat(pending.hasPending("t-pend")).isFalse();
    assertThat(pending.appendIfAbsent(owed, T0)).isFalse();

    Long id = claimed.get(0).id();
    assertThat(pending.release(id, "timeout", 2, 1)).isEqualTo(PendingStatus.PENDING);
    assertThat(pending.claim("t-pend")).singleElement().extracting(PendingEntry::deliveredBlocks).isEqualTo(1);
    assertThat(pending.release(id, "timeout", 2, 1)).isEqualTo(PendingStatus.DEAD);
    assertThat(pending.hasPending("t-pend")).isFalse();

    assertThat(pending.appendIfAbsent(owed, T0)).isTrue();
  }

  @Test
  void owed_reply_is_claimed_per_conversation() {
    pending.appendIfAbsent(new OwedReply("t-own", "conv-a", "555@s.whatsapp.net", 3L, null, 0), T0);
    pending.appendIfAbsent(new OwedReply("t-own", "conv-b", "556@s.whatsapp.net", 3L, "2", 0), T0);

    assertThat(pending.claimFor("conv-a")).map(PendingEntry::isGreeting).contains(true);
    assertThat(pending.claimFor("conv-a")).isEmpty();
    assertThat(pending.claim("t-own")).extracting(PendingEntry::conversationId).containsExactly("conv-b");
  }

  @Test
  void claimed_entries_return_to_queue_on_reset() {
    pending.appendIfAbsent(new OwedReply("t-reset", "conv-r", "444@s.whatsapp.net", 1L, null, 0), T0);
    List<PendingEntry> claimed = pending.claim("t-reset");

    assertThat(pending.resetClaimed()).isGreaterThanOrEqualTo(1);
    assertThat(pending.hasPending("t-reset")).isTrue();

    pending.complete(claimed.get(0).id());
    assertThat(pending.hasPending("t-reset")).isFalse();
  }

  @Test
  void session_rows_and_restart_reset() {
    sessions.save("t-sess-a", SessionState.initial().withStatus(SessionStatus.CONNECTED));
    sessions.save("t-sess-b", SessionState.initial().withManual(true));
    sessions.save("t-sess-c", SessionState.initial());

    assertThat(sessions.findReconnectCandidates()).contains("t-sess-c").doesNotContain("t-sess-a", "t-sess-b");

    sessions.resetInterrupted("RESTART");

    SessionState a = sessions.find("t-sess-a").orElseThrow();
    assertThat(a.status()).isEqualTo(SessionStatus.DISCONNECTED);
    assertThat(a.lastReason()).isEqualTo("RESTART");
    assertThat(sessions.findReconnectCandidates()).contains("t-sess-a");
  }

  @Test
  void credentials_are_replaced_and_deleted() {
    String ref = credentials.save("t-cred", "{\"v\":1}");
    assertThat(credentials.save("t-cred", "{\"v\":2}")).isEqualTo(ref);
    assertThat(credentials.load("t-cred")).contains("{\"v\":2}");

    credentials.delete("t-cred");
    assertThat(credentials.load("t-cred")).isEmpty();
  }
}
