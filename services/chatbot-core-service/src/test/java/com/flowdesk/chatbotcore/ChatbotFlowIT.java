package com.flowdesk.chatbotcore;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flowdesk.chatbotcore.channel.state.ConnectionManager;
import com.flowdesk.chatbotcore.channel.store.CredentialStore;
import com.flowdesk.chatbotcore.channel.transport.ChannelTransport;
import com.flowdesk.chatbotcore.channel.transport.OutboundMessage;
import com.flowdesk.chatbotcore.channel.transport.TransportCapabilities;
import com.flowdesk.chatbotcore.conversation.domain.Conversation;
import com.flowdesk.chatbotcore.conversation.service.ConversationStateStore;
import com.flowdesk.chatbotcore.graph.domain.FlowGraphEntity;
import com.flowdesk.chatbotcore.graph.domain.GraphConnectionEntity;
import com.flowdesk.chatbotcore.graph.domain.GraphNodeEntity;
import com.flowdesk.chatbotcore.graph.domain.GraphOptionEntity;
import com.flowdesk.chatbotcore.graph.domain.NodeKind;
import com.flowdesk.chatbotcore.graph.repository.FlowGraphRepository;
import com.flowdesk.chatbotcore.graph.repository.GraphConnectionRepository;
import com.flowdesk.chatbotcore.graph.repository.GraphNodeRepository;
import com.flowdesk.chatbotcore.graph.repository.GraphOptionRepository;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

@Testcontainers
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class ChatbotFlowIT {

  private static final ParameterizedTypeReference<Map<String, Object>> JSON =
      new ParameterizedTypeReference<>() {};

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
    r.add("dev.channel.enabled", () -> "true");
    r.add("events.redis.enabled", () -> "false");
    r.add("channel.bridge.webhook-secret", () -> "it-secret");
    r.add("channel.dispatch.retry-backoff", () -> "PT0S");
    // Redis is never used with events.redis.enabled=false.
    r.add("spring.data.redis.host", () -> "127.0.0.1");
    r.add("spring.data.redis.port", () -> "1");
  }

  @LocalServerPort int port;

  @Autowired TestRestTemplate http;
  @Autowired FlowGraphRepository graphs;
  @Autowired GraphNodeRepository nodes;
  @Autowired GraphOptionRepository options;
  @Autowired GraphConnectionRepository connections;
  @Autowired ConnectionManager connectionManager;
  @Autowired CredentialStore credentials;
  @Autowired ConversationStateStore conversations;

  @MockBean ChannelTransport transport;

  @BeforeEach
  void stubTransport() {
    when(transport.capabilities()).thenReturn(TransportCapabilities.textOnly());
    when(transport.send(anyString(), anyString(), any())).thenReturn("wamid-1");
  }

  private String base() {
    return "http://localhost:" + port;
  }

  private void seedMenu(String tenantId) {
    FlowGraphEntity graph = graphs.save(new FlowGraphEntity(tenantId, "Main menu", true, null));
    GraphNodeEntity welcome =
        nodes.save(new GraphNodeEntity(graph.getId(), NodeKind.MESSAGE, "Welcome to Acme", true, false));
    GraphNodeEntity menu =
        nodes.save(new GraphNodeEntity(graph.getId(), NodeKind.OPTION, "How can we help?", false, false));
    GraphNodeEntity sales =
        nodes.save(new GraphNodeEntity(graph.getId(), NodeKind.MESSAGE, "Sales is open 9-5", false, true));
    GraphNodeEntity agent =
        nodes.save(new GraphNodeEntity(graph.getId(), NodeKind.ESCALATION, null, false, true));
    connections.save(new GraphConnectionEntity(graph.getId(), welcome.getId(), menu.getId(), null, null));
    options.save(new GraphOptionEntity(menu.getId(), "Sales", 0, sales.getId()));
    options.save(new GraphOptionEntity(menu.getId(), "Talk to an agent", 1, agent.getId()));
  }

  private void connect(String tenantId) {
    credentials.save(tenantId, "{\"session\":\"it\"}");
    connectionManager.initialize(tenantId, "it");
    connectionManager.onOpened(tenantId);
  }

  private String send(String tenantId, String contact, String text) {
    ResponseEntity<Map<String, Object>> res =
        http.exchange(
            base() + "/dev/channel/message",
            HttpMethod.POST,
            new HttpEntity<>(Map.of("tenantId", tenantId, "contactAddress", contact, "text", text)),
            JSON);
    assertThat(res.getStatusCode()).isEqualTo(HttpStatus.OK);
    return (String) res.getBody().get("result");
  }

  @Test
  void contact_walks_menu_and_gets_escalated() {
    String tenant = "tenant-walk";
    String contact = "15550001@s.whatsapp.net";
    seedMenu(tenant);
    connect(tenant);

    assertThat(send(tenant, contact, "hi")).isEqualTo("RESPONDED");
    verify(transport).send(tenant, contact, new OutboundMessage.Text("Welcome to Acme"));
    verify(transport)
        .send(tenant, contact, new OutboundMessage.Text("How can we help?\n1. Sales\n2. Talk to an agent"));

    assertThat(send(tenant, contact, "2")).isEqualTo("RESPONDED");
    assertThat(send(tenant, contact, "anyone there?")).isEqualTo("SUPPRESSED");

    Conversation c = conversations.findOpen(tenant, contact).orElseThrow();
    assertThat(c.status().name()).isEqualTo("ESCALATED");
    verify(transport, times(3)).send(eq(tenant), eq(contact), any());
  }

  @Test
  void first_message_while_disconnected_is_delivered_after_connect() {
    String tenant = "tenant-queue";
    String contact = "15550002@s.whatsapp.net";
    seedMenu(tenant);

    assertThat(send(tenant, contact, "hello")).isEqualTo("QUEUED");

    connect(tenant);

    verify(transport, timeout(5000))
        .send(tenant, contact, new OutboundMessage.Text("Welcome to Acme"));
  }

  @Test
  void group_messages_are_ignored_and_unknown_tenants_have_no_flow() {
    assertThat(send("tenant-none", "1203630@g.us", "hi")).isEqualTo("IGNORED");
    assertThat(send("tenant-none", "15550003@s.whatsapp.net", "hi")).isEqualTo("NO_FLOW");
  }

  @Test
  void admin_close_finishes_conversation() {
    String tenant = "tenant-close";
    String contact = "15550004@s.whatsapp.net";
    seedMenu(tenant);
    connect(tenant);
    send(tenant, contact, "hi");
    String id = conversations.findOpen(tenant, contact).orElseThrow().id();

    ResponseEntity<Map<String, Object>> closed =
        http.exchange(
            base() + "/api/conversations/" + id + "/close", HttpMethod.POST, HttpEntity.EMPTY, JSON);

    assertThat(closed.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(closed.getBody()).containsEntry("status", "FINISHED").containsEntry("closeReason", "MANUAL");
    assertThat(conversations.findOpen(tenant, contact)).isEmpty();

    ResponseEntity<Map<String, Object>> missing =
        http.exchange(
            base() + "/api/conversations/nope/close", HttpMethod.POST, HttpEntity.EMPTY, JSON);
    assertThat(missing.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    assertThat(missing.getBody()).containsEntry("code", "NOT_FOUND");
  }

  @Test
  void session_endpoints_report_and_change_state() {
    String tenant = "tenant-session";
    connect(tenant);

    ResponseEntity<Map<String, Object>> session =
        http.exchange(base() + "/api/tenants/" + tenant + "/channel/session", HttpMethod.GET, null, JSON);
    assertThat(session.getBody()).containsEntry("status", "CONNECTED").containsEntry("channel", "whatsapp");

    ResponseEntity<Map<String, Object>> down =
        http.exchange(
            base() + "/api/tenants/" + tenant + "/channel/disconnect", HttpMethod.POST, HttpEntity.EMPTY, JSON);
    assertThat(down.getBody())
        .containsEntry("status", "DISCONNECTED")
        .containsEntry("manualDisconnect", true);

    ResponseEntity<Map<String, Object>> pairing =
        http.exchange(
            base() + "/api/tenants/" + tenant + "/channel/pairing", HttpMethod.POST, HttpEntity.EMPTY, JSON);
    assertThat(pairing.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);

    ResponseEntity<Map<String, Object>> unknown =
        http.exchange(base() + "/api/tenants/ghost/channel/session", HttpMethod.GET, null, JSON);
    assertThat(unknown.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
  }

  @Test
  void bridge_webhook_requires_secret() {
    HttpHeaders headers = new HttpHeaders();
    headers.set("X-Bridge-Secret", "wrong");
    ResponseEntity<Map<String, Object>> rejected =
        http.exchange(
            base() + "/channel/bridge/events",
            HttpMethod.POST,
            new HttpEntity<>(Map.of("type", "open", "tenantId", "tenant-hook"), headers),
            JSON);
    assertThat(rejected.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);

    headers.set("X-Bridge-Secret", "it-secret");
    ResponseEntity<Map<String, Object>> accepted =
        http.exchange(
            base() + "/channel/bridge/events",
            HttpMethod.POST,
            new HttpEntity<>(Map.of("type", "bogus", "tenantId", "tenant-hook"), headers),
            JSON);
    assertThat(accepted.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(accepted.getBody()).containsEntry("ignored", "unknown_type");
  }
}
