package com.flowdesk.chatbotcore.channel.store;

import com.flowdesk.chatbotcore.channel.state.SessionState;
import java.util.List;
import java.util.Optional;

/** Durable copy of per-tenant session state. */
public interface ChannelSessionStore {

  Optional<SessionState> find(String tenantId);

  /** Inserts the row on first save. */
  void save(String tenantId, SessionState state);

  void updateCredentialsRef(String tenantId, String credentialsRef);

  /** Tenants whose session is DISCONNECTED without a manual disconnect. */
  List<String> findReconnectCandidates();

  /** Moves sessions left in a connection-holding state to DISCONNECTED with the given reason. */
  int resetInterrupted(String reason);
}
