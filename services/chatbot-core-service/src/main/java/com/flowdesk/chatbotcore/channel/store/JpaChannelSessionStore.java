package com.flowdesk.chatbotcore.channel.store;

import com.flowdesk.chatbotcore.channel.domain.ChannelSessionEntity;
import com.flowdesk.chatbotcore.channel.domain.SessionStatus;
import com.flowdesk.chatbotcore.channel.repository.ChannelSessionRepository;
import com.flowdesk.chatbotcore.channel.state.SessionState;
import com.flowdesk.chatbotcore.config.ChannelProperties;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class JpaChannelSessionStore implements ChannelSessionStore {

  private final ChannelSessionRepository repo;
  private final ChannelProperties props;

  @Override
  @Transactional(readOnly = true)
  public Optional<SessionState> find(String tenantId) {
    return repo.findByTenantId(tenantId)
        .map(
            s ->
                new SessionState(
                    s.getStatus(),
                    s.getReconnectAttempts(),
                    s.getLastDisconnectReason(),
                    s.isManualDisconnect(),
                    s.getPairingCode(),
                    s.getPairingExpiresAt()));
  }

  @Override
  @Transactional
  public void save(String tenantId, SessionState state) {
    ChannelSessionEntity s =
        repo.findByTenantId(tenantId)
            .orElseGet(() -> repo.save(new ChannelSessionEntity(tenantId, props.name())));
    s.setStatus(state.status());
    s.setReconnectAttempts(state.attempts());
    s.setLastDisconnectReason(state.lastReason());
    s.setManualDisconnect(state.manual());
    s.setPairingCode(state.pairingCode());
    s.setPairingExpiresAt(state.pairingExpiresAt());
  }

  @Override
  @Transactional
  public void updateCredentialsRef(String tenantId, String credentialsRef) {
    repo.findByTenantId(tenantId).ifPresent(s -> s.setCredentialsRef(credentialsRef));
  }

  @Override
  @Transactional(readOnly = true)
  public List<String> findReconnectCandidates() {
    return repo.findByStatusAndManualDisconnectFalse(SessionStatus.DISCONNECTED).stream()
        .map(ChannelSessionEntity::getTenantId)
        .toList();
  }

  @Override
  @Transactional
  public int resetInterrupted(String reason) {
    return repo.resetStatuses(
        EnumSet.of(SessionStatus.CONNECTED, SessionStatus.CONNECTING, SessionStatus.QR_PENDING),
        SessionStatus.DISCONNECTED,
        reason);
  }
}
