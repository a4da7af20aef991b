package com.flowdesk.chatbotcore.channel.store;

import com.flowdesk.chatbotcore.channel.domain.ChannelCredentialEntity;
import com.flowdesk.chatbotcore.channel.repository.ChannelCredentialRepository;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
@Slf4j
public class JpaCredentialStore implements CredentialStore {

  private final ChannelCredentialRepository repo;

  @Override
  @Transactional(readOnly = true)
  public Optional<String> load(String tenantId) {
    return repo.findByTenantId(tenantId).map(ChannelCredentialEntity::getPayload);
  }

  @Override
  @Transactional
  public String save(String tenantId, String credentials) {
    ChannelCredentialEntity entity =
        repo.findByTenantId(tenantId)
            .map(
                existing -> {
                  existing.replacePayload(credentials);
                  return existing;
                })
            .orElseGet(() -> repo.save(new ChannelCredentialEntity(tenantId, credentials)));
    return "cred-" + entity.getId();
  }

  @Override
  @Transactional
  public void delete(String tenantId) {
    int removed = repo.deleteByTenant(tenantId);
    if (removed > 0) {
      log.info("Deleted stored channel credentials for tenant {}", tenantId);
    }
  }
}
