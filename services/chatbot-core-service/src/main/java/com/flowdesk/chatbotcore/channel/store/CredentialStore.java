package com.flowdesk.chatbotcore.channel.store;

import java.util.Optional;

public interface CredentialStore {

  Optional<String> load(String tenantId);

  /** Stores or replaces the tenant credentials and returns their reference. */
  String save(String tenantId, String credentials);

  void delete(String tenantId);
}
