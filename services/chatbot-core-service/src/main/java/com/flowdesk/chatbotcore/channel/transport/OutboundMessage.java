package com.flowdesk.chatbotcore.channel.transport;

import java.util.List;

/** Wire-level message kinds a transport can be asked to send. */
public interface OutboundMessage {

  record Text(String text) implements OutboundMessage {}

  record Buttons(String text, List<Button> buttons) implements OutboundMessage {}

  record Button(String id, String title) {}

  record Media(String url, String mimeType, String caption) implements OutboundMessage {}
}
