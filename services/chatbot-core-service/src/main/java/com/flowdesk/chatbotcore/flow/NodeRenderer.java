package com.flowdesk.chatbotcore.flow;

import com.flowdesk.chatbotcore.flow.response.BotResponse;
import com.flowdesk.chatbotcore.flow.response.NoticeBlock;
import com.flowdesk.chatbotcore.flow.response.OptionItem;
import com.flowdesk.chatbotcore.flow.response.OptionsBlock;
import com.flowdesk.chatbotcore.flow.response.TextBlock;
import com.flowdesk.chatbotcore.graph.model.FlowGraph;
import com.flowdesk.chatbotcore.graph.model.GraphNode;
import com.flowdesk.chatbotcore.graph.model.NodeOption;
import java.util.ArrayList;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class NodeRenderer {

  private final String escalationNotice;

  public NodeRenderer(
      @Value("${flow.escalation-notice:Thanks! A member of our team will continue this conversation shortly.}")
          String escalationNotice) {
    this.escalationNotice = escalationNotice;
  }

  public BotResponse render(FlowGraph graph, GraphNode node) {
    return switch (node.kind()) {
      case OPTION -> BotResponse.of(new OptionsBlock(node.text(), items(graph.options(node.id()))));
      case ESCALATION -> BotResponse.of(new NoticeBlock(escalationNotice));
      default -> node.text() == null || node.text().isBlank()
          ? new BotResponse(List.of())
          : BotResponse.of(new TextBlock(node.text()));
    };
  }

  private static List<OptionItem> items(List<NodeOption> options) {
    List<OptionItem> items = new ArrayList<>(options.size());
    for (int i = 0; i < options.size(); i++) {
      NodeOption o = options.get(i);
      items.add(new OptionItem(i + 1, o.text(), SelectionPayload.encode(o.id(), i + 1)));
    }
    return items;
  }
}
