package com.flowdesk.chatbotcore.flow.response;

import java.util.List;

public record OptionsBlock(String prompt, List<OptionItem> items) implements ResponseBlock {}
