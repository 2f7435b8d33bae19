package com.lifebutler.assistant.client;

import com.lifebutler.assistant.model.ChatMessage;

import java.util.List;

public interface ChatCompleter {

    String chat(List<ChatMessage> messages, double temperature);
}
