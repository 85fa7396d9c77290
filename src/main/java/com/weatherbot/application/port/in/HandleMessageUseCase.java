package com.weatherbot.application.port.in;

import com.weatherbot.application.dto.ChatReply;

/**
 * Input port for messages arriving through the messaging webhook.
 */
public interface HandleMessageUseCase {

  /**
   * Rate-check the sender, then answer a command or look up the body as a place name.
   * Lookup failures are turned into an error reply; only rate limiting is thrown.
   * 
   * @param senderKey Originating phone number
   * @param body Message text
   * @return Reply text and its classification
   */
  ChatReply handleMessage(String senderKey, String body);
}
