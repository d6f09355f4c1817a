package dev.sitepack.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * {@link ExtractionService} backed by a LangChain4j {@link ChatModel}. The prompt goes in as the
 * system message, the (truncated) page content as the user message, and the reply must be a
 * single JSON object, optionally wrapped in a Markdown code fence.
 */
@Service
public class ChatModelExtractionService implements ExtractionService {

  private static final Logger log = LoggerFactory.getLogger(ChatModelExtractionService.class);

  private final ChatModel chatModel;
  private final ObjectMapper objectMapper;
  private final int maxContentChars;

  public ChatModelExtractionService(
      ChatModel chatModel, ObjectMapper objectMapper, ExtractionProperties properties) {
    this.chatModel = chatModel;
    this.objectMapper = objectMapper;
    this.maxContentChars = properties.maxContentChars();
  }

  @Override
  public ObjectNode extract(String prompt, String content) {
    String bounded = content == null ? "" : content;
    if (bounded.length() > maxContentChars) {
      log.debug("Truncating extraction input from {} to {} chars", bounded.length(), maxContentChars);
      bounded = bounded.substring(0, maxContentChars);
    }

    String reply;
    try {
      ChatResponse response = chatModel.chat(SystemMessage.from(prompt), UserMessage.from(bounded));
      reply = response.aiMessage().text();
    } catch (RuntimeException e) {
      throw new ExtractionException("Extraction call failed: " + e.getMessage(), e);
    }
    if (reply == null || reply.isBlank()) {
      throw new ExtractionException("Extraction service returned an empty reply");
    }
    return parseObject(reply);
  }

  ObjectNode parseObject(String reply) {
    String json = stripCodeFence(reply.trim());
    JsonNode node;
    try {
      node = objectMapper.readTree(json);
    } catch (JsonProcessingException e) {
      throw new ExtractionException("Extraction reply is not valid JSON", e);
    }
    if (node instanceof ObjectNode object) {
      return object;
    }
    throw new ExtractionException("Extraction reply is not a JSON object");
  }

  private static String stripCodeFence(String text) {
    if (!text.startsWith("```")) {
      return text;
    }
    int firstNewline = text.indexOf('\n');
    int closing = text.lastIndexOf("```");
    if (firstNewline < 0 || closing <= firstNewline) {
      return text;
    }
    return text.substring(firstNewline + 1, closing).trim();
  }
}
