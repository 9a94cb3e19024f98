package com.example.pairing.api.request;

import com.example.pairing.api.MalformedInboundMessageException;
import com.example.pairing.model.Gender;
import com.example.pairing.model.Preferences;
import com.example.pairing.model.SkillLevel;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.springframework.stereotype.Component;

/**
 * Turns a raw text frame into an {@link InboundMessage}.
 *
 * <p>Missing or unrecognised preference values fall back to {@code any}. A {@code chat} frame
 * whose text is missing, null, {@code false} or zero carries the empty string; other non-string
 * scalars are converted with their JSON text.
 */
@Component
public class InboundMessageDecoder {

  public static final String REASON_UNPARSEABLE = "unparseable";
  public static final String REASON_NOT_OBJECT = "not_object";
  public static final String REASON_MISSING_TYPE = "missing_type";
  public static final String REASON_UNKNOWN_TYPE = "unknown_type";

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final ObjectMapper objectMapper;

  public InboundMessageDecoder(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public InboundMessage decode(String payload) {
    final JsonNode root = readTree(payload);
    if (root == null || !root.isObject()) {
      throw new MalformedInboundMessageException(REASON_NOT_OBJECT, "payload is not a JSON object");
    }
    final JsonNode typeNode = root.get("type");
    if (typeNode == null || !typeNode.isTextual()) {
      throw new MalformedInboundMessageException(REASON_MISSING_TYPE, "type is required");
    }
    final InboundType type =
        InboundType.fromValue(typeNode.textValue())
            .orElseThrow(
                () ->
                    new MalformedInboundMessageException(
                        REASON_UNKNOWN_TYPE, "unsupported type: " + typeNode.textValue()));
    switch (type) {
      case FIND:
        return InboundMessage.find(readPreferences(root.get("prefs")));
      case CHAT:
        return InboundMessage.chat(readText(root.get("text")));
      default:
        return InboundMessage.of(type);
    }
  }

  private JsonNode readTree(String payload) {
    if (payload == null) {
      throw new MalformedInboundMessageException(REASON_UNPARSEABLE, "payload is null");
    }
    try {
      return objectMapper.readTree(payload);
    } catch (JsonProcessingException ex) {
      throw new MalformedInboundMessageException(REASON_UNPARSEABLE, "payload is not JSON", ex);
    }
  }

  private Preferences readPreferences(JsonNode prefs) {
    if (prefs == null || !prefs.isObject()) {
      return Preferences.ANY;
    }
    return new Preferences(
        Gender.fromValueOrAny(textOrNull(prefs.get("gender"))),
        SkillLevel.fromValueOrAny(textOrNull(prefs.get("level"))));
  }

  private String readText(JsonNode text) {
    if (text == null || text.isNull() || isFalsy(text)) {
      return "";
    }
    if (text.isTextual()) {
      return text.textValue();
    }
    return text.isValueNode() ? text.asText() : text.toString();
  }

  private boolean isFalsy(JsonNode text) {
    if (text.isBoolean()) {
      return !text.booleanValue();
    }
    return text.isNumber() && text.doubleValue() == 0.0;
  }

  private String textOrNull(JsonNode node) {
    return node != null && node.isTextual() ? node.textValue() : null;
  }
}
