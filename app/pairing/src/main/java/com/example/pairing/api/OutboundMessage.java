package com.example.pairing.api;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Server-to-client frame. {@code type} is the discriminator; fields that do not belong to the
 * type are left null and omitted from the JSON.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OutboundMessage(
    String type, String id, String roomId, PartnerDescriptor partner, String text) {

  public static final String TYPE_HELLO = "hello";
  public static final String TYPE_SEARCHING = "searching";
  public static final String TYPE_CANCELED = "canceled";
  public static final String TYPE_MATCHED = "matched";
  public static final String TYPE_CHAT = "chat";
  public static final String TYPE_PARTNER_LEFT = "partner_left";
  public static final String TYPE_LEFT = "left";

  public static OutboundMessage hello(String connectionId) {
    return new OutboundMessage(TYPE_HELLO, connectionId, null, null, null);
  }

  public static OutboundMessage searching() {
    return new OutboundMessage(TYPE_SEARCHING, null, null, null, null);
  }

  public static OutboundMessage canceled() {
    return new OutboundMessage(TYPE_CANCELED, null, null, null, null);
  }

  public static OutboundMessage matched(String roomId, PartnerDescriptor partner) {
    return new OutboundMessage(TYPE_MATCHED, null, roomId, partner, null);
  }

  public static OutboundMessage chat(String text) {
    return new OutboundMessage(TYPE_CHAT, null, null, null, text);
  }

  public static OutboundMessage partnerLeft() {
    return new OutboundMessage(TYPE_PARTNER_LEFT, null, null, null, null);
  }

  public static OutboundMessage left() {
    return new OutboundMessage(TYPE_LEFT, null, null, null, null);
  }
}
