/*
 * どこで: Pairing サービス層
 * 何を: 生存中の接続と ConnectionRecord の対応を管理する
 * なぜ: 接続 ID・状態・希望条件の唯一の所有者を 1 箇所に固定するため
 */
package com.example.pairing.service;

import com.example.common.RandomIds;
import com.example.pairing.api.OutboundMessage;
import com.example.pairing.model.ConnectionRecord;
import com.example.pairing.transport.PeerTransport;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Accessed only from the coordinator thread. */
@Service
public class ConnectionRegistry {

  private static final Logger logger = LoggerFactory.getLogger(ConnectionRegistry.class);

  private final Map<String, ConnectionRecord> recordsByTransport = new HashMap<>();

  /**
   * 役割: 新しい接続を idle 状態で登録し、hello を送る。
   * 動作: 同じ transport が登録済みなら既存のレコードを返し、hello は再送しない。
   */
  public ConnectionRecord register(PeerTransport transport) {
    final ConnectionRecord existing = recordsByTransport.get(transport.transportId());
    if (existing != null) {
      logger.warn("transport already registered connectionId={}", existing.connectionId());
      return existing;
    }
    final ConnectionRecord record = new ConnectionRecord(RandomIds.newId(), transport);
    recordsByTransport.put(transport.transportId(), record);
    transport.send(OutboundMessage.hello(record.connectionId()));
    return record;
  }

  public Optional<ConnectionRecord> lookup(PeerTransport transport) {
    return Optional.ofNullable(recordsByTransport.get(transport.transportId()));
  }

  /** Pool entry and room membership must already be torn down. */
  public Optional<ConnectionRecord> unregister(PeerTransport transport) {
    return Optional.ofNullable(recordsByTransport.remove(transport.transportId()));
  }

  public int size() {
    return recordsByTransport.size();
  }
}
