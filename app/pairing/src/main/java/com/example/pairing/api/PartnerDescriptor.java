/*
 * どこで: Pairing API レスポンス DTO
 * 何を: matched 通知に含める相手の表示情報を定義する
 * なぜ: 実 ID を渡さずに汎用ラベルだけを提示するため
 */
package com.example.pairing.api;

public record PartnerDescriptor(String name, String badge) {}
