package com.example.deckhistory.infra.codec;

import com.example.deckhistory.application.domain.history.snapshot.CommandHistorySnapshot;

import tools.jackson.databind.ObjectMapper;

/**
 * 指令歷史快照 JSON 編解碼器
 *
 * <p>
 * 負責 {@link CommandHistorySnapshot} 與 JSON 字串之間的轉換，與儲存方式 (JDBC、訊息佇列) 無關。
 * 序列化/反序列化失敗均視為系統錯誤。
 * </p>
 */
public class CommandHistoryJsonCodec {

	private final ObjectMapper objectMapper;

	public CommandHistoryJsonCodec(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	/**
	 * 將歷史快照序列化為 JSON 字串
	 *
	 * @param snapshot 歷史快照
	 * @return JSON 字串
	 */
	public String serialize(CommandHistorySnapshot snapshot) {
		try {
			return objectMapper.writeValueAsString(snapshot);
		} catch (Exception e) {
			throw new IllegalStateException("CommandHistorySnapshot JSON 序列化失敗", e);
		}
	}

	/**
	 * 將 JSON 字串反序列化回歷史快照
	 *
	 * @param json JSON 字串
	 * @return 歷史快照
	 */
	public CommandHistorySnapshot deserialize(String json) {
		try {
			return objectMapper.readValue(json, CommandHistorySnapshot.class);
		} catch (Exception e) {
			throw new IllegalStateException("CommandHistorySnapshot JSON 反序列化失敗", e);
		}
	}
}
