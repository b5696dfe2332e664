package com.example.deckhistory.application.domain.history.command;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * 指令序列化結構的唯讀包裝
 *
 * <p>
 * JSON 反序列化後的值型別並不固定 (數字可能是 Integer 或 Long，UUID 與時間皆為字串)，此類別集中處理這些轉換，
 * 讓各指令的重建工廠只需要關心欄位名稱。
 * </p>
 */
public final class CommandPayload {

	/**
	 * 類型判別欄位名稱
	 */
	public static final String TYPE = "type";

	private final Map<String, Object> values;

	public CommandPayload(Map<String, ?> values) {
		this.values = values == null ? new LinkedHashMap<>() : new LinkedHashMap<>(values);
	}

	public String getType() {
		return getString(TYPE);
	}

	public String getString(String key) {
		Object value = values.get(key);
		return value != null ? value.toString() : null;
	}

	public UUID getUuid(String key) {
		Object value = values.get(key);
		if (value == null) {
			return null;
		}
		if (value instanceof UUID) {
			return (UUID) value;
		}
		try {
			return UUID.fromString(value.toString());
		} catch (IllegalArgumentException e) {
			throw new IllegalArgumentException("Payload field '" + key + "' is not a UUID: " + value, e);
		}
	}

	public UUID requireUuid(String key) {
		UUID value = getUuid(key);
		if (value == null) {
			throw new IllegalArgumentException("Payload field '" + key + "' is required");
		}
		return value;
	}

	public Integer getInteger(String key) {
		Object value = values.get(key);
		if (value == null) {
			return null;
		}
		if (value instanceof Number) {
			return ((Number) value).intValue();
		}
		try {
			return Integer.valueOf(value.toString());
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Payload field '" + key + "' is not an integer: " + value, e);
		}
	}

	public int requireInt(String key) {
		Integer value = getInteger(key);
		if (value == null) {
			throw new IllegalArgumentException("Payload field '" + key + "' is required");
		}
		return value;
	}

	public LocalDateTime getDateTime(String key) {
		Object value = values.get(key);
		if (value == null) {
			return null;
		}
		if (value instanceof LocalDateTime) {
			return (LocalDateTime) value;
		}
		return LocalDateTime.parse(value.toString());
	}

	/**
	 * 取得巢狀物件欄位，鍵一律轉為字串。 欄位不存在時回傳 null。
	 */
	public Map<String, Object> getMap(String key) {
		Object value = values.get(key);
		if (value == null) {
			return null;
		}
		if (!(value instanceof Map)) {
			throw new IllegalArgumentException("Payload field '" + key + "' is not an object: " + value);
		}
		Map<String, Object> copy = new LinkedHashMap<>();
		((Map<?, ?>) value).forEach((k, v) -> copy.put(String.valueOf(k), v));
		return copy;
	}

	public Map<String, Object> asMap() {
		return Collections.unmodifiableMap(values);
	}
}
