package com.example.deckhistory.application.domain.slide.aggregate.vo;

import java.util.Arrays;

/**
 * 投影片版面類型
 */
public enum SlideLayoutType {
	TITLE_ONLY("title_only"),
	TITLE_CONTENT("title_content"),
	TWO_COLUMN("two_column"),
	THREE_COLUMN("three_column"),
	COMPARISON("comparison"),
	IMAGE_LEFT("image_left"),
	IMAGE_RIGHT("image_right"),
	FULL_IMAGE("full_image"),
	BLANK("blank");

	private final String value;

	SlideLayoutType(String value) {
		this.value = value;
	}

	/**
	 * 對外 (JSON / 資料庫) 使用的字串值
	 */
	public String getValue() {
		return value;
	}

	/**
	 * 接受字串值 (title_content) 或列舉名稱 (TITLE_CONTENT)
	 */
	public static SlideLayoutType fromValue(String raw) {
		return Arrays.stream(values())
				.filter(type -> type.value.equalsIgnoreCase(raw) || type.name().equalsIgnoreCase(raw)).findFirst()
				.orElseThrow(() -> new IllegalArgumentException("未知版面類型: " + raw));
	}
}
