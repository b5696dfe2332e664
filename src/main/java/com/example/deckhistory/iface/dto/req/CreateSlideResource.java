package com.example.deckhistory.iface.dto.req;

import java.util.Map;

import jakarta.validation.constraints.Min;
import lombok.Data;

/**
 * 新增投影片請求資源
 */
@Data
public class CreateSlideResource {

	/**
	 * 初始欄位值 (title、subtitle、layoutType、content、notes、backgroundColor、textColor、fontFamily)
	 */
	private Map<String, Object> fields;

	/**
	 * 排序位置，未填則附加到文件末端
	 */
	@Min(value = 0, message = "排序位置不可為負數")
	private Integer orderIndex;
}
