package com.example.deckhistory.iface.dto.req;

import java.util.Map;

import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

/**
 * 更新投影片請求資源，只有出現在 fields 中的欄位會被修改
 */
@Data
public class UpdateSlideResource {

	@NotEmpty(message = "至少需要更新一個欄位")
	private Map<String, Object> fields;
}
