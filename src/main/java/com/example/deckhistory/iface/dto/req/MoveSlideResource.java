package com.example.deckhistory.iface.dto.req;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class MoveSlideResource {

	@NotNull(message = "必須指定新位置")
	@Min(value = 0, message = "排序位置不可為負數")
	private Integer newOrder;
}
