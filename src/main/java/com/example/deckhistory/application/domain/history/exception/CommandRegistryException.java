package com.example.deckhistory.application.domain.history.exception;

import lombok.Getter;

/**
 * 重建指令時類型標籤缺失或未註冊
 */
@Getter
public class CommandRegistryException extends CommandException {

	private static final long serialVersionUID = 1L;

	/**
	 * 無法辨識的類型標籤，標籤缺失時為 null
	 */
	private final String commandType;

	public CommandRegistryException(String commandType, String message) {
		super(message, null);
		this.commandType = commandType;
	}
}
