package com.example.deckhistory.application.domain.history.exception;

import com.example.deckhistory.application.domain.history.command.Command;

import lombok.Getter;

/**
 * 指令相關例外的基底類別
 *
 * <p>
 * 攜帶出錯的指令實例 (可能為 null，例如重建階段尚未產生指令時)，供呼叫端診斷。
 * </p>
 */
@Getter
public class CommandException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final transient Command<?> command;

	public CommandException(String message, Command<?> command) {
		super(message);
		this.command = command;
	}

	public CommandException(String message, Command<?> command, Throwable cause) {
		super(message, cause);
		this.command = command;
	}
}
