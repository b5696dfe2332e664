package com.example.deckhistory.application.domain.history.exception;

import com.example.deckhistory.application.domain.history.command.Command;

/**
 * 指令 execute 失敗 (包含 redo 時的再次執行)
 */
public class CommandExecutionException extends CommandException {

	private static final long serialVersionUID = 1L;

	public CommandExecutionException(String message, Command<?> command, Throwable cause) {
		super(message, command, cause);
	}
}
