package com.example.deckhistory.application.domain.history.exception;

import com.example.deckhistory.application.domain.history.command.Command;

/**
 * 指令 undo 失敗，例如目標在執行後被外部修改或刪除
 */
public class CommandUndoException extends CommandException {

	private static final long serialVersionUID = 1L;

	public CommandUndoException(String message, Command<?> command, Throwable cause) {
		super(message, command, cause);
	}
}
