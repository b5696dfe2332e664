package com.example.deckhistory.application.domain.history.command;

import java.util.List;
import java.util.Map;

/**
 * 測試用指令：execute 把名稱加到清單末端，undo 移除最後一筆。
 */
class RecordingCommand extends Command<List<String>> {

	static final String TYPE = "RecordingCommand";

	private final String name;

	private boolean failOnExecute;

	private boolean failOnUndo;

	private boolean failOnRedo;

	int executeCount;

	int undoCount;

	RecordingCommand(String name) {
		this.name = name;
	}

	RecordingCommand failingOnExecute() {
		this.failOnExecute = true;
		return this;
	}

	/**
	 * 第一次 execute 成功，之後的 execute (即 redo) 失敗
	 */
	RecordingCommand failingOnRedo() {
		this.failOnRedo = true;
		return this;
	}

	RecordingCommand failingOnUndo() {
		this.failOnUndo = true;
		return this;
	}

	String getName() {
		return name;
	}

	@Override
	public String getCommandType() {
		return TYPE;
	}

	@Override
	public String describe() {
		return "Record " + name;
	}

	@Override
	protected void performExecute(List<String> target) {
		if (failOnExecute || (failOnRedo && executeCount > 0)) {
			throw new IllegalStateException("execute failed: " + name);
		}
		executeCount++;
		target.add(name);
	}

	@Override
	protected void performUndo(List<String> target) {
		if (failOnUndo) {
			throw new IllegalStateException("undo failed: " + name);
		}
		undoCount++;
		target.remove(target.size() - 1);
	}

	@Override
	protected void writePayload(Map<String, Object> payload) {
		payload.put("name", name);
	}

	static RecordingCommand fromPayload(CommandPayload payload) {
		RecordingCommand command = new RecordingCommand(payload.getString("name"));
		command.restoreMetadata(payload);
		return command;
	}
}
