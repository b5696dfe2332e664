package com.example.deckhistory.application.domain.slide.command;

import java.util.function.Function;

import com.example.deckhistory.application.domain.history.command.Command;
import com.example.deckhistory.application.domain.history.command.CommandPayload;
import com.example.deckhistory.application.domain.history.command.CommandRegistry;
import com.example.deckhistory.application.port.SlideRepositoryPort;

/**
 * 投影片指令類型 (封閉集合)
 *
 * <p>
 * 標籤字串即序列化時的 type 欄位，變更會使既有的持久化歷史無法辨識。
 * </p>
 */
public enum SlideCommandType {
	CREATE_SLIDE("CreateSlideCommand", CreateSlideCommand::fromPayload),
	UPDATE_SLIDE("UpdateSlideCommand", UpdateSlideCommand::fromPayload),
	DELETE_SLIDE("DeleteSlideCommand", DeleteSlideCommand::fromPayload),
	MOVE_SLIDE("MoveSlideCommand", MoveSlideCommand::fromPayload);

	private final String tag;
	private final Function<CommandPayload, ? extends Command<SlideRepositoryPort>> factory;

	SlideCommandType(String tag, Function<CommandPayload, ? extends Command<SlideRepositoryPort>> factory) {
		this.tag = tag;
		this.factory = factory;
	}

	public String getTag() {
		return tag;
	}

	/**
	 * 將所有投影片指令註冊到登錄表
	 */
	public static void registerAll(CommandRegistry<SlideRepositoryPort> registry) {
		for (SlideCommandType type : values()) {
			registry.register(type.tag, type.factory);
		}
	}
}
