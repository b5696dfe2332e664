package com.example.deckhistory.application.port;

import java.util.UUID;

import com.example.deckhistory.application.domain.history.command.CommandHistory;

/**
 * 文件歷史倉儲埠
 *
 * <p>
 * 每份文件對應一個 {@link CommandHistory}，第一次存取時建立 (或由持久化快照還原)，之後重複使用同一個實例。
 * </p>
 */
public interface DocumentHistoryRepositoryPort {

	/**
	 * 取得文件的指令歷史，不存在時建立
	 *
	 * @param documentId 文件 ID
	 */
	CommandHistory<SlideRepositoryPort> load(UUID documentId);

	/**
	 * 從記憶體移除文件的歷史，下一次 load 會重新由快照還原
	 *
	 * @param documentId 文件 ID
	 */
	void evict(UUID documentId);
}
