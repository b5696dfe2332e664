package com.example.deckhistory.application.port;

import java.util.Optional;
import java.util.UUID;

import com.example.deckhistory.application.domain.history.snapshot.CommandHistorySnapshot;

/**
 * 指令歷史快照儲存埠
 *
 * <p>
 * 每份文件只保留最新一份快照，用於程序重啟後還原 undo/redo 歷史。
 * </p>
 */
public interface CommandHistorySnapshotPort {

	/**
	 * 儲存 (覆蓋) 文件的歷史快照
	 *
	 * @param documentId 文件 ID
	 * @param snapshot   歷史快照
	 */
	void save(UUID documentId, CommandHistorySnapshot snapshot);

	/**
	 * 取得文件的歷史快照
	 *
	 * @param documentId 文件 ID
	 * @return 快照，若從未儲存則回傳 Optional.empty()
	 */
	Optional<CommandHistorySnapshot> findByDocument(UUID documentId);
}
