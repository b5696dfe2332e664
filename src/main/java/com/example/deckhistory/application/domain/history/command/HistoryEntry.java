package com.example.deckhistory.application.domain.history.command;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * 歷史摘要中的單筆紀錄，供 UI 顯示
 *
 * @param index      在歷史中的位置
 * @param type       指令類型標籤
 * @param id         指令識別碼
 * @param description 簡短描述
 * @param current    是否為游標所在位置
 * @param undoable   是否位於已套用區段 (index ≤ 游標)
 * @param executedAt 最近一次執行時間
 * @param undoneAt   最近一次撤銷時間
 */
public record HistoryEntry(int index, String type, UUID id, String description, boolean current, boolean undoable,
		LocalDateTime executedAt, LocalDateTime undoneAt) {
}
