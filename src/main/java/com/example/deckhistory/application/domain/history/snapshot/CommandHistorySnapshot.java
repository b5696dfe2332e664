package com.example.deckhistory.application.domain.history.snapshot;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.example.deckhistory.application.domain.history.command.CommandHistory;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 指令歷史的可傳輸 / 可持久化表示
 *
 * <pre>
 * { "maxHistory": 50, "currentIndex": 1, "commands": [ { "type": ..., "id": ..., ... } ] }
 * </pre>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CommandHistorySnapshot {

	/**
	 * 歷史容量上限
	 */
	private int maxHistory = CommandHistory.DEFAULT_MAX_HISTORY;

	/**
	 * 游標位置，-1 代表尚無已套用的指令
	 */
	private int currentIndex = -1;

	/**
	 * 依執行順序排列的指令序列化結構
	 */
	private List<Map<String, Object>> commands = new ArrayList<>();
}
