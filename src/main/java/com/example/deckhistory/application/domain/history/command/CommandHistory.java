package com.example.deckhistory.application.domain.history.command;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.example.deckhistory.application.domain.history.exception.CommandExecutionException;
import com.example.deckhistory.application.domain.history.exception.CommandRegistryException;
import com.example.deckhistory.application.domain.history.exception.CommandUndoException;
import com.example.deckhistory.application.domain.history.snapshot.CommandHistorySnapshot;

import lombok.extern.slf4j.Slf4j;

/**
 * 指令歷史管理器 (Command History)
 *
 * <p>
 * 單一文件範圍內、有容量上限的線性 undo/redo 堆疊。游標 {@code currentIndex} 介於 {@code [-1, size-1]}：
 * <ul>
 * <li>{@code 0..currentIndex}：已套用的指令，可 undo</li>
 * <li>{@code currentIndex+1..size-1}：已撤銷的指令 (redo 分支)，可 redo</li>
 * </ul>
 * </p>
 *
 * <h2>狀態轉移規則：</h2>
 * <ul>
 * <li><b>execute</b>：先執行指令，成功後才丟棄 redo 分支並附加；超過容量時淘汰最舊的一筆。</li>
 * <li><b>undo / redo</b>：無可用步驟時回傳 {@link Optional#empty()}，不是錯誤；步驟失敗時游標保持不動。</li>
 * <li><b>undoMany / redoMany</b>：遇到第一個失敗即停止並拋出，已完成的步驟不回滾。</li>
 * </ul>
 *
 * <p>
 * 本類別不做任何同步，呼叫端需保證同一份歷史同時間只有一個操作 (見 DocumentSerializationAspect)。 歷史簿記本身不做 I/O，
 * I/O 僅發生在指令的 execute / undo。
 * </p>
 *
 * @param <T> 指令的操作目標
 */
@Slf4j
public class CommandHistory<T> {

	public static final int DEFAULT_MAX_HISTORY = 50;

	private final int maxHistory;

	private final List<Command<T>> commands = new ArrayList<>();

	private int currentIndex = -1;

	public CommandHistory() {
		this(DEFAULT_MAX_HISTORY);
	}

	/**
	 * @param maxHistory 容量上限，小於 1 時以 1 計
	 */
	public CommandHistory(int maxHistory) {
		this.maxHistory = Math.max(1, maxHistory);
	}

	public int getMaxHistory() {
		return maxHistory;
	}

	public int getCurrentIndex() {
		return currentIndex;
	}

	public int getHistorySize() {
		return commands.size();
	}

	public boolean canUndo() {
		return currentIndex >= 0;
	}

	public boolean canRedo() {
		return currentIndex < commands.size() - 1;
	}

	public int getUndoCount() {
		return currentIndex + 1;
	}

	public int getRedoCount() {
		return commands.size() - currentIndex - 1;
	}

	public Optional<Command<T>> getCommandAt(int index) {
		if (index >= 0 && index < commands.size()) {
			return Optional.of(commands.get(index));
		}
		return Optional.empty();
	}

	public Optional<Command<T>> getCurrentCommand() {
		return getCommandAt(currentIndex);
	}

	/**
	 * 依序回傳目前保存的所有指令 (唯讀副本)
	 */
	public List<Command<T>> getCommands() {
		return List.copyOf(commands);
	}

	/**
	 * 執行新指令並記錄到歷史。
	 *
	 * @param command 要執行的指令
	 * @param target  操作目標
	 * @throws CommandExecutionException 指令執行失敗，此時歷史不變
	 */
	public void execute(Command<T> command, T target) {
		try {
			command.execute(target);
		} catch (RuntimeException e) {
			log.warn(">>> [History] 指令執行失敗，歷史保持不變: {} ({})", command, e.getMessage());
			throw new CommandExecutionException("Command execution failed: " + e.getMessage(), command, e);
		}

		// 丟棄 redo 分支
		if (canRedo()) {
			commands.subList(currentIndex + 1, commands.size()).clear();
		}

		commands.add(command);
		if (commands.size() > maxHistory) {
			Command<T> evicted = commands.remove(0);
			log.debug(">>> [History] 超過容量 {}，淘汰最舊指令 {}", maxHistory, evicted);
		}
		currentIndex = commands.size() - 1;
	}

	/**
	 * 撤銷游標所在的指令。
	 *
	 * @return 被撤銷的指令；沒有可撤銷的指令時回傳 empty
	 * @throws CommandUndoException 撤銷失敗，此時游標不變
	 */
	public Optional<Command<T>> undo(T target) {
		if (!canUndo()) {
			return Optional.empty();
		}

		Command<T> command = commands.get(currentIndex);
		try {
			command.undo(target);
		} catch (RuntimeException e) {
			log.warn(">>> [History] 撤銷失敗，游標保持於 {}: {} ({})", currentIndex, command, e.getMessage());
			throw new CommandUndoException("Command undo failed: " + e.getMessage(), command, e);
		}

		currentIndex--;
		return Optional.of(command);
	}

	/**
	 * 重做游標之後的第一個指令，重做即再次呼叫 execute。
	 *
	 * @return 被重做的指令；沒有可重做的指令時回傳 empty
	 * @throws CommandExecutionException 重做失敗，此時游標不變
	 */
	public Optional<Command<T>> redo(T target) {
		if (!canRedo()) {
			return Optional.empty();
		}

		int nextIndex = currentIndex + 1;
		Command<T> command = commands.get(nextIndex);
		try {
			command.execute(target);
		} catch (RuntimeException e) {
			log.warn(">>> [History] 重做失敗，游標保持於 {}: {} ({})", currentIndex, command, e.getMessage());
			throw new CommandExecutionException("Command redo failed: " + e.getMessage(), command, e);
		}

		currentIndex = nextIndex;
		return Optional.of(command);
	}

	/**
	 * 連續撤銷 {@code min(count, undoCount)} 步。非原子操作：中途失敗時已完成的步驟不回滾。
	 *
	 * @return 依撤銷順序排列的指令
	 */
	public List<Command<T>> undoMany(int count, T target) {
		int steps = Math.min(Math.max(count, 0), getUndoCount());
		List<Command<T>> undone = new ArrayList<>(steps);
		for (int i = 0; i < steps; i++) {
			undo(target).ifPresent(undone::add);
		}
		return undone;
	}

	/**
	 * 連續重做 {@code min(count, redoCount)} 步。非原子操作：中途失敗時已完成的步驟不回滾。
	 *
	 * @return 依重做順序排列的指令
	 */
	public List<Command<T>> redoMany(int count, T target) {
		int steps = Math.min(Math.max(count, 0), getRedoCount());
		List<Command<T>> redone = new ArrayList<>(steps);
		for (int i = 0; i < steps; i++) {
			redo(target).ifPresent(redone::add);
		}
		return redone;
	}

	/**
	 * 清空歷史簿記。不會對任何指令呼叫 undo，文件狀態維持原樣。
	 */
	public void clear() {
		commands.clear();
		currentIndex = -1;
	}

	public List<HistoryEntry> getHistorySummary() {
		List<HistoryEntry> summary = new ArrayList<>(commands.size());
		for (int i = 0; i < commands.size(); i++) {
			Command<T> command = commands.get(i);
			summary.add(new HistoryEntry(i, command.getCommandType(), command.getId(), command.describe(),
					i == currentIndex, i <= currentIndex, command.getExecutedAt(), command.getUndoneAt()));
		}
		return summary;
	}

	/**
	 * 序列化容量、游標與完整的指令序列。
	 */
	public CommandHistorySnapshot toSnapshot() {
		List<Map<String, Object>> serialized = new ArrayList<>(commands.size());
		for (Command<T> command : commands) {
			serialized.add(command.serialize());
		}
		return new CommandHistorySnapshot(maxHistory, currentIndex, serialized);
	}

	/**
	 * 從快照還原歷史。
	 *
	 * <p>
	 * 無法辨識的類型標籤或無法解碼的內容會被略過 (容忍前後版本不相容的歷史)，游標依略過的已套用指令數後退，
	 * 最後夾在 {@code [-1, size-1]} 範圍內。
	 * </p>
	 *
	 * @param snapshot 歷史快照
	 * @param registry 用於重建指令的登錄表
	 */
	public static <T> CommandHistory<T> materialize(CommandHistorySnapshot snapshot, CommandRegistry<T> registry) {
		CommandHistory<T> history = new CommandHistory<>(snapshot.getMaxHistory());

		List<Map<String, Object>> payloads = snapshot.getCommands() != null ? snapshot.getCommands() : List.of();
		// 游標之前 (含) 被略過的指令數，游標需要等量後退
		int skippedApplied = 0;
		for (int i = 0; i < payloads.size(); i++) {
			Map<String, Object> payload = payloads.get(i);
			try {
				history.commands.add(registry.create(payload));
				continue;
			} catch (CommandRegistryException e) {
				log.warn(">>> [History] 略過無法辨識的指令 (type={}): {}", e.getCommandType(), e.getMessage());
			} catch (RuntimeException e) {
				log.warn(">>> [History] 略過無法解碼的指令 (index={}, type={}): {}", i,
						payload != null ? payload.get("type") : null, e.getMessage());
			}
			if (i <= snapshot.getCurrentIndex()) {
				skippedApplied++;
			}
		}

		// 資料異常時只保留最新的 maxHistory 筆，游標隨之平移
		int trimmed = 0;
		while (history.commands.size() > history.maxHistory) {
			history.commands.remove(0);
			trimmed++;
		}

		int restoredIndex = snapshot.getCurrentIndex() - skippedApplied - trimmed;
		history.currentIndex = Math.max(-1, Math.min(restoredIndex, history.commands.size() - 1));
		return history;
	}
}
