package com.example.deckhistory.application.domain.history.command;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import lombok.Getter;

/**
 * 可逆指令 (Reversible Command) 抽象基類
 *
 * <p>
 * 每個指令封裝一次明確的編輯意圖，以及反轉該意圖所需的最小狀態。 指令本身不持有任何儲存庫參照，操作目標 {@code T} 由呼叫端在
 * {@link #execute(Object)} / {@link #undo(Object)} 時傳入。
 * </p>
 *
 * <p>
 * 生命週期：建立 (未執行) → execute 成功後標記 executedAt → undo 成功後標記 undoneAt → redo 時再次標記
 * executedAt。
 * </p>
 *
 * <p>
 * {@link #undo(Object)} 僅在同一實例最近一次 {@link #execute(Object)} 成功後才有意義，此為前置條件，不做執行期檢查。
 * </p>
 *
 * @param <T> 指令的操作目標 (例如投影片儲存庫)
 */
@Getter
public abstract class Command<T> {

	private UUID id = UUID.randomUUID();

	private LocalDateTime executedAt;

	private LocalDateTime undoneAt;

	/**
	 * 指令類型標籤，作為序列化時的判別欄位 (type)
	 */
	public abstract String getCommandType();

	/**
	 * 執行指令，成功後記錄執行時間。 失敗時不更新任何時間戳記。
	 *
	 * @param target 操作目標
	 */
	public final void execute(T target) {
		performExecute(target);
		this.executedAt = LocalDateTime.now();
	}

	/**
	 * 撤銷指令，精確反轉前一次 execute 的效果，成功後記錄撤銷時間。
	 *
	 * @param target 操作目標
	 */
	public final void undo(T target) {
		performUndo(target);
		this.undoneAt = LocalDateTime.now();
	}

	/**
	 * 給使用者看的簡短描述
	 */
	public String describe() {
		return getCommandType();
	}

	/**
	 * 將指令序列化為可傳輸的結構，必定包含 type 與 id。
	 */
	public final Map<String, Object> serialize() {
		Map<String, Object> payload = new LinkedHashMap<>();
		payload.put(CommandPayload.TYPE, getCommandType());
		payload.put("id", id.toString());
		payload.put("executedAt", executedAt != null ? executedAt.toString() : null);
		payload.put("undoneAt", undoneAt != null ? undoneAt.toString() : null);
		writePayload(payload);
		return payload;
	}

	protected abstract void performExecute(T target);

	protected abstract void performUndo(T target);

	/**
	 * 寫入指令專屬欄位 (意圖與反轉資料)
	 */
	protected abstract void writePayload(Map<String, Object> payload);

	/**
	 * 從序列化結構還原識別碼與時間戳記，供各指令的重建工廠使用。
	 */
	protected void restoreMetadata(CommandPayload payload) {
		UUID restoredId = payload.getUuid("id");
		if (restoredId != null) {
			this.id = restoredId;
		}
		this.executedAt = payload.getDateTime("executedAt");
		this.undoneAt = payload.getDateTime("undoneAt");
	}

	@Override
	public String toString() {
		return getCommandType() + "[" + id + "]";
	}
}
