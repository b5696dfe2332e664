package com.example.deckhistory.application.domain.history.command;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

import com.example.deckhistory.application.domain.history.exception.CommandRegistryException;

import lombok.extern.slf4j.Slf4j;

/**
 * 指令登錄表 (Command Registry)
 *
 * <p>
 * 維護「類型標籤 → 重建函式」的對應，用於跨程序或持久化後把序列化結構還原為指令實例。 同一標籤重複註冊時以最後一次為準。
 * </p>
 *
 * <p>
 * 此物件由服務層持有並以參照傳遞 (Spring Bean)，不作為全域靜態狀態。
 * </p>
 *
 * @param <T> 指令的操作目標
 */
@Slf4j
public class CommandRegistry<T> {

	private final Map<String, Function<CommandPayload, ? extends Command<T>>> constructors = new ConcurrentHashMap<>();

	/**
	 * 註冊類型標籤對應的重建函式，覆蓋既有註冊。
	 */
	public void register(String commandType, Function<CommandPayload, ? extends Command<T>> constructor) {
		if (constructors.put(commandType, constructor) != null) {
			log.debug(">>> [Registry] 類型 {} 已重新註冊，以最新註冊為準", commandType);
		}
	}

	public void unregister(String commandType) {
		constructors.remove(commandType);
	}

	public boolean isRegistered(String commandType) {
		return constructors.containsKey(commandType);
	}

	public Set<String> getRegisteredTypes() {
		return Set.copyOf(constructors.keySet());
	}

	/**
	 * 依 payload 中的 type 欄位重建指令。
	 *
	 * @param payload 指令序列化結構
	 * @return 重建後的指令 (尚未執行)
	 * @throws CommandRegistryException type 缺失或未註冊
	 */
	public Command<T> create(Map<String, ?> payload) {
		CommandPayload commandPayload = new CommandPayload(payload);
		String commandType = commandPayload.getType();
		if (commandType == null || commandType.isBlank()) {
			throw new CommandRegistryException(null, "Command payload must contain a 'type' field");
		}

		Function<CommandPayload, ? extends Command<T>> constructor = constructors.get(commandType);
		if (constructor == null) {
			throw new CommandRegistryException(commandType, "Unknown command type: " + commandType);
		}
		return constructor.apply(commandPayload);
	}
}
