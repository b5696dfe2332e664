package com.example.deckhistory.application.domain.slide.command;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.example.deckhistory.application.domain.history.command.Command;
import com.example.deckhistory.application.domain.history.command.CommandPayload;
import com.example.deckhistory.application.domain.slide.aggregate.Slide;
import com.example.deckhistory.application.domain.slide.aggregate.vo.SlideField;
import com.example.deckhistory.application.domain.slide.exception.SlideNotFoundException;
import com.example.deckhistory.application.port.SlideRepositoryPort;

import lombok.Getter;

/**
 * 更新投影片指令
 *
 * <p>
 * execute 只快照「即將被修改」的欄位再套用更新；undo 把這些欄位還原。 未指定的欄位在兩個方向都不會被碰觸。
 * </p>
 */
@Getter
public class UpdateSlideCommand extends Command<SlideRepositoryPort> {

	private final UUID slideId;

	private final Map<String, Object> updates;

	/**
	 * 執行前被修改欄位的舊值，尚未執行時為 null
	 */
	private Map<String, Object> previousValues;

	public UpdateSlideCommand(UUID slideId, Map<String, ?> updates) {
		this.slideId = Objects.requireNonNull(slideId, "slideId");
		this.updates = SlideField.normalize(updates);
		if (this.updates.isEmpty()) {
			throw new IllegalArgumentException("At least one field must be updated");
		}
	}

	@Override
	public String getCommandType() {
		return SlideCommandType.UPDATE_SLIDE.getTag();
	}

	@Override
	public String describe() {
		return "Update slide " + String.join(", ", updates.keySet());
	}

	@Override
	protected void performExecute(SlideRepositoryPort repository) {
		Slide slide = repository.getById(slideId).orElseThrow(() -> new SlideNotFoundException(slideId));

		Map<String, Object> snapshot = new LinkedHashMap<>();
		updates.forEach((key, value) -> {
			SlideField field = SlideField.fromKey(key);
			snapshot.put(key, field.read(slide));
			field.write(slide, value);
		});

		repository.update(slide);
		this.previousValues = snapshot;
	}

	@Override
	protected void performUndo(SlideRepositoryPort repository) {
		if (previousValues == null) {
			throw new IllegalStateException("No previous values to restore");
		}
		Slide slide = repository.getById(slideId).orElseThrow(() -> new SlideNotFoundException(slideId));
		SlideField.applyAll(slide, previousValues);
		repository.update(slide);
	}

	@Override
	protected void writePayload(Map<String, Object> payload) {
		payload.put("slideId", slideId.toString());
		payload.put("updates", new LinkedHashMap<>(updates));
		payload.put("previousValues", previousValues != null ? new LinkedHashMap<>(previousValues) : null);
	}

	/**
	 * 由序列化結構重建
	 */
	public static UpdateSlideCommand fromPayload(CommandPayload payload) {
		UpdateSlideCommand command = new UpdateSlideCommand(payload.requireUuid("slideId"), payload.getMap("updates"));
		command.previousValues = payload.getMap("previousValues");
		command.restoreMetadata(payload);
		return command;
	}
}
