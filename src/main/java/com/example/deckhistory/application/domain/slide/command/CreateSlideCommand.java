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
 * 新增投影片指令
 *
 * <p>
 * execute 透過儲存庫新增投影片並記下指派的 ID 與實際排序；undo 刪除該 ID。 redo 時沿用記下的 ID 與排序重新建立，
 * 歷史中後續指向這張投影片的指令因此仍然有效。
 * </p>
 */
@Getter
public class CreateSlideCommand extends Command<SlideRepositoryPort> {

	private final UUID documentId;

	/**
	 * 建立時的初始欄位值
	 */
	private final Map<String, Object> initialFields;

	/**
	 * 指定的排序位置，null 代表附加到文件末端
	 */
	private final Integer orderIndex;

	private UUID createdSlideId;

	private Integer resolvedOrderIndex;

	public CreateSlideCommand(UUID documentId, Map<String, ?> initialFields, Integer orderIndex) {
		this.documentId = Objects.requireNonNull(documentId, "documentId");
		this.initialFields = SlideField.normalize(initialFields);
		if (orderIndex != null && orderIndex < 0) {
			throw new IllegalArgumentException("orderIndex must not be negative: " + orderIndex);
		}
		this.orderIndex = orderIndex;
	}

	@Override
	public String getCommandType() {
		return SlideCommandType.CREATE_SLIDE.getTag();
	}

	@Override
	public String describe() {
		Object title = initialFields.get(SlideField.TITLE.getKey());
		return title != null ? "Create slide \"" + title + "\"" : "Create slide";
	}

	@Override
	protected void performExecute(SlideRepositoryPort repository) {
		int position = resolvePosition(repository);

		Slide slide = Slide.builder().id(createdSlideId).documentId(documentId).orderIndex(position).build();
		SlideField.applyAll(slide, initialFields);

		Slide created = repository.create(slide);
		this.createdSlideId = created.getId();
		this.resolvedOrderIndex = created.getOrderIndex();
	}

	@Override
	protected void performUndo(SlideRepositoryPort repository) {
		if (createdSlideId == null) {
			throw new IllegalStateException("No created slide to remove");
		}
		if (!repository.delete(createdSlideId)) {
			throw new SlideNotFoundException(createdSlideId);
		}
	}

	@Override
	protected void writePayload(Map<String, Object> payload) {
		payload.put("documentId", documentId.toString());
		payload.put("initialFields", new LinkedHashMap<>(initialFields));
		payload.put("orderIndex", orderIndex);
		payload.put("createdSlideId", createdSlideId != null ? createdSlideId.toString() : null);
		payload.put("resolvedOrderIndex", resolvedOrderIndex);
	}

	/**
	 * 由序列化結構重建
	 */
	public static CreateSlideCommand fromPayload(CommandPayload payload) {
		CreateSlideCommand command = new CreateSlideCommand(payload.requireUuid("documentId"),
				payload.getMap("initialFields"), payload.getInteger("orderIndex"));
		command.createdSlideId = payload.getUuid("createdSlideId");
		command.resolvedOrderIndex = payload.getInteger("resolvedOrderIndex");
		command.restoreMetadata(payload);
		return command;
	}

	private int resolvePosition(SlideRepositoryPort repository) {
		if (resolvedOrderIndex != null) {
			return resolvedOrderIndex;
		}
		if (orderIndex != null) {
			return orderIndex;
		}
		return repository.findByDocument(documentId).size();
	}
}
