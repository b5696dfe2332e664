package com.example.deckhistory.application.domain.slide.command;

import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.example.deckhistory.application.domain.history.command.Command;
import com.example.deckhistory.application.domain.history.command.CommandPayload;
import com.example.deckhistory.application.domain.slide.aggregate.Slide;
import com.example.deckhistory.application.domain.slide.exception.SlideNotFoundException;
import com.example.deckhistory.application.port.SlideRepositoryPort;

import lombok.Getter;

/**
 * 移動投影片指令
 *
 * <p>
 * execute 快照目前的排序、套用新排序並觸發兄弟投影片重新編號；undo 只還原被移動投影片自身的排序，
 * 兄弟投影片的重新編號不會被反轉。
 * </p>
 */
@Getter
public class MoveSlideCommand extends Command<SlideRepositoryPort> {

	private final UUID slideId;

	private final int newOrder;

	/**
	 * 移動前的排序，尚未執行時為 null
	 */
	private Integer previousOrder;

	public MoveSlideCommand(UUID slideId, int newOrder) {
		this.slideId = Objects.requireNonNull(slideId, "slideId");
		if (newOrder < 0) {
			throw new IllegalArgumentException("newOrder must not be negative: " + newOrder);
		}
		this.newOrder = newOrder;
	}

	@Override
	public String getCommandType() {
		return SlideCommandType.MOVE_SLIDE.getTag();
	}

	@Override
	public String describe() {
		return "Move slide to position " + newOrder;
	}

	@Override
	protected void performExecute(SlideRepositoryPort repository) {
		Slide slide = repository.getById(slideId).orElseThrow(() -> new SlideNotFoundException(slideId));
		int snapshot = slide.getOrderIndex();

		slide.moveTo(newOrder);
		repository.update(slide);
		repository.reindexSiblings(slide.getDocumentId(), slideId, newOrder);

		this.previousOrder = snapshot;
	}

	@Override
	protected void performUndo(SlideRepositoryPort repository) {
		if (previousOrder == null) {
			throw new IllegalStateException("No previous order to restore");
		}
		Slide slide = repository.getById(slideId).orElseThrow(() -> new SlideNotFoundException(slideId));
		slide.moveTo(previousOrder);
		repository.update(slide);
	}

	@Override
	protected void writePayload(Map<String, Object> payload) {
		payload.put("slideId", slideId.toString());
		payload.put("newOrder", newOrder);
		payload.put("previousOrder", previousOrder);
	}

	/**
	 * 由序列化結構重建
	 */
	public static MoveSlideCommand fromPayload(CommandPayload payload) {
		MoveSlideCommand command = new MoveSlideCommand(payload.requireUuid("slideId"), payload.requireInt("newOrder"));
		command.previousOrder = payload.getInteger("previousOrder");
		command.restoreMetadata(payload);
		return command;
	}
}
