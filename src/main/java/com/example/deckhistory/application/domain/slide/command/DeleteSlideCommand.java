package com.example.deckhistory.application.domain.slide.command;

import java.util.LinkedHashMap;
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
 * 刪除投影片指令
 *
 * <p>
 * execute 先快照整張投影片再刪除；undo 依快照重新建立一筆帶有相同 ID、排序與欄位值的投影片 (重新建立，而非復原原本的儲存紀錄)。
 * </p>
 */
@Getter
public class DeleteSlideCommand extends Command<SlideRepositoryPort> {

	private final UUID slideId;

	/**
	 * 刪除前的完整狀態，尚未執行時為 null
	 */
	private Map<String, Object> deletedSnapshot;

	public DeleteSlideCommand(UUID slideId) {
		this.slideId = Objects.requireNonNull(slideId, "slideId");
	}

	@Override
	public String getCommandType() {
		return SlideCommandType.DELETE_SLIDE.getTag();
	}

	@Override
	public String describe() {
		Object title = deletedSnapshot != null ? deletedSnapshot.get("title") : null;
		return title != null ? "Delete slide \"" + title + "\"" : "Delete slide";
	}

	@Override
	protected void performExecute(SlideRepositoryPort repository) {
		Slide slide = repository.getById(slideId).orElseThrow(() -> new SlideNotFoundException(slideId));
		Map<String, Object> snapshot = slide.toSnapshot();

		if (!repository.delete(slideId)) {
			throw new SlideNotFoundException(slideId);
		}
		this.deletedSnapshot = snapshot;
	}

	@Override
	protected void performUndo(SlideRepositoryPort repository) {
		if (deletedSnapshot == null) {
			throw new IllegalStateException("No deleted slide to restore");
		}
		repository.create(Slide.fromSnapshot(deletedSnapshot));
	}

	@Override
	protected void writePayload(Map<String, Object> payload) {
		payload.put("slideId", slideId.toString());
		payload.put("deletedSnapshot", deletedSnapshot != null ? new LinkedHashMap<>(deletedSnapshot) : null);
	}

	/**
	 * 由序列化結構重建
	 */
	public static DeleteSlideCommand fromPayload(CommandPayload payload) {
		DeleteSlideCommand command = new DeleteSlideCommand(payload.requireUuid("slideId"));
		command.deletedSnapshot = payload.getMap("deletedSnapshot");
		command.restoreMetadata(payload);
		return command;
	}
}
