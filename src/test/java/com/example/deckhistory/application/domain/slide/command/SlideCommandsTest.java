package com.example.deckhistory.application.domain.slide.command;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.example.deckhistory.application.domain.history.command.Command;
import com.example.deckhistory.application.domain.history.command.CommandHistory;
import com.example.deckhistory.application.domain.history.command.CommandRegistry;
import com.example.deckhistory.application.domain.history.exception.CommandExecutionException;
import com.example.deckhistory.application.domain.slide.aggregate.Slide;
import com.example.deckhistory.application.domain.slide.exception.SlideNotFoundException;
import com.example.deckhistory.application.port.SlideRepositoryPort;
import com.example.deckhistory.support.InMemorySlideRepository;

import lombok.extern.slf4j.Slf4j;

/**
 * <h1>投影片指令測試</h1>
 *
 * <pre>
 * <b>Given</b> 一個記憶體投影片儲存庫與一份文件歷史
 * <b>When</b>  透過歷史執行、撤銷、重做投影片指令
 * <b>Then</b>  儲存庫的狀態逐欄位回到對應的版本
 * </pre>
 */
@Slf4j
class SlideCommandsTest {

	private InMemorySlideRepository repository;

	private CommandHistory<SlideRepositoryPort> history;

	private UUID documentId;

	@BeforeEach
	void setUp() {
		repository = new InMemorySlideRepository();
		history = new CommandHistory<>();
		documentId = UUID.randomUUID();
	}

	@Test
	@DisplayName("新增 → 修改標題 → 撤銷兩次 → 重做兩次，投影片沿用同一個 ID")
	void createUpdateUndoRedoScenario() {
		log.info(">>> [Given] 新增投影片 S1 並修改標題");
		CreateSlideCommand create = new CreateSlideCommand(documentId, Map.of("title", "S1"), null);
		history.execute(create, repository);
		UUID slideId = create.getCreatedSlideId();
		history.execute(new UpdateSlideCommand(slideId, Map.of("title", "A")), repository);
		assertThat(repository.require(slideId).getTitle()).isEqualTo("A");

		log.info(">>> [When] 撤銷兩次");
		history.undo(repository);
		assertThat(repository.require(slideId).getTitle()).isEqualTo("S1");
		history.undo(repository);
		assertThat(repository.getById(slideId)).isEmpty();

		log.info(">>> [Then] 重做兩次後回到最終狀態");
		history.redo(repository);
		assertThat(repository.require(slideId).getTitle()).isEqualTo("S1");
		history.redo(repository);
		assertThat(repository.require(slideId).getTitle()).isEqualTo("A");
		assertThat(repository.count()).isEqualTo(1);
	}

	@Test
	@DisplayName("未指定位置時附加到文件末端，並記下實際位置")
	void createAppendsToEnd() {
		history.execute(new CreateSlideCommand(documentId, Map.of("title", "first"), null), repository);
		CreateSlideCommand second = new CreateSlideCommand(documentId, Map.of("title", "second"), null);

		history.execute(second, repository);

		assertThat(second.getResolvedOrderIndex()).isEqualTo(1);
		assertThat(repository.require(second.getCreatedSlideId()).getOrderIndex()).isEqualTo(1);
	}

	@Test
	@DisplayName("n 個指令撤銷 n 次再重做 n 次，狀態逐欄位相同")
	void fullRoundTripRestoresEveryField() {
		CreateSlideCommand first = new CreateSlideCommand(documentId,
				Map.of("title", "Intro", "layoutType", "title_only"), null);
		history.execute(first, repository);
		CreateSlideCommand second = new CreateSlideCommand(documentId,
				Map.of("title", "Body", "content", Map.of("bullets", List.of("x", "y"))), null);
		history.execute(second, repository);
		history.execute(new UpdateSlideCommand(first.getCreatedSlideId(), Map.of("notes", "speak slowly",
				"backgroundColor", "#000000")), repository);
		history.execute(new MoveSlideCommand(second.getCreatedSlideId(), 0), repository);
		history.execute(new DeleteSlideCommand(first.getCreatedSlideId()), repository);

		List<Map<String, Object>> finalState = stateOf(repository.findByDocument(documentId));
		int executed = history.getHistorySize();

		history.undoMany(executed, repository);
		assertThat(repository.findByDocument(documentId)).isEmpty();

		history.redoMany(executed, repository);
		assertThat(stateOf(repository.findByDocument(documentId))).isEqualTo(finalState);
	}

	@Test
	@DisplayName("更新只快照被修改的欄位，撤銷不影響其他欄位")
	void updateSnapshotsOnlyChangedFields() {
		UUID slideId = createSlide(Map.of("title", "T", "subtitle", "S", "notes", "N"));
		UpdateSlideCommand update = new UpdateSlideCommand(slideId, Map.of("subtitle", "S2"));
		history.execute(update, repository);

		assertThat(update.getPreviousValues()).containsOnlyKeys("subtitle").containsEntry("subtitle", "S");

		// 歷史之外的修改不應被撤銷覆蓋
		Slide outside = repository.require(slideId);
		outside.setNotes("edited elsewhere");
		repository.update(outside);

		history.undo(repository);

		Slide slide = repository.require(slideId);
		assertThat(slide.getSubtitle()).isEqualTo("S");
		assertThat(slide.getTitle()).isEqualTo("T");
		assertThat(slide.getNotes()).isEqualTo("edited elsewhere");
	}

	@Test
	@DisplayName("刪除後撤銷：以相同 ID、位置與欄位值重新建立")
	void deleteUndoRecreatesSameSlide() {
		UUID slideId = createSlide(Map.of("title", "Keep", "content", Map.of("text", "hello")));
		Map<String, Object> before = repository.require(slideId).toSnapshot();

		history.execute(new DeleteSlideCommand(slideId), repository);
		assertThat(repository.getById(slideId)).isEmpty();

		history.undo(repository);
		assertThat(repository.require(slideId).toSnapshot()).isEqualTo(before);
	}

	@Test
	@DisplayName("移動會重新編排兄弟投影片；撤銷只還原被移動投影片自身的位置")
	void moveUndoRestoresOnlyMovedSlide() {
		UUID a = createSlide(Map.of("title", "A"));
		UUID b = createSlide(Map.of("title", "B"));
		UUID c = createSlide(Map.of("title", "C"));

		MoveSlideCommand move = new MoveSlideCommand(c, 0);
		history.execute(move, repository);

		assertThat(move.getPreviousOrder()).isEqualTo(2);
		assertThat(repository.require(c).getOrderIndex()).isZero();
		assertThat(repository.require(a).getOrderIndex()).isEqualTo(1);
		assertThat(repository.require(b).getOrderIndex()).isEqualTo(2);

		history.undo(repository);

		assertThat(repository.require(c).getOrderIndex()).isEqualTo(2);
		// 兄弟投影片的重新編號不會被反轉
		assertThat(repository.require(a).getOrderIndex()).isEqualTo(1);
		assertThat(repository.require(b).getOrderIndex()).isEqualTo(2);
	}

	@Test
	@DisplayName("操作不存在的投影片時，歷史包裝為 CommandExecutionException 且不記錄")
	void missingSlideIsWrapped() {
		UUID missing = UUID.randomUUID();

		assertThatThrownBy(() -> history.execute(new UpdateSlideCommand(missing, Map.of("title", "x")), repository))
				.isInstanceOf(CommandExecutionException.class).hasCauseInstanceOf(SlideNotFoundException.class);
		assertThat(history.getHistorySize()).isZero();
	}

	@Test
	@DisplayName("不合法的輸入在建立指令時即被拒絕")
	void invalidArgumentsAreRejected() {
		UUID slideId = UUID.randomUUID();

		assertThatThrownBy(() -> new MoveSlideCommand(slideId, -1)).isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> new UpdateSlideCommand(slideId, Map.of())).isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> new UpdateSlideCommand(slideId, Map.of("color", "red")))
				.isInstanceOf(IllegalArgumentException.class).hasMessageContaining("color");
		assertThatThrownBy(() -> new CreateSlideCommand(documentId, Map.of("layoutType", "spiral"), null))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	@DisplayName("每一種投影片指令都能序列化後由登錄表還原並繼續撤銷")
	void everyCommandSurvivesSerialization() {
		CommandRegistry<SlideRepositoryPort> registry = new CommandRegistry<>();
		SlideCommandType.registerAll(registry);

		UUID keep = createSlide(Map.of("title", "Keep"));
		UUID drop = createSlide(Map.of("title", "Drop"));
		history.execute(new UpdateSlideCommand(keep, Map.of("title", "Kept", "layoutType", "two_column")), repository);
		history.execute(new MoveSlideCommand(keep, 1), repository);
		history.execute(new DeleteSlideCommand(drop), repository);

		CommandHistory<SlideRepositoryPort> restored = CommandHistory.materialize(history.toSnapshot(), registry);

		assertThat(restored.getCommands()).extracting(Command::getCommandType).containsExactly("CreateSlideCommand",
				"CreateSlideCommand", "UpdateSlideCommand", "MoveSlideCommand", "DeleteSlideCommand");

		restored.undoMany(restored.getHistorySize(), repository);
		assertThat(repository.count()).isZero();

		restored.redoMany(restored.getHistorySize(), repository);
		Slide kept = repository.require(keep);
		assertThat(kept.getTitle()).isEqualTo("Kept");
		assertThat(kept.getLayoutType().getValue()).isEqualTo("two_column");
		assertThat(repository.getById(drop)).isEmpty();
	}

	private UUID createSlide(Map<String, Object> fields) {
		CreateSlideCommand create = new CreateSlideCommand(documentId, fields, null);
		history.execute(create, repository);
		return create.getCreatedSlideId();
	}

	private static List<Map<String, Object>> stateOf(List<Slide> slides) {
		return slides.stream().map(Slide::toSnapshot).toList();
	}
}
