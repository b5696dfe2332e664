package com.example.deckhistory.application.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.awaitility.Awaitility;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import com.example.deckhistory.application.domain.history.snapshot.CommandHistorySnapshot;
import com.example.deckhistory.application.domain.slide.exception.SlideNotFoundException;
import com.example.deckhistory.application.port.CommandHistorySnapshotPort;
import com.example.deckhistory.application.port.DocumentHistoryRepositoryPort;
import com.example.deckhistory.application.port.SlideRepositoryPort;
import com.example.deckhistory.application.shared.dto.BatchStepResultData;
import com.example.deckhistory.application.shared.dto.UndoRedoResultData;
import com.example.deckhistory.application.shared.projection.HistoryStatusProjection;
import com.example.deckhistory.application.shared.projection.SlideStateProjection;

import lombok.extern.slf4j.Slf4j;

/**
 * <h1>投影片編輯服務整合測試</h1>
 *
 * <pre>
 * <b>Feature:</b> 文件層級的 undo/redo
 * <b>Given</b> H2 (MySQL 模式) 與啟動中的快照 Disruptor
 * <b>When</b>  透過服務編輯、撤銷、重做投影片
 * <b>Then</b>  資料庫中的投影片與歷史快照都反映最新狀態
 * </pre>
 */
@Slf4j
@SpringBootTest
@ActiveProfiles("test")
class SlideEditServiceIntegrationTest {

	@Autowired
	private SlideEditService editService;

	@Autowired
	private HistoryQueryService queryService;

	@Autowired
	private SlideRepositoryPort slideRepository;

	@Autowired
	private DocumentHistoryRepositoryPort historyRepository;

	@Autowired
	private CommandHistorySnapshotPort snapshotPort;

	private UUID documentId;

	@BeforeEach
	void setUp() {
		// 每個測試使用獨立文件，避免互相干擾
		documentId = UUID.randomUUID();
	}

	@Test
	@DisplayName("新增 → 修改 → 撤銷兩次 → 重做兩次，資料庫狀態逐步對應")
	void createUpdateUndoRedo() {
		log.info(">>> [Given] 新增投影片並修改標題");
		SlideStateProjection created = editService.createSlide(documentId, Map.of("title", "S1"), null);
		UUID slideId = created.id();
		editService.updateSlide(documentId, slideId, Map.of("title", "A"));

		log.info(">>> [When] 撤銷");
		UndoRedoResultData first = editService.undo(documentId, slideId);
		assertThat(first.success()).isTrue();
		assertThat(first.resultingState().title()).isEqualTo("S1");
		assertThat(first.canRedo()).isTrue();

		UndoRedoResultData second = editService.undo(documentId, slideId);
		assertThat(second.resultingState()).isNull();
		assertThat(slideRepository.getById(slideId)).isEmpty();

		log.info(">>> [Then] 重做後回到最終狀態，投影片沿用原本的 ID");
		editService.redo(documentId, slideId);
		UndoRedoResultData last = editService.redo(documentId, slideId);
		assertThat(last.resultingState().id()).isEqualTo(slideId);
		assertThat(last.resultingState().title()).isEqualTo("A");
		assertThat(last.canRedo()).isFalse();
	}

	@Test
	@DisplayName("沒有可撤銷的指令時回傳 success=false 而不拋出例外")
	void nothingToUndo() {
		UndoRedoResultData result = editService.undo(documentId, null);

		assertThat(result.success()).isFalse();
		assertThat(result.description()).isEqualTo(SlideEditService.NOTHING_TO_UNDO);
		assertThat(editService.redo(documentId, null).description()).isEqualTo(SlideEditService.NOTHING_TO_REDO);
	}

	@Test
	@DisplayName("不屬於該文件的投影片視為不存在")
	void slideFromAnotherDocumentIsNotFound() {
		UUID slideId = editService.createSlide(documentId, Map.of("title", "mine"), null).id();

		assertThatThrownBy(() -> editService.deleteSlide(UUID.randomUUID(), slideId))
				.isInstanceOf(SlideNotFoundException.class);
		assertThat(slideRepository.getById(slideId)).isPresent();
	}

	@Test
	@DisplayName("undo/redo 不回傳其他文件投影片的狀態")
	void undoRedoIgnoresSlideFromAnotherDocument() {
		UUID otherDocument = UUID.randomUUID();
		UUID foreign = editService.createSlide(otherDocument, Map.of("title", "theirs"), null).id();
		editService.createSlide(documentId, Map.of("title", "mine"), null);

		UndoRedoResultData undone = editService.undo(documentId, foreign);
		UndoRedoResultData redone = editService.redo(documentId, foreign);

		assertThat(undone.success()).isTrue();
		assertThat(undone.resultingState()).isNull();
		assertThat(redone.success()).isTrue();
		assertThat(redone.resultingState()).isNull();
		assertThat(slideRepository.getById(foreign).orElseThrow().getTitle()).isEqualTo("theirs");
	}

	@Test
	@DisplayName("移動投影片：兄弟重新編號，撤銷只還原被移動的投影片")
	void moveAndUndo() {
		UUID a = editService.createSlide(documentId, Map.of("title", "A"), null).id();
		UUID b = editService.createSlide(documentId, Map.of("title", "B"), null).id();
		UUID c = editService.createSlide(documentId, Map.of("title", "C"), null).id();

		SlideStateProjection moved = editService.moveSlide(documentId, c, 0);
		assertThat(moved.orderIndex()).isZero();
		assertThat(slideRepository.findByDocument(documentId)).extracting(slide -> slide.getId())
				.containsExactly(c, a, b);

		editService.undo(documentId, c);
		assertThat(slideRepository.getById(c).orElseThrow().getOrderIndex()).isEqualTo(2);
		assertThat(slideRepository.getById(b).orElseThrow().getOrderIndex()).isEqualTo(2);
	}

	@Test
	@DisplayName("多步撤銷 / 重做與清空歷史")
	void batchStepsAndClear() {
		UUID slideId = editService.createSlide(documentId, Map.of("title", "v0"), null).id();
		editService.updateSlide(documentId, slideId, Map.of("title", "v1"));
		editService.updateSlide(documentId, slideId, Map.of("title", "v2"));

		BatchStepResultData undone = editService.undoSteps(documentId, 2);
		assertThat(undone.completedSteps()).isEqualTo(2);
		assertThat(slideRepository.getById(slideId).orElseThrow().getTitle()).isEqualTo("v0");

		BatchStepResultData redone = editService.redoSteps(documentId, 5);
		assertThat(redone.requestedSteps()).isEqualTo(5);
		assertThat(redone.completedSteps()).isEqualTo(2);
		assertThat(redone.canRedo()).isFalse();

		editService.clearHistory(documentId);
		HistoryStatusProjection status = queryService.status(documentId);
		assertThat(status.historySize()).isZero();
		assertThat(status.canUndo()).isFalse();
		// 清空歷史不會還原投影片
		assertThat(slideRepository.getById(slideId).orElseThrow().getTitle()).isEqualTo("v2");
	}

	@Test
	@DisplayName("歷史快照非同步保存，移除記憶體快取後可由快照還原並繼續撤銷")
	void historyIsRestoredFromSnapshot() {
		log.info(">>> [Given] 文件經過三次編輯與一次撤銷");
		UUID slideId = editService.createSlide(documentId, Map.of("title", "draft"), null).id();
		editService.updateSlide(documentId, slideId, Map.of("subtitle", "sub"));
		editService.updateSlide(documentId, slideId, Map.of("title", "final"));
		editService.undo(documentId, slideId);

		Awaitility.await().atMost(Duration.ofSeconds(5)).pollInterval(Duration.ofMillis(100)).untilAsserted(() -> {
			CommandHistorySnapshot snapshot = snapshotPort.findByDocument(documentId).orElseThrow();
			assertThat(snapshot.getCommands()).hasSize(3);
			assertThat(snapshot.getCurrentIndex()).isEqualTo(1);
		});

		log.info(">>> [When] 移除記憶體中的歷史");
		historyRepository.evict(documentId);

		log.info(">>> [Then] 歷史由快照還原，可以重做與撤銷");
		HistoryStatusProjection status = queryService.status(documentId);
		assertThat(status.historySize()).isEqualTo(3);
		assertThat(status.undoCount()).isEqualTo(2);
		assertThat(status.redoCount()).isEqualTo(1);

		assertThat(editService.redo(documentId, slideId).resultingState().title()).isEqualTo("final");
		editService.undoSteps(documentId, 3);
		assertThat(slideRepository.getById(slideId)).isEmpty();
	}

	@Test
	@DisplayName("同一文件的並行編輯依序執行，歷史筆數等於送出的編輯數")
	void concurrentEditsAreSerialized() throws Exception {
		UUID slideId = editService.createSlide(documentId, Map.of("title", "t"), null).id();
		int edits = 20;

		ExecutorService executor = Executors.newFixedThreadPool(8);
		try {
			List<Future<SlideStateProjection>> futures = new ArrayList<>();
			for (int i = 0; i < edits; i++) {
				String title = "t" + i;
				futures.add(executor.submit(() -> editService.updateSlide(documentId, slideId, Map.of("title", title))));
			}
			for (Future<SlideStateProjection> future : futures) {
				future.get(10, TimeUnit.SECONDS);
			}
		} finally {
			executor.shutdown();
		}

		HistoryStatusProjection status = queryService.status(documentId);
		assertThat(status.historySize()).isEqualTo(edits + 1);

		// 全部撤銷後標題回到最初的值
		editService.undoSteps(documentId, edits);
		assertThat(slideRepository.getById(slideId).orElseThrow().getTitle()).isEqualTo("t");
	}
}
