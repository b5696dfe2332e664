package com.example.deckhistory.iface.rest;

import java.util.UUID;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.example.deckhistory.application.service.SlideEditService;
import com.example.deckhistory.application.shared.dto.UndoRedoResultData;
import com.example.deckhistory.application.shared.projection.SlideStateProjection;
import com.example.deckhistory.iface.dto.req.CreateSlideResource;
import com.example.deckhistory.iface.dto.req.MoveSlideResource;
import com.example.deckhistory.iface.dto.req.UpdateSlideResource;
import com.example.deckhistory.iface.dto.res.SlideResource;
import com.example.deckhistory.iface.dto.res.UndoRedoResource;

import jakarta.validation.Valid;
import lombok.AllArgsConstructor;

/**
 * 投影片編輯控制器
 *
 * <p>
 * 每個編輯請求都會成為文件歷史中的一個指令，可透過 undo / redo 接口撤銷與重做。
 * </p>
 */
@RestController
@AllArgsConstructor
@RequestMapping("/documents/{documentId}/slides")
public class SlideController {

	private final SlideEditService editService;

	@PostMapping
	public ResponseEntity<SlideResource> create(@PathVariable UUID documentId,
			@Valid @RequestBody CreateSlideResource request) {
		SlideStateProjection slide = editService.createSlide(documentId, request.getFields(), request.getOrderIndex());
		return ResponseEntity.status(HttpStatus.CREATED).body(new SlideResource("201", "投影片已新增", slide));
	}

	@PatchMapping("/{slideId}")
	public ResponseEntity<SlideResource> update(@PathVariable UUID documentId, @PathVariable UUID slideId,
			@Valid @RequestBody UpdateSlideResource request) {
		SlideStateProjection slide = editService.updateSlide(documentId, slideId, request.getFields());
		return ResponseEntity.ok(new SlideResource("200", "投影片已更新", slide));
	}

	@DeleteMapping("/{slideId}")
	public ResponseEntity<SlideResource> delete(@PathVariable UUID documentId, @PathVariable UUID slideId) {
		editService.deleteSlide(documentId, slideId);
		return ResponseEntity.ok(new SlideResource("200", "投影片已刪除", null));
	}

	@PostMapping("/{slideId}/move")
	public ResponseEntity<SlideResource> move(@PathVariable UUID documentId, @PathVariable UUID slideId,
			@Valid @RequestBody MoveSlideResource request) {
		SlideStateProjection slide = editService.moveSlide(documentId, slideId, request.getNewOrder());
		return ResponseEntity.ok(new SlideResource("200", "投影片已移動", slide));
	}

	@PostMapping("/{slideId}/undo")
	public ResponseEntity<UndoRedoResource> undo(@PathVariable UUID documentId, @PathVariable UUID slideId) {
		return respond(editService.undo(documentId, slideId));
	}

	@PostMapping("/{slideId}/redo")
	public ResponseEntity<UndoRedoResource> redo(@PathVariable UUID documentId, @PathVariable UUID slideId) {
		return respond(editService.redo(documentId, slideId));
	}

	/**
	 * 沒有可撤銷 / 重做的指令時回傳 409，但仍帶上目前狀態
	 */
	private ResponseEntity<UndoRedoResource> respond(UndoRedoResultData result) {
		if (!result.success()) {
			return ResponseEntity.status(HttpStatus.CONFLICT)
					.body(new UndoRedoResource("409", result.description(), result));
		}
		return ResponseEntity.ok(new UndoRedoResource("200", result.description(), result));
	}
}
