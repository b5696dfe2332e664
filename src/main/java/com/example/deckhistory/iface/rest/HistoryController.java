package com.example.deckhistory.iface.rest;

import java.util.UUID;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.example.deckhistory.application.domain.history.snapshot.CommandHistorySnapshot;
import com.example.deckhistory.application.service.HistoryQueryService;
import com.example.deckhistory.application.service.SlideEditService;
import com.example.deckhistory.application.shared.dto.BatchStepResultData;
import com.example.deckhistory.iface.dto.res.BatchStepResource;
import com.example.deckhistory.iface.dto.res.HistoryResource;

import lombok.AllArgsConstructor;

/**
 * 文件歷史控制器：查詢、匯出、多步撤銷 / 重做與清空
 */
@RestController
@AllArgsConstructor
@RequestMapping("/documents/{documentId}/history")
public class HistoryController {

	private final SlideEditService editService;
	private final HistoryQueryService queryService;

	@GetMapping
	public ResponseEntity<HistoryResource> history(@PathVariable UUID documentId) {
		return ResponseEntity.ok(new HistoryResource("200", "查詢成功", queryService.status(documentId),
				queryService.summary(documentId)));
	}

	/**
	 * 匯出序列化後的歷史 ({maxHistory, currentIndex, commands})
	 */
	@GetMapping("/export")
	public ResponseEntity<CommandHistorySnapshot> export(@PathVariable UUID documentId) {
		return ResponseEntity.ok(queryService.export(documentId));
	}

	@PostMapping("/undo")
	public ResponseEntity<BatchStepResource> undoSteps(@PathVariable UUID documentId,
			@RequestParam(defaultValue = "1") int steps) {
		BatchStepResultData result = editService.undoSteps(documentId, steps);
		return ResponseEntity.ok(new BatchStepResource("200", "已撤銷 " + result.completedSteps() + " 步", result));
	}

	@PostMapping("/redo")
	public ResponseEntity<BatchStepResource> redoSteps(@PathVariable UUID documentId,
			@RequestParam(defaultValue = "1") int steps) {
		BatchStepResultData result = editService.redoSteps(documentId, steps);
		return ResponseEntity.ok(new BatchStepResource("200", "已重做 " + result.completedSteps() + " 步", result));
	}

	@DeleteMapping
	public ResponseEntity<Void> clear(@PathVariable UUID documentId) {
		editService.clearHistory(documentId);
		return ResponseEntity.noContent().build();
	}
}
