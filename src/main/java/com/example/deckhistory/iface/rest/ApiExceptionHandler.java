package com.example.deckhistory.iface.rest;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import com.example.deckhistory.application.domain.history.command.Command;
import com.example.deckhistory.application.domain.history.exception.CommandException;
import com.example.deckhistory.application.domain.history.exception.CommandRegistryException;
import com.example.deckhistory.application.domain.slide.exception.SlideNotFoundException;

import lombok.extern.slf4j.Slf4j;

/**
 * REST 錯誤對應
 *
 * <p>
 * 指令執行或撤銷失敗一律回傳 409 並附上失敗的指令；根因是找不到投影片時 error 標為 NOT_FOUND。
 * </p>
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

	@ExceptionHandler(SlideNotFoundException.class)
	@ResponseStatus(HttpStatus.NOT_FOUND)
	public Map<String, Object> handleNotFound(SlideNotFoundException e) {
		return body("NOT_FOUND", e.getMessage());
	}

	@ExceptionHandler(CommandRegistryException.class)
	@ResponseStatus(HttpStatus.BAD_REQUEST)
	public Map<String, Object> handleRegistry(CommandRegistryException e) {
		Map<String, Object> body = body("BAD_REQUEST", e.getMessage());
		body.put("commandType", e.getCommandType());
		return body;
	}

	@ExceptionHandler(CommandException.class)
	@ResponseStatus(HttpStatus.CONFLICT)
	public Map<String, Object> handleCommandFailure(CommandException e) {
		log.warn(">>> [API] 指令失敗: {}", e.getMessage());
		Map<String, Object> body = body("CONFLICT", e.getMessage());
		Command<?> command = e.getCommand();
		if (command != null) {
			body.put("commandType", command.getCommandType());
			body.put("commandId", command.getId());
		}
		if (e.getCause() instanceof SlideNotFoundException) {
			body.put("error", "NOT_FOUND");
		}
		return body;
	}

	@ExceptionHandler(IllegalArgumentException.class)
	@ResponseStatus(HttpStatus.BAD_REQUEST)
	public Map<String, Object> handleBadRequest(IllegalArgumentException e) {
		return body("BAD_REQUEST", e.getMessage());
	}

	@ExceptionHandler(MethodArgumentNotValidException.class)
	@ResponseStatus(HttpStatus.BAD_REQUEST)
	public Map<String, Object> handleValidation(MethodArgumentNotValidException e) {
		String message = e.getBindingResult().getFieldErrors().stream()
				.map(error -> error.getField() + ": " + error.getDefaultMessage()).collect(Collectors.joining("; "));
		return body("BAD_REQUEST", message);
	}

	private Map<String, Object> body(String error, String message) {
		Map<String, Object> body = new LinkedHashMap<>();
		body.put("error", error);
		body.put("message", message);
		return body;
	}
}
