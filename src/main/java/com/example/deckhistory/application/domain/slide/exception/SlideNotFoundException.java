package com.example.deckhistory.application.domain.slide.exception;

import java.util.UUID;

import lombok.Getter;

/**
 * 找不到指定的投影片
 */
@Getter
public class SlideNotFoundException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final UUID slideId;

	public SlideNotFoundException(UUID slideId) {
		super("Slide " + slideId + " not found");
		this.slideId = slideId;
	}
}
