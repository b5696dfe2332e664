package com.example.deckhistory.config.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.example.deckhistory.infra.codec.CommandHistoryJsonCodec;

import tools.jackson.databind.ObjectMapper;

/**
 * 歷史快照 Codec 的配置類
 */
@Configuration
public class HistoryCodecConfiguration {

	@Bean
	public CommandHistoryJsonCodec commandHistoryJsonCodec(ObjectMapper objectMapper) {
		return new CommandHistoryJsonCodec(objectMapper);
	}
}
