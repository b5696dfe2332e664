package com.example.deckhistory.config.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.example.deckhistory.application.domain.history.command.CommandRegistry;
import com.example.deckhistory.application.domain.slide.command.SlideCommandType;
import com.example.deckhistory.application.port.SlideRepositoryPort;

/**
 * 指令登錄表的配置類
 * <p>
 * 登錄表以 Bean 的形式存在並注入需要它的元件，所有投影片指令類型在此註冊。
 * </p>
 */
@Configuration
public class CommandRegistryConfiguration {

	@Bean
	public CommandRegistry<SlideRepositoryPort> slideCommandRegistry() {
		CommandRegistry<SlideRepositoryPort> registry = new CommandRegistry<>();
		SlideCommandType.registerAll(registry);
		return registry;
	}
}
