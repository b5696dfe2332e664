package com.example.deckhistory;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DeckHistoryApplication {

	public static void main(String[] args) {
		SpringApplication.run(DeckHistoryApplication.class, args);
	}

}
