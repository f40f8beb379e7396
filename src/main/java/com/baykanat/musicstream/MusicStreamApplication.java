package com.baykanat.musicstream;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/** Uygulama giriş noktası; @EnableScheduling ile window roll, trend refresh ve retention cleanup. */
@SpringBootApplication
@EnableScheduling
public class MusicStreamApplication {

	public static void main(String[] args) {
		SpringApplication.run(MusicStreamApplication.class, args);
	}

}
