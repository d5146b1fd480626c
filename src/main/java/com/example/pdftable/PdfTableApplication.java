package com.example.pdftable;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Application entry point.
 * Wires the application context and hands control to Spring; extraction logic lives in the application layer.
 */
@SpringBootApplication
public class PdfTableApplication {

	public static void main(String[] args) {
		SpringApplication.run(PdfTableApplication.class, args);
	}

}
