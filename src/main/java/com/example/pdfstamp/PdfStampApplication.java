package com.example.pdfstamp;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PdfStampApplication {

	public static void main(String[] args) {
		SpringApplication.run(PdfStampApplication.class, args);
	}

}
