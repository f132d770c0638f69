package com.ili.align;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class IliAlignApplication {

	public static void main(String[] args) {
		SpringApplication.run(IliAlignApplication.class, args);
	}

}
