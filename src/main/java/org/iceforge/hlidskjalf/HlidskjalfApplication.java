package org.iceforge.hlidskjalf;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HlidskjalfApplication {

	public static void main(String[] args) {
		System.exit(SpringApplication.exit(SpringApplication.run(HlidskjalfApplication.class, args)));
	}
}
