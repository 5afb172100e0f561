package dev.blogpress;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class BlogpressApplication {

	public static void main(String[] args) {
		SpringApplication.run(BlogpressApplication.class, args);
	}

}
