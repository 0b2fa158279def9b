package com.smurthy.ai.search;

import com.smurthy.ai.search.config.PerplexityProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(PerplexityProperties.class)
public class PerplexityMcpServerApplication {

	public static void main(String[] args) {
		SpringApplication.run(PerplexityMcpServerApplication.class, args);
	}

}
