package com.salesdesk.backend;

import java.util.TimeZone;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class BackendApplication {

	public static void main(String[] args) {
		// Fix default JVM timezone to UTC for consistent logs and audit timestamps
		TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
		SpringApplication.run(BackendApplication.class, args);
	}

}

/*
반드시 루트 패키지에 있어야 합니다. 하위 패키지로 옮기면 modules, global 패키지의
컴포넌트와 @ConfigurationProperties 클래스를 스캔하지 못합니다.
 */
