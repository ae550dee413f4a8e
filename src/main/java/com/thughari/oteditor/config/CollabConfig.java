package com.thughari.oteditor.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.thughari.oteditor.message.MessageCodec;
import com.thughari.oteditor.ot.PositionCodec;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(CollabProperties.class)
public class CollabConfig {

	@Bean
	public PositionCodec positionCodec(CollabProperties properties) {
		return new PositionCodec(properties.getColumnsPerLine());
	}

	@Bean
	public MessageCodec messageCodec(ObjectMapper objectMapper) {
		return new MessageCodec(objectMapper);
	}

	@Bean
	public Clock clock() {
		return Clock.systemUTC();
	}

}
