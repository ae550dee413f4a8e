package com.thughari.oteditor.config;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

import com.thughari.oteditor.websocket.EditorWebSocketHandler;


@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {
	
	@Autowired
	private EditorWebSocketHandler editorWebSocketHandler;

	@Autowired
	private CollabProperties collabProperties;

	@Override
	public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
		registry.addHandler(editorWebSocketHandler, "/collaborate/*")
				.setAllowedOrigins(collabProperties.getAllowedOrigins().toArray(new String[0]));
		
	}
	
}
