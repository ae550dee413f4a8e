package com.thughari.oteditor.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.thughari.oteditor.ot.PositionCodec;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "collab")
public class CollabProperties {

	private List<String> allowedOrigins = new ArrayList<>(List.of("http://localhost:4200"));

	/** Column bound of the line/column index encoding. */
	private int columnsPerLine = PositionCodec.DEFAULT_COLUMNS_PER_LINE;

	/** Applied operations kept per hosted document for transforming late arrivals. */
	private int historyLimit = 500;

	private long syncIntervalMs = 30000;

}
