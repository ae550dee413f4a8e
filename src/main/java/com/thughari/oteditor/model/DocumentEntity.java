package com.thughari.oteditor.model;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
@Document(collection = "documents")
public class DocumentEntity {

	@Id
	private String id;
	private String title;
	private List<String> content;
	private String language;
	private long version;
	private long lastModified;

	public DocumentEntity() {}
    public DocumentEntity(String id) {
        this.id = id;
        this.content = new ArrayList<>(List.of(""));
    }

    public static DocumentEntity from(SharedDocument document) {
        DocumentEntity entity = new DocumentEntity(document.getId());
        entity.setTitle(document.getTitle());
        entity.setContent(new ArrayList<>(document.getContent()));
        entity.setLanguage(document.getLanguage());
        entity.setVersion(document.getVersion());
        entity.setLastModified(document.getLastModified());
        return entity;
    }

    public SharedDocument toSharedDocument() {
        SharedDocument document = new SharedDocument(id);
        if (title != null) {
            document.setTitle(title);
        }
        if (language != null) {
            document.setLanguage(language);
        }
        document.restore(VersionSnapshot.builder().version(version).content(content).build(), lastModified);
        return document;
    }

}
