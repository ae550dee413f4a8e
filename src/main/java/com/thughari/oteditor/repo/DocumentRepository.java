package com.thughari.oteditor.repo;

import org.springframework.data.mongodb.repository.MongoRepository;

import com.thughari.oteditor.model.DocumentEntity;

public interface DocumentRepository extends MongoRepository<DocumentEntity, String> {
}
