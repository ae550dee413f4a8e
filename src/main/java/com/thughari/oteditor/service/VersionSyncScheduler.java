package com.thughari.oteditor.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically pushes each hosted document's snapshot so replicas that fell behind can catch up.
 */
@Component
@Slf4j
public class VersionSyncScheduler {

    private final DocumentHub documentHub;

    public VersionSyncScheduler(DocumentHub documentHub) {
        this.documentHub = documentHub;
    }

    @Scheduled(fixedDelayString = "${collab.sync-interval-ms:30000}", initialDelayString = "${collab.sync-interval-ms:30000}")
    public void broadcastSnapshots() {
        log.debug("Broadcasting version sync snapshots");
        documentHub.broadcastSnapshots();
    }
}
