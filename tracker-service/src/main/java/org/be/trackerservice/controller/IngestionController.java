package org.be.trackerservice.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.be.trackerservice.dto.response.IngestionResult;
import org.be.trackerservice.service.ingestion.IngestionPipeline;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/v1/ingest")
@RequiredArgsConstructor
public class IngestionController {

    private final IngestionPipeline ingestionPipeline;

    /**
     * 수집 실행. query 가 없으면 설정된 브랜드 쿼리를 쓴다
     * POST /api/v1/ingest/run
     */
    @PostMapping("/run")
    public ResponseEntity<IngestionResult> runIngestion(@RequestParam(required = false) String query) {
        log.info("Ingestion requested: query={}", query);
        return ResponseEntity.ok(ingestionPipeline.run(query));
    }
}
