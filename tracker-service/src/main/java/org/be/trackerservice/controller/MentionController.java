package org.be.trackerservice.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.be.trackerservice.dto.request.MentionFilterDto;
import org.be.trackerservice.dto.request.MentionUpdateDto;
import org.be.trackerservice.dto.response.MentionResponseDto;
import org.be.trackerservice.service.mention.MentionService;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.web.PageableDefault;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/mentions")
@RequiredArgsConstructor
public class MentionController {

    private final MentionService mentionService;

    /**
     * 멘션 목록 조회 (페이징, 최신순)
     * GET /api/v1/mentions?source=&sentiment=&topic=&days=&page=&size=
     */
    @GetMapping
    public ResponseEntity<Page<MentionResponseDto>> getMentions(
            MentionFilterDto filter,
            @PageableDefault(size = 100) Pageable pageable) {
        return ResponseEntity.ok(mentionService.getMentions(filter, pageable));
    }

    /**
     * GET /api/v1/mentions/{id}
     */
    @GetMapping("/{id}")
    public ResponseEntity<MentionResponseDto> getMention(@PathVariable Long id) {
        return ResponseEntity.ok(mentionService.getMention(id));
    }

    /**
     * 감성/토픽 보정
     * PUT /api/v1/mentions/{id}
     */
    @PutMapping("/{id}")
    public ResponseEntity<MentionResponseDto> updateMention(@PathVariable Long id,
                                                            @Valid @RequestBody MentionUpdateDto update) {
        return ResponseEntity.ok(mentionService.updateMention(id, update));
    }

    /**
     * DELETE /api/v1/mentions/{id}
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, String>> deleteMention(@PathVariable Long id) {
        mentionService.deleteMention(id);
        return ResponseEntity.ok(Map.of("message", "Mention deleted successfully"));
    }
}
