package org.be.trackerservice.service.mention;

import org.be.trackerservice.dto.request.MentionFilterDto;
import org.be.trackerservice.dto.request.MentionUpdateDto;
import org.be.trackerservice.dto.response.MentionResponseDto;
import org.be.trackerservice.entity.Mention;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

import java.util.List;

public interface MentionService {

    /**
     * 멘션 일괄 저장 (단일 트랜잭션, 전부 저장되거나 전부 롤백)
     */
    List<Mention> saveBatch(List<Mention> mentions);

    /**
     * 멘션 목록 조회 (필터링 및 페이징, 최신순)
     */
    Page<MentionResponseDto> getMentions(MentionFilterDto filter, Pageable pageable);

    /**
     * 멘션 ID로 단일 조회
     */
    MentionResponseDto getMention(Long id);

    /**
     * 감성/토픽 수동 보정
     */
    MentionResponseDto updateMention(Long id, MentionUpdateDto update);

    /**
     * 멘션 삭제
     */
    void deleteMention(Long id);
}
