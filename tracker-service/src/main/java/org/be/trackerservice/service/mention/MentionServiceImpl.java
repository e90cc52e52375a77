package org.be.trackerservice.service.mention;

import jakarta.persistence.criteria.Predicate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.be.trackerservice.dto.request.MentionFilterDto;
import org.be.trackerservice.dto.request.MentionUpdateDto;
import org.be.trackerservice.dto.response.MentionResponseDto;
import org.be.trackerservice.entity.Mention;
import org.be.trackerservice.enums.MentionSource;
import org.be.trackerservice.enums.SentimentLabel;
import org.be.trackerservice.exception.MentionNotFoundException;
import org.be.trackerservice.repository.MentionRepository;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class MentionServiceImpl implements MentionService {

    private final MentionRepository mentionRepository;
    private final Clock clock;

    @Override
    @Transactional
    public List<Mention> saveBatch(List<Mention> mentions) {
        if (mentions.isEmpty()) {
            return List.of();
        }
        log.debug("Saving batch of {} mentions", mentions.size());

        List<Mention> saved = mentionRepository.saveAll(mentions);
        // 커밋 전에 제약 위반을 드러내 호출자에게 예외가 전달되도록 한다
        mentionRepository.flush();

        log.info("Saved {} mentions", saved.size());
        return saved;
    }

    @Override
    public Page<MentionResponseDto> getMentions(MentionFilterDto filter, Pageable pageable) {
        log.debug("Getting mentions with filter: {}", filter);

        Specification<Mention> spec = createSpecification(filter);
        Pageable sortedPageable = PageRequest.of(pageable.getPageNumber(), pageable.getPageSize(),
                Sort.by(Sort.Direction.DESC, "createdAt").and(Sort.by(Sort.Direction.DESC, "id")));

        return mentionRepository.findAll(spec, sortedPageable)
                .map(MentionResponseDto::from);
    }

    @Override
    public MentionResponseDto getMention(Long id) {
        return mentionRepository.findById(id)
                .map(MentionResponseDto::from)
                .orElseThrow(() -> new MentionNotFoundException(id));
    }

    @Override
    @Transactional
    public MentionResponseDto updateMention(Long id, MentionUpdateDto update) {
        Mention mention = mentionRepository.findById(id)
                .orElseThrow(() -> new MentionNotFoundException(id));

        if (StringUtils.hasText(update.getSentiment())) {
            SentimentLabel label = SentimentLabel.fromCode(update.getSentiment().trim());
            double confidence = update.getSentimentScore() != null ? update.getSentimentScore() : 1.0;
            mention.applySentiment(label, confidence);
        }
        if (StringUtils.hasText(update.getTopic())) {
            mention.setTopic(update.getTopic().trim());
        }

        log.info("Updated mention {}: sentiment={}, topic={}", id, mention.getSentiment(), mention.getTopic());
        return MentionResponseDto.from(mentionRepository.save(mention));
    }

    @Override
    @Transactional
    public void deleteMention(Long id) {
        if (!mentionRepository.existsById(id)) {
            throw new MentionNotFoundException(id);
        }
        mentionRepository.deleteById(id);
        log.info("Deleted mention {}", id);
    }

    private Specification<Mention> createSpecification(MentionFilterDto filter) {
        // 필터 값 검증은 쿼리 실행 전에 한다
        MentionSource source = StringUtils.hasText(filter.getSource())
                ? MentionSource.fromCode(filter.getSource().trim()) : null;
        SentimentLabel sentiment = StringUtils.hasText(filter.getSentiment())
                ? SentimentLabel.fromCode(filter.getSentiment().trim()) : null;
        int days = filter.getDays() != null ? filter.getDays() : 7;
        if (days <= 0) {
            throw new IllegalArgumentException("days must be positive: " + days);
        }
        LocalDateTime since = LocalDateTime.now(clock).minusDays(days);

        return (root, query, criteriaBuilder) -> {
            List<Predicate> predicates = new ArrayList<>();

            predicates.add(criteriaBuilder.greaterThanOrEqualTo(root.get("createdAt"), since));

            if (source != null) {
                predicates.add(criteriaBuilder.equal(root.get("source"), source));
            }
            if (sentiment != null) {
                predicates.add(criteriaBuilder.equal(root.get("sentiment"), sentiment));
            }
            if (StringUtils.hasText(filter.getTopic())) {
                predicates.add(criteriaBuilder.equal(root.get("topic"), filter.getTopic().trim()));
            }

            return criteriaBuilder.and(predicates.toArray(new Predicate[0]));
        };
    }
}
