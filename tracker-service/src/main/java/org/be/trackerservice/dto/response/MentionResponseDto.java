package org.be.trackerservice.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.be.trackerservice.entity.Mention;
import org.be.trackerservice.enums.MentionSource;
import org.be.trackerservice.enums.SentimentLabel;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MentionResponseDto {

    private Long id;
    private MentionSource source;
    private String url;
    private String author;
    private String content;
    private SentimentLabel sentiment;
    private Double sentimentScore;
    private String topic;
    private LocalDateTime createdAt;

    public static MentionResponseDto from(Mention mention) {
        return MentionResponseDto.builder()
                .id(mention.getId())
                .source(mention.getSource())
                .url(mention.getUrl())
                .author(mention.getAuthor())
                .content(mention.getContent())
                .sentiment(mention.getSentiment())
                .sentimentScore(mention.getSentimentScore())
                .topic(mention.getTopic())
                .createdAt(mention.getCreatedAt())
                .build();
    }
}
