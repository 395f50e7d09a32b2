package ch.so.arp.faq.bot;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * JSON body returned by {@link FaqController}. The matched question is left
 * out when no confident match was found.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FaqResponse(
        @JsonProperty("answer") String answer,
        @JsonProperty("match_question") String matchQuestion,
        @JsonProperty("match_score") double matchScore) {

    static FaqResponse from(AnswerResult result) {
        return new FaqResponse(result.text(), result.matchedQuestion().orElse(null), round(result.score()));
    }

    private static double round(double score) {
        return Math.round(score * 1000.0d) / 1000.0d;
    }
}
