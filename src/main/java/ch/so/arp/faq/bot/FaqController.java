package ch.so.arp.faq.bot;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoint answering FAQ questions. Accepts {@code {"question": "..."}}
 * and returns the best answer together with the matched question and score.
 */
@RestController
public class FaqController {

    private static final Logger LOGGER = LoggerFactory.getLogger(FaqController.class);

    static final String MISSING_QUESTION_MESSAGE = "Please send a question.";

    private final RetrievalService retrievalService;

    public FaqController(RetrievalService retrievalService) {
        this.retrievalService = retrievalService;
    }

    @PostMapping(path = "/faq", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public FaqResponse faq(@RequestBody(required = false) FaqRequest request) {
        String question = request == null ? null : request.question();
        AnswerResult result = retrievalService.answer(question);
        LOGGER.debug("Answered '{}' with outcome {} (score={})", question, result.outcome(), result.score());
        return FaqResponse.from(result);
    }

    @ExceptionHandler(InvalidQueryException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, String> invalidQuery(InvalidQueryException ex) {
        return Map.of("error", MISSING_QUESTION_MESSAGE);
    }

    /**
     * A body that cannot be read as a question object counts as a missing
     * question.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, String> unreadableBody(HttpMessageNotReadableException ex) {
        LOGGER.debug("Rejecting unreadable FAQ request: {}", ex.getMessage());
        return Map.of("error", MISSING_QUESTION_MESSAGE);
    }
}
