package com.meddollina.assistant.controller;

import com.meddollina.assistant.model.AnswerOutcome;
import com.meddollina.assistant.model.AnswerResult;
import com.meddollina.assistant.model.ChatAnswer;
import com.meddollina.assistant.model.ChatRequest;
import com.meddollina.assistant.model.ChatResponse;
import com.meddollina.assistant.model.Question;
import com.meddollina.assistant.service.QuestionAnsweringService;
import com.meddollina.assistant.service.SuggestionService;
import com.meddollina.assistant.service.memory.ConversationContext;
import com.meddollina.assistant.service.memory.ConversationMemoryStore;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

@RestController
@RequestMapping("/api")
public class ChatController {

    private final QuestionAnsweringService questionAnsweringService;
    private final SuggestionService suggestionService;
    private final ConversationMemoryStore memoryStore;

    public ChatController(QuestionAnsweringService questionAnsweringService,
                          SuggestionService suggestionService,
                          ConversationMemoryStore memoryStore) {
        this.questionAnsweringService = questionAnsweringService;
        this.suggestionService = suggestionService;
        this.memoryStore = memoryStore;
    }

    @PostMapping(path = "/chat", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ChatResponse<ChatAnswer>>> chat(@Valid @RequestBody ChatRequest request) {
        // the pipeline blocks on remote calls, keep it off the event loop
        return Mono.fromCallable(() -> questionAnsweringService.answer(Question.of(request.message()), contextFor(request)))
                .subscribeOn(Schedulers.boundedElastic())
                .map(this::toResponse);
    }

    @GetMapping(path = "/suggestions", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ChatResponse<List<String>>> suggestions(@RequestParam(name = "count", defaultValue = "5") int count) {
        return Mono.fromCallable(() -> suggestionService.suggest(count))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ChatResponse::ok);
    }

    private ResponseEntity<ChatResponse<ChatAnswer>> toResponse(AnswerResult result) {
        ChatAnswer answer = ChatAnswer.from(result);
        if (result.outcome() == AnswerOutcome.GENERATION_FAILED) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(new ChatResponse<>(false, answer, result.answer()));
        }
        if (result.outcome().error()) {
            return ResponseEntity.ok(new ChatResponse<>(false, answer, result.answer()));
        }
        return ResponseEntity.ok(ChatResponse.ok(answer));
    }

    private ConversationContext contextFor(ChatRequest request) {
        if (request.history() != null && !request.history().isEmpty()) {
            return ConversationContext.flat(request.history());
        }
        if (request.conversationId() != null && !request.conversationId().isBlank()) {
            return ConversationContext.structured(memoryStore.forConversation(request.conversationId()));
        }
        return ConversationContext.none();
    }
}
