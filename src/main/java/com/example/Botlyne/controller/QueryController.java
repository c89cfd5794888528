package com.example.Botlyne.controller;

import com.example.Botlyne.model.QueryTurnRequest;
import com.example.Botlyne.model.QueryTurnResponse;
import com.example.Botlyne.model.TurnEvent;
import com.example.Botlyne.service.QueryTurnService;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;

import java.io.IOException;

@RestController
@RequestMapping("/api/query")
@RequiredArgsConstructor
public class QueryController {

    public static final String TENANT_HEADER = "X-Tenant-Id";

    private static final Logger log = LoggerFactory.getLogger(QueryController.class);

    private final QueryTurnService queryTurnService;

    @PostMapping
    public QueryTurnResponse query(@RequestHeader(value = TENANT_HEADER, required = false) String tenantId,
                                   @RequestBody QueryTurnRequest request) {
        return queryTurnService.handle(tenantId, request);
    }

    /**
     * Events: routing, retrieval, drafting, reviewing, final.
     */
    @PostMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@RequestHeader(value = TENANT_HEADER, required = false) String tenantId,
                             @RequestBody QueryTurnRequest request) {
        Flux<TurnEvent> events = queryTurnService.streamTurn(tenantId, request);

        // 0L means the emitter never times out on its own
        SseEmitter emitter = new SseEmitter(0L);

        Disposable subscription = events.subscribe(
                event -> {
                    try {
                        emitter.send(SseEmitter.event()
                                .name(event.stage().eventName())
                                .data(event));
                    } catch (IOException e) {
                        log.debug("Client went away during streamed turn: {}", e.getMessage());
                        emitter.completeWithError(e);
                    }
                },
                emitter::completeWithError,
                emitter::complete
        );

        // Dropping the subscription stops delivery only; the turn itself runs to completion.
        emitter.onCompletion(subscription::dispose);
        emitter.onTimeout(subscription::dispose);
        emitter.onError(t -> subscription.dispose());

        return emitter;
    }
}
