package com.sporewriter.controller;

import com.sporewriter.model.dto.GraphPayload;
import com.sporewriter.model.dto.RewriteRequest;
import com.sporewriter.service.RewriteService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

/**
 * Controller for single-pushout graph rewriting.
 */
@RestController
@RequiredArgsConstructor
public class RewriteController {

    private final RewriteService rewriteService;

    @PostMapping("/calculate")
    public Mono<GraphPayload> calculate(@Valid @RequestBody RewriteRequest request) {
        return rewriteService.calculate(request);
    }
}
