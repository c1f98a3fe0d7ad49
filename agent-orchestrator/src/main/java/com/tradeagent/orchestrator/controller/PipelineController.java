package com.tradeagent.orchestrator.controller;

import com.tradeagent.common.model.PipelineResult;
import com.tradeagent.orchestrator.config.PipelineSettings;
import com.tradeagent.orchestrator.pipeline.TradingPipeline;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
@RequestMapping("/api/v1/pipeline")
public class PipelineController {

    private final TradingPipeline pipeline;
    private final PipelineSettings settings;

    public PipelineController(TradingPipeline pipeline, PipelineSettings settings) {
        this.pipeline = pipeline;
        this.settings = settings;
    }

    @GetMapping("/run")
    public Mono<ResponseEntity<PipelineResult>> runDefault() {
        return run(settings.defaultSymbol());
    }

    @GetMapping("/{symbol}")
    public Mono<ResponseEntity<PipelineResult>> run(@PathVariable String symbol) {
        return Mono.fromCallable(() -> pipeline.run(symbol))
            .subscribeOn(Schedulers.boundedElastic())
            .map(ResponseEntity::ok);
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
