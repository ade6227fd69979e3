package com.idsplit.interfaces.api.split;

import com.idsplit.application.split.SplitAppService;
import com.idsplit.interfaces.api.dto.BatchSplitRequest;
import com.idsplit.interfaces.api.dto.BatchSplitResponse;
import com.idsplit.interfaces.api.dto.SplitRequest;
import com.idsplit.interfaces.api.dto.SplitResponse;
import com.idsplit.interfaces.api.dto.SplitStatsResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/split")
@RequiredArgsConstructor
public class SplitController {

    private final SplitAppService splitAppService;

    @PostMapping
    public ResponseEntity<SplitResponse> split(@Valid @RequestBody SplitRequest request) {
        return ResponseEntity.ok(SplitResponse.from(splitAppService.split(request.identifier())));
    }

    @GetMapping
    public ResponseEntity<SplitResponse> splitQuery(@RequestParam("identifier") String identifier) {
        return ResponseEntity.ok(SplitResponse.from(splitAppService.split(identifier)));
    }

    @PostMapping("/batch")
    public ResponseEntity<BatchSplitResponse> splitBatch(@Valid @RequestBody BatchSplitRequest request) {
        List<SplitResponse> results = splitAppService.splitAll(request.identifiers()).stream()
                .map(SplitResponse::from)
                .toList();
        return ResponseEntity.ok(new BatchSplitResponse(results));
    }

    @GetMapping("/stats")
    public ResponseEntity<SplitStatsResponse> stats() {
        return ResponseEntity.ok(SplitStatsResponse.from(splitAppService.stats()));
    }
}
