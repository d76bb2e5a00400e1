package com.daylock.accountability.controller;

import com.daylock.accountability.dto.AccountabilityReport;
import com.daylock.accountability.dto.EscalationAdvice;
import com.daylock.accountability.dto.ReportRequest;
import com.daylock.accountability.dto.WindowRequest;
import com.daylock.accountability.service.AccountabilityService;
import com.daylock.engine.model.Consequence;
import com.daylock.engine.window.WindowStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/v1/accountability")
public class AccountabilityController {

    private static final Logger log = LoggerFactory.getLogger(AccountabilityController.class);

    private final AccountabilityService accountabilityService;

    public AccountabilityController(AccountabilityService accountabilityService) {
        this.accountabilityService = accountabilityService;
    }

    @PostMapping("/report")
    public Mono<ResponseEntity<AccountabilityReport>> report(@RequestBody ReportRequest request) {
        if (request.records() == null) {
            return Mono.error(new ResponseStatusException(HttpStatus.BAD_REQUEST, "records is required"));
        }
        log.info("Report requested. roomId={} userId={} records={}",
                 request.roomId(), request.userId(), request.records().size());
        return accountabilityService.report(request)
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("Report endpoint error. roomId={} userId={}",
                                      request.roomId(), request.userId(), e));
    }

    @PostMapping("/window")
    public Mono<ResponseEntity<WindowStatus>> window(@RequestBody WindowRequest request) {
        log.info("Window status requested. start={} end={}", request.start(), request.end());
        return accountabilityService.window(request)
            .map(ResponseEntity::ok);
    }

    @PostMapping("/escalation")
    public Mono<ResponseEntity<EscalationAdvice>> escalation(@RequestBody List<Consequence> consequences) {
        log.info("Escalation advice requested. consequences={}", consequences.size());
        return accountabilityService.escalation(consequences)
            .map(ResponseEntity::ok);
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
