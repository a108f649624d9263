package com.delta.warmup.placement.api;

import com.delta.warmup.placement.error.ValidationException;
import com.delta.warmup.placement.model.Domain;
import com.delta.warmup.placement.model.DomainStatus;
import com.delta.warmup.placement.model.LifecycleSignals;
import com.delta.warmup.placement.service.DomainLifecycleService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/domains")
public class DomainController {
    static final String OWNER_HEADER = "X-Owner-Id";

    private final DomainLifecycleService lifecycleService;

    public DomainController(DomainLifecycleService lifecycleService) {
        this.lifecycleService = lifecycleService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Domain register(
        @RequestHeader(OWNER_HEADER) String ownerId,
        @RequestBody RegisterDomainRequest request
    ) {
        if (request == null || request.maxSendVolume() == null) {
            throw new ValidationException("maxSendVolume is required");
        }
        return lifecycleService.register(ownerId, request.name(), request.maxSendVolume(), request.dailySendVolume());
    }

    @GetMapping
    public List<Domain> list(@RequestHeader(OWNER_HEADER) String ownerId) {
        return lifecycleService.listDomains(ownerId);
    }

    @GetMapping("/{id}")
    public Domain get(@RequestHeader(OWNER_HEADER) String ownerId, @PathVariable("id") String id) {
        return lifecycleService.getDomain(ownerId, id);
    }

    @PostMapping("/{id}/transitions")
    public Domain transition(
        @RequestHeader(OWNER_HEADER) String ownerId,
        @PathVariable("id") String id,
        @RequestBody TransitionRequest request
    ) {
        DomainStatus target = request == null ? null : DomainStatus.fromValue(request.target());
        if (target == null) {
            throw new ValidationException("target must be one of WARMING, ACTIVE, INACTIVE");
        }
        return lifecycleService.transition(ownerId, id, target);
    }

    @PostMapping("/{id}/reset")
    public Domain reset(@RequestHeader(OWNER_HEADER) String ownerId, @PathVariable("id") String id) {
        return lifecycleService.resetToWarming(ownerId, id);
    }

    @GetMapping("/{id}/signals")
    public LifecycleSignals signals(@RequestHeader(OWNER_HEADER) String ownerId, @PathVariable("id") String id) {
        return lifecycleService.evaluate(ownerId, id);
    }

    @PostMapping("/{id}/signals/apply")
    public Domain applySignals(@RequestHeader(OWNER_HEADER) String ownerId, @PathVariable("id") String id) {
        return lifecycleService.applySignals(ownerId, id);
    }
}
