package me.golemcore.quota.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.quota.domain.model.Tier;
import me.golemcore.quota.domain.model.TierName;
import me.golemcore.quota.domain.service.TierCatalogService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Optional;

/**
 * Tier catalog administration.
 */
@RestController
@RequestMapping("/api/quota/tiers")
@RequiredArgsConstructor
public class TierCatalogController {

    private final TierCatalogService tierCatalogService;

    @GetMapping
    public Mono<ResponseEntity<List<Tier>>> listTiers() {
        return Mono.fromCallable(() -> ResponseEntity.ok(tierCatalogService.list()));
    }

    @GetMapping("/{name}")
    public Mono<ResponseEntity<Tier>> getTier(@PathVariable String name) {
        return Mono.fromCallable(() -> ResponseEntity.ok(tierCatalogService.require(name)));
    }

    @PutMapping("/{name}")
    public Mono<ResponseEntity<Tier>> upsertTier(@PathVariable String name, @RequestBody Tier tier) {
        if (tier == null) {
            return Mono.error(new ResponseStatusException(HttpStatus.BAD_REQUEST, "Tier body is required"));
        }
        if (tier.getName() != null && !sameTier(tier.getName(), name)) {
            return Mono.error(new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "Tier name in body does not match path: " + tier.getName()));
        }
        return Mono.fromCallable(() -> ResponseEntity.ok(tierCatalogService.upsert(tier.toBuilder().name(name).build())));
    }

    @DeleteMapping("/{name}")
    public Mono<ResponseEntity<Void>> deleteTier(@PathVariable String name) {
        return Mono.fromCallable(() -> {
            tierCatalogService.delete(name);
            return ResponseEntity.noContent().<Void>build();
        });
    }

    private static boolean sameTier(String bodyName, String pathName) {
        Optional<TierName> fromBody = TierName.fromId(bodyName);
        return fromBody.isPresent() && fromBody.equals(TierName.fromId(pathName));
    }
}
