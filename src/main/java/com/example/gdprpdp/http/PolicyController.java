package com.example.gdprpdp.http;

import com.example.gdprpdp.models.Policy;
import com.example.gdprpdp.models.PolicySet;
import com.example.gdprpdp.service.PolicyStoreService;
import java.net.URI;
import java.util.List;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Policy administration. Bodies are validated by {@link PolicyStoreService} so that every rejected
 * definition comes back as SCHEMA_INVALID with the full violation list.
 */
@RestController
public class PolicyController {

    private final PolicyStoreService policyStore;

    public PolicyController(PolicyStoreService policyStore) {
        this.policyStore = policyStore;
    }

    @PostMapping("/policies")
    public ResponseEntity<Policy> create(@RequestBody Policy policy) {
        Policy created = policyStore.create(policy);
        return ResponseEntity.created(URI.create("/policies/" + created.getPolicyId()))
                .header(HttpHeaders.ETAG, created.getVersion().toString())
                .body(created);
    }

    @PostMapping("/policies/bulk")
    public ResponseEntity<List<Policy>> load(@RequestBody List<Policy> policies) {
        PolicySet loaded = policyStore.load(policies);
        return ResponseEntity.ok(loaded.policies());
    }

    @GetMapping("/policies")
    public ResponseEntity<List<Policy>> list() {
        return ResponseEntity.ok(policyStore.list());
    }

    @GetMapping("/policies/{policyId}")
    public ResponseEntity<Policy> get(@PathVariable String policyId) {
        Policy policy = policyStore.get(policyId);
        return ResponseEntity.ok()
                .header(HttpHeaders.ETAG, String.valueOf(policy.getVersion()))
                .body(policy);
    }

    @PutMapping("/policies/{policyId}")
    public ResponseEntity<Policy> update(@PathVariable String policyId, @RequestBody Policy policy) {
        Policy updated = policyStore.update(policyId, policy);
        return ResponseEntity.ok()
                .header(HttpHeaders.ETAG, updated.getVersion().toString())
                .body(updated);
    }

    @DeleteMapping("/policies/{policyId}")
    public ResponseEntity<Void> delete(@PathVariable String policyId) {
        policyStore.delete(policyId);
        return ResponseEntity.noContent().build();
    }
}
