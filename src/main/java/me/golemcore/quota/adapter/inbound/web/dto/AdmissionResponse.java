package me.golemcore.quota.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.quota.domain.model.AdmissionDecision;

import java.time.Instant;

/**
 * Admission outcome as returned to API clients. Unlimited tiers report a null
 * {@code remaining} and {@code monthlyAllowance} instead of a sentinel value.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdmissionResponse {
    private String userId;
    private boolean allowed;
    private boolean unlimited;
    private Long remaining;
    private Long monthlyAllowance;
    private long messagesUsed;
    private String tierName;
    private Instant resetAt;
    private String fault;
    private String reason;

    public static AdmissionResponse from(AdmissionDecision decision) {
        return AdmissionResponse.builder()
                .userId(decision.getUserId())
                .allowed(decision.isAllowed())
                .unlimited(decision.isUnlimited())
                .remaining(decision.isUnlimited() ? null : decision.getRemaining())
                .monthlyAllowance(decision.getMonthlyAllowance())
                .messagesUsed(decision.getMessagesUsed())
                .tierName(decision.getTierName())
                .resetAt(decision.getResetAt())
                .fault(decision.getFault() != null ? decision.getFault().name() : null)
                .reason(decision.getReason())
                .build();
    }
}
