package com.autotrader.domain.model;

import com.autotrader.domain.enums.SignalDirection;
import java.math.BigDecimal;
import java.util.List;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Audit copy of the decision behind a trade: the aggregated signal plus every source
 * that contributed to it. Stored as JSON in the trade record.
 */
@Value
@Builder
@Jacksonized
public class SignalSnapshot {

    SignalDirection direction;
    BigDecimal confidence;
    String rationale;
    List<Contribution> contributions;

    /** Builds a snapshot from the aggregated signal and the opinions it was combined from. */
    public static SignalSnapshot of(Signal combined, List<WeightedOpinion> opinions) {
        List<Contribution> contributions = opinions.stream()
                .filter(WeightedOpinion::isContributing)
                .map(o -> Contribution.builder()
                        .sourceName(o.getSourceName())
                        .weight(o.getWeight())
                        .direction(o.getSignal().getDirection())
                        .confidence(o.getSignal().getConfidence())
                        .build())
                .toList();
        return SignalSnapshot.builder()
                .direction(combined.getDirection())
                .confidence(combined.getConfidence())
                .rationale(combined.getRationale())
                .contributions(contributions)
                .build();
    }

    @Value
    @Builder
    @Jacksonized
    public static class Contribution {
        String sourceName;
        BigDecimal weight;
        SignalDirection direction;
        BigDecimal confidence;
    }
}
