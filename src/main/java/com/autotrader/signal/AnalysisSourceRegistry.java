package com.autotrader.signal;

import com.autotrader.domain.model.MarketSnapshot;
import com.autotrader.domain.model.Signal;
import com.autotrader.domain.model.WeightedOpinion;
import com.autotrader.exception.ResourceNotFoundException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered registry of analysis sources with their per-source weight and enabled flag.
 *
 * <p>Registration order is preserved and determines the order of rationales in the combined
 * signal. Operator changes (weight, enable, disable) may arrive from any thread; each cycle reads
 * them once when {@link #collectOpinions} builds its opinions, so a change never affects a cycle
 * already in flight.
 */
public class AnalysisSourceRegistry {

    private static final Logger log = LoggerFactory.getLogger(AnalysisSourceRegistry.class);

    private final List<RegisteredSource> entries = new CopyOnWriteArrayList<>();

    public synchronized void register(AnalysisSource source, BigDecimal weight) {
        validateWeight(weight);
        if (find(source.name()) != null) {
            throw new IllegalArgumentException("Analysis source already registered: " + source.name());
        }
        entries.add(new RegisteredSource(source, weight));
        log.info("Registered analysis source '{}' with weight {}", source.name(), weight);
    }

    /**
     * Evaluates every enabled source against the snapshot.
     *
     * <p>A source that throws is reported as inactive for this cycle and logged at WARN. Disabled
     * sources are reported as inactive without being evaluated.
     */
    public List<WeightedOpinion> collectOpinions(MarketSnapshot snapshot) {
        List<WeightedOpinion> opinions = new ArrayList<>(entries.size());
        for (RegisteredSource entry : entries) {
            BigDecimal weight = entry.getWeight();
            if (!entry.isEnabled()) {
                opinions.add(WeightedOpinion.inactive(entry.getName(), weight));
                continue;
            }
            try {
                Signal signal = entry.getSource().evaluate(snapshot);
                log.debug("{}: {} (confidence {})", entry.getName(), signal.getDirection(), signal.getConfidence());
                opinions.add(WeightedOpinion.of(entry.getName(), weight, signal));
            } catch (RuntimeException e) {
                log.warn("Analysis source '{}' failed, skipping it this cycle: {}", entry.getName(), e.getMessage(), e);
                opinions.add(WeightedOpinion.inactive(entry.getName(), weight));
            }
        }
        return opinions;
    }

    public void setWeight(String name, BigDecimal weight) {
        validateWeight(weight);
        RegisteredSource entry = require(name);
        entry.setWeight(weight);
        log.info("Analysis source '{}' weight set to {}", name, weight);
    }

    public void enable(String name) {
        require(name).setEnabled(true);
        log.info("Analysis source '{}' enabled", name);
    }

    public void disable(String name) {
        require(name).setEnabled(false);
        log.info("Analysis source '{}' disabled", name);
    }

    /** Read-only view in registration order. */
    public List<RegisteredSource> sources() {
        return Collections.unmodifiableList(entries);
    }

    private RegisteredSource require(String name) {
        RegisteredSource entry = find(name);
        if (entry == null) {
            throw new ResourceNotFoundException("AnalysisSource", name);
        }
        return entry;
    }

    private RegisteredSource find(String name) {
        for (RegisteredSource entry : entries) {
            if (entry.getName().equals(name)) {
                return entry;
            }
        }
        return null;
    }

    private static void validateWeight(BigDecimal weight) {
        if (weight == null || weight.signum() < 0 || weight.compareTo(BigDecimal.ONE) > 0) {
            throw new IllegalArgumentException("Weight must be between 0 and 1, got " + weight);
        }
    }
}
