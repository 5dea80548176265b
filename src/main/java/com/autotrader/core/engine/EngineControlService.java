package com.autotrader.core.engine;

import com.autotrader.domain.model.EngineStatus;
import com.autotrader.signal.AnalysisSourceRegistry;
import java.math.BigDecimal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Operator control surface over the trading engine and its analysis sources.
 *
 * <p>Engine commands are forwarded to the {@link CycleOrchestrator}, which applies them at the next
 * cycle boundary while running. Source weight and enablement changes go to the
 * {@link AnalysisSourceRegistry} and are picked up by the next cycle.
 */
@Service
public class EngineControlService {

    private static final Logger log = LoggerFactory.getLogger(EngineControlService.class);

    private final CycleOrchestrator cycleOrchestrator;
    private final AnalysisSourceRegistry analysisSourceRegistry;

    public EngineControlService(CycleOrchestrator cycleOrchestrator, AnalysisSourceRegistry analysisSourceRegistry) {
        this.cycleOrchestrator = cycleOrchestrator;
        this.analysisSourceRegistry = analysisSourceRegistry;
    }

    // ========================
    // ENGINE
    // ========================

    public void start() {
        log.info("Operator: start engine");
        cycleOrchestrator.start();
    }

    public void stop() {
        log.info("Operator: stop engine");
        cycleOrchestrator.stop();
    }

    public void pause() {
        log.info("Operator: pause engine");
        cycleOrchestrator.pause();
    }

    public void resume() {
        log.info("Operator: resume engine");
        cycleOrchestrator.resume();
    }

    public void closeAll() {
        log.info("Operator: close all positions");
        cycleOrchestrator.closeAll();
    }

    public void resetKillSwitch() {
        log.warn("Operator: reset kill switch");
        cycleOrchestrator.resetKillSwitch();
    }

    public EngineStatus status() {
        return cycleOrchestrator.status();
    }

    // ========================
    // ANALYSIS SOURCES
    // ========================

    /**
     * @throws IllegalArgumentException if the weight is outside [0, 1]
     * @throws com.autotrader.exception.ResourceNotFoundException if no source has that name
     */
    public void setStrategyWeight(String name, BigDecimal weight) {
        analysisSourceRegistry.setWeight(name, weight);
    }

    public void enableStrategy(String name) {
        analysisSourceRegistry.enable(name);
    }

    public void disableStrategy(String name) {
        analysisSourceRegistry.disable(name);
    }
}
