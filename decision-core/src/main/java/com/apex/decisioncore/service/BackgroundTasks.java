package com.apex.decisioncore.service;

import com.apex.decisioncore.config.DecisionProperties;
import com.apex.decisioncore.config.LearningProperties;
import com.apex.decisioncore.config.ShadowProperties;
import com.apex.decisioncore.health.HealthSupervisor;
import com.apex.decisioncore.learning.AdaptiveWeightLearner;
import com.apex.decisioncore.shadow.ShadowCounterfactualEvaluator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "decision.scheduling.enabled", havingValue = "true")
public class BackgroundTasks {

    private final SupervisedTaskRunner supervisedTaskRunner;
    private final DecisionCycleService decisionCycleService;
    private final ShadowCounterfactualEvaluator shadowEvaluator;
    private final AdaptiveWeightLearner adaptiveWeightLearner;
    private final HealthSupervisor healthSupervisor;
    private final DecisionProperties decisionProperties;
    private final ShadowProperties shadowProperties;
    private final LearningProperties learningProperties;

    @EventListener(ApplicationReadyEvent.class)
    public void startLoops() {
        supervisedTaskRunner.start("decision_cycle", decisionProperties.getCycle().getInterval(),
                decisionCycleService::runCycle);
        if (shadowProperties.isEnabled()) {
            supervisedTaskRunner.start("shadow_evaluator", shadowProperties.getPollInterval(),
                    shadowEvaluator::evaluatePending);
        }
        supervisedTaskRunner.start("weight_learner", learningProperties.getInterval(),
                adaptiveWeightLearner::runCycle);
        log.info("Background loops started: {}", supervisedTaskRunner.tasks().size());
    }

    @Scheduled(fixedDelayString = "${health.tick-ms:10000}")
    public void healthTick() {
        healthSupervisor.tick();
    }
}
