package org.caureq.opsinsights.service.context;

public record LearningStats(int resourcesWithBaselines, int patternsDetected, int eventsTracked,
                            int changesRetained, int remediationsLogged) {}
