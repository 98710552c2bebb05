package it.aw.editalanalysis.model;

/**
 * Statistiche aggregate sulle analisi registrate.
 */
public record RegistryStats(
        int totalAnalyses,
        int relevantAnalyses,
        int failedAnalyses,
        String storeType
) {}
