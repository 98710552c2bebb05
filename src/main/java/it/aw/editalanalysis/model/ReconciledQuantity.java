package it.aw.editalanalysis.model;

/**
 * Quantità consolidata su tutti i chunk: il massimo (non la somma) dei totali per chunk.
 * <p>
 * unit ed explanation provengono dalla stima che ha determinato il massimo;
 * sono stringhe vuote se nessuna stima valida è disponibile.
 */
public record ReconciledQuantity(
        long            totalQuantity,
        String          unit,
        String          explanation,
        ThresholdStatus thresholdStatus,
        int             validEstimates
) {}
