package it.aw.editalanalysis.model;

/**
 * Stima di quantità restituita dal modello per un singolo chunk.
 * La quantità non è mai negativa e l'unità non è mai vuota.
 */
public record QuantityEstimate(long totalQuantity, String unit, String explanation) {

    public QuantityEstimate {
        if (totalQuantity < 0) {
            throw new IllegalArgumentException("totalQuantity non può essere negativa: " + totalQuantity);
        }
        if (unit == null || unit.isBlank()) {
            throw new IllegalArgumentException("unit obbligatoria");
        }
        explanation = explanation != null ? explanation : "";
    }
}
