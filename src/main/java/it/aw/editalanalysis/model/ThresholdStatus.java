package it.aw.editalanalysis.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Esito del confronto tra quantità rilevata e threshold. */
public enum ThresholdStatus {

    TRUE("true"),
    FALSE("false"),
    INCONCLUSIVE("inconclusive");

    private final String value;

    ThresholdStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static ThresholdStatus fromValue(String value) {
        for (ThresholdStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) return status;
        }
        throw new IllegalArgumentException("threshold_match sconosciuto: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
