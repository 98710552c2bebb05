package it.aw.editalanalysis.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Record mutabile condiviso dagli stage della pipeline per una singola analisi.
 * <p>
 * Ogni stage modifica solo i propri campi. Una volta impostato {@code hasError}
 * lo stato è terminale: non esiste alcun modo per azzerarlo e i campi di esito
 * restano quelli fissati da {@link #markFailed(PipelineFault)}.
 * <p>
 * Non è thread-safe: appartiene esclusivamente alla run che lo ha creato.
 */
public class PipelineState {

    public static final String UNKNOWN_BID_NUMBER = "N/A";

    private final String bundlePath;

    private String bidNumber = UNKNOWN_BID_NUMBER;
    private String city = "";
    private final Map<String, Object> metadata = new LinkedHashMap<>();
    private String content = "";          // solo interno, mai in output

    private boolean targetMatch;
    private ThresholdStatus thresholdMatch = ThresholdStatus.INCONCLUSIVE;
    private boolean relevant;

    private String summary = "";
    private String justification = "";

    private boolean hasError;
    private String errorMessage = "";

    public PipelineState(String bundlePath) {
        this.bundlePath = bundlePath;
    }

    /** Porta lo stato nella condizione terminale di errore. */
    public void markFailed(PipelineFault fault) {
        this.hasError = true;
        this.errorMessage = fault.errorMessage();
        this.justification = fault.justification();
        this.targetMatch = false;
        this.thresholdMatch = ThresholdStatus.INCONCLUSIVE;
        this.relevant = false;
    }

    public String getBundlePath()          { return bundlePath; }
    public String getBidNumber()           { return bidNumber; }
    public String getCity()                { return city; }
    public Map<String, Object> getMetadata() { return metadata; }
    public String getContent()             { return content; }
    public boolean isTargetMatch()         { return targetMatch; }
    public ThresholdStatus getThresholdMatch() { return thresholdMatch; }
    public boolean isRelevant()            { return relevant; }
    public String getSummary()             { return summary; }
    public String getJustification()       { return justification; }
    public boolean hasError()              { return hasError; }
    public String getErrorMessage()        { return errorMessage; }

    public void setBidNumber(String bidNumber)   { this.bidNumber = bidNumber; }
    public void setCity(String city)             { this.city = city; }
    public void setContent(String content)       { this.content = content; }
    public void setTargetMatch(boolean targetMatch) { this.targetMatch = targetMatch; }
    public void setThresholdMatch(ThresholdStatus thresholdMatch) { this.thresholdMatch = thresholdMatch; }
    public void setRelevant(boolean relevant)    { this.relevant = relevant; }
    public void setSummary(String summary)       { this.summary = summary; }
    public void setJustification(String justification) { this.justification = justification; }

    public String metadataValue(String key) {
        Object value = metadata.get(key);
        return value != null ? value.toString() : "";
    }
}
