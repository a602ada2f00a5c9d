package fr.lapetina.airouting.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Body of {@code POST /requests/{id}/complete}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class RequestCompletionReport {

    private boolean success = true;
    private String errorType;
    private Double quality;

    public boolean isSuccess() { return success; }
    public void setSuccess(boolean success) { this.success = success; }

    public String getErrorType() { return errorType; }
    public void setErrorType(String errorType) { this.errorType = errorType; }

    public Double getQuality() { return quality; }
    public void setQuality(Double quality) { this.quality = quality; }
}
