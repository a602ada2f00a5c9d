package fr.lapetina.airouting.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code POST /requests/start}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class RequestStartReport {

    @JsonProperty("request_id")
    private String requestId;

    private String provider;
    private String model;
    private String service;

    public String getRequestId() { return requestId; }
    public void setRequestId(String requestId) { this.requestId = requestId; }

    public String getProvider() { return provider; }
    public void setProvider(String provider) { this.provider = provider; }

    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }

    public String getService() { return service; }
    public void setService(String service) { this.service = service; }
}
