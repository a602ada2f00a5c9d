package fr.lapetina.airouting.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.airouting.domain.model.RequestContext;
import fr.lapetina.airouting.domain.model.RoutingRequirement;
import fr.lapetina.airouting.domain.model.Urgency;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Body of {@code POST /route}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class RouteRequest {

    @JsonProperty("request_id")
    private String requestId;

    private double complexity = 0.5;
    private Map<String, String> attributes;
    private Double maxResponseTimeMs;
    private Double qualityThreshold;
    private Double reliabilityRequirement;
    private List<String> preferredProviders;
    private String urgency;

    // Getters and setters
    public String getRequestId() { return requestId; }
    public void setRequestId(String requestId) { this.requestId = requestId; }

    public double getComplexity() { return complexity; }
    public void setComplexity(double complexity) { this.complexity = complexity; }

    public Map<String, String> getAttributes() { return attributes; }
    public void setAttributes(Map<String, String> attributes) { this.attributes = attributes; }

    public Double getMaxResponseTimeMs() { return maxResponseTimeMs; }
    public void setMaxResponseTimeMs(Double maxResponseTimeMs) { this.maxResponseTimeMs = maxResponseTimeMs; }

    public Double getQualityThreshold() { return qualityThreshold; }
    public void setQualityThreshold(Double qualityThreshold) { this.qualityThreshold = qualityThreshold; }

    public Double getReliabilityRequirement() { return reliabilityRequirement; }
    public void setReliabilityRequirement(Double reliabilityRequirement) { this.reliabilityRequirement = reliabilityRequirement; }

    public List<String> getPreferredProviders() { return preferredProviders; }
    public void setPreferredProviders(List<String> preferredProviders) { this.preferredProviders = preferredProviders; }

    public String getUrgency() { return urgency; }
    public void setUrgency(String urgency) { this.urgency = urgency; }

    /**
     * @throws IllegalArgumentException if complexity is outside [0, 1]
     */
    public RequestContext toContext() {
        return new RequestContext(requestId, complexity, attributes);
    }

    /**
     * @throws IllegalArgumentException if urgency is not a known level
     */
    public RoutingRequirement toRequirement() {
        return new RoutingRequirement(
                maxResponseTimeMs,
                qualityThreshold,
                reliabilityRequirement,
                preferredProviders != null ? Set.copyOf(preferredProviders) : null,
                urgency != null ? Urgency.valueOf(urgency.trim().toUpperCase()) : null
        );
    }
}
