package fr.lapetina.airouting.analytics;

public enum TrendDirection {
    IMPROVING,
    DECLINING,
    STABLE
}
