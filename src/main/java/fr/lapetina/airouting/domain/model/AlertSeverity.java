package fr.lapetina.airouting.domain.model;

public enum AlertSeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
