package fr.lapetina.airouting.domain.model;

public enum AlertType {
    LATENCY,
    ERROR_RATE,
    INACTIVITY
}
