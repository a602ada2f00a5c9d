package fr.lapetina.airouting.domain.model;

public enum Urgency {
    LOW,
    MEDIUM,
    HIGH
}
