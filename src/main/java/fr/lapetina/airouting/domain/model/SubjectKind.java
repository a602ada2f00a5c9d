package fr.lapetina.airouting.domain.model;

/**
 * What a set of running statistics is keyed on.
 */
public enum SubjectKind {
    PROVIDER,
    SERVICE
}
