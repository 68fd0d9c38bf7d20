package model;

public enum FunctionKind {
    // zero-argument constant, e.g. the patient's name
    SCALAR,
    // relation with arguments, undefined for unrecorded tuples
    TIME_SERIES,
    // last recorded value persists until superseded
    INTERPOLATABLE
}
