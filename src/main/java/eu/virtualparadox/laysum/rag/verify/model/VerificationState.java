package eu.virtualparadox.laysum.rag.verify.model;

public enum VerificationState {
    UNCHECKED,
    ENTAILED,
    REWRITTEN
}
