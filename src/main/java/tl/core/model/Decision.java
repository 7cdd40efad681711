package tl.core.model;

public enum Decision {
    ALLOW,
    REJECT
}
