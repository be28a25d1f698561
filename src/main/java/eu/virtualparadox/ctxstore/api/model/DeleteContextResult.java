package eu.virtualparadox.ctxstore.api.model;

public record DeleteContextResult(boolean deleted) {
}
